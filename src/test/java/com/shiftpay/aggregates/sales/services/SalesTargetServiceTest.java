package com.shiftpay.aggregates.sales.services;

import com.shiftpay.aggregates.sales.model.SalesProgress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class SalesTargetServiceTest {

    private final SalesTargetService service = new SalesTargetService();

    @Test
    @DisplayName("Target is hit once cumulative sales reach a positive target")
    void targetHit() {
        assertTrue(service.isTargetHit(new BigDecimal("5000"), new BigDecimal("5000")));
        assertTrue(service.isTargetHit(new BigDecimal("5000"), new BigDecimal("7200.50")));
        assertFalse(service.isTargetHit(new BigDecimal("5000"), new BigDecimal("4999.99")));
    }

    @Test
    @DisplayName("A zero target is never hit")
    void zeroTarget() {
        assertFalse(service.isTargetHit(BigDecimal.ZERO, new BigDecimal("100")));
        assertFalse(service.isTargetHit(null, new BigDecimal("100")));
    }

    @Test
    void testProgress() {
        SalesProgress progress = service.progress(new BigDecimal("5000"), new BigDecimal("3200"));

        assertFalse(progress.targetHit());
        assertEquals(0, new BigDecimal("1800").compareTo(progress.remainingToTarget()));

        SalesProgress done = service.progress(new BigDecimal("5000"), new BigDecimal("6000"));
        assertTrue(done.targetHit());
        assertEquals(0, BigDecimal.ZERO.compareTo(done.remainingToTarget()));
    }
}
