package com.shiftpay.aggregates.shifts.services;

import com.shiftpay.aggregates.attendance.model.AttendanceStatus;
import com.shiftpay.aggregates.attendance.model.CheckInPolicy;
import com.shiftpay.aggregates.attendance.model.CheckInResult;
import com.shiftpay.aggregates.attendance.services.CheckInClassifier;
import com.shiftpay.aggregates.shifts.model.ShiftInstance;
import com.shiftpay.aggregates.shifts.model.ShiftSpec;
import com.shiftpay.config.PayrollPolicyProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ShiftServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Karachi");
    private static final ShiftSpec NIGHT = ShiftSpec.parse("21:00", "05:00");
    // Sunday 02:00, the tail of Saturday night's shift
    private static final Instant NOW = ZonedDateTime.of(LocalDate.of(2024, 6, 9), LocalTime.of(2, 0), ZONE).toInstant();

    @Spy
    ShiftWindowResolver shiftWindowResolver;

    @Mock
    CheckInClassifier checkInClassifier;

    @Mock
    PayrollPolicyProvider policyProvider;

    @InjectMocks
    ShiftService shiftService;

    @BeforeEach
    void setUp() {
        shiftService.clock = Clock.fixed(NOW, ZONE);
        when(policyProvider.zone()).thenReturn(ZONE);
    }

    @Test
    void testCurrentShiftUsesClock() {
        ShiftInstance shift = shiftService.currentShift(NIGHT);

        assertEquals(LocalDate.of(2024, 6, 8), shift.attributedDate());
        assertTrue(shift.contains(NOW));
    }

    @Test
    void testWeekendShiftIsPaused() {
        assertTrue(shiftService.isPausedNow(NIGHT));
        assertEquals(LocalDate.of(2024, 6, 8), shiftService.attendanceDateNow(NIGHT));
    }

    @Test
    void testCheckInUsesConfiguredPolicy() {
        CheckInPolicy policy = new CheckInPolicy(15, 60);
        CheckInResult expected = new CheckInResult(AttendanceStatus.HALF_DAY, 300, LocalDate.of(2024, 6, 8));
        when(policyProvider.checkInPolicy()).thenReturn(policy);
        when(checkInClassifier.classify(NIGHT, NOW, ZONE, policy)).thenReturn(expected);

        assertSame(expected, shiftService.checkIn(NIGHT));
        verify(checkInClassifier).classify(NIGHT, NOW, ZONE, policy);
    }
}
