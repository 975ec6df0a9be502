package com.shiftpay.aggregates.shifts.services;

import com.shiftpay.aggregates.attendance.model.CheckInResult;
import com.shiftpay.aggregates.attendance.services.CheckInClassifier;
import com.shiftpay.aggregates.shifts.model.ShiftInstance;
import com.shiftpay.aggregates.shifts.model.ShiftSpec;
import com.shiftpay.config.PayrollPolicyProvider;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Shift questions answered against the injected clock in the payroll timezone.
 */
@JBossLog
@ApplicationScoped
public class ShiftService {

    @Inject
    ShiftWindowResolver shiftWindowResolver;

    @Inject
    CheckInClassifier checkInClassifier;

    @Inject
    PayrollPolicyProvider policyProvider;

    @Inject
    Clock clock;

    public ShiftInstance currentShift(ShiftSpec spec) {
        return shiftWindowResolver.resolve(spec, clock.instant(), policyProvider.zone());
    }

    public boolean isPausedNow(ShiftSpec spec) {
        return shiftWindowResolver.isPausedShift(spec, clock.instant(), policyProvider.zone());
    }

    public LocalDate attendanceDateNow(ShiftSpec spec) {
        return shiftWindowResolver.resolveAttendanceDate(spec, clock.instant(), policyProvider.zone());
    }

    /**
     * Classifies a check-in happening now.
     */
    public CheckInResult checkIn(ShiftSpec spec) {
        Instant now = clock.instant();
        CheckInResult result = checkInClassifier.classify(spec, now, policyProvider.zone(), policyProvider.checkInPolicy());
        log.infof("Check-in booked on %s as %s (%d min late)", result.attendanceDate(), result.status().getCode(), result.minutesLate());
        return result;
    }
}
