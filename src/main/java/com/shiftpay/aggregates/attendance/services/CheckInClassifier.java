package com.shiftpay.aggregates.attendance.services;

import com.shiftpay.aggregates.attendance.model.AttendanceStatus;
import com.shiftpay.aggregates.attendance.model.CheckInPolicy;
import com.shiftpay.aggregates.attendance.model.CheckInResult;
import com.shiftpay.aggregates.shifts.model.ShiftSpec;
import com.shiftpay.aggregates.shifts.services.ShiftWindowResolver;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Decides the attendance status of a check-in from how far it is past the shift start.
 * The difference is taken on the wall clock and folded into (-12h, +12h], so 01:00 is
 * four hours late for a 21:00 start and 23:30 is thirty minutes early for a 00:00 start.
 */
@JBossLog
@ApplicationScoped
public class CheckInClassifier {

    private static final int HALF_DAY_MINUTES = 12 * 60;
    private static final int DAY_MINUTES = 24 * 60;

    @Inject
    ShiftWindowResolver shiftWindowResolver;

    public CheckInResult classify(ShiftSpec spec, Instant checkIn, ZoneId zone, CheckInPolicy policy) {
        ZonedDateTime localCheckIn = checkIn.atZone(zone);
        int minutesLate = minutesAfterShiftStart(spec, localCheckIn);

        AttendanceStatus status;
        if (minutesLate <= policy.gracePeriodMinutes()) {
            status = AttendanceStatus.ON_TIME;
        } else if (minutesLate <= policy.lateThresholdMinutes()) {
            status = AttendanceStatus.LATE;
        } else {
            status = AttendanceStatus.HALF_DAY;
        }

        CheckInResult result = new CheckInResult(status, Math.max(0, minutesLate),
                shiftWindowResolver.resolveAttendanceDate(spec, checkIn, zone));
        log.debugf("Check-in at %s against shift start %s: %d min → %s", localCheckIn, spec.start(), minutesLate, status);
        return result;
    }

    static int minutesAfterShiftStart(ShiftSpec spec, ZonedDateTime localCheckIn) {
        int diff = localCheckIn.getHour() * 60 + localCheckIn.getMinute() - spec.startMinute();
        if (diff <= -HALF_DAY_MINUTES) {
            diff += DAY_MINUTES;
        } else if (diff > HALF_DAY_MINUTES) {
            diff -= DAY_MINUTES;
        }
        return diff;
    }
}
