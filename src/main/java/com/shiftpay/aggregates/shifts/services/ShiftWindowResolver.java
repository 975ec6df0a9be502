package com.shiftpay.aggregates.shifts.services;

import com.shiftpay.aggregates.shifts.model.ShiftInstance;
import com.shiftpay.aggregates.shifts.model.ShiftSpec;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Maps an instant to the shift it belongs to.
 *
 * Statistics reset at shift start rather than at local midnight, so an overnight shift
 * (e.g. 21:00 - 05:00) is one accounting window booked on the day it began:
 * <ul>
 *     <li>22:00 on day D → D 21:00 to D+1 05:00, attributed to D</li>
 *     <li>02:00 on day D+1 → same window, attributed to D</li>
 *     <li>06:00 on day D+1 (between shifts) → the last completed shift, attributed to D</li>
 * </ul>
 * Same-day shifts resolve to today's shift once its start has passed and to yesterday's before that.
 */
@JBossLog
@ApplicationScoped
public class ShiftWindowResolver {

    public ShiftInstance resolve(ShiftSpec spec, Instant now, ZoneId zone) {
        ZonedDateTime localNow = now.atZone(zone);
        LocalDate today = localNow.toLocalDate();
        int nowMinute = localNow.getHour() * 60 + localNow.getMinute();

        LocalDate startDay;
        LocalDate endDay;
        if (spec.isOvernight()) {
            if (nowMinute >= spec.startMinute()) {
                startDay = today;
                endDay = today.plusDays(1);
            } else {
                // tail of last night's shift, or the gap after it ended
                startDay = today.minusDays(1);
                endDay = today;
            }
        } else {
            if (nowMinute >= spec.startMinute()) {
                startDay = today;
            } else {
                startDay = today.minusDays(1);
            }
            endDay = startDay;
        }

        ShiftInstance instance = new ShiftInstance(
                ZonedDateTime.of(startDay, spec.start(), zone),
                ZonedDateTime.of(endDay, spec.end(), zone),
                startDay);
        log.debugf("Resolved shift %s-%s at %s to %s - %s (attributed %s)",
                spec.start(), spec.end(), localNow, instance.start(), instance.end(), instance.attributedDate());
        return instance;
    }

    public boolean isPausedShift(ShiftSpec spec, Instant now, ZoneId zone) {
        return resolve(spec, now, zone).isPaused();
    }

    /**
     * The date a check-in at {@code now} is booked against. Only the after-midnight part of an
     * overnight shift belongs to yesterday; once the shift has ended a new day has begun.
     */
    public LocalDate resolveAttendanceDate(ShiftSpec spec, Instant now, ZoneId zone) {
        ZonedDateTime localNow = now.atZone(zone);
        int nowMinute = localNow.getHour() * 60 + localNow.getMinute();
        if (spec.isOvernight() && nowMinute < spec.endMinute()) {
            return localNow.toLocalDate().minusDays(1);
        }
        return localNow.toLocalDate();
    }
}
