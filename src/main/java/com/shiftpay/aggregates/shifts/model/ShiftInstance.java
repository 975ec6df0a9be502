package com.shiftpay.aggregates.shifts.model;

import com.shiftpay.utils.DateUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;

/**
 * One concrete occurrence of a shift. Telemetry and attendance are booked against
 * {@code attributedDate}, the local date on which the shift started.
 */
public record ShiftInstance(ZonedDateTime start, ZonedDateTime end, LocalDate attributedDate) {

    public Instant startInstant() {
        return start.toInstant();
    }

    public Instant endInstant() {
        return end.toInstant();
    }

    /**
     * Start inclusive, end exclusive.
     */
    public boolean contains(Instant instant) {
        return !instant.isBefore(startInstant()) && instant.isBefore(endInstant());
    }

    /**
     * Shifts starting on a Saturday or Sunday are paused, whatever day they end on.
     */
    public boolean isPaused() {
        return DateUtils.isWeekendDay(attributedDate);
    }
}
