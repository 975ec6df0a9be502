package com.shiftpay.aggregates.performance.model;

import java.time.Instant;

/**
 * A call as reported by the phone system. {@code duration} is "H:MM:SS" or "MM:SS".
 */
public record CallLogEntry(Instant callTime, String duration) {
}
