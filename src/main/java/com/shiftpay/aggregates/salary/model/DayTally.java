package com.shiftpay.aggregates.salary.model;

import java.math.BigDecimal;

public record DayTally(int days, BigDecimal earnings) {
}
