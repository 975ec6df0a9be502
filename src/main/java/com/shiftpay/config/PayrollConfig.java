package com.shiftpay.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.math.BigDecimal;

/**
 * Payroll engine configuration.
 *
 * Every property has a default so the engine runs without an application.properties entry.
 * Values are turned into policy objects by {@link PayrollPolicyProvider}; calculators never read this directly.
 */
@ConfigMapping(prefix = "payroll")
public interface PayrollConfig {

    /**
     * The single timezone all wall-clock and calendar arithmetic happens in.
     */
    @WithDefault("Asia/Karachi")
    String zone();

    /**
     * Pay negative month totals as zero when the late-policy deduction exceeds earnings.
     */
    @WithDefault("true")
    boolean clampNegativeTotal();

    Weights weights();

    Targets targets();

    LatePolicyConfig latePolicy();

    CheckIn checkIn();

    Telemetry telemetry();

    Sales sales();

    // Nested configurations

    interface Weights {
        @WithDefault("0.40")
        BigDecimal calls();

        @WithDefault("0.30")
        BigDecimal talkTime();

        @WithDefault("0.30")
        BigDecimal leads();
    }

    interface Targets {
        FullTime fullTime();

        PartTime partTime();
    }

    interface FullTime {
        @WithDefault("150")
        int calls();

        @WithDefault("3600")
        int talkTimeSeconds();

        @WithDefault("3")
        int leads();
    }

    interface PartTime {
        @WithDefault("75")
        int calls();

        @WithDefault("1800")
        int talkTimeSeconds();

        @WithDefault("2")
        int leads();
    }

    interface LatePolicyConfig {
        @WithDefault("3")
        int freeLates();

        @WithDefault("0.5")
        BigDecimal excessLateDeductionDays();

        @WithDefault("0.5")
        BigDecimal halfDayDeductionDays();

        /**
         * Extra multiplier on the earnings of a half day not yet approved by HR.
         */
        @WithDefault("0.5")
        BigDecimal unapprovedHalfDayPenalty();
    }

    interface CheckIn {
        @WithDefault("30")
        int gracePeriodMinutes();

        @WithDefault("90")
        int lateThresholdMinutes();
    }

    interface Telemetry {
        /**
         * Calls shorter than this add no talk time.
         */
        @WithDefault("30")
        int minimumTalkSeconds();
    }

    interface Sales {
        @WithDefault("0.05")
        BigDecimal commissionRate();

        /**
         * New sales wait for HR approval, and their deal value is credited on approval instead of on creation.
         */
        @WithDefault("false")
        boolean requireApproval();
    }
}
