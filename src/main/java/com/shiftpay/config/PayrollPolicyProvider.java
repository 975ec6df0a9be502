package com.shiftpay.config;

import com.shiftpay.aggregates.attendance.model.CheckInPolicy;
import com.shiftpay.aggregates.attendance.model.LatePolicy;
import com.shiftpay.aggregates.performance.model.EmploymentType;
import com.shiftpay.aggregates.performance.model.PerformanceTargets;
import com.shiftpay.aggregates.performance.model.PerformanceWeights;
import com.shiftpay.aggregates.salary.model.SalaryPolicy;
import com.shiftpay.exceptions.PayrollConfigurationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Translates {@link PayrollConfig} into the immutable policy objects the calculators take as parameters.
 * Invalid values fail with {@link PayrollConfigurationException}.
 */
@JBossLog
@ApplicationScoped
public class PayrollPolicyProvider {

    @Inject
    PayrollConfig config;

    public ZoneId zone() {
        try {
            return ZoneId.of(config.zone());
        } catch (DateTimeException e) {
            throw new PayrollConfigurationException("Unknown payroll timezone: " + config.zone(), e);
        }
    }

    public PerformanceTargets targets(EmploymentType employmentType) {
        if (employmentType == EmploymentType.PART_TIME) {
            PayrollConfig.PartTime t = config.targets().partTime();
            return new PerformanceTargets(t.calls(), t.talkTimeSeconds(), t.leads());
        }
        PayrollConfig.FullTime t = config.targets().fullTime();
        return new PerformanceTargets(t.calls(), t.talkTimeSeconds(), t.leads());
    }

    public PerformanceWeights weights() {
        PayrollConfig.Weights w = config.weights();
        return new PerformanceWeights(w.calls(), w.talkTime(), w.leads());
    }

    public LatePolicy latePolicy() {
        PayrollConfig.LatePolicyConfig l = config.latePolicy();
        return new LatePolicy(l.freeLates(), l.excessLateDeductionDays(), l.halfDayDeductionDays(), l.unapprovedHalfDayPenalty());
    }

    public CheckInPolicy checkInPolicy() {
        return new CheckInPolicy(config.checkIn().gracePeriodMinutes(), config.checkIn().lateThresholdMinutes());
    }

    public SalaryPolicy salaryPolicy(EmploymentType employmentType) {
        EmploymentType type = employmentType != null ? employmentType : EmploymentType.FULL_TIME;
        SalaryPolicy policy = new SalaryPolicy(targets(type), weights(), latePolicy(), config.clampNegativeTotal());
        log.debugf("Salary policy for %s: %s", type, policy);
        return policy;
    }

    public int minimumTalkSeconds() {
        return config.telemetry().minimumTalkSeconds();
    }

    public BigDecimal commissionRate() {
        BigDecimal rate = config.sales().commissionRate();
        if (rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
            throw new PayrollConfigurationException("Commission rate must be between 0 and 1: " + rate.toPlainString());
        }
        return rate;
    }

    public boolean requireSaleApproval() {
        return config.sales().requireApproval();
    }
}
