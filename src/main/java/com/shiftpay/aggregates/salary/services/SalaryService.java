package com.shiftpay.aggregates.salary.services;

import com.shiftpay.aggregates.salary.model.SalaryBreakdown;
import com.shiftpay.aggregates.salary.model.SalaryCalculationRequest;
import com.shiftpay.aggregates.salary.model.SalaryPolicy;
import com.shiftpay.config.PayrollPolicyProvider;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

@JBossLog
@ApplicationScoped
public class SalaryService {

    @Inject
    SalaryAggregator salaryAggregator;

    @Inject
    PayrollPolicyProvider policyProvider;

    /**
     * Calculates the month-to-date breakdown with the configured policy for the request's employment type.
     */
    public SalaryBreakdown calculate(SalaryCalculationRequest request) {
        SalaryPolicy policy = policyProvider.salaryPolicy(request.getEmploymentType());
        log.debugf("Calculating salary for %s (%s)", request.getReferenceDate(), request.getEmploymentType());
        return salaryAggregator.calculate(request, policy);
    }
}
