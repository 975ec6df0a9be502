package com.shiftpay.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * The clock the facades read "now" from, in the payroll timezone.
 * Calculators never read it; they receive instants and dates as parameters.
 */
@ApplicationScoped
public class ClockProducer {

    @Inject
    PayrollPolicyProvider policyProvider;

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.system(policyProvider.zone());
    }
}
