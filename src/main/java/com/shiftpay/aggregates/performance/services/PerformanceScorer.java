package com.shiftpay.aggregates.performance.services;

import com.shiftpay.aggregates.performance.model.DailyTelemetry;
import com.shiftpay.aggregates.performance.model.PerformanceScore;
import com.shiftpay.aggregates.performance.model.PerformanceTargets;
import com.shiftpay.aggregates.performance.model.PerformanceWeights;
import jakarta.enterprise.context.ApplicationScoped;

import java.math.BigDecimal;

import static com.shiftpay.utils.MoneyUtils.cappedRatio;

/**
 * Turns one day's counters into a score between 0 and 1.
 * <pre>
 * callScore = min(calls / callsTarget, 1) * wCalls
 * talkScore = min(talkTimeSeconds / talkTimeTarget, 1) * wTalk
 * leadScore = min(leadsApproved / leadsTarget, 1) * wLeads
 * </pre>
 * A surplus on one counter never compensates for a deficit on another.
 */
@ApplicationScoped
public class PerformanceScorer {

    public PerformanceScore evaluate(DailyTelemetry telemetry, PerformanceTargets targets, PerformanceWeights weights) {
        if (telemetry == null) return PerformanceScore.ZERO;

        BigDecimal callScore = cappedRatio(BigDecimal.valueOf(telemetry.calls()), BigDecimal.valueOf(targets.calls()))
                .multiply(weights.calls());
        BigDecimal talkScore = cappedRatio(BigDecimal.valueOf(telemetry.talkTimeSeconds()), BigDecimal.valueOf(targets.talkTimeSeconds()))
                .multiply(weights.talkTime());
        BigDecimal leadScore = cappedRatio(BigDecimal.valueOf(telemetry.leadsApproved()), BigDecimal.valueOf(targets.leads()))
                .multiply(weights.leads());

        return new PerformanceScore(callScore, talkScore, leadScore, callScore.add(talkScore).add(leadScore));
    }

    public BigDecimal score(DailyTelemetry telemetry, PerformanceTargets targets, PerformanceWeights weights) {
        return evaluate(telemetry, targets, weights).total();
    }
}
