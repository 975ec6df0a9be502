package com.shiftpay.aggregates.performance.services;

import com.shiftpay.aggregates.performance.model.CallLogEntry;
import com.shiftpay.aggregates.performance.model.DailyTelemetry;
import com.shiftpay.aggregates.shifts.model.ShiftInstance;
import com.shiftpay.exceptions.PayrollValidationException;
import com.shiftpay.exceptions.PayrollValidationException.ErrorType;
import com.shiftpay.utils.DurationUtils;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.util.List;

/**
 * Builds a shift's telemetry from raw call logs and the counts approved by HR.
 * Calls are counted inside [shift start, shift end); a call adds talk time only when it lasted
 * at least {@code minimumTalkSeconds}, so dropped and unanswered calls do not inflate talk time.
 */
@JBossLog
@ApplicationScoped
public class TelemetryAssembler {

    public DailyTelemetry assemble(ShiftInstance shift,
                                   List<CallLogEntry> callLogs,
                                   int approvedLeads,
                                   BigDecimal approvedSalesAmount,
                                   int meetingSeconds,
                                   int minimumTalkSeconds) {
        int calls = 0;
        int talkTimeSeconds = 0;
        for (CallLogEntry entry : callLogs) {
            if (entry.callTime() == null || !shift.contains(entry.callTime())) continue;
            calls++;
            int seconds = DurationUtils.parse(entry.duration());
            if (seconds < minimumTalkSeconds) continue;
            try {
                talkTimeSeconds = Math.addExact(talkTimeSeconds, seconds);
            } catch (ArithmeticException e) {
                // counted as a call with a malformed duration
                log.warnf("Ignoring duration '%s' of call at %s: talk time for shift %s would overflow",
                        entry.duration(), entry.callTime(), shift.attributedDate());
            }
        }

        int totalTalkTime;
        try {
            totalTalkTime = Math.addExact(talkTimeSeconds, meetingSeconds);
        } catch (ArithmeticException e) {
            throw PayrollValidationException.of("meetingSeconds", "Meeting time " + meetingSeconds
                    + " s overflows the shift's talk time", ErrorType.INVALID_VALUE);
        }

        log.debugf("Assembled telemetry for shift %s: %d calls, %d s talk, %d s meetings, %d leads",
                shift.attributedDate(), calls, talkTimeSeconds, meetingSeconds, approvedLeads);
        return new DailyTelemetry(shift.attributedDate(), calls, totalTalkTime, approvedLeads,
                approvedSalesAmount != null ? approvedSalesAmount : BigDecimal.ZERO);
    }
}
