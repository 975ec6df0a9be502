package com.shiftpay.aggregates.salary.services;

import com.shiftpay.aggregates.attendance.model.AttendanceRecord;
import com.shiftpay.aggregates.attendance.model.AttendanceStatus;
import com.shiftpay.aggregates.attendance.model.LatePolicyResult;
import com.shiftpay.aggregates.attendance.services.AttendancePolicyService;
import com.shiftpay.aggregates.performance.model.DailyTelemetry;
import com.shiftpay.aggregates.performance.services.PerformanceScorer;
import com.shiftpay.aggregates.salary.model.AttendanceBreakdown;
import com.shiftpay.aggregates.salary.model.DayTally;
import com.shiftpay.aggregates.salary.model.LatePolicySummary;
import com.shiftpay.aggregates.salary.model.PerformanceSummary;
import com.shiftpay.aggregates.salary.model.SalaryBreakdown;
import com.shiftpay.aggregates.salary.model.SalaryCalculationRequest;
import com.shiftpay.aggregates.salary.model.SalaryPolicy;
import com.shiftpay.exceptions.PayrollConfigurationException;
import com.shiftpay.exceptions.PayrollValidationException;
import com.shiftpay.exceptions.PayrollValidationException.ErrorType;
import com.shiftpay.exceptions.PayrollValidationException.ValidationError;
import com.shiftpay.utils.DateUtils;
import com.shiftpay.utils.MoneyUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.shiftpay.utils.MoneyUtils.round;

/**
 * Month-to-date salary of one employee.
 * <ol>
 *     <li>dailyPotential = baseSalary / working days in the month</li>
 *     <li>ghost earnings: working days before the system launch, paid at full potential</li>
 *     <li>active earnings: every past day with telemetry, scored and multiplied by its attendance</li>
 *     <li>today earnings: the current shift, if it has telemetry</li>
 *     <li>late-policy deduction over all of the month's attendance, subtracted once</li>
 *     <li>projection: remaining working days at the average score so far</li>
 * </ol>
 * Everything accumulates unrounded; each returned money field is rounded once.
 * The result depends only on the request and the policy.
 */
@JBossLog
@ApplicationScoped
public class SalaryAggregator {

    private static final int SCORE_SCALE = 2;

    @Inject
    PerformanceScorer performanceScorer;

    @Inject
    AttendancePolicyService attendancePolicyService;

    public SalaryBreakdown calculate(SalaryCalculationRequest request, SalaryPolicy policy) {
        validate(request);

        LocalDate referenceDate = request.getReferenceDate();
        LocalDate monthStart = DateUtils.getFirstDayOfMonth(referenceDate);
        BigDecimal baseSalary = request.getBaseSalary();

        int workingDaysInMonth = DateUtils.getWorkingDaysInMonth(referenceDate);
        if (workingDaysInMonth == 0) {
            throw new PayrollConfigurationException("No working days in month of " + referenceDate);
        }
        BigDecimal dailyPotential = MoneyUtils.divide(baseSalary, BigDecimal.valueOf(workingDaysInMonth));

        int ghostDays = DateUtils.getGhostDays(request.getSystemLaunchDate(), referenceDate);
        BigDecimal ghostEarnings = dailyPotential.multiply(BigDecimal.valueOf(ghostDays));

        Map<LocalDate, AttendanceRecord> attendanceByDate = new HashMap<>();
        for (AttendanceRecord record : request.getPastAttendance()) {
            if (record.date().isBefore(monthStart)) continue;
            attendanceByDate.put(record.date(), record);
        }

        List<DailyTelemetry> pastDays = new ArrayList<>();
        for (DailyTelemetry telemetry : request.getPastTelemetry()) {
            if (telemetry.date().isBefore(monthStart)) continue;
            pastDays.add(telemetry);
        }
        pastDays.sort(Comparator.comparing(DailyTelemetry::date));

        Map<AttendanceStatus, Tally> tallies = new EnumMap<>(AttendanceStatus.class);
        for (AttendanceStatus status : AttendanceStatus.values()) tallies.put(status, new Tally());

        BigDecimal activeEarnings = BigDecimal.ZERO;
        BigDecimal scoreSum = BigDecimal.ZERO;
        int scoredDays = 0;
        long totalCalls = 0;
        long totalTalkTime = 0;
        long totalLeads = 0;

        for (DailyTelemetry day : pastDays) {
            AttendanceRecord attendance = attendanceByDate.get(day.date());
            BigDecimal score = performanceScorer.score(day, policy.targets(), policy.weights());
            BigDecimal earnings = attendancePolicyService.dailyEarnings(dailyPotential, score, attendance, policy.latePolicy());

            activeEarnings = activeEarnings.add(earnings);
            scoreSum = scoreSum.add(score);
            scoredDays++;
            totalCalls += day.calls();
            totalTalkTime += day.talkTimeSeconds();
            totalLeads += day.leadsApproved();
            tallies.get(statusOf(attendance)).add(earnings);
        }
        int activeDays = pastDays.size();

        BigDecimal todayEarnings = BigDecimal.ZERO;
        BigDecimal todayScore = BigDecimal.ZERO;
        BigDecimal todayMultiplier = BigDecimal.ZERO;
        DailyTelemetry today = request.getTodayTelemetry();
        AttendanceRecord todayAttendance = request.getTodayAttendance();
        if (today != null) {
            todayScore = performanceScorer.score(today, policy.targets(), policy.weights());
            todayMultiplier = attendancePolicyService.multiplier(todayAttendance);
            todayEarnings = attendancePolicyService.dailyEarnings(dailyPotential, todayScore, todayAttendance, policy.latePolicy());

            scoreSum = scoreSum.add(todayScore);
            scoredDays++;
            totalCalls += today.calls();
            totalTalkTime += today.talkTimeSeconds();
            totalLeads += today.leadsApproved();
            tallies.get(statusOf(todayAttendance)).add(todayEarnings);
        }

        List<AttendanceRecord> monthAttendance = new ArrayList<>(attendanceByDate.values());
        if (todayAttendance != null) monthAttendance.add(todayAttendance);
        LatePolicyResult late = attendancePolicyService.latePolicy(monthAttendance, dailyPotential, policy.latePolicy());

        BigDecimal totalEarnedBeforeDeduction = ghostEarnings.add(activeEarnings).add(todayEarnings);
        BigDecimal totalEarned = totalEarnedBeforeDeduction.subtract(late.deductionAmount());
        if (policy.clampNegativeTotal() && totalEarned.signum() < 0) {
            log.debugf("Clamping negative total %s to zero for %s", totalEarned.toPlainString(), referenceDate);
            totalEarned = BigDecimal.ZERO;
        }

        BigDecimal avgScore = scoredDays > 0
                ? MoneyUtils.divide(scoreSum, BigDecimal.valueOf(scoredDays))
                : BigDecimal.ONE;
        int workingDaysElapsed = DateUtils.getWorkingDaysElapsed(referenceDate);
        int remainingDays = workingDaysInMonth - workingDaysElapsed;
        BigDecimal projectedSalary = totalEarned.add(
                dailyPotential.multiply(BigDecimal.valueOf(remainingDays)).multiply(avgScore));

        SalaryBreakdown breakdown = SalaryBreakdown.builder()
                .baseSalary(round(baseSalary))
                .workingDaysInMonth(workingDaysInMonth)
                .workingDaysElapsed(workingDaysElapsed)
                .workingDaysRemaining(DateUtils.getWorkingDaysRemaining(referenceDate))
                .dailyPotential(round(dailyPotential))
                .ghostDays(ghostDays)
                .ghostEarnings(round(ghostEarnings))
                .activeDays(activeDays)
                .activeEarnings(round(activeEarnings))
                .todayEarnings(round(todayEarnings))
                .todayPerformanceScore(todayScore.setScale(SCORE_SCALE, MoneyUtils.RM))
                .todayAttendanceMultiplier(todayMultiplier.setScale(SCORE_SCALE, MoneyUtils.RM))
                .latePolicy(new LatePolicySummary(late.totalLates(), late.totalHalfDays(), late.freeLatesUsed(),
                        late.freeLatesRemaining(), late.excessLates(), round(late.deductionDays()), round(late.deductionAmount())))
                .totalEarnedBeforeDeduction(round(totalEarnedBeforeDeduction))
                .totalEarned(round(totalEarned))
                .projectedSalary(round(projectedSalary))
                .percentageEarned(MoneyUtils.percentage(totalEarned, baseSalary))
                .attendanceBreakdown(new AttendanceBreakdown(
                        tallies.get(AttendanceStatus.ON_TIME).toDayTally(),
                        tallies.get(AttendanceStatus.LATE).toDayTally(),
                        tallies.get(AttendanceStatus.HALF_DAY).toDayTally(),
                        tallies.get(AttendanceStatus.ABSENT).toDayTally()))
                .performanceSummary(new PerformanceSummary(totalCalls, totalTalkTime, totalLeads,
                        avgScore.setScale(SCORE_SCALE, MoneyUtils.RM)))
                .build();

        log.debugf("Salary for %s: ghost %d days, %d active days, total %s, projected %s",
                referenceDate, ghostDays, activeDays, breakdown.getTotalEarned(), breakdown.getProjectedSalary());
        return breakdown;
    }

    private static AttendanceStatus statusOf(AttendanceRecord attendance) {
        return attendance == null ? AttendanceStatus.ABSENT : attendance.status();
    }

    private void validate(SalaryCalculationRequest request) {
        List<ValidationError> errors = new ArrayList<>();
        LocalDate referenceDate = request.getReferenceDate();

        if (request.getBaseSalary() == null) {
            errors.add(new ValidationError("baseSalary", "Base salary is required", ErrorType.MISSING_REQUIRED));
        } else if (request.getBaseSalary().signum() < 0) {
            errors.add(new ValidationError("baseSalary", "Base salary cannot be negative: " + request.getBaseSalary(), ErrorType.NEGATIVE_VALUE));
        }
        if (request.getSystemLaunchDate() == null) {
            errors.add(new ValidationError("systemLaunchDate", "System launch date is required", ErrorType.MISSING_REQUIRED));
        }
        if (referenceDate == null) {
            errors.add(new ValidationError("referenceDate", "Reference date is required", ErrorType.MISSING_REQUIRED));
            throw new PayrollValidationException(errors);
        }
        if (request.getPastTelemetry() == null || request.getPastAttendance() == null) {
            errors.add(new ValidationError("past", "Past telemetry and attendance lists are required", ErrorType.MISSING_REQUIRED));
            throw new PayrollValidationException(errors);
        }

        Map<LocalDate, Boolean> seen = new HashMap<>();
        for (DailyTelemetry telemetry : request.getPastTelemetry()) {
            if (telemetry == null) {
                errors.add(new ValidationError("pastTelemetry", "Past telemetry contains an empty row", ErrorType.MISSING_REQUIRED));
                continue;
            }
            if (!telemetry.date().isBefore(referenceDate)) {
                errors.add(new ValidationError("pastTelemetry", "Past telemetry dated " + telemetry.date()
                        + " is not before " + referenceDate, ErrorType.DATE_OUT_OF_RANGE));
            }
            if (seen.put(telemetry.date(), Boolean.TRUE) != null) {
                errors.add(new ValidationError("pastTelemetry", "Duplicate telemetry for " + telemetry.date(), ErrorType.INVALID_VALUE));
            }
        }
        for (AttendanceRecord record : request.getPastAttendance()) {
            if (record == null) {
                errors.add(new ValidationError("pastAttendance", "Past attendance contains an empty row", ErrorType.MISSING_REQUIRED));
                continue;
            }
            if (!record.date().isBefore(referenceDate)) {
                errors.add(new ValidationError("pastAttendance", "Past attendance dated " + record.date()
                        + " is not before " + referenceDate, ErrorType.DATE_OUT_OF_RANGE));
            }
        }
        if (request.getTodayTelemetry() != null && !request.getTodayTelemetry().date().equals(referenceDate)) {
            errors.add(new ValidationError("todayTelemetry", "Today's telemetry is dated " + request.getTodayTelemetry().date()
                    + " instead of " + referenceDate, ErrorType.DATE_OUT_OF_RANGE));
        }
        if (request.getTodayAttendance() != null && !request.getTodayAttendance().date().equals(referenceDate)) {
            errors.add(new ValidationError("todayAttendance", "Today's attendance is dated " + request.getTodayAttendance().date()
                    + " instead of " + referenceDate, ErrorType.DATE_OUT_OF_RANGE));
        }

        if (!errors.isEmpty()) {
            log.warnf("Rejected salary calculation for %s: %s", referenceDate, errors);
            throw new PayrollValidationException(errors);
        }
    }

    private static final class Tally {
        private int days;
        private BigDecimal earnings = BigDecimal.ZERO;

        void add(BigDecimal dayEarnings) {
            days++;
            earnings = earnings.add(dayEarnings);
        }

        DayTally toDayTally() {
            return new DayTally(days, round(earnings));
        }
    }
}
