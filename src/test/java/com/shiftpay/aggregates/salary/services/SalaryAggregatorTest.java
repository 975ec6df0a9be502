package com.shiftpay.aggregates.salary.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shiftpay.aggregates.attendance.model.AttendanceRecord;
import com.shiftpay.aggregates.attendance.model.AttendanceStatus;
import com.shiftpay.aggregates.attendance.model.LatePolicy;
import com.shiftpay.aggregates.attendance.services.AttendancePolicyService;
import com.shiftpay.aggregates.performance.model.DailyTelemetry;
import com.shiftpay.aggregates.performance.model.PerformanceTargets;
import com.shiftpay.aggregates.performance.model.PerformanceWeights;
import com.shiftpay.aggregates.performance.services.PerformanceScorer;
import com.shiftpay.aggregates.salary.model.SalaryBreakdown;
import com.shiftpay.aggregates.salary.model.SalaryCalculationRequest;
import com.shiftpay.aggregates.salary.model.SalaryPolicy;
import com.shiftpay.exceptions.PayrollValidationException;
import com.shiftpay.exceptions.PayrollValidationException.ErrorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Month-to-date salary in June 2024: 20 working days, so a base salary of 20 000 is a daily potential of 1 000.
 */
@ExtendWith(MockitoExtension.class)
class SalaryAggregatorTest {

    private static final BigDecimal BASE = new BigDecimal("20000");
    private static final SalaryPolicy POLICY = SalaryPolicy.defaults(PerformanceTargets.FULL_TIME);
    private static final LocalDate JUNE_1 = LocalDate.of(2024, 6, 1);

    @Spy
    PerformanceScorer performanceScorer;

    @Spy
    AttendancePolicyService attendancePolicyService;

    @InjectMocks
    SalaryAggregator aggregator;

    private static DailyTelemetry fullDay(LocalDate date) {
        return new DailyTelemetry(date, 150, 3600, 3);
    }

    private static SalaryCalculationRequest.SalaryCalculationRequestBuilder request(LocalDate launch, LocalDate reference) {
        return SalaryCalculationRequest.builder()
                .baseSalary(BASE)
                .systemLaunchDate(launch)
                .referenceDate(reference);
    }

    // ============================================================================
    // Ghost days
    // ============================================================================

    @Nested
    @DisplayName("Ghost days")
    class Ghost {

        @Test
        @DisplayName("Launch on the 10th, reference on the 20th pays the 1st through the 9th in full")
        void launchMidMonth() {
            SalaryBreakdown breakdown = aggregator.calculate(
                    request(LocalDate.of(2024, 6, 10), LocalDate.of(2024, 6, 20)).build(), POLICY);

            assertEquals(5, breakdown.getGhostDays());
            assertEquals(new BigDecimal("5000.00"), breakdown.getGhostEarnings());
            assertEquals(new BigDecimal("5000.00"), breakdown.getTotalEarned());
            assertEquals(14, breakdown.getWorkingDaysElapsed());
            assertEquals(6, breakdown.getWorkingDaysRemaining());
            // no scored days yet, so the projection assumes a perfect score
            assertEquals(new BigDecimal("1.00"), breakdown.getPerformanceSummary().avgPerformanceScore());
            assertEquals(new BigDecimal("11000.00"), breakdown.getProjectedSalary());
            assertEquals(25, breakdown.getPercentageEarned());
        }

        @Test
        @DisplayName("Launch in a future month makes every elapsed working day a ghost day")
        void launchInFutureMonth() {
            SalaryBreakdown breakdown = aggregator.calculate(
                    request(LocalDate.of(2024, 7, 15), LocalDate.of(2024, 6, 20)).build(), POLICY);

            assertEquals(14, breakdown.getGhostDays());
            assertEquals(new BigDecimal("14000.00"), breakdown.getGhostEarnings());
        }

        @Test
        void testLaunchBeforeMonth() {
            SalaryBreakdown breakdown = aggregator.calculate(
                    request(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 6, 20)).build(), POLICY);

            assertEquals(0, breakdown.getGhostDays());
            assertEquals(new BigDecimal("0.00"), breakdown.getGhostEarnings());
        }
    }

    // ============================================================================
    // Active and today earnings
    // ============================================================================

    @Nested
    @DisplayName("Active days")
    class Active {

        private SalaryCalculationRequest week() {
            return request(JUNE_1, LocalDate.of(2024, 6, 5))
                    .pastTelemetry(List.of(
                            fullDay(LocalDate.of(2024, 6, 3)),
                            new DailyTelemetry(LocalDate.of(2024, 6, 4), 75, 1800, 0)))
                    .pastAttendance(List.of(
                            new AttendanceRecord(LocalDate.of(2024, 6, 3), AttendanceStatus.ON_TIME, false),
                            new AttendanceRecord(LocalDate.of(2024, 6, 4), AttendanceStatus.LATE, false)))
                    .todayTelemetry(fullDay(LocalDate.of(2024, 6, 5)))
                    .todayAttendance(new AttendanceRecord(LocalDate.of(2024, 6, 5), AttendanceStatus.HALF_DAY, false))
                    .build();
        }

        @Test
        @DisplayName("Scores every day, applies attendance and deducts the half day once")
        void fullBreakdown() {
            SalaryBreakdown breakdown = aggregator.calculate(week(), POLICY);

            assertEquals(new BigDecimal("1000.00"), breakdown.getDailyPotential());
            assertEquals(0, breakdown.getGhostDays());
            assertEquals(2, breakdown.getActiveDays());
            assertEquals(new BigDecimal("1350.00"), breakdown.getActiveEarnings());
            assertEquals(new BigDecimal("250.00"), breakdown.getTodayEarnings());
            assertEquals(new BigDecimal("1.00"), breakdown.getTodayPerformanceScore());
            assertEquals(new BigDecimal("0.50"), breakdown.getTodayAttendanceMultiplier());

            assertEquals(1, breakdown.getLatePolicy().totalLates());
            assertEquals(1, breakdown.getLatePolicy().totalHalfDays());
            assertEquals(2, breakdown.getLatePolicy().freeLatesRemaining());
            assertEquals(new BigDecimal("0.50"), breakdown.getLatePolicy().deductionDays());
            assertEquals(new BigDecimal("500.00"), breakdown.getLatePolicy().deductionAmount());

            assertEquals(new BigDecimal("1600.00"), breakdown.getTotalEarnedBeforeDeduction());
            assertEquals(new BigDecimal("1100.00"), breakdown.getTotalEarned());
            assertEquals(6, breakdown.getPercentageEarned());
        }

        @Test
        @DisplayName("Projects the remaining days at the average score so far")
        void projection() {
            SalaryBreakdown breakdown = aggregator.calculate(week(), POLICY);

            assertEquals(3, breakdown.getWorkingDaysElapsed());
            assertEquals(17, breakdown.getWorkingDaysRemaining());
            assertEquals(new BigDecimal("0.78"), breakdown.getPerformanceSummary().avgPerformanceScore());
            // 1100 + 17 * 1000 * (2.35 / 3)
            assertEquals(new BigDecimal("14416.67"), breakdown.getProjectedSalary());
        }

        @Test
        void testAttendanceAndPerformanceSummaries() {
            SalaryBreakdown breakdown = aggregator.calculate(week(), POLICY);

            assertEquals(1, breakdown.getAttendanceBreakdown().onTime().days());
            assertEquals(new BigDecimal("1000.00"), breakdown.getAttendanceBreakdown().onTime().earnings());
            assertEquals(new BigDecimal("350.00"), breakdown.getAttendanceBreakdown().late().earnings());
            assertEquals(new BigDecimal("250.00"), breakdown.getAttendanceBreakdown().halfDay().earnings());
            assertEquals(0, breakdown.getAttendanceBreakdown().absent().days());

            assertEquals(375, breakdown.getPerformanceSummary().totalCalls());
            assertEquals(9000, breakdown.getPerformanceSummary().totalTalkTimeSeconds());
            assertEquals(6, breakdown.getPerformanceSummary().totalLeads());
        }

        @Test
        @DisplayName("A day with telemetry but no attendance is an unpaid absence")
        void missingAttendance() {
            SalaryCalculationRequest request = request(JUNE_1, LocalDate.of(2024, 6, 5))
                    .pastTelemetry(List.of(fullDay(LocalDate.of(2024, 6, 3))))
                    .build();

            SalaryBreakdown breakdown = aggregator.calculate(request, POLICY);

            assertEquals(1, breakdown.getActiveDays());
            assertEquals(new BigDecimal("0.00"), breakdown.getActiveEarnings());
            assertEquals(1, breakdown.getAttendanceBreakdown().absent().days());
            assertEquals(new BigDecimal("0.00"), breakdown.getTodayEarnings());
        }

        @Test
        @DisplayName("Rows from the previous month are ignored")
        void previousMonthIgnored() {
            SalaryCalculationRequest request = request(JUNE_1, LocalDate.of(2024, 6, 5))
                    .pastTelemetry(List.of(fullDay(LocalDate.of(2024, 5, 31)), fullDay(LocalDate.of(2024, 6, 3))))
                    .pastAttendance(List.of(
                            new AttendanceRecord(LocalDate.of(2024, 5, 31), AttendanceStatus.LATE, false),
                            new AttendanceRecord(LocalDate.of(2024, 6, 3), AttendanceStatus.ON_TIME, false)))
                    .build();

            SalaryBreakdown breakdown = aggregator.calculate(request, POLICY);

            assertEquals(1, breakdown.getActiveDays());
            assertEquals(0, breakdown.getLatePolicy().totalLates());
            assertEquals(new BigDecimal("1000.00"), breakdown.getTotalEarned());
        }
    }

    // ============================================================================
    // Negative totals
    // ============================================================================

    @Nested
    @DisplayName("Deductions larger than earnings")
    class Clamp {

        private SalaryCalculationRequest halfDaysOnly() {
            List<AttendanceRecord> attendance = new ArrayList<>();
            for (int day = 3; day <= 6; day++) {
                attendance.add(new AttendanceRecord(LocalDate.of(2024, 6, day), AttendanceStatus.HALF_DAY, true));
            }
            return request(JUNE_1, LocalDate.of(2024, 6, 7)).pastAttendance(attendance).build();
        }

        @Test
        void testClampedToZero() {
            SalaryBreakdown breakdown = aggregator.calculate(halfDaysOnly(), POLICY);

            assertEquals(new BigDecimal("2000.00"), breakdown.getLatePolicy().deductionAmount());
            assertEquals(new BigDecimal("0.00"), breakdown.getTotalEarned());
            assertEquals(new BigDecimal("15000.00"), breakdown.getProjectedSalary());
            assertEquals(0, breakdown.getPercentageEarned());
        }

        @Test
        void testNegativeWhenClampDisabled() {
            SalaryPolicy unclamped = new SalaryPolicy(PerformanceTargets.FULL_TIME, PerformanceWeights.DEFAULT, LatePolicy.DEFAULT, false);

            SalaryBreakdown breakdown = aggregator.calculate(halfDaysOnly(), unclamped);

            assertEquals(new BigDecimal("-2000.00"), breakdown.getTotalEarned());
            assertEquals(new BigDecimal("13000.00"), breakdown.getProjectedSalary());
        }
    }

    // ============================================================================
    // Determinism and validation
    // ============================================================================

    @Test
    @DisplayName("Identical inputs serialise to identical bytes")
    void idempotent() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        SalaryCalculationRequest request = request(LocalDate.of(2024, 6, 4), LocalDate.of(2024, 6, 12))
                .pastTelemetry(List.of(
                        new DailyTelemetry(LocalDate.of(2024, 6, 10), 140, 3000, 1),
                        new DailyTelemetry(LocalDate.of(2024, 6, 4), 20, 700, 2)))
                .pastAttendance(List.of(
                        new AttendanceRecord(LocalDate.of(2024, 6, 4), AttendanceStatus.LATE, false),
                        new AttendanceRecord(LocalDate.of(2024, 6, 10), AttendanceStatus.HALF_DAY, false)))
                .todayTelemetry(new DailyTelemetry(LocalDate.of(2024, 6, 12), 33, 1234, 0))
                .todayAttendance(new AttendanceRecord(LocalDate.of(2024, 6, 12), AttendanceStatus.ON_TIME, false))
                .build();

        byte[] first = mapper.writeValueAsBytes(aggregator.calculate(request, POLICY));
        byte[] second = mapper.writeValueAsBytes(aggregator.calculate(request, POLICY));

        assertArrayEquals(first, second);
    }

    @Test
    void testPastRowOnReferenceDateIsRejected() {
        LocalDate reference = LocalDate.of(2024, 6, 5);
        SalaryCalculationRequest request = request(JUNE_1, reference)
                .pastTelemetry(List.of(fullDay(reference)))
                .build();

        PayrollValidationException e = assertThrows(PayrollValidationException.class, () -> aggregator.calculate(request, POLICY));
        assertEquals(ErrorType.DATE_OUT_OF_RANGE, e.getErrors().get(0).getType());
    }

    @Test
    void testDuplicateTelemetryIsRejected() {
        LocalDate day = LocalDate.of(2024, 6, 3);
        SalaryCalculationRequest request = request(JUNE_1, LocalDate.of(2024, 6, 5))
                .pastTelemetry(List.of(fullDay(day), fullDay(day)))
                .build();

        assertThrows(PayrollValidationException.class, () -> aggregator.calculate(request, POLICY));
    }

    @Test
    @DisplayName("Empty history rows are reported as missing instead of failing the calculation")
    void emptyHistoryRows() {
        List<DailyTelemetry> telemetry = new ArrayList<>();
        telemetry.add(null);
        List<AttendanceRecord> attendance = new ArrayList<>();
        attendance.add(null);
        SalaryCalculationRequest request = request(JUNE_1, LocalDate.of(2024, 6, 5))
                .pastTelemetry(telemetry)
                .pastAttendance(attendance)
                .build();

        PayrollValidationException e = assertThrows(PayrollValidationException.class, () -> aggregator.calculate(request, POLICY));
        assertEquals(2, e.getErrors().size());
        assertEquals("pastTelemetry", e.getErrors().get(0).getField());
        assertEquals(ErrorType.MISSING_REQUIRED, e.getErrors().get(0).getType());
        assertEquals("pastAttendance", e.getErrors().get(1).getField());
        assertEquals(ErrorType.MISSING_REQUIRED, e.getErrors().get(1).getType());
    }

    @Test
    void testNegativeSalaryIsRejected() {
        SalaryCalculationRequest request = request(JUNE_1, LocalDate.of(2024, 6, 5))
                .baseSalary(new BigDecimal("-1"))
                .build();

        PayrollValidationException e = assertThrows(PayrollValidationException.class, () -> aggregator.calculate(request, POLICY));
        assertEquals(ErrorType.NEGATIVE_VALUE, e.getErrors().get(0).getType());
    }
}
