package com.homeplanner.mortgage.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.homeplanner.mortgage.config.MortgageProperties;
import com.homeplanner.mortgage.exception.InvalidLoanException;
import com.homeplanner.mortgage.exception.InvalidPlanException;
import com.homeplanner.mortgage.exception.InvariantViolationException;
import com.homeplanner.mortgage.model.AmortizationSchedule;
import com.homeplanner.mortgage.model.LoanTerms;
import com.homeplanner.mortgage.model.MonthlyEntry;
import com.homeplanner.mortgage.model.PaymentPlan;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AmortizationEngineTest {

    private static final YearMonth START = YearMonth.of(2025, 1);

    private AmortizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new AmortizationEngine(MortgageProperties.defaults());
    }

    @Test
    void interestFreeLoanPaysEqualPrincipalEveryMonth() {
        LoanTerms loan = loan("12000", "0", 12).build();

        AmortizationSchedule schedule = engine.computeSchedule(loan, PaymentPlan.none());

        assertThat(schedule.entries()).hasSize(12);
        assertThat(schedule.monthlyPayment()).isEqualByComparingTo("1000.00");
        for (MonthlyEntry entry : schedule.entries()) {
            assertThat(entry.scheduledPrincipal()).isEqualByComparingTo("1000.00");
            assertThat(entry.scheduledInterest()).isZero();
            assertThat(entry.extraPrincipal()).isZero();
        }
        MonthlyEntry last = schedule.entries().get(11);
        assertThat(last.endingBalance()).isEqualByComparingTo("0.00");
        assertThat(last.calendarDate()).isEqualTo(LocalDate.of(2025, 12, 1));
        assertThat(schedule.payoffDate()).contains(LocalDate.of(2025, 12, 1));
    }

    @Test
    void interestFreeLoanPutsRemainderInFinalMonth() {
        LoanTerms loan = loan("10000", "0", 3).build();

        List<MonthlyEntry> entries = engine.computeSchedule(loan, PaymentPlan.none()).entries();

        assertThat(entries).extracting(MonthlyEntry::scheduledPrincipal)
                .usingComparatorForType(BigDecimal::compareTo, BigDecimal.class)
                .containsExactly(new BigDecimal("3333.34"), new BigDecimal("3333.34"), new BigDecimal("3333.32"));
    }

    @Test
    void scheduledPrincipalSumsToPrincipalOverFullTerm() {
        LoanTerms loan = loan("422000", "6.625", 360).build();

        AmortizationSchedule schedule = engine.computeSchedule(loan, PaymentPlan.none());

        assertThat(schedule.totalMonths()).isEqualTo(360);
        assertThat(schedule.totalScheduledPrincipal()).isEqualByComparingTo("422000.00");
        assertThat(schedule.monthlyPayment()).isEqualByComparingTo("2702.12");
        assertThat(schedule.entries().get(0).scheduledInterest()).isEqualByComparingTo("2329.79");
        assertThat(schedule.entries().get(359).endingBalance()).isZero();
    }

    @Test
    void levelPaymentStaysFixedUntilTheFinalPeriod() {
        LoanTerms loan = loan("250000", "5.25", 180).build();

        AmortizationSchedule schedule = engine.computeSchedule(loan, PaymentPlan.none());

        List<MonthlyEntry> entries = schedule.entries();
        for (MonthlyEntry entry : entries.subList(0, entries.size() - 1)) {
            assertThat(entry.principalAndInterest()).isEqualByComparingTo(schedule.monthlyPayment());
        }
        assertThat(entries.get(entries.size() - 1).principalAndInterest()).isLessThanOrEqualTo(schedule.monthlyPayment().add(BigDecimal.ONE));
    }

    @Test
    void balancesChainFromMonthToMonth() {
        LoanTerms loan = loan("300000", "7", 360).build();

        List<MonthlyEntry> entries = engine.computeSchedule(loan, PaymentPlan.monthly(new BigDecimal("250"))).entries();

        for (int i = 1; i < entries.size(); i++) {
            assertThat(entries.get(i).beginningBalance()).isEqualByComparingTo(entries.get(i - 1).endingBalance());
            assertThat(entries.get(i).monthIndex()).isEqualTo(i + 1);
        }
        for (MonthlyEntry entry : entries) {
            assertThat(entry.principalPaid()).isEqualByComparingTo(entry.scheduledPrincipal().add(entry.extraPrincipal()));
            assertThat(entry.endingBalance()).isEqualByComparingTo(entry.beginningBalance().subtract(entry.principalPaid()));
            assertThat(entry.endingBalance().signum()).isGreaterThanOrEqualTo(0);
        }
        BigDecimal cumulative = entries.stream().map(MonthlyEntry::scheduledInterest).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(entries.get(entries.size() - 1).cumulativeInterest()).isEqualByComparingTo(cumulative);
    }

    @Test
    void oneTimeExtraCoveringTheBalanceRetiresLoanInFirstMonth() {
        LoanTerms loan = loan("5000", "6", 60).build();

        AmortizationSchedule schedule = engine.computeSchedule(loan, PaymentPlan.oneTime(1, new BigDecimal("5000")));

        assertThat(schedule.entries()).hasSize(1);
        MonthlyEntry only = schedule.entries().get(0);
        assertThat(only.endingBalance()).isZero();
        assertThat(only.scheduledInterest()).isEqualByComparingTo("25.00");
        assertThat(only.scheduledPrincipal().add(only.extraPrincipal())).isEqualByComparingTo("5000.00");
    }

    @Test
    void extraIsClippedToTheRemainingBalance() {
        LoanTerms loan = loan("2000", "4", 24).build();

        AmortizationSchedule schedule = engine.computeSchedule(loan, PaymentPlan.monthly(new BigDecimal("1500")));

        assertThat(schedule.entries()).hasSize(2);
        MonthlyEntry last = schedule.entries().get(1);
        assertThat(last.extraPrincipal()).isLessThan(new BigDecimal("1500"));
        assertThat(last.endingBalance()).isZero();
        assertThat(schedule.totalScheduledPrincipal().add(schedule.totalExtraPrincipal())).isEqualByComparingTo("2000.00");
    }

    @Test
    void singleMonthTermPaysEverythingAtOnce() {
        LoanTerms loan = loan("1000", "12", 1).build();

        AmortizationSchedule schedule = engine.computeSchedule(loan, PaymentPlan.monthly(new BigDecimal("50")));

        assertThat(schedule.entries()).hasSize(1);
        MonthlyEntry only = schedule.entries().get(0);
        assertThat(only.scheduledPrincipal()).isEqualByComparingTo("1000.00");
        assertThat(only.scheduledInterest()).isEqualByComparingTo("10.00");
        assertThat(only.extraPrincipal()).isZero();
        assertThat(only.endingBalance()).isZero();
    }

    @Test
    void recurringExtraHonoursEffectiveMonth() {
        LoanTerms loan = loan("100000", "5", 120).build();
        PaymentPlan plan = new PaymentPlan(new BigDecimal("200"), 13, Optional.empty());

        List<MonthlyEntry> entries = engine.computeSchedule(loan, plan).entries();

        assertThat(entries.subList(0, 12)).allSatisfy(entry -> assertThat(entry.extraPrincipal()).isZero());
        assertThat(entries.get(12).extraPrincipal()).isEqualByComparingTo("200.00");
        assertThat(entries).hasSizeLessThan(120);
    }

    @Test
    void pmiChargedThroughCrossingPeriodAndDroppedNextMonth() {
        LoanTerms loan = pmiLoan().build();

        AmortizationSchedule schedule = engine.computeSchedule(loan, PaymentPlan.none());

        List<MonthlyEntry> entries = schedule.entries();
        BigDecimal thresholdBalance = new BigDecimal("160000.00");
        int crossing = firstIndexAtOrBelow(entries, thresholdBalance);
        assertThat(crossing).isPositive();
        for (int i = 0; i <= crossing; i++) {
            assertThat(entries.get(i).pmiActive()).as("month %d", i + 1).isTrue();
        }
        for (int i = crossing + 1; i < entries.size(); i++) {
            assertThat(entries.get(i).pmiActive()).as("month %d", i + 1).isFalse();
        }
        assertThat(entries.get(crossing - 1).endingBalance()).isGreaterThan(thresholdBalance);
        assertThat(schedule.pmiRemovalMonth()).contains(crossing + 2);
        assertThat(schedule.pmiRemovalDate()).contains(entries.get(crossing + 1).calendarDate());
    }

    @Test
    void escrowIncludesPmiOnlyWhileActive() {
        LoanTerms loan = pmiLoan()
                .monthlyTax(new BigDecimal("300"))
                .monthlyInsurance(new BigDecimal("100"))
                .monthlyHoa(new BigDecimal("50"))
                .build();

        AmortizationSchedule schedule = engine.computeSchedule(loan, PaymentPlan.none());

        MonthlyEntry first = schedule.entries().get(0);
        assertThat(first.escrowAddOns()).isEqualByComparingTo("540.00");
        assertThat(first.totalPayment()).isEqualByComparingTo(schedule.monthlyPayment().add(new BigDecimal("540.00")));
        MonthlyEntry afterRemoval = schedule.entries().get(schedule.pmiRemovalMonth().orElseThrow() - 1);
        assertThat(afterRemoval.escrowAddOns()).isEqualByComparingTo("450.00");
    }

    @Test
    void zeroLagDropsPmiInTheCrossingPeriod() {
        LoanTerms loan = pmiLoan().build();
        PmiPolicy noLag = new PmiPolicy(new BigDecimal("0.80"), PmiPolicy.LtvBasis.POST_PAYMENT, 0);

        List<MonthlyEntry> entries = engine.computeSchedule(loan, PaymentPlan.none(), noLag).entries();

        int crossing = firstIndexAtOrBelow(entries, new BigDecimal("160000.00"));
        assertThat(entries.get(crossing - 1).pmiActive()).isTrue();
        assertThat(entries.get(crossing).pmiActive()).isFalse();
    }

    @Test
    void prePaymentBasisCrossesOnePeriodLater() {
        LoanTerms loan = pmiLoan().build();
        PmiPolicy prePayment = new PmiPolicy(new BigDecimal("0.80"), PmiPolicy.LtvBasis.PRE_PAYMENT, 1);

        AmortizationSchedule postSchedule = engine.computeSchedule(loan, PaymentPlan.none());
        AmortizationSchedule preSchedule = engine.computeSchedule(loan, PaymentPlan.none(), prePayment);

        assertThat(preSchedule.pmiRemovalMonth().orElseThrow())
                .isEqualTo(postSchedule.pmiRemovalMonth().orElseThrow() + 1);
    }

    @Test
    void extraPaymentsBringPmiRemovalForward() {
        LoanTerms loan = pmiLoan().build();

        int baseline = engine.computeSchedule(loan, PaymentPlan.none()).pmiRemovalMonth().orElseThrow();
        int accelerated = engine.computeSchedule(loan, PaymentPlan.monthly(new BigDecimal("500"))).pmiRemovalMonth().orElseThrow();

        assertThat(accelerated).isLessThan(baseline);
    }

    @Test
    void pmiNeverRemovedWithoutHomeValue() {
        LoanTerms loan = loan("180000", "6.5", 360).monthlyPmi(new BigDecimal("90")).build();

        AmortizationSchedule schedule = engine.computeSchedule(loan, PaymentPlan.none());

        assertThat(schedule.entries()).allSatisfy(entry -> assertThat(entry.pmiActive()).isTrue());
        assertThat(schedule.pmiRemovalMonth()).isEmpty();
        assertThat(schedule.pmiRemovalDate()).isEmpty();
    }

    @Test
    void pmiNeverRemovedWhenHomeValueBelowPrincipal() {
        LoanTerms loan = loan("180000", "6.5", 360)
                .homeValue(new BigDecimal("170000"))
                .monthlyPmi(new BigDecimal("90"))
                .build();

        AmortizationSchedule schedule = engine.computeSchedule(loan, PaymentPlan.none());

        assertThat(schedule.entries()).allSatisfy(entry -> assertThat(entry.pmiActive()).isTrue());
    }

    @Test
    void noPmiMeansNeverActive() {
        LoanTerms loan = loan("180000", "6.5", 360).homeValue(new BigDecimal("200000")).build();

        AmortizationSchedule schedule = engine.computeSchedule(loan, PaymentPlan.none());

        assertThat(schedule.entries()).noneMatch(MonthlyEntry::pmiActive);
        assertThat(schedule.pmiRemovalMonth()).isEmpty();
    }

    @Test
    void identicalInputsYieldIdenticalSchedules() {
        LoanTerms loan = pmiLoan().monthlyTax(new BigDecimal("275.50")).build();
        PaymentPlan plan = PaymentPlan.monthly(new BigDecimal("125")).withOneTimeExtra(24, new BigDecimal("10000"));

        assertThat(engine.computeSchedule(loan, plan)).isEqualTo(engine.computeSchedule(loan, plan));
    }

    @Test
    void paymentOverrideRunsUntilPayoff() {
        LoanTerms loan = loan("100000", "6", 360).monthlyPaymentOverride(new BigDecimal("1000")).build();

        AmortizationSchedule schedule = engine.computeSchedule(loan, PaymentPlan.none());

        assertThat(schedule.monthlyPayment()).isEqualByComparingTo("1000.00");
        assertThat(schedule.totalMonths()).isBetween(100, 200);
        assertThat(schedule.entries().get(schedule.totalMonths() - 1).endingBalance()).isZero();
        assertThat(schedule.totalScheduledPrincipal()).isEqualByComparingTo("100000.00");
    }

    @Test
    void paymentOverrideMustCoverFirstMonthInterest() {
        LoanTerms loan = loan("100000", "6", 360).monthlyPaymentOverride(new BigDecimal("500")).build();

        assertThatThrownBy(() -> engine.computeSchedule(loan, PaymentPlan.none()))
                .isInstanceOf(InvalidLoanException.class)
                .hasMessageContaining("interest");
    }

    @Test
    void paymentOverrideThatCannotFinishWithinLimitIsAnInvalidLoan() {
        AmortizationEngine shortEngine = new AmortizationEngine(
                new MortgageProperties(null, new MortgageProperties.Engine(24)));
        LoanTerms loan = loan("100000", "6", 24).monthlyPaymentOverride(new BigDecimal("1000")).build();

        assertThatThrownBy(() -> shortEngine.computeSchedule(loan, PaymentPlan.none()))
                .isInstanceOf(InvalidLoanException.class)
                .hasMessageContaining("within 24 months");
    }

    @Test
    void paymentOverrideJustAboveInterestIsAnInvalidLoan() {
        LoanTerms loan = loan("100000", "6", 360).monthlyPaymentOverride(new BigDecimal("500.01")).build();

        assertThatThrownBy(() -> engine.computeSchedule(loan, PaymentPlan.none()))
                .isInstanceOf(InvalidLoanException.class)
                .hasMessageContaining("within 1200 months");
    }

    @Test
    void interestFreeOverrideTooSmallForLimitIsAnInvalidLoan() {
        LoanTerms loan = loan("1000000", "0", 360).monthlyPaymentOverride(new BigDecimal("100")).build();

        assertThatThrownBy(() -> engine.computeSchedule(loan, PaymentPlan.none()))
                .isInstanceOf(InvalidLoanException.class)
                .hasMessageContaining("at least 833.34");
    }

    @Test
    void smallestAcceptedOverrideRetiresTheLoanWithinLimit() {
        AmortizationEngine shortEngine = new AmortizationEngine(
                new MortgageProperties(null, new MortgageProperties.Engine(120)));
        BigDecimal minimum = PaymentCalculator.levelPayment(
                new BigDecimal("100000.00"), PaymentCalculator.monthlyRate(new BigDecimal("6")), 120)
                .add(new BigDecimal("0.01"));
        LoanTerms loan = loan("100000", "6", 120).monthlyPaymentOverride(minimum).build();

        AmortizationSchedule schedule = shortEngine.computeSchedule(loan, PaymentPlan.none());

        assertThat(schedule.totalMonths()).isLessThanOrEqualTo(120);
        assertThat(schedule.entries().get(schedule.totalMonths() - 1).endingBalance()).isZero();
        assertThatThrownBy(() -> shortEngine.computeSchedule(
                loan("100000", "6", 120).monthlyPaymentOverride(minimum.subtract(new BigDecimal("0.01"))).build(),
                PaymentPlan.none()))
                .isInstanceOf(InvalidLoanException.class);
    }

    @Test
    void termBeyondEngineLimitIsRejected() {
        AmortizationEngine shortEngine = new AmortizationEngine(
                new MortgageProperties(null, new MortgageProperties.Engine(360)));
        LoanTerms loan = loan("100000", "6", 480).build();

        assertThatThrownBy(() -> shortEngine.computeSchedule(loan, PaymentPlan.none()))
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("480");
    }

    @Test
    void oneTimeExtraOutsideTermIsRejected() {
        LoanTerms loan = loan("100000", "6", 120).build();

        assertThatThrownBy(() -> engine.computeSchedule(loan, PaymentPlan.oneTime(121, new BigDecimal("1000"))))
                .isInstanceOf(InvalidPlanException.class)
                .hasMessageContaining("121");
    }

    @Test
    void missingArgumentsAreRejected() {
        assertThatThrownBy(() -> engine.computeSchedule(null, PaymentPlan.none()))
                .isInstanceOf(InvalidLoanException.class);
        assertThatThrownBy(() -> engine.computeSchedule(loan("1000", "1", 12).build(), null))
                .isInstanceOf(InvalidPlanException.class);
        assertThatThrownBy(() -> engine.computeSchedule(loan("1000", "1", 12).build(), PaymentPlan.none(), null))
                .isInstanceOf(NullPointerException.class);
    }

    private static int firstIndexAtOrBelow(List<MonthlyEntry> entries, BigDecimal balance) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).endingBalance().compareTo(balance) <= 0) {
                return i;
            }
        }
        return -1;
    }

    private static LoanTerms.Builder pmiLoan() {
        return loan("180000", "6.5", 360)
                .homeValue(new BigDecimal("200000"))
                .monthlyPmi(new BigDecimal("90"));
    }

    private static LoanTerms.Builder loan(String principal, String rate, int termMonths) {
        return LoanTerms.builder()
                .principal(new BigDecimal(principal))
                .annualRatePercent(new BigDecimal(rate))
                .termMonths(termMonths)
                .startMonth(START);
    }
}
