package com.homeplanner.mortgage.engine;

import com.homeplanner.mortgage.config.MortgageProperties;
import com.homeplanner.mortgage.exception.InvalidLoanException;
import com.homeplanner.mortgage.exception.InvalidPlanException;
import com.homeplanner.mortgage.exception.InvariantViolationException;
import com.homeplanner.mortgage.model.AmortizationSchedule;
import com.homeplanner.mortgage.model.LoanTerms;
import com.homeplanner.mortgage.model.MonthlyEntry;
import com.homeplanner.mortgage.model.PaymentPlan;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds month-by-month schedules for fixed-rate loans.
 * <p>
 * Each call is a pure function of its arguments: all running state lives on the call stack and money is
 * carried as cent-scale {@link BigDecimal}, so identical inputs always produce an equal schedule and calls
 * may run concurrently.
 */
@Component
public class AmortizationEngine {

    private static final Logger log = LoggerFactory.getLogger(AmortizationEngine.class);
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
    private static final BigDecimal ONE_CENT = new BigDecimal("0.01");

    private final PmiPolicy pmiPolicy;
    private final int maxMonths;

    public AmortizationEngine(MortgageProperties properties) {
        this.pmiPolicy = properties.pmi().toPolicy();
        this.maxMonths = properties.engine().maxMonths();
    }

    public AmortizationSchedule computeSchedule(LoanTerms loan, PaymentPlan plan) {
        return computeSchedule(loan, plan, pmiPolicy);
    }

    public AmortizationSchedule computeSchedule(LoanTerms loan, PaymentPlan plan, PmiPolicy policy) {
        if (loan == null) {
            throw new InvalidLoanException("loan terms must be provided");
        }
        if (plan == null) {
            throw new InvalidPlanException("payment plan must be provided");
        }
        Objects.requireNonNull(policy, "pmi policy must be provided");
        validatePlan(loan, plan);
        if (loan.termMonths() > maxMonths) {
            throw new InvariantViolationException(
                    "termMonths " + loan.termMonths() + " exceeds the engine limit of " + maxMonths);
        }

        BigDecimal monthlyRate = PaymentCalculator.monthlyRate(loan.annualRatePercent());
        boolean termBound = loan.monthlyPaymentOverride().isEmpty();
        BigDecimal payment = termBound
                ? PaymentCalculator.levelPayment(loan.principal(), monthlyRate, loan.termMonths())
                : loan.monthlyPaymentOverride().get();
        if (!termBound) {
            BigDecimal firstInterest = PaymentCalculator.interestFor(loan.principal(), monthlyRate);
            if (payment.compareTo(firstInterest) <= 0) {
                throw new InvalidLoanException("monthly payment " + payment
                        + " does not cover the first month's interest of " + firstInterest);
            }
            BigDecimal minimumPayment = minimumOverridePayment(loan.principal(), monthlyRate);
            if (payment.compareTo(minimumPayment) < 0) {
                throw new InvalidLoanException("monthly payment " + payment + " cannot retire the loan within "
                        + maxMonths + " months; at least " + minimumPayment + " is required");
            }
        }
        int horizon = termBound ? loan.termMonths() : maxMonths;
        boolean evaluatePmiRemoval = loan.hasPmi() && loan.pmiRemovalEvaluable();
        if (loan.hasPmi() && !evaluatePmiRemoval) {
            log.warn("PMI removal cannot be evaluated (homeValue={}, principal={}); PMI is charged for the life of the loan",
                    loan.homeValue().orElse(null), loan.principal());
        }

        List<MonthlyEntry> entries = new ArrayList<>();
        BigDecimal balance = loan.principal();
        BigDecimal cumulativeInterest = ZERO;
        Integer pmiRemovedFrom = null;

        for (int month = 1; month <= horizon && balance.signum() > 0; month++) {
            BigDecimal beginning = balance;
            BigDecimal interest = PaymentCalculator.interestFor(beginning, monthlyRate);
            BigDecimal scheduledPrincipal = termBound && month == loan.termMonths()
                    ? beginning
                    : payment.subtract(interest).min(beginning).max(ZERO);
            BigDecimal extra = plan.extraFor(month).min(beginning.subtract(scheduledPrincipal));
            BigDecimal ending = beginning.subtract(scheduledPrincipal).subtract(extra);

            if (evaluatePmiRemoval && pmiRemovedFrom == null
                    && policy.thresholdReached(beginning, ending, loan.homeValue().get())) {
                pmiRemovedFrom = policy.removalMonth(month);
                log.debug("PMI threshold reached in month {}; removed from month {}", month, pmiRemovedFrom);
            }
            boolean pmiActive = loan.hasPmi() && (pmiRemovedFrom == null || month < pmiRemovedFrom);
            BigDecimal escrow = pmiActive ? loan.fixedEscrow().add(loan.monthlyPmi()) : loan.fixedEscrow();
            cumulativeInterest = cumulativeInterest.add(interest);

            entries.add(new MonthlyEntry(
                    month,
                    loan.startMonth().plusMonths(month - 1L).atDay(1),
                    beginning,
                    scheduledPrincipal,
                    interest,
                    extra,
                    ending,
                    pmiActive,
                    escrow,
                    scheduledPrincipal.add(interest).add(extra).add(escrow),
                    cumulativeInterest
            ));
            balance = ending;
        }

        if (balance.signum() != 0) {
            throw new InvariantViolationException("schedule ended after " + entries.size()
                    + " months with an outstanding balance of " + balance
                    + (termBound ? "" : "; the payment does not retire the loan within " + maxMonths + " months"));
        }

        Optional<Integer> removalMonth = Optional.ofNullable(pmiRemovedFrom)
                .filter(month -> month <= entries.size());
        log.debug("Computed schedule: months={}, payment={}, pmiRemovalMonth={}",
                entries.size(), payment, removalMonth.orElse(null));
        return new AmortizationSchedule(payment, entries, removalMonth);
    }

    /**
     * Smallest override that is certain to retire {@code principal} within {@code maxMonths} periods.
     */
    private BigDecimal minimumOverridePayment(BigDecimal principal, BigDecimal monthlyRate) {
        BigDecimal level = PaymentCalculator.levelPayment(principal, monthlyRate, maxMonths);
        // one cent over the exact level payment outweighs the half-cent interest rounding of every period
        return monthlyRate.signum() == 0 ? level : level.add(ONE_CENT);
    }

    private static void validatePlan(LoanTerms loan, PaymentPlan plan) {
        plan.oneTimeExtra().ifPresent(extra -> {
            if (extra.monthIndex() > loan.termMonths()) {
                throw new InvalidPlanException("oneTimeExtra.monthIndex " + extra.monthIndex()
                        + " is outside the loan term of " + loan.termMonths() + " months");
            }
        });
    }
}
