package com.homeplanner.mortgage.engine;

import com.homeplanner.mortgage.exception.InvariantViolationException;
import com.homeplanner.mortgage.model.AmortizationSchedule;
import com.homeplanner.mortgage.model.LoanTerms;
import com.homeplanner.mortgage.model.PaymentPlan;
import com.homeplanner.mortgage.model.SavingsSummary;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ScheduleComparator {

    private static final Logger log = LoggerFactory.getLogger(ScheduleComparator.class);

    private final AmortizationEngine engine;

    public ScheduleComparator(AmortizationEngine engine) {
        this.engine = engine;
    }

    public SavingsSummary compare(LoanTerms loan, PaymentPlan baselinePlan, PaymentPlan scenarioPlan) {
        AmortizationSchedule baseline = engine.computeSchedule(loan, baselinePlan);
        AmortizationSchedule scenario = engine.computeSchedule(loan, scenarioPlan);
        return summarize(baseline, scenario);
    }

    public SavingsSummary compareToBaseline(LoanTerms loan, PaymentPlan scenarioPlan) {
        return compare(loan, PaymentPlan.none(), scenarioPlan);
    }

    /**
     * Reduces two computed schedules to their savings. The scenario must carry at least the baseline's extra
     * principal; anything else is reported as an invariant violation rather than a negative saving.
     */
    public SavingsSummary summarize(AmortizationSchedule baseline, AmortizationSchedule scenario) {
        int monthsShaved = baseline.totalMonths() - scenario.totalMonths();
        BigDecimal baselineInterest = baseline.totalInterest();
        BigDecimal scenarioInterest = scenario.totalInterest();
        BigDecimal interestSaved = baselineInterest.subtract(scenarioInterest);
        if (monthsShaved < 0 || interestSaved.signum() < 0) {
            log.error("Savings invariant violated: baselineMonths={}, scenarioMonths={}, baselineInterest={}, scenarioInterest={}",
                    baseline.totalMonths(), scenario.totalMonths(), baselineInterest, scenarioInterest);
            throw new InvariantViolationException("scenario schedule is worse than its baseline: monthsShaved="
                    + monthsShaved + ", interestSaved=" + interestSaved);
        }
        return new SavingsSummary(
                monthsShaved,
                interestSaved,
                baseline.totalMonths(),
                scenario.totalMonths(),
                baselineInterest,
                scenarioInterest,
                baseline.payoffDate().orElse(null),
                scenario.payoffDate().orElse(null)
        );
    }
}
