package com.homeplanner.mortgage.service;

import com.homeplanner.mortgage.engine.AmortizationEngine;
import com.homeplanner.mortgage.engine.ScheduleComparator;
import com.homeplanner.mortgage.model.AmortizationSchedule;
import com.homeplanner.mortgage.model.LoanTerms;
import com.homeplanner.mortgage.model.MortgageProjection;
import com.homeplanner.mortgage.model.PaymentPlan;
import com.homeplanner.mortgage.model.SavingsSummary;
import com.homeplanner.mortgage.web.RequestContextHolder;
import java.math.BigDecimal;
import java.text.NumberFormat;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class MortgageProjectionService {

    private static final Logger log = LoggerFactory.getLogger(MortgageProjectionService.class);
    private static final DateTimeFormatter MONTH_YEAR = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.US);

    private final AmortizationEngine engine;
    private final ScheduleComparator comparator;

    public MortgageProjectionService(AmortizationEngine engine, ScheduleComparator comparator) {
        this.engine = engine;
        this.comparator = comparator;
    }

    public AmortizationSchedule schedule(LoanTerms loan, PaymentPlan plan) {
        AmortizationSchedule schedule = engine.computeSchedule(loan, plan);
        log.info("Schedule computed: principal={}, termMonths={}, months={}, totalInterest={}",
                loan.principal(), loan.termMonths(), schedule.totalMonths(), schedule.totalInterest());
        return schedule;
    }

    public SavingsSummary compare(LoanTerms loan, PaymentPlan baselinePlan, PaymentPlan scenarioPlan) {
        SavingsSummary savings = comparator.compare(loan, baselinePlan, scenarioPlan);
        log.info("Scenario compared: monthsShaved={}, interestSaved={}", savings.monthsShaved(), savings.interestSaved());
        return savings;
    }

    /**
     * Scenario schedule, the no-extra baseline, the savings between them and the PMI drop-off outlook.
     */
    public MortgageProjection project(LoanTerms loan, PaymentPlan plan) {
        AmortizationSchedule scenario = engine.computeSchedule(loan, plan);
        AmortizationSchedule baseline = plan.hasExtraPayments() ? engine.computeSchedule(loan, PaymentPlan.none()) : scenario;
        SavingsSummary savings = comparator.summarize(baseline, scenario);

        LocalDate pmiRemovalDate = scenario.pmiRemovalDate().orElse(null);
        MortgageProjection.HousingCost housingCost = housingCost(loan, scenario.monthlyPayment());
        List<String> notes = buildNotes(loan, pmiRemovalDate, savings);
        String traceId = RequestContextHolder.currentTraceId().orElse(null);

        log.info("Projection built: months={}, baselineMonths={}, interestSaved={}, pmiRemovalDate={}",
                scenario.totalMonths(), baseline.totalMonths(), savings.interestSaved(), pmiRemovalDate);
        return new MortgageProjection(
                scenario,
                baseline,
                savings,
                housingCost,
                pmiRemovalDate,
                loan.pmiRemovalEvaluable(),
                notes,
                traceId
        );
    }

    private static MortgageProjection.HousingCost housingCost(LoanTerms loan, BigDecimal monthlyPayment) {
        BigDecimal withoutPmi = monthlyPayment.add(loan.fixedEscrow());
        return new MortgageProjection.HousingCost(monthlyPayment, withoutPmi.add(loan.monthlyPmi()), withoutPmi);
    }

    private static List<String> buildNotes(LoanTerms loan, LocalDate pmiRemovalDate, SavingsSummary savings) {
        List<String> notes = new ArrayList<>();
        if (loan.hasPmi()) {
            if (pmiRemovalDate != null) {
                notes.add("PMI drops off in " + MONTH_YEAR.format(pmiRemovalDate)
                        + ", reducing your monthly housing cost by " + money(loan.monthlyPmi()) + ".");
            } else if (!loan.pmiRemovalEvaluable()) {
                notes.add("Enter a home value at least equal to the loan balance to estimate when PMI drops off.");
            } else {
                notes.add("PMI stays in place until the loan is paid off.");
            }
        }
        if (savings.monthsShaved() > 0) {
            notes.add("Extra payments retire the loan " + savings.monthsShaved() + " months early and save "
                    + money(savings.interestSaved()) + " in interest.");
        }
        return notes;
    }

    private static String money(BigDecimal amount) {
        return NumberFormat.getCurrencyInstance(Locale.US).format(amount);
    }
}
