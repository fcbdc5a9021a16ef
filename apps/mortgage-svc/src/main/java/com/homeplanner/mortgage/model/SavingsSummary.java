package com.homeplanner.mortgage.model;

import com.homeplanner.mortgage.exception.InvariantViolationException;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Baseline versus scenario comparison. Savings are never negative: a scenario with more extra principal
 * cannot take longer or cost more interest.
 */
public record SavingsSummary(
        int monthsShaved,
        BigDecimal interestSaved,
        int baselineMonths,
        int scenarioMonths,
        BigDecimal baselineInterest,
        BigDecimal scenarioInterest,
        LocalDate baselinePayoffDate,
        LocalDate scenarioPayoffDate
) {

    public SavingsSummary {
        if (monthsShaved < 0) {
            throw new InvariantViolationException("monthsShaved is negative: " + monthsShaved);
        }
        if (interestSaved == null || interestSaved.signum() < 0) {
            throw new InvariantViolationException("interestSaved is negative: " + interestSaved);
        }
    }
}
