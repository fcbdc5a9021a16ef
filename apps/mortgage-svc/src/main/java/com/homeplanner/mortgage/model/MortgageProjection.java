package com.homeplanner.mortgage.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record MortgageProjection(
        AmortizationSchedule schedule,
        AmortizationSchedule baseline,
        SavingsSummary savings,
        HousingCost housingCost,
        LocalDate pmiRemovalDate,
        boolean pmiRemovalEvaluable,
        List<String> notes,
        String traceId
) {

    /**
     * Monthly housing outlay: scheduled principal and interest plus escrow, with and without PMI.
     */
    public record HousingCost(BigDecimal principalAndInterest, BigDecimal withPmi, BigDecimal withoutPmi) {
    }
}
