package com.homeplanner.mortgage.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record SavingsResponseDto(
        int monthsShaved,
        BigDecimal interestSaved,
        int baselineMonths,
        int scenarioMonths,
        BigDecimal baselineInterest,
        BigDecimal scenarioInterest,
        LocalDate baselinePayoffDate,
        LocalDate scenarioPayoffDate
) {
}
