package com.homeplanner.mortgage.controller.dto;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.YearMonth;

public record LoanRequestDto(
        @NotNull BigDecimal principal,
        @NotNull BigDecimal annualRatePercent,
        @NotNull Integer termMonths,
        @NotNull YearMonth startMonth,
        BigDecimal homeValue,
        BigDecimal monthlyTax,
        BigDecimal monthlyInsurance,
        BigDecimal monthlyHoa,
        BigDecimal monthlyPmi,
        BigDecimal monthlyPaymentOverride
) {
}
