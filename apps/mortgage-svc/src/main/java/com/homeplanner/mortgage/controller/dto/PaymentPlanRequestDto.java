package com.homeplanner.mortgage.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record PaymentPlanRequestDto(
        BigDecimal extraMonthly,
        Integer effectiveFromMonth,
        @Valid OneTimeExtra oneTimeExtra
) {
    public record OneTimeExtra(@NotNull Integer monthIndex, @NotNull BigDecimal amount) {
    }
}
