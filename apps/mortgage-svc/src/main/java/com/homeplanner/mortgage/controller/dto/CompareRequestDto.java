package com.homeplanner.mortgage.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * A missing baseline plan means the schedule without extra payments.
 */
public record CompareRequestDto(
        @Valid @NotNull LoanRequestDto loan,
        @Valid PaymentPlanRequestDto baselinePlan,
        @Valid @NotNull PaymentPlanRequestDto scenarioPlan
) {
}
