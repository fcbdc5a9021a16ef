package com.homeplanner.mortgage.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record ScheduleRequestDto(
        @Valid @NotNull LoanRequestDto loan,
        @Valid PaymentPlanRequestDto plan
) {
}
