package com.homeplanner.mortgage.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record ProjectionResponseDto(
        ScheduleResponseDto schedule,
        SavingsResponseDto savings,
        HousingCost housingCost,
        LocalDate pmiRemovalDate,
        boolean pmiRemovalEvaluable,
        List<String> notes,
        String traceId
) {
    public record HousingCost(BigDecimal principalAndInterest, BigDecimal withPmi, BigDecimal withoutPmi) {
    }
}
