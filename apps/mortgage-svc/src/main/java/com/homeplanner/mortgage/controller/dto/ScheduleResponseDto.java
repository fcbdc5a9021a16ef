package com.homeplanner.mortgage.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record ScheduleResponseDto(
        BigDecimal monthlyPayment,
        int totalMonths,
        BigDecimal totalInterest,
        BigDecimal totalPaid,
        BigDecimal totalEscrow,
        LocalDate payoffDate,
        LocalDate pmiRemovalDate,
        List<Entry> entries
) {
    public record Entry(
            int monthIndex,
            LocalDate date,
            BigDecimal beginningBalance,
            BigDecimal scheduledPrincipal,
            BigDecimal scheduledInterest,
            BigDecimal extraPrincipal,
            BigDecimal endingBalance,
            boolean pmiActive,
            BigDecimal escrowAddOns,
            BigDecimal totalPayment,
            BigDecimal cumulativeInterest
    ) {
    }
}
