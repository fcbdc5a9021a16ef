package com.homeplanner.mortgage.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One period of an amortization schedule. Component order matches the export column order.
 */
public record MonthlyEntry(
        int monthIndex,
        LocalDate calendarDate,
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

    public BigDecimal principalAndInterest() {
        return scheduledPrincipal.add(scheduledInterest);
    }

    public BigDecimal principalPaid() {
        return scheduledPrincipal.add(extraPrincipal);
    }
}
