package com.homeplanner.mortgage.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Complete schedule for one loan and plan.
 *
 * @param monthlyPayment scheduled principal and interest payment
 * @param entries periods in month order; the last one ends at a zero balance
 * @param pmiRemovalMonth first period without PMI, when PMI was charged and dropped inside the schedule
 */
public record AmortizationSchedule(BigDecimal monthlyPayment, List<MonthlyEntry> entries, Optional<Integer> pmiRemovalMonth) {

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);

    public AmortizationSchedule {
        entries = entries == null ? List.of() : List.copyOf(entries);
        pmiRemovalMonth = pmiRemovalMonth == null ? Optional.empty() : pmiRemovalMonth;
    }

    public int totalMonths() {
        return entries.size();
    }

    public BigDecimal totalInterest() {
        return sum(MonthlyEntry::scheduledInterest);
    }

    public BigDecimal totalScheduledPrincipal() {
        return sum(MonthlyEntry::scheduledPrincipal);
    }

    public BigDecimal totalExtraPrincipal() {
        return sum(MonthlyEntry::extraPrincipal);
    }

    public BigDecimal totalEscrow() {
        return sum(MonthlyEntry::escrowAddOns);
    }

    /** Principal, interest and extra; escrow excluded. */
    public BigDecimal totalPaid() {
        return totalScheduledPrincipal().add(totalInterest()).add(totalExtraPrincipal());
    }

    public Optional<LocalDate> payoffDate() {
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        MonthlyEntry last = entries.get(entries.size() - 1);
        return last.endingBalance().signum() == 0 ? Optional.of(last.calendarDate()) : Optional.empty();
    }

    public Optional<LocalDate> pmiRemovalDate() {
        return pmiRemovalMonth.map(month -> entries.get(month - 1).calendarDate());
    }

    private BigDecimal sum(Function<MonthlyEntry, BigDecimal> field) {
        return entries.stream().map(field).reduce(ZERO, BigDecimal::add);
    }
}
