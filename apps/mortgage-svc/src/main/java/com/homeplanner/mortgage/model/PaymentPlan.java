package com.homeplanner.mortgage.model;

import com.homeplanner.mortgage.exception.InvalidPlanException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Extra principal payments layered on top of the scheduled payment.
 *
 * @param extraMonthly recurring extra, applied every period from {@code effectiveFromMonth}
 * @param effectiveFromMonth first 1-based period receiving the recurring extra
 * @param oneTimeExtra optional single lump sum
 */
public record PaymentPlan(BigDecimal extraMonthly, int effectiveFromMonth, Optional<OneTimeExtra> oneTimeExtra) {

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
    private static final PaymentPlan NONE = new PaymentPlan(ZERO, 1, Optional.empty());

    public PaymentPlan {
        if (extraMonthly == null) {
            extraMonthly = ZERO;
        }
        if (extraMonthly.signum() < 0) {
            throw new InvalidPlanException("extraMonthly must not be negative");
        }
        extraMonthly = extraMonthly.setScale(2, RoundingMode.HALF_UP);
        if (effectiveFromMonth < 1) {
            throw new InvalidPlanException("effectiveFromMonth must be at least 1");
        }
        if (oneTimeExtra == null) {
            oneTimeExtra = Optional.empty();
        }
    }

    public static PaymentPlan none() {
        return NONE;
    }

    public static PaymentPlan monthly(BigDecimal extraMonthly) {
        return new PaymentPlan(extraMonthly, 1, Optional.empty());
    }

    public static PaymentPlan oneTime(int monthIndex, BigDecimal amount) {
        return new PaymentPlan(ZERO, 1, Optional.of(new OneTimeExtra(monthIndex, amount)));
    }

    public PaymentPlan withOneTimeExtra(int monthIndex, BigDecimal amount) {
        return new PaymentPlan(extraMonthly, effectiveFromMonth, Optional.of(new OneTimeExtra(monthIndex, amount)));
    }

    public boolean hasExtraPayments() {
        return extraMonthly.signum() > 0 || oneTimeExtra.map(extra -> extra.amount().signum() > 0).orElse(false);
    }

    /**
     * Requested extra for a period, before clipping against the remaining balance.
     */
    public BigDecimal extraFor(int monthIndex) {
        BigDecimal extra = monthIndex >= effectiveFromMonth ? extraMonthly : ZERO;
        if (oneTimeExtra.isPresent() && oneTimeExtra.get().monthIndex() == monthIndex) {
            extra = extra.add(oneTimeExtra.get().amount());
        }
        return extra;
    }

    public record OneTimeExtra(int monthIndex, BigDecimal amount) {
        public OneTimeExtra {
            if (monthIndex < 1) {
                throw new InvalidPlanException("oneTimeExtra.monthIndex must be at least 1");
            }
            if (amount == null || amount.signum() < 0) {
                throw new InvalidPlanException("oneTimeExtra.amount must not be negative");
            }
            amount = amount.setScale(2, RoundingMode.HALF_UP);
        }
    }
}
