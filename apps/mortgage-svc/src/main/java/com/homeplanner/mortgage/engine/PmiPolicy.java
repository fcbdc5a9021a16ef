package com.homeplanner.mortgage.engine;

import java.math.BigDecimal;

/**
 * When private mortgage insurance stops being charged.
 * <p>
 * Loan-to-value is {@code basisBalance / homeValue}. The first period whose loan-to-value is at or below
 * {@code ltvThreshold} is the crossing period; PMI is dropped from {@code crossing + removalLagMonths} onward.
 * The default policy evaluates the post-payment balance with a one-period lag, so PMI is still charged in the
 * crossing period and removed starting the next one.
 */
public record PmiPolicy(BigDecimal ltvThreshold, LtvBasis ltvBasis, int removalLagMonths) {

    public static final BigDecimal DEFAULT_LTV_THRESHOLD = new BigDecimal("0.80");
    public static final int DEFAULT_REMOVAL_LAG_MONTHS = 1;

    private static final PmiPolicy STANDARD = new PmiPolicy(DEFAULT_LTV_THRESHOLD, LtvBasis.POST_PAYMENT, DEFAULT_REMOVAL_LAG_MONTHS);

    public PmiPolicy {
        if (ltvThreshold == null || ltvThreshold.signum() <= 0 || ltvThreshold.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("ltvThreshold must be in (0, 1]");
        }
        if (ltvBasis == null) {
            throw new IllegalArgumentException("ltvBasis must be provided");
        }
        if (removalLagMonths < 0) {
            throw new IllegalArgumentException("removalLagMonths must not be negative");
        }
    }

    public static PmiPolicy standard() {
        return STANDARD;
    }

    /**
     * Whether a period with the given balances has crossed the removal threshold.
     */
    public boolean thresholdReached(BigDecimal beginningBalance, BigDecimal endingBalance, BigDecimal homeValue) {
        BigDecimal balance = ltvBasis == LtvBasis.POST_PAYMENT ? endingBalance : beginningBalance;
        // balance / homeValue <= threshold, without the division
        return balance.compareTo(homeValue.multiply(ltvThreshold)) <= 0;
    }

    public int removalMonth(int crossingMonth) {
        return crossingMonth + removalLagMonths;
    }

    public enum LtvBasis {
        /** Balance after the period's payment. */
        POST_PAYMENT,
        /** Balance at the start of the period. */
        PRE_PAYMENT
    }
}
