package com.homeplanner.mortgage.engine;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Fixed-rate payment arithmetic shared by the engine and its callers.
 */
public final class PaymentCalculator {

    private static final BigDecimal MONTHS_PER_YEAR_PERCENT = BigDecimal.valueOf(1200);
    private static final MathContext PRECISION = MathContext.DECIMAL128;
    // formula noise below this scale must not push the payment up a cent
    private static final int SETTLE_SCALE = 8;

    private PaymentCalculator() {
    }

    /**
     * Monthly periodic rate, {@code annualRatePercent / 100 / 12}.
     */
    public static BigDecimal monthlyRate(BigDecimal annualRatePercent) {
        return annualRatePercent.divide(MONTHS_PER_YEAR_PERCENT, PRECISION);
    }

    /**
     * Level payment that retires {@code principal} over {@code termMonths} periods, rounded up to the cent.
     * Zero-rate loans amortize straight-line.
     */
    public static BigDecimal levelPayment(BigDecimal principal, BigDecimal monthlyRate, int termMonths) {
        if (termMonths <= 0) {
            throw new IllegalArgumentException("termMonths must be positive");
        }
        BigDecimal raw;
        if (monthlyRate.signum() == 0) {
            raw = principal.divide(BigDecimal.valueOf(termMonths), PRECISION);
        } else {
            BigDecimal growth = BigDecimal.ONE.add(monthlyRate).pow(termMonths, PRECISION);
            BigDecimal discount = BigDecimal.ONE.divide(growth, PRECISION);
            raw = principal.multiply(monthlyRate, PRECISION)
                    .divide(BigDecimal.ONE.subtract(discount), PRECISION);
        }
        return ceilCents(raw);
    }

    /** Interest accrued on a balance for one period, rounded half-up to the cent. */
    public static BigDecimal interestFor(BigDecimal balance, BigDecimal monthlyRate) {
        return balance.multiply(monthlyRate, PRECISION).setScale(2, RoundingMode.HALF_UP);
    }

    static BigDecimal ceilCents(BigDecimal value) {
        return value.setScale(SETTLE_SCALE, RoundingMode.HALF_UP).setScale(2, RoundingMode.CEILING);
    }
}
