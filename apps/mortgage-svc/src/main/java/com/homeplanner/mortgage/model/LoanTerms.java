package com.homeplanner.mortgage.model;

import com.homeplanner.mortgage.exception.InvalidLoanException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.Optional;

/**
 * Fixed-rate loan description. Every instance has passed validation; monetary amounts are held at cent scale.
 */
public record LoanTerms(
        BigDecimal principal,
        BigDecimal annualRatePercent,
        int termMonths,
        YearMonth startMonth,
        Optional<BigDecimal> homeValue,
        BigDecimal monthlyTax,
        BigDecimal monthlyInsurance,
        BigDecimal monthlyHoa,
        BigDecimal monthlyPmi,
        Optional<BigDecimal> monthlyPaymentOverride
) {

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);

    public LoanTerms {
        if (principal == null) {
            throw new InvalidLoanException("principal must be provided");
        }
        principal = principal.setScale(2, RoundingMode.HALF_UP);
        if (principal.signum() <= 0) {
            throw new InvalidLoanException("principal must be positive");
        }
        if (annualRatePercent == null) {
            throw new InvalidLoanException("annualRatePercent must be provided");
        }
        if (annualRatePercent.signum() < 0) {
            throw new InvalidLoanException("annualRatePercent must not be negative");
        }
        if (termMonths <= 0) {
            throw new InvalidLoanException("termMonths must be positive");
        }
        if (startMonth == null) {
            throw new InvalidLoanException("startMonth must be provided");
        }
        homeValue = homeValue == null ? Optional.empty() : homeValue.map(LoanTerms::cents);
        if (homeValue.isPresent() && homeValue.get().signum() <= 0) {
            throw new InvalidLoanException("homeValue must be positive when provided");
        }
        monthlyTax = nonNegative(monthlyTax, "monthlyTax");
        monthlyInsurance = nonNegative(monthlyInsurance, "monthlyInsurance");
        monthlyHoa = nonNegative(monthlyHoa, "monthlyHoa");
        monthlyPmi = nonNegative(monthlyPmi, "monthlyPmi");
        monthlyPaymentOverride = monthlyPaymentOverride == null
                ? Optional.empty()
                : monthlyPaymentOverride.map(LoanTerms::cents);
        if (monthlyPaymentOverride.isPresent() && monthlyPaymentOverride.get().signum() <= 0) {
            throw new InvalidLoanException("monthlyPaymentOverride must be positive when provided");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasPmi() {
        return monthlyPmi.signum() > 0;
    }

    /**
     * PMI drop-off needs a home value at least as large as the principal. When this is false and PMI is
     * charged, PMI stays on for the life of the loan.
     */
    public boolean pmiRemovalEvaluable() {
        return homeValue.map(value -> value.compareTo(principal) >= 0).orElse(false);
    }

    /** Tax, insurance and HOA; PMI excluded. */
    public BigDecimal fixedEscrow() {
        return monthlyTax.add(monthlyInsurance).add(monthlyHoa);
    }

    private static BigDecimal nonNegative(BigDecimal value, String field) {
        if (value == null) {
            return ZERO;
        }
        if (value.signum() < 0) {
            throw new InvalidLoanException(field + " must not be negative");
        }
        return cents(value);
    }

    private static BigDecimal cents(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    public static final class Builder {
        private BigDecimal principal;
        private BigDecimal annualRatePercent;
        private int termMonths;
        private YearMonth startMonth;
        private BigDecimal homeValue;
        private BigDecimal monthlyTax;
        private BigDecimal monthlyInsurance;
        private BigDecimal monthlyHoa;
        private BigDecimal monthlyPmi;
        private BigDecimal monthlyPaymentOverride;

        public Builder principal(BigDecimal principal) {
            this.principal = principal;
            return this;
        }

        public Builder annualRatePercent(BigDecimal annualRatePercent) {
            this.annualRatePercent = annualRatePercent;
            return this;
        }

        public Builder termMonths(int termMonths) {
            this.termMonths = termMonths;
            return this;
        }

        public Builder startMonth(YearMonth startMonth) {
            this.startMonth = startMonth;
            return this;
        }

        public Builder homeValue(BigDecimal homeValue) {
            this.homeValue = homeValue;
            return this;
        }

        public Builder monthlyTax(BigDecimal monthlyTax) {
            this.monthlyTax = monthlyTax;
            return this;
        }

        public Builder monthlyInsurance(BigDecimal monthlyInsurance) {
            this.monthlyInsurance = monthlyInsurance;
            return this;
        }

        public Builder monthlyHoa(BigDecimal monthlyHoa) {
            this.monthlyHoa = monthlyHoa;
            return this;
        }

        public Builder monthlyPmi(BigDecimal monthlyPmi) {
            this.monthlyPmi = monthlyPmi;
            return this;
        }

        public Builder monthlyPaymentOverride(BigDecimal monthlyPaymentOverride) {
            this.monthlyPaymentOverride = monthlyPaymentOverride;
            return this;
        }

        public LoanTerms build() {
            return new LoanTerms(
                    principal,
                    annualRatePercent,
                    termMonths,
                    startMonth,
                    Optional.ofNullable(homeValue),
                    monthlyTax,
                    monthlyInsurance,
                    monthlyHoa,
                    monthlyPmi,
                    Optional.ofNullable(monthlyPaymentOverride)
            );
        }
    }
}
