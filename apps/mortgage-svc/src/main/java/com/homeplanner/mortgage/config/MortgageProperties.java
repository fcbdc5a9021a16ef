package com.homeplanner.mortgage.config;

import com.homeplanner.mortgage.engine.PmiPolicy;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "mortgage")
public record MortgageProperties(
        Pmi pmi,
        Engine engine
) {

    @ConstructorBinding
    public MortgageProperties {
        // both sections are optional; missing ones fall back to the conventional defaults
        if (pmi == null) {
            pmi = new Pmi(null, null, null);
        }
        if (engine == null) {
            engine = new Engine(null);
        }
    }

    public static MortgageProperties defaults() {
        return new MortgageProperties(null, null);
    }

    public record Pmi(BigDecimal ltvThreshold, PmiPolicy.LtvBasis ltvBasis, Integer removalLagMonths) {
        public Pmi {
            if (ltvThreshold == null) {
                ltvThreshold = PmiPolicy.DEFAULT_LTV_THRESHOLD;
            }
            if (ltvBasis == null) {
                ltvBasis = PmiPolicy.LtvBasis.POST_PAYMENT;
            }
            if (removalLagMonths == null) {
                removalLagMonths = PmiPolicy.DEFAULT_REMOVAL_LAG_MONTHS;
            }
        }

        /**
         * Builds the policy; {@link PmiPolicy} rejects out-of-range values.
         */
        public PmiPolicy toPolicy() {
            return new PmiPolicy(ltvThreshold, ltvBasis, removalLagMonths);
        }
    }

    public record Engine(Integer maxMonths) {
        public static final int DEFAULT_MAX_MONTHS = 1200;

        public Engine {
            if (maxMonths == null) {
                maxMonths = DEFAULT_MAX_MONTHS;
            }
            if (maxMonths <= 0) {
                throw new IllegalArgumentException("maxMonths must be positive");
            }
        }
    }
}
