package com.homeplanner.mortgage.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final MortgageProperties props;

    public StartupDiagnostics(MortgageProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        var pmi = props.pmi();
        log.info("PMI policy: ltvThreshold={}, ltvBasis={}, removalLagMonths={} (env MORTGAGE_PMI_*)",
                pmi.ltvThreshold(), pmi.ltvBasis(), pmi.removalLagMonths());
        log.info("Engine config: maxMonths={}", props.engine().maxMonths());
    }
}
