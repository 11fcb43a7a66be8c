package uk.gegc.gatekeeper.shared.security;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Counts guard decisions by outcome under {@code gatekeeper.guard.decisions}.
 */
@Component
public class AccessDecisionMetrics {

    static final String METRIC_NAME = "gatekeeper.guard.decisions";

    private final Counter grantedCounter;
    private final Counter deniedCounter;
    private final Counter unavailableCounter;

    public AccessDecisionMetrics(MeterRegistry meterRegistry) {
        this.grantedCounter = Counter.builder(METRIC_NAME)
                .description("Guard decisions that granted access")
                .tag("outcome", "granted")
                .register(meterRegistry);
        this.deniedCounter = Counter.builder(METRIC_NAME)
                .description("Guard decisions that denied access")
                .tag("outcome", "denied")
                .register(meterRegistry);
        this.unavailableCounter = Counter.builder(METRIC_NAME)
                .description("Guard decisions denied because the assignment store was unavailable")
                .tag("outcome", "unavailable")
                .register(meterRegistry);
    }

    public void record(AccessDecision decision) {
        switch (decision.outcome()) {
            case GRANTED -> grantedCounter.increment();
            case DENIED -> deniedCounter.increment();
            case SNAPSHOT_UNAVAILABLE -> unavailableCounter.increment();
        }
    }
}
