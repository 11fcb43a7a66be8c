package uk.gegc.gatekeeper.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Type-safe configuration for the access-control engine.
 */
@Component
@Data
@Validated
@ConfigurationProperties(prefix = "gatekeeper")
public class GatekeeperProperties {

    @Valid
    private Snapshot snapshot = new Snapshot();

    @Valid
    private Policy policy = new Policy();

    @Data
    public static class Snapshot {

        /**
         * Upper bound on one assignment store read. A read that takes longer is
         * treated as a denial.
         */
        @NotNull(message = "Property gatekeeper.snapshot.timeout must be configured")
        private Duration timeout = Duration.ofSeconds(2);

        /**
         * How long a built snapshot may be reused. Zero disables caching.
         */
        @NotNull
        private Duration cacheTtl = Duration.ZERO;

        @Min(1)
        private int cacheMaxEntries = 10_000;

        @Valid
        private Executor executor = new Executor();
    }

    @Data
    public static class Executor {

        @Min(1)
        private int corePoolSize = 4;

        @Min(1)
        private int maxPoolSize = 16;

        @Min(0)
        private int queueCapacity = 200;

        @Min(1)
        private int keepAliveSeconds = 60;
    }

    @Data
    public static class Policy {

        /**
         * Reconcile the database catalog against the policy manifest at startup.
         */
        private boolean reconcileOnStartup = false;

        private String manifestPath = "policy/access-policy-manifest.json";
    }
}
