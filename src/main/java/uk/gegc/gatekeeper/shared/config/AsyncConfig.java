package uk.gegc.gatekeeper.shared.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for assignment store reads.
 *
 * <p>Reads run off the calling thread so they can be abandoned after
 * {@code gatekeeper.snapshot.timeout}. A saturated pool rejects the read
 * instead of running it on the caller, which would bypass the timeout; the
 * rejection surfaces as an unavailable snapshot.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AsyncConfig {

    private final GatekeeperProperties properties;

    @Bean(name = "snapshotExecutor")
    public Executor snapshotExecutor() {
        GatekeeperProperties.Executor pool = properties.getSnapshot().getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(pool.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(pool.getMaxPoolSize(), pool.getCorePoolSize()));
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setKeepAliveSeconds(pool.getKeepAliveSeconds());
        executor.setThreadNamePrefix("snapshot-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);

        executor.initialize();

        log.info("Snapshot executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                pool.getCorePoolSize(), pool.getMaxPoolSize(), pool.getQueueCapacity(), pool.getKeepAliveSeconds());

        return executor;
    }
}
