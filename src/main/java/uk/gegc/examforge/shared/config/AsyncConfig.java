package uk.gegc.examforge.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor for calls that leave the process: LLM generation, insight generation and PDF rendering.
 *
 * <p>The pool is bounded and rejects work once the queue is full, so a slow provider cannot pile up
 * unbounded requests. Callers wait on the returned future with a timeout (see
 * {@link uk.gegc.examforge.shared.concurrency.ExternalCallRunner}).
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${async.external.core-pool-size:4}")
    private int corePoolSize;

    @Value("${async.external.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${async.external.queue-capacity:50}")
    private int queueCapacity;

    @Value("${async.external.keep-alive-seconds:60}")
    private int keepAliveSeconds;

    @Bean(name = "externalCallExecutor")
    public ThreadPoolTaskExecutor externalCallExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setKeepAliveSeconds(keepAliveSeconds);
        executor.setThreadNamePrefix("external-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("External call executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                corePoolSize, maxPoolSize, queueCapacity, keepAliveSeconds);

        return executor;
    }
}
