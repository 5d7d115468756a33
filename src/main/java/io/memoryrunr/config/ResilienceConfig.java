package io.memoryrunr.config;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.memoryrunr.support.CollaboratorGuard;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Programmatic Resilience4j wiring for the external collaborators. Each collaborator gets its own
 * circuit breaker so an unavailable embedding model never trips enrichment, and vice versa.
 */
@Configuration
public class ResilienceConfig {

    public static final String ENRICHMENT = "enrichment";
    public static final String EMBEDDING = "embedding";

    @Bean(destroyMethod = "shutdown")
    public ExecutorService collaboratorExecutor() {
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "collaborator-call");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public CollaboratorGuard enrichmentGuard(PipelineProperties properties, ExecutorService collaboratorExecutor) {
        return guard(ENRICHMENT, properties.collaborators(), collaboratorExecutor);
    }

    @Bean
    public CollaboratorGuard embeddingGuard(PipelineProperties properties, ExecutorService collaboratorExecutor) {
        return guard(EMBEDDING, properties.collaborators(), collaboratorExecutor);
    }

    /**
     * Timeout per attempt, {@code maxRetries} retries with exponential backoff, and a breaker that opens
     * after half of the last ten calls failed.
     */
    public static CollaboratorGuard guard(String name, PipelineProperties.Collaborators collaborators,
                                          ExecutorService executor) {
        CircuitBreaker circuitBreaker = CircuitBreaker.of(name, CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .failureRateThreshold(50)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .build());

        Retry retry = Retry.of(name, RetryConfig.custom()
                .maxAttempts(collaborators.maxRetries() + 1)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(collaborators.backoffMillis(), 2.0))
                .ignoreExceptions(CallNotPermittedException.class)
                .build());

        TimeLimiter timeLimiter = TimeLimiter.of(name, TimeLimiterConfig.custom()
                .timeoutDuration(collaborators.timeout())
                .cancelRunningFuture(true)
                .build());

        return new CollaboratorGuard(name, circuitBreaker, retry, timeLimiter, executor);
    }
}
