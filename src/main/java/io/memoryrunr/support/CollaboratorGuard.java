package io.memoryrunr.support;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.memoryrunr.error.TransientIoException;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Wraps calls to an external collaborator with a timeout, bounded exponential-backoff retries and a
 * circuit breaker. Fully programmatic, no AOP proxies.
 *
 * <pre>
 * retry
 *   └─ circuit breaker
 *        └─ time limiter
 *             └─ call (on the collaborator executor)
 * </pre>
 *
 * Any failure that survives the retries, including an open circuit, surfaces as
 * {@link TransientIoException} so callers can apply their documented fallback.
 */
public class CollaboratorGuard {

    private final String name;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final ExecutorService executor;

    public CollaboratorGuard(String name, CircuitBreaker circuitBreaker, Retry retry,
                             TimeLimiter timeLimiter, ExecutorService executor) {
        this.name = name;
        this.circuitBreaker = circuitBreaker;
        this.retry = retry;
        this.timeLimiter = timeLimiter;
        this.executor = executor;
    }

    public <T> T call(Supplier<T> call) {
        Callable<T> limited = () -> timeLimiter.executeFutureSupplier(
                () -> CompletableFuture.supplyAsync(call, executor));
        Callable<T> guarded = Retry.decorateCallable(retry, CircuitBreaker.decorateCallable(circuitBreaker, limited));
        try {
            return guarded.call();
        } catch (CallNotPermittedException e) {
            throw new TransientIoException("Circuit for " + name + " is open", e);
        } catch (TimeoutException e) {
            throw new TransientIoException(name + " timed out after " + timeLimiter.getTimeLimiterConfig().getTimeoutDuration(), e);
        } catch (TransientIoException e) {
            throw e;
        } catch (Exception e) {
            throw new TransientIoException(name + " call failed: " + e.getMessage(), e);
        }
    }

    public CircuitBreaker.State circuitState() {
        return circuitBreaker.getState();
    }

    public String name() {
        return name;
    }
}
