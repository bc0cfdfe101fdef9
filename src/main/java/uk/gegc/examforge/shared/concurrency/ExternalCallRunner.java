package uk.gegc.examforge.shared.concurrency;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;

/**
 * Runs a call to an external collaborator on the bounded external executor and waits for it with a
 * timeout. On timeout the task is cancelled (interrupting it) and the failure is translated by the
 * supplied factory, so no caller ever sees a raw {@link TimeoutException}.
 */
@Slf4j
@Component
public class ExternalCallRunner {

    private final AsyncTaskExecutor executor;

    public ExternalCallRunner(@Qualifier("externalCallExecutor") AsyncTaskExecutor executor) {
        this.executor = executor;
    }

    /**
     * @param description    short label used in logs and error messages
     * @param failureFactory builds the domain exception from a message and cause; exceptions of
     *                       type {@code E} thrown by the call itself are rethrown unchanged
     */
    public <T, E extends RuntimeException> T call(String description,
                                                  Duration timeout,
                                                  Class<E> passThrough,
                                                  BiFunction<String, Throwable, E> failureFactory,
                                                  Callable<T> call) {
        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (TaskRejectedException e) {
            log.error("External call '{}' rejected: executor saturated", description);
            throw failureFactory.apply(description + " rejected: too many concurrent requests", e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("External call '{}' timed out after {}", description, timeout);
            throw failureFactory.apply(description + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw failureFactory.apply(description + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (passThrough.isInstance(cause)) {
                throw passThrough.cast(cause);
            }
            log.error("External call '{}' failed: {}", description, cause.getMessage(), cause);
            throw failureFactory.apply(description + " failed: " + cause.getMessage(), cause);
        }
    }
}
