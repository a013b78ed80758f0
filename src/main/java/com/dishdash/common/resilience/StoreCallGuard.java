package com.dishdash.common.resilience;

import com.dishdash.common.exception.BusinessException;
import com.dishdash.common.exception.ErrorCode;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs order store calls under the Resilience4j {@code orderStore} time limiter and
 * translates store failures into the lifecycle error codes.
 *
 * <ul>
 *   <li>timeout, interrupted call, transient or connection failure → UNAVAILABLE (retryable)</li>
 *   <li>store-call pool saturated → UNAVAILABLE (retryable)</li>
 *   <li>optimistic lock failure → CONFLICT</li>
 *   <li>BusinessException from the store → rethrown unchanged</li>
 * </ul>
 *
 * <p>A call that times out is cancelled with interruption, so the pool thread is
 * released as soon as the JDBC driver honours the interrupt or the query timeout.</p>
 */
@Slf4j
@Component
public class StoreCallGuard {

    public static final String TIME_LIMITER_NAME = "orderStore";

    private final TimeLimiter timeLimiter;
    private final Executor executor;

    @Autowired
    public StoreCallGuard(TimeLimiterRegistry timeLimiterRegistry,
                          @Qualifier("storeCallExecutor") Executor executor) {
        this(timeLimiterRegistry.timeLimiter(TIME_LIMITER_NAME), executor);
    }

    public StoreCallGuard(TimeLimiter timeLimiter, Executor executor) {
        this.timeLimiter = timeLimiter;
        this.executor = executor;
    }

    public <T> T call(String operation, Supplier<T> storeCall) {
        try {
            return timeLimiter.executeFutureSupplier(() -> {
                FutureTask<T> task = new FutureTask<>(storeCall::get);
                executor.execute(task);
                return task;
            });
        } catch (TimeoutException e) {
            log.warn("Order store call timed out: operation={}, limit={}",
                    operation, timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            throw new BusinessException(ErrorCode.UNAVAILABLE,
                    "Order store did not answer in time (" + operation + ")", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.UNAVAILABLE,
                    "Interrupted while waiting for the order store (" + operation + ")", e);
        } catch (Exception e) {
            throw translate(operation, unwrap(e));
        }
    }

    public void run(String operation, Runnable storeCall) {
        call(operation, () -> {
            storeCall.run();
            return null;
        });
    }

    private RuntimeException translate(String operation, Throwable failure) {
        if (failure instanceof BusinessException businessException) {
            return businessException;
        }
        if (failure instanceof RejectedExecutionException) {
            log.warn("Order store call rejected, pool saturated: operation={}", operation);
            return new BusinessException(ErrorCode.UNAVAILABLE,
                    "Order store is overloaded (" + operation + ")", failure);
        }
        if (failure instanceof OptimisticLockingFailureException) {
            return new BusinessException(ErrorCode.CONFLICT, "Order was updated concurrently", failure);
        }
        if (failure instanceof TransientDataAccessException
                || failure instanceof DataAccessResourceFailureException
                || failure instanceof RecoverableDataAccessException) {
            log.warn("Order store unavailable: operation={}, cause={}", operation, failure.getMessage());
            return new BusinessException(ErrorCode.UNAVAILABLE,
                    "Order store temporarily unavailable (" + operation + ")", failure);
        }
        log.error("Order store call failed: operation={}", operation, failure);
        if (failure instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new BusinessException(ErrorCode.INTERNAL_ERROR, failure.getMessage(), failure);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
