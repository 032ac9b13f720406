package com.vidnyan.cpg.application.service;

import com.vidnyan.cpg.domain.common.AnalysisError;
import com.vidnyan.cpg.domain.common.ErrorCode;
import com.vidnyan.cpg.domain.common.Result;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs synchronous query and pattern work under a hard deadline.
 * Work still running at the deadline is interrupted and reported as {@link ErrorCode#TIMEOUT}.
 * Uses its own pool so timed calls never queue behind batch analysis.
 */
@Slf4j
@Component
public class DeadlineExecutor {

    private final ExecutorService executor = newPool();

    public <T> Result<T> call(String task, long timeoutMs, Callable<Result<T>> work) {
        Future<Result<T>> future = executor.submit(work);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} exceeded {}ms and was cancelled", task, timeoutMs);
            return Result.failure(ErrorCode.TIMEOUT, task + " exceeded " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("{} failed", task, cause);
            return Result.failure(AnalysisError.wrap(ErrorCode.INTERNAL_ERROR, cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Result.failure(ErrorCode.TIMEOUT, task + " was interrupted");
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private static ExecutorService newPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "cpg-deadline-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
