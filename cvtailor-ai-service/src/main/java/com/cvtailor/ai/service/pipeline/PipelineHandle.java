package com.cvtailor.ai.service.pipeline;

import com.cvtailor.common.entity.GenerationResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Handle for a submitted invocation.
 */
public class PipelineHandle {

    private final String requestId;
    private final CompletableFuture<GenerationResult> result;
    private final Future<?> task;
    private final Supplier<GenerationResult> cancelledBeforeStart;

    PipelineHandle(String requestId, CompletableFuture<GenerationResult> result, Future<?> task,
            Supplier<GenerationResult> cancelledBeforeStart) {
        this.requestId = requestId;
        this.result = result;
        this.task = task;
        this.cancelledBeforeStart = cancelledBeforeStart;
    }

    public String getRequestId() {
        return requestId;
    }

    /**
     * Completes with the terminal result, including FAILED/CANCELLED after
     * {@link #cancel()}.
     */
    public CompletableFuture<GenerationResult> result() {
        return result;
    }

    /**
     * Interrupts the invocation. Provider calls already dispatched finish in the
     * background and their cost is still reconciled.
     *
     * @return false when the invocation had already finished
     */
    public boolean cancel() {
        if (result.isDone()) {
            return false;
        }
        boolean cancelled = task.cancel(true);
        if (cancelled && !result.isDone()) {
            GenerationResult notStarted = cancelledBeforeStart.get();
            if (notStarted != null) {
                result.complete(notStarted);
            }
        }
        return cancelled;
    }

    public boolean isDone() {
        return result.isDone();
    }
}
