package com.cvtailor.ai.service.pipeline;

import com.cvtailor.ai.service.selection.ModelProfile;
import com.cvtailor.ai.service.strategy.TokenUsage;

/**
 * A completed, paid-for provider call.
 *
 * @param fallbackUsed true when the preferred model failed and an alternate
 *                     produced the value
 */
public record Invocation<T>(T value, ModelProfile model, TokenUsage usage, double costUsd, boolean fallbackUsed) {

    public static <T> Invocation<T> cached(T value, ModelProfile model) {
        return new Invocation<>(value, model, TokenUsage.NONE, 0.0, false);
    }

    Invocation<T> asFallback() {
        return new Invocation<>(value, model, usage, costUsd, true);
    }
}
