package com.cvtailor.ai.service.pipeline;

import com.cvtailor.ai.service.selection.ModelProfile;
import com.cvtailor.ai.service.strategy.TokenUsage;
import com.cvtailor.common.exception.ProviderFailureType;

import java.util.function.Function;

/**
 * One provider request, prepared independently of the model it will run on.
 *
 * @param <T> payload returned on success
 */
public interface ProviderCall<T> {

    /**
     * Planned size, used for cost estimation and budget admission.
     */
    TokenUsage plannedUsage();

    /**
     * Runs the call against {@code model}. Must not throw for provider-side
     * failures.
     */
    Outcome<T> execute(ModelProfile model);

    /**
     * Post-processes a successful payload. A parser that throws
     * {@link IllegalArgumentException} turns the outcome into a
     * MALFORMED_RESPONSE failure, which counts against the model's breaker.
     */
    default <R> ProviderCall<R> thenParse(Function<T, R> parser) {
        ProviderCall<T> source = this;
        return new ProviderCall<>() {
            @Override
            public TokenUsage plannedUsage() {
                return source.plannedUsage();
            }

            @Override
            public Outcome<R> execute(ModelProfile model) {
                Outcome<T> raw = source.execute(model);
                if (!raw.isSuccessful()) {
                    return new Outcome<>(null, raw.usage(), raw.failureType(), raw.errorMessage());
                }
                try {
                    return Outcome.success(parser.apply(raw.value()), raw.usage());
                } catch (IllegalArgumentException e) {
                    return new Outcome<>(null, raw.usage(), ProviderFailureType.MALFORMED_RESPONSE,
                            "Unusable response from " + model.name() + ": " + e.getMessage());
                }
            }
        };
    }

    record Outcome<T>(T value, TokenUsage usage, ProviderFailureType failureType, String errorMessage) {

        public static <T> Outcome<T> success(T value, TokenUsage usage) {
            return new Outcome<>(value, usage, null, null);
        }

        public static <T> Outcome<T> failed(ProviderFailureType failureType, String errorMessage) {
            return new Outcome<>(null, TokenUsage.NONE, failureType, errorMessage);
        }

        public boolean isSuccessful() {
            return failureType == null;
        }
    }
}
