package com.cvtailor.ai.service;

import com.cvtailor.common.exception.ProviderFailureType;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.util.concurrent.TimeoutException;

/**
 * Maps WebClient failures onto the provider failure taxonomy.
 */
final class ProviderErrors {

    private ProviderErrors() {
    }

    static ProviderFailureType classify(Throwable error) {
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof TimeoutException) {
            return ProviderFailureType.TIMEOUT;
        }
        if (cause instanceof WebClientResponseException response
                && response.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return ProviderFailureType.RATE_LIMITED;
        }
        return ProviderFailureType.TRANSPORT;
    }

    static String describe(Throwable error) {
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof WebClientResponseException response) {
            return "HTTP " + response.getStatusCode().value() + " from provider";
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    static int intValue(Object value) {
        return value instanceof Number number ? number.intValue() : 0;
    }
}
