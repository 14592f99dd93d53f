package com.cvtailor.common.exception;

/**
 * Distinguishable provider-side failure causes. Every type counts as a circuit
 * breaker failure for the model that produced it.
 */
public enum ProviderFailureType {
    TRANSPORT,
    TIMEOUT,
    MALFORMED_RESPONSE,
    RATE_LIMITED
}
