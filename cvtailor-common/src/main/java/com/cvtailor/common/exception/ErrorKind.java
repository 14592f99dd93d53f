package com.cvtailor.common.exception;

/**
 * Failure taxonomy surfaced on a failed {@link com.cvtailor.common.entity.GenerationResult}.
 */
public enum ErrorKind {

    PROVIDER_UNAVAILABLE, // Every eligible model is circuit-open, or none supports the task
    BUDGET_EXCEEDED, // Ledger refused the planned spend
    PROVIDER_CALL_FAILED, // Timeout / error / malformed payload from a single call
    INVALID_INPUT, // Empty or malformed source content
    INTERNAL_CACHE_INCONSISTENCY, // Cache entry present but unusable; callers treat it as a miss
    CANCELLED // Invocation cancelled externally before it finished
}
