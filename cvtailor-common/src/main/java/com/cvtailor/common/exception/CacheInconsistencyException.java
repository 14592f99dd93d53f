package com.cvtailor.common.exception;

/**
 * A cache entry exists but cannot be used (wrong dimensionality, missing
 * vector). Never terminal: the cache reports it and the caller recomputes.
 */
public class CacheInconsistencyException extends OrchestrationException {

    private final String fingerprint;

    public CacheInconsistencyException(String fingerprint, String message) {
        super(ErrorKind.INTERNAL_CACHE_INCONSISTENCY, message);
        this.fingerprint = fingerprint;
    }

    public String getFingerprint() {
        return fingerprint;
    }
}
