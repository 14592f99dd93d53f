package com.cvtailor.common.exception;

/**
 * A single provider call failed. Recorded against the model's circuit breaker
 * before it is thrown.
 */
public class ProviderCallFailedException extends OrchestrationException {

    private final String model;
    private final ProviderFailureType failureType;

    public ProviderCallFailedException(String model, ProviderFailureType failureType, String message) {
        super(ErrorKind.PROVIDER_CALL_FAILED, message);
        this.model = model;
        this.failureType = failureType;
    }

    public ProviderCallFailedException(String model, ProviderFailureType failureType, String message,
            Throwable cause) {
        super(ErrorKind.PROVIDER_CALL_FAILED, message, cause);
        this.model = model;
        this.failureType = failureType;
    }

    public String getModel() {
        return model;
    }

    public ProviderFailureType getFailureType() {
        return failureType;
    }
}
