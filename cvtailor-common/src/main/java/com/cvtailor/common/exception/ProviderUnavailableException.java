package com.cvtailor.common.exception;

public class ProviderUnavailableException extends OrchestrationException {

    public ProviderUnavailableException(String message) {
        super(ErrorKind.PROVIDER_UNAVAILABLE, message);
    }
}
