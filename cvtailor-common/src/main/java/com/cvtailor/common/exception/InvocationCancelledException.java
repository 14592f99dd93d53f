package com.cvtailor.common.exception;

/**
 * The invocation was cancelled from outside (superseded or timed out by the
 * caller) before it finished.
 */
public class InvocationCancelledException extends OrchestrationException {

    public InvocationCancelledException(String message) {
        super(ErrorKind.CANCELLED, message);
    }
}
