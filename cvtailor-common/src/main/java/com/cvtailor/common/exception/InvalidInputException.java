package com.cvtailor.common.exception;

public class InvalidInputException extends OrchestrationException {

    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_INPUT, message);
    }
}
