package com.bqwatch.backend.checks;

public class CheckDefinitionException extends RuntimeException {

    public CheckDefinitionException(String message) {
        super(message);
    }

    public CheckDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
