package com.bqwatch.backend.logging;

public class CheckLogException extends RuntimeException {

    public CheckLogException(String message) {
        super(message);
    }

    public CheckLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
