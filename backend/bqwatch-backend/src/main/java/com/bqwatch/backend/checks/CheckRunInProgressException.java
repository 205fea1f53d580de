package com.bqwatch.backend.checks;

public class CheckRunInProgressException extends RuntimeException {

    public CheckRunInProgressException(String message) {
        super(message);
    }
}
