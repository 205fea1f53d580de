package com.bqwatch.backend.checks;

public enum CheckStatus {
    EMPTY,
    ALERTED,
    FAILED
}
