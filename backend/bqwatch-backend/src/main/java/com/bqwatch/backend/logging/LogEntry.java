package com.bqwatch.backend.logging;

import java.time.Instant;

public record LogEntry(Instant timestamp, String message) {}
