package com.bqwatch.backend.notification;

public enum NotificationStatus {
    SENT,
    SKIPPED_QUOTA_EXHAUSTED,
    SKIPPED_NO_RECIPIENTS,
    FAILED
}
