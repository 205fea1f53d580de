package com.bqwatch.backend.notification;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;

@JsonInclude(Include.NON_NULL)
public record NotificationOutcome(NotificationStatus status, String subject, List<String> recipients) {

    public static NotificationOutcome sent(String subject, List<String> recipients) {
        return new NotificationOutcome(NotificationStatus.SENT, subject, List.copyOf(recipients));
    }

    public static NotificationOutcome skipped(NotificationStatus reason, String subject) {
        return new NotificationOutcome(reason, subject, List.of());
    }

    public static NotificationOutcome failed() {
        return new NotificationOutcome(NotificationStatus.FAILED, null, List.of());
    }

    @JsonIgnore
    public boolean isSent() {
        return status == NotificationStatus.SENT;
    }
}
