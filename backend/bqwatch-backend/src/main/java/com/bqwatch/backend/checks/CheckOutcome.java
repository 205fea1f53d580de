package com.bqwatch.backend.checks;

import com.bqwatch.backend.notification.NotificationOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;

@JsonInclude(Include.NON_NULL)
public record CheckOutcome(
        int row,
        String title,
        CheckStatus status,
        int rowCount,
        NotificationOutcome notification,
        String logMessage,
        String error) {

    static CheckOutcome empty(CheckDefinition definition, String logMessage) {
        return new CheckOutcome(definition.row(), definition.title(), CheckStatus.EMPTY, 0, null, logMessage, null);
    }

    static CheckOutcome alerted(
            CheckDefinition definition, int rowCount, NotificationOutcome notification, String logMessage) {
        return new CheckOutcome(
                definition.row(), definition.title(), CheckStatus.ALERTED, rowCount, notification, logMessage, null);
    }

    static CheckOutcome failed(CheckDefinition definition, String logMessage, String error) {
        return new CheckOutcome(definition.row(), definition.title(), CheckStatus.FAILED, 0, null, logMessage, error);
    }
}
