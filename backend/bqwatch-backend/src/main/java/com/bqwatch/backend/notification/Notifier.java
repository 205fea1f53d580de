package com.bqwatch.backend.notification;

import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends alert reports. An exhausted daily quota or a missing recipient list yields a skipped outcome,
 * never an exception; transport failures propagate as {@link NotificationException}.
 */
public class Notifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(Notifier.class);

    private final NotificationGateway gateway;
    private final NotificationProperties properties;
    private final String sourceDescription;

    public Notifier(NotificationGateway gateway, NotificationProperties properties, String sourceDescription) {
        this.gateway = gateway;
        this.properties = properties;
        this.sourceDescription = sourceDescription;
    }

    public NotificationOutcome notify(String title, String body, List<String> recipients) {
        String subject = properties.getSubjectPrefix() + title;
        if (gateway.remainingDailyQuota() <= 0) {
            LOGGER.warn("Daily notification quota exhausted, skipping '{}'", subject);
            return NotificationOutcome.skipped(NotificationStatus.SKIPPED_QUOTA_EXHAUSTED, subject);
        }
        List<String> to = resolveRecipients(recipients);
        if (to.isEmpty()) {
            LOGGER.warn("No recipients configured for '{}', skipping", subject);
            return NotificationOutcome.skipped(NotificationStatus.SKIPPED_NO_RECIPIENTS, subject);
        }
        gateway.send(new OutboundMessage(to, subject, body + "\n\n" + trailer()));
        LOGGER.info("Sent '{}' to {}", subject, to);
        return NotificationOutcome.sent(subject, to);
    }

    String trailer() {
        return "Sent by bqwatch from check configuration: " + sourceDescription;
    }

    private List<String> resolveRecipients(List<String> recipients) {
        if (recipients != null && !recipients.isEmpty()) {
            return recipients;
        }
        return properties.getDefaultRecipients().stream()
                .filter(address -> address != null && !address.isBlank())
                .map(String::trim)
                .collect(Collectors.toList());
    }
}
