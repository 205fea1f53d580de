package com.bqwatch.backend.notification;

/**
 * Outbound message transport. The gateway owns the daily send quota; callers only read it.
 */
public interface NotificationGateway {

    int remainingDailyQuota();

    void send(OutboundMessage message);
}
