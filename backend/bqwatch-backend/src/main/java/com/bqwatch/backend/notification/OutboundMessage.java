package com.bqwatch.backend.notification;

import java.util.List;

public record OutboundMessage(List<String> to, String subject, String body) {

    public OutboundMessage {
        to = List.copyOf(to);
    }
}
