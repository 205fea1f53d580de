package com.bqwatch.backend.notification;

import java.time.Clock;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

public class SmtpNotificationGateway implements NotificationGateway {

    private static final Logger LOGGER = LoggerFactory.getLogger(SmtpNotificationGateway.class);

    private final JavaMailSender mailSender;
    private final NotificationProperties properties;
    private final Clock clock;

    private LocalDate quotaDay;
    private int sentToday;

    public SmtpNotificationGateway(JavaMailSender mailSender, NotificationProperties properties, Clock clock) {
        this.mailSender = mailSender;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public synchronized int remainingDailyQuota() {
        rollOver();
        return Math.max(properties.getDailyQuota() - sentToday, 0);
    }

    @Override
    public synchronized void send(OutboundMessage message) {
        SimpleMailMessage mail = new SimpleMailMessage();
        if (properties.getFrom() != null && !properties.getFrom().isBlank()) {
            mail.setFrom(properties.getFrom());
        }
        mail.setTo(message.to().toArray(new String[0]));
        mail.setSubject(message.subject());
        mail.setText(message.body());
        try {
            mailSender.send(mail);
        } catch (MailException ex) {
            throw new NotificationException("Failed to send '" + message.subject() + "'", ex);
        }
        rollOver();
        sentToday++;
        LOGGER.debug("Sent '{}' to {} ({} sent today)", message.subject(), message.to(), sentToday);
    }

    private void rollOver() {
        LocalDate today = LocalDate.now(clock);
        if (!today.equals(quotaDay)) {
            quotaDay = today;
            sentToday = 0;
        }
    }
}
