package com.bqwatch.backend.notification;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

@Configuration
@EnableConfigurationProperties(NotificationProperties.class)
public class NotificationConfiguration {

    @Bean
    public NotificationGateway notificationGateway(JavaMailSender mailSender, NotificationProperties properties) {
        return new SmtpNotificationGateway(mailSender, properties, Clock.systemDefaultZone());
    }
}
