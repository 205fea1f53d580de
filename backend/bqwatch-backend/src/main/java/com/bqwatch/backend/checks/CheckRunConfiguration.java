package com.bqwatch.backend.checks;

import com.bqwatch.backend.logging.CheckLogger;
import com.bqwatch.backend.notification.NotificationGateway;
import com.bqwatch.backend.notification.NotificationProperties;
import com.bqwatch.backend.notification.Notifier;
import com.bqwatch.backend.query.QueryRunner;
import com.bqwatch.backend.report.ResultFormatter;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
@EnableConfigurationProperties(CheckDefinitionProperties.class)
public class CheckRunConfiguration {

    @Bean
    public CheckDefinitionSource checkDefinitionSource(CheckDefinitionProperties properties) {
        if (StringUtils.hasText(properties.getFile())) {
            return new CsvCheckDefinitionSource(properties.getFile().trim(), properties.getRecipientDelimiter());
        }
        return new PropertiesCheckDefinitionSource(properties);
    }

    @Bean
    public ResultFormatter resultFormatter() {
        return new ResultFormatter();
    }

    @Bean
    public Notifier notifier(
            NotificationGateway gateway, NotificationProperties properties, CheckDefinitionSource source) {
        return new Notifier(gateway, properties, source.describe());
    }

    @Bean
    @ConditionalOnProperty(prefix = "bqwatch.bigquery", name = "enabled", havingValue = "true")
    public CheckOrchestrator checkOrchestrator(
            CheckDefinitionSource source,
            QueryRunner queryRunner,
            ResultFormatter formatter,
            Notifier notifier,
            CheckLogger checkLogger,
            CheckDefinitionProperties properties) {
        return new CheckOrchestrator(
                source, queryRunner, formatter, notifier, checkLogger, properties, Clock.systemUTC());
    }
}
