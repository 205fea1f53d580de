package com.bqwatch.backend.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(QueryPollingProperties.class)
public class QueryRunnerConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryRunnerConfiguration.class);

    @Bean
    @ConditionalOnProperty(prefix = "bqwatch.bigquery", name = "enabled", havingValue = "true")
    public QueryRunner queryRunner(QueryExecutionService executionService, QueryPollingProperties properties) {
        if (properties.getMaxWait() == null) {
            LOGGER.warn(
                    "bqwatch.polling.max-wait is not set; a query job that never completes will block the check run");
        }
        return new QueryRunner(executionService, properties, BackoffWaiter.sleeping());
    }
}
