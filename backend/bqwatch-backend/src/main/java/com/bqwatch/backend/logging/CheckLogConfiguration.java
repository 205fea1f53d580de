package com.bqwatch.backend.logging;

import com.bqwatch.backend.query.bigquery.BigQueryProperties;
import com.google.cloud.bigquery.BigQuery;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CheckLogProperties.class)
public class CheckLogConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "bqwatch.log", name = "store", havingValue = "file", matchIfMissing = true)
    public CheckLogStore fileCheckLogStore(CheckLogProperties properties) {
        return new FileCheckLogStore(properties.getFilePath());
    }

    @Bean
    @ConditionalOnProperty(prefix = "bqwatch.log", name = "store", havingValue = "bigquery")
    public CheckLogStore bigQueryCheckLogStore(
            BigQuery bigQuery, BigQueryProperties bigQueryProperties, CheckLogProperties properties) {
        return new BigQueryCheckLogStore(bigQuery, bigQueryProperties.getProjectId(), properties);
    }

    @Bean
    public CheckLogger checkLogger(CheckLogStore store, CheckLogProperties properties) {
        return new CheckLogger(store, properties, Clock.systemUTC());
    }
}
