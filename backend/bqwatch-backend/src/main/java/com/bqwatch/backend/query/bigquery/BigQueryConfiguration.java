package com.bqwatch.backend.query.bigquery;

import com.bqwatch.backend.query.QueryExecutionService;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(BigQueryProperties.class)
public class BigQueryConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "bqwatch.bigquery", name = "enabled", havingValue = "true")
    public BigQuery bigQuery(BigQueryProperties properties) {
        BigQueryOptions.Builder builder = BigQueryOptions.newBuilder();
        if (properties.getProjectId() != null && !properties.getProjectId().isBlank()) {
            builder.setProjectId(properties.getProjectId());
        }
        if (properties.getLocation() != null && !properties.getLocation().isBlank()) {
            builder.setLocation(properties.getLocation());
        }
        new BigQueryCredentialsResolver(properties).resolve().ifPresent(builder::setCredentials);
        return builder.build().getService();
    }

    @Bean
    @ConditionalOnProperty(prefix = "bqwatch.bigquery", name = "enabled", havingValue = "true")
    public QueryExecutionService queryExecutionService(BigQuery bigQuery, BigQueryProperties properties) {
        return new BigQueryQueryExecutionService(bigQuery, properties);
    }
}
