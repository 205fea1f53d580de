package com.bqwatch.backend.query.bigquery;

import com.google.auth.oauth2.GoogleCredentials;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.util.StringUtils;

/**
 * Builds the BigQuery client credentials from {@code bqwatch.bigquery.credentials-base64} or
 * {@code bqwatch.bigquery.credentials-location}, scoped to BigQuery. An empty result leaves the client on
 * Application Default Credentials.
 */
public class BigQueryCredentialsResolver {

    static final String BIGQUERY_SCOPE = "https://www.googleapis.com/auth/bigquery";

    private static final String CLASSPATH_PREFIX = "classpath:";
    private static final Logger LOGGER = LoggerFactory.getLogger(BigQueryCredentialsResolver.class);

    private final BigQueryProperties properties;

    public BigQueryCredentialsResolver(BigQueryProperties properties) {
        this.properties = properties;
    }

    public Optional<GoogleCredentials> resolve() {
        if (StringUtils.hasText(properties.getCredentialsBase64())) {
            LOGGER.info("Using BigQuery service account from bqwatch.bigquery.credentials-base64");
            return Optional.of(scoped(fromBase64(properties.getCredentialsBase64())));
        }
        if (StringUtils.hasText(properties.getCredentialsLocation())) {
            String location = properties.getCredentialsLocation().trim();
            LOGGER.info("Using BigQuery service account from {}", location);
            return Optional.of(scoped(fromLocation(location)));
        }
        LOGGER.info("No BigQuery service account configured, using Application Default Credentials");
        return Optional.empty();
    }

    private GoogleCredentials fromBase64(String encoded) {
        byte[] json;
        try {
            json = Base64.getDecoder().decode(encoded.replaceAll("\\s+", ""));
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("bqwatch.bigquery.credentials-base64 is not valid Base64", ex);
        }
        return read(new ByteArrayInputStream(json), "bqwatch.bigquery.credentials-base64");
    }

    private GoogleCredentials fromLocation(String location) {
        Resource resource = location.startsWith(CLASSPATH_PREFIX)
                ? new ClassPathResource(location.substring(CLASSPATH_PREFIX.length()))
                : new FileSystemResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("BigQuery credentials " + location + " not found");
        }
        try {
            return read(resource.getInputStream(), location);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to open BigQuery credentials " + location, ex);
        }
    }

    private GoogleCredentials read(InputStream stream, String origin) {
        try (InputStream inputStream = stream) {
            return GoogleCredentials.fromStream(inputStream);
        } catch (IOException ex) {
            throw new IllegalStateException("Invalid service account JSON in " + origin, ex);
        }
    }

    private GoogleCredentials scoped(GoogleCredentials credentials) {
        return credentials.createScoped(List.of(BIGQUERY_SCOPE));
    }
}
