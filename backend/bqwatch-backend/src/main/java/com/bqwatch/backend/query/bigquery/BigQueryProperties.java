package com.bqwatch.backend.query.bigquery;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bqwatch.bigquery")
public class BigQueryProperties {

    private boolean enabled;
    private String projectId;
    private String dataset;
    private String location;
    private long pageSize = 1000L;

    /**
     * Service account JSON file, a filesystem path or a {@code classpath:} resource.
     */
    private String credentialsLocation;

    /**
     * Base64 encoded service account JSON, for deployments that pass secrets as environment variables.
     */
    private String credentialsBase64;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getDataset() {
        return dataset;
    }

    public void setDataset(String dataset) {
        this.dataset = dataset;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public long getPageSize() {
        return pageSize;
    }

    public void setPageSize(long pageSize) {
        if (pageSize > 0) {
            this.pageSize = pageSize;
        }
    }

    public String getCredentialsLocation() {
        return credentialsLocation;
    }

    public void setCredentialsLocation(String credentialsLocation) {
        this.credentialsLocation = credentialsLocation;
    }

    public String getCredentialsBase64() {
        return credentialsBase64;
    }

    public void setCredentialsBase64(String credentialsBase64) {
        this.credentialsBase64 = credentialsBase64;
    }
}
