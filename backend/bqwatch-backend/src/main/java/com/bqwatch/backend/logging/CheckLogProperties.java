package com.bqwatch.backend.logging;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bqwatch.log")
public class CheckLogProperties {

    /**
     * Where check log entries go: {@code file} or {@code bigquery}.
     */
    private String store = "file";
    private String filePath = "logs/check-log.tsv";
    private String dataset = "monitoring";
    private String table = "check_log";
    private int defaultLines = 200;
    private int maxLines = 1000;

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        if (store != null && !store.isBlank()) {
            this.store = store;
        }
    }

    public String getFilePath() {
        return filePath;
    }

    public void setFilePath(String filePath) {
        if (filePath != null && !filePath.isBlank()) {
            this.filePath = filePath;
        }
    }

    public String getDataset() {
        return dataset;
    }

    public void setDataset(String dataset) {
        if (dataset != null && !dataset.isBlank()) {
            this.dataset = dataset;
        }
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        if (table != null && !table.isBlank()) {
            this.table = table;
        }
    }

    public int getDefaultLines() {
        return defaultLines;
    }

    public void setDefaultLines(int defaultLines) {
        if (defaultLines > 0) {
            this.defaultLines = defaultLines;
        }
    }

    public int getMaxLines() {
        return maxLines;
    }

    public void setMaxLines(int maxLines) {
        if (maxLines > 0) {
            this.maxLines = maxLines;
        }
    }
}
