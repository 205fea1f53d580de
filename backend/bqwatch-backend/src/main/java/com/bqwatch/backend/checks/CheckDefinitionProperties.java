package com.bqwatch.backend.checks;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bqwatch.checks")
public class CheckDefinitionProperties {

    /**
     * CSV file with a header row and {@code title,sql,recipients} columns. Takes precedence over
     * {@link #definitions}.
     */
    private String file;
    private String recipientDelimiter = ",";

    /**
     * When false, the first failing query stops the whole run.
     */
    private boolean isolateFailures = true;
    private List<Definition> definitions = new ArrayList<>();

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    public String getRecipientDelimiter() {
        return recipientDelimiter;
    }

    public void setRecipientDelimiter(String recipientDelimiter) {
        if (recipientDelimiter != null && !recipientDelimiter.isEmpty()) {
            this.recipientDelimiter = recipientDelimiter;
        }
    }

    public boolean isIsolateFailures() {
        return isolateFailures;
    }

    public void setIsolateFailures(boolean isolateFailures) {
        this.isolateFailures = isolateFailures;
    }

    public List<Definition> getDefinitions() {
        return definitions;
    }

    public void setDefinitions(List<Definition> definitions) {
        this.definitions = definitions != null ? definitions : new ArrayList<>();
    }

    public static class Definition {

        private String title;
        private String sql;
        private List<String> recipients = new ArrayList<>();

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getSql() {
            return sql;
        }

        public void setSql(String sql) {
            this.sql = sql;
        }

        public List<String> getRecipients() {
            return recipients;
        }

        public void setRecipients(List<String> recipients) {
            this.recipients = recipients != null ? recipients : new ArrayList<>();
        }
    }
}
