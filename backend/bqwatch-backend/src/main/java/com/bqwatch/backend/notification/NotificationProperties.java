package com.bqwatch.backend.notification;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bqwatch.notification")
public class NotificationProperties {

    private String from;
    private String subjectPrefix = "[Alert] ";
    private List<String> defaultRecipients = new ArrayList<>();
    private int dailyQuota = 100;

    public String getFrom() {
        return from;
    }

    public void setFrom(String from) {
        this.from = from;
    }

    public String getSubjectPrefix() {
        return subjectPrefix;
    }

    public void setSubjectPrefix(String subjectPrefix) {
        if (subjectPrefix != null) {
            this.subjectPrefix = subjectPrefix;
        }
    }

    public List<String> getDefaultRecipients() {
        return defaultRecipients;
    }

    public void setDefaultRecipients(List<String> defaultRecipients) {
        this.defaultRecipients = defaultRecipients != null ? defaultRecipients : new ArrayList<>();
    }

    public int getDailyQuota() {
        return dailyQuota;
    }

    public void setDailyQuota(int dailyQuota) {
        if (dailyQuota >= 0) {
            this.dailyQuota = dailyQuota;
        }
    }
}
