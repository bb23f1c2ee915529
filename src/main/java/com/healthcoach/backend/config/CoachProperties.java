package com.healthcoach.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.coach")
public class CoachProperties {

    /** how many progress entries the dashboard hands to the engine (most recent first) */
    private int recentProgressLimit = 7;

    /** GET /progress without ?limit */
    private int defaultPageSize = 30;

    /** hard cap for ?limit */
    private int maxPageSize = 100;

    public int getRecentProgressLimit() { return recentProgressLimit; }
    public void setRecentProgressLimit(int recentProgressLimit) { this.recentProgressLimit = recentProgressLimit; }

    public int getDefaultPageSize() { return defaultPageSize; }
    public void setDefaultPageSize(int defaultPageSize) { this.defaultPageSize = defaultPageSize; }

    public int getMaxPageSize() { return maxPageSize; }
    public void setMaxPageSize(int maxPageSize) { this.maxPageSize = maxPageSize; }
}
