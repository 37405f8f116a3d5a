package com.gridpulse.analytics.model;

public record RecentAnomaly(Reading reading, Severity severity) {
}
