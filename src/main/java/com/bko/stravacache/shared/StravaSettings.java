package com.bko.stravacache.shared;

public record StravaSettings(String apiBaseUrl) {
    public static final String DEFAULT_API_BASE = "https://www.strava.com/api/v3";

    public static StravaSettings defaults() {
        return new StravaSettings(DEFAULT_API_BASE);
    }
}
