package com.bko.stravacache.integrations.strava;

import java.io.IOException;

public class StravaApiException extends IOException {
    private final int statusCode;

    public StravaApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
