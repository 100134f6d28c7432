package com.bko.stravacache.harvest;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BatchPhase {
    STARTING,
    FETCHING_ACTIVITIES,
    RATE_LIMITED,
    COMPLETE;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
