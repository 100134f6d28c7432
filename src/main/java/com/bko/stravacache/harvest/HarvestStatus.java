package com.bko.stravacache.harvest;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HarvestStatus {
    COMPLETE,
    PARTIAL,
    RATE_LIMITED;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
