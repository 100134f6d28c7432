package com.bko.stravacache.harvest;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BatchStatus {
    COMPLETE,
    PARTIAL;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
