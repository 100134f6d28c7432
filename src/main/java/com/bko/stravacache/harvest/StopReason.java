package com.bko.stravacache.harvest;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a batch stopped scheduling live fetches before reaching the end of its id list.
 */
public enum StopReason {
    NONE,
    RATE_LIMIT,
    DEADLINE,
    INTERRUPTED;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
