package com.bko.stravacache.harvest;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HarvestMode {
    FULL,
    RECENT,
    YEAR;

    public static HarvestMode parse(String value) {
        if (value == null || value.isBlank()) {
            return RECENT;
        }
        for (HarvestMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown harvest mode: " + value);
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
