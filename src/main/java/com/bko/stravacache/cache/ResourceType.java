package com.bko.stravacache.cache;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Independently cached resource families. Each one lives in its own directory under the cache root.
 */
public enum ResourceType {
    ACTIVITY("activities"),
    LAPS("laps"),
    COMMENTS("comments"),
    PHOTOS("photos"),
    STREAMS("streams"),
    ACTIVITY_LIST("lists");

    private final String directoryName;

    ResourceType(String directoryName) {
        this.directoryName = directoryName;
    }

    public String directoryName() {
        return directoryName;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
