package com.bko.stravacache.harvest;

import com.bko.stravacache.cache.ResourceType;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * @param maxConcurrent worker pool size, {@code null} for the configured default
 * @param resources     resources that make up a bundle for this job
 * @param timeout       wall-clock ceiling for scheduling new fetches, {@code null} for the configured default
 */
public record BatchOptions(
        Integer maxConcurrent,
        boolean forceRefresh,
        Set<ResourceType> resources,
        Duration timeout,
        ProgressListener onProgress
) {
    public static final Set<ResourceType> BUNDLE_RESOURCES = Collections.unmodifiableSet(EnumSet.of(
            ResourceType.ACTIVITY, ResourceType.LAPS, ResourceType.COMMENTS, ResourceType.PHOTOS));
    public static final Set<ResourceType> PDF_RESOURCES = Collections.unmodifiableSet(EnumSet.of(
            ResourceType.ACTIVITY, ResourceType.LAPS, ResourceType.COMMENTS));

    public BatchOptions {
        if (resources == null) {
            resources = BUNDLE_RESOURCES;
        } else if (resources.isEmpty()) {
            resources = Set.of();
        } else {
            resources = Collections.unmodifiableSet(EnumSet.copyOf(resources));
        }
        if (onProgress == null) {
            onProgress = ProgressListener.NONE;
        }
    }

    public static BatchOptions defaults() {
        return new BatchOptions(null, false, BUNDLE_RESOURCES, null, null);
    }

    public BatchOptions withMaxConcurrent(int value) {
        return new BatchOptions(value, forceRefresh, resources, timeout, onProgress);
    }

    public BatchOptions withForceRefresh(boolean value) {
        return new BatchOptions(maxConcurrent, value, resources, timeout, onProgress);
    }

    public BatchOptions withResources(Set<ResourceType> value) {
        return new BatchOptions(maxConcurrent, forceRefresh, value, timeout, onProgress);
    }

    public BatchOptions withStreams() {
        EnumSet<ResourceType> withStreams = resources.isEmpty() ? EnumSet.noneOf(ResourceType.class) : EnumSet.copyOf(resources);
        withStreams.add(ResourceType.STREAMS);
        return withResources(withStreams);
    }

    public BatchOptions withTimeout(Duration value) {
        return new BatchOptions(maxConcurrent, forceRefresh, resources, value, onProgress);
    }

    public BatchOptions withProgressListener(ProgressListener value) {
        return new BatchOptions(maxConcurrent, forceRefresh, resources, timeout, value);
    }
}
