package com.bko.stravacache.cache;

import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Durable key/value storage for upstream responses, keyed by (resource type, athlete id, resource id).
 * <p>
 * Writes are atomic per key: a reader sees either the previous entry or the new one, never a partial write.
 * Reads never throw; a missing or unreadable entry is reported as absent.
 */
public interface CacheStore {

    <T> Optional<CacheEntry<T>> get(String athleteId, ResourceType type, String resourceId, TypeReference<T> payloadType);

    void put(CacheEntry<?> entry) throws IOException;

    /**
     * Resource ids cached for one athlete, in ascending id order.
     */
    List<String> listIds(ResourceType type, String athleteId);

    /**
     * Resource ids cached across all athletes, in ascending id order.
     */
    List<String> listIds(ResourceType type);

    List<String> listAthleteIds(ResourceType type);

    List<CacheEntryInfo> listEntries(ResourceType type);

    boolean delete(String athleteId, ResourceType type, String resourceId) throws IOException;

    int deleteAll() throws IOException;

    /**
     * Deletes every entry whose {@code fetchedAt} is before now minus {@code days}.
     */
    int deleteOlderThan(int days) throws IOException;
}
