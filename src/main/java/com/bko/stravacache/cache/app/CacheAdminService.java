package com.bko.stravacache.cache.app;

import com.bko.stravacache.cache.CacheAdminUseCase;
import com.bko.stravacache.cache.CacheEntryInfo;
import com.bko.stravacache.cache.CacheStats;
import com.bko.stravacache.cache.CacheStore;
import com.bko.stravacache.cache.CachedAthlete;
import com.bko.stravacache.cache.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Service
public class CacheAdminService implements CacheAdminUseCase {
    private static final Logger logger = LoggerFactory.getLogger(CacheAdminService.class);
    private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB"};

    private final CacheStore cacheStore;

    public CacheAdminService(CacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    @Override
    public CacheStats getStats() {
        Map<ResourceType, Integer> perType = new LinkedHashMap<>();
        Set<String> athletes = new HashSet<>();
        int total = 0;
        long totalBytes = 0;
        Instant oldest = null;
        Instant newest = null;

        for (ResourceType type : ResourceType.values()) {
            List<CacheEntryInfo> entries = cacheStore.listEntries(type);
            perType.put(type, entries.size());
            total += entries.size();
            for (CacheEntryInfo entry : entries) {
                athletes.add(entry.athleteId());
                totalBytes += entry.sizeBytes();
                if (oldest == null || entry.fetchedAt().isBefore(oldest)) {
                    oldest = entry.fetchedAt();
                }
                if (newest == null || entry.fetchedAt().isAfter(newest)) {
                    newest = entry.fetchedAt();
                }
            }
        }
        return new CacheStats(total, perType, oldest, newest, athletes.size(), totalBytes, formatBytes(totalBytes));
    }

    @Override
    public int clearAll() throws IOException {
        int deleted = cacheStore.deleteAll();
        logger.info("Cache cleared: {} entries removed", deleted);
        return deleted;
    }

    @Override
    public int clearOlderThan(int days) throws IOException {
        if (days < 1) {
            throw new IllegalArgumentException("days must be at least 1, got " + days);
        }
        int deleted = cacheStore.deleteOlderThan(days);
        logger.info("Cache pruned: {} entries older than {} days removed", deleted, days);
        return deleted;
    }

    @Override
    public List<String> listCachedActivityIds(String athleteId) {
        if (athleteId == null || athleteId.isBlank()) {
            return cacheStore.listIds(ResourceType.ACTIVITY);
        }
        return cacheStore.listIds(ResourceType.ACTIVITY, athleteId);
    }

    @Override
    public List<CachedAthlete> listCachedAthletes() {
        Map<String, List<CacheEntryInfo>> byAthlete = new LinkedHashMap<>();
        for (CacheEntryInfo entry : cacheStore.listEntries(ResourceType.ACTIVITY)) {
            byAthlete.computeIfAbsent(entry.athleteId(), id -> new ArrayList<>()).add(entry);
        }
        List<CachedAthlete> athletes = new ArrayList<>();
        for (Map.Entry<String, List<CacheEntryInfo>> group : byAthlete.entrySet()) {
            Instant lastUpdate = null;
            for (CacheEntryInfo entry : group.getValue()) {
                if (lastUpdate == null || entry.fetchedAt().isAfter(lastUpdate)) {
                    lastUpdate = entry.fetchedAt();
                }
            }
            athletes.add(new CachedAthlete(group.getKey(), group.getValue().size(), lastUpdate));
        }
        return athletes;
    }

    @Override
    public int deleteActivity(String athleteId, String activityId) throws IOException {
        int deleted = 0;
        for (ResourceType type : ResourceType.values()) {
            if (type == ResourceType.ACTIVITY_LIST) {
                continue;
            }
            if (cacheStore.delete(athleteId, type, activityId)) {
                deleted++;
            }
        }
        logger.info("Removed {} cached resources of activity {} (athlete {})", deleted, activityId, athleteId);
        return deleted;
    }

    static String formatBytes(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }
        int unit = 0;
        double value = bytes;
        while (value >= 1024 && unit < SIZE_UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        String formatted = String.format(Locale.ROOT, "%.2f", value);
        if (formatted.contains(".")) {
            formatted = formatted.replaceAll("0+$", "").replaceAll("\\.$", "");
        }
        return formatted + " " + SIZE_UNITS[unit];
    }
}
