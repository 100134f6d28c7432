package com.bko.stravacache.cache.app;

import com.bko.stravacache.cache.CacheEntryInfo;
import com.bko.stravacache.cache.CacheStats;
import com.bko.stravacache.cache.CacheStore;
import com.bko.stravacache.cache.CachedAthlete;
import com.bko.stravacache.cache.ResourceType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CacheAdminServiceTest {
    private static final Instant T1 = Instant.parse("2024-05-01T00:00:00Z");
    private static final Instant T2 = Instant.parse("2024-05-20T00:00:00Z");

    @Test
    void statsAggregateEveryResourceType() {
        CacheStore store = mock(CacheStore.class);
        when(store.listEntries(any())).thenReturn(List.of());
        when(store.listEntries(ResourceType.ACTIVITY)).thenReturn(List.of(
                new CacheEntryInfo("7", "1", ResourceType.ACTIVITY, T2, 1024),
                new CacheEntryInfo("8", "2", ResourceType.ACTIVITY, T1, 512)));
        when(store.listEntries(ResourceType.LAPS)).thenReturn(List.of(
                new CacheEntryInfo("7", "1", ResourceType.LAPS, T1, 512)));

        CacheStats stats = new CacheAdminService(store).getStats();

        assertEquals(3, stats.totalEntries());
        assertEquals(2, stats.perResourceTypeCounts().get(ResourceType.ACTIVITY));
        assertEquals(1, stats.perResourceTypeCounts().get(ResourceType.LAPS));
        assertEquals(0, stats.perResourceTypeCounts().get(ResourceType.STREAMS));
        assertEquals(ResourceType.values().length, stats.perResourceTypeCounts().size());
        assertEquals(T1, stats.oldestEntryAt());
        assertEquals(T2, stats.newestEntryAt());
        assertEquals(2, stats.athleteCount());
        assertEquals(2048, stats.totalBytes());
        assertEquals("2 KB", stats.cacheSize());
    }

    @Test
    void emptyCacheHasNoTimestamps() {
        CacheStore store = mock(CacheStore.class);
        when(store.listEntries(any())).thenReturn(List.of());

        CacheStats stats = new CacheAdminService(store).getStats();

        assertEquals(0, stats.totalEntries());
        assertNull(stats.oldestEntryAt());
        assertNull(stats.newestEntryAt());
        assertEquals("0 B", stats.cacheSize());
    }

    @Test
    void clearOlderThanRejectsNonPositiveDays() throws Exception {
        CacheStore store = mock(CacheStore.class);
        CacheAdminService service = new CacheAdminService(store);

        assertThrows(IllegalArgumentException.class, () -> service.clearOlderThan(0));
        verify(store, never()).deleteOlderThan(anyInt());

        when(store.deleteOlderThan(30)).thenReturn(4);
        assertEquals(4, service.clearOlderThan(30));
    }

    @Test
    void deleteActivityRemovesEveryPerActivityResource() throws Exception {
        CacheStore store = mock(CacheStore.class);
        when(store.delete(eq("7"), any(), eq("42"))).thenReturn(true);
        when(store.delete("7", ResourceType.STREAMS, "42")).thenReturn(false);

        int deleted = new CacheAdminService(store).deleteActivity("7", "42");

        assertEquals(4, deleted);
        verify(store, never()).delete("7", ResourceType.ACTIVITY_LIST, "42");
    }

    @Test
    void listsAthletesWithActivityCounts() {
        CacheStore store = mock(CacheStore.class);
        when(store.listEntries(ResourceType.ACTIVITY)).thenReturn(List.of(
                new CacheEntryInfo("7", "1", ResourceType.ACTIVITY, T1, 10),
                new CacheEntryInfo("7", "2", ResourceType.ACTIVITY, T2, 10),
                new CacheEntryInfo("8", "3", ResourceType.ACTIVITY, T1, 10)));

        List<CachedAthlete> athletes = new CacheAdminService(store).listCachedAthletes();

        assertEquals(2, athletes.size());
        assertEquals("7", athletes.get(0).athleteId());
        assertEquals(2, athletes.get(0).activityCount());
        assertEquals(T2, athletes.get(0).lastCacheUpdate());
    }

    @Test
    void listCachedActivityIdsWithoutAthleteSpansAllAthletes() {
        CacheStore store = mock(CacheStore.class);
        when(store.listIds(ResourceType.ACTIVITY)).thenReturn(List.of("1", "2"));
        when(store.listIds(ResourceType.ACTIVITY, "7")).thenReturn(List.of("1"));
        CacheAdminService service = new CacheAdminService(store);

        assertEquals(List.of("1", "2"), service.listCachedActivityIds(null));
        assertEquals(List.of("1"), service.listCachedActivityIds("7"));
    }

    @Test
    void formatsBytes() {
        assertEquals("0 B", CacheAdminService.formatBytes(0));
        assertEquals("512 B", CacheAdminService.formatBytes(512));
        assertEquals("1.5 KB", CacheAdminService.formatBytes(1536));
        assertEquals("1 MB", CacheAdminService.formatBytes(1024 * 1024));
        assertEquals("2.25 GB", CacheAdminService.formatBytes(2415919104L));
    }
}
