package com.bko.stravacache.cache.app;

import com.bko.stravacache.cache.CacheEntry;
import com.bko.stravacache.cache.CacheEntryInfo;
import com.bko.stravacache.cache.ResourceType;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileCacheStoreTest {
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final TypeReference<JsonNode> PAYLOAD = new TypeReference<>() {};
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path root;

    private FileCacheStore store() {
        return new FileCacheStore(root, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void putThenGetReturnsAnEqualEntry() throws IOException {
        FileCacheStore store = store();
        CacheEntry<JsonNode> entry = new CacheEntry<>("7", "42", ResourceType.ACTIVITY, activity(42L, "Morning Run"),
                Instant.parse("2024-05-31T06:15:30.123456Z"));

        store.put(entry);

        assertEquals(entry, store.get("7", ResourceType.ACTIVITY, "42", PAYLOAD).orElseThrow());
        assertTrue(Files.isRegularFile(root.resolve("activities").resolve("7").resolve("42.json")));
    }

    @Test
    void payloadIsStoredWithEveryUpstreamField() throws IOException {
        FileCacheStore store = store();
        JsonNode detail = json("{\"id\":42,\"name\":\"Race\",\"map\":{\"summary_polyline\":\"a~l~Fjk~uOwHJy@P\"},"
                + "\"splits_metric\":[{\"split\":1,\"distance\":1000.2,\"moving_time\":290}],"
                + "\"best_efforts\":[{\"name\":\"1k\",\"elapsed_time\":281,\"pr_rank\":null}]}");

        store.put(new CacheEntry<>("7", "42", ResourceType.ACTIVITY, detail, NOW));

        JsonNode file = MAPPER.readTree(root.resolve("activities").resolve("7").resolve("42.json").toFile());
        assertEquals(detail, file.get("payload"));
        JsonNode cached = store.get("7", ResourceType.ACTIVITY, "42", PAYLOAD).orElseThrow().payload();
        assertEquals("a~l~Fjk~uOwHJy@P", cached.path("map").path("summary_polyline").asText());
        assertEquals(290, cached.path("splits_metric").path(0).path("moving_time").asInt());
        assertTrue(cached.path("best_efforts").path(0).has("pr_rank"));
    }

    @Test
    void laterPutReplacesEntryWhole() throws IOException {
        FileCacheStore store = store();
        store.put(new CacheEntry<>("7", "42", ResourceType.LAPS, json("[{\"lap_index\":1},{\"lap_index\":2}]"), NOW.minusSeconds(60)));
        store.put(new CacheEntry<>("7", "42", ResourceType.LAPS, json("[{\"lap_index\":3}]"), NOW));

        CacheEntry<JsonNode> entry = store.get("7", ResourceType.LAPS, "42", PAYLOAD).orElseThrow();
        assertEquals(1, entry.payload().size());
        assertEquals(3, entry.payload().path(0).path("lap_index").asInt());
        assertEquals(NOW, entry.fetchedAt());
        try (Stream<Path> files = Files.list(root.resolve("laps").resolve("7"))) {
            assertEquals(List.of("42.json"), files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    void missingOrCorruptEntriesAreAbsent() throws IOException {
        FileCacheStore store = store();
        assertTrue(store.get("7", ResourceType.ACTIVITY, "1", PAYLOAD).isEmpty());

        Path corrupt = root.resolve("activities").resolve("7").resolve("2.json");
        Files.createDirectories(corrupt.getParent());
        Files.writeString(corrupt, "{\"fetchedAt\": \"not a date\", \"payload\": {");

        Optional<CacheEntry<JsonNode>> entry = store.get("7", ResourceType.ACTIVITY, "2", PAYLOAD);
        assertTrue(entry.isEmpty());
        assertTrue(store.listEntries(ResourceType.ACTIVITY).isEmpty());
    }

    @Test
    void listsIdsPerAthleteAndAcrossAthletes() throws IOException {
        FileCacheStore store = store();
        store.put(new CacheEntry<>("7", "100", ResourceType.ACTIVITY, activity(100L, "a"), NOW));
        store.put(new CacheEntry<>("7", "9", ResourceType.ACTIVITY, activity(9L, "b"), NOW));
        store.put(new CacheEntry<>("8", "55", ResourceType.ACTIVITY, activity(55L, "c"), NOW));
        store.put(new CacheEntry<>("8", "9", ResourceType.LAPS, json("[]"), NOW));

        assertEquals(List.of("9", "100"), store.listIds(ResourceType.ACTIVITY, "7"));
        assertEquals(List.of("9", "55", "100"), store.listIds(ResourceType.ACTIVITY));
        assertEquals(List.of("7", "8"), store.listAthleteIds(ResourceType.ACTIVITY));
        assertEquals(List.of(), store.listIds(ResourceType.ACTIVITY, "unknown"));

        List<CacheEntryInfo> entries = store.listEntries(ResourceType.ACTIVITY);
        assertEquals(3, entries.size());
        assertTrue(entries.stream().allMatch(e -> e.sizeBytes() > 0));
    }

    @Test
    void clearOlderThanUsesFetchTime() throws IOException {
        FileCacheStore store = store();
        store.put(new CacheEntry<>("7", "1", ResourceType.ACTIVITY, activity(1L, "one"), NOW.minus(Duration.ofDays(1))));
        store.put(new CacheEntry<>("7", "2", ResourceType.ACTIVITY, activity(2L, "ten"), NOW.minus(Duration.ofDays(10))));
        store.put(new CacheEntry<>("7", "3", ResourceType.COMMENTS, json("[]"), NOW.minus(Duration.ofDays(40))));

        assertEquals(1, store.deleteOlderThan(30));
        assertEquals(List.of("1", "2"), store.listIds(ResourceType.ACTIVITY, "7"));
        assertEquals(List.of(), store.listIds(ResourceType.COMMENTS, "7"));

        assertEquals(1, store.deleteOlderThan(5));
        assertEquals(List.of("1"), store.listIds(ResourceType.ACTIVITY, "7"));
    }

    @Test
    void deleteAllAndDeleteSingle() throws IOException {
        FileCacheStore store = store();
        store.put(new CacheEntry<>("7", "1", ResourceType.ACTIVITY, activity(1L, "one"), NOW));
        store.put(new CacheEntry<>("7", "1", ResourceType.PHOTOS, json("[]"), NOW));
        store.put(new CacheEntry<>("7", "all", ResourceType.ACTIVITY_LIST, json("[{\"id\":1,\"name\":\"one\"}]"), NOW));

        assertTrue(store.delete("7", ResourceType.PHOTOS, "1"));
        assertFalse(store.delete("7", ResourceType.PHOTOS, "1"));
        assertEquals(2, store.deleteAll());
        assertTrue(store.listEntries(ResourceType.ACTIVITY).isEmpty());
        assertTrue(store.listEntries(ResourceType.ACTIVITY_LIST).isEmpty());
    }

    @Test
    void rejectsPathTraversal() {
        FileCacheStore store = store();
        assertThrows(IllegalArgumentException.class,
                () -> store.put(new CacheEntry<>("7", "../escape", ResourceType.ACTIVITY, activity(1L, "x"), NOW)));
        assertThrows(IllegalArgumentException.class,
                () -> store.get("..", ResourceType.ACTIVITY, "1", PAYLOAD));
        assertThrows(IllegalArgumentException.class,
                () -> store.put(new CacheEntry<>("7", "12 34", ResourceType.ACTIVITY, activity(1L, "x"), NOW)));
    }

    private static JsonNode activity(long id, String name) {
        return json("{\"id\":" + id + ",\"name\":\"" + name + "\",\"distance\":5012.3,\"athlete\":{\"id\":7}}");
    }

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (IOException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
