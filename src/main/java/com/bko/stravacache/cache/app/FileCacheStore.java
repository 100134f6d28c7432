package com.bko.stravacache.cache.app;

import com.bko.stravacache.cache.CacheEntry;
import com.bko.stravacache.cache.CacheEntryInfo;
import com.bko.stravacache.cache.CacheKeys;
import com.bko.stravacache.cache.CacheStore;
import com.bko.stravacache.cache.ResourceType;
import com.bko.stravacache.shared.AppSettings;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * File-backed {@link CacheStore}: {@code <root>/<resource dir>/<athleteId>/<resourceId>.json}.
 * <p>
 * Each file holds the entry metadata plus the serialized payload. Writes go to a temp file in the
 * target directory and are renamed over the destination.
 */
@Component
public class FileCacheStore implements CacheStore {
    private static final Logger logger = LoggerFactory.getLogger(FileCacheStore.class);
    private static final String EXTENSION = ".json";
    static final Comparator<String> ID_ORDER = Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder());

    private final Path root;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public FileCacheStore(AppSettings settings, Clock clock) {
        this(settings.cache().rootDirectory(), clock);
    }

    FileCacheStore(Path root, Clock clock) {
        this.root = root;
        this.clock = clock;
    }

    @Override
    public <T> Optional<CacheEntry<T>> get(String athleteId, ResourceType type, String resourceId, TypeReference<T> payloadType) {
        Path file = fileFor(type, athleteId, resourceId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            StoredEntry stored = objectMapper.readValue(file.toFile(), StoredEntry.class);
            T payload = stored.payload() == null || stored.payload().isNull()
                    ? null
                    : objectMapper.readerFor(payloadType).readValue(stored.payload());
            return Optional.of(new CacheEntry<>(athleteId, resourceId, type, payload, stored.fetchedAt()));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            logger.warn("Ignoring unreadable cache entry {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(CacheEntry<?> entry) throws IOException {
        Path target = fileFor(entry.resourceType(), entry.athleteId(), entry.resourceId());
        Path directory = target.getParent();
        Files.createDirectories(directory);

        StoredEntry stored = new StoredEntry(
                entry.athleteId(),
                entry.resourceId(),
                entry.resourceType(),
                entry.fetchedAt(),
                objectMapper.valueToTree(entry.payload())
        );
        byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(stored);

        Path tmp = Files.createTempFile(directory, "." + entry.resourceId() + "-", ".tmp");
        try {
            Files.write(tmp, bytes);
            moveIntoPlace(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
        logger.debug("Cached {} {} for athlete {}", entry.resourceType().label(), entry.resourceId(), entry.athleteId());
    }

    @Override
    public List<String> listIds(ResourceType type, String athleteId) {
        List<String> ids = new ArrayList<>();
        for (Path file : entryFiles(athleteDir(type, athleteId))) {
            ids.add(idOf(file));
        }
        ids.sort(ID_ORDER);
        return ids;
    }

    @Override
    public List<String> listIds(ResourceType type) {
        TreeSet<String> ids = new TreeSet<>(ID_ORDER);
        for (String athleteId : listAthleteIds(type)) {
            ids.addAll(listIds(type, athleteId));
        }
        return new ArrayList<>(ids);
    }

    @Override
    public List<String> listAthleteIds(ResourceType type) {
        Path typeDir = root.resolve(type.directoryName());
        List<String> athletes = new ArrayList<>();
        if (!Files.isDirectory(typeDir)) {
            return athletes;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(typeDir, Files::isDirectory)) {
            for (Path dir : stream) {
                String name = dir.getFileName().toString();
                if (CacheKeys.isValid(name)) {
                    athletes.add(name);
                }
            }
        } catch (IOException e) {
            logger.warn("Could not list athletes under {}: {}", typeDir, e.getMessage());
        }
        athletes.sort(ID_ORDER);
        return athletes;
    }

    @Override
    public List<CacheEntryInfo> listEntries(ResourceType type) {
        List<CacheEntryInfo> entries = new ArrayList<>();
        for (String athleteId : listAthleteIds(type)) {
            for (Path file : entryFiles(athleteDir(type, athleteId))) {
                readInfo(type, athleteId, file).ifPresent(entries::add);
            }
        }
        return entries;
    }

    @Override
    public boolean delete(String athleteId, ResourceType type, String resourceId) throws IOException {
        return Files.deleteIfExists(fileFor(type, athleteId, resourceId));
    }

    @Override
    public int deleteAll() throws IOException {
        int deleted = 0;
        for (ResourceType type : ResourceType.values()) {
            for (String athleteId : listAthleteIds(type)) {
                for (Path file : entryFiles(athleteDir(type, athleteId))) {
                    if (Files.deleteIfExists(file)) {
                        deleted++;
                    }
                }
            }
        }
        logger.info("Cleared {} cache entries under {}", deleted, root);
        return deleted;
    }

    @Override
    public int deleteOlderThan(int days) throws IOException {
        if (days < 0) {
            throw new IllegalArgumentException("days must not be negative: " + days);
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        int deleted = 0;
        for (ResourceType type : ResourceType.values()) {
            for (CacheEntryInfo info : listEntries(type)) {
                if (info.fetchedAt().isBefore(cutoff)
                        && delete(info.athleteId(), type, info.resourceId())) {
                    deleted++;
                }
            }
        }
        logger.info("Cleared {} cache entries fetched before {}", deleted, cutoff);
        return deleted;
    }

    private Optional<CacheEntryInfo> readInfo(ResourceType type, String athleteId, Path file) {
        try {
            long size = Files.size(file);
            JsonNode node = objectMapper.readTree(file.toFile());
            JsonNode fetchedAt = node.get("fetchedAt");
            if (fetchedAt == null || fetchedAt.isNull()) {
                logger.warn("Cache entry {} has no fetchedAt, skipping", file);
                return Optional.empty();
            }
            return Optional.of(new CacheEntryInfo(athleteId, idOf(file), type, Instant.parse(fetchedAt.asText()), size));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            logger.warn("Skipping unreadable cache entry {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private List<Path> entryFiles(Path directory) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            logger.warn("Could not list cache directory {}: {}", directory, e.getMessage());
        }
        return files;
    }

    private void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path athleteDir(ResourceType type, String athleteId) {
        return root.resolve(type.directoryName()).resolve(CacheKeys.require(athleteId, "athleteId"));
    }

    private Path fileFor(ResourceType type, String athleteId, String resourceId) {
        return athleteDir(type, athleteId).resolve(CacheKeys.require(resourceId, "resourceId") + EXTENSION);
    }

    private static String idOf(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - EXTENSION.length());
    }

    record StoredEntry(String athleteId, String resourceId, ResourceType resourceType, Instant fetchedAt, JsonNode payload) {
    }
}
