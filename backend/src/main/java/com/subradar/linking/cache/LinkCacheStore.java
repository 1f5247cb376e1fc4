package com.subradar.linking.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.benmanes.caffeine.cache.Cache;
import com.subradar.domain.LinkCacheEntry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Resolved cancellation links keyed by normalized merchant, held in Caffeine and persisted as JSON.
 * Concurrent puts for one key are last-write-wins; file writes are serialized and go through a temp file.
 */
@Slf4j
public class LinkCacheStore {

    private static final TypeReference<LinkedHashMap<String, LinkCacheEntry>> FILE_TYPE = new TypeReference<>() {
    };

    private final Cache<String, LinkCacheEntry> cache;
    private final Path file;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final boolean saveOnWrite;
    private final Clock clock;
    private final ReentrantLock fileLock = new ReentrantLock();

    /**
     * @param ttl zero or negative means entries never expire
     */
    public LinkCacheStore(Cache<String, LinkCacheEntry> cache, Path file, ObjectMapper objectMapper,
                          Duration ttl, boolean saveOnWrite, Clock clock) {
        this.cache = cache;
        this.file = file;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.ttl = ttl;
        this.saveOnWrite = saveOnWrite;
        this.clock = clock;
    }

    /**
     * Replaces in-memory content with the file. Missing or empty file gives an empty cache; a corrupt one is logged.
     */
    public void load() {
        cache.invalidateAll();
        if (file == null || !Files.isRegularFile(file)) {
            log.info("Link cache file {} not found, starting empty", file);
            return;
        }
        try {
            if (Files.size(file) == 0) {
                return;
            }
            Map<String, LinkCacheEntry> stored = objectMapper.readValue(file.toFile(), FILE_TYPE);
            if (stored != null) {
                stored.forEach((key, entry) -> {
                    if (key != null && entry != null && entry.url() != null && !entry.url().isBlank()) {
                        cache.put(key, entry);
                    }
                });
            }
            log.info("Loaded {} cached cancellation links from {}", cache.estimatedSize(), file);
        } catch (IOException e) {
            log.warn("Link cache file {} is unreadable, starting empty: {}", file, e.getMessage());
            cache.invalidateAll();
        }
    }

    public Optional<LinkCacheEntry> get(String key) {
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }
        LinkCacheEntry entry = cache.getIfPresent(key);
        if (entry == null || isExpired(entry)) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public LinkCacheEntry put(String key, String url) {
        LinkCacheEntry entry = new LinkCacheEntry(url, clock.instant());
        cache.put(key, entry);
        if (saveOnWrite) {
            flush();
        }
        return entry;
    }

    /**
     * @return true if an entry was present
     */
    public boolean invalidate(String key) {
        if (key == null) {
            return false;
        }
        boolean present = cache.getIfPresent(key) != null;
        cache.invalidate(key);
        if (present && saveOnWrite) {
            flush();
        }
        return present;
    }

    public void invalidateAll() {
        cache.invalidateAll();
        if (saveOnWrite) {
            flush();
        }
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /**
     * Sorted copy of the current entries.
     */
    public Map<String, LinkCacheEntry> snapshot() {
        return new TreeMap<>(cache.asMap());
    }

    /**
     * Writes the whole cache to the file. I/O failures are logged; in-memory state is kept.
     */
    public void flush() {
        if (file == null) {
            return;
        }
        fileLock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot());
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.warn("Failed to write link cache to {}: {}", file, e.getMessage());
        } finally {
            fileLock.unlock();
        }
    }

    private boolean isExpired(LinkCacheEntry entry) {
        if (ttl == null || ttl.isZero() || ttl.isNegative() || entry.resolvedAt() == null) {
            return false;
        }
        return entry.resolvedAt().plus(ttl).isBefore(clock.instant());
    }
}
