package com.subradar.linking.table;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.subradar.common.MerchantNormalizer;
import com.subradar.common.SimilarityMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Curated merchant name to cancellation URL table with fuzzy lookup.
 * Bundled entries come first; the writable overlay file replaces or extends them.
 */
@Slf4j
public class KnownMerchantTable {

    private static final TypeReference<LinkedHashMap<String, String>> TABLE_TYPE = new TypeReference<>() {
    };

    public record Entry(String name, String key, String url) {
    }

    private final List<Entry> entries = new CopyOnWriteArrayList<>();
    private final SimilarityMatcher similarityMatcher;
    private final ObjectMapper objectMapper;
    private final Path overlayFile;
    private final int threshold;

    public KnownMerchantTable(SimilarityMatcher similarityMatcher, ObjectMapper objectMapper,
                              Path overlayFile, int threshold) {
        this.similarityMatcher = similarityMatcher;
        this.objectMapper = objectMapper;
        this.overlayFile = overlayFile;
        this.threshold = Math.max(0, Math.min(100, threshold));
    }

    /**
     * Builds a table from the bundled resource and the overlay file. Missing or unreadable sources are empty.
     */
    public static KnownMerchantTable load(Resource bundled, Path overlayFile, ObjectMapper objectMapper,
                                          SimilarityMatcher similarityMatcher, int threshold) {
        KnownMerchantTable table = new KnownMerchantTable(similarityMatcher, objectMapper, overlayFile, threshold);
        if (bundled != null && bundled.exists()) {
            try (InputStream in = bundled.getInputStream()) {
                table.putAll(objectMapper.readValue(in, TABLE_TYPE));
            } catch (IOException e) {
                log.warn("Could not read bundled known-merchant table {}: {}", bundled.getDescription(), e.getMessage());
            }
        }
        int bundledCount = table.size();
        if (overlayFile != null && Files.isRegularFile(overlayFile)) {
            try {
                if (Files.size(overlayFile) > 0) {
                    table.putAll(objectMapper.readValue(overlayFile.toFile(), TABLE_TYPE));
                }
            } catch (IOException e) {
                log.warn("Could not read known-merchant file {}: {}", overlayFile, e.getMessage());
            }
        }
        log.info("Known-merchant table loaded: {} bundled, {} total", bundledCount, table.size());
        return table;
    }

    /**
     * Highest-scoring entry over all given keys; ties go to the earlier table entry.
     * Empty unless the best score is strictly above the threshold.
     */
    public Optional<Entry> bestMatch(String... keys) {
        Entry best = null;
        int bestScore = -1;
        for (Entry entry : entries) {
            for (String key : keys) {
                if (key == null || key.isEmpty()) {
                    continue;
                }
                int score = similarityMatcher.similarity(key, entry.key());
                if (score > bestScore) {
                    best = entry;
                    bestScore = score;
                }
            }
        }
        if (best == null || bestScore <= threshold) {
            return Optional.empty();
        }
        return Optional.of(best);
    }

    /**
     * Inserts or replaces by normalized name. With {@code save}, writes the whole table to the overlay file.
     */
    public synchronized void addMerchant(String name, String url, boolean save) {
        put(name, url);
        log.info("Known merchant added: {} -> {}", name, url);
        if (save) {
            save();
        }
    }

    /**
     * Writes the table as pretty JSON via a temp file. Failures are logged, not thrown.
     */
    public synchronized void save() {
        if (overlayFile == null) {
            return;
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Entry e : entries) {
            out.put(e.name(), e.url());
        }
        try {
            Path parent = overlayFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = overlayFile.resolveSibling(overlayFile.getFileName() + ".tmp");
            objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(tmp.toFile(), out);
            Files.move(tmp, overlayFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to save known-merchant table to {}", overlayFile, e);
        }
    }

    public int size() {
        return entries.size();
    }

    public List<Entry> entries() {
        return new ArrayList<>(entries);
    }

    private void putAll(Map<String, String> table) {
        if (table == null) {
            return;
        }
        table.forEach(this::put);
    }

    private void put(String name, String url) {
        if (name == null || name.isBlank() || url == null || url.isBlank()) {
            return;
        }
        String key = MerchantNormalizer.normalize(name);
        Entry entry = new Entry(name.strip(), key, url.strip());
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).key().equals(key)) {
                entries.set(i, entry);
                return;
            }
        }
        entries.add(entry);
    }
}
