package selfheal.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Stores cache entries as pretty-printed JSON, by default in
 * {@code reports/healing_cache.json}.
 *
 * <pre>{@code
 * {
 *   "schemaVersion" : "1.0",
 *   "entries" : [ {
 *     "original" : { "kind" : "ID", "value" : "old-button-id" },
 *     "pageContext" : "3f1c...",
 *     "healed" : { "kind" : "ID", "value" : "submit" },
 *     ...
 *   } ]
 * }
 * }</pre>
 *
 * <p>Writes go to a sibling temp file that is then moved over the target, so
 * a crash mid-write never leaves a truncated cache behind.
 */
public class JsonFileCachePersistence implements CachePersistence {

    private static final Logger log = LoggerFactory.getLogger(JsonFileCachePersistence.class);

    public static final String CURRENT_SCHEMA_VERSION = "1.0";

    /** Singleton ObjectMapper, thread-safe after configuration. */
    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;

    public JsonFileCachePersistence(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public List<HealingCacheEntry> load() {
        if (!Files.exists(file)) {
            log.debug("No healing cache at {}, starting empty", file);
            return List.of();
        }
        try {
            CacheFile stored = MAPPER.readValue(file.toFile(), CacheFile.class);
            if (stored == null || stored.entries == null) {
                throw new CacheCorruptionException("Healing cache " + file + " has no entries array", null);
            }
            List<HealingCacheEntry> valid = new ArrayList<>();
            for (HealingCacheEntry e : stored.entries) {
                if (e == null || e.getOriginal() == null || e.getHealedLocator() == null) {
                    throw new CacheCorruptionException("Healing cache " + file + " contains an incomplete entry", null);
                }
                valid.add(e);
            }
            log.info("Loaded {} healed locators from {}", valid.size(), file);
            return valid;
        } catch (IOException e) {
            throw new CacheCorruptionException("Cannot read healing cache " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void save(Collection<HealingCacheEntry> entries) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        CacheFile out = new CacheFile();
        out.schemaVersion = CURRENT_SCHEMA_VERSION;
        out.entries = new ArrayList<>(entries);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        MAPPER.writeValue(tmp.toFile(), out);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Saved {} healed locators to {}", entries.size(), file);
    }

    /** On-disk layout. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CacheFile {
        @JsonProperty("schemaVersion")
        String schemaVersion;

        @JsonProperty("entries")
        List<HealingCacheEntry> entries;
    }
}
