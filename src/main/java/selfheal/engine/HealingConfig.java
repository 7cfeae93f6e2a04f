package selfheal.engine;

import selfheal.cache.CachePersistence;
import selfheal.cache.HealingCache;
import selfheal.cache.JsonFileCachePersistence;
import selfheal.stats.HealingStatistics;
import selfheal.strategy.AttributeSimilarityStrategy;
import selfheal.strategy.NearbyElementStrategy;
import selfheal.strategy.NormalizedCrossCorrelation;
import selfheal.strategy.PositionStrategy;
import selfheal.strategy.StrategyChain;
import selfheal.strategy.TextContentStrategy;
import selfheal.strategy.VisualSimilarityStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Properties;

/**
 * Reads {@code healing.properties} from the classpath and exposes typed
 * healing settings with sensible defaults.
 *
 * <p>All values can be overridden by placing a {@code healing.local.properties}
 * file on the classpath (higher priority, not committed to VCS).
 */
public class HealingConfig {

    private static final Logger log = LoggerFactory.getLogger(HealingConfig.class);

    private static final String CONFIG_FILE       = "healing.properties";
    private static final String CONFIG_LOCAL_FILE = "healing.local.properties";

    // Property keys
    private static final String KEY_TIMEOUT             = "healing.timeout.ms";
    private static final String KEY_RECENT_CAPACITY     = "healing.recent.capacity";
    private static final String KEY_TEXT_EXACT          = "healing.text.exact.confidence";
    private static final String KEY_TEXT_PARTIAL        = "healing.text.partial.confidence";
    private static final String KEY_TEXT_DERIVE_HINTS   = "healing.text.derive.hints";
    private static final String KEY_ATTRIBUTE_THRESHOLD = "healing.attribute.threshold";
    private static final String KEY_NEARBY_RADIUS       = "healing.nearby.radius";
    private static final String KEY_NEARBY_CONFIDENCE   = "healing.nearby.confidence";
    private static final String KEY_POSITION_MAX_PX     = "healing.position.max.distance.px";
    private static final String KEY_VISUAL_THRESHOLD    = "healing.visual.threshold";
    private static final String KEY_PERSIST_ENABLED     = "healing.cache.persistence.enabled";
    private static final String KEY_CACHE_FILE          = "healing.cache.file";

    // Defaults
    private static final long    DEFAULT_TIMEOUT_MS          = 10_000L;
    private static final int     DEFAULT_RECENT_CAPACITY     = HealingStatistics.DEFAULT_RECENT_CAPACITY;
    private static final double  DEFAULT_TEXT_EXACT          = 0.95;
    private static final double  DEFAULT_TEXT_PARTIAL        = 0.75;
    private static final boolean DEFAULT_TEXT_DERIVE_HINTS   = true;
    private static final double  DEFAULT_ATTRIBUTE_THRESHOLD = 0.6;
    private static final int     DEFAULT_NEARBY_RADIUS       = 3;
    private static final double  DEFAULT_NEARBY_CONFIDENCE   = 0.6;
    private static final double  DEFAULT_POSITION_MAX_PX     = 150.0;
    private static final double  DEFAULT_VISUAL_THRESHOLD    = 0.8;
    private static final boolean DEFAULT_PERSIST_ENABLED     = false;
    private static final String  DEFAULT_CACHE_FILE          = "reports/healing_cache.json";

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code healing.local.properties} values override {@code healing.properties}.
     *
     * @throws HealingException if the base healing.properties cannot be loaded
     */
    public HealingConfig() {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new HealingException("Cannot load " + CONFIG_FILE, e);
        }

        // optional, no error if missing
        try (InputStream local = getClass().getClassLoader().getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /**
     * Package-private constructor for tests; accepts an already-populated
     * {@link Properties} instance.
     */
    HealingConfig(Properties props) {
        this.props = props;
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    /** Deadline for one whole resolve call (default: 10 s). */
    public Duration getTimeout() {
        long ms = getLong(KEY_TIMEOUT, DEFAULT_TIMEOUT_MS);
        if (ms < 0) {
            log.warn("Negative timeout '{}' for key '{}', using default {}", ms, KEY_TIMEOUT, DEFAULT_TIMEOUT_MS);
            ms = DEFAULT_TIMEOUT_MS;
        }
        return Duration.ofMillis(ms);
    }

    /** Size of the recent-healings buffer (default: 50). */
    public int getRecentCapacity() {
        int capacity = getInt(KEY_RECENT_CAPACITY, DEFAULT_RECENT_CAPACITY);
        if (capacity < 1) {
            log.warn("Recent capacity must be positive, got {}; using default {}", capacity, DEFAULT_RECENT_CAPACITY);
            return DEFAULT_RECENT_CAPACITY;
        }
        return capacity;
    }

    public double getTextExactConfidence() {
        return getConfidence(KEY_TEXT_EXACT, DEFAULT_TEXT_EXACT);
    }

    public double getTextPartialConfidence() {
        return getConfidence(KEY_TEXT_PARTIAL, DEFAULT_TEXT_PARTIAL);
    }

    /** Whether words in id / name / class values stand in for unknown text (default: true). */
    public boolean isTextDeriveHints() {
        return getBool(KEY_TEXT_DERIVE_HINTS, DEFAULT_TEXT_DERIVE_HINTS);
    }

    /** Weighted Jaccard score an attribute match must exceed (default: 0.6). */
    public double getAttributeThreshold() {
        return getConfidence(KEY_ATTRIBUTE_THRESHOLD, DEFAULT_ATTRIBUTE_THRESHOLD);
    }

    /** Maximum DOM distance from the anchor (default: 3). */
    public int getNearbyRadius() {
        return getInt(KEY_NEARBY_RADIUS, DEFAULT_NEARBY_RADIUS);
    }

    public double getNearbyConfidence() {
        return getConfidence(KEY_NEARBY_CONFIDENCE, DEFAULT_NEARBY_CONFIDENCE);
    }

    /** Box centres farther apart than this never match by position (default: 150). */
    public double getPositionMaxDistancePx() {
        return getDouble(KEY_POSITION_MAX_PX, DEFAULT_POSITION_MAX_PX);
    }

    /** Image similarity a visual match must exceed (default: 0.8). */
    public double getVisualThreshold() {
        return getConfidence(KEY_VISUAL_THRESHOLD, DEFAULT_VISUAL_THRESHOLD);
    }

    /** Whether healed locators are loaded from and saved to {@link #getCacheFile()} (default: false). */
    public boolean isCachePersistenceEnabled() {
        return getBool(KEY_PERSIST_ENABLED, DEFAULT_PERSIST_ENABLED);
    }

    public Path getCacheFile() {
        return Paths.get(props.getProperty(KEY_CACHE_FILE, DEFAULT_CACHE_FILE).trim());
    }

    // ── Factories ─────────────────────────────────────────────────────────

    public StrategyChain buildStrategyChain() {
        return new StrategyChain(
                new TextContentStrategy(getTextExactConfidence(), getTextPartialConfidence(), isTextDeriveHints()),
                new AttributeSimilarityStrategy(getAttributeThreshold()),
                new NearbyElementStrategy(getNearbyRadius(), getNearbyConfidence()),
                new PositionStrategy(getPositionMaxDistancePx()),
                new VisualSimilarityStrategy(new NormalizedCrossCorrelation(), getVisualThreshold()));
    }

    public CachePersistence buildPersistence() {
        return isCachePersistenceEnabled()
                ? new JsonFileCachePersistence(getCacheFile())
                : CachePersistence.none();
    }

    public HealingCache buildCache(Clock clock) {
        return new HealingCache(buildPersistence(), clock);
    }

    /** A fully wired orchestrator; build one per process and share it. */
    public HealingOrchestrator buildOrchestrator() {
        Clock clock = Clock.systemUTC();
        return new HealingOrchestrator(
                buildStrategyChain(),
                buildCache(clock),
                new HealingStatistics(getRecentCapacity()),
                new ElementProfileStore(),
                getTimeout(),
                clock);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private double getDouble(String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    /** A double that must lie in [0, 1]. */
    private double getConfidence(String key, double defaultValue) {
        double value = getDouble(key, defaultValue);
        if (value < 0.0 || value > 1.0) {
            log.warn("Value for key '{}' must be in [0,1], got {}; using default {}", key, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
