package selfheal.cache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import selfheal.model.Locator;
import selfheal.model.StrategyName;

import java.time.Instant;

/**
 * Immutable cache value: the replacement locator for one {@link CacheKey}
 * plus validation bookkeeping. {@link HealingCache} swaps whole entries
 * atomically per key.
 *
 * <p>{@code consecutiveFailures} counts failures recorded since the last
 * success; at {@link #MAX_CONSECUTIVE_FAILURES} the entry is stale.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class HealingCacheEntry {

    /** Two strikes: two failures with no success in between retire an entry. */
    public static final int MAX_CONSECUTIVE_FAILURES = 2;

    private final Locator original;
    private final String pageContextFingerprint;
    private final Locator healedLocator;
    private final StrategyName strategy;
    private final double confidence;
    private final Instant lastValidatedAt;
    private final long hitCount;
    private final Instant lastFailedAt;
    private final int consecutiveFailures;

    @JsonCreator
    public HealingCacheEntry(
            @JsonProperty("original") Locator original,
            @JsonProperty("pageContext") String pageContextFingerprint,
            @JsonProperty("healed") Locator healedLocator,
            @JsonProperty("strategy") StrategyName strategy,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("lastValidatedAt") Instant lastValidatedAt,
            @JsonProperty("hitCount") long hitCount,
            @JsonProperty("lastFailedAt") Instant lastFailedAt,
            @JsonProperty("consecutiveFailures") int consecutiveFailures) {
        this.original               = original;
        this.pageContextFingerprint = pageContextFingerprint == null ? "" : pageContextFingerprint;
        this.healedLocator          = healedLocator;
        this.strategy               = strategy;
        this.confidence             = confidence;
        this.lastValidatedAt        = lastValidatedAt;
        this.hitCount               = hitCount;
        this.lastFailedAt           = lastFailedAt;
        this.consecutiveFailures    = consecutiveFailures;
    }

    /** First success for a key. */
    static HealingCacheEntry created(CacheKey key, Locator healed, StrategyName strategy,
                                     double confidence, Instant now) {
        return new HealingCacheEntry(key.original(), key.pageContextFingerprint(), healed, strategy,
                confidence, now, 1, null, 0);
    }

    /**
     * Entry after another success. A different replacement locator restarts
     * the hit count; the failure streak is always cleared.
     */
    HealingCacheEntry validated(Locator healed, StrategyName newStrategy, double newConfidence, Instant now) {
        boolean sameLocator = healedLocator.equals(healed);
        return new HealingCacheEntry(original, pageContextFingerprint, healed,
                newStrategy != null ? newStrategy : strategy,
                newConfidence, now, sameLocator ? hitCount + 1 : 1, lastFailedAt, 0);
    }

    /** Entry after the replacement failed to resolve. */
    HealingCacheEntry failed(Instant now) {
        return new HealingCacheEntry(original, pageContextFingerprint, healedLocator, strategy,
                confidence, lastValidatedAt, hitCount, now, consecutiveFailures + 1);
    }

    @JsonIgnore
    public CacheKey key() {
        return new CacheKey(original, pageContextFingerprint);
    }

    /** False once two failures were recorded with no success in between. */
    @JsonIgnore
    public boolean isLive() {
        return consecutiveFailures < MAX_CONSECUTIVE_FAILURES;
    }

    @JsonProperty("original")            public Locator      getOriginal()               { return original; }
    @JsonProperty("pageContext")         public String       getPageContextFingerprint() { return pageContextFingerprint; }
    @JsonProperty("healed")              public Locator      getHealedLocator()          { return healedLocator; }
    @JsonProperty("strategy")            public StrategyName getStrategy()               { return strategy; }
    @JsonProperty("confidence")          public double       getConfidence()             { return confidence; }
    @JsonProperty("lastValidatedAt")     public Instant      getLastValidatedAt()        { return lastValidatedAt; }
    @JsonProperty("hitCount")            public long         getHitCount()               { return hitCount; }
    @JsonProperty("lastFailedAt")        public Instant      getLastFailedAt()           { return lastFailedAt; }
    @JsonProperty("consecutiveFailures") public int          getConsecutiveFailures()    { return consecutiveFailures; }

    @Override
    public String toString() {
        return String.format("HealingCacheEntry{%s -> %s, hits=%d, failures=%d}",
                original, healedLocator, hitCount, consecutiveFailures);
    }
}
