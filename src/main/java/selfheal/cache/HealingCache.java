package selfheal.cache;

import selfheal.model.Locator;
import selfheal.model.StrategyName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide mapping from a failed locator (scoped to a page fingerprint)
 * to the replacement locator that last worked for it.
 *
 * <p>Thread-safe. Each key is updated atomically through
 * {@link ConcurrentHashMap#compute}, which locks only that key's bin; no
 * method calls out to a driver or any other blocking collaborator.
 *
 * <p>Two-strikes rule: once {@link #recordFailure} has been called twice for
 * an entry without an intervening {@link #recordSuccess}, {@link #lookup}
 * stops serving it and removes it.
 */
public class HealingCache {

    private static final Logger log = LoggerFactory.getLogger(HealingCache.class);

    private final ConcurrentHashMap<CacheKey, HealingCacheEntry> entries = new ConcurrentHashMap<>();
    private final CachePersistence persistence;
    private final Clock clock;

    public HealingCache() {
        this(CachePersistence.none(), Clock.systemUTC());
    }

    /**
     * Loads persisted entries. A corrupt store is logged and ignored: the
     * cache starts empty and resolution carries on.
     */
    public HealingCache(CachePersistence persistence, Clock clock) {
        this.persistence = persistence;
        this.clock       = clock;
        try {
            for (HealingCacheEntry e : persistence.load()) {
                entries.put(e.key(), e);
            }
        } catch (CacheCorruptionException e) {
            log.warn("Healing cache is corrupt, starting with an empty cache: {}", e.getMessage());
            entries.clear();
        }
    }

    // ── Contract ──────────────────────────────────────────────────────────

    /**
     * Replacement locator for {@code original} on this page, if a live entry
     * exists. Stale entries are evicted here.
     */
    public Optional<Locator> lookup(Locator original, String pageContextFingerprint) {
        CacheKey key = new CacheKey(original, pageContextFingerprint);
        HealingCacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isLive()) {
            if (entries.remove(key, entry)) {
                log.warn("Evicted stale healed locator {} -> {} after {} consecutive failures",
                        original, entry.getHealedLocator(), entry.getConsecutiveFailures());
            }
            return Optional.empty();
        }
        return Optional.of(entry.getHealedLocator());
    }

    /** Upserts the entry, clears its failure streak and counts a hit. */
    public void recordSuccess(Locator original, String pageContextFingerprint, Locator healed, double confidence) {
        recordSuccess(original, pageContextFingerprint, healed, confidence, null);
    }

    public void recordSuccess(Locator original, String pageContextFingerprint, Locator healed,
                              double confidence, StrategyName strategy) {
        CacheKey key = new CacheKey(original, pageContextFingerprint);
        entries.compute(key, (k, current) -> current == null
                ? HealingCacheEntry.created(k, healed, strategy, confidence, clock.instant())
                : current.validated(healed, strategy, confidence, clock.instant()));
    }

    /** Marks the entry's replacement as failing; no-op when there is no entry. */
    public void recordFailure(Locator original, String pageContextFingerprint) {
        CacheKey key = new CacheKey(original, pageContextFingerprint);
        entries.computeIfPresent(key, (k, current) -> current.failed(clock.instant()));
    }

    /** Number of live entries. */
    public int size() {
        int live = 0;
        for (HealingCacheEntry e : entries.values()) {
            if (e.isLive()) live++;
        }
        return live;
    }

    // ── Administration ────────────────────────────────────────────────────

    /** Full entry for a key, live or not, for inspection and reporting. */
    public Optional<HealingCacheEntry> entry(Locator original, String pageContextFingerprint) {
        return Optional.ofNullable(entries.get(new CacheKey(original, pageContextFingerprint)));
    }

    /** Point-in-time copy of every live entry. */
    public List<HealingCacheEntry> liveEntries() {
        List<HealingCacheEntry> out = new ArrayList<>();
        for (HealingCacheEntry e : entries.values()) {
            if (e.isLive()) out.add(e);
        }
        return out;
    }

    public void clear() {
        entries.clear();
        log.info("Healing cache cleared");
    }

    /**
     * Writes the live entries to the persistence collaborator.
     *
     * @return {@code false} if writing failed (already logged)
     */
    public boolean save() {
        List<HealingCacheEntry> live = liveEntries();
        try {
            persistence.save(live);
            return true;
        } catch (IOException e) {
            log.warn("Could not save healing cache ({} entries): {}", live.size(), e.getMessage());
            return false;
        }
    }
}
