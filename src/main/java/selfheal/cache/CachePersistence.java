package selfheal.cache;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Durable storage for cache entries between runs. Invoked when the cache is
 * created and when it is explicitly saved, never in the middle of a
 * resolution.
 */
public interface CachePersistence {

    /**
     * @return previously saved entries; empty when nothing was saved yet
     * @throws CacheCorruptionException if stored data exists but cannot be read
     */
    List<HealingCacheEntry> load();

    void save(Collection<HealingCacheEntry> entries) throws IOException;

    /** Persistence that stores nothing; the cache lives for one process only. */
    static CachePersistence none() {
        return new CachePersistence() {
            @Override
            public List<HealingCacheEntry> load() {
                return List.of();
            }

            @Override
            public void save(Collection<HealingCacheEntry> entries) {
                // in-memory only
            }
        };
    }
}
