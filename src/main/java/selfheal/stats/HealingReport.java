package selfheal.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import selfheal.model.HealingRecord;

import java.util.List;

/**
 * Point-in-time view of healing activity, in the shape dashboards and
 * keyword steps consume.
 *
 * @param totalHealings   successful healings since the process started
 * @param cachedLocators  live entries in the healing cache
 * @param recentHealings  most recent healings, newest first
 * @param totalAttempts   resolutions whose locator did not resolve as-is
 * @param totalSuccesses  attempts healed by a strategy
 * @param totalFailures   attempts that ended in a resolution failure
 * @param cacheHits       attempts answered by the healing cache
 */
public record HealingReport(
        @JsonProperty("total_healings") long totalHealings,
        @JsonProperty("cached_locators") int cachedLocators,
        @JsonProperty("recent_healings") List<HealingRecord> recentHealings,
        @JsonProperty("total_attempts") long totalAttempts,
        @JsonProperty("total_successes") long totalSuccesses,
        @JsonProperty("total_failures") long totalFailures,
        @JsonProperty("cache_hits") long cacheHits) {

    public HealingReport {
        recentHealings = List.copyOf(recentHealings);
    }

    /** Share of attempts that were healed by a strategy or the cache, 0 when there were none. */
    public double successRate() {
        if (totalAttempts == 0) return 0.0;
        return (double) (totalSuccesses + cacheHits) / totalAttempts;
    }
}
