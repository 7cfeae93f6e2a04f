package selfheal.stats;

import selfheal.model.HealingRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Process-lifetime healing counters plus a bounded buffer of the most recent
 * {@link HealingRecord}s.
 *
 * <p>All mutation and {@link #report} run under one monitor, so a report is
 * never a half-applied update: a success is counted and its record appended
 * in the same critical section.
 */
public class HealingStatistics {

    public static final int DEFAULT_RECENT_CAPACITY = 50;

    private final int capacity;
    private final Deque<HealingRecord> recent;

    private long attempts;
    private long successes;
    private long failures;
    private long cacheHits;

    public HealingStatistics() {
        this(DEFAULT_RECENT_CAPACITY);
    }

    public HealingStatistics(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.recent   = new ArrayDeque<>(capacity);
    }

    /** The original locator did not resolve as-is. */
    public synchronized void recordAttempt() {
        attempts++;
    }

    /** A cached replacement resolved. */
    public synchronized void recordCacheHit() {
        cacheHits++;
    }

    /** A strategy healed the locator; the oldest record drops out when the buffer is full. */
    public synchronized void recordSuccess(HealingRecord record) {
        successes++;
        if (recent.size() == capacity) {
            recent.removeLast();
        }
        recent.addFirst(record);
    }

    public synchronized void recordFailure() {
        failures++;
    }

    public synchronized long getAttempts()  { return attempts; }
    public synchronized long getSuccesses() { return successes; }
    public synchronized long getFailures()  { return failures; }
    public synchronized long getCacheHits() { return cacheHits; }

    public int getCapacity() {
        return capacity;
    }

    /** Recent healings, newest first. */
    public synchronized List<HealingRecord> recent() {
        return new ArrayList<>(recent);
    }

    /**
     * Consistent copy of every counter and the buffer.
     *
     * @param cachedLocators live cache size to include, read by the caller
     */
    public synchronized HealingReport report(int cachedLocators) {
        return new HealingReport(successes, cachedLocators, new ArrayList<>(recent),
                attempts, successes, failures, cacheHits);
    }
}
