package selfheal.engine;

import selfheal.cache.HealingCache;
import selfheal.cache.HealingCacheEntry;
import selfheal.model.ElementProfile;
import selfheal.model.ElementSnapshot;
import selfheal.model.HealingRecord;
import selfheal.model.Locator;
import selfheal.model.NodeHandle;
import selfheal.model.StrategyName;
import selfheal.snapshot.PageFingerprint;
import selfheal.snapshot.SnapshotProvider;
import selfheal.snapshot.SnapshotUnavailableException;
import selfheal.stats.HealingReport;
import selfheal.stats.HealingStatistics;
import selfheal.strategy.HealingContext;
import selfheal.strategy.HealingStrategy;
import selfheal.strategy.StrategyChain;
import selfheal.strategy.StrategyMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Single entry point for resolving a locator with self-healing.
 *
 * <p>The resolution cascade for one call is:
 * <ol>
 *   <li>Take one snapshot from the caller's {@link SnapshotProvider}.</li>
 *   <li>Resolve the original locator as-is. On success it is returned
 *       unchanged and nothing is recorded.</li>
 *   <li>Consult the {@link HealingCache}. A cached replacement that still
 *       resolves is returned; one that does not gets a strike and is not
 *       trusted again in this call.</li>
 *   <li>Run the recovery strategies in priority order. The first match whose
 *       synthesized locator resolves to the matched node wins; it is cached,
 *       counted and returned.</li>
 *   <li>Otherwise return a {@link ResolutionFailure}.</li>
 * </ol>
 *
 * <p>The timeout covers the whole call. It is checked between steps and
 * between strategies; once passed, the call returns a
 * {@link ResolutionFailure.Reason#TIMEOUT} failure and discards whatever the
 * running strategy produced.
 *
 * <p>One instance is shared by every concurrent test worker. Only the cache,
 * profile store and statistics are shared; each guards itself and none of
 * them is locked while the snapshot provider blocks on the driver.
 *
 * <p>Healing events are logged at {@code INFO} through the
 * {@code selfheal.engine.HealingOrchestrator} logger, which logback routes to
 * {@code logs/healing.log} as well as the console appender.
 */
public class HealingOrchestrator implements AutoCloseable {

    // logback.xml routes this logger to HEALING_FILE + CONSOLE (additivity=false)
    private static final Logger log = LoggerFactory.getLogger(HealingOrchestrator.class);

    private final StrategyChain chain;
    private final HealingCache cache;
    private final HealingStatistics statistics;
    private final ElementProfileStore profiles;
    private final Duration defaultTimeout;
    private final Clock clock;

    /**
     * @param chain          exact match plus the recovery strategies, in priority order
     * @param cache          shared healed-locator cache
     * @param statistics     shared counters and recent-healings buffer
     * @param profiles       last known element state per original locator
     * @param defaultTimeout deadline used by the overloads that take none
     * @param clock          time source for deadlines and record timestamps
     */
    public HealingOrchestrator(StrategyChain chain, HealingCache cache, HealingStatistics statistics,
                               ElementProfileStore profiles, Duration defaultTimeout, Clock clock) {
        this.chain          = chain;
        this.cache          = cache;
        this.statistics     = statistics;
        this.profiles       = profiles;
        this.defaultTimeout = defaultTimeout;
        this.clock          = clock;
    }

    /** Orchestrator with default strategies, an in-memory cache and a 10 s timeout. */
    public static HealingOrchestrator withDefaults() {
        return new HealingOrchestrator(StrategyChain.defaults(), new HealingCache(),
                new HealingStatistics(), new ElementProfileStore(), Duration.ofSeconds(10), Clock.systemUTC());
    }

    // ── Resolution ────────────────────────────────────────────────────────

    /** Resolves with the default timeout, scoping the cache to the snapshot's own fingerprint. */
    public ResolutionResult resolve(Locator locator, SnapshotProvider provider) {
        return resolve(locator, null, provider, defaultTimeout);
    }

    public ResolutionResult resolve(Locator locator, String pageContextFingerprint, SnapshotProvider provider) {
        return resolve(locator, pageContextFingerprint, provider, defaultTimeout);
    }

    /**
     * Resolves {@code locator} on the page the provider currently shows.
     *
     * @param locator                the locator the test script uses
     * @param pageContextFingerprint cache scope; {@code null} computes it from the snapshot
     * @param provider               binding to the live driver
     * @param timeout                deadline for the whole call
     * @return the resolved (possibly healed) locator, or a failure
     * @throws SnapshotUnavailableException if the provider cannot produce a snapshot;
     *                                      no strategy runs in that case
     */
    public ResolutionResult resolve(Locator locator, String pageContextFingerprint,
                                    SnapshotProvider provider, Duration timeout) {
        Objects.requireNonNull(locator, "locator");
        Objects.requireNonNull(provider, "provider");
        Instant start    = clock.instant();
        Instant deadline = start.plus(timeout);

        // blocking driver I/O; nothing shared is locked here
        ElementSnapshot snapshot = provider.getSnapshot();
        String pageContext = pageContextFingerprint != null
                ? pageContextFingerprint
                : PageFingerprint.of(snapshot);
        HealingContext ctx = new HealingContext(locator, profiles.profileFor(locator), snapshot, provider);
        List<StrategyName> attempted = new ArrayList<>();

        // ── Step 1: exact match ──
        attempted.add(StrategyName.EXACT_MATCH);
        Optional<StrategyMatch> exact = chain.exactMatch().attempt(ctx);
        if (exact.isPresent()) {
            NodeHandle node = exact.get().node();
            profiles.refresh(locator, node.node());
            log.debug("Resolved {} as-is to {}", locator, node.node());
            return ResolutionResult.exact(locator, node);
        }

        statistics.recordAttempt();
        log.info("LOCATOR FAILED | original={} | page={}. Attempting self-healing...",
                locator, shortContext(pageContext));

        // ── Step 2: healing cache ──
        if (expired(deadline)) {
            return timeout(locator, attempted, start);
        }
        Optional<Locator> cached = cache.lookup(locator, pageContext);
        if (cached.isPresent()) {
            Optional<ResolutionResult> hit = tryCached(locator, pageContext, cached.get(), ctx);
            if (hit.isPresent()) {
                return hit.get();
            }
        }

        // ── Step 3: recovery strategies ──
        for (HealingStrategy strategy : chain.recovery()) {
            if (expired(deadline)) {
                return timeout(locator, attempted, start);
            }
            attempted.add(strategy.name());
            Optional<StrategyMatch> match = attemptSafely(strategy, ctx);
            if (expired(deadline)) {
                return timeout(locator, attempted, start);
            }
            if (match.isEmpty()) {
                continue;
            }
            if (!resolvesToMatchedNode(match.get(), ctx)) {
                log.debug("[{}] synthesized {} does not resolve to node {}; skipping",
                        strategy.name().label(), match.get().locator(), match.get().node().index());
                continue;
            }
            return healed(locator, pageContext, match.get(), start);
        }

        // ── Step 4: failure ──
        statistics.recordFailure();
        ResolutionFailure failure = new ResolutionFailure(locator, attempted,
                Duration.between(start, clock.instant()), ResolutionFailure.Reason.NOT_FOUND);
        log.warn("HEALING FAILED | original={} | tried={} | elapsed={}ms",
                locator, attempted, failure.elapsed().toMillis());
        return ResolutionResult.failed(failure);
    }

    /**
     * Resolves and returns the node, for callers that need an element.
     *
     * @throws ElementNotHealedException if resolution fails
     */
    public NodeHandle findElement(Locator locator, SnapshotProvider provider) {
        ResolutionResult result = resolve(locator, provider);
        if (!result.isResolved()) {
            throw new ElementNotHealedException(result.failure());
        }
        return result.node();
    }

    // ── Hints ─────────────────────────────────────────────────────────────

    /** Registers the visible text the element behind {@code original} is expected to show. */
    public void rememberText(Locator original, String text) {
        profiles.rememberText(original, text);
    }

    /** Registers a stable locator the element behind {@code original} sits next to. */
    public void rememberAnchor(Locator original, Locator anchor) {
        profiles.rememberAnchor(original, anchor);
    }

    public void remember(Locator original, ElementProfile profile) {
        profiles.remember(original, profile);
    }

    // ── Administration ────────────────────────────────────────────────────

    /** Consistent point-in-time report; safe to call while resolutions run. */
    public HealingReport getHealingStatistics() {
        return statistics.report(cache.size());
    }

    /** Empties the cache and the element profiles. Counters are kept. */
    public void clearCache() {
        cache.clear();
        profiles.clear();
    }

    /** @return {@code false} if the cache could not be written (already logged) */
    public boolean saveCache() {
        return cache.save();
    }

    /** Saves the cache. */
    @Override
    public void close() {
        saveCache();
    }

    public HealingCache getCache() {
        return cache;
    }

    public ElementProfileStore getProfiles() {
        return profiles;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    // ── Private cascade steps ─────────────────────────────────────────────

    private Optional<ResolutionResult> tryCached(Locator original, String pageContext,
                                                 Locator cachedLocator, HealingContext ctx) {
        Optional<NodeHandle> node = ctx.resolve(cachedLocator);
        if (node.isEmpty()) {
            cache.recordFailure(original, pageContext);
            log.warn("CACHE MISS | original={} | cached={} no longer resolves, falling back to strategies",
                    original, cachedLocator);
            return Optional.empty();
        }
        Optional<HealingCacheEntry> entry = cache.entry(original, pageContext);
        double confidence     = entry.map(HealingCacheEntry::getConfidence).orElse(1.0);
        StrategyName strategy = entry.map(HealingCacheEntry::getStrategy).orElse(null);
        cache.recordSuccess(original, pageContext, cachedLocator, confidence, strategy);
        statistics.recordCacheHit();
        profiles.refresh(original, node.get().node());
        log.info("HEALING CACHE HIT | original={} | healed={} | strategy={} | confidence={}",
                original, cachedLocator, strategy == null ? "-" : strategy.label(), format(confidence));
        return Optional.of(ResolutionResult.cached(cachedLocator, node.get(), strategy, confidence));
    }

    private ResolutionResult healed(Locator original, String pageContext, StrategyMatch match, Instant start) {
        Instant now = clock.instant();
        HealingRecord record = new HealingRecord(original, match.locator(), match.strategy(),
                match.confidence(), now, pageContext, Duration.between(start, now));
        cache.recordSuccess(original, pageContext, match.locator(), match.confidence(), match.strategy());
        statistics.recordSuccess(record);
        profiles.refresh(original, match.node().node());
        log.info("HEALING SUCCESS | original={} | healed={} | strategy={} | confidence={} | time={}ms",
                original, match.locator(), match.strategy().label(), format(match.confidence()),
                record.healingTime().toMillis());
        return ResolutionResult.healed(match.locator(), match.node(), match.strategy(), match.confidence());
    }

    /** A strategy that throws is a miss; the chain carries on. */
    private Optional<StrategyMatch> attemptSafely(HealingStrategy strategy, HealingContext ctx) {
        try {
            Optional<StrategyMatch> match = strategy.attempt(ctx);
            if (match.isEmpty()) {
                log.debug("[{}] no match for {}", strategy.name().label(), ctx.original());
            }
            return match;
        } catch (SnapshotUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[{}] failed on {}: {}", strategy.name().label(), ctx.original(), e.toString());
            return Optional.empty();
        }
    }

    private static boolean resolvesToMatchedNode(StrategyMatch match, HealingContext ctx) {
        return ctx.resolve(match.locator())
                .map(h -> h.index() == match.node().index())
                .orElse(false);
    }

    private boolean expired(Instant deadline) {
        return !clock.instant().isBefore(deadline);
    }

    private ResolutionResult timeout(Locator original, List<StrategyName> attempted, Instant start) {
        statistics.recordFailure();
        ResolutionFailure failure = new ResolutionFailure(original, attempted,
                Duration.between(start, clock.instant()), ResolutionFailure.Reason.TIMEOUT);
        log.warn("HEALING TIMEOUT | original={} | tried={} | elapsed={}ms",
                original, attempted, failure.elapsed().toMillis());
        return ResolutionResult.failed(failure);
    }

    private static String shortContext(String pageContext) {
        return pageContext.length() > 12 ? pageContext.substring(0, 12) : pageContext;
    }

    private static String format(double confidence) {
        return String.format("%.2f", confidence);
    }
}
