package selfheal.engine;

import selfheal.model.Locator;
import selfheal.model.NodeHandle;
import selfheal.model.StrategyName;

import java.util.Optional;

/**
 * Outcome of {@link HealingOrchestrator#resolve}: either a locator that
 * resolves on the current page or a {@link ResolutionFailure}.
 *
 * @param locator    locator to use from now on, {@code null} on failure
 * @param node       node the locator resolved to, {@code null} on failure
 * @param source     how the locator was obtained, {@code null} on failure
 * @param strategy   strategy that produced a healed locator, {@code null} otherwise
 * @param confidence 1.0 for exact matches, the healing confidence otherwise
 * @param failure    failure details, {@code null} on success
 */
public record ResolutionResult(
        Locator locator,
        NodeHandle node,
        Source source,
        StrategyName strategy,
        double confidence,
        ResolutionFailure failure) {

    public enum Source {
        /** The original locator resolved as-is. */
        EXACT,
        /** A previously healed locator from the cache resolved. */
        CACHE,
        /** A strategy found the element and a new locator was synthesized. */
        HEALED
    }

    public static ResolutionResult exact(Locator locator, NodeHandle node) {
        return new ResolutionResult(locator, node, Source.EXACT, null, 1.0, null);
    }

    public static ResolutionResult cached(Locator healed, NodeHandle node, StrategyName strategy, double confidence) {
        return new ResolutionResult(healed, node, Source.CACHE, strategy, confidence, null);
    }

    public static ResolutionResult healed(Locator healed, NodeHandle node, StrategyName strategy, double confidence) {
        return new ResolutionResult(healed, node, Source.HEALED, strategy, confidence, null);
    }

    public static ResolutionResult failed(ResolutionFailure failure) {
        return new ResolutionResult(null, null, null, null, 0.0, failure);
    }

    public boolean isResolved() {
        return failure == null;
    }

    /** True when the returned locator differs from the one the caller asked for. */
    public boolean isHealed() {
        return source == Source.CACHE || source == Source.HEALED;
    }

    public Optional<Locator> getLocator() {
        return Optional.ofNullable(locator);
    }

    public Optional<ResolutionFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * @return the resolved locator
     * @throws ElementNotHealedException if resolution failed
     */
    public Locator orElseThrow() {
        if (failure != null) {
            throw new ElementNotHealedException(failure);
        }
        return locator;
    }
}
