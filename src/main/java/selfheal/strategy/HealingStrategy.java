package selfheal.strategy;

import selfheal.model.StrategyName;

import java.util.Optional;

/**
 * One way of finding the element an original locator was meant to identify.
 *
 * <p>Implementations are pure with respect to the snapshot in the context:
 * they never mutate it, never touch the cache, and return
 * {@link Optional#empty()} when nothing qualifies. An exception means a
 * malformed snapshot or a programming error, never "not found".
 *
 * <p>The set of implementations is closed and ordered by
 * {@link StrategyChain}; priority is part of the resolution contract.
 */
public interface HealingStrategy {

    StrategyName name();

    Optional<StrategyMatch> attempt(HealingContext context);
}
