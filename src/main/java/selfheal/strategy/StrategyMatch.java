package selfheal.strategy;

import selfheal.model.Locator;
import selfheal.model.NodeHandle;
import selfheal.model.StrategyName;

/**
 * A node found by a strategy and the locator that now identifies it.
 *
 * @param strategy   strategy that produced the match
 * @param node       matched node and its snapshot position
 * @param locator    locator resolving to {@code node} in the same snapshot
 * @param confidence how certain the strategy is, in [0, 1]
 */
public record StrategyMatch(StrategyName strategy, NodeHandle node, Locator locator, double confidence) {

    public StrategyMatch {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1]: " + confidence);
        }
    }

    @Override
    public String toString() {
        return String.format("StrategyMatch{%s -> %s, confidence=%.2f}", strategy.label(), locator, confidence);
    }
}
