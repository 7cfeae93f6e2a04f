package selfheal.strategy;

import java.util.List;

/**
 * The closed, ordered set of strategies. Exact match comes first and is not
 * healing; the recovery strategies follow in fixed priority order:
 * text content, attribute similarity, nearby element, position, visual
 * similarity. The first recovery strategy with a match wins; there is no
 * voting across strategies.
 */
public final class StrategyChain {

    private final ExactMatchStrategy exactMatch;
    private final List<HealingStrategy> recovery;

    public StrategyChain(TextContentStrategy text,
                         AttributeSimilarityStrategy attributes,
                         NearbyElementStrategy nearby,
                         PositionStrategy position,
                         VisualSimilarityStrategy visual) {
        this.exactMatch = new ExactMatchStrategy();
        this.recovery   = List.of(text, attributes, nearby, position, visual);
    }

    /** Chain with the documented default thresholds and NCC image comparison. */
    public static StrategyChain defaults() {
        return new StrategyChain(
                new TextContentStrategy(0.95, 0.75, true),
                new AttributeSimilarityStrategy(0.6),
                new NearbyElementStrategy(3, 0.6),
                new PositionStrategy(150),
                new VisualSimilarityStrategy(new NormalizedCrossCorrelation(), 0.8));
    }

    public ExactMatchStrategy exactMatch() {
        return exactMatch;
    }

    /** Recovery strategies, highest priority first. */
    public List<HealingStrategy> recovery() {
        return recovery;
    }
}
