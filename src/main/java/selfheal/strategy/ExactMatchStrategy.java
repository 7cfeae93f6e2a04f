package selfheal.strategy;

import selfheal.model.StrategyName;

import java.util.Optional;

/**
 * The original locator resolves as-is. Not healing: a match here
 * short-circuits the whole resolution and the locator is returned unchanged.
 */
public class ExactMatchStrategy implements HealingStrategy {

    @Override
    public StrategyName name() {
        return StrategyName.EXACT_MATCH;
    }

    @Override
    public Optional<StrategyMatch> attempt(HealingContext context) {
        return context.resolve(context.original())
                .map(handle -> new StrategyMatch(StrategyName.EXACT_MATCH, handle, context.original(), 1.0));
    }
}
