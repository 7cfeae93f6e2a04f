package selfheal.engine;

import selfheal.model.Locator;
import selfheal.model.StrategyName;

import java.time.Duration;
import java.util.List;

/**
 * Why a locator could not be resolved, even with healing.
 *
 * @param originalLocator     locator the caller asked for
 * @param attemptedStrategies strategies that ran, in order, before giving up
 * @param elapsed             wall time spent in the call
 * @param reason              whether the element is gone or the deadline ran out
 */
public record ResolutionFailure(
        Locator originalLocator,
        List<StrategyName> attemptedStrategies,
        Duration elapsed,
        Reason reason) {

    public enum Reason {
        /** Every strategy ran and none matched. */
        NOT_FOUND,
        /** The call's deadline passed before the strategies were exhausted. */
        TIMEOUT
    }

    public ResolutionFailure {
        attemptedStrategies = List.copyOf(attemptedStrategies);
    }

    public boolean isTimeout() {
        return reason == Reason.TIMEOUT;
    }

    @Override
    public String toString() {
        return String.format("ResolutionFailure{%s, reason=%s, tried=%s, elapsed=%dms}",
                originalLocator, reason, attemptedStrategies, elapsed.toMillis());
    }
}
