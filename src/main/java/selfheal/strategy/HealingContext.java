package selfheal.strategy;

import selfheal.model.ElementProfile;
import selfheal.model.ElementSnapshot;
import selfheal.model.Locator;
import selfheal.model.NodeHandle;
import selfheal.snapshot.SnapshotProvider;

import java.util.Optional;

/**
 * Everything a strategy may read for one resolution attempt.
 *
 * @param original the locator the caller asked for
 * @param profile  last known state of the element behind {@code original}
 * @param snapshot page state all strategies in this attempt inspect
 * @param provider binding used to resolve locators against {@code snapshot}
 */
public record HealingContext(
        Locator original,
        ElementProfile profile,
        ElementSnapshot snapshot,
        SnapshotProvider provider) {

    /** Resolves {@code locator} against this context's snapshot. */
    public Optional<NodeHandle> resolve(Locator locator) {
        return provider.tryResolve(locator, snapshot);
    }
}
