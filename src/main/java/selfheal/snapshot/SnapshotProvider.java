package selfheal.snapshot;

import selfheal.model.ElementSnapshot;
import selfheal.model.Locator;
import selfheal.model.NodeHandle;

import java.util.Optional;

/**
 * Capability supplied by the automation binding in use (browser or mobile).
 * The healing engine calls it but never implements driver access itself.
 */
public interface SnapshotProvider {

    /**
     * Captures the current page / screen state. May block on driver I/O.
     *
     * @throws SnapshotUnavailableException if no snapshot can be produced
     */
    ElementSnapshot getSnapshot();

    /**
     * Resolves {@code locator} against {@code snapshot}. The default matches
     * in memory with {@link SnapshotMatcher}; bindings override it only when
     * they can answer more precisely.
     *
     * @return the first matching node in document order, or empty
     */
    default Optional<NodeHandle> tryResolve(Locator locator, ElementSnapshot snapshot) {
        return SnapshotMatcher.resolve(locator, snapshot);
    }
}
