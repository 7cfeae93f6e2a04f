package selfheal.engine;

import selfheal.model.ElementNode;
import selfheal.model.ElementProfile;
import selfheal.model.Locator;
import selfheal.strategy.LocatorProfiles;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last known state of the element behind each original locator. Written by
 * the orchestrator after every resolution that lands on a node, and by
 * callers registering hints ahead of time.
 */
public class ElementProfileStore {

    private final ConcurrentHashMap<Locator, ElementProfile> profiles = new ConcurrentHashMap<>();

    /** Stored profile, or one derived from the locator itself when nothing is stored. */
    public ElementProfile profileFor(Locator original) {
        ElementProfile stored = profiles.get(original);
        return stored != null ? stored : LocatorProfiles.derive(original);
    }

    public Optional<ElementProfile> stored(Locator original) {
        return Optional.ofNullable(profiles.get(original));
    }

    public void remember(Locator original, ElementProfile profile) {
        profiles.put(original, profile);
    }

    public void rememberText(Locator original, String text) {
        profiles.compute(original, (k, p) -> base(k, p).withText(text));
    }

    public void rememberAnchor(Locator original, Locator anchor) {
        profiles.compute(original, (k, p) -> base(k, p).withAnchor(anchor));
    }

    /** Folds a freshly resolved node into the profile, keeping the anchor. */
    public void refresh(Locator original, ElementNode node) {
        profiles.compute(original, (k, p) -> p == null ? ElementProfile.fromNode(node) : p.refreshedFrom(node));
    }

    public int size() {
        return profiles.size();
    }

    public void clear() {
        profiles.clear();
    }

    private static ElementProfile base(Locator original, ElementProfile current) {
        return current != null ? current : LocatorProfiles.derive(original);
    }
}
