package selfheal.cache;

import selfheal.model.Locator;

import java.util.Objects;

/**
 * Identity of a cache entry: the locator that failed, scoped to the page it
 * failed on.
 */
public record CacheKey(Locator original, String pageContextFingerprint) {

    public CacheKey {
        Objects.requireNonNull(original, "original");
        pageContextFingerprint = pageContextFingerprint == null ? "" : pageContextFingerprint;
    }
}
