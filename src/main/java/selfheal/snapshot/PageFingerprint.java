package selfheal.snapshot;

import selfheal.model.Digests;
import selfheal.model.ElementNode;
import selfheal.model.ElementSnapshot;

import java.util.StringJoiner;

/**
 * Stable identity of a page used to scope cache entries, so a locator healed
 * on one page is never reused on an unrelated page that happens to use the
 * same original locator.
 *
 * <p>The fingerprint hashes the URL without query string or fragment, the
 * page title and the tag sequence of the snapshot (its structural signature).
 */
public final class PageFingerprint {

    private PageFingerprint() {}

    public static String of(String url, String title, ElementSnapshot snapshot) {
        StringJoiner structure = new StringJoiner(",");
        if (snapshot != null) {
            for (ElementNode node : snapshot.getNodes()) {
                structure.add(node.getTag() + "^" + node.getParentIndex());
            }
        }
        return Digests.sha256(stripQuery(url) + "|" + (title == null ? "" : title.trim())
                + "|" + structure);
    }

    /** Fingerprint from the URL and title recorded in the snapshot itself. */
    public static String of(ElementSnapshot snapshot) {
        return of(snapshot.getUrl(), snapshot.getTitle(), snapshot);
    }

    /** Fingerprint from URL and title only, for callers without a snapshot at hand. */
    public static String ofContext(String url, String title) {
        return Digests.sha256(stripQuery(url) + "|" + (title == null ? "" : title.trim()));
    }

    static String stripQuery(String url) {
        if (url == null) return "";
        String u = url.trim();
        int cut = u.length();
        int q = u.indexOf('?');
        int h = u.indexOf('#');
        if (q >= 0) cut = Math.min(cut, q);
        if (h >= 0) cut = Math.min(cut, h);
        return u.substring(0, cut);
    }
}
