package selfheal.model;

import java.util.Locale;

/**
 * How a {@link Locator} value is interpreted when looking up an element.
 *
 * <p>Each kind carries the prefixes accepted by {@link Locator#parse(String)};
 * the first prefix is the canonical one used when rendering.
 */
public enum LocatorKind {

    ID("id"),
    NAME("name"),
    CSS("css"),
    XPATH("xpath"),
    TEXT("text", "link"),
    PARTIAL_TEXT("partial_text", "partial_link"),
    CLASS_NAME("class"),
    TAG_NAME("tag");

    private final String[] prefixes;

    LocatorKind(String... prefixes) {
        this.prefixes = prefixes;
    }

    /** Canonical prefix written by {@link Locator#toString()}. */
    public String prefix() {
        return prefixes[0];
    }

    /**
     * Looks up a kind by one of its prefixes (case-insensitive).
     *
     * @return the kind, or {@code null} if the prefix is unknown
     */
    public static LocatorKind fromPrefix(String prefix) {
        if (prefix == null) return null;
        String p = prefix.trim().toLowerCase(Locale.ROOT);
        for (LocatorKind kind : values()) {
            for (String candidate : kind.prefixes) {
                if (candidate.equals(p)) return kind;
            }
        }
        return null;
    }
}
