package selfheal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Immutable description of how to find one UI element.
 *
 * <p>Two locators are equal when both kind and value match exactly. The
 * {@link #fingerprint()} is stable across processes and is used as input to
 * cache keys and persisted files.
 *
 * <h3>String notation</h3>
 * <pre>
 *   id=submit-button
 *   css=form button.primary
 *   xpath=//button[text()='Save']
 *   //button[text()='Save']          (no prefix: XPath)
 * </pre>
 */
public final class Locator {

    private final LocatorKind kind;
    private final String value;

    @JsonCreator
    public Locator(@JsonProperty("kind") LocatorKind kind,
                   @JsonProperty("value") String value) {
        this.kind  = Objects.requireNonNull(kind, "kind");
        this.value = Objects.requireNonNull(value, "value");
    }

    // ── Factories ─────────────────────────────────────────────────────────

    public static Locator id(String value)        { return new Locator(LocatorKind.ID, value); }
    public static Locator name(String value)      { return new Locator(LocatorKind.NAME, value); }
    public static Locator css(String value)       { return new Locator(LocatorKind.CSS, value); }
    public static Locator xpath(String value)     { return new Locator(LocatorKind.XPATH, value); }
    public static Locator text(String value)      { return new Locator(LocatorKind.TEXT, value); }
    public static Locator className(String value) { return new Locator(LocatorKind.CLASS_NAME, value); }
    public static Locator tagName(String value)   { return new Locator(LocatorKind.TAG_NAME, value); }

    /**
     * Parses {@code strategy=value} notation. Strings starting with {@code /}
     * or {@code (}, and strings whose prefix is not a known strategy, are
     * treated as XPath.
     *
     * @throws IllegalArgumentException if {@code spec} is null or blank
     */
    public static Locator parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Locator must not be blank");
        }
        String trimmed = spec.trim();
        if (trimmed.startsWith("/") || trimmed.startsWith("(")) {
            return xpath(trimmed);
        }
        int eq = trimmed.indexOf('=');
        if (eq > 0) {
            LocatorKind kind = LocatorKind.fromPrefix(trimmed.substring(0, eq));
            if (kind != null) {
                return new Locator(kind, trimmed.substring(eq + 1).trim());
            }
        }
        return xpath(trimmed);
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    @JsonProperty("kind")
    public LocatorKind getKind() { return kind; }

    @JsonProperty("value")
    public String getValue()     { return value; }

    /** Stable SHA-256 hex digest of {@code kind|value}. */
    public String fingerprint() {
        return Digests.sha256(kind.name() + "|" + value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Locator)) return false;
        Locator that = (Locator) o;
        return kind == that.kind && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind.prefix() + "=" + value;
    }
}
