package selfheal.model;

/**
 * The fixed set of resolution strategies, declared in priority order
 * (highest first).
 */
public enum StrategyName {

    EXACT_MATCH("exact-match"),
    TEXT_CONTENT("text-content"),
    ATTRIBUTE_SIMILARITY("attribute-similarity"),
    NEARBY_ELEMENT("nearby-element"),
    POSITION("position"),
    VISUAL_SIMILARITY("visual-similarity");

    private final String label;

    StrategyName(String label) {
        this.label = label;
    }

    /** Short label used in log lines and reports. */
    public String label() {
        return label;
    }
}
