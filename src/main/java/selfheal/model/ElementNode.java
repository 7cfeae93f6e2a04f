package selfheal.model;

import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One candidate DOM / UI node inside an {@link ElementSnapshot}.
 *
 * <p>Nodes are immutable. Their position in the snapshot's node list is the
 * document order; {@link #getParentIndex()} points at the parent's position
 * ({@code -1} for a root).
 */
public final class ElementNode {

    private final String tag;
    private final String id;
    private final Set<String> classList;
    private final Map<String, String> attributes;
    private final String text;
    private final BoundingBox boundingBox;
    private final BufferedImage screenshotRegion;
    private final int parentIndex;

    private ElementNode(Builder b) {
        this.tag              = b.tag == null ? "" : b.tag.toLowerCase(Locale.ROOT);
        this.id               = b.id == null ? "" : b.id;
        this.classList        = Collections.unmodifiableSet(new LinkedHashSet<>(b.classList));
        this.attributes       = Collections.unmodifiableMap(new LinkedHashMap<>(b.attributes));
        this.text             = b.text == null ? "" : b.text;
        this.boundingBox      = b.boundingBox;
        this.screenshotRegion = b.screenshotRegion;
        this.parentIndex      = b.parentIndex;
    }

    public static Builder builder(String tag) {
        return new Builder(tag);
    }

    public String              getTag()         { return tag; }
    public String              getId()          { return id; }
    public Set<String>         getClassList()   { return classList; }
    public Map<String, String> getAttributes()  { return attributes; }
    public String              getText()        { return text; }
    public BoundingBox         getBoundingBox() { return boundingBox; }
    public int                 getParentIndex() { return parentIndex; }

    public Optional<BufferedImage> getScreenshotRegion() {
        return Optional.ofNullable(screenshotRegion);
    }

    /** The {@code name} attribute, or empty string. */
    public String getName() {
        return attributes.getOrDefault("name", "");
    }

    /**
     * Attribute lookup that also answers {@code id} and {@code class}
     * from the dedicated fields.
     */
    public String attribute(String name) {
        if ("id".equals(name)) return id.isEmpty() ? null : id;
        if ("class".equals(name)) return classList.isEmpty() ? null : String.join(" ", classList);
        return attributes.get(name);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("<").append(tag);
        if (!id.isEmpty()) sb.append(" id='").append(id).append('\'');
        if (!classList.isEmpty()) sb.append(" class='").append(String.join(" ", classList)).append('\'');
        sb.append('>');
        if (!text.isEmpty()) {
            sb.append(text.length() > 40 ? text.substring(0, 40) + "..." : text);
        }
        return sb.toString();
    }

    // ── Builder ───────────────────────────────────────────────────────────

    public static final class Builder {
        private final String tag;
        private String id;
        private final Set<String> classList = new LinkedHashSet<>();
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private String text;
        private BoundingBox boundingBox;
        private BufferedImage screenshotRegion;
        private int parentIndex = -1;

        private Builder(String tag) {
            this.tag = tag;
        }

        public Builder id(String id)                   { this.id = id; return this; }
        public Builder text(String text)               { this.text = text; return this; }
        public Builder box(BoundingBox box)            { this.boundingBox = box; return this; }
        public Builder box(double x, double y, double w, double h) {
            this.boundingBox = new BoundingBox(x, y, w, h);
            return this;
        }
        public Builder screenshot(BufferedImage image) { this.screenshotRegion = image; return this; }
        public Builder parent(int parentIndex)         { this.parentIndex = parentIndex; return this; }

        /** Adds whitespace-separated class tokens. */
        public Builder classes(String classes) {
            if (classes != null) {
                for (String token : classes.trim().split("\\s+")) {
                    if (!token.isEmpty()) classList.add(token);
                }
            }
            return this;
        }

        public Builder attr(String name, String value) {
            if (name == null || value == null) return this;
            switch (name) {
                case "id":
                    this.id = value;
                    break;
                case "class":
                    classes(value);
                    break;
                default:
                    attributes.put(name, value);
            }
            return this;
        }

        public ElementNode build() {
            return new ElementNode(this);
        }
    }
}
