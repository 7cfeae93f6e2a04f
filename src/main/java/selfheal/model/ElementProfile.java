package selfheal.model;

import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * What is remembered about the element behind an original locator: its
 * last known text, identifying attributes, position, appearance and an
 * optional anchor element it sits next to.
 *
 * <p>Strategies read profiles; only the orchestrator and callers registering
 * hints write them. Instances are immutable; the {@code with*} methods
 * return copies.
 */
public final class ElementProfile {

    private static final ElementProfile EMPTY =
            new ElementProfile("", "", "", "", Set.of(), null, null, null);

    private final String text;
    private final String tag;
    private final String id;
    private final String name;
    private final Set<String> classes;
    private final BoundingBox boundingBox;
    private final BufferedImage screenshotRegion;
    private final Locator anchor;

    private ElementProfile(String text, String tag, String id, String name, Set<String> classes,
                           BoundingBox boundingBox, BufferedImage screenshotRegion, Locator anchor) {
        this.text             = text == null ? "" : text;
        this.tag              = tag == null ? "" : tag.toLowerCase(Locale.ROOT);
        this.id               = id == null ? "" : id;
        this.name             = name == null ? "" : name;
        this.classes          = Collections.unmodifiableSet(new LinkedHashSet<>(classes));
        this.boundingBox      = boundingBox;
        this.screenshotRegion = screenshotRegion;
        this.anchor           = anchor;
    }

    public static ElementProfile empty() {
        return EMPTY;
    }

    /** Captures everything a node exposes; the anchor is left unset. */
    public static ElementProfile fromNode(ElementNode node) {
        return new ElementProfile(
                node.getText().trim(),
                node.getTag(),
                node.getId(),
                node.getName(),
                node.getClassList(),
                node.getBoundingBox(),
                node.getScreenshotRegion().orElse(null),
                null);
    }

    /**
     * Refreshes this profile from a freshly resolved node. Values the node
     * does not carry (blank text, missing box or image) keep their previous
     * value, and the anchor is preserved.
     */
    public ElementProfile refreshedFrom(ElementNode node) {
        String nodeText = node.getText().trim();
        return new ElementProfile(
                nodeText.isEmpty() ? text : nodeText,
                node.getTag(),
                node.getId(),
                node.getName(),
                node.getClassList(),
                node.getBoundingBox() != null ? node.getBoundingBox() : boundingBox,
                node.getScreenshotRegion().orElse(screenshotRegion),
                anchor);
    }

    public ElementProfile withText(String newText) {
        return new ElementProfile(newText, tag, id, name, classes, boundingBox, screenshotRegion, anchor);
    }

    public ElementProfile withTag(String newTag) {
        return new ElementProfile(text, newTag, id, name, classes, boundingBox, screenshotRegion, anchor);
    }

    public ElementProfile withId(String newId) {
        return new ElementProfile(text, tag, newId, name, classes, boundingBox, screenshotRegion, anchor);
    }

    public ElementProfile withName(String newName) {
        return new ElementProfile(text, tag, id, newName, classes, boundingBox, screenshotRegion, anchor);
    }

    public ElementProfile withClasses(Set<String> newClasses) {
        return new ElementProfile(text, tag, id, name, newClasses, boundingBox, screenshotRegion, anchor);
    }

    public ElementProfile withBoundingBox(BoundingBox box) {
        return new ElementProfile(text, tag, id, name, classes, box, screenshotRegion, anchor);
    }

    public ElementProfile withScreenshotRegion(BufferedImage image) {
        return new ElementProfile(text, tag, id, name, classes, boundingBox, image, anchor);
    }

    public ElementProfile withAnchor(Locator newAnchor) {
        return new ElementProfile(text, tag, id, name, classes, boundingBox, screenshotRegion, newAnchor);
    }

    public String      getText()        { return text; }
    public String      getTag()         { return tag; }
    public String      getId()          { return id; }
    public String      getName()        { return name; }
    public Set<String> getClasses()     { return classes; }

    public Optional<BoundingBox>   getBoundingBox()      { return Optional.ofNullable(boundingBox); }
    public Optional<BufferedImage> getScreenshotRegion() { return Optional.ofNullable(screenshotRegion); }
    public Optional<Locator>       getAnchor()           { return Optional.ofNullable(anchor); }

    /** True if no attribute used for similarity scoring is known. */
    @Override
    public String toString() {
        return String.format("ElementProfile{tag='%s', id='%s', name='%s', classes=%s, text='%s', box=%s, anchor=%s}",
                tag, id, name, classes, text, boundingBox, anchor);
    }
}
