package selfheal.strategy;

import selfheal.model.ElementNode;
import selfheal.model.ElementSnapshot;
import selfheal.model.Locator;
import selfheal.model.NodeHandle;
import selfheal.snapshot.SnapshotMatcher;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds a replacement locator for a node chosen by a strategy.
 *
 * <p>Candidates are tried from most to least stable; the first one that
 * resolves to exactly this node in the snapshot wins:
 * <ol>
 *   <li>{@code id=...}</li>
 *   <li>{@code name=...}</li>
 *   <li>{@code css=tag.cls1.cls2}</li>
 *   <li>{@code css=tag[attr='v']} for data-testid, data-test, aria-label, type, role</li>
 *   <li>{@code xpath=//tag[normalize-space()='text']}</li>
 *   <li>{@code xpath=(//tag)[n]}, unique by construction</li>
 * </ol>
 */
public final class LocatorSynthesizer {

    private static final List<String> STABLE_ATTRIBUTES =
            List.of("data-testid", "data-test", "aria-label", "type", "role");

    private static final Pattern CSS_IDENT = Pattern.compile("[A-Za-z_-][\\w-]*");

    private LocatorSynthesizer() {}

    public static Locator synthesize(NodeHandle handle, ElementSnapshot snapshot) {
        ElementNode node = handle.node();
        String tag = node.getTag().isEmpty() ? "*" : node.getTag();

        if (!node.getId().isEmpty()) {
            Locator byId = Locator.id(node.getId());
            if (isUnique(byId, handle, snapshot)) return byId;
        }
        if (!node.getName().isEmpty()) {
            Locator byName = Locator.name(node.getName());
            if (isUnique(byName, handle, snapshot)) return byName;
        }
        if (!node.getClassList().isEmpty() && !"*".equals(tag)
                && node.getClassList().stream().allMatch(c -> CSS_IDENT.matcher(c).matches())) {
            Locator byClass = Locator.css(tag + "." + String.join(".", node.getClassList()));
            if (isUnique(byClass, handle, snapshot)) return byClass;
        }
        for (String attr : STABLE_ATTRIBUTES) {
            String value = node.getAttributes().get(attr);
            if (value == null || value.isEmpty() || value.contains("'")) continue;
            Locator byAttr = Locator.css(("*".equals(tag) ? "" : tag) + "[" + attr + "='" + value + "']");
            if (isUnique(byAttr, handle, snapshot)) return byAttr;
        }
        String text = SnapshotMatcher.normalizeText(node.getText());
        if (!text.isEmpty() && !text.contains("'")) {
            Locator byText = Locator.xpath("//" + tag + "[normalize-space()='" + text + "']");
            if (isUnique(byText, handle, snapshot)) return byText;
        }
        return Locator.xpath("(//" + tag + ")[" + positionAmongTag(handle, snapshot) + "]");
    }

    private static boolean isUnique(Locator locator, NodeHandle handle, ElementSnapshot snapshot) {
        List<NodeHandle> found = SnapshotMatcher.findAll(locator, snapshot);
        return found.size() == 1 && found.get(0).index() == handle.index();
    }

    /** 1-based position of the node among nodes with the same tag, in document order. */
    private static int positionAmongTag(NodeHandle handle, ElementSnapshot snapshot) {
        String tag = handle.node().getTag();
        int position = 0;
        for (int i = 0; i <= handle.index(); i++) {
            if (tag.isEmpty() || snapshot.node(i).getTag().equals(tag)) position++;
        }
        return position;
    }
}
