package selfheal.strategy;

import selfheal.model.ElementNode;
import selfheal.model.ElementProfile;
import selfheal.model.ElementSnapshot;
import selfheal.model.Locator;
import selfheal.model.NodeHandle;
import selfheal.model.StrategyName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Optional;

/**
 * Uses a stable anchor element the target is known to sit next to. When
 * the anchor still resolves, its descendants and its siblings' subtrees
 * within {@code radius} tree edges are searched for a node with the
 * remembered tag that shares at least one remembered class. The closest one
 * wins (document order on ties); confidence is fixed.
 */
public class NearbyElementStrategy implements HealingStrategy {

    private static final Logger log = LoggerFactory.getLogger(NearbyElementStrategy.class);

    private final int radius;
    private final double confidence;

    public NearbyElementStrategy(int radius, double confidence) {
        this.radius     = radius;
        this.confidence = confidence;
    }

    @Override
    public StrategyName name() {
        return StrategyName.NEARBY_ELEMENT;
    }

    @Override
    public Optional<StrategyMatch> attempt(HealingContext context) {
        ElementProfile profile = context.profile();
        Optional<Locator> anchor = profile.getAnchor();
        if (anchor.isEmpty()) {
            return Optional.empty();
        }
        if (profile.getTag().isEmpty() && profile.getClasses().isEmpty()) {
            log.debug("[nearby-element] no tag or class known for {}", context.original());
            return Optional.empty();
        }
        Optional<NodeHandle> anchorHandle = context.resolve(anchor.get());
        if (anchorHandle.isEmpty()) {
            log.debug("[nearby-element] anchor {} no longer resolves", anchor.get());
            return Optional.empty();
        }

        ElementSnapshot snapshot = context.snapshot();
        int anchorIndex = anchorHandle.get().index();
        int scope = snapshot.node(anchorIndex).getParentIndex();
        int best = -1;
        int bestDistance = Integer.MAX_VALUE;
        for (int i = 0; i < snapshot.size(); i++) {
            if (i == anchorIndex) continue;
            boolean inScope = isWithin(i, anchorIndex, snapshot) || (scope >= 0 && isWithin(i, scope, snapshot));
            if (!inScope) continue;
            int distance = snapshot.domDistance(anchorIndex, i);
            if (distance < 1 || distance > radius) continue;
            if (!looksLike(snapshot.node(i), profile)) continue;
            if (distance < bestDistance) {
                best = i;
                bestDistance = distance;
            }
        }
        if (best < 0) {
            log.debug("[nearby-element] nothing matching {} within {} of anchor {}", profile.getTag(), radius, anchor.get());
            return Optional.empty();
        }
        NodeHandle handle = snapshot.handle(best);
        return Optional.of(new StrategyMatch(StrategyName.NEARBY_ELEMENT, handle,
                LocatorSynthesizer.synthesize(handle, snapshot), confidence));
    }

    /** True if {@code index} is a proper descendant of {@code ancestor}. */
    private static boolean isWithin(int index, int ancestor, ElementSnapshot snapshot) {
        for (int a = snapshot.node(index).getParentIndex(); a >= 0; a = snapshot.node(a).getParentIndex()) {
            if (a == ancestor) return true;
        }
        return false;
    }

    private static boolean looksLike(ElementNode node, ElementProfile profile) {
        if (!profile.getTag().isEmpty() && !node.getTag().equals(profile.getTag())) return false;
        return profile.getClasses().isEmpty() || !Collections.disjoint(node.getClassList(), profile.getClasses());
    }
}
