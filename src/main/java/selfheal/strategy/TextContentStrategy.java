package selfheal.strategy;

import selfheal.model.ElementNode;
import selfheal.model.ElementSnapshot;
import selfheal.model.Locator;
import selfheal.model.LocatorKind;
import selfheal.model.NodeHandle;
import selfheal.model.StrategyName;
import selfheal.snapshot.SnapshotMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the element by its visible text.
 *
 * <p>The text hint is the element's last known text. When none is known and
 * hint derivation is enabled, words taken from an id / name / class locator
 * value are used instead ({@code id=submit-btn} hints "submit"); derived
 * hints never score above the partial confidence.
 *
 * <p>A node whose normalised text equals the hint (ignoring case) scores
 * {@code exactConfidence}; one whose text contains it scores
 * {@code partialConfidence}. Only the innermost matching nodes count, so a
 * form does not compete with the button inside it. Within the best tier the
 * node whose id / name / class is closest (normalised Levenshtein) to the
 * original locator value wins; remaining ties go to document order.
 */
public class TextContentStrategy implements HealingStrategy {

    private static final Logger log = LoggerFactory.getLogger(TextContentStrategy.class);

    private final double exactConfidence;
    private final double partialConfidence;
    private final boolean deriveHints;

    public TextContentStrategy(double exactConfidence, double partialConfidence, boolean deriveHints) {
        this.exactConfidence   = exactConfidence;
        this.partialConfidence = partialConfidence;
        this.deriveHints       = deriveHints;
    }

    @Override
    public StrategyName name() {
        return StrategyName.TEXT_CONTENT;
    }

    @Override
    public Optional<StrategyMatch> attempt(HealingContext context) {
        String remembered = SnapshotMatcher.normalizeText(context.profile().getText());
        List<String> hints = new ArrayList<>();
        boolean derived = false;
        if (!remembered.isEmpty()) {
            hints.add(remembered.toLowerCase(Locale.ROOT));
        } else if (deriveHints && isAttributeStyle(context.original().getKind())) {
            hints.addAll(LocatorProfiles.hintWords(context.original().getValue()));
            derived = true;
        }
        if (hints.isEmpty()) {
            log.debug("[text-content] no text hint for {}", context.original());
            return Optional.empty();
        }

        ElementSnapshot snapshot = context.snapshot();
        double[] scores = new double[snapshot.size()];
        List<Integer> matched = new ArrayList<>();
        for (int i = 0; i < snapshot.size(); i++) {
            String text = SnapshotMatcher.normalizeText(snapshot.node(i).getText()).toLowerCase(Locale.ROOT);
            if (text.isEmpty()) continue;
            double score = 0.0;
            for (String hint : hints) {
                if (text.equals(hint)) {
                    score = Math.max(score, derived ? partialConfidence : exactConfidence);
                } else if (text.contains(hint)) {
                    score = Math.max(score, partialConfidence);
                }
            }
            if (score > 0.0) {
                scores[i] = score;
                matched.add(i);
            }
        }
        if (matched.isEmpty()) {
            log.debug("[text-content] no node text matches {}", hints);
            return Optional.empty();
        }

        String originalValue = context.original().getValue().toLowerCase(Locale.ROOT);
        int best = -1;
        double bestDistance = Double.MAX_VALUE;
        for (int i : innermost(matched, snapshot)) {
            double distance = attributeDistance(snapshot.node(i), originalValue);
            if (best < 0 || scores[i] > scores[best]
                    || (scores[i] == scores[best] && distance < bestDistance)) {
                best = i;
                bestDistance = distance;
            }
        }

        NodeHandle handle = snapshot.handle(best);
        Locator healed = LocatorSynthesizer.synthesize(handle, snapshot);
        return Optional.of(new StrategyMatch(StrategyName.TEXT_CONTENT, handle, healed, scores[best]));
    }

    private static boolean isAttributeStyle(LocatorKind kind) {
        return kind == LocatorKind.ID || kind == LocatorKind.NAME || kind == LocatorKind.CLASS_NAME
                || kind == LocatorKind.CSS;
    }

    /** Drops every matched node that is an ancestor of another matched node. */
    private static List<Integer> innermost(List<Integer> matched, ElementSnapshot snapshot) {
        Set<Integer> ancestors = new HashSet<>();
        for (int i : matched) {
            for (int a = snapshot.node(i).getParentIndex(); a >= 0; a = snapshot.node(a).getParentIndex()) {
                ancestors.add(a);
            }
        }
        List<Integer> out = new ArrayList<>();
        for (int i : matched) {
            if (!ancestors.contains(i)) out.add(i);
        }
        return out;
    }

    /** Smallest normalised edit distance between the original value and the node's id, name or classes. */
    private static double attributeDistance(ElementNode node, String originalValue) {
        double best = 1.0;
        List<String> values = new ArrayList<>();
        values.add(node.getId());
        values.add(node.getName());
        values.addAll(node.getClassList());
        for (String v : values) {
            if (v == null || v.isEmpty()) continue;
            best = Math.min(best, TextSimilarity.normalizedDistance(originalValue, v.toLowerCase(Locale.ROOT)));
        }
        return best;
    }
}
