package selfheal.strategy;

import selfheal.model.ElementNode;
import selfheal.model.ElementProfile;
import selfheal.model.ElementSnapshot;
import selfheal.model.NodeHandle;
import selfheal.model.StrategyName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Scores every node by weighted Jaccard similarity between its
 * {id, name, class tokens, tag} and the element's last known attributes.
 * The highest score strictly above the threshold wins (document order on
 * ties) and becomes the confidence. A tag alone identifies nothing, so the
 * known attributes must include an id, a name or a class.
 */
public class AttributeSimilarityStrategy implements HealingStrategy {

    private static final Logger log = LoggerFactory.getLogger(AttributeSimilarityStrategy.class);

    static final double WEIGHT_ID    = 1.5;
    static final double WEIGHT_NAME  = 1.5;
    static final double WEIGHT_CLASS = 1.0;
    static final double WEIGHT_TAG   = 1.0;

    private final double threshold;

    public AttributeSimilarityStrategy(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public StrategyName name() {
        return StrategyName.ATTRIBUTE_SIMILARITY;
    }

    @Override
    public Optional<StrategyMatch> attempt(HealingContext context) {
        ElementProfile profile = context.profile();
        if (profile.getId().isEmpty() && profile.getName().isEmpty() && profile.getClasses().isEmpty()) {
            log.debug("[attribute-similarity] no id, name or class known for {}", context.original());
            return Optional.empty();
        }
        Map<String, Double> expected = features(profile.getTag(), profile.getId(), profile.getName(),
                profile.getClasses());

        ElementSnapshot snapshot = context.snapshot();
        int best = -1;
        double bestScore = 0.0;
        for (int i = 0; i < snapshot.size(); i++) {
            ElementNode node = snapshot.node(i);
            double score = weightedJaccard(expected,
                    features(node.getTag(), node.getId(), node.getName(), node.getClassList()));
            if (score > bestScore) {
                best = i;
                bestScore = score;
            }
        }
        if (best < 0 || bestScore <= threshold) {
            log.debug("[attribute-similarity] best score {} not above threshold {}",
                    String.format("%.3f", bestScore), threshold);
            return Optional.empty();
        }
        NodeHandle handle = snapshot.handle(best);
        return Optional.of(new StrategyMatch(StrategyName.ATTRIBUTE_SIMILARITY, handle,
                LocatorSynthesizer.synthesize(handle, snapshot), Math.min(1.0, bestScore)));
    }

    static Map<String, Double> features(String tag, String id, String name, Set<String> classes) {
        Map<String, Double> f = new HashMap<>();
        if (tag != null && !tag.isEmpty())   f.put("tag:" + tag.toLowerCase(), WEIGHT_TAG);
        if (id != null && !id.isEmpty())     f.put("id:" + id, WEIGHT_ID);
        if (name != null && !name.isEmpty()) f.put("name:" + name, WEIGHT_NAME);
        for (String c : classes) {
            f.put("class:" + c, WEIGHT_CLASS);
        }
        return f;
    }

    /** Sum of weights of shared features over sum of weights of all features. */
    static double weightedJaccard(Map<String, Double> a, Map<String, Double> b) {
        Set<String> union = new HashSet<>(a.keySet());
        union.addAll(b.keySet());
        if (union.isEmpty()) return 0.0;
        double shared = 0.0;
        double total = 0.0;
        for (String key : union) {
            double w = a.containsKey(key) ? a.get(key) : b.get(key);
            total += w;
            if (a.containsKey(key) && b.containsKey(key)) shared += w;
        }
        return shared / total;
    }
}
