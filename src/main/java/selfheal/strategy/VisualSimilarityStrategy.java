package selfheal.strategy;

import selfheal.model.ElementNode;
import selfheal.model.ElementSnapshot;
import selfheal.model.NodeHandle;
import selfheal.model.StrategyName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * Compares the element's last known screenshot crop with each node's crop
 * and picks the most similar one strictly above the threshold. Lowest priority:
 * it is the most expensive strategy and only runs when the structural ones
 * found nothing.
 */
public class VisualSimilarityStrategy implements HealingStrategy {

    private static final Logger log = LoggerFactory.getLogger(VisualSimilarityStrategy.class);

    private final ImageSimilarity similarity;
    private final double threshold;

    public VisualSimilarityStrategy(ImageSimilarity similarity, double threshold) {
        this.similarity = similarity;
        this.threshold  = threshold;
    }

    @Override
    public StrategyName name() {
        return StrategyName.VISUAL_SIMILARITY;
    }

    @Override
    public Optional<StrategyMatch> attempt(HealingContext context) {
        Optional<BufferedImage> reference = context.profile().getScreenshotRegion();
        if (reference.isEmpty()) {
            return Optional.empty();
        }

        ElementSnapshot snapshot = context.snapshot();
        int best = -1;
        double bestScore = 0.0;
        for (int i = 0; i < snapshot.size(); i++) {
            ElementNode node = snapshot.node(i);
            Optional<BufferedImage> region = node.getScreenshotRegion();
            if (region.isEmpty()) continue;
            double score = similarity.similarity(reference.get(), region.get());
            if (score > bestScore) {
                best = i;
                bestScore = score;
            }
        }
        if (best < 0 || bestScore <= threshold) {
            log.debug("[visual-similarity] best score {} not above threshold {}",
                    String.format("%.3f", bestScore), threshold);
            return Optional.empty();
        }
        NodeHandle handle = snapshot.handle(best);
        return Optional.of(new StrategyMatch(StrategyName.VISUAL_SIMILARITY, handle,
                LocatorSynthesizer.synthesize(handle, snapshot), Math.min(1.0, bestScore)));
    }
}
