package selfheal.strategy;

import selfheal.model.BoundingBox;
import selfheal.model.ElementNode;
import selfheal.model.ElementProfile;
import selfheal.model.ElementSnapshot;
import selfheal.model.NodeHandle;
import selfheal.model.StrategyName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Picks the node whose box centre is closest to where the element was last
 * seen. Only nodes within {@code maxDistancePx} qualify; when the last known
 * tag is known, only nodes with that tag are considered.
 *
 * <p>Confidence falls linearly from {@link #NEAR_CONFIDENCE} at distance 0
 * to {@link #FAR_CONFIDENCE} at the distance limit.
 */
public class PositionStrategy implements HealingStrategy {

    private static final Logger log = LoggerFactory.getLogger(PositionStrategy.class);

    static final double NEAR_CONFIDENCE = 0.7;
    static final double FAR_CONFIDENCE  = 0.3;

    private final double maxDistancePx;

    public PositionStrategy(double maxDistancePx) {
        this.maxDistancePx = maxDistancePx;
    }

    @Override
    public StrategyName name() {
        return StrategyName.POSITION;
    }

    @Override
    public Optional<StrategyMatch> attempt(HealingContext context) {
        ElementProfile profile = context.profile();
        Optional<BoundingBox> lastBox = profile.getBoundingBox();
        if (lastBox.isEmpty()) {
            return Optional.empty();
        }

        ElementSnapshot snapshot = context.snapshot();
        int best = -1;
        double bestDistance = Double.MAX_VALUE;
        for (int i = 0; i < snapshot.size(); i++) {
            ElementNode node = snapshot.node(i);
            if (node.getBoundingBox() == null) continue;
            if (!profile.getTag().isEmpty() && !node.getTag().equals(profile.getTag())) continue;
            double distance = node.getBoundingBox().centerDistanceTo(lastBox.get());
            if (distance <= maxDistancePx && distance < bestDistance) {
                best = i;
                bestDistance = distance;
            }
        }
        if (best < 0) {
            log.debug("[position] no node within {}px of {}", maxDistancePx, lastBox.get());
            return Optional.empty();
        }
        NodeHandle handle = snapshot.handle(best);
        return Optional.of(new StrategyMatch(StrategyName.POSITION, handle,
                LocatorSynthesizer.synthesize(handle, snapshot), confidenceAt(bestDistance)));
    }

    double confidenceAt(double distance) {
        if (maxDistancePx <= 0) return NEAR_CONFIDENCE;
        double ratio = Math.min(1.0, distance / maxDistancePx);
        return NEAR_CONFIDENCE - (NEAR_CONFIDENCE - FAR_CONFIDENCE) * ratio;
    }
}
