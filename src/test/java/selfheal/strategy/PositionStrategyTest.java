package selfheal.strategy;

import selfheal.model.BoundingBox;
import selfheal.model.ElementNode;
import selfheal.model.ElementProfile;
import selfheal.model.ElementSnapshot;
import selfheal.model.Locator;
import selfheal.model.StrategyName;
import org.testng.annotations.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class PositionStrategyTest {

    private static final BoundingBox LAST_SEEN = new BoundingBox(100, 150, 80, 30);

    private final PositionStrategy strategy = new PositionStrategy(150);

    private static HealingContext context(ElementProfile profile, ElementSnapshot snapshot) {
        return new HealingContext(Locator.id("gone"), profile, snapshot, () -> snapshot);
    }

    @Test
    public void attempt_sameSpot_returnsNearConfidence() {
        ElementSnapshot snapshot = ElementSnapshot.of(
                ElementNode.builder("button").id("far").box(600, 500, 80, 30).build(),
                ElementNode.builder("button").id("here").box(100, 150, 80, 30).build());

        Optional<StrategyMatch> match = strategy.attempt(
                context(ElementProfile.empty().withBoundingBox(LAST_SEEN), snapshot));

        assertThat(match).isPresent();
        assertThat(match.get().strategy()).isEqualTo(StrategyName.POSITION);
        assertThat(match.get().locator()).isEqualTo(Locator.id("here"));
        assertThat(match.get().confidence()).isCloseTo(0.7, within(1e-9));
    }

    @Test
    public void attempt_halfwayToLimit_decaysLinearly() {
        ElementSnapshot snapshot = ElementSnapshot.of(
                ElementNode.builder("button").id("moved").box(175, 150, 80, 30).build());

        Optional<StrategyMatch> match = strategy.attempt(
                context(ElementProfile.empty().withBoundingBox(LAST_SEEN), snapshot));

        assertThat(match).isPresent();
        assertThat(match.get().confidence()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    public void attempt_beyondLimit_returnsEmpty() {
        ElementSnapshot snapshot = ElementSnapshot.of(
                ElementNode.builder("button").box(251, 150, 80, 30).build());

        assertThat(strategy.attempt(context(ElementProfile.empty().withBoundingBox(LAST_SEEN), snapshot)))
                .isEmpty();
    }

    @Test
    public void attempt_knownTag_ignoresOtherTags() {
        ElementSnapshot snapshot = ElementSnapshot.of(
                ElementNode.builder("div").id("overlay").box(100, 150, 80, 30).build(),
                ElementNode.builder("button").id("btn").box(120, 160, 80, 30).build());
        ElementProfile profile = ElementProfile.empty().withTag("button").withBoundingBox(LAST_SEEN);

        assertThat(strategy.attempt(context(profile, snapshot)))
                .get().extracting(StrategyMatch::locator).isEqualTo(Locator.id("btn"));
    }

    @Test
    public void attempt_noLastKnownBox_returnsEmpty() {
        ElementSnapshot snapshot = ElementSnapshot.of(ElementNode.builder("button").box(100, 150, 80, 30).build());

        assertThat(strategy.attempt(context(ElementProfile.empty(), snapshot))).isEmpty();
    }

    @Test
    public void confidenceAt_endpoints() {
        assertThat(strategy.confidenceAt(0)).isCloseTo(0.7, within(1e-9));
        assertThat(strategy.confidenceAt(150)).isCloseTo(0.3, within(1e-9));
    }
}
