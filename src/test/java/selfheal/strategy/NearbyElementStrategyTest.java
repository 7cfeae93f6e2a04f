package selfheal.strategy;

import selfheal.model.ElementNode;
import selfheal.model.ElementProfile;
import selfheal.model.ElementSnapshot;
import selfheal.model.Locator;
import selfheal.model.StrategyName;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

public class NearbyElementStrategyTest {

    private static final Locator ANCHOR = Locator.id("shipping");

    private final NearbyElementStrategy strategy = new NearbyElementStrategy(3, 0.6);

    /**
     * <pre>
     * 0 body
     * 1   div#shipping           (anchor)
     * 2     label "City"
     * 3     input.field[name=city-new]     distance 1
     * 4   div.panel
     * 5     input.field                    distance 3
     * 6   section
     * 7     div
     * 8       div
     * 9         input.field                distance 5
     * </pre>
     */
    private static List<ElementNode> nodes() {
        List<ElementNode> nodes = new ArrayList<>();
        nodes.add(ElementNode.builder("body").build());
        nodes.add(ElementNode.builder("div").id("shipping").parent(0).build());
        nodes.add(ElementNode.builder("label").text("City").parent(1).build());
        nodes.add(ElementNode.builder("input").classes("field").attr("name", "city-new").parent(1).build());
        nodes.add(ElementNode.builder("div").classes("panel").parent(0).build());
        nodes.add(ElementNode.builder("input").classes("field").attr("name", "zip").parent(4).build());
        nodes.add(ElementNode.builder("section").parent(0).build());
        nodes.add(ElementNode.builder("div").parent(6).build());
        nodes.add(ElementNode.builder("div").parent(7).build());
        nodes.add(ElementNode.builder("input").classes("field").attr("name", "far").parent(8).build());
        return nodes;
    }

    private static HealingContext context(ElementProfile profile, ElementSnapshot snapshot) {
        return new HealingContext(Locator.name("city"), profile, snapshot, () -> snapshot);
    }

    private static ElementProfile inputNearShipping() {
        return ElementProfile.empty().withTag("input").withClasses(Set.of("field")).withAnchor(ANCHOR);
    }

    @Test
    public void attempt_closestMatchingDescendantOfAnchor_wins() {
        ElementSnapshot snapshot = new ElementSnapshot("u", "t", nodes());

        Optional<StrategyMatch> match = strategy.attempt(context(inputNearShipping(), snapshot));

        assertThat(match).isPresent();
        assertThat(match.get().strategy()).isEqualTo(StrategyName.NEARBY_ELEMENT);
        assertThat(match.get().node().index()).isEqualTo(3);
        assertThat(match.get().locator()).isEqualTo(Locator.name("city-new"));
        assertThat(match.get().confidence()).isEqualTo(0.6);
    }

    @Test
    public void attempt_searchesSiblingSubtreesWithinRadius() {
        List<ElementNode> nodes = nodes();
        // the input inside the anchor is gone: keep a plain label in its place
        nodes.set(3, ElementNode.builder("label").parent(1).build());
        ElementSnapshot snapshot = new ElementSnapshot("u", "t", nodes);

        Optional<StrategyMatch> match = strategy.attempt(context(inputNearShipping(), snapshot));

        assertThat(match).get().extracting(m -> m.node().index()).isEqualTo(5);
    }

    @Test
    public void attempt_candidatesBeyondRadius_returnEmpty() {
        List<ElementNode> nodes = nodes();
        nodes.set(3, ElementNode.builder("label").parent(1).build());
        ElementSnapshot snapshot = new ElementSnapshot("u", "t", nodes);
        NearbyElementStrategy tight = new NearbyElementStrategy(2, 0.6);

        assertThat(tight.attempt(context(inputNearShipping(), snapshot))).isEmpty();
    }

    @Test
    public void attempt_anchorMissing_returnsEmpty() {
        ElementSnapshot snapshot = new ElementSnapshot("u", "t", nodes());
        ElementProfile profile = inputNearShipping().withAnchor(Locator.id("billing"));

        assertThat(strategy.attempt(context(profile, snapshot))).isEmpty();
    }

    @Test
    public void attempt_noAnchorKnown_returnsEmpty() {
        ElementSnapshot snapshot = new ElementSnapshot("u", "t", nodes());
        ElementProfile profile = ElementProfile.empty().withTag("input");

        assertThat(strategy.attempt(context(profile, snapshot))).isEmpty();
    }

    @Test
    public void attempt_noTagOrClassKnown_returnsEmpty() {
        ElementSnapshot snapshot = new ElementSnapshot("u", "t", nodes());
        ElementProfile profile = ElementProfile.empty().withAnchor(ANCHOR);

        assertThat(strategy.attempt(context(profile, snapshot))).isEmpty();
    }
}
