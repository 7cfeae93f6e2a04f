package selfheal.strategy;

import selfheal.model.ElementNode;
import selfheal.model.ElementProfile;
import selfheal.model.ElementSnapshot;
import selfheal.model.Locator;
import selfheal.model.StrategyName;
import selfheal.support.SnapshotFixtures;
import org.testng.annotations.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class TextContentStrategyTest {

    private final TextContentStrategy strategy = new TextContentStrategy(0.95, 0.75, true);

    private static HealingContext context(Locator original, ElementProfile profile, ElementSnapshot snapshot) {
        return new HealingContext(original, profile, snapshot, () -> snapshot);
    }

    @Test
    public void attempt_rememberedTextEqual_returnsExactConfidence() {
        ElementSnapshot page = SnapshotFixtures.loginPage();
        Locator original = Locator.id("old-button-id");
        ElementProfile profile = LocatorProfiles.derive(original).withText("Submit");

        Optional<StrategyMatch> match = strategy.attempt(context(original, profile, page));

        assertThat(match).isPresent();
        assertThat(match.get().strategy()).isEqualTo(StrategyName.TEXT_CONTENT);
        assertThat(match.get().node().index()).isEqualTo(4);
        assertThat(match.get().locator()).isEqualTo(Locator.id("submit"));
        assertThat(match.get().confidence()).isEqualTo(0.95);
    }

    @Test
    public void attempt_textComparisonIgnoresCase() {
        ElementSnapshot page = SnapshotFixtures.loginPage();
        Locator original = Locator.id("gone");

        Optional<StrategyMatch> match = strategy.attempt(
                context(original, ElementProfile.empty().withText("SUBMIT"), page));

        assertThat(match).isPresent();
        assertThat(match.get().confidence()).isEqualTo(0.95);
    }

    @Test
    public void attempt_rememberedTextContained_returnsPartialConfidence() {
        ElementSnapshot page = SnapshotFixtures.loginPage();
        Locator original = Locator.css("a.reset-link");

        Optional<StrategyMatch> match = strategy.attempt(
                context(original, ElementProfile.empty().withText("Forgot"), page));

        assertThat(match).isPresent();
        assertThat(match.get().node().index()).isEqualTo(5);
        assertThat(match.get().locator()).isEqualTo(Locator.css("a.link"));
        assertThat(match.get().confidence()).isEqualTo(0.75);
    }

    @Test
    public void attempt_outerContainerWithSameText_isIgnored() {
        // form text "Username Submit" also contains "submit"; the button inside it wins
        ElementSnapshot page = SnapshotFixtures.loginPage();

        Optional<StrategyMatch> match = strategy.attempt(
                context(Locator.id("x"), ElementProfile.empty().withText("Submit"), page));

        assertThat(match).get().extracting(m -> m.node().index()).isEqualTo(4);
    }

    @Test
    public void attempt_noRememberedText_derivesHintFromIdWords() {
        ElementSnapshot page = SnapshotFixtures.loginPage();
        Locator original = Locator.id("old-submit-button");

        Optional<StrategyMatch> match = strategy.attempt(
                context(original, LocatorProfiles.derive(original), page));

        assertThat(match).isPresent();
        assertThat(match.get().node().index()).isEqualTo(4);
        // derived hints never claim an exact text match
        assertThat(match.get().confidence()).isEqualTo(0.75);
    }

    @Test
    public void attempt_hintDerivationDisabled_returnsEmpty() {
        ElementSnapshot page = SnapshotFixtures.loginPage();
        Locator original = Locator.id("old-submit-button");
        TextContentStrategy noHints = new TextContentStrategy(0.95, 0.75, false);

        assertThat(noHints.attempt(context(original, LocatorProfiles.derive(original), page))).isEmpty();
    }

    @Test
    public void attempt_noNodeWithText_returnsEmpty() {
        ElementSnapshot page = SnapshotFixtures.loginPage();

        assertThat(strategy.attempt(context(Locator.id("x"), ElementProfile.empty().withText("Checkout"), page)))
                .isEmpty();
    }

    @Test
    public void attempt_equalText_prefersAttributeClosestToOriginal() {
        ElementSnapshot snapshot = ElementSnapshot.of(
                ElementNode.builder("button").id("save-draft").text("Save").build(),
                ElementNode.builder("button").id("save-final").text("Save").build());

        Optional<StrategyMatch> match = strategy.attempt(
                context(Locator.id("save-finl"), ElementProfile.empty().withText("Save"), snapshot));

        assertThat(match).get().extracting(StrategyMatch::locator).isEqualTo(Locator.id("save-final"));
    }

    @Test
    public void attempt_fullTie_goesToDocumentOrder() {
        ElementSnapshot snapshot = ElementSnapshot.of(
                ElementNode.builder("span").text("OK").build(),
                ElementNode.builder("span").text("OK").build());

        Optional<StrategyMatch> match = strategy.attempt(
                context(Locator.id("ok"), ElementProfile.empty().withText("OK"), snapshot));

        assertThat(match).get().extracting(m -> m.node().index()).isEqualTo(0);
    }
}
