package selfheal.strategy;

import selfheal.model.ElementNode;
import selfheal.model.ElementSnapshot;
import selfheal.model.Locator;
import selfheal.snapshot.SnapshotMatcher;
import selfheal.support.SnapshotFixtures;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class LocatorSynthesizerTest {

    @Test
    public void synthesize_uniqueId_preferred() {
        ElementSnapshot page = SnapshotFixtures.loginPage();

        assertThat(LocatorSynthesizer.synthesize(page.handle(4), page)).isEqualTo(Locator.id("submit"));
    }

    @Test
    public void synthesize_noId_usesClassCss() {
        ElementSnapshot page = SnapshotFixtures.loginPage();

        assertThat(LocatorSynthesizer.synthesize(page.handle(5), page)).isEqualTo(Locator.css("a.link"));
    }

    @Test
    public void synthesize_duplicateId_fallsBackToName() {
        ElementSnapshot snapshot = ElementSnapshot.of(
                ElementNode.builder("input").id("dup").attr("name", "first").build(),
                ElementNode.builder("input").id("dup").attr("name", "second").build());

        assertThat(LocatorSynthesizer.synthesize(snapshot.handle(1), snapshot)).isEqualTo(Locator.name("second"));
    }

    @Test
    public void synthesize_stableAttribute_usedWhenClassesAreShared() {
        ElementSnapshot snapshot = ElementSnapshot.of(
                ElementNode.builder("button").classes("btn").attr("data-testid", "save").build(),
                ElementNode.builder("button").classes("btn").attr("data-testid", "cancel").build());

        assertThat(LocatorSynthesizer.synthesize(snapshot.handle(1), snapshot))
                .isEqualTo(Locator.css("button[data-testid='cancel']"));
    }

    @Test
    public void synthesize_onlyText_usesNormalizedTextXPath() {
        ElementSnapshot snapshot = ElementSnapshot.of(
                ElementNode.builder("span").text("Hello").build(),
                ElementNode.builder("span").text("World").build());

        assertThat(LocatorSynthesizer.synthesize(snapshot.handle(1), snapshot))
                .isEqualTo(Locator.xpath("//span[normalize-space()='World']"));
    }

    @Test
    public void synthesize_indistinguishable_usesGlobalPosition() {
        ElementSnapshot snapshot = ElementSnapshot.of(
                ElementNode.builder("div").build(),
                ElementNode.builder("p").build(),
                ElementNode.builder("div").build());

        Locator locator = LocatorSynthesizer.synthesize(snapshot.handle(2), snapshot);

        assertThat(locator).isEqualTo(Locator.xpath("(//div)[2]"));
        assertThat(SnapshotMatcher.resolve(locator, snapshot)).get()
                .extracting(h -> h.index()).isEqualTo(2);
    }
}
