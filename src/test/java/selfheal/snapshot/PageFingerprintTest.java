package selfheal.snapshot;

import selfheal.model.ElementNode;
import selfheal.model.ElementSnapshot;
import selfheal.support.SnapshotFixtures;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class PageFingerprintTest {

    @Test
    public void of_ignoresQueryAndFragment() {
        ElementSnapshot page = SnapshotFixtures.loginPage();

        assertThat(PageFingerprint.of("https://x.test/login?next=/home#top", "Sign in", page))
                .isEqualTo(PageFingerprint.of("https://x.test/login", "Sign in", page));
    }

    @Test
    public void of_differentTitle_differs() {
        ElementSnapshot page = SnapshotFixtures.loginPage();

        assertThat(PageFingerprint.of("https://x.test/login", "Sign in", page))
                .isNotEqualTo(PageFingerprint.of("https://x.test/login", "Register", page));
    }

    @Test
    public void of_attributeChangeKeepsFingerprint_structureChangeDoesNot() {
        ElementSnapshot before = SnapshotFixtures.loginPage("submit");
        ElementSnapshot renamed = SnapshotFixtures.loginPage("send");

        List<ElementNode> nodes = new ArrayList<>(before.getNodes());
        nodes.add(ElementNode.builder("div").parent(0).build());
        ElementSnapshot extended = new ElementSnapshot(before.getUrl(), before.getTitle(), nodes);

        assertThat(PageFingerprint.of(renamed)).isEqualTo(PageFingerprint.of(before));
        assertThat(PageFingerprint.of(extended)).isNotEqualTo(PageFingerprint.of(before));
    }

    @Test
    public void ofContext_dependsOnUrlAndTitleOnly() {
        assertThat(PageFingerprint.ofContext("https://x.test/a?q=1", "A"))
                .isEqualTo(PageFingerprint.ofContext("https://x.test/a", " A "))
                .hasSize(64);
    }

    @Test
    public void stripQuery_cutsAtFirstQueryOrFragment() {
        assertThat(PageFingerprint.stripQuery("https://x/a?b=1#c")).isEqualTo("https://x/a");
        assertThat(PageFingerprint.stripQuery("https://x/a#c?b")).isEqualTo("https://x/a");
        assertThat(PageFingerprint.stripQuery(null)).isEmpty();
    }
}
