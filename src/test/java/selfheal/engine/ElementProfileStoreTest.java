package selfheal.engine;

import selfheal.model.ElementNode;
import selfheal.model.ElementProfile;
import selfheal.model.Locator;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ElementProfileStoreTest {

    private final ElementProfileStore store = new ElementProfileStore();

    @Test
    public void profileFor_nothingStored_derivesFromLocator() {
        ElementProfile profile = store.profileFor(Locator.css("button#save.primary"));

        assertThat(profile.getTag()).isEqualTo("button");
        assertThat(profile.getId()).isEqualTo("save");
        assertThat(profile.getClasses()).containsExactly("primary");
        assertThat(store.stored(Locator.css("button#save.primary"))).isEmpty();
    }

    @Test
    public void rememberText_keepsWhatTheLocatorSays() {
        Locator original = Locator.id("old-button-id");

        store.rememberText(original, "Submit");

        ElementProfile profile = store.profileFor(original);
        assertThat(profile.getText()).isEqualTo("Submit");
        assertThat(profile.getId()).isEqualTo("old-button-id");
    }

    @Test
    public void refresh_replacesNodeStateButKeepsAnchor() {
        Locator original = Locator.id("email");
        Locator anchor = Locator.id("email-label");
        store.rememberAnchor(original, anchor);

        store.refresh(original, ElementNode.builder("input").id("email").attr("name", "mail")
                .box(10, 20, 100, 30).build());

        ElementProfile profile = store.profileFor(original);
        assertThat(profile.getName()).isEqualTo("mail");
        assertThat(profile.getBoundingBox()).isPresent();
        assertThat(profile.getAnchor()).contains(anchor);
    }

    @Test
    public void refresh_firstResolution_storesNodeProfile() {
        Locator original = Locator.id("submit");

        store.refresh(original, ElementNode.builder("button").id("submit").text("Go").build());

        assertThat(store.stored(original)).map(ElementProfile::getText).contains("Go");
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    public void clear_dropsEverything() {
        store.rememberText(Locator.id("a"), "A");
        store.rememberText(Locator.id("b"), "B");

        store.clear();

        assertThat(store.size()).isZero();
        assertThat(store.profileFor(Locator.id("a")).getText()).isEmpty();
    }
}
