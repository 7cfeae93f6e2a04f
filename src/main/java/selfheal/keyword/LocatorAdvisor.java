package selfheal.keyword;

import selfheal.model.Locator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Suggests resilient locators for an element and scores how fragile a
 * given locator is. Pure string analysis, no page access.
 */
public class LocatorAdvisor {

    private static final Logger log = LoggerFactory.getLogger(LocatorAdvisor.class);

    private static final int BASE_SCORE = 50;

    private static final Pattern INDEX_SELECTOR = Pattern.compile("\\[\\d+]");

    /**
     * Fallback locators for an element, most reliable first: id,
     * {@code data-testid}, name, {@code tag.class[type]}, text, aria-label.
     * Each candidate is produced only when the attributes it needs are present.
     *
     * @param element attribute name to value; {@code tag} and {@code text}
     *                are read as the element's tag name and visible text
     */
    public List<Locator> generateSmartLocators(Map<String, String> element) {
        List<Locator> locators = new ArrayList<>();

        if (present(element, "id")) {
            locators.add(Locator.id(element.get("id")));
        }
        if (present(element, "data-testid")) {
            locators.add(Locator.css("[data-testid='" + element.get("data-testid") + "']"));
        }
        if (present(element, "name")) {
            locators.add(Locator.name(element.get("name")));
        }
        if (present(element, "class") && present(element, "type")) {
            String tag = present(element, "tag") ? element.get("tag") : "button";
            String classes = String.join(".", element.get("class").trim().split("\\s+"));
            locators.add(Locator.css(tag + "." + classes + "[type='" + element.get("type") + "']"));
        }
        if (present(element, "text")) {
            locators.add(Locator.xpath("//*[contains(text(), '" + element.get("text") + "')]"));
        }
        if (present(element, "aria-label")) {
            locators.add(Locator.css("[aria-label='" + element.get("aria-label") + "']"));
        }

        log.info("Generated {} smart locators", locators.size());
        return locators;
    }

    /**
     * Scores {@code locator} (in {@code strategy=value} notation) starting
     * from 50: test ids add 30, ids 25, names 15; wildcard XPath without an
     * attribute test loses 20, class containment 10, positional indexes 15.
     */
    public LocatorStrength validateStrength(String locator) {
        int score = BASE_SCORE;
        List<String> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        if (locator.contains("data-testid") || locator.contains("data-test")) {
            score += 30;
        } else if (locator.startsWith("id=")) {
            score += 25;
        } else if (locator.startsWith("name=")) {
            score += 15;
        }

        if (locator.contains("//*") && locator.contains("[") && !locator.contains("@")) {
            score -= 20;
            issues.add("Wildcard XPath without attributes - very fragile");
            recommendations.add("Use relative XPath or CSS selectors");
        }
        if (locator.contains("contains(@class")) {
            score -= 10;
            issues.add("Class-based locator may be unstable");
            recommendations.add("Consider using data-testid or ID");
        }
        if (INDEX_SELECTOR.matcher(locator).find()) {
            score -= 15;
            issues.add("Index-based selector detected");
            recommendations.add("Use unique attributes instead");
        }

        score = Math.max(0, Math.min(100, score));
        LocatorStrength result = new LocatorStrength(score, LocatorStrength.Strength.of(score), issues, recommendations);
        log.info("Locator strength for '{}': {} ({})", locator, score, result.strength().label());
        return result;
    }

    private static boolean present(Map<String, String> element, String key) {
        String v = element.get(key);
        return v != null && !v.isBlank();
    }
}
