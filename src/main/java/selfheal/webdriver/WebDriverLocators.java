package selfheal.webdriver;

import selfheal.model.Locator;
import org.openqa.selenium.By;

/**
 * Maps {@link Locator}s to Selenium {@link By} instances.
 *
 * <p>Text locators become XPath on the normalised string value of any
 * element rather than {@code By.linkText}. Only the innermost matching
 * elements qualify, so {@code <html>} and {@code <body>} never win over the
 * element that actually carries the text, and the driver lands on the same
 * node as in-memory snapshot matching.
 */
public final class WebDriverLocators {

    private WebDriverLocators() {}

    public static By toBy(Locator locator) {
        String value = locator.getValue();
        switch (locator.getKind()) {
            case ID:           return By.id(value);
            case NAME:         return By.name(value);
            case CSS:          return By.cssSelector(value);
            case XPATH:        return By.xpath(value);
            case CLASS_NAME:   return By.className(value);
            case TAG_NAME:     return By.tagName(value);
            case TEXT: {
                String test = "normalize-space(.)=" + xpathLiteral(value.trim());
                return By.xpath("//*[" + test + "][not(.//*[" + test + "])]");
            }
            case PARTIAL_TEXT: {
                String test = "contains(normalize-space(.), " + xpathLiteral(value.trim()) + ")";
                return By.xpath("//*[" + test + "][not(.//*[" + test + "])]");
            }
            default:
                throw new IllegalArgumentException("Unsupported locator kind: " + locator.getKind());
        }
    }

    /**
     * Quotes {@code value} as an XPath 1.0 string literal. Values holding
     * both quote characters are built with {@code concat()}.
     */
    static String xpathLiteral(String value) {
        if (!value.contains("'")) {
            return "'" + value + "'";
        }
        if (!value.contains("\"")) {
            return "\"" + value + "\"";
        }
        StringBuilder sb = new StringBuilder("concat(");
        String[] parts = value.split("'", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append(", \"'\", ");
            sb.append('\'').append(parts[i]).append('\'');
        }
        return sb.append(')').toString();
    }
}
