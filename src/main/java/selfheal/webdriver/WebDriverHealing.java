package selfheal.webdriver;

import selfheal.engine.ElementNotHealedException;
import selfheal.engine.HealingException;
import selfheal.engine.HealingOrchestrator;
import selfheal.engine.ResolutionResult;
import selfheal.model.Locator;
import selfheal.snapshot.SnapshotProvider;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Finds live {@link WebElement}s through a shared {@link HealingOrchestrator}.
 *
 * <p>The locator is resolved (and healed if needed) against a snapshot of
 * the page, then looked up once through the driver with the resulting
 * locator. There is no retry loop; retrying a step is the test's concern.
 */
public class WebDriverHealing {

    private static final Logger log = LoggerFactory.getLogger(WebDriverHealing.class);

    private final WebDriver driver;
    private final HealingOrchestrator orchestrator;
    private final SnapshotProvider snapshots;

    public WebDriverHealing(WebDriver driver, HealingOrchestrator orchestrator) {
        this(driver, orchestrator, new WebDriverSnapshotProvider(driver));
    }

    public WebDriverHealing(WebDriver driver, HealingOrchestrator orchestrator, SnapshotProvider snapshots) {
        this.driver       = driver;
        this.orchestrator = orchestrator;
        this.snapshots    = snapshots;
    }

    /** Parses {@code locatorSpec} ({@code id=submit}, {@code css=...}, bare XPath) and finds it. */
    public WebElement findElement(String locatorSpec) {
        return findElement(Locator.parse(locatorSpec), orchestrator.getDefaultTimeout());
    }

    public WebElement findElement(Locator locator) {
        return findElement(locator, orchestrator.getDefaultTimeout());
    }

    /**
     * @throws ElementNotHealedException if neither the locator nor any healing strategy finds the element
     * @throws HealingException          if the resolved locator no longer finds the element in the browser
     */
    public WebElement findElement(Locator locator, Duration timeout) {
        ResolutionResult result = orchestrator.resolve(locator, null, snapshots, timeout);
        if (!result.isResolved()) {
            throw new ElementNotHealedException(result.failure());
        }
        Locator resolved = result.locator();
        try {
            WebElement element = driver.findElement(WebDriverLocators.toBy(resolved));
            if (result.isHealed()) {
                log.info("Found {} using healed locator {}", locator, resolved);
            }
            return element;
        } catch (NoSuchElementException e) {
            throw new HealingException("Page changed after resolution; " + resolved
                    + " (for " + locator + ") no longer finds an element", e);
        }
    }

    public HealingOrchestrator getOrchestrator() {
        return orchestrator;
    }
}
