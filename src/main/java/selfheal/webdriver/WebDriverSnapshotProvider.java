package selfheal.webdriver;

import selfheal.model.ElementNode;
import selfheal.model.ElementSnapshot;
import selfheal.model.Locator;
import selfheal.model.NodeHandle;
import selfheal.snapshot.SnapshotProvider;
import selfheal.snapshot.SnapshotUnavailableException;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Captures an {@link ElementSnapshot} from a live Selenium session with a
 * single script round trip.
 *
 * <p>The script walks {@code document.body} in document order, skipping
 * script / style / template content, and reports for each element its tag,
 * attributes, trimmed visible text (capped), page-relative bounding box and
 * the index of its nearest reported ancestor. When screenshot capture is on,
 * one viewport screenshot is taken and each visible node gets its crop.
 *
 * <p>Locators are resolved by the browser itself, so any selector the driver
 * accepts is honoured. The first element found is mapped back to its snapshot
 * index by repeating the snapshot walk in the page.
 *
 * <p>Any other {@link WebDriverException} (closed window, lost session)
 * surfaces as {@link SnapshotUnavailableException}.
 */
public class WebDriverSnapshotProvider implements SnapshotProvider {

    private static final Logger log = LoggerFactory.getLogger(WebDriverSnapshotProvider.class);

    public static final int DEFAULT_MAX_NODES = 5000;

    static final String SNAPSHOT_SCRIPT = """
            var maxNodes = arguments[0];
            var skip = {SCRIPT: 1, STYLE: 1, NOSCRIPT: 1, TEMPLATE: 1};
            var sx = window.scrollX || window.pageXOffset || 0;
            var sy = window.scrollY || window.pageYOffset || 0;
            var nodes = [];
            var index = new Map();
            var root = document.body || document.documentElement;
            var walker = document.createTreeWalker(root, NodeFilter.SHOW_ELEMENT, {
              acceptNode: function (el) {
                return skip[el.tagName] ? NodeFilter.FILTER_REJECT : NodeFilter.FILTER_ACCEPT;
              }
            });
            var el = root;
            while (el && nodes.length < maxNodes) {
              var attrs = {};
              for (var i = 0; i < el.attributes.length; i++) {
                var a = el.attributes[i];
                attrs[a.name] = String(a.value).substring(0, 200);
              }
              var r = el.getBoundingClientRect();
              var p = el.parentElement;
              while (p && !index.has(p)) p = p.parentElement;
              var text = (el.innerText || el.textContent || '').trim();
              index.set(el, nodes.length);
              nodes.push({
                tag: el.tagName.toLowerCase(),
                attributes: attrs,
                text: text.length > 500 ? text.substring(0, 500) : text,
                x: r.left + sx, y: r.top + sy, width: r.width, height: r.height,
                parent: p ? index.get(p) : -1
              });
              el = walker.nextNode();
            }
            return {
              url: window.location.href, title: document.title,
              scrollX: sx, scrollY: sy, dpr: window.devicePixelRatio || 1,
              nodes: nodes
            };
            """;

    /** Position of {@code arguments[0]} in the snapshot walk, or -1. */
    static final String INDEX_SCRIPT = """
            var target = arguments[0];
            var maxNodes = arguments[1];
            var skip = {SCRIPT: 1, STYLE: 1, NOSCRIPT: 1, TEMPLATE: 1};
            var root = document.body || document.documentElement;
            var walker = document.createTreeWalker(root, NodeFilter.SHOW_ELEMENT, {
              acceptNode: function (el) {
                return skip[el.tagName] ? NodeFilter.FILTER_REJECT : NodeFilter.FILTER_ACCEPT;
              }
            });
            var el = root;
            for (var i = 0; el && i < maxNodes; i++) {
              if (el === target) return i;
              el = walker.nextNode();
            }
            return -1;
            """;

    private final WebDriver driver;
    private final boolean captureScreenshots;
    private final int maxNodes;

    public WebDriverSnapshotProvider(WebDriver driver) {
        this(driver, false, DEFAULT_MAX_NODES);
    }

    /**
     * @param driver             live session; must implement {@link JavascriptExecutor}
     * @param captureScreenshots crop per-node images for visual matching
     * @param maxNodes           elements reported beyond this count are dropped
     */
    public WebDriverSnapshotProvider(WebDriver driver, boolean captureScreenshots, int maxNodes) {
        this.driver             = driver;
        this.captureScreenshots = captureScreenshots;
        this.maxNodes           = maxNodes;
    }

    @Override
    public ElementSnapshot getSnapshot() {
        if (!(driver instanceof JavascriptExecutor)) {
            throw new SnapshotUnavailableException("Driver cannot execute scripts: " + driver.getClass().getName());
        }
        Object raw;
        try {
            raw = ((JavascriptExecutor) driver).executeScript(SNAPSHOT_SCRIPT, maxNodes);
        } catch (WebDriverException e) {
            throw new SnapshotUnavailableException("Snapshot script failed: " + e.getMessage(), e);
        }
        if (!(raw instanceof Map)) {
            throw new SnapshotUnavailableException("Snapshot script returned " + raw);
        }
        Map<?, ?> page = (Map<?, ?>) raw;

        BufferedImage screenshot = captureScreenshots ? takeScreenshot() : null;
        double scrollX = number(page.get("scrollX"));
        double scrollY = number(page.get("scrollY"));
        double dpr     = page.get("dpr") == null ? 1.0 : number(page.get("dpr"));

        List<ElementNode> nodes = new ArrayList<>();
        Object rawNodes = page.get("nodes");
        if (rawNodes instanceof List) {
            for (Object o : (List<?>) rawNodes) {
                if (!(o instanceof Map)) {
                    throw new SnapshotUnavailableException("Malformed snapshot node: " + o);
                }
                Map<?, ?> n = (Map<?, ?>) o;
                ElementNode.Builder b = ElementNode.builder(string(n.get("tag")))
                        .text(string(n.get("text")))
                        .box(number(n.get("x")), number(n.get("y")), number(n.get("width")), number(n.get("height")))
                        .parent((int) number(n.get("parent")));
                Object attrs = n.get("attributes");
                if (attrs instanceof Map) {
                    for (Map.Entry<?, ?> a : ((Map<?, ?>) attrs).entrySet()) {
                        b.attr(string(a.getKey()), string(a.getValue()));
                    }
                }
                if (screenshot != null) {
                    BufferedImage crop = crop(screenshot,
                            (number(n.get("x")) - scrollX) * dpr, (number(n.get("y")) - scrollY) * dpr,
                            number(n.get("width")) * dpr, number(n.get("height")) * dpr);
                    if (crop != null) b.screenshot(crop);
                }
                nodes.add(b.build());
            }
        }
        log.debug("Captured snapshot of {} nodes from {}", nodes.size(), page.get("url"));
        try {
            return new ElementSnapshot(string(page.get("url")), string(page.get("title")), nodes);
        } catch (IllegalArgumentException e) {
            throw new SnapshotUnavailableException("Malformed snapshot: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<NodeHandle> tryResolve(Locator locator, ElementSnapshot snapshot) {
        if (!(driver instanceof JavascriptExecutor)) {
            throw new SnapshotUnavailableException("Driver cannot execute scripts: " + driver.getClass().getName());
        }
        try {
            List<WebElement> found = driver.findElements(WebDriverLocators.toBy(locator));
            if (found.isEmpty()) return Optional.empty();
            Object raw = ((JavascriptExecutor) driver).executeScript(INDEX_SCRIPT, found.get(0), maxNodes);
            int index = raw instanceof Number ? ((Number) raw).intValue() : -1;
            if (index < 0 || index >= snapshot.size()) {
                log.debug("{} matched an element outside the snapshot", locator);
                return Optional.empty();
            }
            return Optional.of(snapshot.handle(index));
        } catch (InvalidSelectorException | StaleElementReferenceException e) {
            log.debug("{} did not resolve: {}", locator, e.getMessage());
            return Optional.empty();
        } catch (WebDriverException e) {
            throw new SnapshotUnavailableException("Locator lookup failed for " + locator + ": " + e.getMessage(), e);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private BufferedImage takeScreenshot() {
        if (!(driver instanceof TakesScreenshot)) {
            log.debug("Driver cannot take screenshots; visual matching disabled for this snapshot");
            return null;
        }
        try {
            byte[] png = ((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES);
            return ImageIO.read(new ByteArrayInputStream(png));
        } catch (WebDriverException | IOException e) {
            log.warn("Screenshot for visual matching failed, continuing without images: {}", e.getMessage());
            return null;
        }
    }

    /** Crop of the part of {@code box} inside the image, or null when nothing is visible. */
    static BufferedImage crop(BufferedImage image, double x, double y, double w, double h) {
        int x0 = (int) Math.max(0, Math.floor(x));
        int y0 = (int) Math.max(0, Math.floor(y));
        int x1 = (int) Math.min(image.getWidth(), Math.ceil(x + w));
        int y1 = (int) Math.min(image.getHeight(), Math.ceil(y + h));
        if (x1 - x0 < 2 || y1 - y0 < 2) return null;
        return image.getSubimage(x0, y0, x1 - x0, y1 - y0);
    }

    private static double number(Object o) {
        return o instanceof Number ? ((Number) o).doubleValue() : 0.0;
    }

    private static String string(Object o) {
        return o == null ? "" : o.toString();
    }
}
