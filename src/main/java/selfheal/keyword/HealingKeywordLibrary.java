package selfheal.keyword;

import selfheal.engine.HealingException;
import selfheal.engine.HealingOrchestrator;
import selfheal.model.Locator;
import selfheal.webdriver.WebDriverHealing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Self-healing keywords for keyword-driven test steps.
 *
 * <pre>
 *  findElementWithHealing   find target locator, healing it if needed (param: timeout in s)
 *  getHealingStatistics     current {@link selfheal.stats.HealingReport}
 *  clearHealingCache        reset cache and element profiles between suites
 *  saveHealingCache         write the cache to its persistence store
 *  rememberElementText      register the visible text of target (param: text)
 *  generateSmartLocator     fallback locators from params (id, name, class, type, tag, text, ...)
 *  validateLocatorStrength  score target (or param: locator) 0..100
 * </pre>
 *
 * Keyword names are case-insensitive.
 */
public class HealingKeywordLibrary {

    private static final Logger log = LoggerFactory.getLogger(HealingKeywordLibrary.class);

    private static final int DEFAULT_TIMEOUT_SEC = 10;

    /** Registered keyword handlers: lower-case keyword name → handler */
    private final Map<String, Function<KeywordAction, Object>> registry = new HashMap<>();

    private final WebDriverHealing healing;
    private final HealingOrchestrator orchestrator;
    private final LocatorAdvisor advisor;

    public HealingKeywordLibrary(WebDriverHealing healing) {
        this(healing, new LocatorAdvisor());
    }

    public HealingKeywordLibrary(WebDriverHealing healing, LocatorAdvisor advisor) {
        this.healing      = healing;
        this.orchestrator = healing.getOrchestrator();
        this.advisor      = advisor;
        register();
    }

    // ── Execute ───────────────────────────────────────────────────────────

    /**
     * Runs one keyword step.
     *
     * @return the keyword's value ({@code WebElement}, report, locator list,
     *         strength verdict), or {@code null} for keywords without one
     * @throws HealingException if the keyword is unknown or the step fails
     */
    public Object execute(KeywordAction action) {
        String kw = action.getKeyword();
        Function<KeywordAction, Object> handler = kw == null ? null : registry.get(kw.toLowerCase(Locale.ROOT));
        if (handler == null) {
            throw new HealingException("Unknown keyword: '" + kw + "'. Registered: " + registry.keySet());
        }
        log.info("Keyword: {} target={}", kw, action.getTarget());
        return handler.apply(action);
    }

    public boolean hasKeyword(String keyword) {
        return keyword != null && registry.containsKey(keyword.toLowerCase(Locale.ROOT));
    }

    // ── Registration ──────────────────────────────────────────────────────

    private void register() {
        kw("findelementwithhealing", a -> healing.findElement(
                target(a), Duration.ofSeconds(a.intParam("timeout", DEFAULT_TIMEOUT_SEC))));

        kw("gethealingstatistics", a -> orchestrator.getHealingStatistics());

        kw("clearhealingcache", a -> {
            orchestrator.clearCache();
            return null;
        });

        kw("savehealingcache", a -> orchestrator.saveCache());

        kw("rememberelementtext", a -> {
            orchestrator.rememberText(target(a), require(a, "text"));
            return null;
        });

        kw("generatesmartlocator", a -> advisor.generateSmartLocators(a.getParams()).stream()
                .map(Locator::toString)
                .collect(Collectors.toList()));

        kw("validatelocatorstrength", a -> {
            String locator = a.getTarget() != null ? a.getTarget() : require(a, "locator");
            return advisor.validateStrength(locator);
        });
    }

    private void kw(String name, Function<KeywordAction, Object> handler) {
        registry.put(name, handler);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static Locator target(KeywordAction a) {
        String spec = a.getTarget() != null ? a.getTarget() : a.param("locator", null);
        if (spec == null || spec.isBlank()) {
            throw new HealingException("Keyword '" + a.getKeyword() + "' needs a target locator");
        }
        return Locator.parse(spec);
    }

    private static String require(KeywordAction a, String param) {
        String v = a.param(param, null);
        if (v == null) {
            throw new HealingException("Keyword '" + a.getKeyword() + "' needs param '" + param + "'");
        }
        return v;
    }

    /** Registered keyword names, sorted. */
    public List<String> keywords() {
        return registry.keySet().stream().sorted().collect(Collectors.toList());
    }
}
