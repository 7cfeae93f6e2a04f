package selfheal.keyword;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One keyword-driven test step aimed at the healing library.
 *
 * <p>The target is usually a locator in {@code strategy=value} notation;
 * params carry keyword-specific values such as a timeout or the attribute
 * set of an element:
 * <pre>{@code
 * {
 *   "keyword": "findElementWithHealing",
 *   "target": "id=submit-button",
 *   "params": { "timeout": "10" }
 * }
 * }</pre>
 */
public class KeywordAction {

    private final String              keyword;
    private final String              target;
    private final Map<String, String> params;

    public KeywordAction(String keyword, String target, Map<String, String> params) {
        this.keyword = keyword;
        this.target  = target;
        this.params  = params != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
                : Collections.emptyMap();
    }

    public static KeywordAction of(String keyword, String target) {
        return new KeywordAction(keyword, target, null);
    }

    public String              getKeyword() { return keyword; }
    public String              getTarget()  { return target; }
    public Map<String, String> getParams()  { return params; }

    public String param(String name, String defaultValue) {
        return params.getOrDefault(name, defaultValue);
    }

    /** Integer param; a missing or non-numeric value yields {@code defaultValue}. */
    public int intParam(String name, int defaultValue) {
        String raw = params.get(name);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return String.format("KeywordAction{keyword='%s', target='%s', params=%s}", keyword, target, params);
    }
}
