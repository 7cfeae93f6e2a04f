package selfheal.strategy;

import selfheal.model.ElementProfile;
import selfheal.model.Locator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a minimal {@link ElementProfile} from a locator itself, for
 * elements that have never been resolved before, and splits locator values
 * into words usable as text hints.
 */
public final class LocatorProfiles {

    private static final Pattern CSS_LAST_COMPOUND_TAG = Pattern.compile("^([a-zA-Z][\\w-]*)");
    private static final Pattern CSS_ID    = Pattern.compile("#([\\w-]+)");
    private static final Pattern CSS_CLASS = Pattern.compile("\\.([\\w-]+)");
    private static final Pattern CSS_NAME  = Pattern.compile("\\[\\s*name\\s*=\\s*['\"]?([^'\"\\]]+)['\"]?\\s*]");

    private static final Pattern XP_TAG   = Pattern.compile("//?([a-zA-Z][\\w-]*)[^/]*$");
    private static final Pattern XP_ID    = Pattern.compile("@id\\s*=\\s*['\"]([^'\"]+)['\"]");
    private static final Pattern XP_NAME  = Pattern.compile("@name\\s*=\\s*['\"]([^'\"]+)['\"]");
    private static final Pattern XP_CLASS = Pattern.compile("@class\\s*=\\s*['\"]([^'\"]+)['\"]");
    private static final Pattern XP_TEXT  = Pattern.compile(
            "(?:text\\(\\)|normalize-space\\(\\)|normalize-space\\(text\\(\\)\\)|\\.)\\s*[=,]\\s*['\"]([^'\"]+)['\"]");

    private static final Pattern WORD_SPLIT  = Pattern.compile("[^A-Za-z0-9]+|(?<=[a-z])(?=[A-Z])");

    /** Words too generic to identify an element by its visible text. */
    private static final Set<String> STOP_WORDS = Set.of(
            "btn", "button", "input", "field", "old", "new", "link", "the", "id", "txt", "text",
            "lbl", "label", "div", "span", "container", "wrapper", "element", "elem", "icon",
            "main", "primary", "secondary", "form", "item", "box", "css", "xpath");

    private LocatorProfiles() {}

    /** Profile carrying whatever the locator states about its target. */
    public static ElementProfile derive(Locator locator) {
        ElementProfile profile = ElementProfile.empty();
        String value = locator.getValue().trim();
        switch (locator.getKind()) {
            case ID:
                return profile.withId(value);
            case NAME:
                return profile.withName(value);
            case CLASS_NAME:
                return profile.withClasses(Set.of(value));
            case TAG_NAME:
                return profile.withTag(value);
            case TEXT:
            case PARTIAL_TEXT:
                return profile.withText(value);
            case CSS:
                return deriveFromCss(value);
            case XPATH:
                return deriveFromXPath(value);
            default:
                return profile;
        }
    }

    /**
     * Splits an id / name / class style value into lower-case words, dropping
     * generic ones ("btn", "old", ...) and anything shorter than three
     * characters. {@code "old-submitButton"} yields {@code [submit]}.
     */
    public static List<String> hintWords(String value) {
        List<String> words = new ArrayList<>();
        if (value == null) return words;
        for (String w : WORD_SPLIT.split(value)) {
            String lw = w.toLowerCase(Locale.ROOT);
            if (lw.length() >= 3 && !STOP_WORDS.contains(lw) && !lw.chars().allMatch(Character::isDigit)) {
                words.add(lw);
            }
        }
        return words;
    }

    private static ElementProfile deriveFromCss(String selector) {
        String[] compounds = selector.trim().split("\\s*[\\s>+~]\\s*");
        String last = compounds[compounds.length - 1];
        ElementProfile profile = ElementProfile.empty();
        Matcher m = CSS_LAST_COMPOUND_TAG.matcher(last);
        if (m.find()) profile = profile.withTag(m.group(1));
        m = CSS_ID.matcher(last);
        if (m.find()) profile = profile.withId(m.group(1));
        Set<String> classes = new LinkedHashSet<>();
        m = CSS_CLASS.matcher(last);
        while (m.find()) classes.add(m.group(1));
        if (!classes.isEmpty()) profile = profile.withClasses(classes);
        m = CSS_NAME.matcher(last);
        if (m.find()) profile = profile.withName(m.group(1).trim());
        return profile;
    }

    private static ElementProfile deriveFromXPath(String xpath) {
        ElementProfile profile = ElementProfile.empty();
        Matcher m = XP_TAG.matcher(xpath.replaceAll("[()]\\[\\d+]$", ""));
        if (m.find()) profile = profile.withTag(m.group(1));
        m = XP_ID.matcher(xpath);
        if (m.find()) profile = profile.withId(m.group(1));
        m = XP_NAME.matcher(xpath);
        if (m.find()) profile = profile.withName(m.group(1));
        m = XP_CLASS.matcher(xpath);
        if (m.find()) {
            Set<String> classes = new LinkedHashSet<>(List.of(m.group(1).trim().split("\\s+")));
            profile = profile.withClasses(classes);
        }
        m = XP_TEXT.matcher(xpath);
        if (m.find()) profile = profile.withText(m.group(1));
        return profile;
    }
}
