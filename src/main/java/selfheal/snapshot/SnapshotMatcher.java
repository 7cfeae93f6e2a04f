package selfheal.snapshot;

import selfheal.model.ElementNode;
import selfheal.model.ElementSnapshot;
import selfheal.model.Locator;
import selfheal.model.NodeHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@link Locator}s against an {@link ElementSnapshot} in memory,
 * without a live driver.
 *
 * <p>Supported syntax:
 * <ul>
 *   <li>ID, NAME, CLASS_NAME, TAG_NAME: exact attribute / tag comparison</li>
 *   <li>TEXT: whitespace-normalised equality; PARTIAL_TEXT: substring. Only the
 *       innermost matching nodes count.</li>
 *   <li>CSS: compound selectors ({@code tag#id.cls[attr='v'][attr]}) joined by
 *       descendant (space) or child ({@code >}) combinators, comma groups</li>
 *   <li>XPath: {@code /} and {@code //} steps over tag or {@code *}, with
 *       predicates {@code @attr='v'}, {@code @attr}, {@code text()='v'},
 *       {@code normalize-space()='v'}, {@code .='v'},
 *       {@code contains(x,'v')}, {@code starts-with(x,'v')}, {@code and} /
 *       {@code or}, positional {@code [n]}, and a wrapping {@code (expr)[n]}</li>
 * </ul>
 *
 * <p>Anything outside that subset matches nothing and is logged at DEBUG.
 */
public final class SnapshotMatcher {

    private static final Logger log = LoggerFactory.getLogger(SnapshotMatcher.class);

    /** Virtual document root above every snapshot root node. */
    private static final int ROOT = -1;

    private static final String QUOTED = "(?:'([^']*)'|\"([^\"]*)\")";

    private static final Pattern CSS_TAG   = Pattern.compile("^([a-zA-Z][\\w-]*|\\*)");
    private static final Pattern CSS_ID    = Pattern.compile("^#([\\w-]+)");
    private static final Pattern CSS_CLASS = Pattern.compile("^\\.([\\w-]+)");
    private static final Pattern CSS_ATTR  = Pattern.compile(
            "^\\[\\s*([\\w:-]+)\\s*(?:=\\s*(?:'([^']*)'|\"([^\"]*)\"|([^\\]\\s]*)))?\\s*]");

    private static final Pattern XP_ATTR_EQ  = Pattern.compile("^@([\\w:-]+)\\s*=\\s*" + QUOTED + "$");
    private static final Pattern XP_ATTR_HAS = Pattern.compile("^@([\\w:-]+)$");
    private static final Pattern XP_TEXT_EQ  = Pattern.compile(
            "^(text\\(\\)|\\.|normalize-space\\(\\)|normalize-space\\(text\\(\\)\\)|normalize-space\\(\\.\\))\\s*=\\s*"
                    + QUOTED + "$");
    private static final Pattern XP_FUNC = Pattern.compile(
            "^(contains|starts-with)\\(\\s*(@[\\w:-]+|text\\(\\)|\\.|normalize-space\\(\\)|normalize-space\\(text\\(\\)\\)"
                    + "|normalize-space\\(\\.\\))\\s*,\\s*" + QUOTED + "\\s*\\)$");
    private static final Pattern XP_POSITION = Pattern.compile("^\\d+$");
    private static final Pattern XP_NAME     = Pattern.compile("^([a-zA-Z][\\w-]*|\\*)");

    private SnapshotMatcher() {}

    // ── Public API ────────────────────────────────────────────────────────

    /** First node in document order matched by {@code locator}, or empty. */
    public static Optional<NodeHandle> resolve(Locator locator, ElementSnapshot snapshot) {
        List<NodeHandle> all = findAll(locator, snapshot);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    /** Every node matched by {@code locator}, in document order. */
    public static List<NodeHandle> findAll(Locator locator, ElementSnapshot snapshot) {
        List<Integer> indices;
        try {
            indices = match(locator, snapshot);
        } catch (UnsupportedSyntaxException e) {
            log.debug("Unsupported {} syntax '{}': {}", locator.getKind(), locator.getValue(), e.getMessage());
            return List.of();
        }
        List<NodeHandle> handles = new ArrayList<>(indices.size());
        for (int i : indices) {
            handles.add(snapshot.handle(i));
        }
        return handles;
    }

    /** Trims and collapses internal whitespace runs to a single space. */
    public static String normalizeText(String s) {
        return s == null ? "" : s.trim().replaceAll("\\s+", " ");
    }

    // ── Dispatch ──────────────────────────────────────────────────────────

    private static List<Integer> match(Locator locator, ElementSnapshot snapshot) {
        String value = locator.getValue();
        switch (locator.getKind()) {
            case ID:
                return filter(snapshot, n -> n.getId().equals(value));
            case NAME:
                return filter(snapshot, n -> n.getName().equals(value));
            case CLASS_NAME:
                return filter(snapshot, n -> n.getClassList().contains(value.trim()));
            case TAG_NAME:
                return filter(snapshot, n -> n.getTag().equalsIgnoreCase(value.trim()));
            case TEXT: {
                String expected = normalizeText(value);
                return innermost(snapshot,
                        filter(snapshot, n -> !expected.isEmpty() && normalizeText(n.getText()).equals(expected)));
            }
            case PARTIAL_TEXT: {
                String expected = normalizeText(value);
                return innermost(snapshot,
                        filter(snapshot, n -> !expected.isEmpty() && normalizeText(n.getText()).contains(expected)));
            }
            case CSS:
                return matchCss(value, snapshot);
            case XPATH:
                return matchXPath(value, snapshot);
            default:
                throw new UnsupportedSyntaxException("unknown kind " + locator.getKind());
        }
    }

    private interface NodeTest {
        boolean test(ElementNode node);
    }

    private static List<Integer> filter(ElementSnapshot snapshot, NodeTest test) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < snapshot.size(); i++) {
            if (test.test(snapshot.node(i))) out.add(i);
        }
        return out;
    }

    /** Drops every matched node that has a matched descendant. */
    private static List<Integer> innermost(ElementSnapshot snapshot, List<Integer> matched) {
        Set<Integer> ancestors = new HashSet<>();
        for (int i : matched) {
            for (int a = snapshot.node(i).getParentIndex(); a >= 0; a = snapshot.node(a).getParentIndex()) {
                ancestors.add(a);
            }
        }
        List<Integer> out = new ArrayList<>(matched.size());
        for (int i : matched) {
            if (!ancestors.contains(i)) out.add(i);
        }
        return out;
    }

    // ── CSS ───────────────────────────────────────────────────────────────

    private record AttrTest(String name, String value) {}

    private record Compound(String tag, String id, List<String> classes, List<AttrTest> attrs) {
        boolean matches(ElementNode node) {
            if (tag != null && !"*".equals(tag) && !node.getTag().equalsIgnoreCase(tag)) return false;
            if (id != null && !node.getId().equals(id)) return false;
            if (!node.getClassList().containsAll(classes)) return false;
            for (AttrTest a : attrs) {
                String actual = node.attribute(a.name());
                if (actual == null) return false;
                if (a.value() != null && !actual.equals(a.value())) return false;
            }
            return true;
        }
    }

    /** A compound plus the combinator linking it to the compound on its left. */
    private record CssPart(char combinator, Compound compound) {}

    private static List<Integer> matchCss(String selector, ElementSnapshot snapshot) {
        Set<Integer> union = new LinkedHashSet<>();
        for (String group : splitTopLevel(selector, ',')) {
            List<CssPart> parts = parseCssChain(group.trim());
            for (int i = 0; i < snapshot.size(); i++) {
                if (matchesChain(parts, parts.size() - 1, i, snapshot)) union.add(i);
            }
        }
        List<Integer> ordered = new ArrayList<>(union);
        ordered.sort(Integer::compareTo);
        return ordered;
    }

    private static boolean matchesChain(List<CssPart> parts, int k, int nodeIndex, ElementSnapshot snapshot) {
        if (!parts.get(k).compound().matches(snapshot.node(nodeIndex))) return false;
        if (k == 0) return true;
        int parent = snapshot.node(nodeIndex).getParentIndex();
        if (parts.get(k).combinator() == '>') {
            return parent >= 0 && matchesChain(parts, k - 1, parent, snapshot);
        }
        for (int a = parent; a >= 0; a = snapshot.node(a).getParentIndex()) {
            if (matchesChain(parts, k - 1, a, snapshot)) return true;
        }
        return false;
    }

    private static List<CssPart> parseCssChain(String selector) {
        if (selector.isEmpty()) throw new UnsupportedSyntaxException("empty selector");
        List<CssPart> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char pending = '\0';
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < selector.length(); i++) {
            char c = selector.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                current.append(c);
                continue;
            }
            if (c == '\'' || c == '"') { quote = c; current.append(c); continue; }
            if (c == '[') depth++;
            if (c == ']') depth--;
            if (depth == 0 && (Character.isWhitespace(c) || c == '>')) {
                if (current.length() > 0) {
                    parts.add(new CssPart(parts.isEmpty() ? '\0' : pending, parseCompound(current.toString())));
                    current.setLength(0);
                    pending = ' ';
                }
                if (c == '>') pending = '>';
                continue;
            }
            current.append(c);
        }
        if (current.length() == 0) throw new UnsupportedSyntaxException("dangling combinator");
        parts.add(new CssPart(parts.isEmpty() ? '\0' : pending, parseCompound(current.toString())));
        return parts;
    }

    private static Compound parseCompound(String text) {
        String rest = text;
        String tag = null;
        String id = null;
        List<String> classes = new ArrayList<>();
        List<AttrTest> attrs = new ArrayList<>();

        Matcher m = CSS_TAG.matcher(rest);
        if (m.find()) {
            tag = m.group(1).toLowerCase(Locale.ROOT);
            rest = rest.substring(m.end());
        }
        while (!rest.isEmpty()) {
            if ((m = CSS_ID.matcher(rest)).find()) {
                id = m.group(1);
            } else if ((m = CSS_CLASS.matcher(rest)).find()) {
                classes.add(m.group(1));
            } else if ((m = CSS_ATTR.matcher(rest)).find()) {
                String value = m.group(2) != null ? m.group(2)
                        : m.group(3) != null ? m.group(3)
                        : m.group(4);
                attrs.add(new AttrTest(m.group(1), value));
            } else {
                throw new UnsupportedSyntaxException("cannot parse '" + rest + "'");
            }
            rest = rest.substring(m.end());
        }
        return new Compound(tag, id, classes, attrs);
    }

    // ── XPath ─────────────────────────────────────────────────────────────

    private record Step(boolean descendant, String name, List<String> predicates) {}

    private static List<Integer> matchXPath(String expression, ElementSnapshot snapshot) {
        String expr = expression.trim();
        if (expr.startsWith("(")) {
            int close = findClosing(expr, 0, '(', ')');
            String inner = expr.substring(1, close);
            String tail = expr.substring(close + 1).trim();
            List<Integer> result = matchXPath(inner, snapshot);
            if (tail.isEmpty()) return result;
            if (!tail.startsWith("[") || !tail.endsWith("]")) {
                throw new UnsupportedSyntaxException("unexpected '" + tail + "'");
            }
            String pos = tail.substring(1, tail.length() - 1).trim();
            if (!XP_POSITION.matcher(pos).matches()) {
                throw new UnsupportedSyntaxException("only [n] may follow a group");
            }
            int n = Integer.parseInt(pos);
            return n >= 1 && n <= result.size() ? List.of(result.get(n - 1)) : List.of();
        }

        List<Integer> context = List.of(ROOT);
        for (Step step : parseSteps(expr)) {
            context = applyStep(step, context, snapshot);
            if (context.isEmpty()) break;
        }
        return context;
    }

    private static List<Step> parseSteps(String expr) {
        List<Step> steps = new ArrayList<>();
        int pos = 0;
        boolean first = true;
        while (pos < expr.length()) {
            boolean descendant;
            if (expr.startsWith("//", pos)) {
                descendant = true;
                pos += 2;
            } else if (expr.startsWith("/", pos)) {
                descendant = false;
                pos += 1;
            } else if (first) {
                descendant = true;
            } else {
                throw new UnsupportedSyntaxException("expected '/' at " + pos);
            }
            first = false;

            Matcher m = XP_NAME.matcher(expr.substring(pos));
            if (!m.find()) throw new UnsupportedSyntaxException("expected node test at " + pos);
            String name = m.group(1).toLowerCase(Locale.ROOT);
            pos += m.end();

            List<String> predicates = new ArrayList<>();
            while (pos < expr.length() && expr.charAt(pos) == '[') {
                int close = findClosing(expr, pos, '[', ']');
                predicates.add(expr.substring(pos + 1, close).trim());
                pos = close + 1;
            }
            steps.add(new Step(descendant, name, predicates));
        }
        if (steps.isEmpty()) throw new UnsupportedSyntaxException("empty path");
        return steps;
    }

    private static List<Integer> applyStep(Step step, List<Integer> context, ElementSnapshot snapshot) {
        Set<Integer> ctx = new LinkedHashSet<>(context);
        List<Integer> candidates = new ArrayList<>();
        for (int i = 0; i < snapshot.size(); i++) {
            ElementNode node = snapshot.node(i);
            if (!"*".equals(step.name()) && !node.getTag().equals(step.name())) continue;
            if (step.descendant()) {
                if (ctx.contains(ROOT) || hasAncestorIn(i, ctx, snapshot)) candidates.add(i);
            } else if (ctx.contains(node.getParentIndex())) {
                candidates.add(i);
            }
        }
        for (String predicate : step.predicates()) {
            candidates = applyPredicate(predicate, candidates, snapshot);
        }
        return candidates;
    }

    private static boolean hasAncestorIn(int index, Set<Integer> ctx, ElementSnapshot snapshot) {
        for (int a = snapshot.node(index).getParentIndex(); a >= 0; a = snapshot.node(a).getParentIndex()) {
            if (ctx.contains(a)) return true;
        }
        return false;
    }

    private static List<Integer> applyPredicate(String predicate, List<Integer> candidates,
                                                ElementSnapshot snapshot) {
        if (XP_POSITION.matcher(predicate).matches()) {
            int n = Integer.parseInt(predicate);
            Map<Integer, List<Integer>> byParent = new LinkedHashMap<>();
            for (int i : candidates) {
                byParent.computeIfAbsent(snapshot.node(i).getParentIndex(), k -> new ArrayList<>()).add(i);
            }
            List<Integer> out = new ArrayList<>();
            for (List<Integer> siblings : byParent.values()) {
                if (n >= 1 && n <= siblings.size()) out.add(siblings.get(n - 1));
            }
            out.sort(Integer::compareTo);
            return out;
        }
        List<Integer> out = new ArrayList<>();
        for (int i : candidates) {
            if (evalBoolean(predicate, snapshot.node(i))) out.add(i);
        }
        return out;
    }

    private static boolean evalBoolean(String expr, ElementNode node) {
        List<String> ors = splitKeyword(expr, " or ");
        if (ors.size() > 1) {
            for (String part : ors) {
                if (evalBoolean(part, node)) return true;
            }
            return false;
        }
        List<String> ands = splitKeyword(expr, " and ");
        if (ands.size() > 1) {
            for (String part : ands) {
                if (!evalBoolean(part, node)) return false;
            }
            return true;
        }
        return evalAtom(stripParens(expr.trim()), node);
    }

    private static boolean evalAtom(String atom, ElementNode node) {
        Matcher m;
        if ((m = XP_ATTR_EQ.matcher(atom)).matches()) {
            String actual = node.attribute(m.group(1));
            return actual != null && actual.equals(literal(m, 2));
        }
        if ((m = XP_ATTR_HAS.matcher(atom)).matches()) {
            return node.attribute(m.group(1)) != null;
        }
        if ((m = XP_TEXT_EQ.matcher(atom)).matches()) {
            return normalizeText(node.getText()).equals(normalizeText(literal(m, 2)));
        }
        if ((m = XP_FUNC.matcher(atom)).matches()) {
            String arg = m.group(2);
            String haystack = arg.startsWith("@")
                    ? node.attribute(arg.substring(1))
                    : normalizeText(node.getText());
            if (haystack == null) return false;
            String needle = literal(m, 3);
            return "contains".equals(m.group(1)) ? haystack.contains(needle) : haystack.startsWith(needle);
        }
        throw new UnsupportedSyntaxException("predicate '" + atom + "'");
    }

    private static String literal(Matcher m, int firstGroup) {
        return m.group(firstGroup) != null ? m.group(firstGroup) : m.group(firstGroup + 1);
    }

    // ── Scanning helpers ──────────────────────────────────────────────────

    private static String stripParens(String s) {
        if (s.startsWith("(") && findClosing(s, 0, '(', ')') == s.length() - 1) {
            return stripParens(s.substring(1, s.length() - 1).trim());
        }
        return s;
    }

    /** Index of the bracket closing the one at {@code open}, honouring quotes. */
    private static int findClosing(String s, int open, char opening, char closing) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == opening) {
                depth++;
            } else if (c == closing && --depth == 0) {
                return i;
            }
        }
        throw new UnsupportedSyntaxException("unbalanced '" + opening + "'");
    }

    private static List<String> splitTopLevel(String s, char separator) {
        List<String> out = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '[' || c == '(') {
                depth++;
            } else if (c == ']' || c == ')') {
                depth--;
            } else if (c == separator && depth == 0) {
                out.add(s.substring(start, i));
                start = i + 1;
            }
        }
        out.add(s.substring(start));
        return out;
    }

    private static List<String> splitKeyword(String s, String keyword) {
        List<String> out = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (depth == 0 && s.startsWith(keyword, i)) {
                out.add(s.substring(start, i));
                start = i + keyword.length();
                i = start - 1;
            }
        }
        out.add(s.substring(start));
        return out;
    }

    private static final class UnsupportedSyntaxException extends RuntimeException {
        UnsupportedSyntaxException(String msg) {
            super(msg);
        }
    }
}
