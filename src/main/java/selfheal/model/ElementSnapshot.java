package selfheal.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Captured view of a page or screen: the ordered candidate nodes that
 * strategies inspect. Produced by a driver binding; never mutated after
 * construction.
 */
public final class ElementSnapshot {

    private final String url;
    private final String title;
    private final List<ElementNode> nodes;
    private final Instant capturedAt;

    /**
     * @throws IllegalArgumentException if a node's parent index does not
     *         point at an earlier node
     */
    public ElementSnapshot(String url, String title, List<ElementNode> nodes, Instant capturedAt) {
        this.url        = url == null ? "" : url;
        this.title      = title == null ? "" : title;
        this.nodes      = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.capturedAt = capturedAt == null ? Instant.now() : capturedAt;
        for (int i = 0; i < this.nodes.size(); i++) {
            int parent = this.nodes.get(i).getParentIndex();
            if (parent < -1 || parent >= i) {
                throw new IllegalArgumentException(
                        "Node " + i + " has invalid parent index " + parent);
            }
        }
    }

    public ElementSnapshot(String url, String title, List<ElementNode> nodes) {
        this(url, title, nodes, Instant.now());
    }

    public static ElementSnapshot of(ElementNode... nodes) {
        return new ElementSnapshot("", "", List.of(nodes));
    }

    public String            getUrl()        { return url; }
    public String            getTitle()      { return title; }
    public List<ElementNode> getNodes()      { return nodes; }
    public Instant           getCapturedAt() { return capturedAt; }

    public int size() {
        return nodes.size();
    }

    public ElementNode node(int index) {
        return nodes.get(index);
    }

    public NodeHandle handle(int index) {
        return new NodeHandle(index, nodes.get(index));
    }

    /** Number of parent links from {@code index} up to its root. */
    public int depth(int index) {
        int depth = 0;
        int current = nodes.get(index).getParentIndex();
        while (current >= 0) {
            depth++;
            current = nodes.get(current).getParentIndex();
        }
        return depth;
    }

    /**
     * Tree distance (edges on the path through the lowest common ancestor)
     * between two nodes, or {@code -1} if they are in different trees.
     */
    public int domDistance(int a, int b) {
        if (a == b) return 0;
        List<Integer> pathA = ancestry(a);
        List<Integer> pathB = ancestry(b);
        for (int i = 0; i < pathA.size(); i++) {
            int j = pathB.indexOf(pathA.get(i));
            if (j >= 0) return i + j;
        }
        return -1;
    }

    /** The node itself followed by its ancestors, nearest first. */
    private List<Integer> ancestry(int index) {
        List<Integer> path = new ArrayList<>();
        int current = index;
        while (current >= 0) {
            path.add(current);
            current = nodes.get(current).getParentIndex();
        }
        return path;
    }

    @Override
    public String toString() {
        return String.format("ElementSnapshot{url='%s', title='%s', nodes=%d}", url, title, nodes.size());
    }
}
