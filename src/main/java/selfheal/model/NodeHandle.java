package selfheal.model;

/**
 * A node that a locator resolved to, together with its position in the
 * snapshot it was found in.
 *
 * @param index document-order position inside the snapshot
 * @param node  the resolved node
 */
public record NodeHandle(int index, ElementNode node) {}
