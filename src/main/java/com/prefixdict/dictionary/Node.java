package com.prefixdict.dictionary;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * One position in the prefix tree: the state reached after consuming a specific prefix.
 * Children are keyed by code point, so a supplementary character is a single edge.
 */
final class Node {

    // Stays null until the first child is attached; a leaf carries no map at all.
    private Map<Integer, Node> children;

    // True when the prefix leading to this node is itself a stored word.
    private boolean terminal;

    Node child(int codePoint) {
        return children == null ? null : children.get(codePoint);
    }

    Node childOrCreate(int codePoint) {
        if (children == null) {
            children = new HashMap<>();
        }
        return children.computeIfAbsent(codePoint, k -> new Node());
    }

    // Used by tests to assemble expected trees by hand.
    Node put(int codePoint, Node child) {
        if (children == null) {
            children = new HashMap<>();
        }
        children.put(codePoint, child);
        return this;
    }

    Map<Integer, Node> getChildren() {
        return children == null ? Collections.emptyMap() : Collections.unmodifiableMap(children);
    }

    boolean isTerminal() {
        return terminal;
    }

    /**
     * Marks this node as the end of a word.
     *
     * @return true if the node was not terminal before
     */
    boolean markTerminal() {
        boolean added = !terminal;
        terminal = true;
        return added;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node)) return false;
        Node that = (Node) o;
        // HashMap equality is order-free and recurses through Node.equals
        return terminal == that.terminal && getChildren().equals(that.getChildren());
    }

    @Override
    public int hashCode() {
        return 31 * Boolean.hashCode(terminal) + getChildren().hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Node{");
        if (terminal) {
            sb.append("terminal");
        }
        if (children != null && !children.isEmpty()) {
            if (terminal) sb.append(", ");
            sb.append("children={");
            String sep = "";
            for (Map.Entry<Integer, Node> e : new TreeMap<>(children).entrySet()) {
                sb.append(sep).append('\'').appendCodePoint(e.getKey()).append("': ").append(e.getValue());
                sep = ", ";
            }
            sb.append('}');
        }
        return sb.append('}').toString();
    }
}
