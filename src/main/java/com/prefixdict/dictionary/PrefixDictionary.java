package com.prefixdict.dictionary;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * In-memory prefix dictionary over a closed vocabulary.
 *
 * <p>Words are stored in a tree whose edges are labelled by single Unicode code points, so
 * words sharing a prefix share the path spelling it. Construction and queries both walk the
 * tree directly; there is no separate builder.
 *
 * <p>This class does no locking. {@link #contains} and {@link #prefixesOf} may run concurrently
 * with each other, but {@link #insert} must not overlap with any other call on the same instance.
 * Callers that need both should guard the dictionary with a read/write lock.
 *
 * <p>Identical suffixes are not shared between branches, so strictly speaking this is a trie
 * rather than a minimal word graph. {@link #compact()} is reserved for that.
 */
public final class PrefixDictionary {

    private final Node root;
    private int size;

    public PrefixDictionary() {
        this(new Node());
    }

    PrefixDictionary(Node root) {
        this.root = root;
        this.size = countTerminals(root);
    }

    private static int countTerminals(Node node) {
        int count = node.isTerminal() ? 1 : 0;
        for (Node child : node.getChildren().values()) {
            count += countTerminals(child);
        }
        return count;
    }

    /**
     * Builds a dictionary by inserting every word of the vocabulary in order. Duplicates are
     * harmless and the resulting structure does not depend on the order of the input.
     */
    public static PrefixDictionary of(Iterable<String> vocabulary) {
        PrefixDictionary dictionary = new PrefixDictionary();
        for (String word : vocabulary) {
            dictionary.insert(word);
        }
        return dictionary;
    }

    public static PrefixDictionary of(String... vocabulary) {
        return of(List.of(vocabulary));
    }

    /**
     * Adds a word. The empty string is a legal word and marks the root as terminal.
     *
     * @param word any string, not null
     */
    public void insert(String word) {
        Objects.requireNonNull(word, "word");
        Node current = root;
        for (int i = 0; i < word.length(); ) {
            int codePoint = word.codePointAt(i);
            current = current.childOrCreate(codePoint);
            i += Character.charCount(codePoint);
        }
        if (current.markTerminal()) {
            size++;
        }
    }

    /**
     * Returns true if the word was inserted. A strict prefix of stored words is not itself
     * contained unless it was inserted too.
     */
    public boolean contains(String word) {
        Objects.requireNonNull(word, "word");
        Node current = root;
        for (int i = 0; i < word.length(); ) {
            int codePoint = word.codePointAt(i);
            current = current.child(codePoint);
            if (current == null) {
                return false;
            }
            i += Character.charCount(codePoint);
        }
        return current.isTerminal();
    }

    /**
     * Lists the stored words that are prefixes of {@code word}, shortest first.
     *
     * <p>The walk stops at the first code point without an outgoing edge. The zero-length prefix
     * is never reported, so {@code prefixesOf("")} is empty even after {@code insert("")}.
     *
     * @return a new list, empty when nothing matches
     */
    public List<String> prefixesOf(String word) {
        Objects.requireNonNull(word, "word");
        List<String> result = new ArrayList<>();
        Node current = root;
        for (int i = 0; i < word.length(); ) {
            int codePoint = word.codePointAt(i);
            current = current.child(codePoint);
            if (current == null) {
                break;
            }
            i += Character.charCount(codePoint);
            if (current.isTerminal()) {
                result.add(word.substring(0, i));
            }
        }
        return result;
    }

    /**
     * Lazily produces the same sequence as {@link #prefixesOf(String)}.
     *
     * @throws UnsupportedOperationException always; streaming enumeration is not implemented
     */
    public Iterator<String> iterPrefixes(String word) {
        throw new UnsupportedOperationException("Streaming prefix enumeration is not supported yet");
    }

    /**
     * Merges structurally identical suffix subtrees.
     *
     * @return the number of merged branches
     * @throws UnsupportedOperationException always; compaction is not implemented
     */
    public int compact() {
        throw new UnsupportedOperationException("Suffix compaction is not supported yet");
    }

    /** Number of distinct words stored. */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrefixDictionary)) return false;
        return root.equals(((PrefixDictionary) o).root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return "PrefixDictionary{" + root + "}";
    }
}
