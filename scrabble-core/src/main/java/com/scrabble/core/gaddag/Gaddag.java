package com.scrabble.core.gaddag;

import java.util.Objects;

/**
 * Immutable GADDAG over the letters A-Z plus a separator symbol.
 *
 * <p>Every word {@code w} is stored as {@code reverse(w)} and, for each split point, as
 * {@code reverse(w[0..i]) + SEPARATOR + w[i+1..]}. A walk that starts on any letter of a word can
 * therefore read the word backwards to its first letter, cross the separator once and read the
 * rest forwards.
 *
 * <p>Nodes live in flat arrays and are addressed by integer id. Each node keeps a 27-bit mask of
 * its outgoing symbols; the children are stored in symbol order starting at
 * {@code firstArc[node]}, so a transition is a mask test plus a bit count. Instances are safe to
 * share between threads.
 */
public final class Gaddag {

    public static final int ALPHABET_SIZE = 26;
    public static final int SEPARATOR = 26;
    public static final int SYMBOL_COUNT = 27;
    public static final char SEPARATOR_CHAR = '+';
    public static final int NO_NODE = -1;
    public static final int ALL_LETTERS = (1 << ALPHABET_SIZE) - 1;

    private final int root;
    private final int[] arcMasks;
    private final int[] firstArc;
    private final int[] arcTargets;
    private final boolean[] terminal;

    Gaddag(int root, int[] arcMasks, int[] firstArc, int[] arcTargets, boolean[] terminal) {
        this.root = root;
        this.arcMasks = Objects.requireNonNull(arcMasks, "arcMasks");
        this.firstArc = Objects.requireNonNull(firstArc, "firstArc");
        this.arcTargets = Objects.requireNonNull(arcTargets, "arcTargets");
        this.terminal = Objects.requireNonNull(terminal, "terminal");
    }

    public int root() {
        return root;
    }

    /**
     * Follows the arc labelled {@code symbol} out of {@code node}. Returns {@link #NO_NODE} if there
     * is no such arc, the symbol is not in the alphabet or {@code node} is {@link #NO_NODE}.
     */
    public int next(int node, int symbol) {
        if (node == NO_NODE || symbol < 0 || symbol >= SYMBOL_COUNT) {
            return NO_NODE;
        }
        int mask = arcMasks[node];
        int bit = 1 << symbol;
        if ((mask & bit) == 0) {
            return NO_NODE;
        }
        return arcTargets[firstArc[node] + Integer.bitCount(mask & (bit - 1))];
    }

    public int nextLetter(int node, char letter) {
        return next(node, symbolOf(letter));
    }

    public int nextSeparator(int node) {
        return next(node, SEPARATOR);
    }

    /**
     * Returns {@code true} if the symbols read from the root to {@code node} spell a complete
     * dictionary word in GADDAG form.
     */
    public boolean isTerminal(int node) {
        return node != NO_NODE && terminal[node];
    }

    /**
     * Returns the letters (bit 0 = A) that have an outgoing arc from {@code node}.
     */
    public int letterMask(int node) {
        return node == NO_NODE ? 0 : arcMasks[node] & ALL_LETTERS;
    }

    /**
     * Dictionary lookup: reads {@code word} backwards from the root.
     */
    public boolean contains(CharSequence word) {
        Objects.requireNonNull(word, "word");
        if (word.length() == 0) {
            return false;
        }
        int node = root;
        for (int i = word.length() - 1; i >= 0 && node != NO_NODE; i--) {
            node = nextLetter(node, word.charAt(i));
        }
        return isTerminal(node);
    }

    public int nodeCount() {
        return arcMasks.length;
    }

    public int arcCount() {
        return arcTargets.length;
    }

    public static int symbolOf(char c) {
        if (c >= 'A' && c <= 'Z') {
            return c - 'A';
        }
        return c == SEPARATOR_CHAR ? SEPARATOR : -1;
    }

    public static char charOf(int symbol) {
        if (symbol == SEPARATOR) {
            return SEPARATOR_CHAR;
        }
        if (symbol < 0 || symbol >= ALPHABET_SIZE) {
            throw new IllegalArgumentException("Unknown symbol: " + symbol);
        }
        return (char) ('A' + symbol);
    }

    int arcMask(int node) {
        return arcMasks[node];
    }

    int firstArc(int node) {
        return firstArc[node];
    }

    int arcTarget(int arcIndex) {
        return arcTargets[arcIndex];
    }

    boolean terminalFlag(int node) {
        return terminal[node];
    }
}
