package com.scrabble.core.gaddag;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Builds a minimal {@link Gaddag} from a word list.
 *
 * <p>All GADDAG entries of all words are sorted and added to a trie one by one. Once an entry
 * diverges from its predecessor, the branch of the predecessor below the divergence point can no
 * longer change, so its states are merged with already registered states that have the same
 * terminal flag and the same outgoing arcs. The finished automaton is therefore the minimized trie
 * without the full trie ever being held in memory.
 */
public final class GaddagBuilder {

    private static final Logger LOGGER = Logger.getLogger(GaddagBuilder.class.getName());
    private static final int[] NO_TARGETS = new int[0];

    private final List<BuildState> states = new ArrayList<>();
    private final Map<StateKey, Integer> register = new HashMap<>();

    private GaddagBuilder() {
    }

    /**
     * Builds the automaton for {@code words}. Empty words are skipped and duplicates are ignored.
     *
     * @throws ConstructionException if a word contains a character outside A-Z
     */
    public static Gaddag build(Iterable<? extends CharSequence> words) {
        Objects.requireNonNull(words, "words");
        List<byte[]> entries = new ArrayList<>();
        int wordCount = 0;
        int index = 0;
        for (CharSequence word : words) {
            if (word == null) {
                throw new ConstructionException("Word list contains null at position " + index);
            }
            byte[] symbols = toSymbols(word);
            index++;
            if (symbols.length == 0) {
                continue;
            }
            wordCount++;
            addEntries(symbols, entries);
        }
        entries.sort(Arrays::compare);

        Gaddag gaddag = new GaddagBuilder().minimize(entries);

        final int wordTotal = wordCount;
        final int entryCount = entries.size();
        LOGGER.info(() -> String.format("Built GADDAG from %d words (%d entries): %d nodes, %d arcs", wordTotal,
                entryCount, gaddag.nodeCount(), gaddag.arcCount()));
        return gaddag;
    }

    private static byte[] toSymbols(CharSequence word) {
        byte[] symbols = new byte[word.length()];
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (c < 'A' || c > 'Z') {
                throw new ConstructionException("Word '" + word + "' contains '" + c + "' outside A-Z");
            }
            symbols[i] = (byte) (c - 'A');
        }
        return symbols;
    }

    /*
     * CARE gives ERAC, RAC+E, AC+RE, C+ARE.
     */
    private static void addEntries(byte[] word, List<byte[]> entries) {
        int n = word.length;
        byte[] reversed = new byte[n];
        for (int i = 0; i < n; i++) {
            reversed[i] = word[n - 1 - i];
        }
        entries.add(reversed);
        for (int split = 0; split < n - 1; split++) {
            byte[] entry = new byte[n + 1];
            int k = 0;
            for (int i = split; i >= 0; i--) {
                entry[k++] = word[i];
            }
            entry[k++] = (byte) Gaddag.SEPARATOR;
            for (int i = split + 1; i < n; i++) {
                entry[k++] = word[i];
            }
            entries.add(entry);
        }
    }

    private Gaddag minimize(List<byte[]> entries) {
        int root = newState();
        int maxLength = 0;
        for (byte[] entry : entries) {
            maxLength = Math.max(maxLength, entry.length);
        }
        int[] path = new int[maxLength + 1];
        path[0] = root;

        byte[] previous = null;
        for (byte[] entry : entries) {
            if (previous != null && Arrays.equals(previous, entry)) {
                continue;
            }
            int common = previous == null ? 0 : commonPrefix(previous, entry);
            if (previous != null) {
                freeze(previous, path, common);
            }
            for (int i = common; i < entry.length; i++) {
                int child = newState();
                appendArc(path[i], entry[i], child);
                path[i + 1] = child;
            }
            states.get(path[entry.length]).terminal = true;
            previous = entry;
        }
        if (previous != null) {
            freeze(previous, path, 0);
        }
        return compact(root);
    }

    private void freeze(byte[] entry, int[] path, int common) {
        for (int depth = entry.length; depth > common; depth--) {
            replaceOrRegister(path[depth - 1], path[depth]);
        }
    }

    private void replaceOrRegister(int parent, int child) {
        BuildState state = states.get(child);
        Integer existing = register.putIfAbsent(new StateKey(state), child);
        if (existing != null) {
            BuildState parentState = states.get(parent);
            parentState.targets[parentState.targets.length - 1] = existing;
            states.set(child, null);
        }
    }

    private int newState() {
        states.add(new BuildState());
        return states.size() - 1;
    }

    private void appendArc(int from, int symbol, int to) {
        BuildState state = states.get(from);
        int bit = 1 << symbol;
        if (state.mask >= bit) {
            throw new IllegalStateException("Entries must be added in sorted order");
        }
        state.mask |= bit;
        int[] targets = Arrays.copyOf(state.targets, state.targets.length + 1);
        targets[targets.length - 1] = to;
        state.targets = targets;
    }

    private Gaddag compact(int root) {
        int[] remap = new int[states.size()];
        Arrays.fill(remap, -1);
        List<Integer> order = new ArrayList<>();
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        remap[root] = 0;
        order.add(root);
        queue.add(root);
        int arcCount = 0;
        while (!queue.isEmpty()) {
            BuildState state = states.get(queue.poll());
            arcCount += state.targets.length;
            for (int target : state.targets) {
                if (remap[target] < 0) {
                    remap[target] = order.size();
                    order.add(target);
                    queue.add(target);
                }
            }
        }

        int nodeCount = order.size();
        int[] arcMasks = new int[nodeCount];
        int[] firstArc = new int[nodeCount];
        int[] arcTargets = new int[arcCount];
        boolean[] terminal = new boolean[nodeCount];
        int arc = 0;
        for (int node = 0; node < nodeCount; node++) {
            BuildState state = states.get(order.get(node));
            arcMasks[node] = state.mask;
            firstArc[node] = arc;
            terminal[node] = state.terminal;
            for (int target : state.targets) {
                arcTargets[arc++] = remap[target];
            }
        }
        return new Gaddag(0, arcMasks, firstArc, arcTargets, terminal);
    }

    private static int commonPrefix(byte[] a, byte[] b) {
        int limit = Math.min(a.length, b.length);
        int i = 0;
        while (i < limit && a[i] == b[i]) {
            i++;
        }
        return i;
    }

    private static final class BuildState {

        private int mask;
        private int[] targets = NO_TARGETS;
        private boolean terminal;
    }

    private static final class StateKey {

        private final boolean terminal;
        private final int mask;
        private final int[] targets;
        private final int hash;

        private StateKey(BuildState state) {
            this.terminal = state.terminal;
            this.mask = state.mask;
            this.targets = state.targets;
            this.hash = 31 * (31 * Boolean.hashCode(terminal) + mask) + Arrays.hashCode(targets);
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof StateKey)) {
                return false;
            }
            StateKey that = (StateKey) other;
            return terminal == that.terminal && mask == that.mask && Arrays.equals(targets, that.targets);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
