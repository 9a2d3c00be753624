package com.scrabble.core.gaddag;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Binary form of a {@link Gaddag}.
 *
 * <pre>
 * int magic, int version, int nodeCount, int arcCount, int root
 * per node: int arcMask, boolean terminal, int target * bitCount(arcMask)
 * </pre>
 */
public final class GaddagCodec {

    private static final Logger LOGGER = Logger.getLogger(GaddagCodec.class.getName());

    public static final int MAGIC = 0x47444447;
    public static final int VERSION = 1;

    private static final int SYMBOL_MASK = (1 << Gaddag.SYMBOL_COUNT) - 1;

    private GaddagCodec() {
    }

    public static byte[] serialize(Gaddag gaddag) {
        Objects.requireNonNull(gaddag, "gaddag");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(estimateSize(gaddag));
        try (DataOutputStream output = new DataOutputStream(buffer)) {
            output.writeInt(MAGIC);
            output.writeInt(VERSION);
            output.writeInt(gaddag.nodeCount());
            output.writeInt(gaddag.arcCount());
            output.writeInt(gaddag.root());
            for (int node = 0; node < gaddag.nodeCount(); node++) {
                int mask = gaddag.arcMask(node);
                output.writeInt(mask);
                output.writeBoolean(gaddag.terminalFlag(node));
                int first = gaddag.firstArc(node);
                int count = Integer.bitCount(mask);
                for (int arc = first; arc < first + count; arc++) {
                    output.writeInt(gaddag.arcTarget(arc));
                }
            }
            output.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to serialize GADDAG", ex);
        }
        byte[] bytes = buffer.toByteArray();
        LOGGER.fine(() -> String.format("Serialized GADDAG with %d nodes into %d bytes", gaddag.nodeCount(),
                bytes.length));
        return bytes;
    }

    /**
     * Rebuilds an automaton written by {@link #serialize}.
     *
     * @throws ConstructionException if {@code bytes} is not a well-formed serialized automaton
     */
    public static Gaddag deserialize(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        try (DataInputStream input = new DataInputStream(new ByteArrayInputStream(bytes))) {
            int magic = input.readInt();
            if (magic != MAGIC) {
                throw new ConstructionException(String.format("Bad GADDAG magic 0x%08x", magic));
            }
            int version = input.readInt();
            if (version != VERSION) {
                throw new ConstructionException("Unsupported GADDAG format version " + version);
            }
            int nodeCount = input.readInt();
            int arcCount = input.readInt();
            int root = input.readInt();
            if (nodeCount < 1 || arcCount < 0 || root < 0 || root >= nodeCount) {
                throw new ConstructionException("Corrupt GADDAG header: nodes=" + nodeCount + ", arcs=" + arcCount
                        + ", root=" + root);
            }
            if ((long) nodeCount * (Integer.BYTES + 1) + (long) arcCount * Integer.BYTES > bytes.length) {
                throw new ConstructionException("GADDAG header declares more data than present");
            }

            int[] arcMasks = new int[nodeCount];
            int[] firstArc = new int[nodeCount];
            int[] arcTargets = new int[arcCount];
            boolean[] terminal = new boolean[nodeCount];
            int arc = 0;
            for (int node = 0; node < nodeCount; node++) {
                int mask = input.readInt();
                if ((mask & ~SYMBOL_MASK) != 0) {
                    throw new ConstructionException("Node " + node + " has arcs outside the alphabet");
                }
                arcMasks[node] = mask;
                terminal[node] = input.readBoolean();
                firstArc[node] = arc;
                int count = Integer.bitCount(mask);
                if (arc + count > arcCount) {
                    throw new ConstructionException("Node " + node + " exceeds the declared arc count");
                }
                for (int i = 0; i < count; i++) {
                    int target = input.readInt();
                    if (target < 0 || target >= nodeCount) {
                        throw new ConstructionException("Node " + node + " points at missing node " + target);
                    }
                    arcTargets[arc++] = target;
                }
            }
            if (arc != arcCount) {
                throw new ConstructionException("Expected " + arcCount + " arcs but read " + arc);
            }
            if (input.available() > 0) {
                throw new ConstructionException("Trailing bytes after GADDAG data");
            }
            return new Gaddag(root, arcMasks, firstArc, arcTargets, terminal);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to read serialized GADDAG", ex);
            throw new ConstructionException("Truncated GADDAG data", ex);
        }
    }

    private static int estimateSize(Gaddag gaddag) {
        long size = 5L * Integer.BYTES + (long) gaddag.nodeCount() * (Integer.BYTES + 1)
                + (long) gaddag.arcCount() * Integer.BYTES;
        return (int) Math.min(Integer.MAX_VALUE - 8, size);
    }
}
