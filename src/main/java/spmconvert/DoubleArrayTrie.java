package spmconvert;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Double-array trie using the darts-clone unit layout, which is the trie format
 * embedded in SentencePiece precompiled chars maps.
 *
 * <p>Each unit is a 32-bit word:</p>
 * <ul>
 *   <li>bits 0&ndash;7: label of the edge leading to this node</li>
 *   <li>bit 8: the node has a value leaf at {@code pos ^ offset}</li>
 *   <li>bits 10&ndash;30: XOR offset to the node's children</li>
 *   <li>bit 31: the unit is a leaf, bits 0&ndash;30 hold the value</li>
 * </ul>
 *
 * <p>A child reached through byte {@code c} lives at {@code pos ^ offset ^ c}, so
 * all children of a node share one 256-unit block. Unused units carry a label
 * that can never match a lookup from a real node of the same block.</p>
 */
final class DoubleArrayTrie {
    private static final int BLOCK_SIZE = 256;
    private static final int HAS_LEAF_BIT = 1 << 8;
    private static final int EXTENSION_BIT = 1 << 9;
    private static final int IS_LEAF_BIT = 1 << 31;
    private static final int MAX_OFFSET = 1 << 21;

    private final int[] units;

    private DoubleArrayTrie(int[] units) {
        this.units = units;
    }

    /**
     * One result of {@link #commonPrefixSearch(byte[], int, int)}.
     */
    static final class Match {
        final int value;
        final int length;

        Match(int value, int length) {
            this.value = value;
            this.length = length;
        }
    }

    /**
     * Builds a trie over {@code keys}.
     *
     * @param keys   non-empty byte strings without NUL bytes, strictly ascending in
     *               unsigned byte order
     * @param values non-negative payloads, one per key
     * @return the compiled trie
     * @throws IllegalArgumentException if the keys are empty, out of order, duplicated
     *                                  or contain a NUL byte, or a value is negative
     */
    static DoubleArrayTrie build(List<byte[]> keys, int[] values) {
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a trie without keys");
        }
        if (keys.size() != values.length) {
            throw new IllegalArgumentException("Got " + keys.size() + " keys but " + values.length + " values");
        }
        for (int i = 0; i < keys.size(); i++) {
            byte[] key = keys.get(i);
            if (key.length == 0) {
                throw new IllegalArgumentException("Empty key at index " + i);
            }
            for (byte b : key) {
                if (b == 0) {
                    throw new IllegalArgumentException("NUL byte in key at index " + i);
                }
            }
            if (i > 0 && Arrays.compareUnsigned(keys.get(i - 1), key) >= 0) {
                throw new IllegalArgumentException("Keys are not strictly ascending at index " + i);
            }
            if (values[i] < 0) {
                throw new IllegalArgumentException("Negative value at index " + i + ": " + values[i]);
            }
        }

        Builder builder = new Builder();
        builder.insert(0, keys, values, 0, keys.size(), 0);
        return new DoubleArrayTrie(builder.finish());
    }

    /**
     * Reads a trie from its little-endian serialized form.
     *
     * @param blob   source bytes
     * @param offset position of the first unit
     * @param length byte length of the unit array; a positive multiple of 4
     * @return the trie
     * @throws IllegalArgumentException if the length is not a whole number of units
     */
    static DoubleArrayTrie fromBytes(byte[] blob, int offset, int length) {
        if (length <= 0 || length % Integer.BYTES != 0) {
            throw new IllegalArgumentException("Invalid trie size: " + length);
        }
        ByteBuffer buffer = ByteBuffer.wrap(blob, offset, length).order(ByteOrder.LITTLE_ENDIAN);
        int[] units = new int[length / Integer.BYTES];
        for (int i = 0; i < units.length; i++) {
            units[i] = buffer.getInt();
        }
        return new DoubleArrayTrie(units);
    }

    /**
     * @return the number of 32-bit units
     */
    int size() {
        return units.length;
    }

    /**
     * Serializes the units as little-endian 32-bit words.
     *
     * @return a new byte array of {@code size() * 4} bytes
     */
    byte[] toBytes() {
        ByteBuffer buffer = ByteBuffer.allocate(units.length * Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (int unit : units) {
            buffer.putInt(unit);
        }
        return buffer.array();
    }

    /**
     * Looks up {@code key} as a whole.
     *
     * @param key the key bytes
     * @return the stored value, or {@code -1} if the key is absent
     */
    int exactMatch(byte[] key) {
        int nodePos = 0;
        int unit = units[nodePos];
        for (byte b : key) {
            int label = b & 0xFF;
            nodePos ^= offset(unit) ^ label;
            if (nodePos >= units.length) {
                return -1;
            }
            unit = units[nodePos];
            if (label(unit) != label) {
                return -1;
            }
        }
        if (!hasLeaf(unit)) {
            return -1;
        }
        int leafPos = nodePos ^ offset(unit);
        return leafPos < units.length ? value(units[leafPos]) : -1;
    }

    /**
     * Finds every key that is a prefix of {@code text[from, to)}, shortest first.
     *
     * @param text the input bytes
     * @param from first byte to match
     * @param to   end of the searchable region (exclusive)
     * @return the matches, possibly empty
     */
    List<Match> commonPrefixSearch(byte[] text, int from, int to) {
        List<Match> results = new ArrayList<>();
        int nodePos = offset(units[0]);
        for (int i = from; i < to; i++) {
            int label = text[i] & 0xFF;
            nodePos ^= label;
            if (nodePos >= units.length) {
                break;
            }
            int unit = units[nodePos];
            if (label(unit) != label) {
                break;
            }
            nodePos ^= offset(unit);
            if (hasLeaf(unit) && nodePos < units.length) {
                results.add(new Match(value(units[nodePos]), i - from + 1));
            }
        }
        return results;
    }

    private static boolean hasLeaf(int unit) {
        return (unit & HAS_LEAF_BIT) != 0;
    }

    private static int value(int unit) {
        return unit & ~IS_LEAF_BIT;
    }

    private static int label(int unit) {
        return unit & (IS_LEAF_BIT | 0xFF);
    }

    private static int offset(int unit) {
        return (unit >>> 10) << ((unit & EXTENSION_BIT) >>> 6);
    }

    /**
     * Places nodes depth-first, picking for every node the lowest free base whose
     * child slots are all free.
     */
    private static final class Builder {
        private int[] units = new int[BLOCK_SIZE];
        private final BitSet usedPositions = new BitSet();
        private final BitSet usedBases = new BitSet();
        private int firstFree = 1;

        Builder() {
            usedPositions.set(0);
            // base 0 would make the root unit reachable through a NUL label
            usedBases.set(0);
        }

        void insert(int pos, List<byte[]> keys, int[] values, int begin, int end, int depth) {
            int i = begin;
            boolean terminal = keys.get(i).length == depth;
            int terminalValue = terminal ? values[i] : 0;
            if (terminal) {
                i++;
            }

            List<int[]> groups = new ArrayList<>(); // {label, begin, end}
            while (i < end) {
                int label = keys.get(i)[depth] & 0xFF;
                int groupBegin = i;
                while (i < end && (keys.get(i)[depth] & 0xFF) == label) {
                    i++;
                }
                groups.add(new int[]{label, groupBegin, i});
            }

            int[] slotLabels = new int[groups.size() + (terminal ? 1 : 0)];
            int s = 0;
            if (terminal) {
                slotLabels[s++] = 0;
            }
            for (int[] group : groups) {
                slotLabels[s++] = group[0];
            }

            int base = findBase(slotLabels);
            usedBases.set(base);
            setOffset(pos, pos ^ base);

            if (terminal) {
                units[pos] |= HAS_LEAF_BIT;
                units[base] = IS_LEAF_BIT | terminalValue;
                usedPositions.set(base);
            }
            for (int[] group : groups) {
                int child = base ^ group[0];
                units[child] = group[0];
                usedPositions.set(child);
            }
            for (int[] group : groups) {
                insert(base ^ group[0], keys, values, group[1], group[2], depth + 1);
            }
        }

        private int findBase(int[] labels) {
            while (usedPositions.get(firstFree)) {
                firstFree++;
            }
            for (int q = firstFree; ; q = usedPositions.nextClearBit(q + 1)) {
                int base = q ^ labels[0];
                if (base == 0 || usedBases.get(base)) {
                    continue;
                }
                boolean fits = true;
                for (int label : labels) {
                    if (usedPositions.get(base ^ label)) {
                        fits = false;
                        break;
                    }
                }
                if (fits) {
                    ensureCapacity(base | (BLOCK_SIZE - 1));
                    return base;
                }
            }
        }

        private void setOffset(int pos, int offset) {
            if (offset >= MAX_OFFSET) {
                throw new IllegalStateException("Trie offset out of range: " + offset);
            }
            units[pos] = (units[pos] & (IS_LEAF_BIT | HAS_LEAF_BIT | 0xFF)) | (offset << 10);
        }

        private void ensureCapacity(int pos) {
            if (pos < units.length) {
                return;
            }
            int capacity = units.length;
            while (capacity <= pos) {
                capacity *= 2;
            }
            units = Arrays.copyOf(units, capacity);
        }

        int[] finish() {
            int blocks = (usedPositions.length() + BLOCK_SIZE - 1) / BLOCK_SIZE;
            int[] result = Arrays.copyOf(units, blocks * BLOCK_SIZE);
            for (int block = 0; block < blocks; block++) {
                int begin = block * BLOCK_SIZE;
                int unusedBase = -1;
                for (int b = begin; b < begin + BLOCK_SIZE; b++) {
                    if (!usedBases.get(b)) {
                        unusedBase = b;
                        break;
                    }
                }
                if (unusedBase < 0) {
                    throw new IllegalStateException("No free base left in trie block " + block);
                }
                for (int p = begin; p < begin + BLOCK_SIZE; p++) {
                    if (!usedPositions.get(p)) {
                        result[p] = (p ^ unusedBase) & 0xFF;
                    }
                }
            }
            return result;
        }
    }
}
