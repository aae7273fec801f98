package spmconvert;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Decoded SentencePiece precompiled chars map.
 *
 * <p>Blob layout: a little-endian {@code uint32} holding the byte size of the trie,
 * the {@link DoubleArrayTrie} units, then the NUL-terminated replacement strings.
 * Each trie value is the offset of a replacement string.</p>
 *
 * <p>{@link #normalize(String)} applies the map the way the SentencePiece runtime
 * does: at every position the longest matching key is replaced; where nothing
 * matches one UTF-8 character is copied through, and a malformed byte becomes
 * U+FFFD.</p>
 */
public final class PrecompiledCharsMap {
    private static final byte[] REPLACEMENT_CHAR = "\uFFFD".getBytes(StandardCharsets.UTF_8);

    private final DoubleArrayTrie trie;
    private final byte[] normalized;

    PrecompiledCharsMap(DoubleArrayTrie trie, byte[] normalized) {
        this.trie = trie;
        this.normalized = normalized;
    }

    /**
     * Decodes a precompiled chars map blob.
     *
     * @param blob bytes produced by {@link CharsMapCompiler#compile(CharsMap)} or
     *             read from a model's normalizer spec
     * @return the decoded map
     * @throws IllegalArgumentException if the blob is truncated or inconsistent
     */
    public static PrecompiledCharsMap decode(byte[] blob) {
        if (blob.length <= Integer.BYTES) {
            throw new IllegalArgumentException("Blob for normalization rule is broken");
        }
        long trieSize = ByteBuffer.wrap(blob, 0, Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN).getInt() & 0xFFFFFFFFL;
        if (trieSize >= blob.length) {
            throw new IllegalArgumentException("Trie data size exceeds the input blob size: " + trieSize);
        }
        int normalizedStart = Integer.BYTES + (int) trieSize;
        if (normalizedStart > blob.length) {
            throw new IllegalArgumentException("Trie data size exceeds the input blob size: " + trieSize);
        }
        DoubleArrayTrie trie = DoubleArrayTrie.fromBytes(blob, Integer.BYTES, (int) trieSize);
        byte[] normalized = new byte[blob.length - normalizedStart];
        System.arraycopy(blob, normalizedStart, normalized, 0, normalized.length);
        return new PrecompiledCharsMap(trie, normalized);
    }

    /**
     * Returns the replacement for {@code key} if it is exactly a key of this map.
     *
     * @param key the string to look up
     * @return the replacement, or {@code null} if {@code key} is not a key
     */
    public String lookup(String key) {
        int value = trie.exactMatch(key.getBytes(StandardCharsets.UTF_8));
        return value < 0 ? null : new String(replacementAt(value), StandardCharsets.UTF_8);
    }

    /**
     * Normalizes {@code text} with longest-prefix replacement.
     *
     * @param text input text
     * @return the normalized text
     */
    public String normalize(String text) {
        return new String(normalize(text.getBytes(StandardCharsets.UTF_8)), StandardCharsets.UTF_8);
    }

    /**
     * Normalizes UTF-8 bytes with longest-prefix replacement.
     *
     * @param input UTF-8 input
     * @return the normalized UTF-8 bytes
     */
    public byte[] normalize(byte[] input) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(input.length);
        int pos = 0;
        while (pos < input.length) {
            List<DoubleArrayTrie.Match> matches = trie.commonPrefixSearch(input, pos, input.length);
            DoubleArrayTrie.Match longest = null;
            for (DoubleArrayTrie.Match m : matches) {
                if (longest == null || m.length > longest.length) {
                    longest = m;
                }
            }
            if (longest != null) {
                out.writeBytes(replacementAt(longest.value));
                pos += longest.length;
                continue;
            }
            int charLength = validUtf8Length(input, pos);
            if (charLength == 0) {
                out.writeBytes(REPLACEMENT_CHAR);
                pos++;
            } else {
                out.write(input, pos, charLength);
                pos += charLength;
            }
        }
        return out.toByteArray();
    }

    /**
     * @return the number of trie units
     */
    public int trieSize() {
        return trie.size();
    }

    private byte[] replacementAt(int offset) {
        if (offset >= normalized.length) {
            throw new IllegalStateException("Replacement offset out of range: " + offset);
        }
        int end = offset;
        while (end < normalized.length && normalized[end] != 0) {
            end++;
        }
        byte[] result = new byte[end - offset];
        System.arraycopy(normalized, offset, result, 0, result.length);
        return result;
    }

    /**
     * Length of the well-formed UTF-8 character at {@code pos}, or 0 if malformed.
     */
    private static int validUtf8Length(byte[] s, int pos) {
        int lead = s[pos] & 0xFF;
        int length;
        int min = 0x80;
        int max = 0xBF;
        if (lead < 0x80) {
            return 1;
        } else if (lead >= 0xC2 && lead <= 0xDF) {
            length = 2;
        } else if (lead >= 0xE0 && lead <= 0xEF) {
            length = 3;
            if (lead == 0xE0) min = 0xA0;
            if (lead == 0xED) max = 0x9F;
        } else if (lead >= 0xF0 && lead <= 0xF4) {
            length = 4;
            if (lead == 0xF0) min = 0x90;
            if (lead == 0xF4) max = 0x8F;
        } else {
            return 0;
        }
        if (pos + length > s.length) {
            return 0;
        }
        int second = s[pos + 1] & 0xFF;
        if (second < min || second > max) {
            return 0;
        }
        for (int i = 2; i < length; i++) {
            int b = s[pos + i] & 0xFF;
            if (b < 0x80 || b > 0xBF) {
                return 0;
            }
        }
        return length;
    }
}
