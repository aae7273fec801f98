package spmconvert;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles {@link CharsMap}s into SentencePiece precompiled chars map blobs and
 * wraps them into {@link NormalizationTable}s.
 *
 * <p>The output layout matches SentencePiece's own chars map compiler:</p>
 * <ol>
 *   <li>Distinct replacement strings are UTF-8 encoded, sorted by their bytes and
 *       concatenated, each followed by a NUL byte.</li>
 *   <li>UTF-8 keys are sorted by their bytes and stored in a double-array trie
 *       whose values are offsets into the replacement strings.</li>
 *   <li>The blob is {@code uint32le(trie bytes) + trie + replacement strings}.</li>
 * </ol>
 *
 * <p>Every compiled table is read back and checked key by key before it is
 * returned.</p>
 */
public final class CharsMapCompiler {
    private static final Logger LOGGER = ConverterLogging.getLogger(CharsMapCompiler.class);

    /**
     * Upper bound on the number of keys sharing a prefix with any single key,
     * as enforced by the SentencePiece runtime.
     */
    static final int MAX_TRIE_RESULTS = 32;

    /**
     * Name of the normalizer spec that maps raw bytes to substitute codepoints.
     */
    public static final String FORWARD_NAME = "hf_bytes_to_unicode";

    /**
     * Name of the denormalizer spec that maps substitute codepoints back to bytes.
     */
    public static final String INVERSE_NAME = "hf_unicode_to_bytes";

    private static final Comparator<byte[]> UNSIGNED_BYTES = Arrays::compareUnsigned;

    private CharsMapCompiler() {
    }

    /**
     * Builds and compiles the normalizer table (byte &rarr; substitute).
     *
     * @param entries remap table from {@link ByteRemapTable#build()}
     * @return the forward normalization table
     * @throws CharsMapCompileException if the table cannot be compiled
     */
    public static NormalizationTable forwardTable(List<ByteRemapTable.Entry> entries) {
        return NormalizationTable.byteSubstitution(FORWARD_NAME, compile(CharsMap.forward(entries)));
    }

    /**
     * Builds and compiles the denormalizer table (substitute &rarr; byte).
     *
     * @param entries remap table from {@link ByteRemapTable#build()}
     * @return the inverse normalization table
     * @throws CharsMapCompileException if the table cannot be compiled
     */
    public static NormalizationTable inverseTable(List<ByteRemapTable.Entry> entries) {
        return NormalizationTable.byteSubstitution(INVERSE_NAME, compile(CharsMap.inverse(entries)));
    }

    /**
     * Compiles a chars map into a precompiled chars map blob.
     *
     * @param charsMap the table to compile
     * @return the blob
     * @throws CharsMapCompileException if the map is empty, a key is empty, two keys
     *                                  collide, a key or value holds NUL or an unpaired
     *                                  surrogate, or the compiled trie fails its self-check
     */
    public static byte[] compile(CharsMap charsMap) {
        if (charsMap.isEmpty()) {
            throw new CharsMapCompileException("Chars map is empty");
        }
        LOGGER.fine(() -> "Compiling chars map of size=" + charsMap.size());

        // replacement bytes -> offset in the normalized blob
        TreeMap<byte[], Integer> normalizedToPos = new TreeMap<>(UNSIGNED_BYTES);
        // key bytes -> replacement bytes
        TreeMap<byte[], byte[]> keyToValue = new TreeMap<>(UNSIGNED_BYTES);

        for (Map.Entry<String, String> e : charsMap.mappings().entrySet()) {
            byte[] key = encode(e.getKey(), "key");
            byte[] value = encode(e.getValue(), "value");
            if (key.length == 0) {
                throw new CharsMapCompileException("Chars map contains an empty key");
            }
            if (contains(key, (byte) 0) || contains(value, (byte) 0)) {
                throw new CharsMapCompileException("NUL character in mapping " + describe(e.getKey()));
            }
            if (keyToValue.put(key, value) != null) {
                throw new CharsMapCompileException("Duplicate key " + describe(e.getKey()));
            }
            normalizedToPos.put(value, 0);
        }

        ByteArrayOutputStream normalized = new ByteArrayOutputStream();
        for (Map.Entry<byte[], Integer> e : normalizedToPos.entrySet()) {
            e.setValue(normalized.size());
            normalized.writeBytes(e.getKey());
            normalized.write(0);
        }

        List<byte[]> keys = new ArrayList<>(keyToValue.keySet());
        int[] values = new int[keys.size()];
        int i = 0;
        for (byte[] value : keyToValue.values()) {
            values[i++] = normalizedToPos.get(value);
        }

        DoubleArrayTrie trie;
        try {
            trie = DoubleArrayTrie.build(keys, values);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            throw new CharsMapCompileException("Cannot build double-array: " + ex.getMessage(), ex);
        }

        verify(trie, keys, values);

        byte[] trieBlob = trie.toBytes();
        ByteBuffer blob = ByteBuffer.allocate(Integer.BYTES + trieBlob.length + normalized.size())
                .order(ByteOrder.LITTLE_ENDIAN);
        blob.putInt(trieBlob.length);
        blob.put(trieBlob);
        blob.put(normalized.toByteArray());

        LOGGER.log(Level.FINE, "Compiled chars map: {0} keys, {1} trie units, {2} bytes",
                new Object[]{keys.size(), trie.size(), blob.capacity()});
        return blob.array();
    }

    private static void verify(DoubleArrayTrie trie, List<byte[]> keys, int[] values) {
        for (int k = 0; k < keys.size(); k++) {
            byte[] key = keys.get(k);
            int prefixes = trie.commonPrefixSearch(key, 0, key.length).size();
            if (prefixes >= MAX_TRIE_RESULTS) {
                throw new CharsMapCompileException("Key " + describe(key) + " shares " + prefixes
                        + " prefixes; at most " + (MAX_TRIE_RESULTS - 1) + " are supported");
            }
            int found = trie.exactMatch(key);
            if (found != values[k]) {
                throw new CharsMapCompileException("Trie self-check failed for key " + describe(key)
                        + ": expected " + values[k] + " but found " + found);
            }
        }
    }

    private static byte[] encode(String s, String what) {
        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer buffer = encoder.encode(CharBuffer.wrap(s));
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return bytes;
        } catch (CharacterCodingException ex) {
            throw new CharsMapCompileException("Chars map " + what + " is not valid Unicode: " + describe(s), ex);
        }
    }

    private static boolean contains(byte[] bytes, byte b) {
        for (byte x : bytes) {
            if (x == b) return true;
        }
        return false;
    }

    private static String describe(String s) {
        StringBuilder sb = new StringBuilder();
        s.codePoints().forEach(cp -> {
            if (sb.length() > 0) sb.append(' ');
            sb.append(String.format("U+%04X", cp));
        });
        return sb.toString();
    }

    private static String describe(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("\\x%02X", b & 0xFF));
        }
        return sb.toString();
    }
}
