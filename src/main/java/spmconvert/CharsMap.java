package spmconvert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Character substitution table: each key string is replaced by its value string
 * during normalization.
 *
 * <p>Keys and values are sequences of Unicode codepoints held as Java strings.
 * Instances are immutable and keep their insertion order.</p>
 */
public final class CharsMap {
    private final Map<String, String> mappings;

    private CharsMap(Map<String, String> mappings) {
        this.mappings = Collections.unmodifiableMap(mappings);
    }

    /**
     * Creates a chars map from arbitrary mappings.
     *
     * @param mappings key &rarr; replacement pairs; copied
     * @return the chars map
     */
    public static CharsMap of(Map<String, String> mappings) {
        return new CharsMap(new LinkedHashMap<>(mappings));
    }

    /**
     * Builds the normalizer direction: raw byte &rarr; substitute codepoint.
     *
     * @param entries remap table from {@link ByteRemapTable#build()}
     * @return the forward chars map
     */
    public static CharsMap forward(List<ByteRemapTable.Entry> entries) {
        Map<String, String> m = new LinkedHashMap<>();
        for (ByteRemapTable.Entry e : entries) {
            m.put(codepoint(e.byteValue()), codepoint(e.substitute()));
        }
        return new CharsMap(m);
    }

    /**
     * Builds the denormalizer direction: substitute codepoint &rarr; raw byte.
     *
     * @param entries remap table from {@link ByteRemapTable#build()}
     * @return the inverse chars map
     */
    public static CharsMap inverse(List<ByteRemapTable.Entry> entries) {
        Map<String, String> m = new LinkedHashMap<>();
        for (ByteRemapTable.Entry e : entries) {
            m.put(codepoint(e.substitute()), codepoint(e.byteValue()));
        }
        return new CharsMap(m);
    }

    private static String codepoint(int cp) {
        return new String(Character.toChars(cp));
    }

    public Map<String, String> mappings() {
        return mappings;
    }

    public int size() {
        return mappings.size();
    }

    public boolean isEmpty() {
        return mappings.isEmpty();
    }

    /**
     * @param key the string to look up
     * @return the replacement, or {@code null} if {@code key} is not mapped
     */
    public String get(String key) {
        return mappings.get(key);
    }

    @Override
    public String toString() {
        return "<CharsMap with " + mappings.size() + " mappings>";
    }
}
