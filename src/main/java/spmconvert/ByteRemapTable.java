package spmconvert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the byte &rarr; substitute codepoint table for non-printable bytes.
 *
 * <p>Bytes {@code 1..255} are visited in ascending order; each non-printable byte
 * receives the next codepoint starting at {@link #FIRST_SUBSTITUTE}. The result is
 * a bijection onto a contiguous codepoint range and is identical on every call, so
 * the forward and inverse chars maps built from two separate calls always agree.</p>
 *
 * <p>Byte {@code 0} is never mapped: SentencePiece chars maps cannot hold an empty key.</p>
 */
public final class ByteRemapTable {

    /**
     * Codepoint assigned to the first non-printable byte.
     */
    public static final int FIRST_SUBSTITUTE = 257;

    private ByteRemapTable() {
    }

    /**
     * One {@code byte -> substitute} pair.
     */
    public static final class Entry {
        private final int byteValue;
        private final int substitute;

        Entry(int byteValue, int substitute) {
            this.byteValue = byteValue;
            this.substitute = substitute;
        }

        /**
         * @return the raw byte value in {@code [1, 255]}
         */
        public int byteValue() {
            return byteValue;
        }

        /**
         * @return the substitute codepoint, {@code >= 257}
         */
        public int substitute() {
            return substitute;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Entry)) return false;
            Entry that = (Entry) o;
            return byteValue == that.byteValue && substitute == that.substitute;
        }

        @Override
        public int hashCode() {
            return 31 * byteValue + substitute;
        }

        @Override
        public String toString() {
            return String.format("0x%02X -> U+%04X", byteValue, substitute);
        }
    }

    /**
     * Builds the remap table.
     *
     * @return an unmodifiable list of entries ordered by byte value
     */
    public static List<Entry> build() {
        List<Entry> entries = new ArrayList<>();
        int n = 1;
        for (int i = 1; i < 256; i++) {
            if (!ByteClassifier.isPrintable(i)) {
                entries.add(new Entry(i, 256 + n));
                n++;
            }
        }
        return Collections.unmodifiableList(entries);
    }
}
