package spmconvert;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Classifies raw byte values as printable or non-printable.
 *
 * <p>A byte is printable when its Latin-1 character is a visible glyph that can
 * stand for itself in a byte-level vocabulary. The three ranges follow the GPT-2
 * {@code bytes_to_unicode} table:</p>
 * <ul>
 *   <li>{@code [33, 126]} &ndash; {@code '!'} to {@code '~'}</li>
 *   <li>{@code [161, 172]} &ndash; {@code '¡'} to {@code '¬'}</li>
 *   <li>{@code [174, 255]} &ndash; {@code '®'} to {@code 'ÿ'}</li>
 * </ul>
 *
 * <p>Every other byte (control characters, space, DEL, NBSP and the soft hyphen)
 * is non-printable and gets a substitute codepoint from {@link ByteRemapTable}.</p>
 */
public final class ByteClassifier {

    /**
     * Printable byte ranges, in ascending order. Disjoint.
     */
    public static final List<ByteRange> PRINTABLE_RANGES = Collections.unmodifiableList(Arrays.asList(
            new ByteRange('!', '~'),
            new ByteRange(0xA1, 0xAC),
            new ByteRange(0xAE, 0xFF)
    ));

    private ByteClassifier() {
    }

    /**
     * Returns {@code true} if {@code b} falls inside one of the {@link #PRINTABLE_RANGES}.
     *
     * @param b a byte value in {@code [0, 255]}
     * @return whether the byte is left untouched by the remapping
     * @throws IllegalArgumentException if {@code b} is not a byte value
     */
    public static boolean isPrintable(int b) {
        if (b < 0 || b > 255) {
            throw new IllegalArgumentException("Not a byte value: " + b);
        }
        for (ByteRange range : PRINTABLE_RANGES) {
            if (range.contains(b)) {
                return true;
            }
        }
        return false;
    }
}
