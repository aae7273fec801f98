package spmconvert;

/**
 * Closed interval {@code [lo, hi]} of byte values.
 *
 * <p>Instances are immutable and are used by {@link ByteClassifier} to describe
 * the byte values that already have a visible character of their own.</p>
 */
public final class ByteRange {
    private final int lo;
    private final int hi;

    /**
     * Creates a new range.
     *
     * @param lo the smallest byte value in the range (inclusive)
     * @param hi the largest byte value in the range (inclusive)
     * @throws IllegalArgumentException if the bounds are outside {@code [0, 255]}
     *                                  or {@code lo > hi}
     */
    public ByteRange(int lo, int hi) {
        if (lo < 0 || hi > 255 || lo > hi) {
            throw new IllegalArgumentException("Invalid byte range: [" + lo + ", " + hi + "]");
        }
        this.lo = lo;
        this.hi = hi;
    }

    public int lo() {
        return lo;
    }

    public int hi() {
        return hi;
    }

    /**
     * Returns the number of byte values covered by this range.
     *
     * @return {@code hi - lo + 1}
     */
    public int size() {
        return hi - lo + 1;
    }

    /**
     * Checks whether {@code value} lies inside this range.
     *
     * @param value the byte value to test
     * @return {@code true} if {@code lo <= value <= hi}
     */
    public boolean contains(int value) {
        return value >= lo && value <= hi;
    }

    /**
     * Checks whether this range shares at least one value with {@code other}.
     *
     * @param other the range to compare against
     * @return {@code true} if the two ranges overlap
     */
    public boolean overlaps(ByteRange other) {
        return lo <= other.hi && other.lo <= hi;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ByteRange)) return false;
        ByteRange that = (ByteRange) o;
        return lo == that.lo && hi == that.hi;
    }

    @Override
    public int hashCode() {
        return 31 * lo + hi;
    }

    @Override
    public String toString() {
        return "[" + lo + ", " + hi + "]";
    }
}
