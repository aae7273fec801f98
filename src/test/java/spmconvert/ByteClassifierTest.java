package spmconvert;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ByteClassifierTest {

    @Test
    void testEveryByteIsPrintableInAtMostOneRange() {
        List<ByteRange> ranges = ByteClassifier.PRINTABLE_RANGES;
        for (int b = 1; b <= 255; b++) {
            int hits = 0;
            for (ByteRange r : ranges) {
                if (r.contains(b)) hits++;
            }
            assertTrue(hits <= 1, "byte " + b + " is in " + hits + " ranges");
            assertEquals(hits == 1, ByteClassifier.isPrintable(b), "byte " + b);
        }
    }

    @Test
    void testRangesAreDisjointAndPartial() {
        List<ByteRange> ranges = ByteClassifier.PRINTABLE_RANGES;
        assertEquals(3, ranges.size());
        for (int i = 0; i < ranges.size(); i++) {
            for (int j = i + 1; j < ranges.size(); j++) {
                assertFalse(ranges.get(i).overlaps(ranges.get(j)), ranges.get(i) + " overlaps " + ranges.get(j));
            }
        }
        assertEquals(94, ranges.get(0).size());
        assertEquals(12, ranges.get(1).size());
        assertEquals(82, ranges.get(2).size());
        assertFalse(ByteClassifier.isPrintable(0));
    }

    @Test
    void testNonPrintableExamples() {
        assertFalse(ByteClassifier.isPrintable(' '));
        assertFalse(ByteClassifier.isPrintable('\n'));
        assertFalse(ByteClassifier.isPrintable(0x7F));
        assertFalse(ByteClassifier.isPrintable(0xA0));
        assertFalse(ByteClassifier.isPrintable(0xAD));
        assertTrue(ByteClassifier.isPrintable('!'));
        assertTrue(ByteClassifier.isPrintable('~'));
        assertTrue(ByteClassifier.isPrintable(0xFF));
    }

    @Test
    void testRejectsNonByteValues() {
        assertThrows(IllegalArgumentException.class, () -> ByteClassifier.isPrintable(256));
        assertThrows(IllegalArgumentException.class, () -> ByteClassifier.isPrintable(-1));
        assertThrows(IllegalArgumentException.class, () -> new ByteRange(10, 5));
    }
}
