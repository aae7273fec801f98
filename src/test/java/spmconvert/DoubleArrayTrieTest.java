package spmconvert;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DoubleArrayTrieTest {

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static DoubleArrayTrie sample() {
        return DoubleArrayTrie.build(Arrays.asList(b("a"), b("ab"), b("abc"), b("b"), b("ba")),
                new int[]{10, 20, 30, 40, 50});
    }

    @Test
    void testExactMatch() {
        DoubleArrayTrie trie = sample();
        assertEquals(10, trie.exactMatch(b("a")));
        assertEquals(20, trie.exactMatch(b("ab")));
        assertEquals(30, trie.exactMatch(b("abc")));
        assertEquals(40, trie.exactMatch(b("b")));
        assertEquals(50, trie.exactMatch(b("ba")));
        assertEquals(-1, trie.exactMatch(b("abcd")));
        assertEquals(-1, trie.exactMatch(b("c")));
        assertEquals(-1, trie.exactMatch(b("bb")));
        assertEquals(-1, trie.exactMatch(new byte[]{'a', 0}));
    }

    @Test
    void testCommonPrefixSearchReturnsShortestFirst() {
        DoubleArrayTrie trie = sample();
        byte[] text = b("xabcd");
        List<DoubleArrayTrie.Match> matches = trie.commonPrefixSearch(text, 1, text.length);
        assertEquals(3, matches.size());
        assertEquals(10, matches.get(0).value);
        assertEquals(1, matches.get(0).length);
        assertEquals(30, matches.get(2).value);
        assertEquals(3, matches.get(2).length);

        assertTrue(trie.commonPrefixSearch(text, 0, text.length).isEmpty());
        assertTrue(trie.commonPrefixSearch(new byte[]{0, 'a'}, 0, 2).isEmpty());
    }

    @Test
    void testSerializedFormIsWholeBlocks() {
        DoubleArrayTrie trie = sample();
        byte[] bytes = trie.toBytes();
        assertEquals(0, trie.size() % 256);
        assertEquals(trie.size() * 4, bytes.length);

        DoubleArrayTrie reread = DoubleArrayTrie.fromBytes(bytes, 0, bytes.length);
        assertEquals(30, reread.exactMatch(b("abc")));
        assertArrayEquals(bytes, reread.toBytes());
    }

    @Test
    void testManyKeysSpanSeveralBlocks() {
        List<byte[]> keys = new ArrayList<>();
        for (int hi = 0xC2; hi <= 0xDF; hi++) {
            for (int lo = 0x80; lo <= 0xBF; lo++) {
                keys.add(new byte[]{(byte) hi, (byte) lo});
            }
        }
        int[] values = new int[keys.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = i * 3;
        }
        DoubleArrayTrie trie = DoubleArrayTrie.build(keys, values);
        assertTrue(trie.size() > 256);
        for (int i = 0; i < keys.size(); i++) {
            assertEquals(values[i], trie.exactMatch(keys.get(i)));
        }
        assertEquals(-1, trie.exactMatch(new byte[]{(byte) 0xC2}));
    }

    @Test
    void testRejectsInvalidKeys() {
        assertThrows(IllegalArgumentException.class,
                () -> DoubleArrayTrie.build(List.of(), new int[0]));
        assertThrows(IllegalArgumentException.class,
                () -> DoubleArrayTrie.build(Arrays.asList(b("b"), b("a")), new int[]{1, 2}));
        assertThrows(IllegalArgumentException.class,
                () -> DoubleArrayTrie.build(Arrays.asList(b("a"), b("a")), new int[]{1, 2}));
        assertThrows(IllegalArgumentException.class,
                () -> DoubleArrayTrie.build(Arrays.asList(new byte[0]), new int[]{1}));
        assertThrows(IllegalArgumentException.class,
                () -> DoubleArrayTrie.build(Arrays.asList(new byte[]{'a', 0}), new int[]{1}));
        assertThrows(IllegalArgumentException.class,
                () -> DoubleArrayTrie.build(Arrays.asList(b("a")), new int[]{-1}));
    }
}
