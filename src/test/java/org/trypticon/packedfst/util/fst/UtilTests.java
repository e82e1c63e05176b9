package org.trypticon.packedfst.util.fst;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;
import org.apache.lucene.util.IntsRef;
import org.apache.lucene.util.IntsRefBuilder;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertThrows;

/**
 * Tests for {@link Util}.
 */
public class UtilTests {
    private static final PositiveIntOutputs LONGS = PositiveIntOutputs.getSingleton();

    private static FST<Long> catCarCart() throws Exception {
        Map<String, Long> entries = new LinkedHashMap<>();
        entries.put("cat", 1L);
        entries.put("car", 2L);
        entries.put("cart", 3L);
        return FSTTestUtils.build(FST.INPUT_TYPE.BYTE1, LONGS, entries);
    }

    private static String key(IntsRef input) {
        return Util.toBytesRef(input, new BytesRefBuilder()).utf8ToString();
    }

    private static List<String> keys(Util.TopResults<Long> results) {
        List<String> keys = new ArrayList<>();
        for (Util.Result<Long> result : results) {
            keys.add(key(result.input));
        }
        return keys;
    }

    @Test
    public void testGetByOutput() throws Exception {
        Map<String, Long> ordinals = FSTTestUtils.ordinals(
                FSTTestUtils.randomKeys(new Random(11), 200, 6, "abcdef"));
        FST<Long> fst = FSTTestUtils.build(FST.INPUT_TYPE.BYTE1, LONGS, ordinals);
        for (Map.Entry<String, Long> entry : ordinals.entrySet()) {
            assertThat(key(Util.getByOutput(fst, entry.getValue())), is(entry.getKey()));
        }
        assertThat(Util.getByOutput(fst, ordinals.size()), is(nullValue()));
    }

    @Test
    public void testGetByOutputOnPackedFst() throws Exception {
        Map<String, Long> ordinals = FSTTestUtils.ordinals(
                FSTTestUtils.randomKeys(new Random(12), 200, 6, "abcdef"));
        FST<Long> fst = FSTTestUtils.buildPacked(FST.INPUT_TYPE.BYTE1, LONGS, ordinals);
        for (Map.Entry<String, Long> entry : ordinals.entrySet()) {
            assertThat(key(Util.getByOutput(fst, entry.getValue())), is(entry.getKey()));
        }
    }

    @Test
    public void testShortestPathsInCostOrder() throws Exception {
        FST<Long> fst = catCarCart();
        Util.TopResults<Long> results = Util.shortestPaths(fst, fst.getFirstArc(new FST.Arc<>()),
                LONGS.getNoOutput(), Comparator.naturalOrder(), 3, false);
        assertThat(keys(results), contains("cat", "car", "cart"));
        assertThat(results.topN.get(2).output, is(3L));
    }

    @Test
    public void testShortestPathsWithFewerPathsThanRequested() throws Exception {
        FST<Long> fst = catCarCart();
        Util.TopResults<Long> results = Util.shortestPaths(fst, fst.getFirstArc(new FST.Arc<>()),
                LONGS.getNoOutput(), Comparator.naturalOrder(), 10, false);
        assertThat(keys(results), contains("cat", "car", "cart"));
    }

    @Test
    public void testShortestPathsIncludesEmptyString() throws Exception {
        Map<String, Long> entries = new LinkedHashMap<>();
        entries.put("", 5L);
        entries.put("a", 1L);
        entries.put("b", 9L);
        FST<Long> fst = FSTTestUtils.build(FST.INPUT_TYPE.BYTE1, LONGS, entries);
        FST.Arc<Long> start = fst.getFirstArc(new FST.Arc<>());

        Util.TopResults<Long> with = Util.shortestPaths(fst, start, LONGS.getNoOutput(),
                Comparator.naturalOrder(), 3, true);
        assertThat(keys(with), contains("a", "", "b"));

        Util.TopResults<Long> without = Util.shortestPaths(fst, start, LONGS.getNoOutput(),
                Comparator.naturalOrder(), 3, false);
        assertThat(keys(without), contains("a", "b"));
    }

    @Test
    public void testSearcherSkipsRejectedResults() throws Exception {
        FST<Long> fst = catCarCart();
        Util.TopNSearcher<Long> searcher = new Util.TopNSearcher<Long>(fst, 2, 3, Comparator.naturalOrder()) {
            @Override
            protected boolean acceptResult(IntsRef input, Long output) {
                return !key(input).equals("car");
            }
        };
        searcher.addStartPaths(fst.getFirstArc(new FST.Arc<>()), LONGS.getNoOutput(), false, new IntsRefBuilder());
        Util.TopResults<Long> results = searcher.search();
        assertThat(keys(results), contains("cat", "cart"));
        assertThat(results.isComplete, is(true));
    }

    @Test
    public void testSearcherArguments() throws Exception {
        FST<Long> fst = catCarCart();
        assertThrows(IllegalArgumentException.class,
                () -> new Util.TopNSearcher<>(fst, 0, 5, Comparator.<Long>naturalOrder()));
        assertThrows(IllegalArgumentException.class,
                () -> new Util.TopNSearcher<>(fst, 5, 4, Comparator.<Long>naturalOrder()));
    }

    @Test
    public void testReadCeilArc() throws Exception {
        Map<String, Object> entries = new LinkedHashMap<>();
        for (String word : Arrays.asList("apple", "banana", "cherry", "date", "elder", "fig", "kiwi")) {
            entries.put(word, NoOutputs.getSingleton().getNoOutput());
        }
        FST<Object> fst = FSTTestUtils.build(FST.INPUT_TYPE.BYTE1, NoOutputs.getSingleton(), entries);
        FST.BytesReader in = fst.getBytesReader();
        FST.Arc<Object> root = fst.getFirstArc(new FST.Arc<>());

        // the root node has enough arcs to be stored as an array
        assertThat(Util.readCeilArc('c', fst, root, new FST.Arc<>(), in).label, is((int) 'c'));
        assertThat(Util.readCeilArc('g', fst, root, new FST.Arc<>(), in).label, is((int) 'k'));
        assertThat(Util.readCeilArc(0, fst, root, new FST.Arc<>(), in).label, is((int) 'a'));
        assertThat(Util.readCeilArc('z', fst, root, new FST.Arc<>(), in), is(nullValue()));
        assertThat(Util.readCeilArc(FST.END_LABEL, fst, root, new FST.Arc<>(), in), is(nullValue()));

        // the node after 'c' has a single arc
        FST.Arc<Object> c = fst.findTargetArc('c', root, new FST.Arc<>(), in);
        assertThat(Util.readCeilArc('a', fst, c, new FST.Arc<>(), in).label, is((int) 'h'));
        assertThat(Util.readCeilArc('h', fst, c, new FST.Arc<>(), in).label, is((int) 'h'));
        assertThat(Util.readCeilArc('i', fst, c, new FST.Arc<>(), in), is(nullValue()));
    }

    @Test
    public void testToDot() throws Exception {
        StringWriter writer = new StringWriter();
        Util.toDot(catCarCart(), writer, true, true);
        String dot = writer.toString();
        assertThat(dot, startsWith("digraph FST {"));
        assertThat(dot, containsString("initial ->"));
        assertThat(dot, containsString("label=\"c"));
        assertThat(dot, endsWith("}\n"));
    }

    @Test
    public void testToUTF32() {
        String text = "a\u00e9\uD83D\uDE00";
        IntsRef ints = Util.toUTF32(text, new IntsRefBuilder());
        assertThat(ints.length, is(3));
        assertThat(ints.ints[ints.offset], is((int) 'a'));
        assertThat(ints.ints[ints.offset + 1], is(0xE9));
        assertThat(ints.ints[ints.offset + 2], is(0x1F600));
    }

    @Test
    public void testToUTF16() {
        IntsRef ints = Util.toUTF16("a\uD83D\uDE00", new IntsRefBuilder());
        assertThat(ints.length, is(3));
        assertThat(ints.ints[ints.offset + 1], is(0xD83D));
        assertThat(ints.ints[ints.offset + 2], is(0xDE00));
    }

    @Test
    public void testBytesConversions() {
        BytesRef bytes = new BytesRef(new byte[] { 1, (byte) 0x80, (byte) 0xFF });
        IntsRef ints = Util.toIntsRef(bytes, new IntsRefBuilder());
        assertThat(ints.ints[ints.offset + 1], is(0x80));
        assertThat(ints.ints[ints.offset + 2], is(0xFF));
        assertThat(Util.toBytesRef(ints, new BytesRefBuilder()), is(bytes));
    }
}
