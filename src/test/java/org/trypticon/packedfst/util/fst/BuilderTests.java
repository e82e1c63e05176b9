package org.trypticon.packedfst.util.fst;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.IntsRef;
import org.apache.lucene.util.IntsRefBuilder;
import org.apache.lucene.util.packed.PackedInts;
import org.junit.Test;
import org.trypticon.packedfst.InfoStream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertThrows;

/**
 * Tests for {@link Builder}.
 */
public class BuilderTests {
    private static final PositiveIntOutputs LONGS = PositiveIntOutputs.getSingleton();

    private static IntsRef input(String key) {
        return Util.toIntsRef(new BytesRef(key), new IntsRefBuilder());
    }

    private static Builder<Long> builder(int minSuffixCount1, int shareMaxTailLength, int bytesPageBits) {
        return new Builder<>(FST.INPUT_TYPE.BYTE1, minSuffixCount1, 0, true, true, shareMaxTailLength, LONGS, null,
                false, PackedInts.COMPACT, true, bytesPageBits, null);
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> builder(-1, Integer.MAX_VALUE, 15));
        assertThrows(IllegalArgumentException.class, () -> builder(0, -1, 15));
        assertThrows(IllegalArgumentException.class, () -> builder(0, Integer.MAX_VALUE, 0));
        assertThrows(IllegalArgumentException.class, () -> builder(0, Integer.MAX_VALUE, 31));
    }

    @Test
    public void testOutOfOrderInput() throws Exception {
        Builder<Long> builder = new Builder<>(FST.INPUT_TYPE.BYTE1, LONGS);
        builder.add(input("b"), 1L);
        assertThrows(IllegalArgumentException.class, () -> builder.add(input("a"), 2L));
    }

    @Test
    public void testAddAfterFinish() throws Exception {
        Builder<Long> builder = new Builder<>(FST.INPUT_TYPE.BYTE1, LONGS);
        builder.add(input("a"), 1L);
        builder.finish();
        assertThrows(IllegalStateException.class, () -> builder.add(input("b"), 2L));
    }

    @Test
    public void testFinishTwice() throws Exception {
        Builder<Long> builder = new Builder<>(FST.INPUT_TYPE.BYTE1, LONGS);
        builder.add(input("a"), 1L);
        builder.finish();
        assertThrows(IllegalStateException.class, builder::finish);
    }

    @Test
    public void testNothingAccepted() throws Exception {
        assertThat(new Builder<>(FST.INPUT_TYPE.BYTE1, LONGS).finish(), is(nullValue()));
    }

    @Test
    public void testDuplicateInputsMergeForNoOutputs() throws Exception {
        NoOutputs outputs = NoOutputs.getSingleton();
        Builder<Object> builder = new Builder<>(FST.INPUT_TYPE.BYTE1, outputs);
        builder.add(input("dup"), outputs.getNoOutput());
        builder.add(input("dup"), outputs.getNoOutput());
        builder.add(input("other"), outputs.getNoOutput());
        FST<Object> fst = builder.finish();
        assertThat(FSTTestUtils.enumerate(fst).keySet(), contains("dup", "other"));
    }

    @Test
    public void testDuplicateInputsRejectedWithoutMerge() throws Exception {
        Builder<Long> builder = new Builder<>(FST.INPUT_TYPE.BYTE1, LONGS);
        builder.add(input("dup"), 1L);
        assertThrows(UnsupportedOperationException.class, () -> builder.add(input("dup"), 2L));
    }

    @Test
    public void testCounters() throws Exception {
        Builder<Long> builder = new Builder<>(FST.INPUT_TYPE.BYTE1, LONGS);
        builder.add(input("cat"), 1L);
        builder.add(input("dog"), 2L);
        builder.add(input("hat"), 3L);
        FST<Long> fst = builder.finish();
        assertThat(builder.getTermCount(), is(3L));
        assertThat(builder.getTotStateCount(), is(fst.getNodeCount() - 1));
        assertThat(builder.getMappedStateCount(), is(greaterThan(0L)));
    }

    @Test
    public void testPruningWithMinSuffixCount() throws Exception {
        Map<String, Long> entries = new LinkedHashMap<>();
        entries.put("aa", 1L);
        entries.put("ab", 2L);
        entries.put("b", 3L);
        Builder<Long> builder = builder(2, Integer.MAX_VALUE, 15);
        FST<Long> fst = FSTTestUtils.build(builder, FST.INPUT_TYPE.BYTE1, entries);
        // "b" is only reached by one input so its arc is pruned
        assertThat(Util.get(fst, new BytesRef("b")), is(nullValue()));
    }

    @Test
    public void testWithoutSuffixSharing() throws Exception {
        Map<String, Long> entries = new LinkedHashMap<>();
        for (int i = 0; i < 20; i++) {
            entries.put(String.format("%02dsame", i), (long) i);
        }
        FST<Long> shared = FSTTestUtils.build(FST.INPUT_TYPE.BYTE1, LONGS, entries);
        Builder<Long> unsharedBuilder = new Builder<>(FST.INPUT_TYPE.BYTE1, 0, 0, false, false, Integer.MAX_VALUE,
                LONGS, null, false, PackedInts.COMPACT, true, 15, null);
        FST<Long> unshared = FSTTestUtils.build(unsharedBuilder, FST.INPUT_TYPE.BYTE1, entries);

        assertThat(unshared.getNodeCount(), is(greaterThan(shared.getNodeCount())));
        assertThat(unsharedBuilder.getMappedStateCount(), is(0L));
        assertThat(FSTTestUtils.enumerate(unshared), is(FSTTestUtils.enumerate(shared)));
    }

    @Test
    public void testWithoutArrayArcs() throws Exception {
        Map<String, Long> entries = new LinkedHashMap<>();
        for (char c = 'a'; c <= 'z'; c++) {
            entries.put(c + "x", (long) c);
        }
        Builder<Long> builder = new Builder<>(FST.INPUT_TYPE.BYTE1, 0, 0, true, true, Integer.MAX_VALUE,
                LONGS, null, false, PackedInts.COMPACT, false, 15, null);
        FST<Long> fst = FSTTestUtils.build(builder, FST.INPUT_TYPE.BYTE1, entries);
        FST<Long> withArrays = FSTTestUtils.build(FST.INPUT_TYPE.BYTE1, LONGS, entries);
        assertThat(fst.getSizeInBytes() < withArrays.getSizeInBytes(), is(true));
        for (Map.Entry<String, Long> entry : entries.entrySet()) {
            assertThat(Util.get(fst, new BytesRef(entry.getKey())), is(entry.getValue()));
        }
    }

    @Test
    public void testReportsSummary() throws Exception {
        List<String> messages = new ArrayList<>();
        InfoStream recording = new InfoStream() {
            @Override
            public void message(String component, String line) {
                messages.add(component + ": " + line);
            }

            @Override
            public boolean isEnabled(String component) {
                return true;
            }
        };
        Builder<Long> builder = new Builder<>(FST.INPUT_TYPE.BYTE1, 0, 0, true, true, Integer.MAX_VALUE,
                LONGS, null, false, PackedInts.COMPACT, true, 15, recording);
        builder.add(input("a"), 1L);
        builder.add(input("b"), 2L);
        builder.finish();
        assertThat(messages, contains(startsWith("FST: built FST from 2 inputs: ")));
    }

    @Test
    public void testFreezeTailIsCalled() throws Exception {
        List<Integer> prefixes = new ArrayList<>();
        Builder<Object> builder = new Builder<>(FST.INPUT_TYPE.BYTE1, 0, 0, true, true, Integer.MAX_VALUE,
                NoOutputs.getSingleton(), new Builder.FreezeTail<Object>() {
                    @Override
                    public void freeze(Builder.UnCompiledNode<Object>[] frontier, int prefixLenPlus1, IntsRef prevInput) {
                        prefixes.add(prefixLenPlus1);
                    }
                }, false, PackedInts.COMPACT, true, 15, null);
        builder.add(input("ab"), NoOutputs.getSingleton().getNoOutput());
        builder.add(input("ac"), NoOutputs.getSingleton().getNoOutput());
        assertThat(prefixes, contains(1, 2));
    }
}
