package org.trypticon.packedfst.util.fst;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.CharsRef;
import org.apache.lucene.util.IntsRef;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;

/**
 * Tests for the values produced by each concrete {@link Outputs}.
 */
public class OutputsBehaviourTests {

    @Test
    public void testPositiveIntOutputs() {
        PositiveIntOutputs outputs = PositiveIntOutputs.getSingleton();
        assertThat(outputs.common(5L, 3L), is(3L));
        assertThat(outputs.add(5L, 3L), is(8L));
        assertThat(outputs.subtract(5L, 3L), is(2L));
        assertThat(outputs.outputToString(17L), is("17"));
    }

    @Test
    public void testByteSequenceOutputs() {
        ByteSequenceOutputs outputs = ByteSequenceOutputs.getSingleton();
        assertThat(outputs.common(new BytesRef("foobar"), new BytesRef("foobaz")), is(new BytesRef("fooba")));
        assertThat(outputs.add(new BytesRef("foo"), new BytesRef("bar")), is(new BytesRef("foobar")));
        assertThat(outputs.subtract(new BytesRef("foobar"), new BytesRef("foo")), is(new BytesRef("bar")));
        assertThat(outputs.common(new BytesRef("abc"), new BytesRef("xyz")), is(sameInstance(outputs.getNoOutput())));
    }

    @Test
    public void testIntSequenceOutputs() {
        IntSequenceOutputs outputs = IntSequenceOutputs.getSingleton();
        IntsRef common = outputs.common(new IntsRef(new int[] { 1, 2, 3 }, 0, 3), new IntsRef(new int[] { 1, 2, 9 }, 0, 3));
        assertThat(common, is(new IntsRef(new int[] { 1, 2 }, 0, 2)));
    }

    @Test
    public void testCharSequenceOutputs() {
        CharSequenceOutputs outputs = CharSequenceOutputs.getSingleton();
        assertThat(outputs.add(new CharsRef("he"), new CharsRef("llo")).toString(), is("hello"));
        assertThat(outputs.subtract(new CharsRef("hello"), new CharsRef("he")).toString(), is("llo"));
    }

    @Test
    public void testPairOutputsNormalisesNoOutput() {
        PairOutputs<Long, BytesRef> outputs =
                new PairOutputs<>(PositiveIntOutputs.getSingleton(), ByteSequenceOutputs.getSingleton());
        PairOutputs.Pair<Long, BytesRef> pair = outputs.newPair(0L, new BytesRef());
        assertThat(pair, is(sameInstance(outputs.getNoOutput())));

        PairOutputs.Pair<Long, BytesRef> other = outputs.newPair(3L, new BytesRef("a"));
        assertThat(other, is(outputs.newPair(3L, new BytesRef("a"))));
        assertThat(other, is(not(outputs.newPair(3L, new BytesRef("b")))));
        assertThat(other.hashCode(), is(outputs.newPair(3L, new BytesRef("a")).hashCode()));
    }

    @Test
    public void testNoOutputsValue() {
        NoOutputs outputs = NoOutputs.getSingleton();
        Object none = outputs.getNoOutput();
        assertThat(none.hashCode(), is(42));
        assertThat(outputs.merge(none, none), is(sameInstance(none)));
        assertThat(outputs.outputToString(none), is(""));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testMergeIsUnsupportedByDefault() {
        PositiveIntOutputs.getSingleton().merge(1L, 2L);
    }
}
