package org.trypticon.packedfst;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.CharsRef;
import org.apache.lucene.util.IntsRef;
import org.junit.Test;
import org.trypticon.packedfst.util.fst.ByteSequenceOutputs;
import org.trypticon.packedfst.util.fst.NoOutputs;
import org.trypticon.packedfst.util.fst.PositiveIntOutputs;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThrows;

public class OutputTypeTests {

    @Test
    public void testFindByName() {
        for (OutputType type : OutputType.values()) {
            assertThat(OutputType.findByName(type.getName()), is(type));
        }
        assertThat(OutputType.findByName("LONG"), is(nullValue()));
        assertThat(OutputType.findByName("pickle"), is(nullValue()));
    }

    @Test
    public void testOutputs() {
        assertThat((Object) OutputType.NONE.outputs(), is(sameInstance((Object) NoOutputs.getSingleton())));
        assertThat((Object) OutputType.LONG.outputs(), is(sameInstance((Object) PositiveIntOutputs.getSingleton())));
        assertThat((Object) OutputType.BYTES.outputs(), is(sameInstance((Object) ByteSequenceOutputs.getSingleton())));
    }

    @Test
    public void testNone() {
        Object value = OutputType.NONE.parse("");
        assertThat(value, is(sameInstance(NoOutputs.getSingleton().getNoOutput())));
        assertThat(OutputType.NONE.format(value), is(""));
        assertThrows(IllegalArgumentException.class, () -> OutputType.NONE.parse("1"));
    }

    @Test
    public void testLong() {
        assertThat(OutputType.LONG.<Long>parse(" 42 "), is(42L));
        assertThat(OutputType.LONG.format(42L), is("42"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> OutputType.LONG.parse("-1"));
        assertThat(e.getMessage(), is("Outputs must be >= 0, got: -1"));
        e = assertThrows(IllegalArgumentException.class, () -> OutputType.LONG.parse("abc"));
        assertThat(e.getMessage(), is("Not a number: abc"));
    }

    @Test
    public void testBytes() {
        BytesRef value = OutputType.BYTES.parse("caf\u00e9");
        assertThat(value.length, is(5));
        assertThat(OutputType.BYTES.format(value), is("caf\u00e9"));
    }

    @Test
    public void testInts() {
        IntsRef value = OutputType.INTS.parse("3, 1,4");
        assertThat(value, is(new IntsRef(new int[] { 3, 1, 4 }, 0, 3)));
        assertThat(OutputType.INTS.format(value), is("3,1,4"));
        IntsRef empty = OutputType.INTS.parse("");
        assertThat(empty.length, is(0));
        assertThrows(IllegalArgumentException.class, () -> OutputType.INTS.parse("1,x"));
    }

    @Test
    public void testChars() {
        CharsRef value = OutputType.CHARS.parse("text");
        assertThat(value.toString(), is("text"));
        assertThat(OutputType.CHARS.format(value), is("text"));
    }
}
