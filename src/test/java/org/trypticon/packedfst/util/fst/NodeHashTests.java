package org.trypticon.packedfst.util.fst;

import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

/**
 * Tests for {@link NodeHash}.
 */
public class NodeHashTests {
    private static final PositiveIntOutputs LONGS = PositiveIntOutputs.getSingleton();

    private Builder<Long> builder;
    private NodeHash<Long> hash;

    @Before
    public void setUp() {
        builder = new Builder<>(FST.INPUT_TYPE.BYTE1, LONGS);
        hash = new NodeHash<>(builder.fst, builder.fst.bytes.getReverseReader(false));
    }

    private Builder.UnCompiledNode<Long> finalNode(int label, long output) {
        Builder.CompiledNode end = new Builder.CompiledNode();
        end.node = FST.FINAL_END_NODE;
        Builder.UnCompiledNode<Long> node = new Builder.UnCompiledNode<>(builder, 1);
        node.addArc(label, end);
        node.replaceLast(label, end, LONGS.getNoOutput(), true);
        if (output != 0) {
            node.setLastOutput(label, output);
        }
        return node;
    }

    @Test
    public void testEqualNodesShareAddress() throws Exception {
        long first = hash.add(finalNode('x', 3));
        long again = hash.add(finalNode('x', 3));
        assertThat(again, is(first));
        assertThat(hash.size(), is(1L));
    }

    @Test
    public void testDifferentNodesAreSeparate() throws Exception {
        long x = hash.add(finalNode('x', 3));
        long y = hash.add(finalNode('y', 3));
        long x4 = hash.add(finalNode('x', 4));
        assertThat(y, is(not(x)));
        assertThat(x4, is(not(x)));
        assertThat(hash.size(), is(3L));
    }

    @Test
    public void testLookupsSurviveRehash() throws Exception {
        long[] addresses = new long[200];
        for (int i = 0; i < addresses.length; i++) {
            addresses[i] = hash.add(finalNode('a' + (i % 20), 1 + i / 20));
            assertThat(addresses[i], is(greaterThan(0L)));
        }
        for (int i = 0; i < addresses.length; i++) {
            assertThat(hash.add(finalNode('a' + (i % 20), 1 + i / 20)), is(addresses[i]));
        }
        assertThat(hash.size(), is(200L));
    }
}
