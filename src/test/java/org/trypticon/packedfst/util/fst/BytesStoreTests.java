package org.trypticon.packedfst.util.fst;

import java.util.Arrays;
import java.util.Random;

import org.apache.lucene.store.ByteArrayDataInput;
import org.apache.lucene.store.ByteBuffersDataOutput;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

/**
 * Checks {@link BytesStore} against a plain byte array, with pages small
 * enough that every operation crosses page boundaries.
 */
public class BytesStoreTests {
    private static final int BLOCK_BITS = 2;

    private final Random random = new Random(2024);

    private byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return bytes;
    }

    private static byte[] contents(BytesStore store) {
        byte[] bytes = new byte[(int) store.getPosition()];
        if (bytes.length > 0) {
            store.copyBytes(0, bytes, 0, bytes.length);
        }
        return bytes;
    }

    private static BytesStore storeOf(byte[] bytes) {
        BytesStore store = new BytesStore(BLOCK_BITS);
        store.writeBytes(bytes, 0, bytes.length);
        return store;
    }

    @Test
    public void testAppend() {
        byte[] expected = randomBytes(37);
        BytesStore store = new BytesStore(BLOCK_BITS);
        store.writeBytes(expected, 0, 10);
        for (int i = 10; i < 20; i++) {
            store.writeByte(expected[i]);
        }
        store.writeBytes(expected, 20, 17);
        assertThat(store.getPosition(), is(37L));
        assertThat(contents(store), is(expected));
    }

    @Test
    public void testAbsoluteWrites() {
        byte[] expected = randomBytes(30);
        BytesStore store = storeOf(expected);
        for (int i = 0; i < 20; i++) {
            int dest = random.nextInt(expected.length);
            byte b = (byte) random.nextInt();
            expected[dest] = b;
            store.writeByte(dest, b);
        }
        byte[] patch = randomBytes(9);
        store.writeBytes(5, patch, 0, patch.length);
        System.arraycopy(patch, 0, expected, 5, patch.length);
        assertThat(contents(store), is(expected));
    }

    @Test
    public void testOverlappingCopy() {
        byte[] expected = randomBytes(40);
        BytesStore store = storeOf(expected);
        store.copyBytes(3, 10, 21);
        System.arraycopy(expected, 3, expected, 10, 21);
        assertThat(contents(store), is(expected));
    }

    @Test
    public void testReverse() {
        byte[] expected = randomBytes(25);
        BytesStore store = storeOf(expected);
        store.reverse(2, 21);
        for (int i = 2, j = 21; i < j; i++, j--) {
            byte b = expected[i];
            expected[i] = expected[j];
            expected[j] = b;
        }
        assertThat(contents(store), is(expected));
    }

    @Test
    public void testSkipAndTruncate() {
        byte[] start = randomBytes(6);
        BytesStore store = storeOf(start);
        store.skipBytes(11);
        assertThat(store.getPosition(), is(17L));
        byte[] expected = Arrays.copyOf(start, 17);
        assertThat(contents(store), is(expected));

        store.truncate(8);
        assertThat(store.getPosition(), is(8L));
        store.writeByte((byte) 42);
        expected = Arrays.copyOf(start, 9);
        expected[8] = 42;
        assertThat(contents(store), is(expected));

        store.truncate(0);
        assertThat(store.getPosition(), is(0L));
    }

    @Test
    public void testForwardReader() throws Exception {
        byte[] expected = randomBytes(23);
        BytesStore store = storeOf(expected);
        FST.BytesReader reader = store.getForwardReader();
        assertThat(reader.reversed(), is(false));
        for (int i = 0; i < 50; i++) {
            int pos = random.nextInt(expected.length);
            reader.setPosition(pos);
            assertThat(reader.getPosition(), is((long) pos));
            assertThat(reader.readByte(), is(expected[pos]));
            int len = random.nextInt(expected.length - pos);
            byte[] read = new byte[len];
            reader.readBytes(read, 0, len);
            assertThat(read, is(Arrays.copyOfRange(expected, pos + 1, pos + 1 + len)));
        }
        reader.setPosition(5);
        reader.skipBytes(7);
        assertThat(reader.readByte(), is(expected[12]));
    }

    @Test
    public void testReverseReader() throws Exception {
        byte[] expected = randomBytes(23);
        BytesStore store = storeOf(expected);
        FST.BytesReader reader = store.getReverseReader();
        assertThat(reader.reversed(), is(true));
        for (int i = 0; i < 50; i++) {
            int pos = random.nextInt(expected.length);
            reader.setPosition(pos);
            assertThat(reader.getPosition(), is((long) pos));
            int len = random.nextInt(pos + 1);
            for (int j = 0; j < len; j++) {
                assertThat(reader.readByte(), is(expected[pos - j]));
            }
        }
        reader.setPosition(20);
        reader.skipBytes(6);
        assertThat(reader.readByte(), is(expected[14]));
        reader.setPosition(10);
        reader.skipBytes(-3);
        assertThat(reader.readByte(), is(expected[13]));
    }

    @Test
    public void testSinglePageReaders() throws Exception {
        byte[] expected = randomBytes(3);
        BytesStore store = storeOf(expected);
        FST.BytesReader forward = store.getForwardReader();
        forward.setPosition(1);
        assertThat(forward.readByte(), is(expected[1]));
        FST.BytesReader reverse = store.getReverseReader();
        reverse.setPosition(2);
        assertThat(reverse.readByte(), is(expected[2]));
        assertThat(reverse.readByte(), is(expected[1]));
    }

    @Test
    public void testWriteToAndLoad() throws Exception {
        byte[] expected = randomBytes(41);
        BytesStore store = storeOf(expected);
        store.finish();
        ByteBuffersDataOutput out = new ByteBuffersDataOutput();
        store.writeTo(out);
        assertThat(out.toArrayCopy(), is(expected));

        BytesStore loaded = new BytesStore(new ByteArrayDataInput(expected), expected.length, 8);
        assertThat(loaded.getPosition(), is(41L));
        FST.BytesReader reader = loaded.getForwardReader();
        reader.setPosition(0);
        byte[] read = new byte[expected.length];
        reader.readBytes(read, 0, read.length);
        assertThat(read, is(expected));
    }
}
