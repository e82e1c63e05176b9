package org.trypticon.packedfst.util.fst;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.lucene.store.ByteArrayDataInput;
import org.apache.lucene.store.ByteBuffersDataOutput;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;
import org.apache.lucene.util.IntsRef;
import org.apache.lucene.util.IntsRefBuilder;

/**
 * Helpers for building FSTs from string keys in tests.
 */
final class FSTTestUtils {
    private FSTTestUtils() {
    }

    /**
     * Converts a key to the labels for the given input type.
     */
    static IntsRef toInput(FST.INPUT_TYPE inputType, String key) {
        IntsRefBuilder scratch = new IntsRefBuilder();
        switch (inputType) {
            case BYTE1:
                return Util.toIntsRef(new BytesRef(key), scratch);
            case BYTE2:
                return Util.toUTF16(key, scratch);
            default:
                return Util.toUTF32(key, scratch);
        }
    }

    /**
     * Converts labels for the given input type back to a key.
     */
    static String toKey(FST.INPUT_TYPE inputType, IntsRef input) {
        switch (inputType) {
            case BYTE1:
                return Util.toBytesRef(input, new BytesRefBuilder()).utf8ToString();
            case BYTE2:
                char[] chars = new char[input.length];
                for (int i = 0; i < input.length; i++) {
                    chars[i] = (char) input.ints[input.offset + i];
                }
                return new String(chars);
            default:
                return new String(input.ints, input.offset, input.length);
        }
    }

    /**
     * Sorts the keys into the order the builder needs for the given input type.
     */
    static <T> List<Map.Entry<IntsRef, T>> sortedInputs(FST.INPUT_TYPE inputType, Map<String, T> entries) {
        SortedMap<IntsRef, T> sorted = new TreeMap<>();
        for (Map.Entry<String, T> entry : entries.entrySet()) {
            sorted.put(toInput(inputType, entry.getKey()), entry.getValue());
        }
        return new ArrayList<>(sorted.entrySet());
    }

    static <T> FST<T> build(Builder<T> builder, FST.INPUT_TYPE inputType, Map<String, T> entries) throws IOException {
        for (Map.Entry<IntsRef, T> entry : sortedInputs(inputType, entries)) {
            builder.add(entry.getKey(), entry.getValue());
        }
        return builder.finish();
    }

    static <T> FST<T> build(FST.INPUT_TYPE inputType, Outputs<T> outputs, Map<String, T> entries) throws IOException {
        return build(new Builder<>(inputType, outputs), inputType, entries);
    }

    static <T> FST<T> buildPacked(FST.INPUT_TYPE inputType, Outputs<T> outputs, Map<String, T> entries) throws IOException {
        Builder<T> builder = new Builder<>(inputType, 0, 0, true, true, Integer.MAX_VALUE, outputs, null,
                true, 0.0f, true, 15, null);
        return build(builder, inputType, entries);
    }

    /**
     * Saves the FST to memory and reads it back.
     */
    static <T> FST<T> saveAndLoad(FST<T> fst, Outputs<T> outputs) throws IOException {
        ByteBuffersDataOutput out = new ByteBuffersDataOutput();
        fst.save(out);
        return new FST<>(new ByteArrayDataInput(out.toArrayCopy()), outputs);
    }

    /**
     * Lists every accepted key with its output, in FST order.
     */
    static <T> Map<String, T> enumerate(FST<T> fst) throws IOException {
        Map<String, T> result = new LinkedHashMap<>();
        IntsRefFSTEnum<T> fstEnum = new IntsRefFSTEnum<>(fst);
        IntsRefFSTEnum.InputOutput<T> current;
        while ((current = fstEnum.next()) != null) {
            result.put(toKey(fst.getInputType(), current.input), current.output);
        }
        return result;
    }

    /**
     * Lists the entries in the order the FST should enumerate them.
     */
    static <T> Map<String, T> expectedOrder(FST.INPUT_TYPE inputType, Map<String, T> entries) {
        Map<String, T> result = new LinkedHashMap<>();
        for (Map.Entry<IntsRef, T> entry : sortedInputs(inputType, entries)) {
            result.put(toKey(inputType, entry.getKey()), entry.getValue());
        }
        return result;
    }

    /**
     * Generates distinct random keys from the given alphabet.
     */
    static TreeSet<String> randomKeys(Random random, int count, int maxLength, String alphabet) {
        TreeSet<String> keys = new TreeSet<>();
        while (keys.size() < count) {
            int length = 1 + random.nextInt(maxLength);
            StringBuilder builder = new StringBuilder();
            for (int i = 0; i < length; i++) {
                builder.append(alphabet.charAt(random.nextInt(alphabet.length())));
            }
            keys.add(builder.toString());
        }
        return keys;
    }

    /**
     * Maps each key to its ordinal in sorted order.
     */
    static Map<String, Long> ordinals(Iterable<String> sortedKeys) {
        Map<String, Long> result = new LinkedHashMap<>();
        long ord = 0;
        for (String key : sortedKeys) {
            result.put(key, ord++);
        }
        return result;
    }
}
