package org.trypticon.packedfst;

import java.util.ArrayList;
import java.util.List;

import javax.annotation.Nonnull;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.CharsRef;
import org.apache.lucene.util.IntsRef;
import org.trypticon.packedfst.util.fst.ByteSequenceOutputs;
import org.trypticon.packedfst.util.fst.CharSequenceOutputs;
import org.trypticon.packedfst.util.fst.IntSequenceOutputs;
import org.trypticon.packedfst.util.fst.NoOutputs;
import org.trypticon.packedfst.util.fst.Outputs;
import org.trypticon.packedfst.util.fst.PositiveIntOutputs;

/**
 * Enumeration of the output algebras which can be named from the command line.
 * Each type knows its {@link Outputs} instance and how to convert its values to and from text.
 */
public enum OutputType {

    NONE("none") {
        @Override
        protected Outputs<?> createOutputs() {
            return NoOutputs.getSingleton();
        }

        @Override
        protected Object parseValue(@Nonnull String text) {
            if (!text.isEmpty()) {
                throw new IllegalArgumentException("Output type none takes no values, got: " + text);
            }
            return NoOutputs.getSingleton().getNoOutput();
        }

        @Override
        protected String formatValue(@Nonnull Object value) {
            return "";
        }
    },

    LONG("long") {
        @Override
        protected Outputs<?> createOutputs() {
            return PositiveIntOutputs.getSingleton();
        }

        @Override
        protected Object parseValue(@Nonnull String text) {
            long value;
            try {
                value = Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number: " + text, e);
            }
            if (value < 0) {
                throw new IllegalArgumentException("Outputs must be >= 0, got: " + value);
            }
            return value;
        }

        @Override
        protected String formatValue(@Nonnull Object value) {
            return value.toString();
        }
    },

    BYTES("bytes") {
        @Override
        protected Outputs<?> createOutputs() {
            return ByteSequenceOutputs.getSingleton();
        }

        @Override
        protected Object parseValue(@Nonnull String text) {
            return new BytesRef(text);
        }

        @Override
        protected String formatValue(@Nonnull Object value) {
            return ((BytesRef) value).utf8ToString();
        }
    },

    INTS("ints") {
        @Override
        protected Outputs<?> createOutputs() {
            return IntSequenceOutputs.getSingleton();
        }

        @Override
        protected Object parseValue(@Nonnull String text) {
            List<Integer> values = new ArrayList<>();
            if (!text.trim().isEmpty()) {
                for (String part : text.split(",")) {
                    try {
                        values.add(Integer.parseInt(part.trim()));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Not a number: " + part, e);
                    }
                }
            }
            int[] ints = new int[values.size()];
            for (int i = 0; i < ints.length; i++) {
                ints[i] = values.get(i);
            }
            return new IntsRef(ints, 0, ints.length);
        }

        @Override
        protected String formatValue(@Nonnull Object value) {
            IntsRef ints = (IntsRef) value;
            StringBuilder builder = new StringBuilder();
            for (int i = 0; i < ints.length; i++) {
                if (i > 0) {
                    builder.append(',');
                }
                builder.append(ints.ints[ints.offset + i]);
            }
            return builder.toString();
        }
    },

    CHARS("chars") {
        @Override
        protected Outputs<?> createOutputs() {
            return CharSequenceOutputs.getSingleton();
        }

        @Override
        protected Object parseValue(@Nonnull String text) {
            return new CharsRef(text);
        }

        @Override
        protected String formatValue(@Nonnull Object value) {
            return value.toString();
        }
    };

    private final String typeName;

    OutputType(String typeName) {
        this.typeName = typeName;
    }

    /**
     * Gets the name used for this output type on the command line.
     *
     * @return the name.
     */
    @Nonnull
    public String getName() {
        return typeName;
    }

    /**
     * Gets the outputs algebra for this type.
     *
     * @param <T> the output value type, which the caller must match to this output type.
     * @return the outputs.
     */
    @Nonnull
    @SuppressWarnings("unchecked")
    public <T> Outputs<T> outputs() {
        return (Outputs<T>) createOutputs();
    }

    /**
     * Parses an output value from text.
     *
     * @param text the text.
     * @param <T> the output value type, which the caller must match to this output type.
     * @return the parsed value.
     * @throws IllegalArgumentException if the text is not a valid value for this type.
     */
    @Nonnull
    @SuppressWarnings("unchecked")
    public <T> T parse(@Nonnull String text) {
        return (T) parseValue(text);
    }

    /**
     * Formats an output value as text. {@link #parse(String)} accepts the result.
     *
     * @param value the value.
     * @return the formatted text.
     */
    @Nonnull
    public String format(@Nonnull Object value) {
        return formatValue(value);
    }

    protected abstract Outputs<?> createOutputs();

    protected abstract Object parseValue(@Nonnull String text);

    protected abstract String formatValue(@Nonnull Object value);

    /**
     * Tries to find an output type by its name.
     *
     * @param name the name.
     * @return the output type. Returns {@code null} if not found.
     */
    public static OutputType findByName(String name) {
        for (OutputType type : values()) {
            if (type.typeName.equals(name)) {
                return type;
            }
        }
        return null;
    }
}
