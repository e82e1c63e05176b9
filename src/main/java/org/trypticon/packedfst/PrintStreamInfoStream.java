package org.trypticon.packedfst;

import java.io.PrintStream;
import java.util.Objects;

import javax.annotation.Nonnull;

/**
 * Info stream writing every message to a {@link PrintStream}, one
 * {@code component: message} line each.
 */
public class PrintStreamInfoStream implements InfoStream {
    private final PrintStream stream;

    /**
     * Constructs the info stream.
     *
     * @param stream the stream to write messages to.
     */
    public PrintStreamInfoStream(@Nonnull PrintStream stream) {
        this.stream = Objects.requireNonNull(stream, "stream");
    }

    @Override
    public void message(String component, String line) {
        stream.println(component + ": " + line);
    }

    @Override
    public boolean isEnabled(String component) {
        return true;
    }
}
