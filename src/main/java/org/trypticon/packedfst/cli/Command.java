package org.trypticon.packedfst.cli;

import java.io.PrintStream;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nonnull;

import org.trypticon.packedfst.OutputType;

/**
 * Base class for CLI commands.
 */
abstract class Command {
    private final String name;
    private final String description;
    private final String usage;

    /**
     * Constructs the command.
     *
     * @param name a short name for the command.
     * @param description a description of the command.
     * @param usage usage summary of arguments to the command.
     */
    protected Command(@Nonnull String name, @Nonnull String description, @Nonnull String usage) {
        this.name = name;
        this.description = description;
        this.usage = usage;
    }

    /**
     * Gets the name of the command.
     *
     * @return the name of the command.
     */
    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * Gets a description of the command.
     *
     * @return a description of the command.
     */
    @Nonnull
    public String getDescription() {
        return description;
    }

    /**
     * Prints usage info for this command.
     *
     * @param err the error stream.
     */
    void usage(@Nonnull PrintStream err) {
        err.println("usage: " + Constants.APP_NAME + " " + name + " " + usage);
    }

    /**
     * Gets further help lines for the command, such as the format of the files it reads.
     *
     * @return the lines. Empty if the usage line says it all.
     */
    @Nonnull
    List<String> details() {
        return Collections.emptyList();
    }

    /**
     * Runs the command.
     *
     * @param args the arguments to the command.
     * @param out the output stream.
     * @param err the error stream.
     * @return the exit code of the command.
     */
    abstract int run(@Nonnull List<String> args, @Nonnull PrintStream out, @Nonnull PrintStream err);

    /**
     * Prints a summary of the given exception.
     *
     * @param err the error stream.
     * @param e the exception.
     */
    static void printErrorSummary(@Nonnull PrintStream err, @Nonnull Exception e) {
        Throwable temp = e;
        while (temp != null) {
            err.println(temp);
            temp = temp.getCause();
        }
    }

    /**
     * Looks up an output type named on the command line, reporting it if unknown.
     *
     * @param err the error stream.
     * @param name the name of the output type.
     * @return the output type. Returns {@code null} if no type has that name.
     */
    static OutputType findOutputType(@Nonnull PrintStream err, @Nonnull String name) {
        OutputType type = OutputType.findByName(name);
        if (type == null) {
            err.println("Unknown output type: " + name);
            err.println("Available output types: " + outputTypeNames());
        }
        return type;
    }

    /**
     * Lists the names of the output types an FST file can be read with.
     *
     * @return the names, comma separated.
     */
    @Nonnull
    static String outputTypeNames() {
        StringBuilder names = new StringBuilder();
        for (OutputType type : OutputType.values()) {
            if (names.length() > 0) {
                names.append(", ");
            }
            names.append(type.getName());
        }
        return names.toString();
    }
}
