package org.trypticon.packedfst.cli;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.annotation.Nonnull;

/**
 * Main entry class. Holds the commands by name and dispatches to them.
 */
public class Main {
    private final Map<String, Command> commands = new LinkedHashMap<>();

    /**
     * Constructs the entry point with all the FST commands registered.
     */
    public Main() {
        register(new HelpCommand(this));
        register(new BuildCommand());
        register(new InfoCommand());
        register(new LookupCommand());
    }

    private void register(Command command) {
        commands.put(command.getName(), command);
    }

    /**
     * Main entry point for calling from a launcher.
     *
     * @param args the command-line arguments.
     */
    public static void main(String[] args) {
        int result = new Main().run(Arrays.asList(args), System.out, System.err);
        System.exit(result);
    }

    /**
     * Main entry point for command-line interface.
     *
     * @param args the command-line arguments.
     * @param out the output stream.
     * @param err the error stream.
     * @return the result of running the command.
     */
    int run(@Nonnull List<String> args, @Nonnull PrintStream out, @Nonnull PrintStream err) {
        if (args.isEmpty()) {
            usage(err);
            return 1;
        }

        Command command = findCommand(args.get(0), err);
        if (command == null) {
            return 1;
        }

        return command.run(args.subList(1, args.size()), out, err);
    }

    /**
     * Finds a command by name, listing the available commands if there is none by that name.
     *
     * @param name the command name.
     * @param err the error stream.
     * @return the command. Returns {@code null} if no command with that name was found.
     */
    Command findCommand(@Nonnull String name, @Nonnull PrintStream err) {
        Command command = commands.get(name);
        if (command == null) {
            err.println("Unknown command: " + name);
            listCommands(err);
        }
        return command;
    }

    private void listCommands(PrintStream err) {
        err.println("Available commands:");
        for (Command command : commands.values()) {
            err.println(String.format("  %-8s%s", command.getName(), command.getDescription()));
        }
    }

    private void usage(PrintStream err) {
        err.println("usage: " + Constants.APP_NAME + " <command> <args...>");
        listCommands(err);
        err.println("Output types: " + Command.outputTypeNames());
        err.println("Use " + Constants.APP_NAME + " help <command> for help on a specific command.");
    }
}
