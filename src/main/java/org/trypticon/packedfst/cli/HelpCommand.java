package org.trypticon.packedfst.cli;

import java.io.PrintStream;
import java.util.List;

/**
 * Command to show help on other commands, including the file formats they read.
 */
class HelpCommand extends Command {
    private final Main main;

    HelpCommand(Main main) {
        super("help", "Prints help for a command", "<command>");
        this.main = main;
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        if (args.size() != 1) {
            usage(err);
            return 1;
        }
        String commandName = args.get(0);
        Command command = main.findCommand(commandName, err);
        if (command == null) {
            return 1;
        }

        err.println(Constants.APP_NAME + " " + commandName + " - " + command.getDescription());
        command.usage(err);
        List<String> details = command.details();
        if (!details.isEmpty()) {
            err.println();
            for (String line : details) {
                err.println(line);
            }
        }
        return 0;
    }
}
