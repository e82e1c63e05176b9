package org.trypticon.packedfst.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.trypticon.packedfst.OutputType;
import org.trypticon.packedfst.util.fst.FST;

/**
 * Command to show info about a saved FST.
 */
class InfoCommand extends Command {
    InfoCommand() {
        super("info", "Gives info about an FST file", "<output type> <fst file>");
    }

    @Override
    List<String> details() {
        return Arrays.asList(
                "Prints the label width, whether the FST is packed, its node and arc counts, its size",
                "and the output for the empty string if it is accepted.",
                "The output type must be the one the FST was built with: " + outputTypeNames());
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        if (args.size() != 2) {
            usage(err);
            return 1;
        }
        OutputType type = findOutputType(err, args.get(0));
        if (type == null) {
            return 1;
        }
        Path file = Path.of(args.get(1));
        try {
            FST<Object> fst = FST.read(file, type.outputs());
            out.println("Input type: " + fst.getInputType());
            out.println("Packed: " + fst.isPacked());
            out.println("Nodes: " + fst.getNodeCount());
            out.println("Arcs: " + fst.getArcCount());
            out.println("Arcs with output: " + fst.getArcWithOutputCount());
            out.println("Size in bytes: " + fst.getSizeInBytes());
            Object emptyOutput = fst.getEmptyOutput();
            if (emptyOutput != null) {
                out.println("Empty string output: " + type.format(emptyOutput));
            }
            return 0;
        } catch (IOException e) {
            err.println("Error reading FST at: " + file);
            printErrorSummary(err, e);
            return 1;
        }
    }
}
