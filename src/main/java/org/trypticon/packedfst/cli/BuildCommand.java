package org.trypticon.packedfst.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.IntsRefBuilder;
import org.apache.lucene.util.packed.PackedInts;
import org.trypticon.packedfst.InfoStream;
import org.trypticon.packedfst.OutputType;
import org.trypticon.packedfst.PrintStreamInfoStream;
import org.trypticon.packedfst.util.fst.Builder;
import org.trypticon.packedfst.util.fst.FST;
import org.trypticon.packedfst.util.fst.Util;

/**
 * Command to build an FST from a sorted dictionary file.
 * Each line holds a key, then a tab and the output for the key unless the output type is {@code none}.
 * Blank lines are skipped.
 */
class BuildCommand extends Command {
    BuildCommand() {
        super("build", "Builds an FST from a sorted dictionary file",
                "[-v] [--pack] <output type> <sorted input file> <fst file>");
    }

    @Override
    List<String> details() {
        return Arrays.asList(
                "Each line of the input file holds a key, a tab and the output for the key.",
                "For output type none a line holds just the key. Blank lines are skipped.",
                "Keys must be sorted by their UTF-8 bytes. Keys are stored as single byte labels.",
                "  -v      report construction and packing progress",
                "  --pack  pack the FST to make it smaller",
                "Output types: " + outputTypeNames());
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        boolean verbose = false;
        boolean pack = false;
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            if (arg.equals("-v")) {
                verbose = true;
            } else if (arg.equals("--pack")) {
                pack = true;
            } else if (arg.startsWith("-")) {
                err.println("Unknown option: " + arg);
                usage(err);
                return 1;
            } else {
                positional.add(arg);
            }
        }
        if (positional.size() != 3) {
            usage(err);
            return 1;
        }

        OutputType type = findOutputType(err, positional.get(0));
        if (type == null) {
            return 1;
        }
        Path input = Path.of(positional.get(1));
        Path output = Path.of(positional.get(2));
        InfoStream infoStream = verbose ? new PrintStreamInfoStream(err) : InfoStream.NO_OUTPUT;

        try {
            FST<Object> fst = build(type, input, pack, infoStream);
            if (fst == null) {
                err.println("No entries found in: " + input);
                return 1;
            }
            fst.save(output);
            out.println("Built FST with " + fst.getNodeCount() + " nodes and " + fst.getArcCount()
                    + " arcs (" + fst.getSizeInBytes() + " bytes) at: " + output);
            return 0;
        } catch (IOException | IllegalArgumentException | UnsupportedOperationException e) {
            err.println("Error building FST from: " + input);
            printErrorSummary(err, e);
            return 1;
        }
    }

    private FST<Object> build(OutputType type, Path input, boolean pack, InfoStream infoStream) throws IOException {
        Builder<Object> builder = new Builder<>(FST.INPUT_TYPE.BYTE1, 0, 0, true, true, Integer.MAX_VALUE,
                type.<Object>outputs(), null, pack, PackedInts.COMPACT, true, 15, infoStream);
        IntsRefBuilder scratch = new IntsRefBuilder();
        try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isEmpty()) {
                    continue;
                }
                String key;
                Object value;
                int tab = line.indexOf('\t');
                if (type == OutputType.NONE) {
                    key = tab < 0 ? line : line.substring(0, tab);
                    value = type.parse("");
                } else if (tab < 0) {
                    throw new IllegalArgumentException("Missing output on line " + lineNumber + ": " + line);
                } else {
                    key = line.substring(0, tab);
                    try {
                        value = type.parse(line.substring(tab + 1));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output on line " + lineNumber + ": " + line, e);
                    }
                }
                try {
                    builder.add(Util.toIntsRef(new BytesRef(key), scratch), value);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Key out of order on line " + lineNumber + ": " + key, e);
                }
            }
        }
        return builder.finish();
    }
}
