package org.trypticon.packedfst.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.IntsRef;
import org.apache.lucene.util.IntsRefBuilder;
import org.trypticon.packedfst.OutputType;
import org.trypticon.packedfst.util.fst.FST;
import org.trypticon.packedfst.util.fst.Util;

/**
 * Command to look up keys in a saved FST.
 */
class LookupCommand extends Command {
    LookupCommand() {
        super("lookup", "Looks up keys in an FST file", "<output type> <fst file> <key...>");
    }

    @Override
    List<String> details() {
        return Arrays.asList(
                "Prints each key with its output, or (not found) if the FST does not accept it.",
                "The output type must be the one the FST was built with: " + outputTypeNames());
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        if (args.size() < 3) {
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
            IntsRefBuilder scratch = new IntsRefBuilder();
            for (String key : args.subList(2, args.size())) {
                Object output = Util.get(fst, toInput(fst.getInputType(), key, scratch));
                if (output == null) {
                    out.println(key + "\t(not found)");
                } else {
                    out.println(key + "\t" + type.format(output));
                }
            }
            return 0;
        } catch (IOException e) {
            err.println("Error reading FST at: " + file);
            printErrorSummary(err, e);
            return 1;
        }
    }

    /**
     * Converts a key to the labels used by an FST of the given input type.
     * Single byte labels are the UTF-8 bytes, two byte labels the UTF-16 units and
     * four byte labels the code points.
     */
    private static IntsRef toInput(FST.INPUT_TYPE inputType, String key, IntsRefBuilder scratch) {
        switch (inputType) {
            case BYTE1:
                return Util.toIntsRef(new BytesRef(key), scratch);
            case BYTE2:
                return Util.toUTF16(key, scratch);
            default:
                return Util.toUTF32(key, scratch);
        }
    }
}
