package org.trypticon.packedfst.cli;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.trypticon.packedfst.Utils;
import org.trypticon.packedfst.util.fst.FST;
import org.trypticon.packedfst.util.fst.PositiveIntOutputs;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;

public class MainTest {
    private Path temp;
    private ByteArrayOutputStream rawOut;
    private ByteArrayOutputStream rawErr;
    private PrintStream out;
    private PrintStream err;
    private int result;

    @Before
    public void setUp() throws Exception {
        temp = Files.createTempDirectory("test");
        rawOut = new ByteArrayOutputStream();
        rawErr = new ByteArrayOutputStream();
        out = new PrintStream(rawOut, true, StandardCharsets.UTF_8);
        err = new PrintStream(rawErr, true, StandardCharsets.UTF_8);
    }

    @After
    public void tearDown() throws Exception {
        Utils.recursiveDeleteIfExists(temp);
    }

    @Test
    public void testNoArguments() {
        run();
        assertResult(1);
        assertOutput();
        assertError("usage: packedfst <command> <args...>",
                "Available commands:",
                "  help    Prints help for a command",
                "  build   Builds an FST from a sorted dictionary file",
                "  info    Gives info about an FST file",
                "  lookup  Looks up keys in an FST file",
                "Output types: none, long, bytes, ints, chars",
                "Use packedfst help <command> for help on a specific command.");
    }

    @Test
    public void testUnknown() {
        run("pickle");
        assertResult(1);
        assertOutput();
        assertError("Unknown command: pickle",
                "Available commands:",
                "  help    Prints help for a command",
                "  build   Builds an FST from a sorted dictionary file",
                "  info    Gives info about an FST file",
                "  lookup  Looks up keys in an FST file");
    }

    @Test
    public void testHelp() {
        run("help", "build");
        assertResult(0);
        assertOutput();
        assertError("packedfst build - Builds an FST from a sorted dictionary file",
                "usage: packedfst build [-v] [--pack] <output type> <sorted input file> <fst file>",
                "",
                "Each line of the input file holds a key, a tab and the output for the key.",
                "For output type none a line holds just the key. Blank lines are skipped.",
                "Keys must be sorted by their UTF-8 bytes. Keys are stored as single byte labels.",
                "  -v      report construction and packing progress",
                "  --pack  pack the FST to make it smaller",
                "Output types: none, long, bytes, ints, chars");
    }

    @Test
    public void testHelp_Lookup() {
        run("help", "lookup");
        assertResult(0);
        assertOutput();
        assertError("packedfst lookup - Looks up keys in an FST file",
                "usage: packedfst lookup <output type> <fst file> <key...>",
                "",
                "Prints each key with its output, or (not found) if the FST does not accept it.",
                "The output type must be the one the FST was built with: none, long, bytes, ints, chars");
    }

    @Test
    public void testHelp_Help() {
        run("help", "help");
        assertResult(0);
        assertOutput();
        assertError("packedfst help - Prints help for a command",
                "usage: packedfst help <command>");
    }

    @Test
    public void testHelp_NoArguments() {
        run("help");
        assertResult(1);
        assertOutput();
        assertError("usage: packedfst help <command>");
    }

    @Test
    public void testHelp_Unknown() {
        run("help", "pickle");
        assertResult(1);
        assertOutput();
        assertError("Unknown command: pickle",
                "Available commands:",
                "  help    Prints help for a command",
                "  build   Builds an FST from a sorted dictionary file",
                "  info    Gives info about an FST file",
                "  lookup  Looks up keys in an FST file");
    }

    @Test
    public void testBuild() throws Exception {
        Path input = Utils.writeDictionary(temp, "dict.txt", "car\t2", "cart\t3", "cat\t1");
        Path fstFile = temp.resolve("dict.fst");
        run("build", "long", input.toString(), fstFile.toString());
        assertResult(0);
        FST<Long> fst = FST.read(fstFile, PositiveIntOutputs.getSingleton());
        assertOutput("Built FST with " + fst.getNodeCount() + " nodes and " + fst.getArcCount()
                + " arcs (" + fst.getSizeInBytes() + " bytes) at: " + fstFile);
        assertError();
    }

    @Test
    public void testBuild_Verbose() throws Exception {
        Path input = Utils.writeDictionary(temp, "dict.txt", "car\t2", "cart\t3", "cat\t1");
        run("build", "-v", "--pack", "long", input.toString(), temp.resolve("dict.fst").toString());
        assertResult(0);
        List<String> lines = errorLines();
        assertThat(lines.get(0), startsWith("FST: built FST from 3 inputs: "));
        assertThat(lines, everyItem(startsWith("FST: ")));
        assertThat(lines.get(lines.size() - 1), startsWith("FST: packed in "));
    }

    @Test
    public void testBuild_UnknownOption() {
        run("build", "--fast", "long", "in", "out");
        assertResult(1);
        assertOutput();
        assertError("Unknown option: --fast",
                "usage: packedfst build [-v] [--pack] <output type> <sorted input file> <fst file>");
    }

    @Test
    public void testBuild_UnknownOutputType() {
        run("build", "pickle", "in", "out");
        assertResult(1);
        assertOutput();
        assertError("Unknown output type: pickle",
                "Available output types: none, long, bytes, ints, chars");
    }

    @Test
    public void testBuild_OutOfOrder() throws Exception {
        Path input = Utils.writeDictionary(temp, "dict.txt", "b\t1", "a\t2");
        run("build", "long", input.toString(), temp.resolve("dict.fst").toString());
        assertResult(1);
        assertOutput();
        List<String> lines = errorLines();
        assertEquals("Error building FST from: " + input, lines.get(0));
        assertEquals("java.lang.IllegalArgumentException: Key out of order on line 2: a", lines.get(1));
    }

    @Test
    public void testBuild_InvalidOutput() throws Exception {
        Path input = Utils.writeDictionary(temp, "dict.txt", "a\tx");
        run("build", "long", input.toString(), temp.resolve("dict.fst").toString());
        assertResult(1);
        assertOutput();
        assertError("Error building FST from: " + input,
                "java.lang.IllegalArgumentException: Invalid output on line 1: a\tx",
                "java.lang.IllegalArgumentException: Not a number: x",
                "java.lang.NumberFormatException: For input string: \"x\"");
    }

    @Test
    public void testBuild_MissingOutput() throws Exception {
        Path input = Utils.writeDictionary(temp, "dict.txt", "a\t1", "b");
        run("build", "long", input.toString(), temp.resolve("dict.fst").toString());
        assertResult(1);
        assertOutput();
        assertError("Error building FST from: " + input,
                "java.lang.IllegalArgumentException: Missing output on line 2: b");
    }

    @Test
    public void testBuild_Empty() throws Exception {
        Path input = Utils.writeDictionary(temp, "dict.txt", "", "");
        run("build", "none", input.toString(), temp.resolve("dict.fst").toString());
        assertResult(1);
        assertOutput();
        assertError("No entries found in: " + input);
    }

    @Test
    public void testBuild_InvalidPath() {
        Path invalid = temp.resolve("invalid.txt");
        run("build", "long", invalid.toString(), temp.resolve("dict.fst").toString());
        assertResult(1);
        assertOutput();
        assertError("Error building FST from: " + invalid,
                "java.nio.file.NoSuchFileException: " + invalid);
    }

    @Test
    public void testInfo() throws Exception {
        Path input = Utils.writeDictionary(temp, "dict.txt", "\t5", "car\t2", "cart\t3", "cat\t1");
        Path fstFile = temp.resolve("dict.fst");
        run("build", "long", input.toString(), fstFile.toString());
        resetStreams();

        run("info", "long", fstFile.toString());
        assertResult(0);
        FST<Long> fst = FST.read(fstFile, PositiveIntOutputs.getSingleton());
        assertOutput("Input type: BYTE1",
                "Packed: false",
                "Nodes: " + fst.getNodeCount(),
                "Arcs: 5",
                "Arcs with output: 3",
                "Size in bytes: " + fst.getSizeInBytes(),
                "Empty string output: 5");
        assertError();
    }

    @Test
    public void testInfo_Packed() throws Exception {
        Path input = Utils.writeDictionary(temp, "dict.txt", "apple", "banana", "cherry");
        Path fstFile = temp.resolve("dict.fst");
        run("build", "--pack", "none", input.toString(), fstFile.toString());
        resetStreams();

        run("info", "none", fstFile.toString());
        assertResult(0);
        assertThat(outputLines().get(1), startsWith("Packed: true"));
    }

    @Test
    public void testInfo_InvalidPath() {
        Path invalid = temp.resolve("invalid.fst");
        run("info", "long", invalid.toString());
        assertResult(1);
        assertOutput();
        assertError("Error reading FST at: " + invalid,
                "java.nio.file.NoSuchFileException: " + invalid);
    }

    @Test
    public void testLookup() throws Exception {
        Path input = Utils.writeDictionary(temp, "dict.txt", "car\tvehicle", "cart\ttrolley", "cat\tanimal");
        Path fstFile = temp.resolve("dict.fst");
        run("build", "bytes", input.toString(), fstFile.toString());
        resetStreams();

        run("lookup", "bytes", fstFile.toString(), "cart", "ca", "cat");
        assertResult(0);
        assertOutput("cart\ttrolley",
                "ca\t(not found)",
                "cat\tanimal");
        assertError();
    }

    @Test
    public void testLookup_Ints() throws Exception {
        Path input = Utils.writeDictionary(temp, "dict.txt", "one\t1", "three\t1,2,3");
        Path fstFile = temp.resolve("dict.fst");
        run("build", "ints", input.toString(), fstFile.toString());
        resetStreams();

        run("lookup", "ints", fstFile.toString(), "three", "one");
        assertResult(0);
        assertOutput("three\t1,2,3",
                "one\t1");
    }

    @Test
    public void testLookup_TooFewArguments() {
        run("lookup", "long", "dict.fst");
        assertResult(1);
        assertOutput();
        assertError("usage: packedfst lookup <output type> <fst file> <key...>");
    }

    private void run(String... args) {
        result = new Main().run(List.of(args), out, err);
    }

    private void resetStreams() {
        rawOut.reset();
        rawErr.reset();
    }

    private List<String> outputLines() {
        return Arrays.asList(rawOut.toString(StandardCharsets.UTF_8).trim().split("\\R"));
    }

    private List<String> errorLines() {
        return Arrays.asList(rawErr.toString(StandardCharsets.UTF_8).trim().split("\\R"));
    }

    private void assertResult(int expected) {
        assertEquals(expected, result);
    }

    private void assertOutput(String... expectedLines) {
        String expected = String.join(System.lineSeparator(), expectedLines);
        assertEquals(expected, rawOut.toString(StandardCharsets.UTF_8).trim());
    }

    private void assertError(String... expectedLines) {
        String expected = String.join(System.lineSeparator(), expectedLines);
        assertEquals(expected, rawErr.toString(StandardCharsets.UTF_8).trim());
    }
}
