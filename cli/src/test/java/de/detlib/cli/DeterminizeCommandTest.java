package de.detlib.cli;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

public class DeterminizeCommandTest {

    private static final String EPSILON_NFA = "{\n" +
                                              "  \"states\": [\"q0\", \"q1\", \"q2\", \"q3\"],\n" +
                                              "  \"alphabet\": [\"a\", \"b\"],\n" +
                                              "  \"start_state\": \"q0\",\n" +
                                              "  \"final_states\": [\"q0\"],\n" +
                                              "  \"state_transitions\": {\n" +
                                              "    \"q0\": { \"ε\": [\"q1\"] },\n" +
                                              "    \"q1\": { \"a\": [\"q1\", \"q2\"], \"b\": [\"q2\"] },\n" +
                                              "    \"q2\": { \"a\": [\"q0\", \"q2\"], \"b\": [\"q3\"] },\n" +
                                              "    \"q3\": { \"b\": [\"q1\"] }\n" +
                                              "  }\n" +
                                              "}\n";

    private Path description;
    private Path broken;

    private final ByteArrayOutputStream outBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuffer = new ByteArrayOutputStream();

    @BeforeClass
    public void setUp() throws IOException {
        description = Files.createTempFile("epsilon-nfa", ".json");
        Files.write(description, EPSILON_NFA.getBytes(StandardCharsets.UTF_8));
        broken = Files.createTempFile("broken", ".json");
        Files.write(broken, "{\"states\": [".getBytes(StandardCharsets.UTF_8));
    }

    @AfterClass
    public void tearDown() throws IOException {
        Files.deleteIfExists(description);
        Files.deleteIfExists(broken);
    }

    @Test
    public void testSimulateWords() {
        final int exit = run("-f", description.toString(), "-w", "aa", "--word", "aab", "-w", "bba", "-w", "c");

        Assert.assertEquals(exit, DeterminizeCommand.EXIT_OK);
        final String out = out();
        Assert.assertTrue(out.contains("aa -> ACCEPTED"), out);
        Assert.assertTrue(out.contains("aab -> REJECTED"), out);
        Assert.assertTrue(out.contains("bba -> NO_TRANSITION"), out);
        Assert.assertTrue(out.contains("c -> INVALID_ALPHABET"), out);
    }

    @Test
    public void testPrintAutomaton() {
        final int exit = run("-f", description.toString(), "-p");

        Assert.assertEquals(exit, DeterminizeCommand.EXIT_OK);
        Assert.assertTrue(out().contains("\"start_state\" : \"q0,q1\""), out());
    }

    @Test
    public void testMissingFile() {
        Assert.assertEquals(run("-w", "a"), DeterminizeCommand.EXIT_USAGE);
    }

    @Test
    public void testUnknownOption() {
        Assert.assertEquals(run("-f", description.toString(), "--minimize"), DeterminizeCommand.EXIT_USAGE);
    }

    @Test
    public void testUnreadableInput() {
        Assert.assertEquals(run("-f", broken.toString()), DeterminizeCommand.EXIT_INPUT);
        Assert.assertEquals(run("-f", description.resolveSibling("does-not-exist.json").toString()),
                            DeterminizeCommand.EXIT_INPUT);
    }

    @Test
    public void testHelp() {
        Assert.assertEquals(run("-h"), DeterminizeCommand.EXIT_OK);
        Assert.assertTrue(out().contains("determinize"), out());
    }

    private int run(String... args) {
        outBuffer.reset();
        errBuffer.reset();
        try (PrintStream out = new PrintStream(outBuffer, true, StandardCharsets.UTF_8);
             PrintStream err = new PrintStream(errBuffer, true, StandardCharsets.UTF_8)) {
            return new DeterminizeCommand().run(args, out, err);
        }
    }

    private String out() {
        return new String(outBuffer.toByteArray(), StandardCharsets.UTF_8);
    }
}
