package de.detlib.oracle.simulator;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import de.detlib.api.simulation.Acceptance;
import de.detlib.examples.ExampleTrailingZerosDFA;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class DFASimulatorOracleTest {

    private final DFASimulatorOracle oracle = new DFASimulatorOracle(ExampleTrailingZerosDFA.constructDFA());

    @Test
    public void testPrefixSuffixQuery() {
        Word<Character> prefix = Word.fromCharSequence("001");
        Assert.assertEquals(oracle.answerQuery(prefix, Word.fromCharSequence("00")), Acceptance.ACCEPTED);
        Assert.assertEquals(oracle.answerQuery(prefix, Word.fromCharSequence("0")), Acceptance.REJECTED);
        Assert.assertEquals(oracle.answerQuery(prefix, Word.fromCharSequence("x")), Acceptance.INVALID_ALPHABET);
        Assert.assertTrue(oracle.accepts("1"));
        Assert.assertFalse(oracle.accepts("10"));
        Assert.assertEquals(oracle.getAutomaton().getStartState(), "q1");
    }

    @Test(timeOut = 10000)
    public void testConcurrentQueries() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Acceptance>> results = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                final String word = i % 2 == 0 ? "110011" : "001000";
                results.add(executor.submit(() -> oracle.answerQuery(word)));
            }
            for (int i = 0; i < results.size(); i++) {
                Acceptance expected = i % 2 == 0 ? Acceptance.ACCEPTED : Acceptance.REJECTED;
                Assert.assertEquals(results.get(i).get(), expected);
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
    }
}
