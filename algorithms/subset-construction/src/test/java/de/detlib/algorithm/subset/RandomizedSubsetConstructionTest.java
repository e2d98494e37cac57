package de.detlib.algorithm.subset;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import de.detlib.api.automaton.DFA;
import de.detlib.api.automaton.NFA;
import de.detlib.examples.AutomatonExample;
import de.detlib.examples.ExampleEpsilonNFA;
import de.detlib.examples.ExampleRandomDeterministicNFA;
import de.detlib.examples.ExampleRandomNFA;
import de.detlib.examples.ExampleTrailingZerosDFA;
import de.detlib.examples.ReferenceAcceptor;
import de.detlib.examples.Words;
import de.detlib.oracle.simulator.DFAWalkSimulator;
import de.detlib.util.automata.AutomataLibConversions;
import net.automatalib.automata.fsa.impl.compact.CompactNFA;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import net.automatalib.words.impl.Alphabets;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class RandomizedSubsetConstructionTest {

    private static final List<Character> SYMBOLS = Arrays.asList('a', 'b');
    private static final int MAX_WORD_LENGTH = 6;

    private final DFAWalkSimulator simulator = DFAWalkSimulator.getInstance();

    @DataProvider(name = "seeds")
    public static Object[][] seeds() {
        return new Object[][] {{1L}, {17L}, {42L}, {1337L}, {4711L}, {90210L}};
    }

    @DataProvider(name = "examples")
    public static Object[][] examples() {
        final Random random = new Random(3);
        return new Object[][] {{ExampleTrailingZerosDFA.createExample()},
                               {ExampleEpsilonNFA.createExample()},
                               {new ExampleRandomNFA(random, SYMBOLS, 5, 0.25, 0.1, 0.4)},
                               {new ExampleRandomDeterministicNFA(random, Alphabets.characters('x', 'z'), 6)}};
    }

    @Test(dataProvider = "examples")
    public void testExamples(AutomatonExample example) {
        final NFA nfa = example.getReferenceAutomaton();
        final DFA dfa = new SubsetConstruction().determinize(nfa);

        Assert.assertEquals(dfa.getSymbols(), nfa.getSymbols());
        for (Word<Character> word : Words.allWords(example.getAlphabet(), MAX_WORD_LENGTH)) {
            Assert.assertEquals(simulator.simulate(dfa, word).isAccepted(), ReferenceAcceptor.accepts(nfa, word),
                                word.toString());
        }
    }

    @Test(dataProvider = "seeds")
    public void testRandomEpsilonNFAs(long seed) {
        final Random random = new Random(seed);

        for (int i = 0; i < 10; i++) {
            final int size = 2 + random.nextInt(5);
            final NFA nfa = ExampleRandomNFA.constructMachine(random, SYMBOLS, size, 0.3, 0.15, 0.3);
            final DFA dfa = new SubsetConstruction().determinize(nfa);

            Assert.assertTrue(dfa.size() <= 1 << size, "Too many state sets: " + dfa.size());
            for (Word<Character> word : Words.allWords(SYMBOLS, MAX_WORD_LENGTH)) {
                Assert.assertEquals(simulator.simulate(dfa, word).isAccepted(),
                                    ReferenceAcceptor.accepts(nfa, word),
                                    "seed " + seed + ", word '" + word + "', automaton " + nfa);
            }
        }
    }

    @Test(dataProvider = "seeds")
    public void testAgainstCompactNFA(long seed) {
        final Random random = new Random(seed);

        for (int i = 0; i < 10; i++) {
            final NFA nfa = ExampleRandomNFA.constructMachine(random, SYMBOLS, 4, 0.35, 0.0, 0.5);
            final CompactNFA<Character> reference = AutomataLibConversions.toCompactNFA(nfa).getFirst();
            final DFA dfa = new SubsetConstruction(false).determinize(nfa);

            for (Word<Character> word : Words.allWords(SYMBOLS, MAX_WORD_LENGTH)) {
                Assert.assertEquals(simulator.simulate(dfa, word).isAccepted(), reference.accepts(word),
                                    "seed " + seed + ", word '" + word + "'");
            }
        }
    }

    @Test(dataProvider = "seeds")
    public void testShortcutAgreesWithGeneralPath(long seed) {
        final Alphabet<Character> alphabet = Alphabets.characters('a', 'c');
        final NFA nfa = ExampleRandomDeterministicNFA.constructMachine(new Random(seed), alphabet, 8);

        Assert.assertTrue(nfa.isDeterministic());

        final DFA shortcut = new SubsetConstruction(true).determinize(nfa);
        final DFA general = new SubsetConstruction(false).determinize(nfa);

        for (Word<Character> word : Words.allWords(alphabet, 5)) {
            Assert.assertEquals(simulator.simulate(shortcut, word), simulator.simulate(general, word),
                                word.toString());
        }
    }
}
