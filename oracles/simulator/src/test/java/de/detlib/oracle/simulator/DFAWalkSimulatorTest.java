/* Copyright (C) 2024 DetLib contributors
 * This file is part of DetLib.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.detlib.oracle.simulator;

import java.util.Arrays;

import de.detlib.api.automaton.DFA;
import de.detlib.api.simulation.Acceptance;
import de.detlib.examples.ExampleTrailingZerosDFA;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class DFAWalkSimulatorTest {

    private final DFA dfa = ExampleTrailingZerosDFA.constructDFA();
    private final DFAWalkSimulator simulator = new DFAWalkSimulator();

    @DataProvider
    public static Object[][] words() {
        return new Object[][] {{"11111", Acceptance.ACCEPTED},
                               {"00100", Acceptance.ACCEPTED},
                               {"11100", Acceptance.ACCEPTED},
                               {"110011", Acceptance.ACCEPTED},
                               {"001001", Acceptance.ACCEPTED},
                               {"0010001", Acceptance.ACCEPTED},
                               {"00000", Acceptance.REJECTED},
                               {"01010", Acceptance.REJECTED},
                               {"001000", Acceptance.REJECTED},
                               {"", Acceptance.REJECTED},
                               {"a11111", Acceptance.INVALID_ALPHABET},
                               {"00100b", Acceptance.INVALID_ALPHABET},
                               {"111c00", Acceptance.INVALID_ALPHABET},
                               {"111020", Acceptance.INVALID_ALPHABET},
                               {"1-11c00", Acceptance.INVALID_ALPHABET}};
    }

    @Test(dataProvider = "words")
    public void testCompleteAutomaton(String word, Acceptance expected) {
        Assert.assertEquals(simulator.simulate(dfa, word), expected);
        Assert.assertEquals(simulator.simulate(dfa, Word.fromCharSequence(word)), expected);
    }

    @Test
    public void testEmptyWord() {
        DFA accepting = DFA.builder().withStates("s").withAlphabet('a').withStartState("s").withFinalStates("s").build();
        DFA rejecting = DFA.builder().withStates("s").withAlphabet('a').withStartState("s").build();

        Assert.assertEquals(simulator.simulate(accepting, ""), Acceptance.ACCEPTED);
        Assert.assertEquals(simulator.simulate(accepting, Word.epsilon()), Acceptance.ACCEPTED);
        Assert.assertEquals(simulator.simulate(rejecting, ""), Acceptance.REJECTED);
    }

    @Test
    public void testPartialAutomaton() {
        // s0 -a-> s1 (final), nothing else
        DFA partial = DFA.builder()
                         .withStates("s0", "s1")
                         .withAlphabet('a', 'b')
                         .withStartState("s0")
                         .withFinalStates("s1")
                         .withTransition("s0", 'a', "s1")
                         .build();

        Assert.assertEquals(simulator.simulate(partial, "a"), Acceptance.ACCEPTED);
        Assert.assertEquals(simulator.simulate(partial, "b"), Acceptance.NO_TRANSITION);
        Assert.assertEquals(simulator.simulate(partial, "aa"), Acceptance.NO_TRANSITION);
        // the walk halts before reaching the invalid symbol
        Assert.assertEquals(simulator.simulate(partial, "aac"), Acceptance.NO_TRANSITION);
        Assert.assertEquals(simulator.simulate(partial, "ca"), Acceptance.INVALID_ALPHABET);
    }

    @Test
    public void testUndeclaredTarget() {
        DFA dfa = DFA.builder()
                     .withStates("s0")
                     .withAlphabet('a')
                     .withStartState("s0")
                     .withTransition("s0", 'a', "elsewhere")
                     .build();

        Assert.assertEquals(simulator.simulate(dfa, "a"), Acceptance.REJECTED);
        Assert.assertEquals(simulator.simulate(dfa, "aa"), Acceptance.NO_TRANSITION);
    }

    @Test
    public void testNullSymbol() {
        Word<Character> word = Word.fromList(Arrays.asList('1', null, '1'));
        Assert.assertEquals(simulator.simulate(dfa, word), Acceptance.INVALID_ALPHABET);
    }

    @Test
    public void testRepeatedQueriesGiveSameOutcome() {
        for (int i = 0; i < 10; i++) {
            Assert.assertEquals(simulator.simulate(dfa, "0010001"), Acceptance.ACCEPTED);
        }
    }
}
