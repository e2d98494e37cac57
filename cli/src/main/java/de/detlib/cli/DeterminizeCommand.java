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
package de.detlib.cli;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import de.detlib.algorithm.subset.SubsetConstruction;
import de.detlib.api.automaton.DFA;
import de.detlib.api.automaton.NFA;
import de.detlib.api.simulation.Acceptance;
import de.detlib.oracle.simulator.DFAWalkSimulator;
import de.detlib.serialization.json.AutomatonFormatException;
import de.detlib.serialization.json.JsonAutomatonParser;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point: reads a JSON automaton description, determinizes it and simulates the given words on the
 * result.
 * <pre>
 * determinize -f &lt;file&gt; [-w &lt;word&gt;]... [-p] [-e &lt;token&gt;]
 * </pre>
 * For each word, one line {@code <word> -> <outcome>} is printed. Exit codes: {@value #EXIT_OK} on success,
 * {@value #EXIT_INPUT} if the description cannot be read, {@value #EXIT_USAGE} on bad arguments.
 */
public final class DeterminizeCommand {

    public static final int EXIT_OK = 0;
    public static final int EXIT_INPUT = 1;
    public static final int EXIT_USAGE = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(DeterminizeCommand.class);

    private static final String NAME = "determinize";

    private final Options options;

    public DeterminizeCommand() {
        options = new Options();
        options.addOption(Option.builder("f")
                                .longOpt("file")
                                .hasArg()
                                .argName("file")
                                .desc("JSON description of the automaton")
                                .build());
        options.addOption(Option.builder("w")
                                .longOpt("word")
                                .hasArg()
                                .argName("word")
                                .desc("word to simulate on the determinized automaton, may be repeated")
                                .build());
        options.addOption("p", "print", false, "print the determinized automaton");
        options.addOption(Option.builder("e")
                                .longOpt("epsilon")
                                .hasArg()
                                .argName("token")
                                .desc("token denoting epsilon transitions (default: "
                                      + JsonAutomatonParser.DEFAULT_EPSILON_TOKEN + ")")
                                .build());
        options.addOption("h", "help", false, "print this help");
    }

    public static void main(String[] args) {
        System.exit(new DeterminizeCommand().run(args, System.out, System.err));
    }

    public int run(String[] args, PrintStream out, PrintStream err) {
        final CommandLineParser parser = new DefaultParser();
        final CommandLine cmd;

        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            err.println(e.getMessage());
            printHelp(err);
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            printHelp(out);
            return EXIT_OK;
        }
        if (!cmd.hasOption("file") || !cmd.getArgList().isEmpty()) {
            err.println("Expected exactly the option -f <file> and no further arguments");
            printHelp(err);
            return EXIT_USAGE;
        }

        final JsonAutomatonParser jsonParser =
                new JsonAutomatonParser(cmd.getOptionValue("epsilon", JsonAutomatonParser.DEFAULT_EPSILON_TOKEN));
        final File file = new File(cmd.getOptionValue("file"));

        final NFA nfa;
        try {
            nfa = jsonParser.readNFA(file);
        } catch (IOException | AutomatonFormatException e) {
            LOGGER.debug("Could not read {}", file, e);
            err.println("Cannot read " + file + ": " + e.getMessage());
            return EXIT_INPUT;
        }

        final DFA dfa = new SubsetConstruction().determinize(nfa);
        LOGGER.info("Determinized {} states into {} states", nfa.getStates().size(), dfa.size());

        if (cmd.hasOption("print")) {
            out.println(jsonParser.writeDFA(dfa));
        }

        final String[] words = cmd.getOptionValues("word");
        if (words != null) {
            for (String word : words) {
                final Acceptance outcome = DFAWalkSimulator.getInstance().simulate(dfa, word);
                out.println(word + " -> " + outcome);
            }
        }

        return EXIT_OK;
    }

    private void printHelp(PrintStream stream) {
        final PrintWriter writer = new PrintWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8));
        final HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp(writer,
                            HelpFormatter.DEFAULT_WIDTH,
                            NAME,
                            null,
                            options,
                            HelpFormatter.DEFAULT_LEFT_PAD,
                            HelpFormatter.DEFAULT_DESC_PAD,
                            null,
                            true);
        writer.flush();
    }
}
