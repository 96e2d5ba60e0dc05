/*
 * This file is part of BoolNet.
 * Copyright (c) 2026 The BoolNet Authors.
 *
 * BoolNet is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * BoolNet is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with BoolNet. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.boolnet;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/** Command line entry point. Each command reads at most one file and writes one file. */
public final class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    static final int SUCCESS = 0;
    static final int USER_ERROR = 1;
    static final int USAGE_ERROR = 2;

    static final int DEFAULT_ATTRACTOR_COUNT = 3;
    static final int DEFAULT_ATTRACTOR_SIZE = 4;

    private static final ImmutableSet<String> OPTIONS = ImmutableSet.of(
            "--seed",
            "--variables",
            "--parentless",
            "--attractors",
            "--attractor-size",
            "--attractor-sizes",
            "--min-ones",
            "--max-ones",
            "--dependencies",
            "--max-attempts",
            "--policy",
            "-o");

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: boolnet <command> [options]",
            "Commands:",
            "  generate-network [--variables n] [--parentless p] [--attractors k --attractor-size l"
                    + " | --attractor-sizes a,b,c] [--seed s] [--max-attempts m]",
            "  generate-3dep [--variables n] [--dependencies k] [--min-ones a] [--max-ones b]"
                    + " [--attractors k] [--attractor-sizes a,b,c] [--seed s] [--max-attempts m]",
            "  transitions-to-truth-table <file> [--policy flip|self-loop]",
            "  functions-to-truth-table <file>",
            "  truth-table-to-sops <file>",
            "  simplify-sops <file>",
            "  analyze <file>",
            "All commands write to standard output unless -o <file> is given.");

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return USAGE_ERROR;
        }

        try {
            return execute(arguments, out, err);
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return USAGE_ERROR;
        } catch (InvalidFormatException e) {
            err.println("Invalid input: " + e.getMessage());
            return USER_ERROR;
        } catch (StructuralInfeasibleException e) {
            err.println("Infeasible parameter " + e.parameter() + ": " + e.getMessage());
            return USER_ERROR;
        } catch (IOException e) {
            logger.log(Level.FINE, "I/O failure", e);
            err.println("I/O error: " + e.getMessage());
            return USER_ERROR;
        }
    }

    private static int execute(Arguments arguments, PrintStream out, PrintStream err)
            throws UsageException, IOException, InvalidFormatException, StructuralInfeasibleException {
        switch (arguments.command) {
            case "generate-network":
                return generateNetwork(arguments, out);
            case "generate-3dep":
                return generateBoundedDependency(arguments, out, err);
            case "transitions-to-truth-table": {
                TransitionSet transitions;
                try (Reader reader = Files.newBufferedReader(arguments.input())) {
                    transitions = NetworkReader.readTransitions(reader);
                }
                TruthTable table = TruthTables.fromTransitions(transitions, arguments.policy());
                try (Writer writer = arguments.output(out)) {
                    NetworkWriter.writeTruthTable(table, writer);
                }
                return SUCCESS;
            }
            case "functions-to-truth-table": {
                BooleanNetwork network;
                try (Reader reader = Files.newBufferedReader(arguments.input())) {
                    network = NetworkReader.readNetwork(reader);
                }
                try (Writer writer = arguments.output(out)) {
                    NetworkWriter.writeTruthTable(TruthTables.fromNetwork(network), writer);
                }
                return SUCCESS;
            }
            case "truth-table-to-sops": {
                TruthTable table;
                try (Reader reader = Files.newBufferedReader(arguments.input())) {
                    table = NetworkReader.readTruthTable(reader);
                }
                try (Writer writer = arguments.output(out)) {
                    NetworkWriter.writeNetwork(
                            FunctionExtractor.extractAll(table), writer, "Functions extracted from: " + arguments.input());
                }
                return SUCCESS;
            }
            case "simplify-sops": {
                BooleanNetwork network;
                try (Reader reader = Files.newBufferedReader(arguments.input())) {
                    network = NetworkReader.readNetwork(reader);
                }
                BooleanNetwork simplified = new QuineMcCluskey().simplify(network);
                try (Writer writer = arguments.output(out)) {
                    NetworkWriter.writeNetwork(simplified, writer, "Simplified functions from: " + arguments.input());
                }
                return SUCCESS;
            }
            case "analyze": {
                TransitionSet transitions;
                try (Reader reader = Files.newBufferedReader(arguments.input())) {
                    transitions = NetworkReader.readTransitions(reader);
                }
                NetworkAnalysis analysis = transitions.analyse();
                try (Writer writer = arguments.output(out)) {
                    writer.write(analysis + System.lineSeparator());
                    for (Set<State> attractor : analysis.attractors()) {
                        writer.write("Attractor " + attractor + System.lineSeparator());
                    }
                }
                return SUCCESS;
            }
            default:
                throw new UsageException("Unknown command " + arguments.command);
        }
    }

    private static int generateNetwork(Arguments arguments, PrintStream out)
            throws UsageException, IOException, StructuralInfeasibleException {
        long seed = arguments.seed();
        ImmutableStructuralNetworkConfiguration.Builder builder = ImmutableStructuralNetworkConfiguration.builder()
                .seed(seed)
                .variableCount(arguments.intOption("--variables", StructuralNetworkConfiguration.DEFAULT_VARIABLE_COUNT))
                .parentlessCount(arguments.intOption("--parentless", StructuralNetworkConfiguration.DEFAULT_PARENTLESS_COUNT))
                .maxAttempts(arguments.intOption("--max-attempts", StructuralNetworkConfiguration.DEFAULT_MAX_ATTEMPTS));
        List<Integer> sizes = arguments.sizes();
        if (sizes == null) {
            int count = arguments.intOption("--attractors", DEFAULT_ATTRACTOR_COUNT);
            int size = arguments.intOption("--attractor-size", DEFAULT_ATTRACTOR_SIZE);
            sizes = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                sizes.add(size);
            }
        }
        builder.attractorSizes(sizes);

        StructuralNetworkConfiguration configuration;
        try {
            configuration = builder.build();
        } catch (IllegalStateException e) {
            throw new UsageException(e.getMessage());
        }
        StructuralNetwork network = new StructuralNetworkGenerator(configuration).generate();
        String description = String.format(
                "Generated network over %d variables (seed %d)%n%nStructure:%n"
                        + "  - %d parentless states%n  - %d transient states%n  - attractors of sizes %s",
                configuration.variableCount(),
                seed,
                network.parentless().size(),
                network.transientStates().size(),
                network.analyse().attractorSizes());
        try (Writer writer = arguments.output(out)) {
            NetworkWriter.writeTransitions(network.transitions(), writer, description);
        }
        return SUCCESS;
    }

    private static int generateBoundedDependency(Arguments arguments, PrintStream out, PrintStream err)
            throws UsageException, IOException {
        long seed = arguments.seed();
        ImmutableBoundedDependencyConfiguration.Builder builder = ImmutableBoundedDependencyConfiguration.builder()
                .seed(seed)
                .variableCount(arguments.intOption("--variables", BoundedDependencyConfiguration.DEFAULT_VARIABLE_COUNT))
                .dependencyCount(
                        arguments.intOption("--dependencies", BoundedDependencyConfiguration.DEFAULT_DEPENDENCY_COUNT))
                .minTrueOutputs(arguments.intOption("--min-ones", BoundedDependencyConfiguration.DEFAULT_MIN_TRUE_OUTPUTS))
                .maxTrueOutputs(arguments.intOption("--max-ones", BoundedDependencyConfiguration.DEFAULT_MAX_TRUE_OUTPUTS))
                .maxAttempts(arguments.intOption("--max-attempts", BoundedDependencyConfiguration.DEFAULT_MAX_ATTEMPTS));
        if (arguments.options.containsKey("--attractors")) {
            builder.attractorCount(arguments.intOption("--attractors", 0));
        }
        List<Integer> sizes = arguments.sizes();
        if (sizes != null) {
            builder.attractorSizes(sizes);
        }

        BoundedDependencyConfiguration configuration;
        try {
            configuration = builder.build();
        } catch (IllegalStateException e) {
            throw new UsageException(e.getMessage());
        }
        GenerationResult result = new BoundedDependencyGenerator(configuration).generate();
        if (result.isExhausted()) {
            err.println(result);
            return USER_ERROR;
        }
        String description = String.format(
                "Generated network over %d variables with %d dependencies per function (seed %d)%n"
                        + "Attractors of sizes %s found after %d attempts",
                configuration.variableCount(),
                configuration.dependencyCount(),
                seed,
                result.attractorSizes(),
                result.attempts());
        try (Writer writer = arguments.output(out)) {
            NetworkWriter.writeNetwork(result.network(), writer, description);
        }
        return SUCCESS;
    }

    static final class UsageException extends Exception {
        private static final long serialVersionUID = 1L;

        UsageException(String message) {
            super(message);
        }
    }

    private static final class Arguments {
        private final String command;
        private final List<String> positional;
        private final Map<String, String> options;

        private Arguments(String command, List<String> positional, Map<String, String> options) {
            this.command = command;
            this.positional = positional;
            this.options = options;
        }

        static Arguments parse(String[] args) throws UsageException {
            if (args.length == 0) {
                throw new UsageException("No command given");
            }
            List<String> positional = new ArrayList<>();
            Map<String, String> options = new HashMap<>();
            for (int i = 1; i < args.length; i++) {
                String argument = args[i];
                if (OPTIONS.contains(argument)) {
                    if (i + 1 == args.length) {
                        throw new UsageException("Missing value for " + argument);
                    }
                    options.put(argument, args[i + 1]);
                    i += 1;
                } else if (argument.startsWith("-")) {
                    throw new UsageException("Unknown option " + argument);
                } else {
                    positional.add(argument);
                }
            }
            return new Arguments(args[0], ImmutableList.copyOf(positional), options);
        }

        Path input() throws UsageException {
            if (positional.size() != 1) {
                throw new UsageException(command + " expects exactly one input file");
            }
            return Paths.get(positional.get(0));
        }

        Writer output(PrintStream out) throws IOException {
            String file = options.get("-o");
            if (file == null) {
                return new OutputStreamWriter(new UncloseableStream(out), StandardCharsets.UTF_8);
            }
            logger.log(Level.FINE, "Writing to {0}", file);
            return Files.newBufferedWriter(Paths.get(file), StandardCharsets.UTF_8);
        }

        int intOption(String name, int defaultValue) throws UsageException {
            String value = options.get(name);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new UsageException("Invalid number '" + value + "' for " + name);
            }
        }

        long seed() throws UsageException {
            String value = options.get("--seed");
            if (value == null) {
                long seed = new Random().nextLong();
                logger.log(Level.INFO, "Using random seed {0}", seed);
                return seed;
            }
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new UsageException("Invalid seed '" + value + "'");
            }
        }

        @Nullable
        List<Integer> sizes() throws UsageException {
            String value = options.get("--attractor-sizes");
            if (value == null) {
                return null;
            }
            List<Integer> sizes = new ArrayList<>();
            for (String size : Splitter.on(',').trimResults().omitEmptyStrings().split(value)) {
                try {
                    sizes.add(Integer.parseInt(size));
                } catch (NumberFormatException e) {
                    throw new UsageException("Invalid attractor size '" + size + "'");
                }
            }
            return sizes;
        }

        MissingTransitionPolicy policy() throws UsageException {
            String value = options.getOrDefault("--policy", "flip");
            switch (value.toLowerCase(Locale.ROOT)) {
                case "flip":
                    return MissingTransitionPolicy.FLIP;
                case "self-loop":
                    return MissingTransitionPolicy.SELF_LOOP;
                default:
                    throw new UsageException("Unknown policy " + value);
            }
        }
    }

    /** Keeps standard output open when the writer wrapping it is closed. */
    private static final class UncloseableStream extends FilterOutputStream {
        UncloseableStream(PrintStream out) {
            super(out);
        }

        @Override
        public void write(byte[] bytes, int offset, int length) throws IOException {
            out.write(bytes, offset, length);
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }
}
