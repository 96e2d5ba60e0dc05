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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads networks from files holding a single literal binding like {@code transitions = {...}}. The
 * binding may be preceded by a {@code """} docstring and comments; the mapping itself may use single
 * quotes, {@code #} comments and trailing commas.
 */
public final class NetworkReader {
    public static final String TRANSITIONS = "transitions";
    public static final String NETWORK_FUNCTIONS = "network_functions";
    public static final String TRUTH_TABLE = "truth_table";

    private static final Pattern DOCSTRING = Pattern.compile("\"\"\".*?\"\"\"", Pattern.DOTALL);
    private static final ObjectMapper mapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_YAML_COMMENTS)
            .build();

    private NetworkReader() {}

    /**
     * Reads a transitions file. An entry listing the state itself marks a fixed point and does not
     * add a transition.
     */
    public static TransitionSet readTransitions(Reader reader) throws IOException, InvalidFormatException {
        JsonNode root = readBinding(reader, TRANSITIONS);
        int variableCount = -1;
        TransitionSet.Builder builder = null;
        Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            State source = parseState(entry.getKey(), variableCount);
            if (builder == null) {
                variableCount = source.variableCount();
                builder = TransitionSet.builder(variableCount);
            }
            builder.addState(source);
            if (!entry.getValue().isArray()) {
                throw new InvalidFormatException("Successors of " + entry.getKey() + " are not a list");
            }
            for (JsonNode node : entry.getValue()) {
                State target = parseState(textOf(node, entry.getKey()), variableCount);
                if (target.equals(source)) {
                    continue;
                }
                if (source.distance(target) != 1) {
                    throw new InvalidFormatException(String.format(
                            "Transition %s -> %s does not flip exactly one variable", source, target));
                }
                builder.add(source, target);
            }
        }
        if (builder == null) {
            throw new InvalidFormatException("No states in " + TRANSITIONS);
        }
        return builder.build();
    }

    /** Reads a functions file with one expression per variable {@code x1, ..., xn}. */
    public static BooleanNetwork readNetwork(Reader reader) throws IOException, InvalidFormatException {
        JsonNode root = readBinding(reader, NETWORK_FUNCTIONS);
        int variableCount = root.size();
        if (variableCount == 0 || variableCount > State.MAX_VARIABLES) {
            throw new InvalidFormatException("Invalid number of functions " + variableCount);
        }
        Expression[] expressions = new Expression[variableCount];
        Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            int variable = parseVariable(entry.getKey(), variableCount);
            String text = textOf(entry.getValue(), entry.getKey());
            try {
                expressions[variable] = ExpressionParser.parse(text, variableCount);
            } catch (InvalidFormatException e) {
                throw new InvalidFormatException("Invalid function for " + entry.getKey() + ": " + e.getMessage(), e);
            }
        }

        List<BooleanFunction> functions = new ArrayList<>(variableCount);
        for (int variable = 0; variable < variableCount; variable++) {
            if (expressions[variable] == null) {
                throw new InvalidFormatException("No function for " + StateSpace.variableName(variable));
            }
            functions.add(BooleanFunction.of(variable, variableCount, expressions[variable]));
        }
        return BooleanNetwork.of(ImmutableList.copyOf(functions));
    }

    /** Reads a truth table file, which has to list every state and every variable. */
    public static TruthTable readTruthTable(Reader reader) throws IOException, InvalidFormatException {
        JsonNode root = readBinding(reader, TRUTH_TABLE);
        if (root.size() == 0) {
            throw new InvalidFormatException("No states in " + TRUTH_TABLE);
        }
        int variableCount = root.fieldNames().next().length();
        if (variableCount == 0 || variableCount > State.MAX_VARIABLES || root.size() != 1 << variableCount) {
            throw new InvalidFormatException(String.format(
                    "Truth table lists %d states of length %d", root.size(), variableCount));
        }

        TruthTable.Builder builder = TruthTable.builder(variableCount);
        Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            State state = parseState(entry.getKey(), variableCount);
            JsonNode row = entry.getValue();
            if (!row.isObject() || row.size() != variableCount) {
                throw new InvalidFormatException("Row of " + state + " does not list all " + variableCount + " variables");
            }
            Iterator<Map.Entry<String, JsonNode>> cells = row.fields();
            while (cells.hasNext()) {
                Map.Entry<String, JsonNode> cell = cells.next();
                int variable = parseVariable(cell.getKey(), variableCount);
                State result = parseState(textOf(cell.getValue(), entry.getKey()), variableCount);
                try {
                    builder.put(state, variable, result);
                } catch (IllegalArgumentException e) {
                    throw new InvalidFormatException(e.getMessage(), e);
                }
            }
        }
        try {
            return builder.build();
        } catch (IllegalStateException e) {
            throw new InvalidFormatException(e.getMessage(), e);
        }
    }

    /** Locates the binding of the given name and parses the literal assigned to it. */
    static JsonNode readBinding(Reader reader, String name) throws IOException, InvalidFormatException {
        String text = DOCSTRING.matcher(CharStreams.toString(reader)).replaceAll("");
        Matcher matcher = Pattern.compile("(?m)^\\s*" + Pattern.quote(name) + "\\s*=").matcher(text);
        if (!matcher.find()) {
            throw new InvalidFormatException("No binding '" + name + "' found");
        }
        JsonNode root;
        try (JsonParser parser = mapper.createParser(text.substring(matcher.end()))) {
            root = mapper.readTree(parser);
        } catch (JsonProcessingException e) {
            throw new InvalidFormatException("Malformed value of '" + name + "': " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidFormatException("Value of '" + name + "' is not a mapping");
        }
        return root;
    }

    private static String textOf(JsonNode node, String key) throws InvalidFormatException {
        if (!node.isTextual()) {
            throw new InvalidFormatException("Expected a string for " + key + ", found " + node);
        }
        return node.textValue();
    }

    private static State parseState(String text, int variableCount) throws InvalidFormatException {
        State state;
        try {
            state = State.parse(text);
        } catch (IllegalArgumentException e) {
            throw new InvalidFormatException("Invalid state '" + text + "'", e);
        }
        if (variableCount > 0 && state.variableCount() != variableCount) {
            throw new InvalidFormatException(
                    String.format("State '%s' does not have %d variables", text, variableCount));
        }
        return state;
    }

    private static int parseVariable(String name, int variableCount) throws InvalidFormatException {
        int variable = StateSpace.variableIndex(name);
        if (variable < 0 || variable >= variableCount) {
            throw new InvalidFormatException("Undefined variable '" + name + "'");
        }
        return variable;
    }
}
