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

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for Boolean expressions over {@code x1, ..., xn}.
 *
 * <pre>
 *   disjunction := conjunction ('|' conjunction)*
 *   conjunction := negation ('&amp;' negation)*
 *   negation    := '~'* atom
 *   atom        := '(' disjunction ')' | 'x' digits | '0' | '1'
 * </pre>
 */
public final class ExpressionParser {
    static final int MAX_DEPTH = 256;

    private final String text;
    private final int variableCount;
    private int position = 0;
    private int depth = 0;

    private ExpressionParser(String text, int variableCount) {
        this.text = text;
        this.variableCount = variableCount;
    }

    /**
     * Parses the given expression.
     *
     * @throws InvalidFormatException if the text is not a well-formed expression or references a
     *     variable outside of {@code x1, ..., x<variableCount>}.
     */
    public static Expression parse(String text, int variableCount) throws InvalidFormatException {
        ExpressionParser parser = new ExpressionParser(text, variableCount);
        Expression expression = parser.disjunction();
        parser.skipWhitespace();
        if (parser.position < text.length()) {
            throw parser.error("Unexpected '" + text.charAt(parser.position) + "'");
        }
        return expression;
    }

    private Expression disjunction() throws InvalidFormatException {
        List<Expression> operands = new ArrayList<>();
        operands.add(conjunction());
        while (consume('|')) {
            operands.add(conjunction());
        }
        return Expression.disjunction(operands);
    }

    private Expression conjunction() throws InvalidFormatException {
        List<Expression> operands = new ArrayList<>();
        operands.add(negation());
        while (consume('&')) {
            operands.add(negation());
        }
        return Expression.conjunction(operands);
    }

    private Expression negation() throws InvalidFormatException {
        // Double negations cancel.
        boolean negated = false;
        while (consume('~')) {
            negated = !negated;
        }
        Expression atom = atom();
        return negated ? Expression.not(atom) : atom;
    }

    private Expression atom() throws InvalidFormatException {
        skipWhitespace();
        if (position >= text.length()) {
            throw error("Unexpected end of expression");
        }
        char c = text.charAt(position);
        if (c == '(') {
            if (depth == MAX_DEPTH) {
                throw error("Parentheses nested deeper than " + MAX_DEPTH);
            }
            position += 1;
            depth += 1;
            Expression expression = disjunction();
            if (!consume(')')) {
                throw error("Missing ')'");
            }
            depth -= 1;
            return expression;
        }
        if (c == '0' || c == '1') {
            position += 1;
            return Expression.constant(c == '1');
        }
        if (Character.isLetter(c)) {
            int start = position;
            while (position < text.length() && Character.isLetterOrDigit(text.charAt(position))) {
                position += 1;
            }
            String name = text.substring(start, position);
            int variable = StateSpace.variableIndex(name);
            if (variable < 0) {
                throw error("Invalid variable name " + name);
            }
            if (variable >= variableCount) {
                throw error("Expression references undefined variable " + name);
            }
            return Expression.variable(variable);
        }
        throw error("Unexpected '" + c + "'");
    }

    private boolean consume(char expected) {
        skipWhitespace();
        if (position < text.length() && text.charAt(position) == expected) {
            position += 1;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
            position += 1;
        }
    }

    private InvalidFormatException error(String message) {
        return new InvalidFormatException(
                String.format("%s at position %d of expression \"%s\"", message, position, text));
    }
}
