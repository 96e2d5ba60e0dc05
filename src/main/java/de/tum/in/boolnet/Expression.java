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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.BitSet;
import java.util.List;

/**
 * Propositional formula over the variables {@code x1, ..., xn} built from constants, negation,
 * conjunction and disjunction. The textual form uses {@code ~}, {@code &}, {@code |} and
 * parentheses and is accepted by {@link ExpressionParser}.
 */
public abstract class Expression {
    private static final Expression TRUE = new Constant(true);
    private static final Expression FALSE = new Constant(false);

    Expression() {}

    public static Expression constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Expression variable(int variable) {
        checkArgument(variable >= 0, "Negative variable %s", variable);
        return new Variable(variable);
    }

    public static Expression literal(int variable, boolean positive) {
        return positive ? variable(variable) : not(variable(variable));
    }

    public static Expression not(Expression expression) {
        return new Not(expression);
    }

    public static Expression and(Expression left, Expression right) {
        return junction(Operator.AND, ImmutableList.of(left, right));
    }

    public static Expression or(Expression left, Expression right) {
        return junction(Operator.OR, ImmutableList.of(left, right));
    }

    /** Conjunction of all operands, {@code true} if the list is empty. */
    public static Expression conjunction(List<Expression> operands) {
        return operands.isEmpty() ? TRUE : junction(Operator.AND, operands);
    }

    /** Disjunction of all operands, {@code false} if the list is empty. */
    public static Expression disjunction(List<Expression> operands) {
        return operands.isEmpty() ? FALSE : junction(Operator.OR, operands);
    }

    private static Expression junction(Operator operator, List<Expression> operands) {
        if (operands.size() == 1) {
            return operands.get(0);
        }
        ImmutableList.Builder<Expression> flattened = ImmutableList.builder();
        for (Expression operand : operands) {
            if (operand instanceof Junction && ((Junction) operand).operator == operator) {
                flattened.addAll(((Junction) operand).operands);
            } else {
                flattened.add(operand);
            }
        }
        return new Junction(operator, flattened.build());
    }

    public abstract boolean evaluate(State state);

    /** The variables occurring in this expression. */
    public BitSet variables() {
        BitSet variables = new BitSet();
        gatherVariables(variables);
        return variables;
    }

    abstract void gatherVariables(BitSet variables);

    /** Binding strength used to decide on parentheses when printing. */
    abstract int precedence();

    static String wrap(Expression child, int parentPrecedence) {
        return child.precedence() <= parentPrecedence ? "(" + child + ")" : child.toString();
    }

    enum Operator {
        OR(1, " | "),
        AND(2, " & ");

        final int precedence;
        final String symbol;

        Operator(int precedence, String symbol) {
            this.precedence = precedence;
            this.symbol = symbol;
        }
    }

    static final class Constant extends Expression {
        private final boolean value;

        Constant(boolean value) {
            this.value = value;
        }

        @Override
        public boolean evaluate(State state) {
            return value;
        }

        @Override
        void gatherVariables(BitSet variables) {
            // No variables in this leaf
        }

        @Override
        int precedence() {
            return 4;
        }

        @Override
        public boolean equals(Object object) {
            return this == object || (object instanceof Constant && ((Constant) object).value == value);
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return value ? "1" : "0";
        }
    }

    static final class Variable extends Expression {
        private final int variable;

        Variable(int variable) {
            this.variable = variable;
        }

        int variable() {
            return variable;
        }

        @Override
        public boolean evaluate(State state) {
            return state.get(variable);
        }

        @Override
        void gatherVariables(BitSet variables) {
            variables.set(variable);
        }

        @Override
        int precedence() {
            return 4;
        }

        @Override
        public boolean equals(Object object) {
            return this == object || (object instanceof Variable && ((Variable) object).variable == variable);
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(variable);
        }

        @Override
        public String toString() {
            return StateSpace.variableName(variable);
        }
    }

    static final class Not extends Expression {
        private final Expression child;

        Not(Expression child) {
            this.child = child;
        }

        Expression child() {
            return child;
        }

        @Override
        public boolean evaluate(State state) {
            return !child.evaluate(state);
        }

        @Override
        void gatherVariables(BitSet variables) {
            child.gatherVariables(variables);
        }

        @Override
        int precedence() {
            return 3;
        }

        @Override
        public boolean equals(Object object) {
            return this == object || (object instanceof Not && ((Not) object).child.equals(child));
        }

        @Override
        public int hashCode() {
            return 17 * child.hashCode() + 1;
        }

        @Override
        public String toString() {
            return "~" + wrap(child, precedence() - 1);
        }
    }

    /** A conjunction or disjunction of at least two operands, none of them of the same operator. */
    static final class Junction extends Expression {
        private final Operator operator;
        private final ImmutableList<Expression> operands;

        Junction(Operator operator, ImmutableList<Expression> operands) {
            this.operator = operator;
            this.operands = operands;
        }

        Operator operator() {
            return operator;
        }

        ImmutableList<Expression> operands() {
            return operands;
        }

        @Override
        public boolean evaluate(State state) {
            boolean shortCircuit = operator == Operator.OR;
            for (Expression operand : operands) {
                if (operand.evaluate(state) == shortCircuit) {
                    return shortCircuit;
                }
            }
            return !shortCircuit;
        }

        @Override
        void gatherVariables(BitSet variables) {
            for (Expression operand : operands) {
                operand.gatherVariables(variables);
            }
        }

        @Override
        int precedence() {
            return operator.precedence;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Junction)) {
                return false;
            }
            Junction that = (Junction) object;
            return operator == that.operator && operands.equals(that.operands);
        }

        @Override
        public int hashCode() {
            return 31 * operator.hashCode() + operands.hashCode();
        }

        @Override
        public String toString() {
            // Conjunctions nested in a disjunction are always parenthesised, as in (x1 & ~x2) | x3
            StringBuilder builder = new StringBuilder();
            for (Expression operand : operands) {
                if (builder.length() > 0) {
                    builder.append(operator.symbol);
                }
                if (operator == Operator.OR && operand instanceof Junction) {
                    builder.append('(').append(operand).append(')');
                } else {
                    builder.append(wrap(operand, precedence()));
                }
            }
            return builder.toString();
        }
    }
}
