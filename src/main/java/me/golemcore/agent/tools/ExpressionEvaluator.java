package me.golemcore.agent.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Recursive-descent evaluator for arithmetic expressions.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/' | '%') unary)*
 * unary      := ('-' | '+') unary | power
 * power      := primary ('^' unary)?
 * primary    := number | constant | function '(' args ')' | '(' expression ')'
 * </pre>
 *
 * Constants: {@code pi}, {@code e}. Functions: {@code sin cos tan sqrt log log10
 * exp abs} (one argument), {@code pow} (two), {@code min max} (one or more).
 * {@code ^} is right-associative and binds tighter than unary minus, so
 * {@code -2^2} is {@code -4}. Nothing outside this grammar is evaluated.
 */
public final class ExpressionEvaluator {

    private static final Map<String, Double> CONSTANTS = Map.of(
            "pi", Math.PI,
            "e", Math.E);

    private static final Map<String, DoubleUnaryOperator> UNARY_FUNCTIONS = Map.of(
            "sin", Math::sin,
            "cos", Math::cos,
            "tan", Math::tan,
            "sqrt", Math::sqrt,
            "log", Math::log,
            "log10", Math::log10,
            "exp", Math::exp,
            "abs", Math::abs);

    private final String input;
    private int pos;

    private ExpressionEvaluator(String input) {
        this.input = input;
    }

    /**
     * Evaluates the expression.
     *
     * @throws IllegalArgumentException
     *             on syntax errors, unknown names, wrong argument counts or
     *             division by zero
     */
    public static double evaluate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Expression is empty");
        }
        ExpressionEvaluator evaluator = new ExpressionEvaluator(expression);
        double value = evaluator.parseExpression();
        evaluator.skipWhitespace();
        if (evaluator.pos < evaluator.input.length()) {
            throw new IllegalArgumentException(
                    "Unexpected '" + evaluator.input.charAt(evaluator.pos) + "' at position " + evaluator.pos);
        }
        return value;
    }

    /**
     * Integral values print without a fraction ({@code 4}, not {@code 4.0}).
     */
    public static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private double parseExpression() {
        double value = parseTerm();
        while (true) {
            if (consume('+')) {
                value += parseTerm();
            } else if (consume('-')) {
                value -= parseTerm();
            } else {
                return value;
            }
        }
    }

    private double parseTerm() {
        double value = parseUnary();
        while (true) {
            if (consume('*')) {
                value *= parseUnary();
            } else if (consume('/')) {
                double divisor = parseUnary();
                if (divisor == 0) {
                    throw new IllegalArgumentException("Division by zero");
                }
                value /= divisor;
            } else if (consume('%')) {
                double divisor = parseUnary();
                if (divisor == 0) {
                    throw new IllegalArgumentException("Division by zero");
                }
                value %= divisor;
            } else {
                return value;
            }
        }
    }

    private double parseUnary() {
        if (consume('-')) {
            return -parseUnary();
        }
        if (consume('+')) {
            return parseUnary();
        }
        return parsePower();
    }

    private double parsePower() {
        double base = parsePrimary();
        if (consume('^')) {
            return Math.pow(base, parseUnary());
        }
        return base;
    }

    private double parsePrimary() {
        skipWhitespace();
        if (pos >= input.length()) {
            throw new IllegalArgumentException("Unexpected end of expression");
        }
        char c = input.charAt(pos);
        if (c == '(') {
            pos++;
            double value = parseExpression();
            expect(')');
            return value;
        }
        if (Character.isDigit(c) || c == '.') {
            return parseNumber();
        }
        if (Character.isLetter(c)) {
            return parseName();
        }
        throw new IllegalArgumentException("Unexpected '" + c + "' at position " + pos);
    }

    private double parseNumber() {
        int start = pos;
        while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
            pos++;
        }
        String token = input.substring(start, pos);
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number: " + token, e);
        }
    }

    private double parseName() {
        int start = pos;
        while (pos < input.length() && Character.isLetterOrDigit(input.charAt(pos))) {
            pos++;
        }
        String name = input.substring(start, pos).toLowerCase(Locale.ROOT);

        skipWhitespace();
        if (pos < input.length() && input.charAt(pos) == '(') {
            pos++;
            return applyFunction(name, parseArguments());
        }
        Double constant = CONSTANTS.get(name);
        if (constant == null) {
            throw new IllegalArgumentException("Unknown name: " + name);
        }
        return constant;
    }

    private List<Double> parseArguments() {
        List<Double> args = new ArrayList<>();
        if (consume(')')) {
            return args;
        }
        do {
            args.add(parseExpression());
        } while (consume(','));
        expect(')');
        return args;
    }

    private static double applyFunction(String name, List<Double> args) {
        DoubleUnaryOperator unary = UNARY_FUNCTIONS.get(name);
        if (unary != null) {
            requireArgs(name, args, 1);
            return unary.applyAsDouble(args.get(0));
        }
        return switch (name) {
        case "pow" -> {
            requireArgs(name, args, 2);
            yield Math.pow(args.get(0), args.get(1));
        }
        case "min" -> {
            requireAtLeastOne(name, args);
            yield args.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
        }
        case "max" -> {
            requireAtLeastOne(name, args);
            yield args.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
        }
        default -> throw new IllegalArgumentException("Unknown function: " + name);
        };
    }

    private static void requireArgs(String name, List<Double> args, int expected) {
        if (args.size() != expected) {
            throw new IllegalArgumentException(
                    name + "() takes " + expected + " argument(s), got " + args.size());
        }
    }

    private static void requireAtLeastOne(String name, List<Double> args) {
        if (args.isEmpty()) {
            throw new IllegalArgumentException(name + "() needs at least one argument");
        }
    }

    private boolean consume(char expected) {
        skipWhitespace();
        if (pos < input.length() && input.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char expected) {
        if (!consume(expected)) {
            throw new IllegalArgumentException("Expected '" + expected + "' at position " + pos);
        }
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }
}
