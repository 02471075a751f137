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

package me.golemcore.agents.tools;

import me.golemcore.agents.domain.component.ToolComponent;
import me.golemcore.agents.domain.model.ExecutionContext;
import me.golemcore.agents.domain.model.ToolExample;
import me.golemcore.agents.domain.model.ToolParameter;
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.model.ToolSchema;
import me.golemcore.agents.domain.tools.ToolExecutionException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Tool for evaluating arithmetic expressions.
 *
 * <p>
 * Grammar, lowest precedence first:
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/' | '%') unary)*
 * unary      := ('+' | '-') unary | power
 * power      := primary ('^' unary)?
 * primary    := number | '(' expression ')' | function '(' expression ')'
 * function   := sqrt | abs
 * </pre>
 *
 * {@code ^} is right-associative and binds tighter than unary minus, so
 * {@code -2^2} is {@code -4}. Whole results are returned as integers.
 *
 * <p>
 * Always enabled.
 */
@Component
public class CalculatorTool implements ToolComponent {

    static final String NAME = "calculator";
    static final String ERROR_CODE = "CALCULATION_ERROR";
    private static final String PARAM_EXPRESSION = "expression";

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .name(NAME)
            .description("Performs basic arithmetic calculations and mathematical operations")
            .parameter(ToolParameter.builder()
                    .name(PARAM_EXPRESSION)
                    .type(ToolParameter.Type.STRING)
                    .description("Mathematical expression to evaluate (supports +, -, *, /, %, ^, sqrt, abs)")
                    .required(true)
                    .pattern("^[0-9+\\-*/().\\s^%a-z,]+$")
                    .build())
            .example(new ToolExample("Simple arithmetic",
                    Map.of(PARAM_EXPRESSION, "2 + 3 * 4"),
                    Map.of("result", 14, PARAM_EXPRESSION, "2 + 3 * 4")))
            .example(new ToolExample("Square root calculation",
                    Map.of(PARAM_EXPRESSION, "sqrt(16)"),
                    Map.of("result", 4, PARAM_EXPRESSION, "sqrt(16)")))
            .build();

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolResult execute(ExecutionContext context, Map<String, Object> input) {
        String expression = (String) input.get(PARAM_EXPRESSION);
        double value;
        try {
            value = evaluate(expression);
        } catch (ArithmeticException | IllegalArgumentException e) {
            throw new ToolExecutionException(NAME, ERROR_CODE,
                    "Failed to evaluate expression: " + e.getMessage(), e);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("result", normalize(value));
        data.put(PARAM_EXPRESSION, expression);
        return ToolResult.success(data);
    }

    static double evaluate(String expression) {
        Parser parser = new Parser(expression);
        double value = parser.parseExpression();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw new IllegalArgumentException("unexpected '" + parser.peek() + "' at position " + parser.pos);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ArithmeticException("result is not a finite number");
        }
        return value;
    }

    private static Number normalize(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return (long) value;
        }
        return value;
    }

    private static final class Parser {

        private final String input;
        private int pos;

        Parser(String input) {
            this.input = input != null ? input : "";
        }

        double parseExpression() {
            double value = parseTerm();
            while (true) {
                skipWhitespace();
                if (consume('+')) {
                    value += parseTerm();
                } else if (consume('-')) {
                    value -= parseTerm();
                } else {
                    return value;
                }
            }
        }

        double parseTerm() {
            double value = parseUnary();
            while (true) {
                skipWhitespace();
                if (consume('*')) {
                    value *= parseUnary();
                } else if (consume('/')) {
                    double divisor = parseUnary();
                    if (divisor == 0) {
                        throw new ArithmeticException("division by zero");
                    }
                    value /= divisor;
                } else if (consume('%')) {
                    double divisor = parseUnary();
                    if (divisor == 0) {
                        throw new ArithmeticException("modulo by zero");
                    }
                    value %= divisor;
                } else {
                    return value;
                }
            }
        }

        double parseUnary() {
            skipWhitespace();
            if (consume('-')) {
                return -parseUnary();
            }
            if (consume('+')) {
                return parseUnary();
            }
            return parsePower();
        }

        double parsePower() {
            double base = parsePrimary();
            skipWhitespace();
            if (consume('^')) {
                // Exponent may carry its own sign: 2^-1
                return Math.pow(base, parseUnary());
            }
            return base;
        }

        double parsePrimary() {
            skipWhitespace();
            if (atEnd()) {
                throw new IllegalArgumentException("unexpected end of expression");
            }
            char c = peek();
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
                return parseFunction();
            }
            throw new IllegalArgumentException("unexpected '" + c + "' at position " + pos);
        }

        private double parseFunction() {
            int start = pos;
            while (!atEnd() && Character.isLetter(peek())) {
                pos++;
            }
            String name = input.substring(start, pos).toLowerCase(Locale.ROOT);
            skipWhitespace();
            expect('(');
            double argument = parseExpression();
            expect(')');
            return switch (name) {
            case "sqrt" -> {
                if (argument < 0) {
                    throw new ArithmeticException("square root of negative number");
                }
                yield Math.sqrt(argument);
            }
            case "abs" -> Math.abs(argument);
            default -> throw new IllegalArgumentException("unknown function: " + name);
            };
        }

        private double parseNumber() {
            int start = pos;
            while (!atEnd() && (Character.isDigit(peek()) || peek() == '.')) {
                pos++;
            }
            String number = input.substring(start, pos);
            try {
                return Double.parseDouble(number);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid number: " + number, e);
            }
        }

        private void expect(char expected) {
            skipWhitespace();
            if (!consume(expected)) {
                throw new IllegalArgumentException(atEnd()
                        ? "expected '" + expected + "' at end of expression"
                        : "expected '" + expected + "' at position " + pos);
            }
        }

        private boolean consume(char expected) {
            if (!atEnd() && input.charAt(pos) == expected) {
                pos++;
                return true;
            }
            return false;
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }

        boolean atEnd() {
            return pos >= input.length();
        }

        char peek() {
            return input.charAt(pos);
        }
    }
}
