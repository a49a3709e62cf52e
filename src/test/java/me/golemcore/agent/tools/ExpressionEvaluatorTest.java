package me.golemcore.agent.tools;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionEvaluatorTest {

    private static final double DELTA = 1e-9;

    @Test
    void evaluate_respectsPrecedence() {
        assertEquals(14, ExpressionEvaluator.evaluate("2 + 3 * 4"), DELTA);
        assertEquals(20, ExpressionEvaluator.evaluate("(2 + 3) * 4"), DELTA);
        assertEquals(1, ExpressionEvaluator.evaluate("7 % 3"), DELTA);
    }

    @Test
    void evaluate_powerIsRightAssociativeAndBindsTighterThanMinus() {
        assertEquals(512, ExpressionEvaluator.evaluate("2^3^2"), DELTA);
        assertEquals(-4, ExpressionEvaluator.evaluate("-2^2"), DELTA);
        assertEquals(0.25, ExpressionEvaluator.evaluate("2^-2"), DELTA);
    }

    @Test
    void evaluate_functionsAndConstants() {
        assertEquals(12 + Math.PI, ExpressionEvaluator.evaluate("sqrt(144) + pi"), DELTA);
        assertEquals(0, ExpressionEvaluator.evaluate("sin(0)"), DELTA);
        assertEquals(1, ExpressionEvaluator.evaluate("log(e)"), DELTA);
        assertEquals(1024, ExpressionEvaluator.evaluate("pow(2, 10)"), DELTA);
        assertEquals(5, ExpressionEvaluator.evaluate("max(1, 5, 3)"), DELTA);
        assertEquals(-2, ExpressionEvaluator.evaluate("min(4, -2)"), DELTA);
        assertEquals(3, ExpressionEvaluator.evaluate("ABS(-3)"), DELTA);
    }

    @Test
    void evaluate_rejectsDivisionByZero() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> ExpressionEvaluator.evaluate("10 / (5 - 5)"));
        assertEquals("Division by zero", ex.getMessage());
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("1 % 0"));
    }

    @Test
    void evaluate_rejectsAnythingOutsideTheGrammar() {
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("import os"));
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("__class__"));
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("2 +"));
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("(1 + 2"));
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("1 2"));
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("foo(1)"));
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("pow(2)"));
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("1..2"));
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate(" "));
    }

    @Test
    void format_printsIntegralValuesWithoutFraction() {
        assertEquals("4", ExpressionEvaluator.format(4.0));
        assertEquals("-4", ExpressionEvaluator.format(-4.0));
        assertEquals("0.5", ExpressionEvaluator.format(0.5));
        assertEquals("1.0E20", ExpressionEvaluator.format(1e20));
    }
}
