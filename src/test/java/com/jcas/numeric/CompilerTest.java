package com.jcas.numeric;

import com.jcas.error.DimensionException;
import com.jcas.error.DivisionByZeroException;
import com.jcas.error.OperatorException;
import com.jcas.error.UndefinedException;
import com.jcas.session.Session;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerTest {

    private final Session session = new Session();

    @ParameterizedTest
    @CsvSource({
        "'x^2+sin(y)', 2, 0, 4",
        "'x*y+1', 3, 4, 13",
        "'e^x', 0, 5, 1",
        "'sqrt(x)+y/2', 9, 1, 3.5",
        "'cos(pi*x)', 1, 0, -1"
    })
    public void testEvaluate(String expression, double x, double y, double expected) {
        CompiledFunction f = Compiler.compile(session.parse(expression), "x", "y");
        assertEquals(expected, f.apply(x, y), 1e-12);
    }

    @Test
    public void testConstantExpression() {
        assertEquals(Math.PI / 2, Compiler.compile(session.parse("pi/2")).apply(), 1e-15);
    }

    @Test
    public void testFreeVariable() {
        assertThrows(UndefinedException.class, () -> Compiler.compile(session.parse("x+y"), "x"));
    }

    @Test
    public void testWrongArity() {
        CompiledFunction f = Compiler.compile(session.parse("x+y"), "x", "y");
        assertThrows(DimensionException.class, () -> f.apply(1.0));
    }

    @Test
    public void testUncompilableFunction() {
        assertThrows(OperatorException.class, () -> Compiler.compile(session.parse("integrate(e^(x^2), x)"), "x"));
    }

    @Test
    public void testPole() {
        CompiledFunction f = Compiler.compile(session.parse("1/x"), "x");
        assertThrows(DivisionByZeroException.class, () -> f.apply(0.0));
    }
}
