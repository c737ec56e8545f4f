package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.session.Session;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class SimplifierTest {

    private final Session session = new Session();

    @ParameterizedTest
    @CsvSource({
        "'(x^2-1)/(x-1)', 'x+1'",
        "'(x+1)^2-x^2', '2*x+1'",
        "'(x^3-x)/(x^2+x)', 'x-1'",
        "'x+x', '2*x'",
        "'sin((x^2-1)/(x+1))', 'sin(x-1)'",
        "'sin(x)^2+cos(x)^2', '1'",
        "'2*sin(x)^2+2*cos(x)^2+1', '3'",
        "'y*sin(2*x)^2+y*cos(2*x)^2', 'y'"
    })
    public void testSimplify(String input, String expected) {
        assertEquals(session.parse(expected), session.simplify(session.parse(input)));
    }

    @Test
    public void testAlreadySimpleIsAFixedPoint() {
        ExprNode f = session.parse("x^2+y");
        assertEquals(f, session.simplify(f));
    }

    @Test
    public void testParserEntryPoint() {
        assertEquals("x+1", session.format(session.parse("simplify((x^2-1)/(x-1))")));
    }

    @Test
    public void testUnpairedSquareIsKept() {
        ExprNode f = session.parse("sin(x)^2+cos(y)^2");
        assertEquals(f, session.simplify(f));
    }
}
