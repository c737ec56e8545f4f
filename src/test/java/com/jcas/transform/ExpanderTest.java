package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.session.Session;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class ExpanderTest {

    private final Session session = new Session();

    @ParameterizedTest
    @CsvSource({
        "'(x+1)^2', 'x^2+2*x+1'",
        "'(a+b)*(a-b)', 'a^2-b^2'",
        "'2*(x+1)', '2*x+2'",
        "'x*(x+y)', 'x^2+x*y'",
        "'(x+1)^3', 'x^3+3*x^2+3*x+1'",
        "'1/(x+1)^2', '1/(x^2+2*x+1)'",
        "'sin((x+1)^2)', 'sin(x^2+2*x+1)'"
    })
    public void testExpand(String input, String expected) {
        assertEquals(session.parse(expected), session.expand(session.parse(input)));
    }

    @Test
    public void testCanonicalText() {
        assertEquals("x^2+2*x+1", session.format(session.expand(session.parse("(x+1)^2"))));
    }

    @Test
    public void testInputIsNotModified() {
        ExprNode f = session.parse("(x+1)^2");
        session.expand(f);
        assertEquals(session.parse("(x+1)^2"), f);
    }
}
