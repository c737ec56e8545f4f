package com.jcas.output;

import com.jcas.session.Session;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class ExprFormatterTest {

    private final Session session = new Session();

    @ParameterizedTest
    @ValueSource(strings = {
        "3*x^2", "x^2+2*x+1", "(x+2)*(x-2)", "2*(x+1)", "sin(x)^2", "e^(2*x)",
        "1/(x+1)", "-x/2", "x^(1/2)", "t^2/2", "[1,x,5]"
    })
    public void testCanonicalTextReparses(String text) {
        String formatted = session.format(session.parse(text));
        assertEquals(session.parse(text), session.parse(formatted), formatted);
    }

    @Test
    public void testDecimalPrecision() {
        assertEquals("0.333", ExprFormatter.decimal(3).format(session.parse("1/3")));
        assertEquals("0.5*x", ExprFormatter.decimal(3).format(session.parse("x/2")));
    }

    @Test
    public void testKeys() {
        assertEquals(ExprFormatter.additiveKey(session.parse("2*x")), ExprFormatter.additiveKey(session.parse("5*x")));
        assertEquals(ExprFormatter.additiveKey(session.parse("2")), ExprFormatter.additiveKey(session.parse("7")));
        assertEquals(ExprFormatter.multiplicativeKey(session.parse("x^2")),
                ExprFormatter.multiplicativeKey(session.parse("x^3")));
    }
}
