package com.jcas.output;

import com.jcas.session.Session;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

public class JsonResultWriterTest {

    private final Session session = new Session();

    @Test
    public void testScalarResult() throws IOException {
        StringWriter out = new StringWriter();
        new JsonResultWriter(false).write(out, "diff(x^3, x)", session.parse("diff(x^3, x)"), null);

        assertEquals("{\"input\":\"diff(x^3, x)\",\"result\":\"3*x^2\"}", out.toString().trim());
    }

    @Test
    public void testVectorResultWithDecimals() throws IOException {
        StringWriter out = new StringWriter();
        new JsonResultWriter(false).write(out, "v", session.parse("[1/2, 2]"), ExprFormatter.decimal(5));

        assertEquals("{\"input\":\"v\",\"result\":[\"1/2\",\"2\"],\"decimal\":[\"0.5\",\"2\"]}", out.toString().trim());
    }

    @Test
    public void testPrettyPrint() throws IOException {
        StringWriter out = new StringWriter();
        new JsonResultWriter(true).write(out, "x", session.parse("x"), null);

        assertTrue(out.toString().contains("\n"));
        assertTrue(out.toString().contains("\"result\" : \"x\""), out.toString());
    }
}
