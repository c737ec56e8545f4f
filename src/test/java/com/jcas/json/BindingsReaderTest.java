package com.jcas.json;

import com.jcas.expr.ExprNode;
import com.jcas.session.Session;
import org.eclipse.collections.api.map.MutableMap;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import com.jcas.error.OutOfRangeException;
import static org.junit.jupiter.api.Assertions.*;

public class BindingsReaderTest {

    private final Session session = new Session();
    private final BindingsReader reader = new BindingsReader(session);

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testReadValues() throws IOException {
        MutableMap<String, ExprNode> bindings = reader.read(json("{\"x\": 2, \"y\": 0.25, \"z\": \"1/3\"}"));

        assertEquals(3, bindings.size());
        assertEquals(ExprNode.constant(2), bindings.get("x"));
        assertEquals(session.parse("1/4"), bindings.get("y"));
        assertEquals(session.parse("1/3"), bindings.get("z"));
    }

    @Test
    public void testReadArrayAsVector() throws IOException {
        MutableMap<String, ExprNode> bindings = reader.read(json("{\"r\": [1, \"pi\", [2]]}"));

        ExprNode r = bindings.get("r");
        assertTrue(r.isFunction("vector"));
        assertEquals(3, r.args().size());
        assertEquals(session.parse("pi"), r.arg(1));
        assertTrue(r.arg(2).isFunction("vector"));
    }

    @Test
    public void testBindingsFeedEvaluation() throws IOException {
        MutableMap<String, ExprNode> bindings = reader.read(json("{\"x\": 3}"));
        assertEquals(ExprNode.constant(10), session.evaluate("x^2+1", bindings));
    }

    @Test
    public void testEmptyObject() throws IOException {
        assertTrue(reader.read(json("{}")).isEmpty());
    }

    @Test
    public void testRootMustBeObject() {
        assertThrows(IOException.class, () -> reader.read(json("[1, 2]")));
    }

    @Test
    public void testUnsupportedValue() {
        IOException e = assertThrows(IOException.class, () -> reader.read(json("{\"flag\": true}")));
        assertTrue(e.getMessage().contains("VALUE_TRUE"), e.getMessage());
    }

    @Test
    public void testOversizedNumberIsRejected() {
        assertThrows(OutOfRangeException.class, () -> reader.read(json("{\"big\": 1e20000000}")));
    }
}
