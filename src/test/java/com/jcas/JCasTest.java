package com.jcas;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class JCasTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new JCas());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    public void testEvaluate() {
        assertEquals(0, run("diff(x^3, x)"));
        assertEquals("3*x^2", out.toString().trim());
    }

    @Test
    public void testSolve() {
        assertEquals(0, run("solve(x^2-4)"));
        assertEquals("[2,-2]", out.toString().trim());
    }

    @Test
    public void testVariableBindings() {
        assertEquals(0, run("-v", "x=2", "-v", "y=1/3", "x^2+y"));
        assertEquals("13/3", out.toString().trim());
    }

    @Test
    public void testBindingsFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("bindings.json");
        Files.write(file, "{\"x\": 3, \"y\": 1}".getBytes(StandardCharsets.UTF_8));

        assertEquals(0, run("-b", file.toString(), "-v", "y=5", "x*y"));
        assertEquals("15", out.toString().trim());
    }

    @Test
    public void testDecimalOutput() {
        assertEquals(0, run("-d", "-p", "4", "1/3"));
        assertEquals("0.3333", out.toString().trim());
    }

    @Test
    public void testNumericMode() {
        assertEquals(0, run("-n", "sin(pi/2)"));
        assertEquals("1", out.toString().trim());
    }

    @Test
    public void testJsonOutput() {
        assertEquals(0, run("-j", "factor(x^2-4)"));
        assertEquals("{\"input\":\"factor(x^2-4)\",\"result\":\"(x+2)*(x-2)\"}", out.toString().trim());
    }

    // ========== Errors ==========

    @Test
    public void testParseError() {
        assertEquals(1, run("(x+1"));
        assertTrue(err.toString().startsWith("Error:"), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    public void testDivisionByZero() {
        assertEquals(1, run("1/0"));
        assertTrue(err.toString().contains("Error:"));
    }

    @Test
    public void testMissingExpression() {
        assertNotEquals(0, run());
    }
}
