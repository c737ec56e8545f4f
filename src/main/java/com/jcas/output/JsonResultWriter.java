package com.jcas.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.jcas.expr.ExprNode;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes one evaluation as a JSON object:
 *
 * <pre>{"input": "solve(x^2-4)", "result": ["2", "-2"], "decimal": ["2", "-2"]}</pre>
 *
 * Vector results are written as arrays, everything else as canonical text. The decimal field is
 * present only when a decimal formatter is given.
 */
public class JsonResultWriter {
    private final JsonFactory factory = new JsonFactory();
    private final boolean prettyPrint;

    public JsonResultWriter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public void write(Writer out, String input, ExprNode result, ExprFormatter decimal) throws IOException {
        try (JsonGenerator generator = factory.createGenerator(out)) {
            generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
            if (prettyPrint) {
                generator.useDefaultPrettyPrinter();
            }
            generator.writeStartObject();
            generator.writeStringField("input", input);
            generator.writeFieldName("result");
            writeNode(generator, result, ExprFormatter.CANONICAL);
            if (decimal != null) {
                generator.writeFieldName("decimal");
                writeNode(generator, result, decimal);
            }
            generator.writeEndObject();
        }
        out.write(System.lineSeparator());
        out.flush();
    }

    private void writeNode(JsonGenerator generator, ExprNode node, ExprFormatter formatter) throws IOException {
        if (node.isFunction("vector")) {
            generator.writeStartArray();
            for (ExprNode element : node.args()) {
                writeNode(generator, element, formatter);
            }
            generator.writeEndArray();
        } else {
            generator.writeString(formatter.format(node));
        }
    }
}
