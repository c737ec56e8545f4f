package com.jcas.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.jcas.expr.ExprNode;
import com.jcas.math.Rational;
import com.jcas.session.Session;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads variable bindings from a JSON object. Numbers become exact constants, strings are
 * parsed as expressions in the given session, arrays become vectors.
 *
 * <pre>{"x": 2, "y": "1/3", "r": [1, "pi"]}</pre>
 */
public class BindingsReader {
    private final JsonFactory factory = new JsonFactory();
    private final Session session;

    public BindingsReader(Session session) {
        this.session = session;
    }

    public MutableMap<String, ExprNode> read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token != JsonToken.START_OBJECT) {
                throw new IOException("Bindings must be a JSON object but got " + token);
            }
            MutableMap<String, ExprNode> bindings = Maps.mutable.empty();
            while (parser.nextToken() != JsonToken.END_OBJECT) {
                String name = parser.currentName();
                bindings.put(name, readValue(parser, parser.nextToken()));
            }
            return bindings;
        }
    }

    private ExprNode readValue(JsonParser parser, JsonToken token) throws IOException {
        return switch (token) {
            case VALUE_NUMBER_INT -> ExprNode.constant(Rational.valueOf(parser.getBigIntegerValue()));
            case VALUE_NUMBER_FLOAT -> ExprNode.constant(Rational.valueOf(parser.getDecimalValue()));
            case VALUE_STRING -> session.parse(parser.getText());
            case START_ARRAY -> readArray(parser);
            default -> throw new IOException("Unsupported binding value at "
                    + parser.currentLocation().getLineNr() + ":" + parser.currentLocation().getColumnNr() + ": " + token);
        };
    }

    private ExprNode readArray(JsonParser parser) throws IOException {
        var elements = Lists.mutable.<ExprNode>empty();
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(readValue(parser, token));
        }
        return ExprNode.function("vector", elements);
    }
}
