package com.jcas.parser;

import com.jcas.expr.ExprNode;
import com.jcas.session.Session;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MapIterable;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Text to canonical tree in four stages, each callable on its own.
 */
public final class ExpressionParser {
    private static final Logger logger = LoggerFactory.getLogger(ExpressionParser.class);

    private final ParserTables tables;
    private final PostfixReducer reducer;
    private final PostfixEvaluator evaluator;

    public ExpressionParser(Session session, ParserTables tables) {
        this.tables = tables;
        this.reducer = new PostfixReducer(tables);
        this.evaluator = new PostfixEvaluator(session);
    }

    public String preprocess(String text) {
        String result = text;
        for (Preprocessor preprocessor : tables.preprocessors()) {
            result = preprocessor.apply(result, tables);
        }
        return result;
    }

    public MutableList<Token> tokenize(String text) {
        return new Tokenizer(tables).tokenize(text);
    }

    public MutableList<Instruction> reduce(MutableList<Token> tokens) {
        return reducer.reduce(tokens);
    }

    public ExprNode evaluate(MutableList<Instruction> program, MapIterable<String, ExprNode> bindings) {
        return evaluator.evaluate(program, bindings);
    }

    public ExprNode parse(String text) {
        return parse(text, Maps.immutable.empty());
    }

    public ExprNode parse(String text, MapIterable<String, ExprNode> bindings) {
        String prepared = preprocess(text);
        logger.debug("Preprocessed '{}' to '{}'", text, prepared);
        return evaluate(reduce(tokenize(prepared)), bindings);
    }
}
