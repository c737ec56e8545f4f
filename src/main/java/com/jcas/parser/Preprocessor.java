package com.jcas.parser;

/**
 * A text rewrite applied before tokenizing. Preprocessors run in registration order.
 */
@FunctionalInterface
public interface Preprocessor {
    String apply(String text, ParserTables tables);
}
