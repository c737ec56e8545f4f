package com.jcas.parser;

import com.jcas.expr.ExprNode;
import com.jcas.math.Rational;

import static com.jcas.parser.Operator.Associativity.LEFT;
import static com.jcas.parser.Operator.Associativity.RIGHT;
import static com.jcas.parser.Operator.Fixity.INFIX;
import static com.jcas.parser.Operator.Fixity.POSTFIX;
import static com.jcas.parser.Operator.Fixity.PREFIX;

/**
 * The default operator and bracket tables.
 */
public final class StandardOperators {

    private StandardOperators() {
    }

    public static void registerAll(ParserTables tables) {
        tables.registerBracket(Bracket.PARENTHESES);
        tables.registerBracket(Bracket.SQUARE);

        tables.registerOperator(new Operator("+", "add", 1, LEFT, INFIX,
                (s, o) -> s.arithmetic().add(o.get(0), o.get(1))));
        tables.registerOperator(new Operator("-", "subtract", 1, LEFT, INFIX,
                (s, o) -> s.arithmetic().subtract(o.get(0), o.get(1))));
        tables.registerOperator(new Operator("*", "multiply", 2, LEFT, INFIX,
                (s, o) -> s.arithmetic().multiply(o.get(0), o.get(1))));
        tables.registerOperator(new Operator("/", "divide", 2, LEFT, INFIX,
                (s, o) -> s.arithmetic().divide(o.get(0), o.get(1))));
        tables.registerOperator(new Operator("-", "negate", 3, RIGHT, PREFIX,
                (s, o) -> s.arithmetic().negate(o.get(0))));
        tables.registerOperator(new Operator("+", "positive", 3, RIGHT, PREFIX,
                (s, o) -> o.get(0)));
        tables.registerOperator(new Operator("^", "pow", 4, RIGHT, INFIX,
                (s, o) -> s.arithmetic().pow(o.get(0), o.get(1))));
        tables.registerOperator(new Operator("!", "factorial", 5, LEFT, POSTFIX,
                (s, o) -> s.call("factorial", o)));
        tables.registerOperator(new Operator("%", "percent", 5, LEFT, POSTFIX,
                (s, o) -> s.arithmetic().multiply(o.get(0), ExprNode.constant(Rational.valueOf(1, 100)))));
    }
}
