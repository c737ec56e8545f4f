package com.jcas.parser;

import com.jcas.error.OperatorException;
import com.jcas.error.ParseException;
import com.jcas.error.UnexpectedTokenException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Shunting-yard reduction of a token tree into a postfix program. Groups are reduced
 * recursively, so a call instruction carries one finished program per argument.
 */
public final class PostfixReducer {
    private final ParserTables tables;

    public PostfixReducer(ParserTables tables) {
        this.tables = tables;
    }

    public MutableList<Instruction> reduce(MutableList<Token> tokens) {
        MutableList<Instruction> output = Lists.mutable.empty();
        Deque<Token> operatorTokens = new ArrayDeque<>();
        Deque<Operator> operators = new ArrayDeque<>();
        boolean expectOperand = true;
        Token last = null;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            switch (token.type()) {
                case NUMBER -> {
                    requireOperandSlot(expectOperand, token);
                    output.add(new Instruction.PushNumber(token.text(), token.position()));
                    expectOperand = false;
                }
                case IDENTIFIER -> {
                    requireOperandSlot(expectOperand, token);
                    Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
                    if (next != null && next.isGroup(Bracket.Kind.GROUP) && tables.isFunction(token.text())) {
                        output.add(new Instruction.CallFunction(token.text(), reduceArguments(next, true),
                                token.position()));
                        i++;
                    } else {
                        output.add(new Instruction.PushIdentifier(token.text(), token.position()));
                    }
                    expectOperand = false;
                }
                case GROUP -> {
                    requireOperandSlot(expectOperand, token);
                    if (token.bracket().kind() == Bracket.Kind.LIST) {
                        output.add(new Instruction.BuildList(reduceArguments(token, true), token.position()));
                    } else {
                        MutableList<MutableList<Instruction>> parts = reduceArguments(token, false);
                        if (parts.size() != 1) {
                            throw new UnexpectedTokenException("unexpected ','", ",", token.position());
                        }
                        output.addAll(parts.getFirst());
                    }
                    expectOperand = false;
                }
                case COMMA -> throw new UnexpectedTokenException("unexpected ','", ",", token.position());
                case OPERATOR -> {
                    if (expectOperand) {
                        Operator unary = tables.prefix(token.text());
                        if (unary == null) {
                            throw new OperatorException("missing operand before '" + token.text() + "'",
                                    token.text(), token.position());
                        }
                        operators.push(unary);
                        operatorTokens.push(token);
                    } else if (tables.postfix(token.text()) != null) {
                        Operator suffix = tables.postfix(token.text());
                        popWhile(operators, operatorTokens, output, suffix);
                        output.add(new Instruction.ApplyOperator(suffix, token.position()));
                    } else {
                        Operator binary = tables.infix(token.text());
                        if (binary == null) {
                            throw new OperatorException("'" + token.text() + "' is not a binary operator",
                                    token.text(), token.position());
                        }
                        popWhile(operators, operatorTokens, output, binary);
                        operators.push(binary);
                        operatorTokens.push(token);
                        expectOperand = true;
                    }
                }
                default -> throw new IllegalStateException("Unknown token type: " + token.type());
            }
            last = token;
        }

        if (expectOperand && last != null) {
            throw new OperatorException("missing operand after '" + last.text() + "'", last.text(), last.position());
        }
        while (!operators.isEmpty()) {
            output.add(new Instruction.ApplyOperator(operators.pop(), operatorTokens.pop().position()));
        }
        return output;
    }

    private static void requireOperandSlot(boolean expectOperand, Token token) {
        if (!expectOperand) {
            throw new UnexpectedTokenException("unexpected '" + token.text() + "'", token.text(), token.position());
        }
    }

    private static void popWhile(Deque<Operator> operators, Deque<Token> operatorTokens,
                                 MutableList<Instruction> output, Operator incoming) {
        while (!operators.isEmpty()) {
            Operator top = operators.peek();
            boolean higher = top.precedence() > incoming.precedence()
                    || (top.precedence() == incoming.precedence()
                    && incoming.associativity() == Operator.Associativity.LEFT
                    && top.fixity() != Operator.Fixity.PREFIX);
            if (!higher) {
                return;
            }
            output.add(new Instruction.ApplyOperator(operators.pop(), operatorTokens.pop().position()));
        }
    }

    /**
     * Splits a group at its top-level commas and reduces each part. An empty group yields no
     * parts when {@code allowEmpty} is set.
     */
    private MutableList<MutableList<Instruction>> reduceArguments(Token group, boolean allowEmpty) {
        MutableList<MutableList<Instruction>> parts = Lists.mutable.empty();
        if (group.children().isEmpty()) {
            if (!allowEmpty) {
                throw new ParseException("empty group", group.text(), group.position());
            }
            return parts;
        }
        MutableList<Token> current = Lists.mutable.empty();
        for (Token child : group.children()) {
            if (child.type() == Token.Type.COMMA) {
                parts.add(reducePart(current, child));
                current = Lists.mutable.empty();
            } else {
                current.add(child);
            }
        }
        parts.add(reducePart(current, group));
        return parts;
    }

    private MutableList<Instruction> reducePart(MutableList<Token> part, Token anchor) {
        if (part.isEmpty()) {
            throw new ParseException("empty argument", anchor.text(), anchor.position());
        }
        return reduce(part);
    }
}
