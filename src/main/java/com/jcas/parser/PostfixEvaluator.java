package com.jcas.parser;

import com.jcas.error.InvalidVariableNameException;
import com.jcas.error.OperatorException;
import com.jcas.error.ParseException;
import com.jcas.expr.ExprNode;
import com.jcas.math.Rational;
import com.jcas.session.Session;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MapIterable;
import org.eclipse.collections.impl.factory.Lists;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/**
 * Stack machine over a postfix program. Identifiers resolve against the caller's bindings,
 * then session variables, then session constants; anything else becomes a free variable.
 */
public final class PostfixEvaluator {
    private static final Pattern VARIABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Session session;

    public PostfixEvaluator(Session session) {
        this.session = session;
    }

    public ExprNode evaluate(MutableList<Instruction> program, MapIterable<String, ExprNode> bindings) {
        Deque<ExprNode> stack = new ArrayDeque<>();
        for (Instruction instruction : program) {
            session.deadline().check();
            if (instruction instanceof Instruction.PushNumber number) {
                stack.push(ExprNode.constant(parseNumber(number)));
            } else if (instruction instanceof Instruction.PushIdentifier identifier) {
                stack.push(resolve(identifier, bindings));
            } else if (instruction instanceof Instruction.ApplyOperator apply) {
                Operator operator = apply.operator();
                if (stack.size() < operator.arity()) {
                    throw new OperatorException("missing operand for '" + operator.symbol() + "'",
                            operator.symbol(), apply.position());
                }
                MutableList<ExprNode> operands = Lists.mutable.empty();
                for (int i = 0; i < operator.arity(); i++) {
                    operands.add(0, stack.pop());
                }
                session.peek(operator.name(), operands);
                stack.push(operator.action().apply(session, operands));
            } else if (instruction instanceof Instruction.CallFunction call) {
                MutableList<ExprNode> args = call.arguments().collect(a -> evaluate(a, bindings));
                stack.push(session.call(call.name(), args));
            } else if (instruction instanceof Instruction.BuildList list) {
                MutableList<ExprNode> elements = list.elements().collect(e -> evaluate(e, bindings));
                stack.push(ExprNode.function("vector", elements));
            } else {
                throw new IllegalStateException("Unknown instruction: " + instruction);
            }
        }
        if (stack.isEmpty()) {
            throw new ParseException("empty expression");
        }
        if (stack.size() > 1) {
            throw new OperatorException("missing operator between operands");
        }
        return stack.pop();
    }

    private static Rational parseNumber(Instruction.PushNumber number) {
        try {
            return Rational.parse(number.literal());
        } catch (NumberFormatException e) {
            throw new ParseException("malformed number '" + number.literal() + "'", number.literal(), number.position());
        }
    }

    private ExprNode resolve(Instruction.PushIdentifier identifier, MapIterable<String, ExprNode> bindings) {
        String name = identifier.name();
        ExprNode bound = bindings.get(name);
        if (bound != null) {
            return bound.copy();
        }
        ExprNode value = session.variable(name);
        if (value != null) {
            return value.copy();
        }
        ExprNode constant = session.constant(name);
        if (constant != null) {
            return constant;
        }
        if (!VARIABLE_NAME.matcher(name).matches() || session.functions().contains(name)) {
            throw new InvalidVariableNameException("'" + name + "' cannot be used as a variable name");
        }
        return ExprNode.variable(name);
    }
}
