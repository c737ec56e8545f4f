package com.jcas.session;

import com.jcas.error.InvalidVariableNameException;
import com.jcas.error.OperatorException;
import com.jcas.expr.Arithmetic;
import com.jcas.expr.ExprNode;
import com.jcas.expr.Substitution;
import com.jcas.math.Rational;
import com.jcas.numeric.CompiledFunction;
import com.jcas.numeric.Compiler;
import com.jcas.output.ExprFormatter;
import com.jcas.parser.AliasSubstitution;
import com.jcas.parser.BuiltinFunctions;
import com.jcas.parser.ExpressionParser;
import com.jcas.parser.FunctionBody;
import com.jcas.parser.FunctionDefinition;
import com.jcas.parser.FunctionRegistry;
import com.jcas.parser.ImpliedMultiplication;
import com.jcas.parser.Operator;
import com.jcas.parser.ParserTables;
import com.jcas.parser.Peeker;
import com.jcas.parser.Preprocessor;
import com.jcas.parser.StandardOperators;
import com.jcas.transform.Algebra;
import com.jcas.transform.Decomposition;
import com.jcas.transform.Derivative;
import com.jcas.transform.Expander;
import com.jcas.transform.Factorizer;
import com.jcas.transform.Integrator;
import com.jcas.transform.LaplaceTransform;
import com.jcas.transform.Limit;
import com.jcas.transform.PartialFractions;
import com.jcas.transform.Simplifier;
import com.jcas.transform.Solver;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MapIterable;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Everything one caller's expressions share: settings, the deadline guard, the operator and
 * function tables, known variables and constants. Registrations stay visible to every later
 * call on the same session. Not thread-safe; use one session per thread.
 *
 * <p>Transform entry points run under the deadline guard with the session's timeout. Nested
 * calls (a transform invoked while parsing, a transform that uses another) share the outermost
 * budget.
 */
public final class Session {
    private static final Logger logger = LoggerFactory.getLogger(Session.class);
    private static final Pattern VARIABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Settings settings;
    private final DeadlineGuard deadline = new DeadlineGuard();
    private final Arithmetic arithmetic;
    private final Substitution substitution;
    private final FunctionRegistry functions = new FunctionRegistry();
    private final ParserTables tables = new ParserTables(functions);
    private final ExpressionParser parser;

    private final MutableMap<String, MutableList<Peeker>> peekers = Maps.mutable.empty();
    private final MutableMap<String, ExprNode> variables = Maps.mutable.empty();
    private final MutableMap<String, ExprNode> constants = Maps.mutable.empty();

    private final Expander expander;
    private final Decomposition decomposition;
    private final Derivative derivative;
    private final Integrator integrator;
    private final LaplaceTransform laplace;
    private final Factorizer factorizer;
    private final PartialFractions partialFractions;
    private final Simplifier simplifier;
    private final Solver solver;
    private final Limit limits;
    private final Algebra algebra;

    public Session() {
        this(Settings.defaults());
    }

    public Session(Settings settings) {
        this.settings = settings;
        this.arithmetic = new Arithmetic(settings, deadline);
        this.substitution = new Substitution(arithmetic, this::applyFunction);
        this.parser = new ExpressionParser(this, tables);
        this.expander = new Expander(this);
        this.decomposition = new Decomposition(this);
        this.derivative = new Derivative(this);
        this.integrator = new Integrator(this);
        this.laplace = new LaplaceTransform(this);
        this.factorizer = new Factorizer(this);
        this.partialFractions = new PartialFractions(this);
        this.simplifier = new Simplifier(this);
        this.solver = new Solver(this);
        this.limits = new Limit(this);
        this.algebra = new Algebra(this);
        installDefaults();
    }

    private void installDefaults() {
        StandardOperators.registerAll(tables);
        tables.addPreprocessor(new AliasSubstitution());
        tables.addPreprocessor(new ImpliedMultiplication());
        tables.alias("ln", "log");
        BuiltinFunctions.registerAll(functions);
        constants.put("pi", ExprNode.variable("pi"));
        constants.put("e", ExprNode.variable("e"));
        constants.put(Limit.INFINITY, ExprNode.variable(Limit.INFINITY));
    }

    // ========== accessors ==========

    public Settings settings() {
        return settings;
    }

    public DeadlineGuard deadline() {
        return deadline;
    }

    public Arithmetic arithmetic() {
        return arithmetic;
    }

    public FunctionRegistry functions() {
        return functions;
    }

    public ParserTables tables() {
        return tables;
    }

    public ExpressionParser parser() {
        return parser;
    }

    public Expander expander() {
        return expander;
    }

    public Decomposition decomposition() {
        return decomposition;
    }

    public Derivative derivative() {
        return derivative;
    }

    public Integrator integrator() {
        return integrator;
    }

    public PartialFractions partialFractions() {
        return partialFractions;
    }

    public Limit limits() {
        return limits;
    }

    public Algebra algebra() {
        return algebra;
    }

    // ========== parsing and evaluation ==========

    public ExprNode parse(String text) {
        return evaluate(text, Maps.immutable.empty());
    }

    /**
     * Parses {@code text} with {@code bindings} taking precedence over session variables.
     */
    public ExprNode evaluate(String text, MapIterable<String, ExprNode> bindings) {
        return guarded(() -> parser.parse(text, bindings));
    }

    /**
     * Evaluates in numeric mode. A result free of variables is reduced to a single constant.
     */
    public ExprNode evaluateNumeric(String text, MapIterable<String, ExprNode> bindings) {
        return settings.override(s -> s.setNumeric(true), () -> {
            ExprNode result = evaluate(text, bindings);
            if (result.isConstant() || result.variables().notEmpty() || result.isFunction("vector")) {
                return result;
            }
            double value;
            try {
                value = Compiler.compile(result).apply();
            } catch (OperatorException e) {
                logger.debug("Keeping {} symbolic: {}", result, e.getMessage());
                return result;
            }
            return Double.isFinite(value) ? ExprNode.constant(Rational.valueOf(BigDecimal.valueOf(value))) : result;
        });
    }

    public String format(ExprNode node) {
        return ExprFormatter.CANONICAL.format(node);
    }

    public String formatDecimal(ExprNode node) {
        return ExprFormatter.decimal(settings.precision()).format(node);
    }

    // ========== functions and peekers ==========

    /**
     * Calls a registered function, notifying peekers first.
     */
    public ExprNode call(String name, MutableList<ExprNode> args) {
        FunctionDefinition definition = functions.lookup(name, args.size());
        peek(name, args);
        return definition.body().apply(this, args);
    }

    /**
     * Re-applies {@code name} to rebuilt arguments: through the function table when it knows
     * the name and arity, otherwise as an uninterpreted call.
     */
    public ExprNode applyFunction(String name, MutableList<ExprNode> args) {
        FunctionDefinition definition = functions.find(name);
        if (definition != null && definition.accepts(args.size())) {
            return call(name, args);
        }
        return ExprNode.function(name, args);
    }

    public void peek(String operation, ListIterable<ExprNode> operands) {
        MutableList<Peeker> subscribed = peekers.get(operation);
        if (subscribed == null || subscribed.isEmpty()) {
            return;
        }
        for (Peeker peeker : subscribed) {
            peeker.peek(operation, Lists.immutable.withAll(operands.collect(ExprNode::copy)));
        }
    }

    public void addPeeker(String operation, Peeker peeker) {
        peekers.getIfAbsentPut(operation, Lists.mutable::empty).add(peeker);
    }

    public boolean removePeeker(String operation, Peeker peeker) {
        MutableList<Peeker> subscribed = peekers.get(operation);
        return subscribed != null && subscribed.remove(peeker);
    }

    /**
     * Defines {@code name(params...) = body}. The body is parsed once with the parameters kept
     * symbolic; calls substitute the arguments for all parameters at once.
     */
    public void defineFunction(String name, List<String> params, String body) {
        MutableMap<String, ExprNode> symbolic = Maps.mutable.empty();
        for (String param : params) {
            requireVariableName(param);
            symbolic.put(param, ExprNode.variable(param));
        }
        ExprNode template = evaluate(body, symbolic);
        ImmutableList<String> names = Lists.immutable.withAll(params);
        functions.register(name, names.size(), names.size(), (session, args) -> {
            MutableMap<String, ExprNode> values = Maps.mutable.empty();
            for (int i = 0; i < args.size(); i++) {
                values.put(names.get(i), args.get(i));
            }
            return session.substitution.substituteAll(template, values);
        });
        logger.debug("Defined {}({}) = {}", name, params, template);
    }

    public void registerFunction(String name, int minArity, int maxArity, FunctionBody body) {
        functions.register(name, minArity, maxArity, body);
    }

    public boolean removeFunction(String name) {
        return functions.remove(name);
    }

    public void registerOperator(Operator operator) {
        tables.registerOperator(operator);
    }

    public void addPreprocessor(Preprocessor preprocessor) {
        tables.addPreprocessor(preprocessor);
    }

    public boolean removePreprocessor(Preprocessor preprocessor) {
        return tables.removePreprocessor(preprocessor);
    }

    public void alias(String from, String to) {
        tables.alias(from, to);
    }

    // ========== variables and constants ==========

    /**
     * The known value of {@code name}, or null.
     */
    public ExprNode variable(String name) {
        ExprNode value = variables.get(name);
        return value == null ? null : value.copy();
    }

    public void setVariable(String name, ExprNode value) {
        requireVariableName(name);
        variables.put(name, value.copy());
    }

    public boolean clearVariable(String name) {
        return variables.remove(name) != null;
    }

    /**
     * The value of a named constant, or null. In numeric mode {@code pi} and {@code e} are
     * their decimal approximations.
     */
    public ExprNode constant(String name) {
        if (settings.isNumeric()) {
            if (name.equals("pi")) {
                return ExprNode.constant(Rational.valueOf(BigDecimal.valueOf(Math.PI)));
            }
            if (name.equals("e")) {
                return ExprNode.constant(Rational.valueOf(BigDecimal.valueOf(Math.E)));
            }
        }
        ExprNode value = constants.get(name);
        return value == null ? null : value.copy();
    }

    public boolean isConstantName(String name) {
        return constants.containsKey(name);
    }

    public void setConstant(String name, ExprNode value) {
        requireVariableName(name);
        constants.put(name, value.copy());
    }

    private void requireVariableName(String name) {
        if (!VARIABLE_NAME.matcher(name).matches() || functions.contains(name)) {
            throw new InvalidVariableNameException("'" + name + "' cannot be used as a variable name");
        }
    }

    // ========== transforms ==========

    public ExprNode substitute(ExprNode node, String variable, ExprNode value) {
        return substitution.substitute(node, variable, value);
    }

    public ExprNode substituteAll(ExprNode node, MapIterable<String, ExprNode> values) {
        return substitution.substituteAll(node, values);
    }

    public ExprNode canonicalize(ExprNode node) {
        return guarded(() -> substitution.canonicalize(node));
    }

    public ExprNode diff(ExprNode f, String x, int order) {
        return guarded(() -> derivative.diff(f, x, order));
    }

    public ExprNode diff(ExprNode f, String x) {
        return diff(f, x, 1);
    }

    public ExprNode integrate(ExprNode f, String x) {
        return guarded(() -> integrator.integrate(f, x));
    }

    public ExprNode definiteIntegral(ExprNode f, ExprNode from, ExprNode to, String x) {
        return guarded(() -> integrator.definiteIntegral(f, from, to, x));
    }

    public ExprNode laplace(ExprNode f, String t, String s) {
        return guarded(() -> laplace.laplace(f, t, s));
    }

    public ExprNode inverseLaplace(ExprNode transform, String s, String t) {
        return guarded(() -> laplace.inverseLaplace(transform, s, t));
    }

    public ExprNode expand(ExprNode node) {
        return guarded(() -> expander.expand(node));
    }

    public ExprNode factor(ExprNode node) {
        return guarded(() -> factorizer.factor(node));
    }

    public ExprNode partialFractions(ExprNode f, String x) {
        return guarded(() -> partialFractions.apply(f, x));
    }

    public ExprNode simplify(ExprNode node) {
        return guarded(() -> simplifier.simplify(node));
    }

    public MutableList<ExprNode> solve(ExprNode f, String x) {
        return guarded(() -> solver.solve(f, x));
    }

    /**
     * Values for {@code unknowns}, in order, of a square linear system of expressions equal to
     * zero, or null when it is non-linear or singular.
     */
    public MutableList<ExprNode> solveEquations(ListIterable<ExprNode> equations, ListIterable<String> unknowns) {
        return guarded(() -> solver.solveLinearSystem(equations, unknowns));
    }

    /**
     * The limit of {@code f} as {@code x} approaches {@code point}, which may be
     * {@code Infinity} or {@code -Infinity}.
     */
    public ExprNode limit(ExprNode f, String x, ExprNode point) {
        return guarded(() -> limits.limit(f, x, point));
    }

    public ExprNode gcd(ListIterable<ExprNode> args) {
        return guarded(() -> algebra.gcd(args));
    }

    public ExprNode lcm(ListIterable<ExprNode> args) {
        return guarded(() -> algebra.lcm(args));
    }

    public ExprNode divide(ExprNode dividend, ExprNode divisor) {
        return guarded(() -> algebra.divide(dividend, divisor));
    }

    public ExprNode sum(ExprNode f, String index, ExprNode start, ExprNode end) {
        return guarded(() -> algebra.sum(f, index, start, end));
    }

    public ExprNode product(ExprNode f, String index, ExprNode start, ExprNode end) {
        return guarded(() -> algebra.product(f, index, start, end));
    }

    /**
     * {@code node} as a function of the given variables, in order.
     */
    public CompiledFunction compile(ExprNode node, String... variables) {
        return Compiler.compile(node, variables);
    }

    private <T> T guarded(Supplier<T> body) {
        try (DeadlineGuard.Scope ignored = deadline.arm(settings.timeoutMillis())) {
            return body.get();
        }
    }
}
