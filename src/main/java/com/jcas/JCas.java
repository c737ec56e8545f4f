package com.jcas;

import com.jcas.expr.ExprNode;
import com.jcas.json.BindingsReader;
import com.jcas.output.ExprFormatter;
import com.jcas.output.JsonResultWriter;
import com.jcas.session.Session;
import com.jcas.session.Settings;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "jcas", mixinStandardHelpOptions = true, version = "1.0",
         description = "Evaluate, simplify and transform symbolic math expressions")
public class JCas implements Callable<Integer> {
    @Parameters(index = "0", description = "The expression, e.g. \"diff(x^3, x)\" or \"solve(x^2-4)\"")
    private String expression;

    @Option(names = {"-v", "--var"}, description = "Bind a variable, e.g. -v x=2 -v y=1/3")
    private Map<String, String> variables = new LinkedHashMap<>();

    @Option(names = {"-b", "--bindings"}, description = "JSON object of variable bindings")
    private File bindingsFile;

    @Option(names = {"-n", "--numeric"}, description = "Evaluate functions of constants numerically")
    private boolean numeric = false;

    @Option(names = {"-d", "--decimal"}, description = "Print constants as decimals instead of fractions")
    private boolean decimal = false;

    @Option(names = {"-j", "--json"}, description = "Print the result as a JSON object")
    private boolean json = false;

    @Option(names = {"-t", "--timeout"}, description = "Evaluation budget in milliseconds (0 for none)")
    private Long timeoutMillis;

    @Option(names = {"-p", "--precision"}, description = "Digits after the decimal point for -d")
    private Integer precision;

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JCas()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        try {
            Settings settings = Settings.defaults();
            if (timeoutMillis != null) {
                settings.setTimeoutMillis(timeoutMillis);
            }
            if (precision != null) {
                settings.setPrecision(precision);
            }
            Session session = new Session(settings);

            // Bindings from the file first, so -v can override them
            MutableMap<String, ExprNode> bindings = Maps.mutable.empty();
            if (bindingsFile != null) {
                try (InputStream input = new FileInputStream(bindingsFile)) {
                    bindings.putAll(new BindingsReader(session).read(input));
                }
            }
            variables.forEach((name, value) -> bindings.put(name, session.parse(value)));

            ExprNode result = numeric
                    ? session.evaluateNumeric(expression, bindings)
                    : session.evaluate(expression, bindings);

            PrintWriter out = spec.commandLine().getOut();
            if (json) {
                ExprFormatter decimalFormatter = decimal ? ExprFormatter.decimal(settings.precision()) : null;
                new JsonResultWriter(false).write(out, expression, result, decimalFormatter);
            } else {
                out.println(decimal ? session.formatDecimal(result) : session.format(result));
                out.flush();
            }
            return 0;
        } catch (Exception e) {
            PrintWriter err = spec.commandLine().getErr();
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
