package info.isaksson.erland.codeatlas.annotate;

import info.isaksson.erland.codeatlas.ir.DryRunTrace;
import info.isaksson.erland.codeatlas.ir.FunctionDef;
import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.ir.ParsedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Synthesizes bounded dry-run traces for simple functions.
 *
 * <p>A trace is produced only when every parameter gets a literal value, either from the caller's
 * {@link SampleInput} or from literal defaults, and the function stays under the complexity
 * ceiling ({@value #MAX_NESTING} nested blocks, {@value #MAX_BODY_LINES} body lines). Otherwise the
 * result is empty and callers show {@link DryRunTrace#NO_TRACE_MESSAGE}.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public final class DryRunSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(DryRunSynthesizer.class);

    public static final int DEFAULT_MAX_STEPS = 200;
    public static final int MAX_NESTING = 4;
    public static final int MAX_BODY_LINES = 120;

    private static final Pattern PARAMETER =
            Pattern.compile("^(\\*\\*|\\*|\\.\\.\\.)?\\s*(?:(?:public|private|protected|readonly)\\s+)*([A-Za-z_$][\\w$]*)");

    private final int maxSteps;

    public DryRunSynthesizer() {
        this(DEFAULT_MAX_STEPS);
    }

    public DryRunSynthesizer(int maxSteps) {
        if (maxSteps < 1) throw new IllegalArgumentException("maxSteps must be >= 1, got " + maxSteps);
        this.maxSteps = maxSteps;
    }

    public int maxSteps() {
        return maxSteps;
    }

    /**
     * Traces {@code function} of {@code file}.
     *
     * @param input caller-supplied literals, or null to infer from parameter defaults
     */
    public Optional<DryRunTrace> synthesize(ParsedFile file, FunctionDef function, SampleInput input) {
        Optional<FunctionBody> body = file.language == Language.PYTHON
                ? PythonStatements.build(file.lines, function)
                : ScriptStatements.build(file.lines, function, file.language);
        if (body.isEmpty()) {
            log.debug("{}: no body found for {}", file.path, function.qualifiedName());
            return Optional.empty();
        }
        FunctionBody b = body.get();
        if (b.nesting > MAX_NESTING || b.lines > MAX_BODY_LINES) {
            log.debug("{}: {} is above the dry-run ceiling (nesting {}, {} lines)", file.path, function.qualifiedName(), b.nesting, b.lines);
            return Optional.empty();
        }
        Env env = new Env(file.language);
        Optional<String> rendered = bind(function, file.language, input, env);
        if (rendered.isEmpty()) return Optional.empty();

        String shown = rendered.get();
        String opening = "Call " + function.qualifiedName() + (shown.isEmpty() ? " with no arguments" : " with " + shown);
        TraceWalker walker = new TraceWalker(env, maxSteps);
        walker.run(opening, b.statements, function.endLine);
        if (walker.truncated()) {
            log.debug("{}: trace of {} truncated after {} steps", file.path, function.qualifiedName(), maxSteps);
        }
        return Optional.of(new DryRunTrace(function.qualifiedName(), shown, input == null, walker.truncated(), walker.steps()));
    }

    /**
     * Traces every function of a file, in declaration order. {@code inputs} is keyed by qualified
     * function name; functions without an entry use inferred input. Functions for which no trace
     * can be synthesized are left out.
     */
    public List<DryRunTrace> synthesizeAll(ParsedFile file, Map<String, SampleInput> inputs) {
        List<DryRunTrace> out = new ArrayList<>();
        for (FunctionDef f : file.functions) {
            SampleInput input = inputs == null ? null : inputs.get(f.qualifiedName());
            synthesize(file, f, input).ifPresent(out::add);
        }
        return out;
    }

    /**
     * Binds every parameter in {@code env}.
     *
     * @return the input as shown in the trace, or empty when some parameter has no literal value
     */
    private Optional<String> bind(FunctionDef function, Language language, SampleInput input, Env env) {
        boolean python = language == Language.PYTHON;
        Map<String, Object> shown = new LinkedHashMap<>();
        if (!python) env.bind("this", new Opaque(function.ownerClass == null ? "this" : function.ownerClass));
        for (int i = 0; i < function.parameters.size(); i++) {
            String parameter = function.parameters.get(i).trim();
            if (parameter.equals("*") || parameter.equals("/")) continue;
            Matcher m = PARAMETER.matcher(parameter);
            if (!m.find()) {
                log.debug("{}: parameter '{}' is not a plain name", function.qualifiedName(), parameter);
                return Optional.empty();
            }
            String prefix = m.group(1);
            String name = m.group(2);
            if (!python && name.equals("this")) continue;
            if (python && i == 0 && (name.equals("self") || name.equals("cls"))) {
                env.bind(name, new Opaque(function.ownerClass == null ? name : function.ownerClass));
                continue;
            }
            Object value;
            if (input != null && input.has(name)) {
                Optional<Object> literal = literal(input.valueOf(name), language);
                if (literal.isEmpty()) {
                    log.debug("{}: sample value for '{}' is not a literal: {}", function.qualifiedName(), name, input.valueOf(name));
                    return Optional.empty();
                }
                value = literal.get();
            } else if (prefix != null) {
                value = prefix.equals("**") ? new LinkedHashMap<>() : prefix.equals("*") ? new Tuple(List.of()) : new ArrayList<>();
            } else {
                String defaultText = defaultOf(parameter, python);
                if (defaultText == null) {
                    if (!python && parameter.substring(m.end()).trim().startsWith("?")) {
                        value = Nothing.UNDEFINED;
                    } else {
                        return Optional.empty();
                    }
                } else {
                    Optional<Object> literal = literal(defaultText, language);
                    if (literal.isEmpty()) return Optional.empty();
                    value = literal.get();
                }
            }
            env.bind(name, value);
            shown.put(name, value);
        }
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, Object> e : shown.entrySet()) parts.add(e.getKey() + " = " + env.repr(e.getValue()));
        return Optional.of(String.join(", ", parts));
    }

    private static Optional<Object> literal(String text, Language language) {
        try {
            return Optional.of(ExpressionParser.parse(text, language).eval(new Env(language)));
        } catch (UnresolvedException e) {
            return Optional.empty();
        }
    }

    /** Text after the default {@code =} of a parameter, or null. */
    private static String defaultOf(String parameter, boolean python) {
        int depth = 0;
        for (int i = 0; i < parameter.length(); i++) {
            char c = parameter.charAt(i);
            if (c == '(' || c == '[' || c == '{' || (!python && c == '<')) depth++;
            else if (c == ')' || c == ']' || c == '}' || (!python && c == '>' && (i == 0 || parameter.charAt(i - 1) != '='))) depth--;
            else if (c == '=' && depth == 0) {
                boolean next = i + 1 < parameter.length() && (parameter.charAt(i + 1) == '=' || parameter.charAt(i + 1) == '>');
                if (!next) return parameter.substring(i + 1).trim();
            }
        }
        return null;
    }
}
