package com.simscript.params.eval;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simscript.params.exception.EvaluationException;
import com.simscript.params.exception.EvaluationException.Category;
import com.simscript.params.exception.ExpressionSyntaxException;
import com.simscript.params.exception.UnresolvedReferenceException;
import com.simscript.params.grammar.ArrayLiteralExpander;
import com.simscript.params.grammar.ExpressionGrammar;
import com.simscript.params.grammar.ExpressionKind;
import com.simscript.params.grammar.LiteralReader;
import com.simscript.params.grammar.Marker;
import com.simscript.params.record.OrderedRecord;
import com.simscript.params.value.ErrorMarker;
import com.simscript.params.value.PathValue;
import com.simscript.params.value.ValueFormatter;

/**
 * Evaluates records into snapshots and formats templates against records.
 *
 * Fields are evaluated in record order against the snapshot built so far, so a field only
 * sees the fields before it. A field that cannot be evaluated receives an {@link ErrorMarker}
 * and the remaining fields are still evaluated.
 */
public class Evaluator {
    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private final EvaluatorConfig config;
    private final MathFunctions functions;
    private final Interpolator interpolator;
    private final ArrayLiteralExpander expander;

    public Evaluator() {
        this(EvaluatorConfig.defaults());
    }

    public Evaluator(EvaluatorConfig config) {
        this.config = config;
        this.functions = new MathFunctions(config.getMaxRangeElements());
        this.interpolator = new Interpolator(functions);
        this.expander = new ArrayLiteralExpander(config.getMaxRangeElements());
    }

    /**
     * Evaluates every field of a record. The source is never modified; evaluating a
     * snapshot returns an identical copy.
     */
    public OrderedRecord evaluate(OrderedRecord record) {
        if (record.isEvaluated()) {
            return record.copy();
        }
        OrderedRecord snapshot = new OrderedRecord();
        List<String> knownNames = record.keys();
        for (Map.Entry<String, Object> field : record.items()) {
            Object result = evaluateField(field.getKey(), field.getValue(), snapshot, knownNames);
            if (result instanceof ErrorMarker marker) {
                log.debug("{} = {} ({})", field.getKey(), marker, marker.getCause());
            } else {
                log.debug("{} = {}", field.getKey(), ValueFormatter.display(result));
            }
            snapshot.set(field.getKey(), result);
        }
        snapshot.setEvaluated(true);
        return snapshot;
    }

    /**
     * Evaluates one value against an existing snapshot.
     */
    public Object evaluateValue(Object value, OrderedRecord snapshot) {
        return evaluateField("", value, snapshot, snapshot.keys());
    }

    private Object evaluateField(String name, Object value, OrderedRecord snapshot, Collection<String> knownNames) {
        if (value instanceof PathValue path) {
            return evaluatePath(path, snapshot, knownNames);
        }
        if (!(value instanceof String source)) {
            return OrderedRecord.copyValue(value);
        }
        String text = ExpressionGrammar.stripComment(source);
        if (config.isProtection()) {
            text = ExpressionGrammar.protect(text, knownNames);
        }
        String trimmed = text.strip();
        if (!config.isEvaluation()) {
            return interpolateOnly(trimmed, snapshot, source);
        }
        ExpressionKind kind = ExpressionGrammar.classify(trimmed);
        log.trace("{} is classified as {}", name, kind);
        return switch (kind) {
            case EMPTY -> "";
            case RECURSIVE_LITERAL -> evaluateLiteralList(trimmed.substring(1), snapshot, source);
            case LITERAL -> interpolateOnly(trimmed.substring(1).stripLeading(), snapshot, source);
            case ESCAPED -> interpolateOnly(trimmed, snapshot, source);
            default -> evaluateFully(trimmed, snapshot, source);
        };
    }

    private Object evaluatePath(PathValue path, OrderedRecord snapshot, Collection<String> knownNames) {
        String text = path.toString();
        if (config.isProtection()) {
            text = ExpressionGrammar.protect(text, knownNames);
        }
        Object interpolated = interpolateOnly(text, snapshot, path.toString());
        if (interpolated instanceof ErrorMarker) {
            return interpolated;
        }
        return PathValue.of((String) interpolated).toPath();
    }

    /**
     * Interpolation without computation; escaped markers lose their backslash.
     */
    private Object interpolateOnly(String text, OrderedRecord snapshot, String source) {
        ErrorMarker upstream = interpolator.upstreamError(text, snapshot);
        if (upstream != null) {
            return ErrorMarker.propagate(upstream, source);
        }
        try {
            return ExpressionGrammar.unescape(interpolator.interpolate(text, snapshot));
        } catch (UnresolvedReferenceException e) {
            return ErrorMarker.unresolved(e.getMissingName(), source);
        } catch (EvaluationException e) {
            return ErrorMarker.error(e.describe(), source);
        }
    }

    /**
     * Interpolates then computes the text. Text that is not an expression is kept as
     * interpolated, unless the configuration is strict.
     */
    private Object evaluateFully(String text, OrderedRecord snapshot, String source) {
        ErrorMarker upstream = interpolator.upstreamError(text, snapshot);
        if (upstream != null) {
            return ErrorMarker.propagate(upstream, source);
        }
        String interpolated = text;
        try {
            List<Marker> markers = ExpressionGrammar.findMarkers(text);
            if (markers.size() == 1 && markers.get(0).getStart() == 0 && markers.get(0).getEnd() == text.length()) {
                return OrderedRecord.copyValue(interpolator.resolve(markers.get(0), snapshot));
            }
            interpolated = interpolator.interpolateExpression(text, snapshot);
            String expression = ArrayLiteralExpander.containsArrayLiteral(interpolated)
                    ? expander.expand(interpolated)
                    : interpolated;
            return new ExpressionEvaluator(NameResolver.constantsOnly(), functions).evaluate(expression);
        } catch (UnresolvedReferenceException e) {
            return ErrorMarker.unresolved(e.getMissingName(), source);
        } catch (EvaluationException e) {
            if (isSoftFailure(e) && !config.isStrict()) {
                return interpolated;
            }
            return ErrorMarker.error(e.describe(), source);
        }
    }

    /**
     * Failures meaning "this text is not an expression" rather than "this expression is wrong".
     */
    private static boolean isSoftFailure(EvaluationException e) {
        return e instanceof ExpressionSyntaxException || e.getCategory() == Category.UNKNOWN_NAME;
    }

    /**
     * {@code !} values: a literal sequence whose string items are interpolated, then
     * computed when they form an expression.
     */
    private Object evaluateLiteralList(String body, OrderedRecord snapshot, String source) {
        Object literal;
        try {
            literal = LiteralReader.read(body);
        } catch (ExpressionSyntaxException first) {
            try {
                literal = LiteralReader.read(interpolator.interpolateSoft(body, snapshot));
            } catch (ExpressionSyntaxException e) {
                return ErrorMarker.error(e.describe(), source);
            }
        }
        if (!(literal instanceof List<?> items)) {
            return literal instanceof String text ? computeSoftly(text, snapshot) : literal;
        }
        List<Object> out = new ArrayList<>(items.size());
        for (Object item : items) {
            out.add(item instanceof String text ? computeSoftly(text, snapshot) : item);
        }
        return out;
    }

    private Object computeSoftly(String text, OrderedRecord snapshot) {
        String interpolated = ExpressionGrammar.unescape(interpolator.interpolateSoft(text, snapshot));
        try {
            return new ExpressionEvaluator(NameResolver.constantsOnly(), functions).evaluate(interpolated);
        } catch (EvaluationException e) {
            log.trace("{} kept as text: {}", interpolated, e.describe());
            return interpolated;
        }
    }

    /**
     * Interpolates a template against the values of a record as they are. Markers that
     * cannot be substituted are kept verbatim; this method never fails.
     */
    public String format(String template, OrderedRecord record) {
        return ExpressionGrammar.unescape(interpolator.interpolateSoft(template, record));
    }

    /**
     * Evaluates the definitions, then formats the template line by line. Trailing comments
     * are preserved; with {@code fullEvaluation} each formatted line is also computed when
     * it is an expression. A line starting with {@code %} is turned into a {@code #} comment
     * after substitution.
     */
    public String formatEval(String template, OrderedRecord definitions, boolean fullEvaluation) {
        OrderedRecord snapshot = evaluate(definitions);
        if (snapshot.isEmpty()) {
            return template;
        }
        String[] lines = template.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            String comment = "";
            int hash = line.indexOf('#');
            if (hash >= 0) {
                while (hash > 0 && line.charAt(hash - 1) == ' ') {
                    hash--;
                }
                comment = line.substring(hash);
                line = line.substring(0, hash);
            }
            if (config.isProtection()) {
                line = ExpressionGrammar.protect(line, snapshot.keys());
            }
            String formatted = format(line, snapshot);
            if (fullEvaluation && !formatted.isBlank()) {
                formatted = computeLine(formatted);
            }
            String result = formatted + comment;
            if (result.startsWith("%")) {
                result = "#" + result.substring(1);
            }
            lines[i] = result;
        }
        return String.join("\n", lines);
    }

    private String computeLine(String line) {
        try {
            String expression = ArrayLiteralExpander.containsArrayLiteral(line) ? expander.expand(line) : line;
            Object value = new ExpressionEvaluator(NameResolver.constantsOnly(), functions).evaluate(expression);
            return ValueFormatter.toText(value);
        } catch (EvaluationException e) {
            return line;
        }
    }
}
