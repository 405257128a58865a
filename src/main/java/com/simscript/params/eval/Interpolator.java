package com.simscript.params.eval;

import java.util.List;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simscript.params.exception.EvaluationException;
import com.simscript.params.exception.EvaluationException.Category;
import com.simscript.params.exception.UnresolvedReferenceException;
import com.simscript.params.grammar.ExpressionGrammar;
import com.simscript.params.grammar.ExpressionParser;
import com.simscript.params.grammar.Marker;
import com.simscript.params.record.OrderedRecord;
import com.simscript.params.value.ErrorMarker;
import com.simscript.params.value.NdArray;
import com.simscript.params.value.ValueFormatter;

/**
 * Substitutes {@code ${...}} and {@code @{...}} markers by the textual form of their value.
 *
 * Marker contents are expressions whose identifiers are fields of the context record.
 * {@code @{...}} values are coerced to arrays of at least two dimensions.
 */
public class Interpolator {
    private static final Logger log = LoggerFactory.getLogger(Interpolator.class);

    private final MathFunctions functions;

    public Interpolator(MathFunctions functions) {
        this.functions = functions;
    }

    /**
     * Value of one marker.
     *
     * @throws UnresolvedReferenceException when a name is not defined in {@code context}
     * @throws EvaluationException when the marker content cannot be computed
     */
    public Object resolve(Marker marker, OrderedRecord context) {
        Object value = new ExpressionEvaluator(NameResolver.of(context), functions)
                .evaluate(ExpressionParser.parse(marker.getContent()));
        if (!marker.isArrayCoercing()) {
            return value;
        }
        if (value instanceof NdArray array) {
            return array.atLeast2d();
        }
        try {
            return NdArray.fromNested(value).atLeast2d();
        } catch (IllegalArgumentException e) {
            throw new EvaluationException(Category.TYPE, "@{" + marker.getContent() + "} is not numeric: "
                    + e.getMessage(), e);
        }
    }

    /**
     * Replaces every live marker; escaped markers are left for the caller.
     *
     * @throws UnresolvedReferenceException on the first undefined name
     * @throws EvaluationException on the first marker that cannot be computed
     */
    public String interpolate(String text, OrderedRecord context) {
        return substitute(text, context, ValueFormatter::toText);
    }

    /**
     * Like {@link #interpolate}, for text that is computed afterwards: arrays are written as
     * {@code array(...)} calls so that they keep their type.
     */
    public String interpolateExpression(String text, OrderedRecord context) {
        return substitute(text, context, ValueFormatter::expressionText);
    }

    private String substitute(String text, OrderedRecord context, Function<Object, String> writer) {
        List<Marker> markers = ExpressionGrammar.findMarkers(text);
        StringBuilder sb = new StringBuilder(text.length());
        int last = 0;
        for (Marker marker : markers) {
            sb.append(text, last, marker.getStart());
            sb.append(writer.apply(resolve(marker, context)));
            last = marker.getEnd();
        }
        sb.append(text, last, text.length());
        return sb.toString();
    }

    /**
     * Like {@link #interpolate} but never fails: a marker that cannot be substituted is
     * written back unchanged.
     */
    public String interpolateSoft(String text, OrderedRecord context) {
        List<Marker> markers = ExpressionGrammar.findMarkers(text, true);
        StringBuilder sb = new StringBuilder(text.length());
        int last = 0;
        for (Marker marker : markers) {
            sb.append(text, last, marker.getStart());
            try {
                sb.append(ValueFormatter.toText(resolve(marker, context)));
            } catch (UnresolvedReferenceException e) {
                log.warn("the variable {} is not defined, {} kept", e.getMissingName(), marker.text());
                sb.append(marker.text());
            } catch (EvaluationException e) {
                log.warn("{} cannot be substituted ({}), kept as is", marker.text(), e.describe());
                sb.append(marker.text());
            }
            last = marker.getEnd();
        }
        sb.append(text, last, text.length());
        return sb.toString();
    }

    /**
     * First error marker held by a field that the text references, or null.
     */
    public ErrorMarker upstreamError(String text, OrderedRecord context) {
        for (String name : ExpressionGrammar.references(text)) {
            if (context.has(name) && context.get(name) instanceof ErrorMarker marker) {
                return marker;
            }
        }
        return null;
    }
}
