package com.simscript.params.param;

import java.util.Iterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simscript.params.eval.Evaluator;
import com.simscript.params.eval.EvaluatorConfig;
import com.simscript.params.record.OrderedRecord;
import com.simscript.params.record.RecordTable;
import com.simscript.params.resolve.DependencyResolver;
import com.simscript.params.resolve.ResolutionMode;

import lombok.Getter;

/**
 * A named set of parameter definitions together with the evaluator used to compute them.
 *
 * Definitions are kept as written. Values are computed on demand by {@link #evaluate()},
 * optionally after reordering the definitions by dependency (see {@link #autoSorting()}).
 */
public class ParameterSet implements Iterable<String> {
    private static final Logger log = LoggerFactory.getLogger(ParameterSet.class);

    private final OrderedRecord definitions;
    @Getter
    private final Evaluator evaluator;
    private final DependencyResolver resolver;
    @Getter
    private final boolean sortBeforeEvaluation;

    public ParameterSet() {
        this(new OrderedRecord(), EvaluatorConfig.defaults(), false);
    }

    public ParameterSet(OrderedRecord definitions) {
        this(definitions, EvaluatorConfig.defaults(), false);
    }

    public ParameterSet(OrderedRecord definitions, EvaluatorConfig config, boolean sortBeforeEvaluation) {
        this.definitions = definitions.copy();
        this.definitions.setEvaluated(false);
        this.evaluator = new Evaluator(config);
        this.resolver = new DependencyResolver();
        this.sortBeforeEvaluation = sortBeforeEvaluation;
    }

    /**
     * A parameter set whose definitions may be given in any order: they are sorted by
     * dependency before every evaluation.
     */
    public static ParameterSet autoSorting() {
        return new ParameterSet(new OrderedRecord(), EvaluatorConfig.defaults(), true);
    }

    public static ParameterSet autoSorting(OrderedRecord definitions) {
        return new ParameterSet(definitions, EvaluatorConfig.defaults(), true);
    }

    public ParameterSet define(String name, Object value) {
        definitions.set(name, value);
        return this;
    }

    /**
     * @return the definition as written, not its evaluated value
     */
    public Object get(String name) {
        return definitions.get(name);
    }

    public boolean has(String name) {
        return definitions.has(name);
    }

    public void remove(String name) {
        definitions.delete(name);
    }

    public int size() {
        return definitions.size();
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    public OrderedRecord definitions() {
        return definitions.copy();
    }

    /**
     * Adds or overrides definitions with those of another set. Overridden fields keep
     * their position.
     */
    public ParameterSet merge(ParameterSet other) {
        definitions.concatInPlace(other.definitions);
        return this;
    }

    public ParameterSet merge(OrderedRecord other) {
        definitions.concatInPlace(other);
        return this;
    }

    public OrderedRecord evaluate() {
        OrderedRecord source = definitions;
        if (sortBeforeEvaluation && !resolver.isOrdered(definitions)) {
            log.debug("Sorting {} definitions before evaluation", definitions.size());
            source = resolver.sort(definitions, ResolutionMode.LENIENT);
        }
        return evaluator.evaluate(source);
    }

    /**
     * @return the evaluated value of one definition
     */
    public Object value(String name) {
        return evaluate().get(name);
    }

    /**
     * @return the evaluated values of the named definitions, in the order given
     */
    public OrderedRecord subset(String... names) {
        return evaluate().subset(names);
    }

    public String format(String template) {
        return evaluator.format(template, evaluate());
    }

    public String formatEval(String template) {
        return evaluator.formatEval(template, sortedDefinitions(), true);
    }

    /**
     * Substitutes evaluated values line by line without computing the resulting lines.
     */
    public String formatInterpolate(String template) {
        return evaluator.formatEval(template, sortedDefinitions(), false);
    }

    private OrderedRecord sortedDefinitions() {
        return sortBeforeEvaluation ? resolver.sort(definitions, ResolutionMode.LENIENT) : definitions;
    }

    @Override
    public Iterator<String> iterator() {
        return definitions.keys().iterator();
    }

    @Override
    public String toString() {
        return RecordTable.render(definitions, evaluate());
    }
}
