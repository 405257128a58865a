package com.simscript.params.eval;

import com.simscript.params.exception.EvaluationException;
import com.simscript.params.exception.EvaluationException.Category;
import com.simscript.params.exception.UnresolvedReferenceException;
import com.simscript.params.grammar.ExpressionGrammar;
import com.simscript.params.record.OrderedRecord;

/**
 * Binds the bare identifiers of an expression.
 */
@FunctionalInterface
public interface NameResolver {

    Object resolve(String name);

    /**
     * Constants only; any other name is an unknown name.
     */
    static NameResolver constantsOnly() {
        return name -> {
            Double constant = ExpressionGrammar.CONSTANTS.get(name);
            if (constant == null) {
                throw new EvaluationException(Category.UNKNOWN_NAME, "name '" + name + "' is not defined");
            }
            return constant;
        };
    }

    /**
     * Fields of {@code context} first, then constants; other names are unresolved references.
     */
    static NameResolver of(OrderedRecord context) {
        return name -> {
            if (context.has(name)) {
                return context.get(name);
            }
            Double constant = ExpressionGrammar.CONSTANTS.get(name);
            if (constant == null) {
                throw new UnresolvedReferenceException(name);
            }
            return constant;
        };
    }
}
