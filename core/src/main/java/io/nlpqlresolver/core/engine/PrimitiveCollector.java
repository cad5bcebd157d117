package io.nlpqlresolver.core.engine;

import io.nlpqlresolver.core.error.ReductionInvariantException;
import io.nlpqlresolver.core.model.NamedExpression;
import io.nlpqlresolver.core.model.Token;
import io.nlpqlresolver.core.spec.ExpressionTokenizer;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the task names referenced by reduced expression bodies: the features the data layer
 * has to supply before the evaluator can run. {@code Temperature.value} counts as a reference to
 * {@code Temperature}.
 */
public final class PrimitiveCollector {

    private PrimitiveCollector() {}

    /**
     * Scans every reduced body for declared names.
     *
     * @return task names in order of first use
     * @throws ReductionInvariantException if a declared name other than a task is still referenced
     */
    public static Set<String> collect(NameRegistry registry, List<NamedExpression> reducedExpressions, String source) {
        Set<String> primitives = new LinkedHashSet<>();
        for (NamedExpression expression : reducedExpressions) {
            for (Token token : ExpressionTokenizer.tokenize(expression.definition())) {
                if (!token.isName() || !registry.isDefined(token.baseName())) {
                    continue;
                }
                String base = token.baseName();
                if (registry.isTask(base)) {
                    primitives.add(base);
                } else {
                    throw new ReductionInvariantException(
                            String.format(
                                    "Expression \"%s\": \"%s\" is not a primitive name", expression.name(), base),
                            source);
                }
            }
        }
        return Collections.unmodifiableSet(primitives);
    }
}
