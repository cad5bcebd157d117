package io.nlpqlresolver.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A fully resolved definitions file. Immutable, thread-safe: created once by {@code
 * DefinitionResolver} and handed read-only to the expression evaluator and the data layer.
 *
 * <p>
 * {@link #reducedExpressions()} pairs every expression with a body written only in task names,
 * literals and operators; {@link #names()} is the list the evaluator needs to recognise
 * identifiers; {@link #primitives()} is the minimal set of task results the data layer must
 * supply.
 *
 * @param context            evaluation context identifier, e.g. {@code patient} or {@code document}
 * @param names              tasks followed by expression names, in declaration order
 * @param tasks              task (primitive) names in declaration order
 * @param expressions        expressions with their raw bodies, in declaration order
 * @param reducedExpressions expressions with their reduced bodies, same order as {@code expressions}
 * @param primitives         task names referenced by any reduced body, in first-use order
 * @param finalNames         names declared with {@code final}
 * @param compositeNames     expressions whose body needed at least one substitution
 */
public record DefinitionFile(
        String context,
        List<String> names,
        List<String> tasks,
        List<NamedExpression> expressions,
        List<NamedExpression> reducedExpressions,
        Set<String> primitives,
        Set<String> finalNames,
        Set<String> compositeNames) {

    /**
     * Canonical constructor: copies every collection and checks the structural invariants.
     *
     * @throws IllegalArgumentException if names is not tasks followed by expression names, holds a
     *                                  duplicate, or the reduced list does not line up with the
     *                                  raw list
     */
    public DefinitionFile {
        Objects.requireNonNull(context, "context must not be null");
        names = List.copyOf(names);
        tasks = List.copyOf(tasks);
        expressions = List.copyOf(expressions);
        reducedExpressions = List.copyOf(reducedExpressions);
        primitives = Collections.unmodifiableSet(new LinkedHashSet<>(primitives));
        finalNames = Collections.unmodifiableSet(new LinkedHashSet<>(finalNames));
        compositeNames = Collections.unmodifiableSet(new LinkedHashSet<>(compositeNames));

        List<String> expected = new ArrayList<>(tasks);
        for (NamedExpression expression : expressions) {
            expected.add(expression.name());
        }
        if (!expected.equals(names)) {
            throw new IllegalArgumentException("names must be the task names followed by the expression names");
        }
        if (new LinkedHashSet<>(names).size() != names.size()) {
            throw new IllegalArgumentException("names must not contain duplicates");
        }
        if (reducedExpressions.size() != expressions.size()) {
            throw new IllegalArgumentException(String.format(
                    "reducedExpressions has %d entries, expressions has %d",
                    reducedExpressions.size(), expressions.size()));
        }
        for (int i = 0; i < expressions.size(); i++) {
            if (!expressions.get(i).name().equals(reducedExpressions.get(i).name())) {
                throw new IllegalArgumentException("reducedExpressions must follow the order of expressions");
            }
        }
    }

    public boolean isTask(String name) {
        return tasks.contains(name);
    }

    public boolean isExpression(String name) {
        return isDefined(name) && !isTask(name);
    }

    public boolean isDefined(String name) {
        return names.contains(name);
    }

    /** {@code true} if the name was declared with the {@code final} keyword. */
    public boolean isFinal(String name) {
        return finalNames.contains(name);
    }

    /** The body of the named expression as written in the file. */
    public Optional<String> rawDefinition(String name) {
        return find(expressions, name);
    }

    /** The body of the named expression after reduction to primitive names. */
    public Optional<String> reducedDefinition(String name) {
        return find(reducedExpressions, name);
    }

    private static Optional<String> find(List<NamedExpression> list, String name) {
        return list.stream()
                .filter(e -> e.name().equals(name))
                .map(NamedExpression::definition)
                .findFirst();
    }
}
