package io.nlpqlresolver.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Statements found in a normalized definitions text, in order of appearance.
 *
 * @param context     the context identifier
 * @param tasks       task names
 * @param expressions expression names with their raw bodies
 * @param finalNames  names (of either kind) declared with the {@code final} keyword
 */
public record ExtractedStatements(
        String context, List<String> tasks, List<NamedExpression> expressions, Set<String> finalNames) {

    public ExtractedStatements {
        Objects.requireNonNull(context, "context must not be null");
        tasks = List.copyOf(tasks);
        expressions = List.copyOf(expressions);
        finalNames = Collections.unmodifiableSet(new LinkedHashSet<>(finalNames));
    }
}
