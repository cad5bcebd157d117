package io.nlpqlresolver.core.engine;

import io.nlpqlresolver.core.error.DuplicateDefinitionException;
import io.nlpqlresolver.core.error.DuplicateDefinitionException.Kind;
import io.nlpqlresolver.core.model.ExtractedStatements;
import io.nlpqlresolver.core.model.NamedExpression;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Every name declared in one definitions file, tasks first, then expressions, each in
 * declaration order. Immutable once built.
 */
public final class NameRegistry {

    private final Map<String, Kind> kinds;
    private final List<String> names;
    private final List<String> tasks;
    private final List<String> expressionNames;

    private NameRegistry(Map<String, Kind> kinds, List<String> tasks, List<String> expressionNames) {
        this.kinds = kinds;
        this.tasks = List.copyOf(tasks);
        this.expressionNames = List.copyOf(expressionNames);
        this.names = List.copyOf(kinds.keySet());
    }

    /**
     * Builds a registry from task names and expression names.
     *
     * @throws DuplicateDefinitionException if a name occurs twice in either list or in both
     */
    public static NameRegistry of(List<String> tasks, List<String> expressionNames, String source) {
        Objects.requireNonNull(tasks, "tasks must not be null");
        Objects.requireNonNull(expressionNames, "expressionNames must not be null");
        Map<String, Kind> kinds = new LinkedHashMap<>();
        for (String task : tasks) {
            register(kinds, task, Kind.TASK, source);
        }
        for (String expression : expressionNames) {
            register(kinds, expression, Kind.EXPRESSION, source);
        }
        return new NameRegistry(kinds, tasks, expressionNames);
    }

    /** Builds a registry from extracted statements. */
    public static NameRegistry of(ExtractedStatements statements, String source) {
        List<String> expressionNames = new ArrayList<>();
        for (NamedExpression expression : statements.expressions()) {
            expressionNames.add(expression.name());
        }
        return of(statements.tasks(), expressionNames, source);
    }

    private static void register(Map<String, Kind> kinds, String name, Kind kind, String source) {
        Kind previous = kinds.putIfAbsent(name, kind);
        if (previous != null) {
            throw new DuplicateDefinitionException(name, previous, kind, source);
        }
    }

    public boolean isTask(String name) {
        return kinds.get(name) == Kind.TASK;
    }

    public boolean isExpression(String name) {
        return kinds.get(name) == Kind.EXPRESSION;
    }

    public boolean isDefined(String name) {
        return kinds.containsKey(name);
    }

    /** Tasks followed by expression names. */
    public List<String> names() {
        return names;
    }

    public List<String> tasks() {
        return tasks;
    }

    public List<String> expressionNames() {
        return expressionNames;
    }
}
