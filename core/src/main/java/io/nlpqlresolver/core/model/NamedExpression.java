package io.nlpqlresolver.core.model;

import java.util.Objects;

/**
 * A declared expression name paired with a definition body (raw or reduced).
 *
 * @param name       the declared name
 * @param definition the right-hand side text
 */
public record NamedExpression(String name, String definition) {

    public NamedExpression {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(definition, "definition must not be null");
    }
}
