package io.nlpqlresolver.core.model;

/** Lexical category of a {@link Token} in an expression body. */
public enum TokenType {
    IDENTIFIER,
    QUALIFIED_IDENTIFIER,
    OPERATOR,
    LITERAL
}
