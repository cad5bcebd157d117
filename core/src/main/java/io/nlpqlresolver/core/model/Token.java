package io.nlpqlresolver.core.model;

import java.util.Objects;

/**
 * A single lexical token of an expression body.
 *
 * @param type token category
 * @param text token text exactly as written
 */
public record Token(TokenType type, String text) {

    public static final Token OPEN_PAREN = new Token(TokenType.OPERATOR, "(");
    public static final Token CLOSE_PAREN = new Token(TokenType.OPERATOR, ")");

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("text must not be empty");
        }
    }

    /** {@code true} for plain and qualified identifiers. */
    public boolean isName() {
        return type == TokenType.IDENTIFIER || type == TokenType.QUALIFIED_IDENTIFIER;
    }

    /**
     * The referenced name: the whole text for an identifier, the part before the first {@code .}
     * for a qualified identifier ({@code Temperature.value} gives {@code Temperature}).
     */
    public String baseName() {
        if (type != TokenType.QUALIFIED_IDENTIFIER) {
            return text;
        }
        return text.substring(0, text.indexOf('.'));
    }
}
