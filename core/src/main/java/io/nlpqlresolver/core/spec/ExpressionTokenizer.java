package io.nlpqlresolver.core.spec;

import io.nlpqlresolver.core.model.Token;
import io.nlpqlresolver.core.model.TokenType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Splits an expression body into a typed token stream so that name substitution can work on
 * tokens instead of whitespace-split strings.
 *
 * <ul>
 * <li>identifiers: {@code hasFever}, {@code AND}; ASCII letters, digits, {@code _} and {@code $},
 * not starting with a digit
 * <li>qualified identifiers: {@code Temperature.value}
 * <li>literals: {@code 100.4}, {@code .5}, {@code 'text'}, {@code "text"}
 * <li>operators: {@code >=}, {@code <=}, {@code ==}, {@code !=}, {@code <>} and any other single
 * character, parentheses included
 * </ul>
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class ExpressionTokenizer {

    private static final Set<String> TWO_CHAR_OPERATORS = Set.of(">=", "<=", "==", "!=", "<>");

    private ExpressionTokenizer() {}

    /**
     * Tokenizes an expression body. Whitespace separates tokens and is dropped. An unterminated
     * quoted string becomes a literal running to the end of the body.
     *
     * @param body expression body text
     * @return the tokens in order, empty for a blank body
     */
    public static List<Token> tokenize(String body) {
        Objects.requireNonNull(body, "body must not be null");
        List<Token> tokens = new ArrayList<>();
        int length = body.length();
        int i = 0;
        while (i < length) {
            char c = body.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (isIdentifierStart(c)) {
                i = readName(body, i, tokens);
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < length && Character.isDigit(body.charAt(i + 1)))) {
                i = readNumber(body, i, tokens);
            } else if (c == '\'' || c == '"') {
                i = readString(body, i, tokens);
            } else if (i + 1 < length && TWO_CHAR_OPERATORS.contains(body.substring(i, i + 2))) {
                tokens.add(new Token(TokenType.OPERATOR, body.substring(i, i + 2)));
                i += 2;
            } else {
                tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c)));
                i++;
            }
        }
        return tokens;
    }

    /** {@code true} if {@code text} is exactly one unqualified identifier. */
    public static boolean isIdentifier(String text) {
        if (text == null || text.isEmpty() || !isIdentifierStart(text.charAt(0))) {
            return false;
        }
        return scanIdentifier(text, 0) == text.length();
    }

    /** Joins the token texts with single spaces. */
    public static String render(List<Token> tokens) {
        return tokens.stream().map(Token::text).collect(Collectors.joining(" "));
    }

    private static int readName(String body, int start, List<Token> tokens) {
        int i = scanIdentifier(body, start);
        boolean qualified = false;
        while (i + 1 < body.length() && body.charAt(i) == '.' && isIdentifierStart(body.charAt(i + 1))) {
            i = scanIdentifier(body, i + 1);
            qualified = true;
        }
        TokenType type = qualified ? TokenType.QUALIFIED_IDENTIFIER : TokenType.IDENTIFIER;
        tokens.add(new Token(type, body.substring(start, i)));
        return i;
    }

    private static int scanIdentifier(String body, int start) {
        int i = start + 1;
        while (i < body.length() && isIdentifierPart(body.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int readNumber(String body, int start, List<Token> tokens) {
        int i = start;
        boolean seenDot = false;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (Character.isDigit(c)) {
                i++;
            } else if (c == '.' && !seenDot && i + 1 < body.length() && Character.isDigit(body.charAt(i + 1))) {
                seenDot = true;
                i++;
            } else {
                break;
            }
        }
        tokens.add(new Token(TokenType.LITERAL, body.substring(start, i)));
        return i;
    }

    private static int readString(String body, int start, List<Token> tokens) {
        char quote = body.charAt(start);
        int i = start + 1;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                i += 2;
            } else if (c == quote) {
                i++;
                break;
            } else {
                i++;
            }
        }
        tokens.add(new Token(TokenType.LITERAL, body.substring(start, Math.min(i, body.length()))));
        return i;
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
