package io.nlpqlresolver.core.engine;

import io.nlpqlresolver.core.error.CyclicReferenceException;
import io.nlpqlresolver.core.error.InvalidReferenceException;
import io.nlpqlresolver.core.error.ReductionInvariantException;
import io.nlpqlresolver.core.model.NamedExpression;
import io.nlpqlresolver.core.model.Token;
import io.nlpqlresolver.core.model.TokenType;
import io.nlpqlresolver.core.spec.ExpressionTokenizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites expression bodies until they name no other expression: every reference to an
 * expression is replaced by that expression's current body wrapped in parentheses, pass after
 * pass, until a full pass makes no substitution.
 *
 * <p>
 * Before substituting, the reference graph is checked so the fixpoint loop is known to end. A
 * body that names its own expression is never expanded in place; the token survives substitution
 * and the result is rejected by the post-condition check.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class ExpressionReducer {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionReducer.class);

    private ExpressionReducer() {}

    /**
     * Outcome of a reduction.
     *
     * @param reducedExpressions expressions with reduced bodies, in input order
     * @param compositeNames     expressions that needed at least one substitution
     * @param passes             number of passes, the final no-change pass included
     */
    public record Reduction(List<NamedExpression> reducedExpressions, Set<String> compositeNames, int passes) {

        public Reduction {
            reducedExpressions = List.copyOf(reducedExpressions);
            compositeNames = Collections.unmodifiableSet(new LinkedHashSet<>(compositeNames));
        }
    }

    /** Reduces with {@code <inline>} as the error source. */
    public static Reduction reduce(NameRegistry registry, List<NamedExpression> expressions) {
        return reduce(registry, expressions, DefinitionResolver.INLINE_SOURCE);
    }

    /**
     * Reduces the given expressions against the names in {@code registry}. Bodies that need no
     * substitution are returned unchanged; composite bodies are rendered from tokens with single
     * spaces between them.
     *
     * @throws InvalidReferenceException   if a qualified reference has an expression as its base
     * @throws CyclicReferenceException    if expressions reference each other in a loop
     * @throws ReductionInvariantException if a reduced body still names an expression, its own
     *                                     name included
     */
    public static Reduction reduce(NameRegistry registry, List<NamedExpression> expressions, String source) {
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(expressions, "expressions must not be null");

        Map<String, List<Token>> working = new LinkedHashMap<>();
        for (NamedExpression expression : expressions) {
            List<Token> tokens = ExpressionTokenizer.tokenize(expression.definition());
            rejectQualifiedExpressionReferences(registry, expression.name(), tokens, source);
            working.put(expression.name(), tokens);
        }

        ReferenceGraph.build(registry, working).checkAcyclic(source);

        Set<String> composite = new LinkedHashSet<>();
        int passes = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            passes++;
            for (Map.Entry<String, List<Token>> entry : working.entrySet()) {
                List<Token> rewritten = substitute(registry, entry.getKey(), entry.getValue(), working, source);
                if (rewritten != null) {
                    entry.setValue(rewritten);
                    composite.add(entry.getKey());
                    changed = true;
                }
            }
        }
        LOG.debug("Reduced {} expressions in {} passes, composite={}", working.size(), passes, composite);

        List<NamedExpression> reduced = new ArrayList<>(expressions.size());
        for (NamedExpression expression : expressions) {
            List<Token> tokens = working.get(expression.name());
            verifyPrimitive(registry, expression.name(), tokens, source);
            String body = composite.contains(expression.name())
                    ? ExpressionTokenizer.render(tokens)
                    : expression.definition();
            reduced.add(new NamedExpression(expression.name(), body));
        }
        return new Reduction(reduced, composite, passes);
    }

    /** Returns the rewritten token list, or {@code null} if nothing was substituted. */
    private static List<Token> substitute(
            NameRegistry registry, String name, List<Token> tokens, Map<String, List<Token>> working, String source) {
        List<Token> rewritten = new ArrayList<>(tokens.size());
        boolean substituted = false;
        for (Token token : tokens) {
            if (token.type() != TokenType.IDENTIFIER
                    || !registry.isExpression(token.text())
                    || token.text().equals(name)) {
                rewritten.add(token);
                continue;
            }
            List<Token> body = working.get(token.text());
            if (body == null) {
                throw new ReductionInvariantException(
                        String.format("Expression \"%s\" references \"%s\", which has no body", name, token.text()),
                        source);
            }
            LOG.debug("Expression '{}': inlining '{}'", name, token.text());
            rewritten.add(Token.OPEN_PAREN);
            rewritten.addAll(body);
            rewritten.add(Token.CLOSE_PAREN);
            substituted = true;
        }
        return substituted ? rewritten : null;
    }

    private static void rejectQualifiedExpressionReferences(
            NameRegistry registry, String name, List<Token> tokens, String source) {
        for (Token token : tokens) {
            if (token.type() == TokenType.QUALIFIED_IDENTIFIER && registry.isExpression(token.baseName())) {
                throw new InvalidReferenceException(name, token.text(), source);
            }
        }
    }

    private static void verifyPrimitive(NameRegistry registry, String name, List<Token> tokens, String source) {
        for (Token token : tokens) {
            if (!token.isName() || !registry.isDefined(token.baseName()) || registry.isTask(token.baseName())) {
                continue;
            }
            throw new ReductionInvariantException(
                    String.format(
                            "Reduced expression \"%s\" still references expression \"%s\"", name, token.text()),
                    source);
        }
    }
}
