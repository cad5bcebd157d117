package io.nlpqlresolver.core.engine;

import io.nlpqlresolver.core.config.ResolverConfig;
import io.nlpqlresolver.core.error.DefinitionInputException;
import io.nlpqlresolver.core.error.DefinitionReadException;
import io.nlpqlresolver.core.model.DefinitionFile;
import io.nlpqlresolver.core.model.ExtractedStatements;
import io.nlpqlresolver.core.model.NamedExpression;
import io.nlpqlresolver.core.spec.StatementExtractor;
import io.nlpqlresolver.core.spec.TextNormalizer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Entry point: turns a definitions text into a {@link DefinitionFile}.
 *
 * <p>
 * Stages, in order: {@link TextNormalizer}, {@link StatementExtractor}, {@link NameRegistry},
 * {@link ExpressionReducer}, {@link PrimitiveCollector}. Any failure aborts the whole file; no
 * partially resolved record is ever returned.
 *
 * <p>
 * Thread-safe: holds only its immutable {@link ResolverConfig}.
 */
public final class DefinitionResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DefinitionResolver.class);

    /** Error source used for definitions text that did not come from a file. */
    public static final String INLINE_SOURCE = "<inline>";

    private final ResolverConfig config;

    public DefinitionResolver() {
        this(ResolverConfig.defaults());
    }

    public DefinitionResolver(ResolverConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public ResolverConfig config() {
        return config;
    }

    /**
     * Reads and resolves a definitions file using the configured charset.
     *
     * @param path definitions file
     * @return the resolved file
     * @throws DefinitionReadException  if the file is missing or unreadable
     * @throws DefinitionInputException if the text is malformed
     */
    public DefinitionFile resolve(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        String text;
        try {
            text = Files.readString(path, config.charset());
        } catch (NoSuchFileException e) {
            throw new DefinitionReadException("Definitions file not found: " + source, e, source);
        } catch (IOException e) {
            throw new DefinitionReadException("Failed to read definitions file: " + source, e, source);
        }

        try {
            return resolve(text, source);
        } catch (DefinitionInputException e) {
            LOG.warn("Rejected definitions file {}: {}", source, e.getMessage());
            throw e;
        }
    }

    /** Resolves in-memory definitions text, reported as {@value #INLINE_SOURCE} in errors. */
    public DefinitionFile resolve(String text) {
        return resolve(text, INLINE_SOURCE);
    }

    /**
     * Resolves definitions text.
     *
     * @param text   the definitions text
     * @param source file path or label used in error messages and logs
     * @return the resolved file
     */
    public DefinitionFile resolve(String text, String source) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(source, "source must not be null");

        String normalized = TextNormalizer.normalize(text);
        ExtractedStatements statements = StatementExtractor.extract(normalized, source);
        NameRegistry registry = NameRegistry.of(statements, source);

        ExpressionReducer.Reduction reduction =
                ExpressionReducer.reduce(registry, statements.expressions(), source);
        List<NamedExpression> reduced = reduction.reducedExpressions();

        DefinitionFile file = new DefinitionFile(
                statements.context(),
                registry.names(),
                registry.tasks(),
                statements.expressions(),
                reduced,
                PrimitiveCollector.collect(registry, reduced, source),
                statements.finalNames(),
                reduction.compositeNames());

        LOG.debug(
                "Resolved {}: context={}, tasks={}, expressions={}, primitives={}, passes={}",
                source,
                file.context(),
                file.tasks().size(),
                file.expressions().size(),
                file.primitives(),
                reduction.passes());
        dump(file, source);
        return file;
    }

    private void dump(DefinitionFile file, String source) {
        Level level = config.trace() ? Level.INFO : Level.DEBUG;
        if (!LOG.isEnabledForLevel(level)) {
            return;
        }
        LOG.atLevel(level).log("File data after expression reduction ({}):", source);
        LOG.atLevel(level).log("    context: {}", file.context());
        LOG.atLevel(level).log(" task_names: {}", file.tasks());
        LOG.atLevel(level).log("      names: {}", file.names());
        LOG.atLevel(level).log(" primitives: {}", file.primitives());
        if (file.expressions().isEmpty()) {
            LOG.atLevel(level).log("expressions: none found");
            return;
        }
        for (int i = 0; i < file.expressions().size(); i++) {
            NamedExpression original = file.expressions().get(i);
            LOG.atLevel(level)
                    .log(
                            "{}{}: original: {} | reduced: {}",
                            original.name(),
                            file.isFinal(original.name()) ? " (final)" : "",
                            original.definition(),
                            file.reducedExpressions().get(i).definition());
        }
    }
}
