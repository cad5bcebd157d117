package io.nlpqlresolver.core.error;

/**
 * Abstract base for all resolver exceptions. Never thrown directly: user-input problems are
 * reported through the subclasses of {@link DefinitionInputException}, reducer defects through
 * {@link ReductionInvariantException}.
 */
public abstract class DefinitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Stage of resolution in which the error occurred. */
    public enum Phase {
        READ,
        PARSE,
        REDUCE
    }

    private final String source;
    private final Phase phase;

    protected DefinitionException(String message, String source, Phase phase) {
        super(message);
        this.source = source;
        this.phase = phase;
    }

    protected DefinitionException(String message, Throwable cause, String source, Phase phase) {
        super(message, cause);
        this.source = source;
        this.phase = phase;
    }

    /** The file path or source label of the definitions text, never {@code null}. */
    public String source() {
        return source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
