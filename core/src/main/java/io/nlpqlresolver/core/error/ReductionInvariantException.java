package io.nlpqlresolver.core.error;

/**
 * Thrown when a reduced expression still references a declared name that is not a task. This
 * signals a defect in the reducer (or a cycle that slipped past the reference check), not bad
 * input, and is therefore not a {@link DefinitionInputException}.
 */
public final class ReductionInvariantException extends DefinitionException {

    private static final long serialVersionUID = 1L;

    public ReductionInvariantException(String message, String source) {
        super(message, source, Phase.REDUCE);
    }
}
