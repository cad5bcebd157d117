package io.nlpqlresolver.core.error;

/** Thrown when the definitions text holds no {@code context <identifier>;} statement. */
public final class MissingContextException extends DefinitionInputException {

    private static final long serialVersionUID = 1L;

    public MissingContextException(String source) {
        super("Context statement not found in " + source, source, Phase.PARSE);
    }
}
