package io.nlpqlresolver.core.error;

/** Thrown when a definitions file is missing or cannot be read. */
public final class DefinitionReadException extends DefinitionInputException {

    private static final long serialVersionUID = 1L;

    public DefinitionReadException(String message, String source) {
        super(message, source, Phase.READ);
    }

    public DefinitionReadException(String message, Throwable cause, String source) {
        super(message, cause, source, Phase.READ);
    }
}
