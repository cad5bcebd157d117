package io.nlpqlresolver.core.error;

/**
 * Abstract parent for errors caused by the definitions text itself (or by the file that should
 * hold it). Resolution of the whole file is abandoned; no partial result is produced.
 */
public abstract class DefinitionInputException extends DefinitionException {

    private static final long serialVersionUID = 1L;

    protected DefinitionInputException(String message, String source, Phase phase) {
        super(message, source, phase);
    }

    protected DefinitionInputException(String message, Throwable cause, String source, Phase phase) {
        super(message, cause, source, phase);
    }
}
