package io.nlpqlresolver.core.error;

/**
 * Thrown when a task or expression is declared under a name that is not a plain identifier
 * ({@code [A-Za-z_$][A-Za-z0-9_$]*}). Such a name could never be matched as a single token in an
 * expression body.
 */
public final class InvalidNameException extends DefinitionInputException {

    private static final long serialVersionUID = 1L;

    private final String name;

    public InvalidNameException(String name, String source) {
        super(String.format("Declared name \"%s\" is not a valid identifier", name), source, Phase.PARSE);
        this.name = name;
    }

    /** The rejected name as written. */
    public String name() {
        return name;
    }
}
