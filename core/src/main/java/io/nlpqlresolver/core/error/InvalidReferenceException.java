package io.nlpqlresolver.core.error;

/**
 * Thrown when an expression body uses a qualified reference ({@code Name.field}) whose base name
 * is another expression. Field access is only meaningful on task results.
 */
public final class InvalidReferenceException extends DefinitionInputException {

    private static final long serialVersionUID = 1L;

    private final String expressionName;
    private final String reference;

    public InvalidReferenceException(String expressionName, String reference, String source) {
        super(
                String.format(
                        "Expression \"%s\": qualified reference \"%s\" does not name a task",
                        expressionName, reference),
                source,
                Phase.REDUCE);
        this.expressionName = expressionName;
        this.reference = reference;
    }

    /** The expression whose body holds the bad reference. */
    public String expressionName() {
        return expressionName;
    }

    /** The offending qualified token text. */
    public String reference() {
        return reference;
    }
}
