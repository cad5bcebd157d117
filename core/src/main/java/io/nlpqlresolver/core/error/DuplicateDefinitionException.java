package io.nlpqlresolver.core.error;

/**
 * Thrown when a name is declared more than once, either twice in the same category or once as a
 * task and once as an expression.
 */
public final class DuplicateDefinitionException extends DefinitionInputException {

    private static final long serialVersionUID = 1L;

    /** Category of a declaration. */
    public enum Kind {
        TASK,
        EXPRESSION
    }

    private final String name;
    private final Kind firstKind;
    private final Kind secondKind;

    public DuplicateDefinitionException(String name, Kind firstKind, Kind secondKind, String source) {
        super(message(name, firstKind, secondKind), source, Phase.PARSE);
        this.name = name;
        this.firstKind = firstKind;
        this.secondKind = secondKind;
    }

    /** The name that was declared more than once. */
    public String name() {
        return name;
    }

    /** Category of the first declaration seen. */
    public Kind firstKind() {
        return firstKind;
    }

    /** Category of the conflicting declaration. */
    public Kind secondKind() {
        return secondKind;
    }

    /** {@code true} if the name was declared once as a task and once as an expression. */
    public boolean isCrossCategory() {
        return firstKind != secondKind;
    }

    private static String message(String name, Kind firstKind, Kind secondKind) {
        if (firstKind == secondKind) {
            return String.format("Multiple definitions for \"%s\"", name);
        }
        return String.format(
                "Multiple definitions for \"%s\": declared as both %s and %s",
                name, firstKind.name().toLowerCase(), secondKind.name().toLowerCase());
    }
}
