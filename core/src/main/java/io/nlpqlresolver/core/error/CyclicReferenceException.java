package io.nlpqlresolver.core.error;

import java.util.List;

/**
 * Thrown when expressions reference each other in a cycle, which would make inlining
 * non-terminating. The cycle lists the names along the loop with the first name repeated at the
 * end, e.g. {@code [A, B, A]}.
 */
public final class CyclicReferenceException extends DefinitionInputException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public CyclicReferenceException(List<String> cycle, String source) {
        super("Cyclic expression references: " + String.join(" -> ", cycle), source, Phase.REDUCE);
        this.cycle = List.copyOf(cycle);
    }

    /** Names along the cycle, first name repeated at the end. */
    public List<String> cycle() {
        return cycle;
    }
}
