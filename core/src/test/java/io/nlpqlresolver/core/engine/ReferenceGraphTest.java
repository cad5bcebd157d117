package io.nlpqlresolver.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.nlpqlresolver.core.error.CyclicReferenceException;
import io.nlpqlresolver.core.model.Token;
import io.nlpqlresolver.core.spec.ExpressionTokenizer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReferenceGraphTest {

    private static ReferenceGraph graph(List<String> tasks, String... nameAndBody) {
        Map<String, List<Token>> bodies = new LinkedHashMap<>();
        for (int i = 0; i < nameAndBody.length; i += 2) {
            bodies.put(nameAndBody[i], ExpressionTokenizer.tokenize(nameAndBody[i + 1]));
        }
        NameRegistry registry = NameRegistry.of(tasks, List.copyOf(bodies.keySet()), "src");
        return ReferenceGraph.build(registry, bodies);
    }

    @Test
    void edgesOnlyPointAtExpressions() {
        ReferenceGraph graph = graph(List.of("X", "Y"), "A", "B AND X", "B", "Y OR Y.value > 2");

        assertThat(graph.references("A")).containsExactly("B");
        assertThat(graph.references("B")).isEmpty();
    }

    @Test
    void acyclicGraphPasses() {
        ReferenceGraph graph = graph(List.of("X"), "A", "B AND C", "B", "C", "C", "X");

        assertThatCode(() -> graph.checkAcyclic("src")).doesNotThrowAnyException();
    }

    @Test
    void twoNodeCycle() {
        ReferenceGraph graph = graph(List.of(), "A", "B", "B", "A");

        assertThatThrownBy(() -> graph.checkAcyclic("src"))
                .isInstanceOfSatisfying(
                        CyclicReferenceException.class, e -> assertThat(e.cycle()).containsExactly("A", "B", "A"));
    }

    @Test
    void cycleReportedWithoutLeadingPath() {
        ReferenceGraph graph = graph(List.of("X"), "Start", "A OR X", "A", "B", "B", "C", "C", "A");

        assertThatThrownBy(() -> graph.checkAcyclic("src"))
                .isInstanceOfSatisfying(
                        CyclicReferenceException.class,
                        e -> assertThat(e.cycle()).containsExactly("A", "B", "C", "A"));
    }

    @Test
    void selfReferenceIsNotAnEdge() {
        ReferenceGraph graph = graph(List.of("X"), "A", "A OR X");

        assertThat(graph.selfReferencing()).containsExactly("A");
        assertThat(graph.references("A")).isEmpty();
        assertThatCode(() -> graph.checkAcyclic("src")).doesNotThrowAnyException();
    }

    @Test
    void inliningASelfReferencingExpressionIsACycle() {
        ReferenceGraph graph = graph(List.of("X"), "A", "A OR X", "B", "A AND X");

        assertThatThrownBy(() -> graph.checkAcyclic("src"))
                .isInstanceOfSatisfying(
                        CyclicReferenceException.class, e -> assertThat(e.cycle()).containsExactly("A", "A"));
    }

    @Test
    void deepChainIsWalkedWithoutRecursion() {
        int depth = 100_000;
        String[] nameAndBody = new String[depth * 2];
        for (int i = 0; i < depth; i++) {
            nameAndBody[2 * i] = "E" + i;
            nameAndBody[2 * i + 1] = i + 1 < depth ? "E" + (i + 1) + " AND X" : "X";
        }
        ReferenceGraph graph = graph(List.of("X"), nameAndBody);

        assertThatCode(() -> graph.checkAcyclic("src")).doesNotThrowAnyException();
    }

    @Test
    void cycleAtTheEndOfADeepChain() {
        int depth = 100_000;
        String[] nameAndBody = new String[depth * 2];
        for (int i = 0; i < depth; i++) {
            nameAndBody[2 * i] = "E" + i;
            nameAndBody[2 * i + 1] = i + 1 < depth ? "E" + (i + 1) : "E" + (depth - 2);
        }
        ReferenceGraph graph = graph(List.of(), nameAndBody);

        assertThatThrownBy(() -> graph.checkAcyclic("src"))
                .isInstanceOfSatisfying(
                        CyclicReferenceException.class,
                        e -> assertThat(e.cycle())
                                .containsExactly("E" + (depth - 2), "E" + (depth - 1), "E" + (depth - 2)));
    }
}
