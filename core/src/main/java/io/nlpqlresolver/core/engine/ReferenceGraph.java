package io.nlpqlresolver.core.engine;

import io.nlpqlresolver.core.error.CyclicReferenceException;
import io.nlpqlresolver.core.model.Token;
import io.nlpqlresolver.core.model.TokenType;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of expression-to-expression references, built from tokenized bodies. An edge
 * {@code A -> B} means the body of {@code A} names expression {@code B}. References to tasks are
 * not edges.
 *
 * <p>
 * A self-reference ({@code A} naming itself) is kept aside rather than treated as an edge: the
 * reducer leaves it in place. It only becomes a cycle once another expression would inline
 * {@code A}, because the copied body would name {@code A} again.
 */
final class ReferenceGraph {

    private enum Mark {
        VISITING,
        DONE
    }

    private final Map<String, Set<String>> edges;
    private final Set<String> selfReferencing;

    private ReferenceGraph(Map<String, Set<String>> edges, Set<String> selfReferencing) {
        this.edges = edges;
        this.selfReferencing = selfReferencing;
    }

    static ReferenceGraph build(NameRegistry registry, Map<String, List<Token>> bodies) {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        Set<String> selfReferencing = new LinkedHashSet<>();
        bodies.forEach((name, tokens) -> {
            Set<String> targets = new LinkedHashSet<>();
            for (Token token : tokens) {
                if (token.type() != TokenType.IDENTIFIER || !registry.isExpression(token.text())) {
                    continue;
                }
                if (token.text().equals(name)) {
                    selfReferencing.add(name);
                } else {
                    targets.add(token.text());
                }
            }
            edges.put(name, targets);
        });
        return new ReferenceGraph(edges, selfReferencing);
    }

    /** Expressions referenced by the given expression, self-reference excluded. */
    Set<String> references(String name) {
        return Collections.unmodifiableSet(edges.getOrDefault(name, Set.of()));
    }

    /** Expressions whose body names themselves. */
    Set<String> selfReferencing() {
        return Collections.unmodifiableSet(selfReferencing);
    }

    /**
     * Verifies that inlining terminates.
     *
     * @throws CyclicReferenceException on the first cycle found, scanning in declaration order
     */
    void checkAcyclic(String source) {
        for (Set<String> targets : edges.values()) {
            for (String target : targets) {
                if (selfReferencing.contains(target)) {
                    throw new CyclicReferenceException(List.of(target, target), source);
                }
            }
        }

        Map<String, Mark> marks = new HashMap<>();
        for (String root : edges.keySet()) {
            if (!marks.containsKey(root)) {
                visit(root, marks, source);
            }
        }
    }

    // iterative; reference chains may be arbitrarily deep
    private void visit(String root, Map<String, Mark> marks, String source) {
        Deque<Frame> stack = new ArrayDeque<>();
        List<String> path = new ArrayList<>();
        marks.put(root, Mark.VISITING);
        path.add(root);
        stack.push(new Frame(root, edges.getOrDefault(root, Set.of()).iterator()));
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.targets().hasNext()) {
                stack.pop();
                path.remove(path.size() - 1);
                marks.put(frame.name(), Mark.DONE);
                continue;
            }
            String target = frame.targets().next();
            Mark mark = marks.get(target);
            if (mark == Mark.DONE) {
                continue;
            }
            if (mark == Mark.VISITING) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(target), path.size()));
                cycle.add(target);
                throw new CyclicReferenceException(cycle, source);
            }
            marks.put(target, Mark.VISITING);
            path.add(target);
            stack.push(new Frame(target, edges.getOrDefault(target, Set.of()).iterator()));
        }
    }

    private record Frame(String name, Iterator<String> targets) {}
}
