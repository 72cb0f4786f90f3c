package org.pragmatica.y2e.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Reference graph over non-terminal names. An edge runs from a definition to every known
 * name it references directly; references to unknown names are dropped.
 *
 * <p>Node order is the insertion order of the map the graph was built from and is used
 * to make every result deterministic.
 */
public final class DependencyGraph {
    private final Map<String, Set<String>> successors;

    private DependencyGraph(Map<String, Set<String>> successors) {
        this.successors = successors;
    }

    public static DependencyGraph of(Map<String, ? extends Collection<String>> references) {
        var edges = new LinkedHashMap<String, Set<String>>();
        references.forEach((node, targets) -> {
            var known = new LinkedHashSet<String>();
            for (var target : targets) {
                if (references.containsKey(target)) {
                    known.add(target);
                }
            }
            edges.put(node, Collections.unmodifiableSet(known));
        });
        return new DependencyGraph(Collections.unmodifiableMap(edges));
    }

    public Set<String> nodes() {
        return successors.keySet();
    }

    public Set<String> successors(String node) {
        return successors.getOrDefault(node, Set.of());
    }

    /**
     * Whether {@code to} can be reached from {@code from} following at least one edge.
     */
    public boolean reaches(String from, String to) {
        Set<String> visited = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>(successors(from));
        while (!queue.isEmpty()) {
            var current = queue.poll();
            if (current.equals(to)) {
                return true;
            }
            if (visited.add(current)) {
                queue.addAll(successors(current));
            }
        }
        return false;
    }

    public boolean isRecursive(String node) {
        return reaches(node, node);
    }

    /**
     * A component is a recursive group if it has several members or its only member refers to itself.
     */
    public boolean isRecursiveGroup(List<String> component) {
        return component.size() > 1 || (component.size() == 1 && isRecursive(component.get(0)));
    }

    /**
     * Strongly connected components, dependencies first: no component has an edge to a component
     * listed after it. Members of a component keep node order.
     */
    public List<List<String>> components() {
        return new Tarjan().run();
    }

    // Tarjan emits a component only after every component reachable from it
    private final class Tarjan {
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowlink = new HashMap<>();
        private final Map<String, Integer> order = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<List<String>> components = new ArrayList<>();
        private int counter = 0;

        List<List<String>> run() {
            int position = 0;
            for (var node : successors.keySet()) {
                order.put(node, position++);
            }
            for (var node : successors.keySet()) {
                if (!index.containsKey(node)) {
                    visit(node);
                }
            }
            return Collections.unmodifiableList(components);
        }

        private void visit(String node) {
            index.put(node, counter);
            lowlink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);

            for (var next : successors(node)) {
                if (!index.containsKey(next)) {
                    visit(next);
                    lowlink.put(node, Math.min(lowlink.get(node), lowlink.get(next)));
                } else if (onStack.contains(next)) {
                    lowlink.put(node, Math.min(lowlink.get(node), index.get(next)));
                }
            }

            if (lowlink.get(node).equals(index.get(node))) {
                var component = new ArrayList<String>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(node));
                component.sort(Comparator.comparing(order::get));
                components.add(List.copyOf(component));
            }
        }
    }
}
