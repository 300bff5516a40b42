package com.uimigrator.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;

/**
 * Finds dependency cycles with Tarjan's strongly connected components algorithm.
 *
 * <p>The traversal uses an explicit stack, so long dependency chains cannot overflow the call
 * stack. Only components with more than one member are reported; self-edges are never created
 * by the graph builder.
 */
public final class CycleDetector {

    private CycleDetector() {
        // Utility class
    }

    /**
     * Returns the cycles of a directed graph.
     *
     * @param adjacency node ID to the IDs it depends on, sorted for deterministic output
     * @return cycles, each sorted, ordered by their smallest ID
     */
    public static List<List<String>> findCycles(SortedMap<String, ? extends Set<String>> adjacency) {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        List<List<String>> cycles = new ArrayList<>();
        int counter = 0;

        for (String start : adjacency.keySet()) {
            if (index.containsKey(start)) {
                continue;
            }
            Deque<Frame> work = new ArrayDeque<>();
            work.push(new Frame(start, successors(adjacency, start)));
            index.put(start, counter);
            lowLink.put(start, counter);
            counter++;
            stack.push(start);
            onStack.add(start);

            while (!work.isEmpty()) {
                Frame frame = work.peek();
                if (frame.successors().hasNext()) {
                    String next = frame.successors().next();
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter);
                        counter++;
                        stack.push(next);
                        onStack.add(next);
                        work.push(new Frame(next, successors(adjacency, next)));
                    } else if (onStack.contains(next)) {
                        lowLink.put(frame.node(), Math.min(lowLink.get(frame.node()), index.get(next)));
                    }
                    continue;
                }

                work.pop();
                if (!work.isEmpty()) {
                    Frame parent = work.peek();
                    lowLink.put(parent.node(), Math.min(lowLink.get(parent.node()), lowLink.get(frame.node())));
                }
                if (lowLink.get(frame.node()).equals(index.get(frame.node()))) {
                    List<String> component = new ArrayList<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(frame.node()));
                    if (component.size() > 1) {
                        component.sort(Comparator.naturalOrder());
                        cycles.add(List.copyOf(component));
                    }
                }
            }
        }

        cycles.sort(Comparator.comparing(cycle -> cycle.get(0)));
        return cycles;
    }

    private static Iterator<String> successors(SortedMap<String, ? extends Set<String>> adjacency, String node) {
        Set<String> targets = adjacency.get(node);
        return targets == null ? List.<String>of().iterator() : targets.iterator();
    }

    private record Frame(String node, Iterator<String> successors) {}
}
