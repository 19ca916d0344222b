package info.isaksson.erland.svtofsm.validate;

import info.isaksson.erland.svtofsm.model.Fsm;
import info.isaksson.erland.svtofsm.model.FsmState;
import info.isaksson.erland.svtofsm.model.FsmTransition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Graph queries over the transition relation of an {@link Fsm}. */
public final class FsmGraph {

    private FsmGraph() {}

    /** States reachable from {@code start} (inclusive), in breadth-first order. */
    public static Set<String> reachableFrom(Fsm fsm, String start) {
        if (fsm == null) throw new IllegalArgumentException("fsm is null");
        Set<String> reachable = new LinkedHashSet<>();
        if (start == null) return reachable;

        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!reachable.add(current)) continue;
            for (FsmTransition t : fsm.transitions) {
                if (t.from.equals(current) && !reachable.contains(t.to)) {
                    queue.add(t.to);
                }
            }
        }
        return reachable;
    }

    /** True when every state can be reached from the reset state; false without a reset state. */
    public static boolean isStronglyConnected(Fsm fsm) {
        if (fsm == null) throw new IllegalArgumentException("fsm is null");
        if (fsm.resetState == null) return false;
        return reachableFrom(fsm, fsm.resetState).size() == fsm.states.size();
    }

    /**
     * Cycles found by a depth-first search over the non-self-loop edges, started from each unvisited
     * state in declaration order. Each cycle is closed, i.e. its last element repeats the first.
     */
    public static List<List<String>> findCycles(Fsm fsm) {
        if (fsm == null) throw new IllegalArgumentException("fsm is null");

        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (FsmState s : fsm.states) {
            adjacency.put(s.name, new ArrayList<>());
        }
        for (FsmTransition t : fsm.transitions) {
            if (t.isSelfLoop) continue;
            List<String> next = adjacency.get(t.from);
            if (next != null) next.add(t.to);
        }

        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (FsmState s : fsm.states) {
            if (!visited.contains(s.name)) {
                dfs(s.name, adjacency, visited, new HashSet<>(), new ArrayList<>(), cycles);
            }
        }
        return cycles;
    }

    private static void dfs(String state, Map<String, List<String>> adjacency, Set<String> visited,
                            Set<String> onStack, List<String> path, List<List<String>> cycles) {
        visited.add(state);
        onStack.add(state);
        path.add(state);

        for (String next : adjacency.getOrDefault(state, List.of())) {
            if (!visited.contains(next)) {
                dfs(next, adjacency, visited, onStack, path, cycles);
            } else if (onStack.contains(next)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                cycles.add(cycle);
            }
        }

        path.remove(path.size() - 1);
        onStack.remove(state);
    }
}
