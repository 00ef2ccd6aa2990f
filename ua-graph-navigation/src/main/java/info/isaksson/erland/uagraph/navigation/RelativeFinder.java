package info.isaksson.erland.uagraph.navigation;

import info.isaksson.erland.uagraph.model.Reference;
import info.isaksson.erland.uagraph.model.error.ClosureDivergenceException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Breadth-wise multi-hop traversal from a set of seeds.
 *
 * <p>Every hop joins the current frontier against the edges keyed on the frontier's end node. The result
 * holds one row per seed at hop 0 plus one row per node reached at each later hop. Without paths, rows
 * with the same seed, end and hop count collapse to one.</p>
 */
public final class RelativeFinder {

    private RelativeFinder() {}

    public static List<Relative> find(Collection<Integer> seeds,
                                      Collection<Reference> edges,
                                      Direction direction,
                                      Integer cutoff,
                                      boolean keepPaths) {
        if (seeds == null) throw new IllegalArgumentException("seeds must not be null");
        if (edges == null) throw new IllegalArgumentException("edges must not be null");
        if (direction == null) throw new IllegalArgumentException("direction must not be null");

        Map<Integer, List<Integer>> next = new HashMap<>();
        Set<Integer> endpoints = new HashSet<>();
        Set<Long> seenEdges = new HashSet<>();
        for (Reference r : edges) {
            int from = direction == Direction.DESCENDANT ? r.src : r.trg;
            int to = direction == Direction.DESCENDANT ? r.trg : r.src;
            endpoints.add(from);
            endpoints.add(to);
            if (seenEdges.add(((long) from << 32) | (to & 0xffffffffL))) {
                next.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
            }
        }

        List<Relative> result = new ArrayList<>();
        List<Relative> frontier = new ArrayList<>();
        for (int s : new LinkedHashSet<>(seeds)) {
            Relative r = new Relative(s, s, 0, keepPaths ? List.of(s) : List.of());
            frontier.add(r);
            result.add(r);
        }

        int hop = 1;
        while (!frontier.isEmpty() && (cutoff == null || hop <= cutoff)) {
            if (cutoff == null && hop > endpoints.size()) {
                throw new ClosureDivergenceException("Traversal still growing after " + (hop - 1)
                        + " hops over " + endpoints.size() + " nodes; the edges contain a cycle");
            }
            Map<Object, Relative> reached = new LinkedHashMap<>();
            for (Relative r : frontier) {
                for (int to : next.getOrDefault(r.end, List.of())) {
                    if (keepPaths) {
                        List<Integer> path = new ArrayList<>(r.path);
                        path.add(to);
                        reached.putIfAbsent(path, new Relative(r.seed, to, hop, path));
                    } else {
                        reached.putIfAbsent(List.of(r.seed, to), new Relative(r.seed, to, hop, List.of()));
                    }
                }
            }
            frontier = new ArrayList<>(reached.values());
            result.addAll(frontier);
            hop++;
        }
        return result;
    }
}
