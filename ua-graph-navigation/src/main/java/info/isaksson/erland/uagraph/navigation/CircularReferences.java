package info.isaksson.erland.uagraph.navigation;

import info.isaksson.erland.uagraph.model.Reference;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.IntPredicate;

/**
 * Finds nodes that lie on a directed cycle of hierarchical references.
 *
 * <p>Only references with at least one endpoint in the namespace of interest are considered. A node is
 * circular when the closure holds both (a, b) and (b, a) for some b, or when it references itself.</p>
 */
public final class CircularReferences {

    private CircularReferences() {}

    /** @return ids of circular nodes, ascending */
    public static List<Integer> find(Collection<Reference> references,
                                     ReferenceFilters filters,
                                     IntPredicate inNamespace,
                                     ClosureOptions options) {
        Set<Integer> circular = new TreeSet<>();
        Set<IdPair> edges = new LinkedHashSet<>();
        for (Reference r : filters.hierarchical(references)) {
            if (!inNamespace.test(r.src) && !inNamespace.test(r.trg)) continue;
            if (r.src == r.trg) {
                circular.add(r.src);
            } else {
                edges.add(new IdPair(r.src, r.trg));
            }
        }
        Set<IdPair> closure = new LinkedHashSet<>(TransitiveClosure.compute(edges, options).pairs);
        for (IdPair p : closure) {
            if (closure.contains(new IdPair(p.trg, p.src))) circular.add(p.src);
        }
        return List.copyOf(circular);
    }
}
