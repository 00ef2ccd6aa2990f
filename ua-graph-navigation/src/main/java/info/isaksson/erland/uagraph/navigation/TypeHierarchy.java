package info.isaksson.erland.uagraph.navigation;

import info.isaksson.erland.uagraph.model.Node;
import info.isaksson.erland.uagraph.model.Reference;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reflexive-transitive closure of {@code HasSubtype}.
 *
 * <p>Every id that appears as an endpoint of the type references is its own subtype and supertype.</p>
 */
public final class TypeHierarchy {

    private final List<TypePair> closure;
    private final Map<Integer, List<Integer>> subtypes = new HashMap<>();
    private final Map<Integer, List<Integer>> supertypes = new HashMap<>();

    private TypeHierarchy(List<TypePair> closure) {
        this.closure = List.copyOf(closure);
        for (TypePair p : closure) {
            subtypes.computeIfAbsent(p.supertype, k -> new ArrayList<>()).add(p.subtype);
            supertypes.computeIfAbsent(p.subtype, k -> new ArrayList<>()).add(p.supertype);
        }
    }

    public static TypeHierarchy build(Collection<Node> typeNodes, Collection<Reference> typeReferences) {
        return build(typeNodes, typeReferences, ClosureOptions.defaults());
    }

    public static TypeHierarchy build(Collection<Node> typeNodes,
                                      Collection<Reference> typeReferences,
                                      ClosureOptions options) {
        int hasSubtype = ReferenceTypes.resolve(typeNodes, ReferenceTypes.HAS_SUBTYPE);
        Set<IdPair> edges = new LinkedHashSet<>();
        Set<Integer> endpoints = new LinkedHashSet<>();
        for (Reference r : typeReferences) {
            if (r.referenceType == hasSubtype) edges.add(new IdPair(r.src, r.trg));
        }
        for (Reference r : typeReferences) endpoints.add(r.src);
        for (Reference r : typeReferences) endpoints.add(r.trg);

        Set<TypePair> pairs = new HashSet<>();
        for (IdPair p : TransitiveClosure.compute(edges, options).pairs) {
            pairs.add(new TypePair(p.src, p.trg));
        }
        for (int id : endpoints) {
            pairs.add(new TypePair(id, id));
        }
        List<TypePair> sorted = new ArrayList<>(pairs);
        sorted.sort(TypePair.ORDER);
        return new TypeHierarchy(sorted);
    }

    /** All pairs, sorted by (supertype, subtype). */
    public List<TypePair> closure() {
        return closure;
    }

    /** Pairs whose supertype is one of {@code types}. */
    public List<TypePair> subtypesOf(Collection<Integer> types) {
        List<TypePair> out = new ArrayList<>();
        for (int t : new LinkedHashSet<>(types)) {
            for (int s : subtypes.getOrDefault(t, List.of())) out.add(new TypePair(t, s));
        }
        out.sort(TypePair.ORDER);
        return out;
    }

    /** Pairs whose subtype is one of {@code types}. */
    public List<TypePair> supertypesOf(Collection<Integer> types) {
        List<TypePair> out = new ArrayList<>();
        for (int t : new LinkedHashSet<>(types)) {
            for (int s : supertypes.getOrDefault(t, List.of())) out.add(new TypePair(s, t));
        }
        out.sort(TypePair.ORDER);
        return out;
    }

    /** {@code types} and everything derived from them. */
    public Set<Integer> subtypeIds(Collection<Integer> types) {
        Set<Integer> out = new HashSet<>();
        for (int t : types) out.addAll(subtypes.getOrDefault(t, List.of()));
        return out;
    }

    /** Number of strict supertypes of {@code type}; 0 for a root. */
    public int depth(int type) {
        List<Integer> s = supertypes.get(type);
        return s == null ? 0 : s.size() - 1;
    }
}
