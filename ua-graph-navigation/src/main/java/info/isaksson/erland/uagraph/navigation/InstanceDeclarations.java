package info.isaksson.erland.uagraph.navigation;

import info.isaksson.erland.uagraph.model.Node;
import info.isaksson.erland.uagraph.model.Reference;
import info.isaksson.erland.uagraph.model.error.EmptyInputException;
import info.isaksson.erland.uagraph.model.error.SchemaException;
import info.isaksson.erland.uagraph.model.error.UnknownTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the fully inherited instance-declaration tree of a set of types.
 *
 * <p>For each requested type the supertype chain is walked. Every supertype contributes the nodes reachable
 * through hierarchical references whose targets carry a modelling rule. When several types in the chain
 * declare the same BrowsePath, the most derived one wins. Declarations below a placeholder are templates
 * and are dropped.</p>
 */
public final class InstanceDeclarations {

    private static final Logger log = LoggerFactory.getLogger(InstanceDeclarations.class);

    static final Set<String> PLACEHOLDER_RULES = Set.of("OptionalPlaceholder", "MandatoryPlaceholder");

    /** Descending (type, index, browsePath, end); the first of each (type, browsePath) is kept. */
    private static final Comparator<Candidate> PRECEDENCE = Comparator
            .comparingInt((Candidate c) -> c.type)
            .thenComparingInt(c -> c.index)
            .thenComparing(c -> c.browsePath)
            .thenComparingInt(c -> c.end)
            .reversed();

    private InstanceDeclarations() {}

    public static List<InstanceDeclaration> fullyInherited(Collection<Integer> requestedTypes,
                                                           List<Node> typeNodes,
                                                           List<Reference> typeReferences) {
        return fullyInherited(requestedTypes, typeNodes, typeReferences, ClosureOptions.defaults());
    }

    public static List<InstanceDeclaration> fullyInherited(Collection<Integer> requestedTypes,
                                                           List<Node> typeNodes,
                                                           List<Reference> typeReferences,
                                                           ClosureOptions options) {
        if (typeNodes == null) throw new SchemaException("Type nodes table is missing");
        if (typeReferences == null) throw new SchemaException("Type references table is missing");
        if (requestedTypes == null || requestedTypes.isEmpty()) {
            throw new EmptyInputException("Called without any requested types");
        }
        if (typeNodes.isEmpty()) {
            throw new EmptyInputException("Called without any type-library nodes");
        }

        Map<Integer, Node> byId = new HashMap<>();
        Set<Integer> typeIds = new HashSet<>();
        for (Node n : typeNodes) {
            byId.put(n.id, n);
            if (n.nodeClass.isType()) typeIds.add(n.id);
        }
        Set<Integer> missing = new TreeSet<>();
        for (int t : requestedTypes) {
            if (!typeIds.contains(t)) missing.add(t);
        }
        if (!missing.isEmpty()) throw new UnknownTypeException(new ArrayList<>(missing));

        long start = System.nanoTime();
        ReferenceFilters filters = new ReferenceFilters(typeNodes, typeReferences, options);
        TypeHierarchy hierarchy = filters.hierarchy();
        List<Reference> declarationEdges = filters.hierarchicalTrgHasModellingRule(typeReferences);

        Map<Integer, List<String>> rules = new HashMap<>();
        for (Reference r : filters.hasModellingRule(typeReferences)) {
            Node rule = byId.get(r.trg);
            if (rule != null) rules.computeIfAbsent(r.src, k -> new ArrayList<>()).add(rule.browseName);
        }

        List<Candidate> candidates = new ArrayList<>();
        for (int type : new LinkedHashSet<>(requestedTypes)) {
            List<Integer> chain = supertypeChain(hierarchy, type);
            for (int index = 0; index < chain.size(); index++) {
                int supertype = chain.get(index);
                for (Relative r : RelativeFinder.find(List.of(supertype), declarationEdges, Direction.DESCENDANT, null, true)) {
                    candidates.add(candidate(type, index, supertype, r, byId, rules));
                }
            }
        }

        candidates.sort(PRECEDENCE);
        Set<String> seen = new HashSet<>();
        List<InstanceDeclaration> out = new ArrayList<>();
        for (Candidate c : candidates) {
            if (!seen.add(c.type + "\u0000" + c.browsePath)) continue;
            if (belowPlaceholder(c.rules)) continue;
            out.add(new InstanceDeclaration(c.end, c.browsePath, c.type, c.supertype, c.rules));
        }
        out.sort(Comparator.comparingInt((InstanceDeclaration d) -> d.typeId).thenComparing(d -> d.browsePath));
        log.debug("Built {} instance declarations for {} types in {} ms",
                out.size(), requestedTypes.size(), (System.nanoTime() - start) / 1_000_000);
        return out;
    }

    /** Supertypes of {@code type}, itself included, most general first. */
    static List<Integer> supertypeChain(TypeHierarchy hierarchy, int type) {
        List<Integer> chain = new ArrayList<>();
        for (TypePair p : hierarchy.supertypesOf(List.of(type))) chain.add(p.supertype);
        if (chain.isEmpty()) chain.add(type);
        chain.sort(Comparator.comparingInt(hierarchy::depth).thenComparingInt(Integer::intValue));
        return chain;
    }

    private static Candidate candidate(int type, int index, int supertype, Relative r,
                                       Map<Integer, Node> byId, Map<Integer, List<String>> rules) {
        List<String> names = new ArrayList<>();
        List<String> rulePath = new ArrayList<>();
        for (int position = 1; position <= r.hops; position++) {
            int id = r.at(position);
            Node n = byId.get(id);
            if (n == null) throw new SchemaException("Instance declaration " + id + " has no node row");
            names.add(n.browseName);
            rulePath.addAll(rules.getOrDefault(id, List.of()));
        }
        return new Candidate(type, index, supertype, r.end, String.join("/", names), rulePath);
    }

    /** Only a placeholder declared directly on the type survives; any longer rule path through one is a template. */
    static boolean belowPlaceholder(List<String> rulePath) {
        if (rulePath.size() <= 1) return false;
        for (String rule : rulePath) {
            if (PLACEHOLDER_RULES.contains(rule)) return true;
        }
        return false;
    }

    private static final class Candidate {
        final int type;
        final int index;
        final int supertype;
        final int end;
        final String browsePath;
        final List<String> rules;

        Candidate(int type, int index, int supertype, int end, String browsePath, List<String> rules) {
            this.type = type;
            this.index = index;
            this.supertype = supertype;
            this.end = end;
            this.browsePath = browsePath;
            this.rules = rules;
        }
    }
}
