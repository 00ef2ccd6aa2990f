package info.isaksson.erland.uagraph.navigation;

import info.isaksson.erland.uagraph.model.Node;
import info.isaksson.erland.uagraph.model.NodeClass;
import info.isaksson.erland.uagraph.model.NodeId;
import info.isaksson.erland.uagraph.model.Reference;
import info.isaksson.erland.uagraph.model.error.AmbiguousLookupException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reference subsets defined by the reference-type taxonomy of a type library.
 *
 * <p>Filters by an abstract category (hierarchical, has-property, ...) include every subtype of that
 * category. {@code HasSubtype} and {@code HasTypeDefinition} are matched exactly.</p>
 */
public final class ReferenceFilters {

    private final List<Node> typeNodes;
    private final TypeHierarchy hierarchy;

    public ReferenceFilters(List<Node> typeNodes, List<Reference> typeReferences) {
        this(typeNodes, typeReferences, ClosureOptions.defaults());
    }

    public ReferenceFilters(List<Node> typeNodes, List<Reference> typeReferences, ClosureOptions options) {
        if (typeNodes == null) throw new IllegalArgumentException("typeNodes must not be null");
        if (typeReferences == null) throw new IllegalArgumentException("typeReferences must not be null");
        this.typeNodes = typeNodes;
        this.hierarchy = TypeHierarchy.build(typeNodes, typeReferences, options);
    }

    public TypeHierarchy hierarchy() {
        return hierarchy;
    }

    public int referenceType(String browseName) {
        return ReferenceTypes.resolve(typeNodes, browseName);
    }

    /** References whose type is one of {@code allowedTypes} or a subtype of one. */
    public List<Reference> constrainToReferenceType(Collection<Reference> references, Collection<Integer> allowedTypes) {
        Set<Integer> allowed = hierarchy.subtypeIds(allowedTypes);
        List<Reference> out = new ArrayList<>();
        for (Reference r : references) {
            if (allowed.contains(r.referenceType)) out.add(r);
        }
        return out;
    }

    public List<Reference> hasSubtype(Collection<Reference> references) {
        return exactly(references, referenceType(ReferenceTypes.HAS_SUBTYPE));
    }

    public List<Reference> hasTypeDefinition(Collection<Reference> references) {
        return exactly(references, referenceType(ReferenceTypes.HAS_TYPE_DEFINITION));
    }

    public List<Reference> hasProperty(Collection<Reference> references) {
        return constrained(references, ReferenceTypes.HAS_PROPERTY);
    }

    public List<Reference> hasModellingRule(Collection<Reference> references) {
        return constrained(references, ReferenceTypes.HAS_MODELLING_RULE);
    }

    public List<Reference> hierarchical(Collection<Reference> references) {
        return constrained(references, ReferenceTypes.HIERARCHICAL_REFERENCES);
    }

    public List<Reference> nonHierarchical(Collection<Reference> references) {
        return constrained(references, ReferenceTypes.NON_HIERARCHICAL_REFERENCES);
    }

    /** Hierarchical references pointing at instance declarations. */
    public List<Reference> hierarchicalTrgHasModellingRule(Collection<Reference> references) {
        Set<Integer> withRule = sources(hasModellingRule(references));
        List<Reference> out = new ArrayList<>();
        for (Reference r : hierarchical(references)) {
            if (withRule.contains(r.trg)) out.add(r);
        }
        return out;
    }

    /** Hierarchical references whose target has no modelling rule, e.g. method arguments to keep when instantiating. */
    public List<Reference> hierarchicalTrgHasNoModellingRule(Collection<Reference> references) {
        return withoutRuleTarget(hierarchical(references), references);
    }

    /** Non-hierarchical references that do not point at instance declarations. */
    public List<Reference> nonHierarchicalTrgHasNoModellingRule(Collection<Reference> references) {
        return withoutRuleTarget(nonHierarchical(references), references);
    }

    /** Instances typed by {@code BaseDataVariableType} or one of its subtypes. */
    public Set<Integer> signalVariables(Collection<Reference> instanceReferences) {
        return instancesOfVariableType(instanceReferences, "BaseDataVariableType");
    }

    /** Instances typed by {@code PropertyType} or one of its subtypes. */
    public Set<Integer> propertyVariables(Collection<Reference> instanceReferences) {
        return instancesOfVariableType(instanceReferences, "PropertyType");
    }

    /**
     * Closure of {@code constrainedReferences} restricted to pairs whose both ends are instances of
     * {@code interestingTypes} or their subtypes.
     */
    public List<IdPair> hierarchyBetweenInstancesOf(Collection<Reference> instanceReferences,
                                                    Collection<Reference> constrainedReferences,
                                                    Collection<Integer> interestingTypes) {
        Set<Integer> instances = instancesOf(instanceReferences, hierarchy.subtypeIds(interestingTypes));
        Set<IdPair> edges = new LinkedHashSet<>();
        for (Reference r : constrainedReferences) {
            if (r.src != r.trg) edges.add(new IdPair(r.src, r.trg));
        }
        List<IdPair> out = new ArrayList<>();
        for (IdPair p : TransitiveClosure.of(edges)) {
            if (instances.contains(p.src) && instances.contains(p.trg)) out.add(p);
        }
        return out;
    }

    /**
     * Pairs each variable of {@code kind} with its closest parent, as {@code (parent, variable)}.
     *
     * <p>Parents of signals are instances of {@code interestingTypes} or their subtypes. Parents of properties
     * may also be signals. Paths never pass through another such instance, or through a signal when looking
     * for property parents, so a nested instance hides its own variables from the instances above it.
     * Sorted by variable, signal parents first, then by parent.</p>
     */
    public List<IdPair> closestParents(Collection<Reference> instanceReferences,
                                       Collection<Integer> interestingTypes,
                                       VariableKind kind) {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        Set<Integer> instances = instancesOf(instanceReferences, hierarchy.subtypeIds(interestingTypes));
        List<Reference> kept = new ArrayList<>();
        for (Reference r : instanceReferences) {
            if (!instances.contains(r.trg)) kept.add(r);
        }
        Set<Integer> signals = signalVariables(kept);
        if (kind == VariableKind.PROPERTY) {
            kept.removeIf(r -> signals.contains(r.trg));
        }

        Set<IdPair> edges = new LinkedHashSet<>();
        for (Reference r : kept) {
            if (r.src != r.trg) edges.add(new IdPair(r.src, r.trg));
        }
        Set<Integer> variables = kind == VariableKind.SIGNAL ? signals : propertyVariables(kept);
        List<IdPair> out = new ArrayList<>();
        for (IdPair p : TransitiveClosure.of(edges)) {
            if (!variables.contains(p.trg)) continue;
            boolean parent = instances.contains(p.src) || (kind == VariableKind.PROPERTY && signals.contains(p.src));
            if (parent) out.add(p);
        }
        out.sort(Comparator.comparingInt((IdPair p) -> p.trg)
                .thenComparing(p -> !signals.contains(p.src))
                .thenComparingInt(p -> p.src));
        return out;
    }

    private Set<Integer> instancesOfVariableType(Collection<Reference> instanceReferences, String variableType) {
        Integer type = null;
        for (Node n : typeNodes) {
            if (n.nodeClass == NodeClass.VARIABLE_TYPE && n.browseName.equals(variableType)) {
                type = n.id;
                break;
            }
        }
        if (type == null) throw new AmbiguousLookupException("No VariableType has BrowseName " + variableType);
        return instancesOf(instanceReferences, hierarchy.subtypeIds(List.of(type)));
    }

    private Set<Integer> instancesOf(Collection<Reference> instanceReferences, Set<Integer> types) {
        Set<Integer> out = new HashSet<>();
        for (Reference r : hasTypeDefinition(instanceReferences)) {
            if (types.contains(r.trg)) out.add(r.src);
        }
        return out;
    }

    private List<Reference> withoutRuleTarget(List<Reference> candidates, Collection<Reference> references) {
        Set<Integer> withRule = sources(hasModellingRule(references));
        List<Reference> out = new ArrayList<>();
        for (Reference r : candidates) {
            if (!withRule.contains(r.trg)) out.add(r);
        }
        return out;
    }

    private List<Reference> constrained(Collection<Reference> references, String category) {
        return constrainToReferenceType(references, List.of(referenceType(category)));
    }

    private static List<Reference> exactly(Collection<Reference> references, int type) {
        List<Reference> out = new ArrayList<>();
        for (Reference r : references) {
            if (r.referenceType == type) out.add(r);
        }
        return out;
    }

    private static Set<Integer> sources(Collection<Reference> references) {
        Set<Integer> out = new HashSet<>();
        for (Reference r : references) out.add(r.src);
        return out;
    }

    /** @throws AmbiguousLookupException when no node has {@code nodeId} */
    public static int resolveIdFromNodeId(Collection<Node> nodes, NodeId nodeId) {
        for (Node n : nodes) {
            if (n.nodeId.equals(nodeId)) return n.id;
        }
        throw new AmbiguousLookupException("No node has NodeId " + nodeId);
    }

    /**
     * Ids of the nodes with the given browse names, in request order. Every name must match exactly one node.
     */
    public static List<Integer> resolveIdsFromBrowseNames(Collection<Node> nodes, List<String> browseNames) {
        List<Integer> out = new ArrayList<>(browseNames.size());
        for (String name : browseNames) {
            Integer found = null;
            for (Node n : nodes) {
                if (!n.browseName.equals(name)) continue;
                if (found != null) throw new AmbiguousLookupException("More than one node has BrowseName " + name);
                found = n.id;
            }
            if (found == null) throw new AmbiguousLookupException("No node has BrowseName " + name);
            out.add(found);
        }
        return out;
    }
}
