package info.isaksson.erland.uagraph.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Consolidated result of parsing one or more NodeSet2 files: normalized Nodes and References,
 * the surrogate lookup, the namespace table and the per-file models.
 *
 * <p>Instances are immutable; derived states are new instances.</p>
 */
public final class NodeSetTables {
    public final List<Node> nodes;
    public final List<Reference> references;
    public final NodeIdLookup lookup;
    public final NamespaceTable namespaces;
    public final List<UaModel> models;

    private Map<Integer, Node> nodesById;

    public NodeSetTables(List<Node> nodes,
                         List<Reference> references,
                         NodeIdLookup lookup,
                         NamespaceTable namespaces,
                         List<UaModel> models) {
        this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
        this.references = references == null ? List.of() : List.copyOf(references);
        this.lookup = Objects.requireNonNull(lookup, "lookup");
        this.namespaces = Objects.requireNonNull(namespaces, "namespaces");
        this.models = models == null ? List.of() : List.copyOf(models);
    }

    public NodeSetTables withNodes(List<Node> newNodes) {
        return new NodeSetTables(newNodes, references, lookup, namespaces, models);
    }

    public NodeSetTables withReferences(List<Reference> newReferences) {
        return new NodeSetTables(nodes, newReferences, lookup, namespaces, models);
    }

    /** @return the node with surrogate {@code id}, or null */
    public synchronized Node node(int id) {
        if (nodesById == null) {
            Map<Integer, Node> m = new HashMap<>();
            for (Node n : nodes) m.put(n.id, n);
            nodesById = m;
        }
        return nodesById.get(id);
    }

    public NodeRow denormalize(Node n) {
        return new NodeRow(
                n.nodeId,
                n.nodeClass,
                n.browseNameNamespace,
                n.browseName,
                n.displayName,
                n.description,
                n.value,
                lookup.nodeIdOrNull(n.dataType),
                lookup.nodeIdOrNull(n.parentNodeId),
                lookup.nodeIdOrNull(n.methodDeclarationId),
                n.attributes);
    }

    public ReferenceRow denormalize(Reference r) {
        return new ReferenceRow(lookup.nodeId(r.src), lookup.nodeId(r.trg), lookup.nodeId(r.referenceType));
    }

    public List<NodeRow> denormalizedNodes() {
        List<NodeRow> out = new ArrayList<>(nodes.size());
        for (Node n : nodes) out.add(denormalize(n));
        out.sort(NodeRow.BY_NODE_ID);
        return out;
    }

    public List<ReferenceRow> denormalizedReferences() {
        List<ReferenceRow> out = new ArrayList<>(references.size());
        for (Reference r : references) out.add(denormalize(r));
        out.sort(ReferenceRow.ORDER);
        return out;
    }
}
