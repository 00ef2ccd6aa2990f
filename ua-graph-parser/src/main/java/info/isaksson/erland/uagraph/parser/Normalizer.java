package info.isaksson.erland.uagraph.parser;

import info.isaksson.erland.uagraph.model.NamespaceTable;
import info.isaksson.erland.uagraph.model.Node;
import info.isaksson.erland.uagraph.model.NodeId;
import info.isaksson.erland.uagraph.model.NodeIdLookup;
import info.isaksson.erland.uagraph.model.NodeRow;
import info.isaksson.erland.uagraph.model.NodeSetTables;
import info.isaksson.erland.uagraph.model.Reference;
import info.isaksson.erland.uagraph.model.ReferenceRow;
import info.isaksson.erland.uagraph.model.UaModel;
import info.isaksson.erland.uagraph.model.error.SchemaException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Replaces every identifier column with a dense surrogate id.
 *
 * <p>Ids are assigned column by column in first-seen order: NodeId, ParentNodeId, DataType,
 * MethodDeclarationId, then Src, Trg and ReferenceType of the references.</p>
 */
public final class Normalizer {

    private Normalizer() {}

    public static NodeSetTables normalize(List<NodeRow> nodeRows,
                                          List<ReferenceRow> referenceRows,
                                          NamespaceTable namespaces,
                                          List<UaModel> models) {
        NodeIdLookup.Builder lookup = NodeIdLookup.builder();

        Set<NodeId> declared = new LinkedHashSet<>();
        for (NodeRow r : nodeRows) {
            if (!declared.add(r.nodeId)) {
                throw new SchemaException("NodeId " + r.nodeId + " is declared more than once");
            }
            lookup.intern(r.nodeId);
        }
        internColumn(lookup, nodeRows, r -> r.parentNodeId);
        internColumn(lookup, nodeRows, r -> r.dataType);
        internColumn(lookup, nodeRows, r -> r.methodDeclarationId);
        internColumn(lookup, referenceRows, r -> r.src);
        internColumn(lookup, referenceRows, r -> r.trg);
        internColumn(lookup, referenceRows, r -> r.referenceType);

        List<Node> nodes = new ArrayList<>(nodeRows.size());
        for (NodeRow r : nodeRows) {
            nodes.add(new Node(
                    lookup.intern(r.nodeId),
                    r.nodeId,
                    r.nodeClass,
                    r.browseNameNamespace,
                    r.browseName,
                    r.displayName,
                    r.description,
                    r.value,
                    lookup.internOrNull(r.dataType),
                    lookup.internOrNull(r.parentNodeId),
                    lookup.internOrNull(r.methodDeclarationId),
                    r.attributes));
        }

        Set<Reference> references = new LinkedHashSet<>();
        for (ReferenceRow r : referenceRows) {
            references.add(new Reference(lookup.intern(r.src), lookup.intern(r.trg), lookup.intern(r.referenceType)));
        }
        return new NodeSetTables(nodes, new ArrayList<>(references), lookup.build(), namespaces, models);
    }

    private static <T> void internColumn(NodeIdLookup.Builder lookup, List<T> rows, Function<T, NodeId> column) {
        for (T row : rows) {
            lookup.internOrNull(column.apply(row));
        }
    }
}
