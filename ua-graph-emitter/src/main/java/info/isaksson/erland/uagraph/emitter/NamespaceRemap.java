package info.isaksson.erland.uagraph.emitter;

import info.isaksson.erland.uagraph.model.DataTypeField;
import info.isaksson.erland.uagraph.model.NamespaceTable;
import info.isaksson.erland.uagraph.model.Node;
import info.isaksson.erland.uagraph.model.NodeAttributes;
import info.isaksson.erland.uagraph.model.NodeId;
import info.isaksson.erland.uagraph.model.NodeIdLookup;
import info.isaksson.erland.uagraph.model.Reference;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Maps global namespace indices to the indices of a single written file.
 *
 * <p>Only namespaces the written rows actually use are kept. Index 0 stays the OPC UA namespace, the
 * serialized namespace becomes 1 and the others follow in global order.</p>
 */
public final class NamespaceRemap {

    private final Map<Integer, Integer> globalToLocal;
    private final List<String> uris;

    private NamespaceRemap(Map<Integer, Integer> globalToLocal, List<String> uris) {
        this.globalToLocal = globalToLocal;
        this.uris = uris;
    }

    public static NamespaceRemap compute(NamespaceTable namespaces,
                                         int serialized,
                                         NodeIdLookup lookup,
                                         Collection<Node> nodes,
                                         Collection<Reference> references) {
        TreeSet<Integer> inUse = new TreeSet<>();
        inUse.add(serialized);
        for (Node n : nodes) {
            inUse.add(n.namespace());
            inUse.add(n.browseNameNamespace);
            addNamespace(inUse, lookup, n.dataType);
            addNamespace(inUse, lookup, n.parentNodeId);
            addNamespace(inUse, lookup, n.methodDeclarationId);
            if (n.attributes instanceof NodeAttributes.DataTypeAttributes) {
                NodeAttributes.DataTypeAttributes dt = (NodeAttributes.DataTypeAttributes) n.attributes;
                if (dt.definition != null) {
                    for (DataTypeField f : dt.definition.fields) {
                        if (f.dataType != null) inUse.add(f.dataType.namespace);
                    }
                }
            }
        }
        for (Reference r : references) {
            addNamespace(inUse, lookup, r.src);
            addNamespace(inUse, lookup, r.trg);
            addNamespace(inUse, lookup, r.referenceType);
        }

        List<Integer> order = new ArrayList<>();
        order.add(0);
        if (serialized != 0) order.add(serialized);
        for (int ns : inUse) {
            if (ns != 0 && ns != serialized) order.add(ns);
        }

        Map<Integer, Integer> map = new LinkedHashMap<>();
        List<String> uris = new ArrayList<>();
        for (int global : order) {
            if (global >= namespaces.size()) {
                throw new IllegalArgumentException("Namespace index " + global + " is not in the namespace table " + namespaces);
            }
            map.put(global, uris.size());
            uris.add(namespaces.uri(global));
        }
        return new NamespaceRemap(Collections.unmodifiableMap(map), List.copyOf(uris));
    }

    private static void addNamespace(Collection<Integer> inUse, NodeIdLookup lookup, Integer id) {
        if (id == null) return;
        inUse.add(lookup.nodeId(id).namespace);
    }

    /** Namespace URIs of the written file in local index order, OPC UA first. */
    public List<String> uris() {
        return uris;
    }

    public int local(int globalNamespace) {
        Integer local = globalToLocal.get(globalNamespace);
        if (local == null) {
            throw new IllegalArgumentException("Namespace index " + globalNamespace + " is not in use by the written rows");
        }
        return local;
    }

    public NodeId apply(NodeId nodeId) {
        return nodeId.withNamespace(local(nodeId.namespace));
    }

    public Map<Integer, Integer> asMap() {
        return globalToLocal;
    }
}
