package info.isaksson.erland.uagraph.navigation;

import info.isaksson.erland.uagraph.model.Node;
import info.isaksson.erland.uagraph.model.NodeClass;
import info.isaksson.erland.uagraph.model.NodeId;
import info.isaksson.erland.uagraph.model.Reference;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Hand-built Nodes/References tables keyed by short names. */
final class GraphFixture {

    final List<Node> nodes = new ArrayList<>();
    final List<Reference> references = new ArrayList<>();
    private final Map<String, Integer> ids = new HashMap<>();

    /** Reference-type taxonomy, the modelling rules and BaseObjectType. */
    static GraphFixture withStandardTypes() {
        GraphFixture f = new GraphFixture();
        f.node("References", NodeClass.REFERENCE_TYPE);
        f.node("HasSubtype", NodeClass.REFERENCE_TYPE);
        f.subtype("HierarchicalReferences", NodeClass.REFERENCE_TYPE, "References");
        f.subtype("NonHierarchicalReferences", NodeClass.REFERENCE_TYPE, "References");
        f.subtype("HasChild", NodeClass.REFERENCE_TYPE, "HierarchicalReferences");
        f.subtype("Organizes", NodeClass.REFERENCE_TYPE, "HierarchicalReferences");
        f.ref("HasChild", "HasSubtype", "HasSubtype");
        f.subtype("Aggregates", NodeClass.REFERENCE_TYPE, "HasChild");
        f.subtype("HasComponent", NodeClass.REFERENCE_TYPE, "Aggregates");
        f.subtype("HasProperty", NodeClass.REFERENCE_TYPE, "Aggregates");
        f.subtype("HasTypeDefinition", NodeClass.REFERENCE_TYPE, "NonHierarchicalReferences");
        f.subtype("HasModellingRule", NodeClass.REFERENCE_TYPE, "NonHierarchicalReferences");
        f.node("BaseObjectType", NodeClass.OBJECT_TYPE);
        f.subtype("ModellingRuleType", NodeClass.OBJECT_TYPE, "BaseObjectType");
        for (String rule : List.of("Mandatory", "Optional", "OptionalPlaceholder", "MandatoryPlaceholder")) {
            f.node(rule, NodeClass.OBJECT);
            f.ref(rule, "HasTypeDefinition", "ModellingRuleType");
        }
        return f;
    }

    int node(String name, NodeClass nodeClass) {
        return node(name, name, nodeClass);
    }

    /** Adds a node whose lookup key differs from its BrowseName. */
    int node(String key, String browseName, NodeClass nodeClass) {
        if (ids.containsKey(key)) throw new IllegalArgumentException("duplicate key " + key);
        int id = nodes.size();
        nodes.add(new Node(id, NodeId.numeric(1, 1000 + id), nodeClass, 1, browseName, browseName, "",
                null, null, null, null, null));
        ids.put(key, id);
        return id;
    }

    /** Adds a node plus the HasSubtype reference from its supertype, which must exist already. */
    int subtype(String name, NodeClass nodeClass, String supertype) {
        int id = node(name, nodeClass);
        ref(supertype, "HasSubtype", name);
        return id;
    }

    void ref(String src, String referenceType, String trg) {
        references.add(new Reference(id(src), id(trg), id(referenceType)));
    }

    /** A member of {@code parent} with a modelling rule, or none when {@code rule} is null. */
    int member(String parent, String key, String browseName, String referenceType, String rule) {
        int id = node(key, browseName, NodeClass.VARIABLE);
        ref(parent, referenceType, key);
        if (rule != null) ref(key, "HasModellingRule", rule);
        return id;
    }

    int id(String key) {
        Integer id = ids.get(key);
        if (id == null) throw new IllegalArgumentException("unknown key " + key);
        return id;
    }
}
