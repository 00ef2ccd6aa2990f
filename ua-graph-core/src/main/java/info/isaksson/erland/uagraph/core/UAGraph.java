package info.isaksson.erland.uagraph.core;

import info.isaksson.erland.uagraph.emitter.NodeSetWriter;
import info.isaksson.erland.uagraph.emitter.WriteOptions;
import info.isaksson.erland.uagraph.model.NamespaceTable;
import info.isaksson.erland.uagraph.model.Node;
import info.isaksson.erland.uagraph.model.NodeClass;
import info.isaksson.erland.uagraph.model.NodeId;
import info.isaksson.erland.uagraph.model.NodeRow;
import info.isaksson.erland.uagraph.model.NodeSetTables;
import info.isaksson.erland.uagraph.model.Reference;
import info.isaksson.erland.uagraph.model.ReferenceRow;
import info.isaksson.erland.uagraph.model.TableJson;
import info.isaksson.erland.uagraph.model.UaModel;
import info.isaksson.erland.uagraph.model.error.AmbiguousLookupException;
import info.isaksson.erland.uagraph.model.error.ReferentialIntegrityException;
import info.isaksson.erland.uagraph.model.error.SchemaException;
import info.isaksson.erland.uagraph.navigation.CircularReferences;
import info.isaksson.erland.uagraph.navigation.ClosureOptions;
import info.isaksson.erland.uagraph.navigation.Direction;
import info.isaksson.erland.uagraph.navigation.InstanceDeclaration;
import info.isaksson.erland.uagraph.navigation.InstanceDeclarations;
import info.isaksson.erland.uagraph.navigation.ReferenceFilters;
import info.isaksson.erland.uagraph.navigation.ReferenceTypes;
import info.isaksson.erland.uagraph.navigation.Relative;
import info.isaksson.erland.uagraph.navigation.RelativeFinder;
import info.isaksson.erland.uagraph.parser.NamespaceTableBuilder;
import info.isaksson.erland.uagraph.parser.NodeSetParser;
import info.isaksson.erland.uagraph.parser.ParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Entry point to a set of parsed NodeSet2 files: lookups, navigation, enum handling and serialization.
 *
 * <p>A graph is immutable. Operations that derive a new state (enum transformation, reference removal)
 * return a new graph or new rows and leave this one untouched.</p>
 */
public final class UAGraph {

    private static final Logger log = LoggerFactory.getLogger(UAGraph.class);

    private final NodeSetTables tables;
    private final ClosureOptions closureOptions;
    private ReferenceFilters filters;

    /**
     * Wrap already parsed tables.
     *
     * @throws ReferentialIntegrityException when a reference points at an undeclared node
     */
    public UAGraph(NodeSetTables tables) {
        this(tables, ClosureOptions.defaults());
    }

    public UAGraph(NodeSetTables tables, ClosureOptions closureOptions) {
        if (tables == null) throw new IllegalArgumentException("tables must not be null");
        this.tables = tables;
        this.closureOptions = closureOptions == null ? ClosureOptions.defaults() : closureOptions;
        checkReferentialIntegrity(tables);
    }

    // ---------------------------------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------------------------------

    /** Parse every NodeSet2 file of {@code directory}. */
    public static UAGraph fromPath(Path directory) throws IOException {
        return fromPath(directory, new ParseOptions());
    }

    /**
     * Parse every NodeSet2 file of {@code directory}, placing namespaces at the given indices.
     * Files that declare none of the given namespaces are skipped.
     */
    public static UAGraph fromPath(Path directory, Map<Integer, String> namespaceIndices) throws IOException {
        return fromPath(directory, ParseOptions.withNamespaces(NamespaceTableBuilder.fromIndexMap(namespaceIndices)));
    }

    public static UAGraph fromPath(Path directory, ParseOptions options) throws IOException {
        if (directory == null) throw new IllegalArgumentException("directory must not be null");
        return of(new NodeSetParser().parseDirectory(directory, options));
    }

    public static UAGraph fromFileList(List<Path> files) throws IOException {
        return fromFileList(files, new ParseOptions());
    }

    public static UAGraph fromFileList(List<Path> files, Map<Integer, String> namespaceIndices) throws IOException {
        return fromFileList(files, ParseOptions.withNamespaces(NamespaceTableBuilder.fromIndexMap(namespaceIndices)));
    }

    public static UAGraph fromFileList(List<Path> files, ParseOptions options) throws IOException {
        return of(new NodeSetParser().parseFiles(files, options));
    }

    /** Validate {@code tables} and apply the enum transformation when the graph declares {@code Enumeration}. */
    public static UAGraph of(NodeSetTables tables) {
        UAGraph graph = new UAGraph(tables);
        if (EnumTransformer.enumerationDataType(tables.nodes) == null) {
            log.debug("Graph declares no Enumeration DataType, values kept as parsed");
            return graph;
        }
        return graph.transformIntsToEnums();
    }

    private static void checkReferentialIntegrity(NodeSetTables tables) {
        Set<Integer> ids = new HashSet<>();
        for (Node n : tables.nodes) ids.add(n.id);
        List<String> problems = new ArrayList<>();
        for (Reference r : tables.references) {
            if (ids.contains(r.src) && ids.contains(r.trg)) continue;
            problems.add(describe(tables, r.referenceType) + " from " + describe(tables, r.src)
                    + " to " + describe(tables, r.trg));
        }
        if (!problems.isEmpty()) {
            throw new ReferentialIntegrityException("References point at nodes that are not in the graph: "
                    + String.join("; ", problems));
        }
    }

    private static String describe(NodeSetTables tables, int id) {
        Node n = tables.node(id);
        if (n == null) return "missing node " + tables.lookup.nodeId(id);
        return n.displayName + " (" + n.nodeId + ")";
    }

    // ---------------------------------------------------------------------------------------------
    // Tables
    // ---------------------------------------------------------------------------------------------

    public NodeSetTables tables() {
        return tables;
    }

    public List<Node> nodes() {
        return tables.nodes;
    }

    public List<Reference> references() {
        return tables.references;
    }

    public List<String> namespaces() {
        return tables.namespaces.uris();
    }

    public List<UaModel> models() {
        return tables.models;
    }

    /** @return the node with surrogate {@code id}, or null */
    public Node node(int id) {
        return tables.node(id);
    }

    public synchronized ReferenceFilters filters() {
        if (filters == null) filters = new ReferenceFilters(tables.nodes, tables.references, closureOptions);
        return filters;
    }

    public List<NodeRow> getDenormalizedNodes() {
        return tables.denormalizedNodes();
    }

    /** Nodes whose NodeId lives in {@code namespaceUri}, sorted by NodeId. */
    public List<NodeRow> getDenormalizedNodes(String namespaceUri) {
        int ns = tables.namespaces.requireIndex(namespaceUri);
        List<NodeRow> out = new ArrayList<>();
        for (NodeRow row : tables.denormalizedNodes()) {
            if (row.nodeId.namespace == ns) out.add(row);
        }
        return out;
    }

    public List<ReferenceRow> getDenormalizedReferences() {
        return tables.denormalizedReferences();
    }

    /** References with either endpoint in {@code namespaceUri}. */
    public List<ReferenceRow> getDenormalizedReferences(String namespaceUri) {
        int ns = tables.namespaces.requireIndex(namespaceUri);
        List<ReferenceRow> out = new ArrayList<>();
        for (ReferenceRow row : tables.denormalizedReferences()) {
            if (row.src.namespace == ns || row.trg.namespace == ns) out.add(row);
        }
        return out;
    }

    public TableJson.Snapshot snapshot() {
        return TableJson.snapshot(tables);
    }

    public void writeSnapshot(Path path) throws IOException {
        TableJson.write(snapshot(), path);
    }

    // ---------------------------------------------------------------------------------------------
    // Lookups
    // ---------------------------------------------------------------------------------------------

    public int referenceTypeByBrowseName(String browseName) {
        return ReferenceTypes.resolve(tables.nodes, browseName);
    }

    public int objectTypeByBrowseName(String browseName) {
        return unique(browseName, NodeClass.OBJECT_TYPE).id;
    }

    public int variableTypeByBrowseName(String browseName) {
        return unique(browseName, NodeClass.VARIABLE_TYPE).id;
    }

    public int dataTypeByBrowseName(String browseName) {
        return unique(browseName, NodeClass.DATA_TYPE).id;
    }

    public int objectByBrowseName(String browseName) {
        return unique(browseName, NodeClass.OBJECT).id;
    }

    /** NodeId of the single node called {@code browseName}, of any class. */
    public NodeId nodeIdByBrowseName(String browseName) {
        return unique(browseName, null).nodeId;
    }

    public NodeId nodeIdByBrowseName(String browseName, NodeClass nodeClass) {
        return unique(browseName, nodeClass).nodeId;
    }

    /** References of exactly the reference type called {@code referenceTypeBrowseName}. */
    public List<Reference> allReferencesOfType(String referenceTypeBrowseName) {
        int type = referenceTypeByBrowseName(referenceTypeBrowseName);
        List<Reference> out = new ArrayList<>();
        for (Reference r : tables.references) {
            if (r.referenceType == type) out.add(r);
        }
        return out;
    }

    private Node unique(String browseName, NodeClass nodeClass) {
        if (browseName == null) throw new IllegalArgumentException("browseName must not be null");
        Node found = null;
        int count = 0;
        for (Node n : tables.nodes) {
            if (nodeClass != null && n.nodeClass != nodeClass) continue;
            if (!n.browseName.equals(browseName)) continue;
            found = n;
            count++;
        }
        if (count != 1) {
            String what = nodeClass == null ? "node" : nodeClass.xmlTag().substring(2);
            throw new AmbiguousLookupException("Expected exactly one " + what + " with BrowseName "
                    + browseName + ", found " + count);
        }
        return found;
    }

    // ---------------------------------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------------------------------

    /** Distinct browse names of the nodes of {@code nodeClass}, optionally limited to one namespace index. */
    public List<String> getBrowseNamesForNodeClass(NodeClass nodeClass, Integer namespace) {
        if (nodeClass == null) throw new IllegalArgumentException("nodeClass must not be null");
        Set<String> out = new TreeSet<>();
        for (Node n : tables.nodes) {
            if (n.nodeClass != nodeClass) continue;
            if (namespace != null && n.namespace() != namespace) continue;
            out.add(n.browseName);
        }
        return List.copyOf(out);
    }

    public List<String> getBrowseNamesForNodeClass(NodeClass nodeClass) {
        return getBrowseNamesForNodeClass(nodeClass, null);
    }

    /** Node classes present in the graph. */
    public List<NodeClass> getNodeClasses() {
        Set<NodeClass> present = EnumSet.noneOf(NodeClass.class);
        for (Node n : tables.nodes) present.add(n.nodeClass);
        return List.copyOf(present);
    }

    /** Every {@code HasTypeDefinition} reference as an (instance, type) pair, ordered by instance NodeId. */
    public List<InstanceTypeInfo> getInstancesWithTypeInfo() {
        List<InstanceTypeInfo> out = new ArrayList<>();
        for (Reference r : filters().hasTypeDefinition(tables.references)) {
            out.add(new InstanceTypeInfo(tables.node(r.src), tables.node(r.trg)));
        }
        out.sort(Comparator.comparing((InstanceTypeInfo i) -> i.instance.nodeId).thenComparing(i -> i.type.nodeId));
        return out;
    }

    /** Objects whose type definition is exactly the ObjectType called {@code typeBrowseName}. */
    public List<Node> getObjectsOfType(String typeBrowseName) {
        int type = objectTypeByBrowseName(typeBrowseName);
        List<Node> out = new ArrayList<>();
        for (Reference r : filters().hasTypeDefinition(tables.references)) {
            if (r.trg != type) continue;
            Node n = tables.node(r.src);
            if (n.nodeClass == NodeClass.OBJECT) out.add(n);
        }
        out.sort(Comparator.comparing(n -> n.nodeId));
        return out;
    }

    public List<Neighbor> getNeighboringNodesById(int id, Relation relation) {
        if (relation == null) throw new IllegalArgumentException("relation must not be null");
        if (tables.node(id) == null) throw new IllegalArgumentException("No node with id " + id);
        List<Neighbor> out = new ArrayList<>();
        for (Reference r : tables.references) {
            int other;
            if (relation == Relation.OUTGOING && r.src == id) {
                other = r.trg;
            } else if (relation == Relation.INCOMING && r.trg == id) {
                other = r.src;
            } else {
                continue;
            }
            Node type = tables.node(r.referenceType);
            String typeName = type == null ? tables.lookup.nodeId(r.referenceType).toString() : type.browseName;
            out.add(new Neighbor(r, typeName, tables.node(other)));
        }
        out.sort(Comparator.comparing((Neighbor n) -> n.referenceTypeBrowseName).thenComparing(n -> n.node.nodeId));
        return out;
    }

    public List<Neighbor> getNeighboringNodesByBrowseName(String browseName, NodeClass nodeClass, Relation relation) {
        return getNeighboringNodesById(unique(browseName, nodeClass).id, relation);
    }

    /**
     * Every node reachable from the object {@code rootBrowseName} over references of exactly the given types,
     * with the browse names along the way joined by '/'. A node reached along several routes appears once per route.
     */
    public List<NodePath> createNodePathsByReferenceTypes(String rootBrowseName, List<String> referenceTypes) {
        if (referenceTypes == null || referenceTypes.isEmpty()) {
            throw new IllegalArgumentException("referenceTypes must not be empty");
        }
        int root = objectByBrowseName(rootBrowseName);
        Set<Integer> types = new HashSet<>();
        for (String name : referenceTypes) types.add(referenceTypeByBrowseName(name));
        List<Reference> edges = new ArrayList<>();
        for (Reference r : tables.references) {
            if (types.contains(r.referenceType)) edges.add(r);
        }

        List<NodePath> out = new ArrayList<>();
        for (Relative rel : RelativeFinder.find(List.of(root), edges, Direction.DESCENDANT, null, true)) {
            StringBuilder path = new StringBuilder();
            for (int id : rel.path) {
                if (path.length() > 0) path.append('/');
                path.append(tables.node(id).browseName);
            }
            out.add(new NodePath(rel.end, tables.lookup.nodeId(rel.end), path.toString()));
        }
        out.sort(Comparator.comparing((NodePath p) -> p.path).thenComparing(p -> p.nodeId));
        return out;
    }

    /** NodeIds of the nodes in {@code namespaceUri} that take part in a hierarchical cycle. */
    public List<NodeId> findCircularReferenceNodes(String namespaceUri) {
        int ns = tables.namespaces.requireIndex(namespaceUri);
        List<NodeId> out = new ArrayList<>();
        for (int id : CircularReferences.find(tables.references, filters(),
                i -> tables.lookup.nodeId(i).namespace == ns, closureOptions)) {
            out.add(tables.lookup.nodeId(id));
        }
        return out;
    }

    public List<InstanceDeclaration> fullyInheritedInstanceDeclarations(Collection<Integer> types) {
        return InstanceDeclarations.fullyInherited(types, tables.nodes, tables.references, closureOptions);
    }

    /** Instance declarations of the types with the given browse names; every name must match one type node. */
    public List<InstanceDeclaration> fullyInheritedInstanceDeclarationsByBrowseName(List<String> typeBrowseNames) {
        List<Node> typeNodes = new ArrayList<>();
        for (Node n : tables.nodes) {
            if (n.nodeClass.isType()) typeNodes.add(n);
        }
        return fullyInheritedInstanceDeclarations(ReferenceFilters.resolveIdsFromBrowseNames(typeNodes, typeBrowseNames));
    }

    /**
     * References kept when serializing {@code namespace} as a type library: those pointing into the namespace,
     * and every {@code HasModellingRule} and {@code HasTypeDefinition} reference.
     */
    public List<Reference> removeInstanceLevelOutgoingReferences(int namespace) {
        int hasModellingRule = referenceTypeByBrowseName(ReferenceTypes.HAS_MODELLING_RULE);
        int hasTypeDefinition = referenceTypeByBrowseName(ReferenceTypes.HAS_TYPE_DEFINITION);
        List<Reference> out = new ArrayList<>();
        for (Reference r : tables.references) {
            if (tables.lookup.nodeId(r.trg).namespace == namespace
                    || r.referenceType == hasModellingRule
                    || r.referenceType == hasTypeDefinition) {
                out.add(r);
            }
        }
        log.debug("Kept {} of {} references for namespace {}", out.size(), tables.references.size(), namespace);
        return out;
    }

    // ---------------------------------------------------------------------------------------------
    // Enumerations
    // ---------------------------------------------------------------------------------------------

    /** A graph whose enumeration-typed Int32 values carry their labels. */
    public UAGraph transformIntsToEnums() {
        return new UAGraph(EnumTransformer.transform(tables), closureOptions);
    }

    /**
     * Labels of the enumeration DataType {@code enumBrowseName}, title-cased and keyed by index.
     *
     * @throws UnsupportedOperationException when the enumeration is defined by {@code EnumValues}
     */
    public Map<Integer, String> getEnumDict(String enumBrowseName) {
        int type = dataTypeByBrowseName(enumBrowseName);
        Node definition = EnumTransformer.enumDefinition(tables, type);
        if (definition == null) {
            throw new SchemaException("DataType " + enumBrowseName + " has no EnumStrings or EnumValues property");
        }
        if (definition.browseName.equals(EnumTransformer.ENUM_VALUES)) {
            throw new UnsupportedOperationException("EnumValues encoding of " + enumBrowseName + " is not supported");
        }
        Map<Integer, String> out = new TreeMap<>();
        for (Map.Entry<Integer, String> e : EnumTransformer.labels(tables, type).entrySet()) {
            out.put(e.getKey(), titleCase(e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    public String getEnumString(String enumBrowseName, int value) {
        String label = getEnumDict(enumBrowseName).get(value);
        if (label == null) {
            throw new IllegalArgumentException("Could not find the value " + value + " in enumeration " + enumBrowseName);
        }
        return label;
    }

    /** Inverse of {@link #getEnumString}; line breaks are dropped and the label is title-cased before matching. */
    public int getEnumInt(String enumBrowseName, String label) {
        if (label == null) throw new IllegalArgumentException("label must not be null");
        String wanted = titleCase(label.replace("\r", "").replace("\n", "")).trim();
        for (Map.Entry<Integer, String> e : getEnumDict(enumBrowseName).entrySet()) {
            if (e.getValue().equals(wanted)) return e.getKey();
        }
        throw new IllegalArgumentException("Could not find the string " + label + " in enumeration " + enumBrowseName);
    }

    /** Upper-cases the first letter of every run of letters and lower-cases the rest. */
    static String titleCase(String s) {
        if (s == null) return null;
        StringBuilder sb = new StringBuilder(s.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousIsLetter = true;
            } else {
                sb.append(c);
                previousIsLetter = false;
            }
        }
        return sb.toString();
    }

    // ---------------------------------------------------------------------------------------------
    // Serialization
    // ---------------------------------------------------------------------------------------------

    public NodeSetWriter.Result writeNodeSet(Path outFile, String namespaceUri, WriteOptions options) throws IOException {
        if (options == null) options = WriteOptions.defaults();
        return NodeSetWriter.write(tablesForWriting(namespaceUri, options), namespaceUri, options, outFile);
    }

    public NodeSetWriter.Result writeNodeSetToString(String namespaceUri, WriteOptions options) {
        if (options == null) options = WriteOptions.defaults();
        return NodeSetWriter.writeToString(tablesForWriting(namespaceUri, options), namespaceUri, options);
    }

    private NodeSetTables tablesForWriting(String namespaceUri, WriteOptions options) {
        if (options.includeOutgoingInstanceLevelReferences) return tables;
        int ns = tables.namespaces.requireIndex(namespaceUri);
        return tables.withReferences(removeInstanceLevelOutgoingReferences(ns));
    }

    public NamespaceTable namespaceTable() {
        return tables.namespaces;
    }
}
