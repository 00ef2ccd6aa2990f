package info.isaksson.erland.uagraph.emitter;

import info.isaksson.erland.uagraph.model.DataTypeDefinition;
import info.isaksson.erland.uagraph.model.Node;
import info.isaksson.erland.uagraph.model.NodeAttributes;
import info.isaksson.erland.uagraph.model.NodeClass;
import info.isaksson.erland.uagraph.model.NodeId;
import info.isaksson.erland.uagraph.model.NodeSetTables;
import info.isaksson.erland.uagraph.model.Reference;
import info.isaksson.erland.uagraph.model.UaModel;
import info.isaksson.erland.uagraph.model.UaRequiredModel;
import info.isaksson.erland.uagraph.model.XmlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes the nodes of one namespace as a NodeSet2 document.
 *
 * <p>The written rows are the nodes whose NodeId lies in the namespace plus every reference touching them.
 * Namespace indices are renumbered through a {@link NamespaceRemap}. A reference is attached to its target
 * as an inverse reference when the target is written, and to its source otherwise, so that each
 * {@code <References>} block only describes locally declared nodes.</p>
 *
 * <p>Output is deterministic for fixed timestamps: nodes are ordered by NodeId, references by type and
 * the NodeId they point at.</p>
 */
public final class NodeSetWriter {

    private static final Logger log = LoggerFactory.getLogger(NodeSetWriter.class);

    public static final String UA_NODESET_NS = "http://opcfoundation.org/UA/2011/03/UANodeSet.xsd";
    static final String DEFAULT_MODEL_VERSION = "1.0.0";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private NodeSetWriter() {}

    /** In-memory result: the document plus what went into it. */
    public static final class Result {
        public final String xml;
        public final List<String> namespaceUris;
        public final int nodeCount;
        public final int referenceCount;
        public final List<NodeSetDiagnostic> warnings;

        Result(String xml, List<String> namespaceUris, int nodeCount, int referenceCount, List<NodeSetDiagnostic> warnings) {
            this.xml = xml;
            this.namespaceUris = List.copyOf(namespaceUris);
            this.nodeCount = nodeCount;
            this.referenceCount = referenceCount;
            this.warnings = warnings == null ? List.of() : warnings;
        }
    }

    public static Result write(NodeSetTables tables, String namespaceUri, WriteOptions options, Path outFile) throws IOException {
        if (outFile == null) {
            throw new IllegalArgumentException("outFile must not be null");
        }
        Result result = writeToString(tables, namespaceUri, options);

        Path parent = outFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outFile, result.xml, StandardCharsets.UTF_8);
        log.info("Wrote {} nodes of {} to {}", result.nodeCount, namespaceUri, outFile);
        return result;
    }

    /**
     * Serialize one namespace to a NodeSet2 string.
     *
     * @throws info.isaksson.erland.uagraph.model.error.ValidationException when value validation is enabled
     *         and a value disagrees with its DataType
     */
    public static Result writeToString(NodeSetTables tables, String namespaceUri, WriteOptions options) {
        if (tables == null) {
            throw new IllegalArgumentException("tables must not be null");
        }
        if (namespaceUri == null || namespaceUri.isBlank()) {
            throw new IllegalArgumentException("namespaceUri must not be blank");
        }
        if (options == null) options = WriteOptions.defaults();

        long start = System.nanoTime();
        int serialized = tables.namespaces.requireIndex(namespaceUri);

        List<Node> nodes = new ArrayList<>();
        Set<Integer> written = new HashSet<>();
        for (Node n : tables.nodes) {
            if (n.namespace() == serialized) {
                nodes.add(n);
                written.add(n.id);
            }
        }
        nodes.sort(Comparator.comparing((Node n) -> n.nodeId));

        List<Reference> references = new ArrayList<>();
        for (Reference r : tables.references) {
            if (written.contains(r.src) || written.contains(r.trg)) references.add(r);
        }

        if (options.validateValues) {
            ValueValidator.validate(tables, nodes);
        }

        NodeSetDiagnostics warnings = new NodeSetDiagnostics();
        NamespaceRemap remap = NamespaceRemap.compute(tables.namespaces, serialized, tables.lookup, nodes, references);
        Map<Integer, List<String>> referenceXml = referencesByOwner(tables, remap, references, written);

        StringBuilder sb = new StringBuilder(256 + nodes.size() * 256);
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        writeHeader(sb, tables, namespaceUri, remap, options, now, warnings);
        for (Node n : nodes) {
            writeNode(sb, tables, remap, n, referenceXml.getOrDefault(n.id, List.of()));
        }
        sb.append("</UANodeSet>\n");

        log.info("Generated NodeSet2 for {}: {} nodes, {} references, {} namespaces in {} ms",
                namespaceUri, nodes.size(), references.size(), remap.uris().size(),
                (System.nanoTime() - start) / 1_000_000);
        return new Result(sb.toString(), remap.uris(), nodes.size(), references.size(), warnings.toList());
    }

    private static Map<Integer, List<String>> referencesByOwner(NodeSetTables tables,
                                                               NamespaceRemap remap,
                                                               List<Reference> references,
                                                               Set<Integer> written) {
        List<Reference> sorted = new ArrayList<>(references);
        sorted.sort(Comparator
                .comparing((Reference r) -> tables.lookup.nodeId(r.referenceType))
                .thenComparing(r -> tables.lookup.nodeId(written.contains(r.trg) ? r.src : r.trg))
                .thenComparing(r -> tables.lookup.nodeId(r.src))
                .thenComparing(r -> tables.lookup.nodeId(r.trg)));

        Map<Integer, List<String>> out = new HashMap<>();
        for (Reference r : sorted) {
            String type = XmlText.escape(remap.apply(tables.lookup.nodeId(r.referenceType)).toString());
            if (written.contains(r.trg)) {
                String src = XmlText.escape(remap.apply(tables.lookup.nodeId(r.src)).toString());
                out.computeIfAbsent(r.trg, k -> new ArrayList<>())
                        .add("<Reference ReferenceType=\"" + type + "\" IsForward=\"false\">" + src + "</Reference>");
            } else {
                String trg = XmlText.escape(remap.apply(tables.lookup.nodeId(r.trg)).toString());
                out.computeIfAbsent(r.src, k -> new ArrayList<>())
                        .add("<Reference ReferenceType=\"" + type + "\">" + trg + "</Reference>");
            }
        }
        return out;
    }

    private static void writeHeader(StringBuilder sb,
                                    NodeSetTables tables,
                                    String namespaceUri,
                                    NamespaceRemap remap,
                                    WriteOptions options,
                                    OffsetDateTime now,
                                    NodeSetDiagnostics warnings) {
        OffsetDateTime lastModified = options.lastModified != null ? options.lastModified : now;
        sb.append("<?xml version=\"1.0\" encoding=\"utf-8\"?>\n");
        sb.append("<UANodeSet xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\"")
                .append(" xmlns:xsd=\"http://www.w3.org/2001/XMLSchema\"")
                .append(" LastModified=\"").append(lastModified.format(TIMESTAMP)).append('"')
                .append(" xmlns=\"").append(UA_NODESET_NS).append("\">\n");

        List<String> uris = remap.uris();
        if (uris.size() > 1) {
            sb.append("  <NamespaceUris>\n");
            for (int i = 1; i < uris.size(); i++) {
                sb.append("    <Uri>").append(XmlText.escape(uris.get(i))).append("</Uri>\n");
            }
            sb.append("  </NamespaceUris>\n");
        }

        UaModel parsed = null;
        for (UaModel m : tables.models) {
            if (m.modelUri.equals(namespaceUri)) parsed = m;
        }
        if (parsed == null) {
            warnings.report("model.missing", "No parsed model for namespace, using defaults", "modelUri", namespaceUri);
        }

        String version = options.newModelVersion;
        if (version == null) version = parsed != null && parsed.version != null ? parsed.version : DEFAULT_MODEL_VERSION;
        OffsetDateTime publicationDate = options.publicationDate;
        if (publicationDate == null) {
            publicationDate = parsed != null && parsed.publicationDate != null ? parsed.publicationDate : now;
        }

        sb.append("  <Models>\n");
        sb.append("    <Model ModelUri=\"").append(XmlText.escape(namespaceUri)).append('"')
                .append(" Version=\"").append(XmlText.escape(version)).append('"')
                .append(" PublicationDate=\"").append(publicationDate.format(TIMESTAMP)).append('"');
        List<UaRequiredModel> required = parsed == null ? List.of() : parsed.requiredModels;
        if (required.isEmpty()) {
            sb.append(" />\n");
        } else {
            sb.append(">\n");
            for (UaRequiredModel r : required) {
                sb.append("      <RequiredModel ModelUri=\"").append(XmlText.escape(r.modelUri)).append('"');
                if (r.version != null) sb.append(" Version=\"").append(XmlText.escape(r.version)).append('"');
                OffsetDateTime date = r.publicationDate != null ? r.publicationDate : now;
                sb.append(" PublicationDate=\"").append(date.format(TIMESTAMP)).append("\" />\n");
            }
            sb.append("    </Model>\n");
        }
        sb.append("  </Models>\n");
        sb.append("  <Aliases />\n");
    }

    private static void writeNode(StringBuilder sb,
                                  NodeSetTables tables,
                                  NamespaceRemap remap,
                                  Node n,
                                  List<String> references) {
        String tag = n.nodeClass.xmlTag();
        sb.append("  <").append(tag)
                .append(" NodeId=\"").append(XmlText.escape(remap.apply(n.nodeId).toString())).append('"')
                .append(" BrowseName=\"").append(XmlText.escape(browseName(remap, n))).append('"');
        if (n.attributes.symbolicName != null && !n.attributes.symbolicName.isEmpty()) {
            attribute(sb, "SymbolicName", n.attributes.symbolicName);
        }
        if (n.parentNodeId != null) attribute(sb, "ParentNodeId", remapped(tables, remap, n.parentNodeId));
        if (n.dataType != null) attribute(sb, "DataType", remapped(tables, remap, n.dataType));
        if (n.methodDeclarationId != null) {
            attribute(sb, "MethodDeclarationId", remapped(tables, remap, n.methodDeclarationId));
        }
        for (Map.Entry<String, String> a : n.attributes.xmlAttributes().entrySet()) {
            attribute(sb, a.getKey(), a.getValue());
        }
        sb.append(">\n");

        sb.append("    <DisplayName>").append(XmlText.escape(n.displayName)).append("</DisplayName>\n");
        if (!n.description.isEmpty()) {
            sb.append("    <Description>").append(XmlText.escape(n.description)).append("</Description>\n");
        }
        if (references.isEmpty()) {
            sb.append("    <References />\n");
        } else {
            sb.append("    <References>\n");
            for (String r : references) sb.append("      ").append(r).append('\n');
            sb.append("    </References>\n");
        }

        if (n.value != null && (n.nodeClass == NodeClass.VARIABLE || n.nodeClass == NodeClass.VARIABLE_TYPE)) {
            sb.append("    <Value>").append(n.value.encodeXml(true)).append("</Value>\n");
        }
        if (n.attributes instanceof NodeAttributes.DataTypeAttributes) {
            DataTypeDefinition definition = ((NodeAttributes.DataTypeAttributes) n.attributes).definition;
            if (definition != null) {
                sb.append("    ").append(definition.mapFieldDataTypes(remap::apply).encodeXml()).append('\n');
            }
        }
        if (n.attributes instanceof NodeAttributes.ReferenceTypeAttributes) {
            String inverseName = ((NodeAttributes.ReferenceTypeAttributes) n.attributes).inverseName;
            if (inverseName != null && !inverseName.isEmpty()) {
                sb.append("    <InverseName>").append(XmlText.escape(inverseName)).append("</InverseName>\n");
            }
        }
        sb.append("  </").append(tag).append(">\n");
    }

    /** {@code <ns>:<name>} with the namespace renumbered; namespace 0 is written without prefix. */
    static String browseName(NamespaceRemap remap, Node n) {
        int local = remap.local(n.browseNameNamespace);
        return local == 0 ? n.browseName : local + ":" + n.browseName;
    }

    private static String remapped(NodeSetTables tables, NamespaceRemap remap, int id) {
        NodeId nodeId = tables.lookup.nodeId(id);
        return remap.apply(nodeId).toString();
    }

    private static void attribute(StringBuilder sb, String name, String value) {
        sb.append(' ').append(name).append("=\"").append(XmlText.escape(value)).append('"');
    }
}
