package info.isaksson.erland.uagraph.parser;

import info.isaksson.erland.uagraph.model.DataTypeDefinition;
import info.isaksson.erland.uagraph.model.DataTypeField;
import info.isaksson.erland.uagraph.model.NodeAttributes;
import info.isaksson.erland.uagraph.model.NodeClass;
import info.isaksson.erland.uagraph.model.NodeId;
import info.isaksson.erland.uagraph.model.NodeRow;
import info.isaksson.erland.uagraph.model.ReferenceRow;
import info.isaksson.erland.uagraph.model.UaModel;
import info.isaksson.erland.uagraph.model.UaRequiredModel;
import info.isaksson.erland.uagraph.model.error.AmbiguousLookupException;
import info.isaksson.erland.uagraph.model.error.NodeSetParseException;
import info.isaksson.erland.uagraph.model.error.SchemaException;
import info.isaksson.erland.uagraph.model.error.UnresolvedNamespaceException;
import info.isaksson.erland.uagraph.model.value.UaDateTime;
import info.isaksson.erland.uagraph.model.value.UaValue;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static info.isaksson.erland.uagraph.parser.NodeSetXml.attribute;
import static info.isaksson.erland.uagraph.parser.NodeSetXml.child;
import static info.isaksson.erland.uagraph.parser.NodeSetXml.childText;
import static info.isaksson.erland.uagraph.parser.NodeSetXml.children;

/**
 * Reads one NodeSet2 file into node and reference rows.
 *
 * <p>Namespace indices are remapped through the file's {@code <NamespaceUris>} block, aliases are resolved,
 * and inverse references are flipped so every row is in forward orientation.</p>
 */
public final class NodeSetFileReader {

    private final ValueDecoder valueDecoder = new ValueDecoder();

    public ParsedFile read(Path file, NamespaceTableBuilder namespaces) throws IOException {
        Document doc;
        try (InputStream in = Files.newInputStream(file)) {
            doc = NodeSetXml.newDocumentBuilder().parse(in, file.toUri().toString());
        } catch (SAXException e) {
            throw new NodeSetParseException(file, "not well-formed: " + e.getMessage(), e);
        }
        Element root = doc.getDocumentElement();
        if (!NodeSetXml.UA_NODESET_NS.equals(root.getNamespaceURI()) || !"UANodeSet".equals(root.getLocalName())) {
            throw new NodeSetParseException(file, "root element is not a UANodeSet");
        }

        Element nsUris = child(root, "NamespaceUris");
        List<String> fileUris = new ArrayList<>();
        if (nsUris != null) {
            for (Element uri : children(nsUris, "Uri")) {
                fileUris.add(uri.getTextContent().strip());
            }
        }
        Map<Integer, Integer> namespaceMap = namespaces.register(fileUris);
        Map<String, NodeId> aliases = readAliases(root, namespaceMap);
        UaModel model = readModel(file, root);

        List<NodeRow> nodes = new ArrayList<>();
        Set<ReferenceRow> references = new LinkedHashSet<>();
        for (Element e : children(root)) {
            Optional<NodeClass> nodeClass = NodeClass.fromXmlTag(e.getLocalName());
            if (nodeClass.isEmpty()) continue;
            NodeRow row = readNode(file, e, nodeClass.get(), namespaceMap, aliases);
            nodes.add(row);
            readReferences(e, row.nodeId, namespaceMap, aliases, references);
        }
        return new ParsedFile(file, nodes, new ArrayList<>(references), model);
    }

    private static Map<String, NodeId> readAliases(Element root, Map<Integer, Integer> namespaceMap) {
        Map<String, NodeId> aliases = new HashMap<>();
        Element block = child(root, "Aliases");
        if (block == null) return aliases;
        for (Element a : children(block, "Alias")) {
            aliases.put(a.getAttribute("Alias"), NodeId.parse(a.getTextContent(), namespaceMap, null));
        }
        return aliases;
    }

    static UaModel readModel(Path file, Element root) {
        Element block = child(root, "Models");
        if (block == null) return null;
        List<Element> models = children(block, "Model");
        if (models.isEmpty()) return null;
        if (models.size() > 1) {
            throw new AmbiguousLookupException(file + " declares " + models.size() + " models, expected one");
        }
        Element m = models.get(0);
        List<UaRequiredModel> required = new ArrayList<>();
        for (Element r : children(m, "RequiredModel")) {
            required.add(new UaRequiredModel(
                    r.getAttribute("ModelUri"),
                    attribute(r, "Version"),
                    timestamp(attribute(r, "PublicationDate"))));
        }
        return new UaModel(
                m.getAttribute("ModelUri"),
                timestamp(attribute(m, "PublicationDate")),
                attribute(m, "Version"),
                required);
    }

    private static OffsetDateTime timestamp(String text) {
        return text == null || text.isBlank() ? null : UaDateTime.parse(text.strip()).value;
    }

    private NodeRow readNode(Path file,
                             Element e,
                             NodeClass nodeClass,
                             Map<Integer, Integer> namespaceMap,
                             Map<String, NodeId> aliases) {
        String rawNodeId = attribute(e, "NodeId");
        String rawBrowseName = attribute(e, "BrowseName");
        if (rawNodeId == null) {
            throw new SchemaException(file + ": " + nodeClass.xmlTag() + " without NodeId");
        }
        if (rawBrowseName == null) {
            throw new SchemaException(file + ": " + rawNodeId + " has no BrowseName");
        }
        NodeId nodeId = NodeId.parse(rawNodeId, namespaceMap, aliases);

        int browseNameNamespace = 0;
        String browseName = rawBrowseName;
        int colon = rawBrowseName.indexOf(':');
        if (colon > 0 && isDigits(rawBrowseName.substring(0, colon))) {
            int local = Integer.parseInt(rawBrowseName.substring(0, colon));
            Integer mapped = namespaceMap.get(local);
            if (mapped == null) {
                throw new UnresolvedNamespaceException("BrowseName namespace " + local + " of " + rawNodeId + " is not declared");
            }
            browseNameNamespace = mapped;
            browseName = rawBrowseName.substring(colon + 1);
        }

        DataTypeDefinition definition = null;
        Element def = child(e, "Definition");
        if (def != null) {
            definition = readDefinition(def, namespaceMap, aliases);
        }
        Element inverse = child(e, "InverseName");
        NodeAttributes attributes = NodeAttributes.forClass(
                nodeClass,
                name -> attribute(e, name),
                inverse == null ? null : inverse.getTextContent().stripTrailing(),
                definition);

        return new NodeRow(
                nodeId,
                nodeClass,
                browseNameNamespace,
                browseName,
                trimmedText(e, "DisplayName"),
                trimmedText(e, "Description"),
                readValue(e),
                optionalNodeId(e, "DataType", namespaceMap, aliases),
                optionalNodeId(e, "ParentNodeId", namespaceMap, aliases),
                optionalNodeId(e, "MethodDeclarationId", namespaceMap, aliases),
                attributes);
    }

    private static DataTypeDefinition readDefinition(Element def, Map<Integer, Integer> namespaceMap, Map<String, NodeId> aliases) {
        List<DataTypeField> fields = new ArrayList<>();
        for (Element f : children(def, "Field")) {
            String desc = childText(f, "Description");
            fields.add(new DataTypeField(
                    f.getAttribute("Name"),
                    optionalNodeId(f, "DataType", namespaceMap, aliases),
                    attribute(f, "Value"),
                    desc == null ? null : desc.stripTrailing()));
        }
        return new DataTypeDefinition(def.getAttribute("Name"), fields);
    }

    private UaValue readValue(Element e) {
        Element value = child(e, "Value");
        if (value == null) return null;
        List<Element> content = children(value);
        return content.isEmpty() ? null : valueDecoder.decode(content.get(0));
    }

    private static void readReferences(Element e,
                                       NodeId owner,
                                       Map<Integer, Integer> namespaceMap,
                                       Map<String, NodeId> aliases,
                                       Set<ReferenceRow> out) {
        for (Element block : children(e, "References")) {
            for (Element r : children(block, "Reference")) {
                NodeId other = NodeId.parse(r.getTextContent().stripTrailing(), namespaceMap, aliases);
                NodeId type = NodeId.parse(r.getAttribute("ReferenceType"), namespaceMap, aliases);
                boolean forward = !"false".equals(attribute(r, "IsForward"));
                out.add(forward ? new ReferenceRow(owner, other, type) : new ReferenceRow(other, owner, type));
            }
        }
    }

    private static NodeId optionalNodeId(Element e, String name, Map<Integer, Integer> namespaceMap, Map<String, NodeId> aliases) {
        String raw = attribute(e, name);
        return raw == null || raw.isEmpty() ? null : NodeId.parse(raw, namespaceMap, aliases);
    }

    private static String trimmedText(Element e, String name) {
        String t = childText(e, name);
        return t == null ? "" : t.stripTrailing();
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }
}
