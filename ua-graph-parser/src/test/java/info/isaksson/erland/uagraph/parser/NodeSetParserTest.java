package info.isaksson.erland.uagraph.parser;

import info.isaksson.erland.uagraph.model.NamespaceTable;
import info.isaksson.erland.uagraph.model.Node;
import info.isaksson.erland.uagraph.model.NodeAttributes;
import info.isaksson.erland.uagraph.model.NodeClass;
import info.isaksson.erland.uagraph.model.NodeId;
import info.isaksson.erland.uagraph.model.NodeRow;
import info.isaksson.erland.uagraph.model.NodeSetTables;
import info.isaksson.erland.uagraph.model.ReferenceRow;
import info.isaksson.erland.uagraph.model.UaModel;
import info.isaksson.erland.uagraph.model.error.NodeSetParseException;
import info.isaksson.erland.uagraph.model.error.SchemaException;
import info.isaksson.erland.uagraph.model.error.UnresolvedNamespaceException;
import info.isaksson.erland.uagraph.model.value.UaFloatingPoint;
import info.isaksson.erland.uagraph.model.value.UaListOf;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class NodeSetParserTest {

    private static final NodeId ORGANIZES = NodeId.parse("i=35");
    private static final NodeId HAS_SUBTYPE = NodeId.parse("i=45");

    private static NodeSetTables parseFixtures(ParseOptions options) throws Exception {
        Path dir = Fixtures.copyToTempDir(Fixtures.CORE, Fixtures.MOTORS);
        return new NodeSetParser().parseDirectory(dir, options);
    }

    private static NodeRow row(NodeSetTables tables, String nodeId) {
        NodeId id = NodeId.parse(nodeId);
        return tables.denormalizedNodes().stream()
                .filter(r -> r.nodeId.equals(id))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no node " + nodeId));
    }

    @Test
    void parsesDirectoryIntoOneConsolidatedTable() throws Exception {
        NodeSetTables tables = parseFixtures(new ParseOptions());

        assertEquals(List.of(NamespaceTable.OPC_UA_URI, Fixtures.MOTORS_URI), tables.namespaces.uris());
        assertEquals(2, tables.models.size());
        Set<String> uris = tables.models.stream().map(m -> m.modelUri).collect(Collectors.toSet());
        assertEquals(Set.of(NamespaceTable.OPC_UA_URI, Fixtures.MOTORS_URI), uris);

        NodeRow motorType = row(tables, "ns=1;i=1001");
        assertEquals(NodeClass.OBJECT_TYPE, motorType.nodeClass);
        assertEquals(1, motorType.browseNameNamespace);
        assertEquals("MotorType", motorType.browseName);
        assertEquals("A rotating machine.", motorType.description);

        NodeRow enumStrings = row(tables, "ns=1;i=3002");
        assertEquals(0, enumStrings.browseNameNamespace);
        assertEquals(NodeId.parse("i=21"), enumStrings.dataType);
        assertEquals(NodeId.parse("ns=1;i=3001"), enumStrings.parentNodeId);
        assertTrue(enumStrings.value instanceof UaListOf);
        assertEquals(2, ((UaListOf) enumStrings.value).values.size());
    }

    @Test
    void surrogateIdsAreDenseAndBijective() throws Exception {
        NodeSetTables tables = parseFixtures(new ParseOptions());

        Set<NodeId> seen = new HashSet<>();
        for (int i = 0; i < tables.lookup.size(); i++) {
            NodeId nodeId = tables.lookup.nodeId(i);
            assertTrue(seen.add(nodeId), "duplicate identifier " + nodeId);
            assertEquals(Integer.valueOf(i), tables.lookup.idOf(nodeId));
        }
        for (Node n : tables.nodes) {
            assertEquals(n.nodeId, tables.lookup.nodeId(n.id));
        }
        // Declared nodes are interned before any other column.
        assertEquals(tables.nodes.size(), tables.nodes.stream().mapToInt(n -> n.id).max().getAsInt() + 1);
    }

    @Test
    void inverseReferencesAreStoredForward() throws Exception {
        NodeSetTables tables = parseFixtures(new ParseOptions());
        List<ReferenceRow> refs = tables.denormalizedReferences();
        NodeId motor1 = NodeId.parse("ns=1;i=5001");

        assertTrue(refs.contains(new ReferenceRow(NodeId.parse("i=85"), motor1, ORGANIZES)));
        assertFalse(refs.stream().anyMatch(r -> r.src.equals(motor1) && r.referenceType.equals(ORGANIZES)));
    }

    @Test
    void referencesDeclaredOnBothEndsCollapseToOneRow() throws Exception {
        NodeSetTables tables = parseFixtures(new ParseOptions());
        ReferenceRow hasProperty = new ReferenceRow(
                NodeId.parse("ns=1;i=3001"), NodeId.parse("ns=1;i=3002"), NodeId.parse("i=46"));
        ReferenceRow subtype = new ReferenceRow(NodeId.parse("i=31"), NodeId.parse("i=33"), HAS_SUBTYPE);

        List<ReferenceRow> refs = tables.denormalizedReferences();
        assertEquals(1, refs.stream().filter(hasProperty::equals).count());
        assertEquals(1, refs.stream().filter(subtype::equals).count());
    }

    @Test
    void trailingWhitespaceIsStrippedFromTexts() throws Exception {
        NodeSetTables tables = parseFixtures(new ParseOptions());
        NodeRow speed = row(tables, "ns=1;i=1002");

        assertEquals("Rotational speed", speed.description);
        assertEquals(new UaFloatingPoint("Double", 0.0), speed.value);
        assertEquals("3", ((NodeAttributes.VariableAttributes) speed.attributes).accessLevel);
    }

    @Test
    void referenceTypeInverseNameAndDataTypeDefinitionAreKept() throws Exception {
        NodeSetTables tables = parseFixtures(new ParseOptions());

        var organizes = (NodeAttributes.ReferenceTypeAttributes) row(tables, "i=35").attributes;
        assertEquals("OrganizedBy", organizes.inverseName);

        var motorState = (NodeAttributes.DataTypeAttributes) row(tables, "ns=1;i=3001").attributes;
        assertNotNull(motorState.definition);
        assertEquals(2, motorState.definition.fields.size());
        assertEquals("1", motorState.definition.fields.get(1).value);
        assertEquals("Shaft is turning", motorState.definition.fields.get(1).description);
    }

    @Test
    void modelCarriesRequiredModels() throws Exception {
        NodeSetTables tables = parseFixtures(new ParseOptions());
        UaModel motors = tables.models.stream()
                .filter(m -> m.modelUri.equals(Fixtures.MOTORS_URI))
                .findFirst()
                .orElseThrow();

        assertEquals("1.2.0", motors.version);
        assertEquals(1, motors.requiredModels.size());
        assertEquals(NamespaceTable.OPC_UA_URI, motors.requiredModels.get(0).modelUri);
    }

    @Test
    void desiredNamespaceOrderIsHonoured() throws Exception {
        ParseOptions options = ParseOptions.withNamespaces(
                List.of(NamespaceTable.OPC_UA_URI, "urn:unused", Fixtures.MOTORS_URI));
        NodeSetTables tables = parseFixtures(options);

        assertEquals(3, tables.namespaces.size());
        assertEquals(2, row(tables, "ns=2;i=1001").browseNameNamespace);
        assertTrue(tables.nodes.stream().noneMatch(n -> n.namespace() == 1));
    }

    @Test
    void filesOutsideDesiredNamespacesAreExcluded() throws Exception {
        NodeSetTables tables = parseFixtures(ParseOptions.withNamespaces(List.of(NamespaceTable.OPC_UA_URI)));

        assertEquals(List.of(NamespaceTable.OPC_UA_URI), tables.namespaces.uris());
        assertTrue(tables.nodes.stream().allMatch(n -> n.namespace() == 0));
    }

    @Test
    void unexpectedNamespaceIsAppendedWhenFilesAreNotExcluded() throws Exception {
        ParseOptions options = ParseOptions.withNamespaces(List.of(NamespaceTable.OPC_UA_URI, "urn:first"));
        options.excludeFilesNotInNamespaces = false;
        NodeSetTables tables = parseFixtures(options);

        assertEquals(List.of(NamespaceTable.OPC_UA_URI, "urn:first", Fixtures.MOTORS_URI), tables.namespaces.uris());
        assertEquals(NodeClass.OBJECT_TYPE, row(tables, "ns=2;i=1001").nodeClass);
    }

    @Test
    void nonXmlFilesAreIgnoredAndMissingFilesFail() throws Exception {
        Path dir = Fixtures.copyToTempDir(Fixtures.CORE);
        Path notes = dir.resolve("README.txt");
        Files.writeString(notes, "not a nodeset", StandardCharsets.UTF_8);

        NodeSetTables tables = new NodeSetParser().parseFiles(
                List.of(notes, dir.resolve(Fixtures.CORE)), new ParseOptions());
        assertFalse(tables.nodes.isEmpty());

        assertThrows(NoSuchFileException.class,
                () -> new NodeSetParser().parseFiles(List.of(dir.resolve("Missing.xml")), new ParseOptions()));
    }

    @Test
    void malformedXmlNamesTheFile() throws Exception {
        Path dir = Files.createTempDirectory("ua-graph-parser-bad-");
        Path broken = dir.resolve("Broken.NodeSet2.xml");
        Files.writeString(broken, "<UANodeSet><UAObject", StandardCharsets.UTF_8);

        NodeSetParseException ex = assertThrows(NodeSetParseException.class,
                () -> new NodeSetParser().parseDirectory(dir, new ParseOptions()));
        assertTrue(ex.getMessage().contains("Broken.NodeSet2.xml"));
    }

    @Test
    void nodeDeclaredInTwoFilesIsRejected() throws Exception {
        Path dir = Fixtures.copyToTempDir(Fixtures.CORE);
        Files.copy(dir.resolve(Fixtures.CORE), dir.resolve("Copy.NodeSet2.xml"));

        assertThrows(SchemaException.class, () -> new NodeSetParser().parseDirectory(dir, new ParseOptions()));
    }

    @Test
    void undeclaredNamespaceIndexIsFatal() throws Exception {
        Path dir = Files.createTempDirectory("ua-graph-parser-ns-");
        Files.writeString(dir.resolve("Dangling.NodeSet2.xml"),
                "<UANodeSet xmlns=\"http://opcfoundation.org/UA/2011/03/UANodeSet.xsd\">"
                        + "<NamespaceUris><Uri>urn:one</Uri></NamespaceUris>"
                        + "<UAObject NodeId=\"ns=2;i=1\" BrowseName=\"2:Thing\"><DisplayName>Thing</DisplayName></UAObject>"
                        + "</UANodeSet>",
                StandardCharsets.UTF_8);

        assertThrows(UnresolvedNamespaceException.class,
                () -> new NodeSetParser().parseDirectory(dir, new ParseOptions()));
    }

    @Test
    void nodeWithoutBrowseNameIsASchemaError() throws Exception {
        Path dir = Files.createTempDirectory("ua-graph-parser-schema-");
        Files.writeString(dir.resolve("NoName.NodeSet2.xml"),
                "<UANodeSet xmlns=\"http://opcfoundation.org/UA/2011/03/UANodeSet.xsd\">"
                        + "<UAObject NodeId=\"i=5000\"><DisplayName>Thing</DisplayName></UAObject>"
                        + "</UANodeSet>",
                StandardCharsets.UTF_8);

        SchemaException ex = assertThrows(SchemaException.class,
                () -> new NodeSetParser().parseDirectory(dir, new ParseOptions()));
        assertTrue(ex.getMessage().contains("i=5000"));
    }
}
