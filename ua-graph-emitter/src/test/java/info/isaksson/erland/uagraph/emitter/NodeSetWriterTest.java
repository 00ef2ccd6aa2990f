package info.isaksson.erland.uagraph.emitter;

import info.isaksson.erland.uagraph.model.DataTypeDefinition;
import info.isaksson.erland.uagraph.model.DataTypeField;
import info.isaksson.erland.uagraph.model.NamespaceTable;
import info.isaksson.erland.uagraph.model.NodeAttributes;
import info.isaksson.erland.uagraph.model.NodeClass;
import info.isaksson.erland.uagraph.model.NodeId;
import info.isaksson.erland.uagraph.model.NodeSetTables;
import info.isaksson.erland.uagraph.model.UaModel;
import info.isaksson.erland.uagraph.model.UaRequiredModel;
import info.isaksson.erland.uagraph.model.value.UaFloatingPoint;
import info.isaksson.erland.uagraph.model.value.UaNodeIdValue;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NodeSetWriterTest {

    private static final OffsetDateTime FIXED = OffsetDateTime.of(2021, 6, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private static WriteOptions fixedOptions() {
        WriteOptions o = WriteOptions.defaults();
        o.lastModified = FIXED;
        o.publicationDate = FIXED;
        return o;
    }

    private static NodeSetTables plant() {
        return TablesBuilder.plant(new UaFloatingPoint("Double", 3.5)).build();
    }

    @Test
    void serializedNamespaceBecomesIndexOne() {
        NodeSetWriter.Result r = NodeSetWriter.writeToString(plant(), TablesBuilder.PLANT, fixedOptions());

        assertEquals(List.of(NamespaceTable.OPC_UA_URI, TablesBuilder.PLANT, TablesBuilder.DEVICES), r.namespaceUris);
        String xml = r.xml;
        assertTrue(xml.indexOf("<Uri>" + TablesBuilder.PLANT + "</Uri>") < xml.indexOf("<Uri>" + TablesBuilder.DEVICES + "</Uri>"));
        assertFalse(xml.contains("<Uri>" + NamespaceTable.OPC_UA_URI + "</Uri>"));
        assertTrue(xml.contains("<UAObject NodeId=\"ns=1;i=10\" BrowseName=\"1:Pump\">"), xml);
        assertTrue(xml.contains("<UAVariable NodeId=\"ns=1;i=11\" BrowseName=\"1:Flow\" DataType=\"i=11\">"), xml);
        assertEquals(2, r.nodeCount);
        assertEquals(4, r.referenceCount);
    }

    @Test
    void referencesAreAttachedToWrittenTargetsAsInverse() {
        String xml = NodeSetWriter.writeToString(plant(), TablesBuilder.PLANT, fixedOptions()).xml;

        assertTrue(xml.contains("<Reference ReferenceType=\"i=35\" IsForward=\"false\">i=85</Reference>"), xml);
        assertTrue(xml.contains("<Reference ReferenceType=\"i=47\" IsForward=\"false\">ns=1;i=10</Reference>"), xml);
        assertTrue(xml.contains("<Reference ReferenceType=\"i=40\">ns=2;i=1</Reference>"), xml);
        assertTrue(xml.contains("<Reference ReferenceType=\"i=40\">i=63</Reference>"), xml);
        assertFalse(xml.contains("i=45"), "references not touching the namespace are left out");
    }

    @Test
    void textIsEscapedAndValuesCarryTypesNamespace() {
        String xml = NodeSetWriter.writeToString(plant(), TablesBuilder.PLANT, fixedOptions()).xml;

        assertTrue(xml.contains("<Description>Flow &amp; rate</Description>"), xml);
        assertTrue(xml.contains("<Value><Double xmlns=\"http://opcfoundation.org/UA/2008/02/Types.xsd\">3.5</Double></Value>"), xml);
        assertEquals(1, xml.split("<Description>", -1).length - 1, "empty descriptions are not written");
    }

    @Test
    void unusedNamespacesAreNotListed() {
        TablesBuilder b = new TablesBuilder(TablesBuilder.DEVICES, TablesBuilder.PLANT);
        b.node("i=85", NodeClass.OBJECT, 0, "Objects")
                .node("i=35", NodeClass.REFERENCE_TYPE, 0, "Organizes")
                .node("ns=1;i=1", NodeClass.OBJECT_TYPE, 1, "PumpType")
                .node("ns=2;i=10", NodeClass.OBJECT, 2, "Pump")
                .ref("i=85", "i=35", "ns=2;i=10");

        NodeSetWriter.Result r = NodeSetWriter.writeToString(b.build(), TablesBuilder.PLANT, fixedOptions());

        assertEquals(List.of(NamespaceTable.OPC_UA_URI, TablesBuilder.PLANT), r.namespaceUris);
        assertFalse(r.xml.contains(TablesBuilder.DEVICES));
    }

    @Test
    void modelFallsBackToDefaultsWithoutParsedModel() {
        WriteOptions o = fixedOptions();
        o.publicationDate = null;
        NodeSetWriter.Result r = NodeSetWriter.writeToString(plant(), TablesBuilder.PLANT, o);

        assertTrue(r.xml.contains("<Model ModelUri=\"" + TablesBuilder.PLANT + "\" Version=\"1.0.0\""), r.xml);
        assertTrue(r.xml.contains("LastModified=\"2021-06-01T12:00:00Z\""), r.xml);
        assertEquals(1, r.warnings.size());
        assertEquals("model.missing", r.warnings.get(0).code);
    }

    @Test
    void parsedModelSuppliesVersionDateAndRequiredModels() {
        OffsetDateTime published = OffsetDateTime.of(2020, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
        NodeSetTables tables = TablesBuilder.plant(null)
                .model(new UaModel(TablesBuilder.PLANT, published, "2.1.0",
                        List.of(new UaRequiredModel(NamespaceTable.OPC_UA_URI, "1.04", published))))
                .build();
        WriteOptions o = WriteOptions.defaults();
        o.lastModified = FIXED;

        NodeSetWriter.Result r = NodeSetWriter.writeToString(tables, TablesBuilder.PLANT, o);

        assertTrue(r.xml.contains("Version=\"2.1.0\" PublicationDate=\"2020-01-01T00:00:00Z\">"), r.xml);
        assertTrue(r.xml.contains("<RequiredModel ModelUri=\"http://opcfoundation.org/UA/\" Version=\"1.04\" PublicationDate=\"2020-01-01T00:00:00Z\" />"), r.xml);
        assertTrue(r.warnings.isEmpty());

        o.newModelVersion = "3.0.0";
        o.publicationDate = FIXED;
        String overridden = NodeSetWriter.writeToString(tables, TablesBuilder.PLANT, o).xml;
        assertTrue(overridden.contains("Version=\"3.0.0\" PublicationDate=\"2021-06-01T12:00:00Z\">"), overridden);
    }

    @Test
    void definitionsAndInverseNamesAreWrittenWithRemappedFieldTypes() throws Exception {
        DataTypeDefinition definition = new DataTypeDefinition("2:Mode", List.of(
                new DataTypeField("Off", null, "0", null),
                new DataTypeField("Level", NodeId.parse("ns=2;i=21"), null, "Nominal level")));
        NodeSetTables tables = TablesBuilder.plant(null)
                .node("ns=2;i=20", NodeClass.DATA_TYPE, 2, "Mode", "", null, null,
                        new NodeAttributes.DataTypeAttributes("ModeSym", null, null, "false", definition))
                .node("ns=2;i=21", NodeClass.DATA_TYPE, 2, "Level")
                .node("ns=2;i=30", NodeClass.REFERENCE_TYPE, 2, "Feeds", "", null, null,
                        new NodeAttributes.ReferenceTypeAttributes(null, null, null, null, "false", "FedBy"))
                .build();

        String xml = NodeSetWriter.writeToString(tables, TablesBuilder.PLANT, fixedOptions()).xml;

        assertTrue(xml.contains("<UADataType NodeId=\"ns=1;i=20\" BrowseName=\"1:Mode\" SymbolicName=\"ModeSym\" IsAbstract=\"false\">"), xml);
        assertTrue(xml.contains("<Field Name=\"Level\" DataType=\"ns=1;i=21\"><Description>Nominal level</Description></Field>"), xml);
        assertTrue(xml.contains("<Field Name=\"Off\" Value=\"0\" />"), xml);
        assertTrue(xml.contains("<InverseName>FedBy</InverseName>"), xml);
        assertTrue(NodeSetSchemaValidator.validateString(xml).valid);
    }

    @Test
    void infiniteValuesAreWrittenInSchemaForm() throws Exception {
        NodeSetTables tables = TablesBuilder.plant(new UaFloatingPoint("Double", Double.NEGATIVE_INFINITY)).build();

        String xml = NodeSetWriter.writeToString(tables, TablesBuilder.PLANT, fixedOptions()).xml;

        assertTrue(xml.contains(">-INF</Double>"), xml);
        assertFalse(xml.contains("Infinity"), xml);
        assertTrue(NodeSetSchemaValidator.validateString(xml).valid);
    }

    @Test
    void nodeIdValuesKeepTheirParsedNamespaceIndex() {
        NodeSetTables tables = TablesBuilder.plant(new UaNodeIdValue(NodeId.parse("ns=2;i=10"))).build();
        WriteOptions options = fixedOptions();
        options.validateValues = false;

        String xml = NodeSetWriter.writeToString(tables, TablesBuilder.PLANT, options).xml;

        assertTrue(xml.contains("<UAObject NodeId=\"ns=1;i=10\" BrowseName=\"1:Pump\">"), xml);
        assertTrue(xml.contains("<Identifier>ns=2;i=10</Identifier>"), xml);
    }

    @Test
    void outputIsDeterministicForFixedTimestamps() {
        String first = NodeSetWriter.writeToString(plant(), TablesBuilder.PLANT, fixedOptions()).xml;
        String second = NodeSetWriter.writeToString(plant(), TablesBuilder.PLANT, fixedOptions()).xml;

        assertEquals(first, second);
    }

    @Test
    void writeCreatesParentDirectories() throws Exception {
        Path out = Files.createTempDirectory("ua-graph-writer").resolve("nested/dir/Plant.NodeSet2.xml");

        NodeSetWriter.Result r = NodeSetWriter.write(plant(), TablesBuilder.PLANT, fixedOptions(), out);

        assertTrue(Files.isRegularFile(out));
        assertEquals(r.xml, Files.readString(out, StandardCharsets.UTF_8));
        assertTrue(NodeSetSchemaValidator.validate(out).valid);
    }

    @Test
    void unknownNamespaceIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> NodeSetWriter.writeToString(plant(), "http://example.com/nowhere/", fixedOptions()));
        assertThrows(IllegalArgumentException.class,
                () -> NodeSetWriter.writeToString(null, TablesBuilder.PLANT, fixedOptions()));
    }
}
