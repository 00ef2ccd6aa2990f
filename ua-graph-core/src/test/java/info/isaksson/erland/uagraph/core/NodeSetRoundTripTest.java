package info.isaksson.erland.uagraph.core;

import info.isaksson.erland.uagraph.emitter.NodeSetSchemaValidator;
import info.isaksson.erland.uagraph.emitter.NodeSetWriter;
import info.isaksson.erland.uagraph.emitter.SchemaValidationResult;
import info.isaksson.erland.uagraph.emitter.WriteOptions;
import info.isaksson.erland.uagraph.model.UaModel;
import info.isaksson.erland.uagraph.model.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NodeSetRoundTripTest {

    @Test
    void writtenNamespaceParsesBackToTheSameTables() throws Exception {
        UAGraph graph = Fixtures.graph(Fixtures.CORE, Fixtures.MOTORS);
        Path outDir = Files.createTempDirectory("ua-graph-roundtrip-").resolve("generated");
        Path generated = outDir.resolve("Motors.NodeSet2.xml");

        NodeSetWriter.Result result = graph.writeNodeSet(generated, Fixtures.MOTORS_URI, WriteOptions.defaults());
        Fixtures.copy(Fixtures.CORE, outDir);
        UAGraph reparsed = UAGraph.fromPath(outDir);

        assertEquals(14, result.nodeCount);
        assertEquals(graph.namespaces(), reparsed.namespaces());
        assertEquals(graph.getDenormalizedNodes(), reparsed.getDenormalizedNodes());
        assertEquals(graph.getDenormalizedReferences(), reparsed.getDenormalizedReferences());

        UaModel motors = reparsed.models().stream()
                .filter(m -> m.modelUri.equals(Fixtures.MOTORS_URI))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no Motors model"));
        assertEquals("1.2.0", motors.version);
        assertEquals(1, motors.requiredModels.size());
    }

    @Test
    void writtenFileConformsToTheNodeSetSchema() throws Exception {
        UAGraph graph = Fixtures.graph(Fixtures.CORE, Fixtures.MOTORS);
        Path out = Files.createTempDirectory("ua-graph-schema-").resolve("Motors.NodeSet2.xml");

        graph.writeNodeSet(out, Fixtures.MOTORS_URI, WriteOptions.defaults());
        SchemaValidationResult validation = NodeSetSchemaValidator.validate(out);

        assertTrue(validation.valid, validation.describe());
    }

    @Test
    void writingTwiceGivesIdenticalBytes() throws Exception {
        UAGraph graph = Fixtures.graph(Fixtures.CORE, Fixtures.MOTORS);
        WriteOptions options = WriteOptions.defaults();
        options.lastModified = OffsetDateTime.parse("2024-05-01T00:00:00Z");

        String first = graph.writeNodeSetToString(Fixtures.MOTORS_URI, options).xml;
        String second = graph.writeNodeSetToString(Fixtures.MOTORS_URI, options).xml;

        assertEquals(first, second);
    }

    @Test
    void instanceLevelReferencesAreLeftOutOnRequest() throws Exception {
        UAGraph graph = Fixtures.graph(Fixtures.CORE, Fixtures.LOOPS);
        String outgoing = "<Reference ReferenceType=\"i=35\">i=78</Reference>";

        String all = graph.writeNodeSetToString(Fixtures.LOOPS_URI, WriteOptions.defaults()).xml;
        WriteOptions typesOnly = WriteOptions.defaults();
        typesOnly.includeOutgoingInstanceLevelReferences = false;
        String trimmed = graph.writeNodeSetToString(Fixtures.LOOPS_URI, typesOnly).xml;

        assertTrue(all.contains(outgoing), all);
        assertFalse(trimmed.contains(outgoing), trimmed);
        assertTrue(trimmed.contains("<Reference ReferenceType=\"i=40\">i=58</Reference>"), trimmed);
        assertTrue(trimmed.contains("<Reference ReferenceType=\"i=35\" IsForward=\"false\">i=85</Reference>"), trimmed);
    }

    @Test
    void valueMismatchFailsBeforeAnythingIsWritten() throws Exception {
        UAGraph graph = Fixtures.graph(Fixtures.CORE, Fixtures.MISMATCH);
        Path out = Files.createTempDirectory("ua-graph-mismatch-").resolve("Mismatch.NodeSet2.xml");

        ValidationException e = assertThrows(ValidationException.class,
                () -> graph.writeNodeSet(out, Fixtures.MISMATCH_URI, WriteOptions.defaults()));

        assertEquals(List.of("Pressure"), e.getInvalidDisplayNames());
        assertFalse(Files.exists(out));

        WriteOptions unchecked = WriteOptions.defaults();
        unchecked.validateValues = false;
        graph.writeNodeSet(out, Fixtures.MISMATCH_URI, unchecked);
        assertTrue(Files.readString(out, StandardCharsets.UTF_8).contains("<String xmlns="));
    }

    @Test
    void valueWithoutDataTypeFails() throws Exception {
        UAGraph graph = Fixtures.graph(Fixtures.CORE, Fixtures.NO_DATA_TYPE);

        ValidationException e = assertThrows(ValidationException.class,
                () -> graph.writeNodeSetToString(Fixtures.NO_DATA_TYPE_URI, WriteOptions.defaults()));

        assertTrue(e.getMessage().contains("UAVariable has no DataType!"), e.getMessage());
    }

    @Test
    void snapshotIsWrittenAsJson() throws Exception {
        UAGraph graph = Fixtures.graph(Fixtures.CORE, Fixtures.MOTORS);
        Path out = Files.createTempDirectory("ua-graph-snapshot-").resolve("tables.json");

        graph.writeSnapshot(out);

        String json = Files.readString(out, StandardCharsets.UTF_8);
        assertTrue(json.contains(Fixtures.MOTORS_URI), json);
        assertTrue(json.contains("ns=1;i=5001"), json);
        assertEquals(graph.getDenormalizedNodes().size(), graph.snapshot().nodes.size());
    }
}
