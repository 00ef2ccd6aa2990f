package info.isaksson.erland.uagraph.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON snapshots of denormalized tables.
 *
 * <p>Writing is deterministic: rows are sorted and map keys are ordered, so two snapshots of equal
 * tables are byte-identical.</p>
 */
public final class TableJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private TableJson() {}

    @JsonPropertyOrder({"namespaces","nodes","references"})
    public static final class Snapshot {
        public final List<String> namespaces;
        public final List<NodeRow> nodes;
        public final List<ReferenceRow> references;

        public Snapshot(List<String> namespaces, List<NodeRow> nodes, List<ReferenceRow> references) {
            this.namespaces = namespaces == null ? List.of() : List.copyOf(namespaces);
            List<NodeRow> n = new ArrayList<>(nodes == null ? List.of() : nodes);
            n.sort(NodeRow.BY_NODE_ID);
            List<ReferenceRow> r = new ArrayList<>(references == null ? List.of() : references);
            r.sort(ReferenceRow.ORDER);
            this.nodes = List.copyOf(n);
            this.references = List.copyOf(r);
        }
    }

    public static Snapshot snapshot(NodeSetTables tables) {
        return new Snapshot(tables.namespaces.uris(), tables.denormalizedNodes(), tables.denormalizedReferences());
    }

    public static String toJsonString(Snapshot snapshot) throws IOException {
        if (snapshot == null) throw new IllegalArgumentException("snapshot must not be null");
        return MAPPER.writer(PRETTY).writeValueAsString(snapshot) + "\n";
    }

    public static void write(Snapshot snapshot, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, snapshot);
            // Trailing newline for diff-friendliness.
            out.write('\n');
        }
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Prevent Jackson from closing the provided OutputStream.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
