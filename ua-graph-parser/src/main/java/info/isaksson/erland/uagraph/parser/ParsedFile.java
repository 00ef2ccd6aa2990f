package info.isaksson.erland.uagraph.parser;

import info.isaksson.erland.uagraph.model.NodeRow;
import info.isaksson.erland.uagraph.model.ReferenceRow;
import info.isaksson.erland.uagraph.model.UaModel;

import java.nio.file.Path;
import java.util.List;

/** Rows of one NodeSet2 file with identifiers already remapped to the global namespace table. */
public final class ParsedFile {
    public final Path file;
    public final List<NodeRow> nodes;
    public final List<ReferenceRow> references;
    /** The file's model, or null when it declares none. */
    public final UaModel model;

    public ParsedFile(Path file, List<NodeRow> nodes, List<ReferenceRow> references, UaModel model) {
        this.file = file;
        this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
        this.references = references == null ? List.of() : List.copyOf(references);
        this.model = model;
    }
}
