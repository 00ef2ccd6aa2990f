package info.isaksson.erland.uagraph.parser;

import info.isaksson.erland.uagraph.model.NodeRow;
import info.isaksson.erland.uagraph.model.NodeSetTables;
import info.isaksson.erland.uagraph.model.ReferenceRow;
import info.isaksson.erland.uagraph.model.UaModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Parses NodeSet2 files into one consolidated, normalized pair of Nodes and References tables.
 *
 * <p>Either every file parses or the call fails as a whole.</p>
 */
public final class NodeSetParser {

    private static final Logger log = LoggerFactory.getLogger(NodeSetParser.class);

    private final NodeSetFileReader reader = new NodeSetFileReader();

    public NodeSetTables parseDirectory(Path directory, ParseOptions options) throws IOException {
        return parseFiles(NodeSetFileScanner.scan(directory), options);
    }

    public NodeSetTables parseFiles(List<Path> files, ParseOptions options) throws IOException {
        if (files == null) throw new IllegalArgumentException("files must not be null");
        if (options == null) options = new ParseOptions();

        List<Path> selected = new ArrayList<>();
        for (Path f : files) {
            if (NodeSetFileScanner.isXml(f)) selected.add(f);
        }
        for (Path f : selected) {
            if (!Files.isRegularFile(f)) throw new NoSuchFileException(f.toString());
        }
        boolean haveDesired = !options.desiredNamespaces.isEmpty();
        if (haveDesired && options.excludeFilesNotInNamespaces) {
            selected = NamespaceFileFilter.retainFilesInNamespaces(selected, options.desiredNamespaces);
        }
        selected.sort(Comparator.comparing(Path::toString));

        NamespaceTableBuilder namespaces = new NamespaceTableBuilder(options.desiredNamespaces);
        List<NodeRow> nodes = new ArrayList<>();
        List<ReferenceRow> references = new ArrayList<>();
        List<UaModel> models = new ArrayList<>();
        for (Path f : selected) {
            long start = System.nanoTime();
            log.info("Started parsing {}", f);
            ParsedFile parsed = reader.read(f, namespaces);
            nodes.addAll(parsed.nodes);
            references.addAll(parsed.references);
            if (parsed.model != null) models.add(parsed.model);
            log.info("Finished parsing {}: {} nodes, {} references in {} ms",
                    f.getFileName(), parsed.nodes.size(), parsed.references.size(), (System.nanoTime() - start) / 1_000_000);
        }

        log.info("Started normalizing {} nodes and {} references", nodes.size(), references.size());
        NodeSetTables tables = Normalizer.normalize(nodes, references, namespaces.build(), models);
        log.info("Finished normalizing: {} distinct identifiers", tables.lookup.size());
        return tables;
    }
}
