package info.isaksson.erland.uagraph.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Deterministic NodeSet2 file discovery: the regular {@code .xml} files directly inside a directory,
 * sorted by file name.
 */
public final class NodeSetFileScanner {

    private NodeSetFileScanner() {}

    public static List<Path> scan(Path directory) throws IOException {
        Objects.requireNonNull(directory, "directory");
        if (!Files.isDirectory(directory)) {
            throw new IOException("Not a directory: " + directory);
        }
        try (Stream<Path> stream = Files.list(directory)) {
            List<Path> out = new ArrayList<>();
            stream
                .filter(Files::isRegularFile)
                .filter(NodeSetFileScanner::isXml)
                .forEach(out::add);
            out.sort(Comparator.comparing(p -> p.getFileName().toString()));
            return out;
        }
    }

    static boolean isXml(Path p) {
        return p.getFileName().toString().endsWith(".xml");
    }
}
