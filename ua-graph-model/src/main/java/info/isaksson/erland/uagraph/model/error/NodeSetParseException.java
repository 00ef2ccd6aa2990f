package info.isaksson.erland.uagraph.model.error;

import java.nio.file.Path;

/** A NodeSet2 file that is not well-formed XML or lacks mandatory structure. */
public class NodeSetParseException extends UaGraphException {

    private final Path file;

    public NodeSetParseException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public NodeSetParseException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
