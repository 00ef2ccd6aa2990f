package info.isaksson.erland.uagraph.core;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

final class Fixtures {

    static final String CORE = "nodesets/Opc.Ua.NodeSet2.Mini.xml";
    static final String MOTORS = "nodesets/Motors.NodeSet2.xml";
    static final String LOOPS = "nodesets/Loops.NodeSet2.xml";
    static final String VALVES = "nodesets/Valves.NodeSet2.xml";
    static final String DANGLING = "invalid/dangling/Dangling.NodeSet2.xml";
    static final String MISMATCH = "invalid/mismatch/Mismatch.NodeSet2.xml";
    static final String NO_DATA_TYPE = "invalid/nodatatype/NoDataType.NodeSet2.xml";

    static final String MOTORS_URI = "http://example.com/UA/Motors/";
    static final String LOOPS_URI = "http://example.com/UA/Loops/";
    static final String VALVES_URI = "http://example.com/UA/Valves/";
    static final String MISMATCH_URI = "http://example.com/UA/Mismatch/";
    static final String NO_DATA_TYPE_URI = "http://example.com/UA/NoDataType/";

    private Fixtures() {}

    /** Copies the given classpath resources, flattened, into a fresh temp directory. */
    static Path copyToTempDir(String... resources) throws IOException {
        Path dir = Files.createTempDirectory("ua-graph-core-");
        for (String resource : resources) {
            copy(resource, dir);
        }
        return dir;
    }

    static Path copy(String resource, Path dir) throws IOException {
        try (InputStream in = Fixtures.class.getResourceAsStream("/" + resource)) {
            if (in == null) throw new IOException("Missing fixture " + resource);
            Path target = dir.resolve(Path.of(resource).getFileName().toString());
            Files.copy(in, target);
            return target;
        }
    }

    static UAGraph graph(String... resources) throws IOException {
        return UAGraph.fromPath(copyToTempDir(resources));
    }
}
