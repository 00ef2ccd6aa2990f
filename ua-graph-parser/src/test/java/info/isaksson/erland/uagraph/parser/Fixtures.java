package info.isaksson.erland.uagraph.parser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

final class Fixtures {

    static final String CORE = "Opc.Ua.NodeSet2.Mini.xml";
    static final String MOTORS = "Motors.NodeSet2.xml";
    static final String MOTORS_URI = "http://example.com/UA/Motors/";

    private Fixtures() {}

    /** Copies the named files from {@code /nodesets} into a fresh temp directory. */
    static Path copyToTempDir(String... names) throws IOException {
        Path dir = Files.createTempDirectory("ua-graph-parser-");
        for (String name : names) {
            try (InputStream in = Fixtures.class.getResourceAsStream("/nodesets/" + name)) {
                if (in == null) throw new IOException("Missing fixture " + name);
                Files.copy(in, dir.resolve(name));
            }
        }
        return dir;
    }
}
