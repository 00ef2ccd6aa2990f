package info.isaksson.erland.uagraph.parser;

import info.isaksson.erland.uagraph.model.NamespaceTable;
import info.isaksson.erland.uagraph.model.error.NodeSetParseException;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static info.isaksson.erland.uagraph.parser.NodeSetXml.child;
import static info.isaksson.erland.uagraph.parser.NodeSetXml.children;

/**
 * Decides which files belong to a set of wanted namespaces.
 *
 * <p>A file's namespaces are its Model URIs, or its {@code <NamespaceUris>} when it has no {@code <Models>}
 * block. The core nodeset file name always counts as the OPC UA namespace.</p>
 */
public final class NamespaceFileFilter {

    static final String CORE_NODESET_FILE_NAME = "Opc.Ua.NodeSet2.xml";

    private NamespaceFileFilter() {}

    public static List<String> declaredNamespaces(Path file) throws IOException {
        if (file.getFileName().toString().endsWith(CORE_NODESET_FILE_NAME)) {
            return List.of("http://opcfoundation.org/UA", NamespaceTable.OPC_UA_URI);
        }
        Element root;
        try (InputStream in = Files.newInputStream(file)) {
            root = NodeSetXml.newDocumentBuilder().parse(in).getDocumentElement();
        } catch (SAXException e) {
            throw new NodeSetParseException(file, "not well-formed: " + e.getMessage(), e);
        }
        List<String> out = new ArrayList<>();
        Element models = child(root, "Models");
        if (models != null) {
            for (Element m : children(models, "Model")) {
                String uri = m.getAttribute("ModelUri");
                if (!uri.isEmpty()) out.add(uri);
            }
            return out;
        }
        Element uris = child(root, "NamespaceUris");
        if (uris != null) {
            for (Element u : children(uris, "Uri")) out.add(u.getTextContent().strip());
        }
        return out;
    }

    /** Keep the files that declare at least one of {@code wanted}; placeholders never match. */
    public static List<Path> retainFilesInNamespaces(List<Path> files, List<String> wanted) throws IOException {
        List<String> real = new ArrayList<>();
        for (String w : wanted) {
            if (w != null && !NamespaceTable.PLACEHOLDER.equals(w)) real.add(w);
        }
        List<Path> out = new ArrayList<>();
        for (Path f : files) {
            List<String> declared = declaredNamespaces(f);
            if (declared.stream().anyMatch(real::contains)) out.add(f);
        }
        return out;
    }
}
