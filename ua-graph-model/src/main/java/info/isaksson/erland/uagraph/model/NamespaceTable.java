package info.isaksson.erland.uagraph.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered namespace URIs. Index 0 is always the OPC Foundation namespace.
 *
 * <p>Gaps in a caller-supplied index map are filled with {@link #PLACEHOLDER}, which never matches a file.</p>
 */
public final class NamespaceTable {

    public static final String OPC_UA_URI = "http://opcfoundation.org/UA/";
    public static final String PLACEHOLDER = "None";

    private final List<String> uris;

    public NamespaceTable(List<String> uris) {
        Objects.requireNonNull(uris, "uris");
        if (uris.isEmpty() || !OPC_UA_URI.equals(uris.get(0))) {
            throw new IllegalArgumentException("Namespace 0 must be " + OPC_UA_URI + ", got " + uris);
        }
        this.uris = List.copyOf(uris);
    }

    public List<String> uris() {
        return uris;
    }

    public int size() {
        return uris.size();
    }

    public String uri(int index) {
        return uris.get(index);
    }

    /** @return the index of {@code uri}, or -1 */
    public int indexOf(String uri) {
        return uris.indexOf(uri);
    }

    public int requireIndex(String uri) {
        int i = uris.indexOf(uri);
        if (i < 0) throw new IllegalArgumentException("Could not find namespace uri: " + uri);
        return i;
    }

    @Override public boolean equals(Object o) {
        return o instanceof NamespaceTable && uris.equals(((NamespaceTable) o).uris);
    }

    @Override public int hashCode() {
        return uris.hashCode();
    }

    @Override public String toString() {
        return uris.toString();
    }
}
