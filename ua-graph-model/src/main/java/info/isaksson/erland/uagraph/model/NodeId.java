package info.isaksson.erland.uagraph.model;

import com.fasterxml.jackson.annotation.JsonValue;
import info.isaksson.erland.uagraph.model.error.MalformedNodeIdException;
import info.isaksson.erland.uagraph.model.error.UnresolvedNamespaceException;

import java.util.Map;
import java.util.Objects;

/**
 * Namespace-qualified node identifier.
 *
 * <p>The canonical text is {@code ns=<n>;<k>=<v>}, with the {@code ns=} part omitted for namespace 0.
 * Ordering follows the canonical text.</p>
 */
public final class NodeId implements Comparable<NodeId> {

    private static final int MAX_NAMESPACE = 0xFFFF;

    public final int namespace;
    public final NodeIdType type;
    public final String value;

    public NodeId(int namespace, NodeIdType type, String value) {
        if (namespace < 0 || namespace > MAX_NAMESPACE) {
            throw new MalformedNodeIdException("Namespace index out of range: " + namespace);
        }
        this.namespace = namespace;
        this.type = Objects.requireNonNull(type, "type");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static NodeId numeric(int namespace, long value) {
        return new NodeId(namespace, NodeIdType.NUMERIC, Long.toString(value));
    }

    public static NodeId parse(String text) {
        return parse(text, null, null);
    }

    /**
     * Parse identifier text.
     *
     * @param text raw attribute or element text
     * @param namespaceMap file-local to global namespace index mapping, or null to keep indices as written
     * @param aliases alias names declared by the file, consulted before anything else; may be null
     */
    public static NodeId parse(String text, Map<Integer, Integer> namespaceMap, Map<String, NodeId> aliases) {
        if (text == null) throw new MalformedNodeIdException("Identifier text is null");
        String raw = text.strip();
        if (aliases != null) {
            NodeId aliased = aliases.get(raw);
            if (aliased != null) return aliased;
        }

        int ns = 0;
        String rest = raw;
        if (raw.startsWith("ns=")) {
            int semi = raw.indexOf(';');
            if (semi < 0) throw new MalformedNodeIdException("Could not parse " + text);
            ns = parseNamespace(raw.substring(3, semi), text);
            rest = raw.substring(semi + 1);
        }

        int eq = rest.indexOf('=');
        if (eq <= 0) throw new MalformedNodeIdException("Could not parse " + text);
        NodeIdType type = NodeIdType.fromCode(rest.substring(0, eq));
        String value = rest.substring(eq + 1);
        if (type == NodeIdType.NUMERIC && !isCanonicalUnsigned(value)) {
            throw new MalformedNodeIdException("Numeric identifier must be a non-negative integer: " + text);
        }

        if (namespaceMap != null) {
            Integer mapped = namespaceMap.get(ns);
            if (mapped == null) {
                throw new UnresolvedNamespaceException("Namespace index " + ns + " of '" + text + "' is not declared");
            }
            ns = mapped;
        }
        return new NodeId(ns, type, value);
    }

    private static int parseNamespace(String digits, String text) {
        if (!isCanonicalUnsigned(digits)) {
            throw new MalformedNodeIdException("Malformed namespace index in " + text);
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new MalformedNodeIdException("Malformed namespace index in " + text);
        }
    }

    static boolean isCanonicalUnsigned(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return s.length() == 1 || s.charAt(0) != '0';
    }

    public NodeId withNamespace(int newNamespace) {
        if (newNamespace == namespace) return this;
        return new NodeId(newNamespace, type, value);
    }

    @JsonValue
    @Override
    public String toString() {
        String body = type.code() + "=" + value;
        return namespace == 0 ? body : "ns=" + namespace + ";" + body;
    }

    @Override
    public int compareTo(NodeId o) {
        return toString().compareTo(o.toString());
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeId)) return false;
        NodeId that = (NodeId) o;
        return namespace == that.namespace && type == that.type && value.equals(that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(namespace, type, value);
    }
}
