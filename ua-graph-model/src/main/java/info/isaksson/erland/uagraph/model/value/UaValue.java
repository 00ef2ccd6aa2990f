package info.isaksson.erland.uagraph.model.value;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A typed value stored on a node, as written inside a NodeSet2 {@code <Value>} element.
 *
 * <p>Every value can encode itself back to the {@code Types.xsd} XML it was read from.</p>
 */
public abstract class UaValue {

    public static final String TYPES_NAMESPACE = "http://opcfoundation.org/UA/2008/02/Types.xsd";

    /** Element name of the encoded value, e.g. {@code Int32} or {@code ListOfLocalizedText}. */
    public abstract String typeName();

    public abstract String encodeXml(boolean includeNamespaceDecl);

    @JsonValue
    public String toXml() {
        return encodeXml(false);
    }

    @Override
    public String toString() {
        return encodeXml(false);
    }

    protected static String open(String tag, boolean includeNamespaceDecl) {
        return includeNamespaceDecl ? "<" + tag + " xmlns=\"" + TYPES_NAMESPACE + "\">" : "<" + tag + ">";
    }

    protected static String close(String tag) {
        return "</" + tag + ">";
    }

    protected static String element(String tag, String escapedContent, boolean includeNamespaceDecl) {
        return open(tag, includeNamespaceDecl) + escapedContent + close(tag);
    }
}
