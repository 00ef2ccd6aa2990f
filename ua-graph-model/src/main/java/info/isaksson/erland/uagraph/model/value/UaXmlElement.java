package info.isaksson.erland.uagraph.model.value;

/**
 * Value markup this model does not interpret, kept verbatim.
 *
 * <p>The markup carries its own namespace declarations, so the flag is ignored on encoding.</p>
 */
public final class UaXmlElement extends UaValue {
    private final String elementName;
    public final String xml;

    public UaXmlElement(String elementName, String xml) {
        this.elementName = elementName;
        this.xml = xml;
    }

    @Override public String typeName() {
        return elementName;
    }

    @Override public String encodeXml(boolean includeNamespaceDecl) {
        return xml;
    }

    @Override public boolean equals(Object o) {
        return o instanceof UaXmlElement && xml.equals(((UaXmlElement) o).xml);
    }

    @Override public int hashCode() {
        return xml.hashCode();
    }
}
