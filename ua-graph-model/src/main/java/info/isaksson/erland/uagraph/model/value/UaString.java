package info.isaksson.erland.uagraph.model.value;

import info.isaksson.erland.uagraph.model.XmlText;

import java.util.Objects;

/** String or Guid; both are carried as text. */
public final class UaString extends UaValue {
    private final String typeName;
    public final String value;

    public UaString(String typeName, String value) {
        if (!"String".equals(typeName) && !"Guid".equals(typeName)) {
            throw new IllegalArgumentException("Not a string type: " + typeName);
        }
        this.typeName = typeName;
        this.value = value;
    }

    public static UaString of(String value) {
        return new UaString("String", value);
    }

    @Override public String typeName() {
        return typeName;
    }

    @Override public String encodeXml(boolean includeNamespaceDecl) {
        if ("Guid".equals(typeName)) {
            return open("Guid", includeNamespaceDecl) + "<String>" + XmlText.escape(value) + "</String>" + close("Guid");
        }
        return element(typeName, XmlText.escape(value), includeNamespaceDecl);
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof UaString)) return false;
        UaString that = (UaString) o;
        return typeName.equals(that.typeName) && Objects.equals(value, that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(typeName, value);
    }
}
