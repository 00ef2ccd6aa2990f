package info.isaksson.erland.uagraph.model.value;

import java.util.Objects;

public final class UaBoolean extends UaValue {
    public final Boolean value;

    public UaBoolean(Boolean value) {
        this.value = value;
    }

    /** Accepts "true" and "True"; any other non-empty text is false. */
    public static UaBoolean parse(String text) {
        if (text == null || text.isEmpty()) return new UaBoolean(null);
        return new UaBoolean("true".equals(text) || "True".equals(text));
    }

    @Override public String typeName() {
        return "Boolean";
    }

    @Override public String encodeXml(boolean includeNamespaceDecl) {
        return element("Boolean", value == null ? "" : value.toString(), includeNamespaceDecl);
    }

    @Override public boolean equals(Object o) {
        return o instanceof UaBoolean && Objects.equals(value, ((UaBoolean) o).value);
    }

    @Override public int hashCode() {
        return Objects.hashCode(value);
    }
}
