package info.isaksson.erland.uagraph.model.value;

import java.util.Objects;
import java.util.Set;

/**
 * Any of the eight integer built-ins. UInt64 is held as an unsigned long.
 */
public class UaInteger extends UaValue {

    public static final Set<String> TYPE_NAMES =
            Set.of("SByte", "Byte", "Int16", "UInt16", "Int32", "UInt32", "Int64", "UInt64");

    private final String typeName;
    public final Long value;

    public UaInteger(String typeName, Long value) {
        if (!TYPE_NAMES.contains(typeName)) {
            throw new IllegalArgumentException("Not an integer type: " + typeName);
        }
        this.typeName = typeName;
        this.value = value;
    }

    public static UaInteger int32(int value) {
        return new UaInteger("Int32", (long) value);
    }

    public static UaInteger parse(String typeName, String text) {
        if (text == null || text.isEmpty()) return new UaInteger(typeName, null);
        long v = "UInt64".equals(typeName) ? Long.parseUnsignedLong(text) : Long.parseLong(text);
        return new UaInteger(typeName, v);
    }

    @Override public String typeName() {
        return typeName;
    }

    protected String lexical() {
        if (value == null) return "";
        return "UInt64".equals(typeName) ? Long.toUnsignedString(value) : value.toString();
    }

    @Override public String encodeXml(boolean includeNamespaceDecl) {
        return element(typeName, lexical(), includeNamespaceDecl);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        UaInteger that = (UaInteger) o;
        return typeName.equals(that.typeName) && Objects.equals(value, that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(typeName, value);
    }
}
