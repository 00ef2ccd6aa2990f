package info.isaksson.erland.uagraph.model.value;

import java.util.Objects;

/**
 * An Int32 value of an enumeration DataType together with its label.
 *
 * <p>Encodes as the plain Int32 it was read from.</p>
 */
public final class UaEnumeration extends UaInteger {
    public final String label;
    public final String enumName;

    public UaEnumeration(int value, String label, String enumName) {
        super("Int32", (long) value);
        this.label = label;
        this.enumName = enumName;
    }

    public int intValue() {
        return value.intValue();
    }

    @Override public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        UaEnumeration that = (UaEnumeration) o;
        return Objects.equals(label, that.label) && Objects.equals(enumName, that.enumName);
    }

    @Override public int hashCode() {
        return Objects.hash(super.hashCode(), label, enumName);
    }
}
