package info.isaksson.erland.uagraph.model.value;

import java.util.Objects;

/** One entry of an {@code EnumValues} property: numeric value plus display name. */
public final class UaEnumValueType extends UaValue {
    public final long value;
    public final UaLocalizedText displayName;
    public final UaLocalizedText description;

    public UaEnumValueType(long value, UaLocalizedText displayName, UaLocalizedText description) {
        this.value = value;
        this.displayName = displayName == null ? new UaLocalizedText(null, null) : displayName;
        this.description = description;
    }

    @Override public String typeName() {
        return "EnumValueType";
    }

    @Override public String encodeXml(boolean includeNamespaceDecl) {
        return open("EnumValueType", includeNamespaceDecl)
                + "<Value>" + value + "</Value>"
                + "<DisplayName>" + displayName.body() + "</DisplayName>"
                + (description == null ? "" : "<Description>" + description.body() + "</Description>")
                + close("EnumValueType");
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof UaEnumValueType)) return false;
        UaEnumValueType that = (UaEnumValueType) o;
        return value == that.value && displayName.equals(that.displayName) && Objects.equals(description, that.description);
    }

    @Override public int hashCode() {
        return Objects.hash(value, displayName, description);
    }
}
