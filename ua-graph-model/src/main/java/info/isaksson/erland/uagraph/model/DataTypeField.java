package info.isaksson.erland.uagraph.model;

import java.util.Objects;

/** One {@code <Field>} of a DataType {@code <Definition>}. */
public final class DataTypeField {
    public final String name;
    /** Field DataType, already remapped to the global namespace table; may be null. */
    public final NodeId dataType;
    /** Enumeration value; null for structure fields. */
    public final String value;
    public final String description;

    public DataTypeField(String name, NodeId dataType, String value, String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.dataType = dataType;
        this.value = value;
        this.description = description;
    }

    public DataTypeField withDataType(NodeId newDataType) {
        return new DataTypeField(name, newDataType, value, description);
    }

    public String encodeXml() {
        StringBuilder sb = new StringBuilder("<Field Name=\"").append(XmlText.escape(name)).append('"');
        if (dataType != null) sb.append(" DataType=\"").append(XmlText.escape(dataType.toString())).append('"');
        if (value != null) sb.append(" Value=\"").append(XmlText.escape(value)).append('"');
        if (description == null || description.isEmpty()) {
            return sb.append(" />").toString();
        }
        return sb.append("><Description>").append(XmlText.escape(description)).append("</Description></Field>").toString();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataTypeField)) return false;
        DataTypeField that = (DataTypeField) o;
        return name.equals(that.name)
                && Objects.equals(dataType, that.dataType)
                && Objects.equals(value, that.value)
                && Objects.equals(emptyToNull(description), emptyToNull(that.description));
    }

    @Override public int hashCode() {
        return Objects.hash(name, dataType, value, emptyToNull(description));
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
