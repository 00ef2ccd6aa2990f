package info.isaksson.erland.uagraph.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/** Structure or enumeration layout carried by a DataType node. */
public final class DataTypeDefinition {
    public final String name;
    public final List<DataTypeField> fields;

    public DataTypeDefinition(String name, List<DataTypeField> fields) {
        this.name = Objects.requireNonNull(name, "name");
        this.fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public DataTypeDefinition mapFieldDataTypes(Function<NodeId, NodeId> mapper) {
        List<DataTypeField> out = new ArrayList<>(fields.size());
        for (DataTypeField f : fields) {
            out.add(f.dataType == null ? f : f.withDataType(mapper.apply(f.dataType)));
        }
        return new DataTypeDefinition(name, out);
    }

    public String encodeXml() {
        StringBuilder sb = new StringBuilder("<Definition Name=\"").append(XmlText.escape(name)).append("\">");
        for (DataTypeField f : fields) {
            sb.append(f.encodeXml());
        }
        return sb.append("</Definition>").toString();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataTypeDefinition)) return false;
        DataTypeDefinition that = (DataTypeDefinition) o;
        return name.equals(that.name) && fields.equals(that.fields);
    }

    @Override public int hashCode() {
        return Objects.hash(name, fields);
    }

    @Override public String toString() {
        return encodeXml();
    }
}
