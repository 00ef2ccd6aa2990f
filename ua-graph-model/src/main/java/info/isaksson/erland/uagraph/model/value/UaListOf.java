package info.isaksson.erland.uagraph.model.value;

import java.util.List;
import java.util.Objects;

public final class UaListOf extends UaValue {
    public final String elementTypeName;
    public final List<UaValue> values;

    public UaListOf(String elementTypeName, List<UaValue> values) {
        this.elementTypeName = Objects.requireNonNull(elementTypeName, "elementTypeName");
        this.values = values == null ? List.of() : List.copyOf(values);
    }

    @Override public String typeName() {
        return "ListOf" + elementTypeName;
    }

    @Override public String encodeXml(boolean includeNamespaceDecl) {
        StringBuilder sb = new StringBuilder(open(typeName(), includeNamespaceDecl));
        for (UaValue v : values) {
            sb.append(v.encodeXml(false));
        }
        return sb.append(close(typeName())).toString();
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof UaListOf)) return false;
        UaListOf that = (UaListOf) o;
        return elementTypeName.equals(that.elementTypeName) && values.equals(that.values);
    }

    @Override public int hashCode() {
        return Objects.hash(elementTypeName, values);
    }
}
