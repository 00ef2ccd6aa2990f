package info.isaksson.erland.uagraph.model.value;

import info.isaksson.erland.uagraph.model.NodeId;
import info.isaksson.erland.uagraph.model.XmlText;

import java.util.Objects;

/** A NodeId carried as a value. The identifier is kept exactly as written. */
public final class UaNodeIdValue extends UaValue {
    public final NodeId value;

    public UaNodeIdValue(NodeId value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override public String typeName() {
        return "NodeId";
    }

    @Override public String encodeXml(boolean includeNamespaceDecl) {
        return open("NodeId", includeNamespaceDecl)
                + "<Identifier>" + XmlText.escape(value.toString()) + "</Identifier>"
                + close("NodeId");
    }

    @Override public boolean equals(Object o) {
        return o instanceof UaNodeIdValue && value.equals(((UaNodeIdValue) o).value);
    }

    @Override public int hashCode() {
        return value.hashCode();
    }
}
