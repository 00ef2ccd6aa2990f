package info.isaksson.erland.uagraph.model.value;

import info.isaksson.erland.uagraph.model.NodeId;
import info.isaksson.erland.uagraph.model.XmlText;

import java.util.Objects;

/**
 * Structured value with an encoding id and a body.
 *
 * <p>Well-known bodies (EUInformation, Range) have their own value classes; this one carries the rest.</p>
 */
public class UaExtensionObject extends UaValue {
    public final NodeId typeId;
    public final UaValue body;

    public UaExtensionObject(NodeId typeId, UaValue body) {
        this.typeId = typeId;
        this.body = body;
    }

    @Override public String typeName() {
        return "ExtensionObject";
    }

    protected String encodedBody() {
        return body == null ? "" : body.encodeXml(false);
    }

    @Override public String encodeXml(boolean includeNamespaceDecl) {
        return open("ExtensionObject", includeNamespaceDecl)
                + "<TypeId>" + (typeId == null ? "" : "<Identifier>" + XmlText.escape(typeId.toString()) + "</Identifier>") + "</TypeId>"
                + "<Body>" + encodedBody() + "</Body>"
                + close("ExtensionObject");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        UaExtensionObject that = (UaExtensionObject) o;
        return Objects.equals(typeId, that.typeId) && Objects.equals(body, that.body);
    }

    @Override public int hashCode() {
        return Objects.hash(typeId, body);
    }
}
