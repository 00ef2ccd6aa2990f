package info.isaksson.erland.uagraph.model;

import info.isaksson.erland.uagraph.model.value.UaValue;

import java.util.Objects;

/**
 * One declared node in normalized form.
 *
 * <p>{@code id} is the dense surrogate of {@code nodeId}; {@code dataType}, {@code parentNodeId} and
 * {@code methodDeclarationId} are surrogates as well and null when the node does not carry them.</p>
 */
public final class Node {
    public final int id;
    public final NodeId nodeId;
    public final NodeClass nodeClass;
    public final int browseNameNamespace;
    public final String browseName;
    public final String displayName;
    public final String description;
    public final UaValue value;
    public final Integer dataType;
    public final Integer parentNodeId;
    public final Integer methodDeclarationId;
    public final NodeAttributes attributes;

    public Node(int id,
                NodeId nodeId,
                NodeClass nodeClass,
                int browseNameNamespace,
                String browseName,
                String displayName,
                String description,
                UaValue value,
                Integer dataType,
                Integer parentNodeId,
                Integer methodDeclarationId,
                NodeAttributes attributes) {
        this.id = id;
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.nodeClass = Objects.requireNonNull(nodeClass, "nodeClass");
        this.browseNameNamespace = browseNameNamespace;
        this.browseName = Objects.requireNonNull(browseName, "browseName");
        this.displayName = displayName == null ? "" : displayName;
        this.description = description == null ? "" : description;
        this.value = value;
        this.dataType = dataType;
        this.parentNodeId = parentNodeId;
        this.methodDeclarationId = methodDeclarationId;
        this.attributes = attributes == null ? NodeAttributes.empty(nodeClass) : attributes;
    }

    public int namespace() {
        return nodeId.namespace;
    }

    public Node withValue(UaValue newValue) {
        return new Node(id, nodeId, nodeClass, browseNameNamespace, browseName, displayName, description,
                newValue, dataType, parentNodeId, methodDeclarationId, attributes);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node)) return false;
        Node that = (Node) o;
        return id == that.id
                && browseNameNamespace == that.browseNameNamespace
                && nodeId.equals(that.nodeId)
                && nodeClass == that.nodeClass
                && browseName.equals(that.browseName)
                && displayName.equals(that.displayName)
                && description.equals(that.description)
                && Objects.equals(value, that.value)
                && Objects.equals(dataType, that.dataType)
                && Objects.equals(parentNodeId, that.parentNodeId)
                && Objects.equals(methodDeclarationId, that.methodDeclarationId)
                && attributes.equals(that.attributes);
    }

    @Override public int hashCode() {
        return Objects.hash(id, nodeId, nodeClass, browseNameNamespace, browseName);
    }

    @Override public String toString() {
        return nodeClass.xmlTag() + "[" + id + " " + nodeId + " " + browseNameNamespace + ":" + browseName + "]";
    }
}
