package info.isaksson.erland.uagraph.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.uagraph.model.value.UaValue;

import java.util.Comparator;
import java.util.Objects;

/**
 * A node with every identifier column in textual form.
 *
 * <p>This is what the parser emits per file before normalization and what denormalization gives back.</p>
 */
@JsonPropertyOrder({"nodeId","nodeClass","browseNameNamespace","browseName","displayName","description",
        "dataType","parentNodeId","methodDeclarationId","attributes","value"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NodeRow {

    public static final Comparator<NodeRow> BY_NODE_ID = Comparator.comparing(r -> r.nodeId);

    public final NodeId nodeId;
    public final NodeClass nodeClass;
    public final int browseNameNamespace;
    public final String browseName;
    public final String displayName;
    public final String description;
    public final UaValue value;
    public final NodeId dataType;
    public final NodeId parentNodeId;
    public final NodeId methodDeclarationId;
    public final NodeAttributes attributes;

    public NodeRow(NodeId nodeId,
                   NodeClass nodeClass,
                   int browseNameNamespace,
                   String browseName,
                   String displayName,
                   String description,
                   UaValue value,
                   NodeId dataType,
                   NodeId parentNodeId,
                   NodeId methodDeclarationId,
                   NodeAttributes attributes) {
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

    @JsonIgnore
    public String qualifiedBrowseName() {
        return browseNameNamespace + ":" + browseName;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeRow)) return false;
        NodeRow that = (NodeRow) o;
        return browseNameNamespace == that.browseNameNamespace
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
        return Objects.hash(nodeId, nodeClass, browseNameNamespace, browseName, displayName);
    }

    @Override public String toString() {
        return nodeClass.xmlTag() + "[" + nodeId + " " + qualifiedBrowseName()
                + (value == null ? "" : " value=" + value) + "]";
    }
}
