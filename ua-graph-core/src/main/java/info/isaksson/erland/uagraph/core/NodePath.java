package info.isaksson.erland.uagraph.core;

import info.isaksson.erland.uagraph.model.NodeId;

import java.util.Objects;

/** A node reached from a root object, with the '/'-joined browse names leading to it. */
public final class NodePath {
    public final int id;
    public final NodeId nodeId;
    public final String path;

    public NodePath(int id, NodeId nodeId, String path) {
        this.id = id;
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodePath)) return false;
        NodePath that = (NodePath) o;
        return id == that.id && nodeId.equals(that.nodeId) && path.equals(that.path);
    }

    @Override public int hashCode() {
        return Objects.hash(id, nodeId, path);
    }

    @Override public String toString() {
        return path + " (" + nodeId + ")";
    }
}
