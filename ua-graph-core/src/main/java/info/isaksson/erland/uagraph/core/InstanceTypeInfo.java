package info.isaksson.erland.uagraph.core;

import info.isaksson.erland.uagraph.model.Node;

import java.util.Objects;

/** An instance joined with the type its {@code HasTypeDefinition} reference points at. */
public final class InstanceTypeInfo {
    public final Node instance;
    public final Node type;

    public InstanceTypeInfo(Node instance, Node type) {
        this.instance = Objects.requireNonNull(instance, "instance");
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InstanceTypeInfo)) return false;
        InstanceTypeInfo that = (InstanceTypeInfo) o;
        return instance.equals(that.instance) && type.equals(that.type);
    }

    @Override public int hashCode() {
        return Objects.hash(instance.id, type.id);
    }

    @Override public String toString() {
        return instance.browseName + " : " + type.browseName;
    }
}
