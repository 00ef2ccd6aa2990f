package info.isaksson.erland.uagraph.core;

import info.isaksson.erland.uagraph.model.Node;
import info.isaksson.erland.uagraph.model.Reference;

import java.util.Objects;

/** A node at the other end of one reference, with the reference type's browse name resolved. */
public final class Neighbor {
    public final Reference reference;
    public final String referenceTypeBrowseName;
    public final Node node;

    public Neighbor(Reference reference, String referenceTypeBrowseName, Node node) {
        this.reference = Objects.requireNonNull(reference, "reference");
        this.referenceTypeBrowseName = referenceTypeBrowseName;
        this.node = Objects.requireNonNull(node, "node");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Neighbor)) return false;
        Neighbor that = (Neighbor) o;
        return reference.equals(that.reference)
                && Objects.equals(referenceTypeBrowseName, that.referenceTypeBrowseName)
                && node.equals(that.node);
    }

    @Override public int hashCode() {
        return Objects.hash(reference, referenceTypeBrowseName, node.id);
    }

    @Override public String toString() {
        return referenceTypeBrowseName + " " + node;
    }
}
