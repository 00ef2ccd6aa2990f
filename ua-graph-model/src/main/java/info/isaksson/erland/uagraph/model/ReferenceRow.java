package info.isaksson.erland.uagraph.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;
import java.util.Objects;

/** A reference with textual identifiers. */
@JsonPropertyOrder({"src","trg","referenceType"})
public final class ReferenceRow {

    public static final Comparator<ReferenceRow> ORDER = Comparator
            .comparing((ReferenceRow r) -> r.src)
            .thenComparing(r -> r.trg)
            .thenComparing(r -> r.referenceType);

    public final NodeId src;
    public final NodeId trg;
    public final NodeId referenceType;

    public ReferenceRow(NodeId src, NodeId trg, NodeId referenceType) {
        this.src = Objects.requireNonNull(src, "src");
        this.trg = Objects.requireNonNull(trg, "trg");
        this.referenceType = Objects.requireNonNull(referenceType, "referenceType");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReferenceRow)) return false;
        ReferenceRow that = (ReferenceRow) o;
        return src.equals(that.src) && trg.equals(that.trg) && referenceType.equals(that.referenceType);
    }

    @Override public int hashCode() {
        return Objects.hash(src, trg, referenceType);
    }

    @Override public String toString() {
        return "(" + src + " -[" + referenceType + "]-> " + trg + ")";
    }
}
