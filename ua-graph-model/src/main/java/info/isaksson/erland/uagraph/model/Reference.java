package info.isaksson.erland.uagraph.model;

import java.util.Comparator;

/** A typed directed edge between two node surrogates, always in forward orientation. */
public final class Reference {

    public static final Comparator<Reference> ORDER = Comparator
            .comparingInt((Reference r) -> r.src)
            .thenComparingInt(r -> r.trg)
            .thenComparingInt(r -> r.referenceType);

    public final int src;
    public final int trg;
    public final int referenceType;

    public Reference(int src, int trg, int referenceType) {
        this.src = src;
        this.trg = trg;
        this.referenceType = referenceType;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reference)) return false;
        Reference that = (Reference) o;
        return src == that.src && trg == that.trg && referenceType == that.referenceType;
    }

    @Override public int hashCode() {
        return (src * 31 + trg) * 31 + referenceType;
    }

    @Override public String toString() {
        return "(" + src + " -[" + referenceType + "]-> " + trg + ")";
    }
}
