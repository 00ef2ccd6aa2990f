package info.isaksson.erland.uagraph.navigation;

import java.util.Comparator;

/** A directed pair of node surrogates without a reference type. */
public final class IdPair {

    public static final Comparator<IdPair> ORDER = Comparator
            .comparingInt((IdPair p) -> p.src)
            .thenComparingInt(p -> p.trg);

    public final int src;
    public final int trg;

    public IdPair(int src, int trg) {
        this.src = src;
        this.trg = trg;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdPair)) return false;
        IdPair that = (IdPair) o;
        return src == that.src && trg == that.trg;
    }

    @Override public int hashCode() {
        return src * 31 + trg;
    }

    @Override public String toString() {
        return "(" + src + ", " + trg + ")";
    }
}
