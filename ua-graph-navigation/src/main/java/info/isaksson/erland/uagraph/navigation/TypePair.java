package info.isaksson.erland.uagraph.navigation;

import java.util.Comparator;

/**
 * One pair of the reflexive-transitive subtype relation: {@code subtype} is {@code supertype} or derives from it.
 */
public final class TypePair {

    public static final Comparator<TypePair> ORDER = Comparator
            .comparingInt((TypePair p) -> p.supertype)
            .thenComparingInt(p -> p.subtype);

    public final int supertype;
    public final int subtype;

    public TypePair(int supertype, int subtype) {
        this.supertype = supertype;
        this.subtype = subtype;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypePair)) return false;
        TypePair that = (TypePair) o;
        return supertype == that.supertype && subtype == that.subtype;
    }

    @Override public int hashCode() {
        return supertype * 31 + subtype;
    }

    @Override public String toString() {
        return supertype + " :> " + subtype;
    }
}
