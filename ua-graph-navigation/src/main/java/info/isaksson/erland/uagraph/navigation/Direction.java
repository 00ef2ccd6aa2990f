package info.isaksson.erland.uagraph.navigation;

/** Which way edges are followed by {@link RelativeFinder}. */
public enum Direction {
    /** Src to Trg. */
    DESCENDANT,
    /** Trg to Src. */
    ANCESTOR
}
