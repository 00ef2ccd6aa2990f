package info.isaksson.erland.uagraph.navigation;

/** Options for the fixed-point closure. */
public final class ClosureOptions {
    /**
     * Maximum number of squaring rounds. Each round doubles the path length covered, so the default
     * handles any relation with a diameter below 2^63.
     */
    public int maxRounds = 64;

    public static ClosureOptions defaults() {
        return new ClosureOptions();
    }
}
