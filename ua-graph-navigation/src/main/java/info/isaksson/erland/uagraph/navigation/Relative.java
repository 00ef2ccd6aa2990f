package info.isaksson.erland.uagraph.navigation;

import java.util.List;
import java.util.Objects;

/**
 * A node reached from a seed after {@code hops} steps.
 *
 * <p>{@code path} lists every node from the seed to {@code end} when paths are kept; it is empty otherwise.</p>
 */
public final class Relative {
    public final int seed;
    public final int end;
    public final int hops;
    public final List<Integer> path;

    public Relative(int seed, int end, int hops, List<Integer> path) {
        this.seed = seed;
        this.end = end;
        this.hops = hops;
        this.path = path == null ? List.of() : List.copyOf(path);
    }

    /** Path element at {@code position}, 0 being the seed. */
    public int at(int position) {
        return path.get(position);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Relative)) return false;
        Relative that = (Relative) o;
        return seed == that.seed && end == that.end && hops == that.hops && path.equals(that.path);
    }

    @Override public int hashCode() {
        return Objects.hash(seed, end, hops, path);
    }

    @Override public String toString() {
        return seed + " -" + hops + "-> " + end + (path.isEmpty() ? "" : " " + path);
    }
}
