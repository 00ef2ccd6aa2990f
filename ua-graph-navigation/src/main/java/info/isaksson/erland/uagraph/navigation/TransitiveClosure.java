package info.isaksson.erland.uagraph.navigation;

import info.isaksson.erland.uagraph.model.error.ClosureDivergenceException;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strict transitive closure of a relation by repeated boolean matrix squaring.
 *
 * <p>The relation is held as one {@link BitSet} row per distinct endpoint. The identity is added, the
 * matrix is squared until the number of set cells stops changing, and the identity is removed again.
 * Each round doubles the path length covered, so the loop runs O(log diameter) times.</p>
 */
public final class TransitiveClosure {

    private TransitiveClosure() {}

    public static final class Result {
        /** Closure pairs sorted by (src, trg), diagonal excluded. */
        public final List<IdPair> pairs;
        /** Squaring rounds performed, the confirming round included. */
        public final int iterations;

        Result(List<IdPair> pairs, int iterations) {
            this.pairs = List.copyOf(pairs);
            this.iterations = iterations;
        }
    }

    public static List<IdPair> of(Collection<IdPair> edges) {
        return compute(edges, ClosureOptions.defaults()).pairs;
    }

    /**
     * @throws IllegalArgumentException when an edge is a self loop
     * @throws ClosureDivergenceException when no fixed point is reached within {@link ClosureOptions#maxRounds}
     */
    public static Result compute(Collection<IdPair> edges, ClosureOptions options) {
        if (edges == null) throw new IllegalArgumentException("edges must not be null");
        if (options == null) options = ClosureOptions.defaults();

        // Factorize sources first, then targets, in first-seen order.
        Map<Integer, Integer> codes = new LinkedHashMap<>();
        for (IdPair e : edges) {
            if (e.src == e.trg) {
                throw new IllegalArgumentException("There should be no self loops, found " + e);
            }
            codes.putIfAbsent(e.src, codes.size());
        }
        for (IdPair e : edges) {
            codes.putIfAbsent(e.trg, codes.size());
        }
        int n = codes.size();
        int[] uniques = new int[n];
        for (Map.Entry<Integer, Integer> c : codes.entrySet()) {
            uniques[c.getValue()] = c.getKey();
        }

        BitSet[] rows = new BitSet[n];
        for (int i = 0; i < n; i++) {
            rows[i] = new BitSet();
            rows[i].set(i);
        }
        for (IdPair e : edges) {
            rows[codes.get(e.src)].set(codes.get(e.trg));
        }

        long count = cardinality(rows);
        int iterations = 0;
        boolean fixedPoint = n == 0;
        while (!fixedPoint) {
            if (iterations >= options.maxRounds) {
                throw new ClosureDivergenceException("Transitive closure did not reach a fixed point within "
                        + options.maxRounds + " rounds over " + n + " nodes");
            }
            rows = square(rows);
            iterations++;
            long after = cardinality(rows);
            fixedPoint = after == count;
            count = after;
        }

        List<IdPair> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            BitSet row = rows[i];
            for (int j = row.nextSetBit(0); j >= 0; j = row.nextSetBit(j + 1)) {
                if (j != i) out.add(new IdPair(uniques[i], uniques[j]));
            }
        }
        out.sort(IdPair.ORDER);
        return new Result(out, iterations);
    }

    private static BitSet[] square(BitSet[] rows) {
        BitSet[] out = new BitSet[rows.length];
        for (int i = 0; i < rows.length; i++) {
            BitSet acc = new BitSet();
            BitSet row = rows[i];
            for (int k = row.nextSetBit(0); k >= 0; k = row.nextSetBit(k + 1)) {
                acc.or(rows[k]);
            }
            out[i] = acc;
        }
        return out;
    }

    private static long cardinality(BitSet[] rows) {
        long c = 0;
        for (BitSet r : rows) c += r.cardinality();
        return c;
    }
}
