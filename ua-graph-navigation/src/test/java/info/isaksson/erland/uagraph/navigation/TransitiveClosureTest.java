package info.isaksson.erland.uagraph.navigation;

import info.isaksson.erland.uagraph.model.error.ClosureDivergenceException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransitiveClosureTest {

    private static List<IdPair> chain(int length) {
        List<IdPair> edges = new ArrayList<>();
        for (int i = 0; i < length; i++) edges.add(new IdPair(i, i + 1));
        return edges;
    }

    @Test
    void chainOfTwoEdgesClosesInTwoRounds() {
        TransitiveClosure.Result r = TransitiveClosure.compute(
                List.of(new IdPair(1, 2), new IdPair(2, 3)), ClosureOptions.defaults());

        assertEquals(List.of(new IdPair(1, 2), new IdPair(1, 3), new IdPair(2, 3)), r.pairs);
        assertEquals(2, r.iterations);
    }

    @Test
    void roundsGrowLogarithmicallyWithPathLength() {
        TransitiveClosure.Result r = TransitiveClosure.compute(chain(16), ClosureOptions.defaults());

        assertEquals(16 * 17 / 2, r.pairs.size());
        assertTrue(r.iterations <= 6, "iterations " + r.iterations);
    }

    @Test
    void cycleProducesEveryOffDiagonalPair() {
        List<IdPair> pairs = TransitiveClosure.of(List.of(new IdPair(7, 8), new IdPair(8, 9), new IdPair(9, 7)));

        assertEquals(6, pairs.size());
        assertTrue(pairs.contains(new IdPair(9, 8)));
        assertFalse(pairs.contains(new IdPair(7, 7)));
    }

    @Test
    void emptyRelationIsAlreadyAFixedPoint() {
        TransitiveClosure.Result r = TransitiveClosure.compute(List.of(), ClosureOptions.defaults());

        assertTrue(r.pairs.isEmpty());
        assertEquals(0, r.iterations);
    }

    @Test
    void selfLoopsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> TransitiveClosure.of(List.of(new IdPair(4, 4))));
    }

    @Test
    void roundCapStopsTheIteration() {
        ClosureOptions options = new ClosureOptions();
        options.maxRounds = 1;

        assertThrows(ClosureDivergenceException.class, () -> TransitiveClosure.compute(chain(3), options));
    }
}
