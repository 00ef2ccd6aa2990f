package info.isaksson.erland.uagraph.model.error;

import java.util.List;

/** Requested type ids that are not among the type-class nodes. */
public class UnknownTypeException extends UaGraphException {

    private final List<Integer> missingIds;

    public UnknownTypeException(List<Integer> missingIds) {
        super("Missing requested types from type nodes: " + missingIds);
        this.missingIds = List.copyOf(missingIds);
    }

    public List<Integer> getMissingIds() {
        return missingIds;
    }
}
