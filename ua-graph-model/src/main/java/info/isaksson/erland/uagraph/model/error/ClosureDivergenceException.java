package info.isaksson.erland.uagraph.model.error;

/** An iterative traversal did not settle within its iteration cap. */
public class ClosureDivergenceException extends UaGraphException {

    public ClosureDivergenceException(String message) {
        super(message);
    }
}
