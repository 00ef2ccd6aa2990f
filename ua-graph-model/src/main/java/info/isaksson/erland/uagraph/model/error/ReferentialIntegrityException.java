package info.isaksson.erland.uagraph.model.error;

/** A reference points at a node that is not part of the graph. */
public class ReferentialIntegrityException extends UaGraphException {

    public ReferentialIntegrityException(String message) {
        super(message);
    }
}
