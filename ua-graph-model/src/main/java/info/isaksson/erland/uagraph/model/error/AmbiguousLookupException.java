package info.isaksson.erland.uagraph.model.error;

/** A lookup that must match exactly one element matched none or several. */
public class AmbiguousLookupException extends UaGraphException {

    public AmbiguousLookupException(String message) {
        super(message);
    }
}
