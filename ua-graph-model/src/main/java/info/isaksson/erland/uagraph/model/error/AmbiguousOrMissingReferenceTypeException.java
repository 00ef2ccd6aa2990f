package info.isaksson.erland.uagraph.model.error;

/** A well-known reference type could not be resolved to exactly one node. */
public class AmbiguousOrMissingReferenceTypeException extends AmbiguousLookupException {

    public AmbiguousOrMissingReferenceTypeException(String message) {
        super(message);
    }
}
