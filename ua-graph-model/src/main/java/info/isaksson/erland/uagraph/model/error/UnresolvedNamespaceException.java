package info.isaksson.erland.uagraph.model.error;

/** A namespace index that has no entry in the namespace map of the file being read. */
public class UnresolvedNamespaceException extends UaGraphException {

    public UnresolvedNamespaceException(String message) {
        super(message);
    }
}
