package info.isaksson.erland.uagraph.model.error;

/** Identifier text that does not follow {@code ns=<n>;<k>=<v>} or {@code <k>=<v>}. */
public class MalformedNodeIdException extends UaGraphException {

    public MalformedNodeIdException(String message) {
        super(message);
    }
}
