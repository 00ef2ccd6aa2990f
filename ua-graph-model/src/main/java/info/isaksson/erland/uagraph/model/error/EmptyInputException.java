package info.isaksson.erland.uagraph.model.error;

/** An operation was called with an empty required input. */
public class EmptyInputException extends UaGraphException {

    public EmptyInputException(String message) {
        super(message);
    }
}
