package info.isaksson.erland.uagraph.model.error;

/** Base type for every failure raised by the graph engine. */
public class UaGraphException extends RuntimeException {

    public UaGraphException(String message) {
        super(message);
    }

    public UaGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
