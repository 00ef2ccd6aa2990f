package info.isaksson.erland.uagraph.model.error;

/** Input rows that lack a required field or break a table invariant. */
public class SchemaException extends UaGraphException {

    public SchemaException(String message) {
        super(message);
    }
}
