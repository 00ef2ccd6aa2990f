package info.isaksson.erland.uagraph.model.error;

import java.util.List;

/**
 * Stored values that disagree with their declared DataType.
 *
 * <p>All offending rows of one validation pass are reported together.</p>
 */
public class ValidationException extends UaGraphException {

    private final List<String> invalidDisplayNames;

    public ValidationException(String message) {
        super(message);
        this.invalidDisplayNames = List.of();
    }

    public ValidationException(List<String> invalidDisplayNames) {
        super("Invalid Value for rows with the following display names: " + invalidDisplayNames + ".");
        this.invalidDisplayNames = List.copyOf(invalidDisplayNames);
    }

    public List<String> getInvalidDisplayNames() {
        return invalidDisplayNames;
    }
}
