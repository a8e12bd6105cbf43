package msgrepl.common;

/**
 * Malformed client or peer input. Raised before anything is stored or sent.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
