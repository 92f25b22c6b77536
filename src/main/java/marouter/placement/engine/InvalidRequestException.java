package marouter.placement.engine;

/**
 * A placement request was rejected before filtering because one of its
 * values is missing or malformed.
 */
public class InvalidRequestException extends IllegalArgumentException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
