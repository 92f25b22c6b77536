package marouter.placement.engine;

/**
 * The node directory could not produce a snapshot. Evaluation stops and
 * nothing is recorded; retrying is the caller's decision.
 */
public class SnapshotUnavailableException extends RuntimeException {

    public SnapshotUnavailableException(String message) {
        super(message);
    }

    public SnapshotUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
