package msgrepl.rpc;

/**
 * A failed call to a peer. Never thrown for a successful or duplicate delivery.
 */
public class TransportException extends RuntimeException {

    public enum Failure {
        /** no answer within the per-call deadline */
        TIMEOUT,
        /** connection refused, peer down or filtered out */
        UNREACHABLE,
        /** peer answered but refused the request */
        REJECTED,
        ERROR
    }

    private final int peerId;
    private final Failure failure;

    public TransportException(int peerId, Failure failure, String message) {
        super(message);
        this.peerId = peerId;
        this.failure = failure;
    }

    public TransportException(int peerId, Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.peerId = peerId;
        this.failure = failure;
    }

    public int getPeerId() {
        return peerId;
    }

    public Failure getFailure() {
        return failure;
    }

    @Override
    public String getMessage() {
        return failure + " peer=" + peerId + ": " + super.getMessage();
    }
}
