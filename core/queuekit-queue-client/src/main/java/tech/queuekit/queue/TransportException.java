package tech.queuekit.queue;

/**
 * Thrown when a queue operation fails in the transport: network, credentials,
 * or an error reported by the queue service itself.
 *
 * <p>Transport errors are recoverable. Consumers back off and poll again;
 * producers surface them to the caller.
 */
public class TransportException extends QueueKitException {

    private final String errorCode;
    private final boolean authenticationFailure;

    public TransportException(String message) {
        this(message, null, false, null);
    }

    public TransportException(String message, Throwable cause) {
        this(message, null, false, cause);
    }

    public TransportException(String message, String errorCode, boolean authenticationFailure, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.authenticationFailure = authenticationFailure;
    }

    /**
     * Service error code, or null when the failure happened before the service answered.
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * True when retrying soon is pointless: bad credentials, unknown endpoint or
     * a queue that does not exist.
     */
    public boolean isAuthenticationFailure() {
        return authenticationFailure;
    }
}
