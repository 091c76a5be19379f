package io.avalonrest.core;

/**
 * Base class for request-level failures that map to a client-visible status.
 *
 * <p>Every dispatch stage classifies its own failures into one of the nested kinds. The
 * message of these exceptions is written to the response body; any other exception is
 * reported to the client as a generic internal error.
 */
public abstract class AvalonRestException extends RuntimeException {

    private final int status;

    protected AvalonRestException(int status, String message) {
        super(message);
        this.status = status;
    }

    protected AvalonRestException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * HTTP status this failure is reported with.
     */
    public int status() {
        return status;
    }

    /**
     * Raised for malformed or invalid client-supplied data (bad JSON, failed conversion,
     * missing required header or body, malformed multipart).
     */
    public static class BadInput extends AvalonRestException {
        public BadInput(String message) {
            super(400, message);
        }

        public BadInput(String message, Throwable cause) {
            super(400, message, cause);
        }
    }

    /**
     * Raised when the request body exceeds the configured maximum size.
     */
    public static class PayloadTooLarge extends AvalonRestException {
        private final long maxBytes;
        private final long receivedBytes;

        public PayloadTooLarge(long maxBytes, long receivedBytes) {
            super(413, "Payload exceeds maximum size of " + maxBytes + " bytes");
            this.maxBytes = maxBytes;
            this.receivedBytes = receivedBytes;
        }

        public long maxBytes() {
            return maxBytes;
        }

        /**
         * Bytes received or declared when the limit tripped, or {@code -1} if unknown.
         */
        public long receivedBytes() {
            return receivedBytes;
        }
    }

    /**
     * Raised when no handler or handler method matches.
     */
    public static class NotFound extends AvalonRestException {
        public NotFound(String message) {
            super(404, message);
        }
    }

    /**
     * Raised when a credential is missing, malformed, unsupported or rejected.
     */
    public static class Unauthenticated extends AvalonRestException {
        public Unauthenticated(String message) {
            super(401, message);
        }
    }

    /**
     * Raised when a verified identity lacks every required role.
     */
    public static class Forbidden extends AvalonRestException {
        public Forbidden(String message) {
            super(403, message);
        }
    }
}
