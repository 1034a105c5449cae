package me.golemcore.runstream.port.outbound;

/**
 * Transport or protocol failure talking to the agent backend.
 */
public class AgentGatewayException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int httpStatus;

    public AgentGatewayException(String message) {
        this(message, 0, null);
    }

    public AgentGatewayException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public AgentGatewayException(String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    /**
     * HTTP status of the failed call, or 0 when no response was received.
     */
    public int getHttpStatus() {
        return httpStatus;
    }
}
