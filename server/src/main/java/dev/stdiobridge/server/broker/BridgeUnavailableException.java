package dev.stdiobridge.server.broker;

/**
 * The child can no longer be reached: its output failed or a write to it did.
 */
public class BridgeUnavailableException extends RuntimeException {

    public BridgeUnavailableException(String message) {
        super(message);
    }

    public BridgeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
