package dev.stdiobridge.transport;

import java.io.IOException;

/**
 * Raised when the byte stream does not carry a well-formed Content-Length frame. The stream is not
 * recoverable afterwards.
 */
public class FramingException extends IOException {

    public FramingException(String message) {
        super(message);
    }

    public FramingException(String message, Throwable cause) {
        super(message, cause);
    }
}
