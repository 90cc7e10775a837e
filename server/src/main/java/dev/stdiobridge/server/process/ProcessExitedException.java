package dev.stdiobridge.server.process;

import java.io.IOException;

/**
 * The child's stdout reached end of stream, normally because the process exited.
 */
public class ProcessExitedException extends IOException {

    public ProcessExitedException(String message) {
        super(message);
    }
}
