package dev.stdiobridge.server.process;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;

/**
 * Message-level view of the bridged child: one serialized writer, one inbox of decoded frames.
 */
public interface ChildChannel {

    /**
     * Write one message to the child. Concurrent callers never interleave frames.
     */
    void send(JsonNode message) throws IOException;

    /**
     * Take the next message emitted by the child, waiting if none is available.
     *
     * @throws IOException once the child's output is exhausted or corrupt; every later call fails the same way
     */
    JsonNode receive() throws IOException, InterruptedException;
}
