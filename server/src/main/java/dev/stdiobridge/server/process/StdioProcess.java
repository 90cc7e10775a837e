package dev.stdiobridge.server.process;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.stdiobridge.transport.ContentLengthCodec;
import dev.stdiobridge.transport.Wire;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supervises the bridged child process. A reader thread decodes the child's stdout into an inbox,
 * a second thread forwards stderr lines to the {@code child.stderr} logger, and writes to stdin
 * are serialized so frames never interleave.
 */
public class StdioProcess implements ChildChannel, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(StdioProcess.class);
    private static final Logger CHILD_STDERR = LoggerFactory.getLogger("child.stderr");

    public static final String HEALTH_PROBE_ID = "bridge-health-check";
    static final String CHANNEL = "child";

    // marks the end of the inbox; compared by identity
    private static final JsonNode END_OF_STREAM = JsonNodeFactory.instance.objectNode();

    private final ChildProcessSettings settings;
    private final BlockingDeque<JsonNode> inbox = new LinkedBlockingDeque<>();
    private final Object writeLock = new Object();

    private Process process;
    private OutputStream stdin;
    private Thread readerThread;
    private Thread stderrThread;
    private volatile IOException failure;
    private volatile boolean stopping;

    public StdioProcess(ChildProcessSettings settings) {
        this.settings = settings;
    }

    /**
     * Launch the child and, when configured, probe it. A failed probe is logged and ignored.
     */
    public void start() throws IOException {
        if (process != null) {
            return;
        }
        ProcessBuilder builder = new ProcessBuilder(settings.command());
        if (settings.workingDirectory() != null) {
            builder.directory(settings.workingDirectory().toFile());
        }
        builder.environment().putAll(settings.environment());
        process = builder.start();
        stdin = process.getOutputStream();
        LOGGER.info("Started child pid={} command={}", process.pid(), settings.command());

        readerThread = new Thread(this::readLoop, "child-stdout-reader");
        readerThread.setDaemon(true);
        readerThread.start();
        stderrThread = new Thread(this::pumpStderr, "child-stderr-pump");
        stderrThread.setDaemon(true);
        stderrThread.start();

        if (settings.healthProbe()) {
            boolean healthy = false;
            try {
                healthy = probe(settings.healthProbeTimeout());
            } catch (IOException e) {
                LOGGER.warn("Health probe could not be completed: {}", e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (healthy) {
                LOGGER.info("Child passed health probe");
            } else {
                LOGGER.warn("Child did not answer the health probe within {}; continuing anyway",
                    settings.healthProbeTimeout());
            }
        }
    }

    /**
     * Send an initialize request with a sentinel id and wait for its response. Anything else the
     * child emits meanwhile stays in the inbox, in order.
     *
     * @return {@code true} when a result with the sentinel id arrived in time
     */
    boolean probe(Duration timeout) throws IOException, InterruptedException {
        send(healthProbeRequest());
        long deadline = System.nanoTime() + timeout.toNanos();
        Deque<JsonNode> held = new ArrayDeque<>();
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                JsonNode message = inbox.pollFirst(remaining, TimeUnit.NANOSECONDS);
                if (message == null) {
                    return false;
                }
                if (message == END_OF_STREAM) {
                    held.addLast(message);
                    return false;
                }
                if (HEALTH_PROBE_ID.equals(message.path("id").textValue())) {
                    return message.has("result");
                }
                held.addLast(message);
            }
        } finally {
            for (Iterator<JsonNode> it = held.descendingIterator(); it.hasNext(); ) {
                inbox.addFirst(it.next());
            }
        }
    }

    static ObjectNode healthProbeRequest() {
        ObjectNode request = JsonNodeFactory.instance.objectNode();
        request.put("jsonrpc", "2.0");
        request.put("id", HEALTH_PROBE_ID);
        request.put("method", "initialize");
        ObjectNode params = request.putObject("params");
        params.put("protocolVersion", "2024-11-05");
        params.putObject("capabilities");
        ObjectNode clientInfo = params.putObject("clientInfo");
        clientInfo.put("name", "Bridge Health Check");
        clientInfo.put("version", "1.0.0");
        return request;
    }

    @Override
    public void send(JsonNode message) throws IOException {
        if (stdin == null) {
            throw new IOException("Child process not started");
        }
        synchronized (writeLock) {
            Wire.tx(CHANNEL, message);
            ContentLengthCodec.writeFrame(stdin, message);
        }
    }

    @Override
    public JsonNode receive() throws IOException, InterruptedException {
        JsonNode message = inbox.takeFirst();
        if (message == END_OF_STREAM) {
            inbox.putFirst(END_OF_STREAM);
            throw failure;
        }
        return message;
    }

    private void readLoop() {
        try (InputStream stdout = process.getInputStream()) {
            while (true) {
                JsonNode message = ContentLengthCodec.readFrame(stdout);
                if (message == null) {
                    failure = new ProcessExitedException("Child process closed its output" + exitDescription());
                    break;
                }
                Wire.rx(CHANNEL, message);
                inbox.putLast(message);
            }
        } catch (IOException e) {
            failure = e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = new IOException("Child reader interrupted", e);
        } finally {
            if (failure == null) {
                failure = new ProcessExitedException("Child reader stopped");
            }
            if (stopping) {
                LOGGER.debug("Child reader finished during shutdown: {}", failure.getMessage());
            } else {
                LOGGER.error("Child output ended: {}", failure.getMessage());
            }
            inbox.addLast(END_OF_STREAM);
        }
    }

    private String exitDescription() {
        try {
            if (process.waitFor(1, TimeUnit.SECONDS)) {
                return " (exit code " + process.exitValue() + ")";
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return "";
    }

    private void pumpStderr() {
        try (BufferedReader reader = new BufferedReader(
            new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                CHILD_STDERR.info(line);
            }
        } catch (IOException e) {
            if (!stopping) {
                LOGGER.warn("Error reading child stderr", e);
            }
        }
    }

    public boolean isAlive() {
        return process != null && process.isAlive();
    }

    public long pid() {
        return process == null ? -1 : process.pid();
    }

    /**
     * Stop the child: close its stdin and ask it to exit, kill it after the grace period, then
     * reap the pump threads.
     */
    public void terminate() {
        if (process == null || stopping) {
            return;
        }
        stopping = true;
        try {
            stdin.close();
        } catch (IOException e) {
            LOGGER.debug("Error closing child stdin", e);
        }
        process.destroy();
        try {
            if (!process.waitFor(settings.shutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Child pid={} did not exit within {}; killing it", process.pid(),
                    settings.shutdownGracePeriod());
                process.destroyForcibly();
                process.waitFor(settings.shutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS);
            }
            readerThread.join(Duration.ofSeconds(1).toMillis());
            stderrThread.join(Duration.ofSeconds(1).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Child process stopped");
    }

    @Override
    public void close() {
        terminate();
    }
}
