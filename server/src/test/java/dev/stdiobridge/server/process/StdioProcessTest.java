package dev.stdiobridge.server.process;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.stdiobridge.transport.ContentLengthCodec;
import dev.stdiobridge.transport.FramingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class StdioProcessTest {

    private final List<StdioProcess> started = new ArrayList<>();

    @AfterEach
    void stopChildren() {
        started.forEach(StdioProcess::terminate);
    }

    @Test
    void echoesFramesThroughTheChild() throws Exception {
        StdioProcess process = start(ChildProcessSettings.of(List.of("cat")));
        ObjectNode request = request(1, "tools/list");

        process.send(request);
        process.send(request(2, "résumé ✓"));

        assertThat(process.receive()).isEqualTo(request);
        assertThat(process.receive().get("method").asText()).isEqualTo("résumé ✓");
        assertThat(process.isAlive()).isTrue();
        assertThat(process.pid()).isPositive();
    }

    @Test
    void probeSucceedsAndKeepsEarlierMessagesInOrder() throws Exception {
        ObjectNode first = notification("notifications/first");
        ObjectNode second = notification("notifications/second");
        ObjectNode answer = JsonNodeFactory.instance.objectNode();
        answer.put("jsonrpc", "2.0");
        answer.put("id", StdioProcess.HEALTH_PROBE_ID);
        answer.putObject("result").put("protocolVersion", "2024-11-05");
        ObjectNode after = notification("notifications/after");
        StdioProcess process = start(emitting(first, second, answer, after));

        assertThat(process.probe(Duration.ofSeconds(5))).isTrue();

        assertThat(process.receive()).isEqualTo(first);
        assertThat(process.receive()).isEqualTo(second);
        assertThat(process.receive()).isEqualTo(after);
    }

    @Test
    void probeFailsOnErrorResponse() throws Exception {
        ObjectNode answer = JsonNodeFactory.instance.objectNode();
        answer.put("jsonrpc", "2.0");
        answer.put("id", StdioProcess.HEALTH_PROBE_ID);
        answer.putObject("error").put("code", -32601);
        StdioProcess process = start(emitting(answer));

        assertThat(process.probe(Duration.ofSeconds(5))).isFalse();
    }

    @Test
    void probeTimesOutWhenTheChildStaysSilent() throws Exception {
        StdioProcess process = start(ChildProcessSettings.of(List.of("sh", "-c", "sleep 5")));

        assertThat(process.probe(Duration.ofMillis(200))).isFalse();
    }

    @Test
    void failedProbeDoesNotStopTheChild() throws Exception {
        StdioProcess process = start(new ChildProcessSettings(List.of("cat"), null, Map.of(), null, true,
            Duration.ofMillis(300)));

        assertThat(process.isAlive()).isTrue();
        ObjectNode request = request(9, "ping");
        process.send(request);
        // the echoed probe request carries the sentinel id but no result, so it was consumed as a failed answer
        assertThat(process.receive()).isEqualTo(request);
    }

    @Test
    void malformedOutputIsAFramingError() throws Exception {
        StdioProcess process = start(ChildProcessSettings.of(
            List.of("sh", "-c", "printf 'Content-Length: abc\\r\\n\\r\\n{}'; sleep 5")));

        assertThatThrownBy(process::receive).isInstanceOf(FramingException.class);
        assertThatThrownBy(process::receive).isInstanceOf(FramingException.class);
    }

    @Test
    void exitIsReportedToEveryReceiver() throws Exception {
        StdioProcess process = start(ChildProcessSettings.of(List.of("sh", "-c", "exit 3")));

        assertThatThrownBy(process::receive).isInstanceOf(ProcessExitedException.class)
            .hasMessageContaining("exit code 3");
        assertThatThrownBy(process::receive).isInstanceOf(ProcessExitedException.class);
    }

    @Test
    void appliesWorkingDirectoryAndEnvironment(@TempDir Path directory) throws Exception {
        String script = "body=\"{\\\"dir\\\":\\\"$(pwd -P)\\\",\\\"v\\\":\\\"$BRIDGE_TEST_VAR\\\"}\"; "
            + "printf 'Content-Length: %d\\r\\n\\r\\n%s' ${#body} \"$body\"; sleep 5";
        StdioProcess process = start(new ChildProcessSettings(List.of("sh", "-c", script), directory,
            Map.of("BRIDGE_TEST_VAR", "hello"), null, false, null));

        JsonNode reported = process.receive();

        assertThat(reported.get("dir").asText()).isEqualTo(directory.toRealPath().toString());
        assertThat(reported.get("v").asText()).isEqualTo("hello");
    }

    @Test
    void terminateKillsAChildThatIgnoresTheStopSignal() throws Exception {
        StdioProcess process = start(new ChildProcessSettings(
            List.of("sh", "-c", "trap '' TERM; exec sleep 30"), null, Map.of(), Duration.ofMillis(200), false, null));

        process.terminate();

        assertThat(process.isAlive()).isFalse();
    }

    @Test
    void sendBeforeStartFails() {
        StdioProcess process = new StdioProcess(ChildProcessSettings.of(List.of("cat")));

        assertThatThrownBy(() -> process.send(request(1, "ping"))).hasMessageContaining("not started");
    }

    @Test
    void emptyCommandIsRejected() {
        assertThatThrownBy(() -> ChildProcessSettings.of(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    private StdioProcess start(ChildProcessSettings settings) throws Exception {
        StdioProcess process = new StdioProcess(settings);
        started.add(process);
        process.start();
        return process;
    }

    private static ChildProcessSettings emitting(JsonNode... messages) throws Exception {
        StringBuilder payload = new StringBuilder();
        for (JsonNode message : messages) {
            payload.append(new String(ContentLengthCodec.encode(message), StandardCharsets.UTF_8));
        }
        return ChildProcessSettings.of(List.of("sh", "-c", "printf '%s' \"$1\"; sleep 5", "sh", payload.toString()));
    }

    private static ObjectNode request(int id, String method) {
        ObjectNode request = JsonNodeFactory.instance.objectNode();
        request.put("jsonrpc", "2.0");
        request.put("id", id);
        request.put("method", method);
        return request;
    }

    private static ObjectNode notification(String method) {
        ObjectNode notification = JsonNodeFactory.instance.objectNode();
        notification.put("jsonrpc", "2.0");
        notification.put("method", method);
        return notification;
    }
}
