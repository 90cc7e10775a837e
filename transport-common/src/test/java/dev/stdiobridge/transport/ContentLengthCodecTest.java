package dev.stdiobridge.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ContentLengthCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void writesExactHeaderAndCompactBody() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        ContentLengthCodec.writeFrame(out, mapper.readTree("{ \"jsonrpc\" : \"2.0\", \"id\" : 1 }"));

        assertThat(out.toString(StandardCharsets.UTF_8))
            .isEqualTo("Content-Length: 24\r\n\r\n{\"jsonrpc\":\"2.0\",\"id\":1}");
    }

    @Test
    void contentLengthCountsUtf8BytesNotCharacters() throws IOException {
        byte[] frame = ContentLengthCodec.encode(mapper.readTree("{\"msg\":\"héllo ✓\"}"));

        String text = new String(frame, StandardCharsets.UTF_8);
        int body = text.indexOf("\r\n\r\n") + 4;
        int declared = Integer.parseInt(text.substring("Content-Length: ".length(), text.indexOf('\r')));
        assertThat(declared).isEqualTo(frame.length - body);
        assertThat(declared).isGreaterThan(text.length() - body);
    }

    @Test
    void roundTripPreservesIdLiteralType() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        JsonNode stringId = mapper.readTree("{\"jsonrpc\":\"2.0\",\"id\":\"1\",\"method\":\"ping\"}");
        JsonNode numberId = mapper.readTree("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}");
        ContentLengthCodec.writeFrame(out, stringId);
        ContentLengthCodec.writeFrame(out, numberId);

        InputStream in = new ByteArrayInputStream(out.toByteArray());
        JsonNode first = ContentLengthCodec.readFrame(in);
        JsonNode second = ContentLengthCodec.readFrame(in);

        assertThat(first).isEqualTo(stringId);
        assertThat(second).isEqualTo(numberId);
        assertThat(first.get("id").isTextual()).isTrue();
        assertThat(second.get("id").isNumber()).isTrue();
        assertThat(first.get("id")).isNotEqualTo(second.get("id"));
        assertThat(ContentLengthCodec.readFrame(in)).isNull();
    }

    @Test
    void roundTripsNestedValues() throws IOException {
        JsonNode value = mapper.readTree(
            "{\"a\":[1,2.5,null,true,{\"b\":\"\\u0000x\"}],\"c\":{},\"d\":[],\"e\":-7,\"f\":\"ünï\"}");
        InputStream in = new ByteArrayInputStream(ContentLengthCodec.encode(value));

        assertThat(ContentLengthCodec.readFrame(in)).isEqualTo(value);
    }

    @Test
    void headerNameIsCaseInsensitiveAndExtraHeadersAreIgnored() throws IOException {
        String frame = "content-type: application/json\r\nCONTENT-LENGTH:  2\r\n\r\n{}";

        JsonNode message = ContentLengthCodec.readFrame(stream(frame));

        assertThat(message.isObject()).isTrue();
        assertThat(message.size()).isZero();
    }

    @Test
    void loopsOverShortReads() throws IOException {
        byte[] frame = ContentLengthCodec.encode(mapper.readTree("{\"result\":\"" + "x".repeat(500) + "\"}"));
        InputStream trickle = new ByteArrayInputStream(frame) {
            @Override
            public synchronized int read(byte[] b, int off, int len) {
                return super.read(b, off, Math.min(len, 7));
            }
        };

        assertThat(ContentLengthCodec.readFrame(trickle).get("result").asText()).hasSize(500);
    }

    @Test
    void missingContentLengthIsAFramingError() {
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("X-Other: 1\r\n\r\n{}")))
            .isInstanceOf(FramingException.class)
            .hasMessageContaining("Missing Content-Length");
    }

    @Test
    void nonNumericContentLengthIsAFramingError() {
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("Content-Length: 1x\r\n\r\n{}")))
            .isInstanceOf(FramingException.class)
            .hasMessageContaining("Bad Content-Length");
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("Content-Length: -2\r\n\r\n{}")))
            .isInstanceOf(FramingException.class);
    }

    @Test
    void headerLineWithoutColonIsAFramingError() {
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("garbage\r\n\r\n{}")))
            .isInstanceOf(FramingException.class)
            .hasMessageContaining("Malformed header");
    }

    @Test
    void eofInsideBodyIsAFramingError() {
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("Content-Length: 10\r\n\r\n{\"a\":")))
            .isInstanceOf(FramingException.class)
            .hasMessageContaining("Unexpected end of stream");
    }

    @Test
    void eofInsideHeaderIsAFramingError() {
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("Content-Length: 2\r\n")))
            .isInstanceOf(FramingException.class);
    }

    @Test
    void invalidJsonBodyIsAFramingError() {
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("Content-Length: 3\r\n\r\n{x}")))
            .isInstanceOf(FramingException.class)
            .hasMessageContaining("Bad JSON");
    }

    @Test
    void bareLineFeedsDoNotTerminateTheHeader() {
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("Content-Length: 2\n\n{}")))
            .isInstanceOf(FramingException.class);
    }

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
