package dev.stdiobridge.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Codec that writes and reads frames made of an ASCII {@code Content-Length: <n>\r\n\r\n} header
 * followed by exactly {@code n} bytes of UTF-8 encoded JSON.
 */
public final class ContentLengthCodec {

    public static final int MAX_HEADER_BYTES = 8 * 1024;
    public static final int MAX_CONTENT_LENGTH = 64 * 1024 * 1024;

    private static final String CONTENT_LENGTH = "content-length";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ContentLengthCodec() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static byte[] encode(JsonNode message) throws JsonProcessingException {
        byte[] payload = MAPPER.writeValueAsBytes(message);
        byte[] header = ("Content-Length: " + payload.length + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII);
        byte[] frame = new byte[header.length + payload.length];
        System.arraycopy(header, 0, frame, 0, header.length);
        System.arraycopy(payload, 0, frame, header.length, payload.length);
        return frame;
    }

    /**
     * Writes header and body with a single {@code write} call. Callers sharing a stream must still
     * serialize access to it.
     */
    public static void writeFrame(OutputStream out, JsonNode message) throws IOException {
        out.write(encode(message));
        out.flush();
    }

    /**
     * Reads one frame.
     *
     * @return the decoded message, or {@code null} when the stream ended cleanly before the first
     *     header byte
     * @throws FramingException when the header is malformed, the body is not JSON, or the stream
     *     ends inside a frame
     */
    public static JsonNode readFrame(InputStream in) throws IOException {
        String headerBlock = readHeaderBlock(in);
        if (headerBlock == null) {
            return null; // EOF at a frame boundary.
        }
        int length = parseContentLength(headerBlock);
        byte[] payload = readFully(in, length);
        try {
            JsonNode message = MAPPER.readTree(payload);
            if (message == null || message.isMissingNode()) {
                throw new FramingException("Empty JSON payload");
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new FramingException("Bad JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    private static String readHeaderBlock(InputStream in) throws IOException {
        ByteArrayOutputStream header = new ByteArrayOutputStream(64);
        int matched = 0;
        while (true) {
            int b = in.read();
            if (b == -1) {
                if (header.size() == 0) {
                    return null;
                }
                throw new FramingException("Unexpected end of stream while reading headers");
            }
            if (b > 0x7F) {
                throw new FramingException("Non-ASCII byte in frame header");
            }
            header.write(b);
            if (header.size() > MAX_HEADER_BYTES) {
                throw new FramingException("Frame header exceeds " + MAX_HEADER_BYTES + " bytes");
            }
            matched = nextTerminatorState(matched, b);
            if (matched == 4) {
                String text = header.toString(StandardCharsets.US_ASCII);
                return text.substring(0, text.length() - 4);
            }
        }
    }

    // Tracks progress through "\r\n\r\n"; returns how many terminator bytes are matched so far.
    private static int nextTerminatorState(int matched, int b) {
        if (b == '\r') {
            return matched == 2 ? 3 : 1;
        }
        if (b == '\n' && (matched == 1 || matched == 3)) {
            return matched + 1;
        }
        return 0;
    }

    private static int parseContentLength(String headerBlock) throws FramingException {
        String value = null;
        for (String line : headerBlock.split("\r\n")) {
            if (line.isEmpty()) {
                continue;
            }
            int colon = line.indexOf(':');
            if (colon < 0) {
                throw new FramingException("Malformed header line: " + line);
            }
            String name = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            if (CONTENT_LENGTH.equals(name)) {
                value = line.substring(colon + 1).trim();
            }
        }
        if (value == null) {
            throw new FramingException("Missing Content-Length header");
        }
        if (value.isEmpty() || !value.chars().allMatch(ch -> ch >= '0' && ch <= '9')) {
            throw new FramingException("Bad Content-Length: " + value);
        }
        long length;
        try {
            length = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new FramingException("Bad Content-Length: " + value, e);
        }
        if (length > MAX_CONTENT_LENGTH) {
            throw new FramingException("Frame too large: " + length);
        }
        return (int) length;
    }

    private static byte[] readFully(InputStream in, int length) throws IOException {
        byte[] buffer = new byte[length];
        int offset = 0;
        while (offset < length) {
            int read = in.read(buffer, offset, length - offset);
            if (read == -1) {
                throw new FramingException("Unexpected end of stream after reading " + offset + " of "
                    + length + " body bytes", new EOFException());
            }
            offset += read;
        }
        return buffer;
    }
}
