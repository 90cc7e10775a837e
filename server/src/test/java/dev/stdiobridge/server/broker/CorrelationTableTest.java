package dev.stdiobridge.server.broker;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class CorrelationTableTest {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final CorrelationTable table = new CorrelationTable();

    @Test
    void onlyStringAndNumberIdsAreCorrelatable() {
        assertThat(CorrelationTable.isCorrelatable(JSON.textNode("a"))).isTrue();
        assertThat(CorrelationTable.isCorrelatable(JSON.numberNode(7))).isTrue();
        assertThat(CorrelationTable.isCorrelatable(JSON.nullNode())).isFalse();
        assertThat(CorrelationTable.isCorrelatable(JSON.objectNode())).isFalse();
        assertThat(CorrelationTable.isCorrelatable(null)).isFalse();
    }

    @Test
    void popRemovesTheOwner() {
        table.register(JSON.textNode("r1"), "s1", NOW);

        assertThat(table.pop(JSON.textNode("r1"))).contains("s1");
        assertThat(table.pop(JSON.textNode("r1"))).isEmpty();
        assertThat(table.pop(JSON.nullNode())).isEmpty();
    }

    @Test
    void stringAndNumberIdsDoNotCollide() {
        table.register(JSON.textNode("1"), "textual", NOW);
        table.register(JSON.numberNode(1), "numeric", NOW);

        assertThat(table.size()).isEqualTo(2);
        assertThat(table.pop(JSON.numberNode(1))).contains("numeric");
        assertThat(table.pop(JSON.textNode("1"))).contains("textual");
    }

    @Test
    void numericIdsMatchAcrossRepresentations() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        JsonNode parsed = mapper.readTree("{\"id\":42}").get("id");
        table.register(parsed, "s1", NOW);
        table.register(mapper.readTree("1.50"), "s2", NOW);

        assertThat(table.pop(JSON.numberNode(42L))).contains("s1");
        assertThat(table.pop(mapper.readTree("1.5"))).contains("s2");
    }

    @Test
    void integralAndFractionalIdsDoNotCollide() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        table.register(mapper.readTree("1"), "integral", NOW);
        table.register(mapper.readTree("1.0"), "fractional", NOW);

        assertThat(table.size()).isEqualTo(2);
        assertThat(table.pop(mapper.readTree("1.0"))).contains("fractional");
        assertThat(table.pop(mapper.readTree("1"))).contains("integral");
    }

    @Test
    void registerReportsTheReplacedOwner() {
        assertThat(table.register(JSON.numberNode(3), "s1", NOW)).isEmpty();
        assertThat(table.register(JSON.numberNode(3), "s2", NOW)).contains("s1");
        assertThat(table.pop(JSON.numberNode(3))).contains("s2");
    }

    @Test
    void releaseOnlyRemovesEntriesOwnedByTheSession() {
        table.register(JSON.numberNode(3), "s2", NOW);

        assertThat(table.release(JSON.numberNode(3), "s1")).isFalse();
        assertThat(table.release(JSON.numberNode(3), "s2")).isTrue();
        assertThat(table.size()).isZero();
    }

    @Test
    void removeSessionDropsAllItsEntries() {
        table.register(JSON.numberNode(1), "s1", NOW);
        table.register(JSON.numberNode(2), "s1", NOW);
        table.register(JSON.numberNode(3), "s2", NOW);

        assertThat(table.removeSession("s1")).isEqualTo(2);
        assertThat(table.size()).isEqualTo(1);
    }

    @Test
    void expireDropsOnlyOldEntries() {
        table.register(JSON.numberNode(1), "s1", NOW);
        table.register(JSON.numberNode(2), "s1", NOW.plusSeconds(50));

        assertThat(table.expireOlderThan(Duration.ofSeconds(30), NOW.plusSeconds(60))).isEqualTo(1);
        assertThat(table.pop(JSON.numberNode(2))).contains("s1");
    }
}
