package dev.stdiobridge.server.filter.builtin;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import dev.stdiobridge.server.filter.Direction;
import dev.stdiobridge.server.filter.FilterAction;
import dev.stdiobridge.server.filter.FilterConfig;
import dev.stdiobridge.server.filter.FilterInvocation;
import dev.stdiobridge.server.filter.FilterVerdict;
import dev.stdiobridge.server.filter.PiiCategories;

class SecretMaskingFilterTest {

	private final ObjectMapper mapper = new ObjectMapper();

	private final SecretMaskingFilter filter = new SecretMaskingFilter();

	@Test
	void masksKeysAndTokens() throws Exception {
		FilterVerdict verdict = apply("{\"env\":\"api_key=abcdefghijklmnop\",\"note\":\"use sk-ABCDEFGHIJKLMNOPQRSTUV now\","
				+ "\"auth\":\"Bearer token: 0123456789abcdef\"}");

		assertThat(verdict.actions()).containsExactly(FilterAction.SECRETS_MASKED);
		assertThat(verdict.redactions()).containsEntry(PiiCategories.SECRET, 3);
		assertThat(verdict.message().get("env").asText()).isEqualTo("[REDACTED]");
		assertThat(verdict.message().get("note").asText()).isEqualTo("use [REDACTED] now");
		assertThat(verdict.message().get("auth").asText()).isEqualTo("[REDACTED]");
	}

	@Test
	void leavesShortValuesAndOrdinaryTextAlone() throws Exception {
		FilterVerdict verdict = apply("{\"a\":\"api_key=short\",\"b\":\"the sk- prefix\"}");

		assertThat(verdict.actions()).isEmpty();
		assertThat(verdict.message().get("a").asText()).isEqualTo("api_key=short");
	}

	private FilterVerdict apply(String json) throws Exception {
		return this.filter.apply(
				new FilterInvocation(Direction.CLIENT_TO_SERVER, "s1", this.mapper.readTree(json), FilterConfig.defaults()));
	}

}
