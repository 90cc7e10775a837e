package dev.stdiobridge.server;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import dev.stdiobridge.server.broker.Submission;
import dev.stdiobridge.server.control.BridgeControlService;
import dev.stdiobridge.server.session.Delivery;

@EnabledOnOs({ OS.LINUX, OS.MAC })
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE,
		properties = { "bridge.process.command=cat", "bridge.process.health-probe=false",
				"bridge.session.heartbeat-interval=100ms" })
class BridgeServerApplicationTest {

	@Autowired
	private BridgeControlService controlService;

	@Test
	void bridgesMessagesThroughARealChild() throws Exception {
		String session = this.controlService.registerSession();

		Submission submission = this.controlService.submit(session,
				new ObjectMapper().readTree("{\"method\":\"notifications/echo\",\"params\":{\"n\":1}}"));

		Delivery delivery = awaitFrame(session);
		assertThat(submission.forwarded()).isTrue();
		assertThat(delivery.frame().get("method").asText()).isEqualTo("notifications/echo");
		assertThat(delivery.frame().at("/params/n").asInt()).isEqualTo(1);
		assertThat(this.controlService.status().broker().running()).isTrue();
	}

	private Delivery awaitFrame(String session) throws InterruptedException {
		for (int i = 0; i < 50; i++) {
			Delivery delivery = this.controlService.nextDelivery(session);
			if (!delivery.isHeartbeat()) {
				return delivery;
			}
		}
		throw new AssertionError("No frame for session " + session);
	}

}
