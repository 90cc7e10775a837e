package dev.stdiobridge.server.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import dev.stdiobridge.server.MutableClock;

class SessionRegistryTest {

	private final MutableClock clock = new MutableClock();

	private final SessionRegistry registry = new SessionRegistry(5, this.clock);

	@Test
	void createdSessionsHaveDistinctCompactIds() {
		String first = this.registry.create();
		String second = this.registry.create();

		assertThat(first).isNotEqualTo(second).hasSize(32).doesNotContain("-");
		assertThat(this.registry.ids()).containsExactlyInAnyOrder(first, second);
		assertThat(this.registry.size()).isEqualTo(2);
	}

	@Test
	void unknownSessionIsReported() {
		assertThatThrownBy(() -> this.registry.get("missing")).isInstanceOf(SessionNotFoundException.class)
			.hasMessageContaining("missing");
		assertThat(this.registry.find("missing")).isEmpty();
		assertThat(this.registry.contains(null)).isFalse();
	}

	@Test
	void removedSessionIsGoneAndItsQueueDiscarded() {
		String id = this.registry.create();
		Session session = this.registry.get(id);
		this.registry.deliver(id, JsonNodeFactory.instance.objectNode());

		assertThat(this.registry.remove(id)).isTrue();

		assertThat(this.registry.contains(id)).isFalse();
		assertThat(session.queueDepth()).isZero();
		assertThat(this.registry.remove(id)).isFalse();
		assertThat(this.registry.deliver(id, JsonNodeFactory.instance.objectNode())).isFalse();
	}

	@Test
	void listReportsQueueState() {
		String id = this.registry.create();
		this.registry.deliver(id, JsonNodeFactory.instance.objectNode());
		this.registry.deliver(id, JsonNodeFactory.instance.objectNode());

		SessionInfo info = this.registry.list().get(0);

		assertThat(info.id()).isEqualTo(id);
		assertThat(info.queueDepth()).isEqualTo(2);
		assertThat(info.subscriberCount()).isZero();
		assertThat(info.delivered()).isEqualTo(2);
		assertThat(info.createdAt()).isEqualTo(this.clock.instant());
	}

	@Test
	void sweepRemovesOnlySessionsIdleLongerThanTheLimit() {
		String stale = this.registry.create();
		this.clock.advance(Duration.ofMinutes(4));
		String fresh = this.registry.create();
		this.clock.advance(Duration.ofMinutes(2));

		assertThat(this.registry.sweepIdle(Duration.ofMinutes(5))).containsExactly(stale);
		assertThat(this.registry.ids()).containsExactly(fresh);
	}

	@Test
	void activityDefersTheSweep() {
		String id = this.registry.create();
		this.clock.advance(Duration.ofMinutes(4));
		this.registry.get(id).touch();
		this.clock.advance(Duration.ofMinutes(4));

		assertThat(this.registry.sweepIdle(Duration.ofMinutes(5))).isEmpty();
		assertThat(this.registry.contains(id)).isTrue();
	}

	@Test
	void attachedSubscriberKeepsAnIdleSessionAlive() {
		String id = this.registry.create();
		this.registry.get(id).attach(new SessionTest.RecordingSubscriber());
		this.clock.advance(Duration.ofHours(1));

		assertThat(this.registry.sweepIdle(Duration.ofMinutes(5))).isEmpty();
		assertThat(this.registry.contains(id)).isTrue();
	}

	@Test
	void rejectsNonPositiveCapacity() {
		assertThatThrownBy(() -> new SessionRegistry(0, this.clock)).isInstanceOf(IllegalArgumentException.class);
	}

}
