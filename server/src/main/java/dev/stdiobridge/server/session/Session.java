package dev.stdiobridge.server.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One logical client: a bounded outbound queue plus any number of live subscribers. Only the
 * {@link SessionRegistry} hands out sessions, and only by id.
 */
public class Session {

	private static final Logger logger = LoggerFactory.getLogger(Session.class);

	private final String id;

	private final BlockingQueue<JsonNode> outbound;

	private final Map<Subscriber, SubscriberOutlet> outlets = new ConcurrentHashMap<>();

	private final int capacity;

	private final Clock clock;

	private final Instant createdAt;

	private volatile Instant lastActivity;

	private final AtomicLong delivered = new AtomicLong();

	private final AtomicLong dropped = new AtomicLong();

	private final AtomicBoolean saturated = new AtomicBoolean();

	private volatile boolean closed;

	Session(String id, int queueCapacity, Clock clock) {
		this.id = id;
		this.outbound = new ArrayBlockingQueue<>(queueCapacity);
		this.capacity = queueCapacity;
		this.clock = clock;
		this.createdAt = clock.instant();
		this.lastActivity = this.createdAt;
	}

	public String id() {
		return this.id;
	}

	/**
	 * Hand a frame to this session without blocking. Attached subscribers each get it through their
	 * own sender; a subscriber whose buffer is full is detached. Only when no subscriber took the
	 * frame is it queued for pull consumers, and when that queue is full the frame is dropped.
	 * @param frame frame to deliver
	 * @return {@code true} when a subscriber or the queue accepted the frame
	 */
	public boolean offer(JsonNode frame) {
		if (this.closed) {
			return false;
		}
		int reached = 0;
		for (SubscriberOutlet outlet : this.outlets.values()) {
			if (outlet.offer(frame)) {
				reached++;
			}
			else {
				logger.warn("Subscriber of session {} is not keeping up; detaching it", this.id);
				detach(outlet.subscriber());
			}
		}
		if (reached > 0 || this.outbound.offer(frame)) {
			this.delivered.incrementAndGet();
			this.saturated.set(false);
			return true;
		}
		this.dropped.incrementAndGet();
		if (this.saturated.compareAndSet(false, true)) {
			logger.warn("Outbound queue of session {} is full; dropping newest frames", this.id);
		}
		else {
			logger.debug("Queue of session {} full, frame dropped", this.id);
		}
		return false;
	}

	/**
	 * Wait for the next queued frame.
	 * @param heartbeatInterval how long to wait before returning a heartbeat instead
	 * @return the next frame, or a heartbeat
	 * @throws InterruptedException when interrupted while waiting
	 */
	public Delivery next(Duration heartbeatInterval) throws InterruptedException {
		touch();
		JsonNode frame = this.outbound.poll(heartbeatInterval.toMillis(), TimeUnit.MILLISECONDS);
		return frame == null ? Delivery.heartbeat() : Delivery.of(frame);
	}

	/**
	 * Take a queued frame if one is waiting.
	 * @return the frame, or {@code null}
	 */
	public JsonNode poll() {
		return this.outbound.poll();
	}

	/**
	 * Attach a live subscriber. It receives every frame delivered from now on.
	 * @param subscriber subscriber to attach
	 */
	public void attach(Subscriber subscriber) {
		touch();
		if (this.closed) {
			subscriber.close();
			return;
		}
		SubscriberOutlet outlet = new SubscriberOutlet(this.id, subscriber, this.capacity, this::detach);
		if (this.outlets.putIfAbsent(subscriber, outlet) == null) {
			outlet.start();
		}
	}

	public void detach(Subscriber subscriber) {
		SubscriberOutlet outlet = this.outlets.remove(subscriber);
		if (outlet != null) {
			outlet.close();
		}
	}

	/**
	 * Record client activity, deferring the idle sweep.
	 */
	public void touch() {
		this.lastActivity = this.clock.instant();
	}

	public Duration idleFor() {
		return Duration.between(this.lastActivity, this.clock.instant());
	}

	public int queueDepth() {
		return this.outbound.size();
	}

	public int subscriberCount() {
		return this.outlets.size();
	}

	SessionInfo info() {
		return new SessionInfo(this.id, queueDepth(), subscriberCount(), this.createdAt, idleFor(),
				this.delivered.get(), this.dropped.get());
	}

	void close() {
		this.closed = true;
		this.outbound.clear();
		for (Subscriber subscriber : this.outlets.keySet()) {
			detach(subscriber);
		}
	}

}
