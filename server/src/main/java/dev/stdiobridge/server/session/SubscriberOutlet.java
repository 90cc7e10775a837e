package dev.stdiobridge.server.session;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.function.Consumer;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands frames to one {@link Subscriber} on a dedicated sender thread. The caller only ever
 * performs a non-blocking offer into a bounded buffer, so a slow peer stalls nothing but itself.
 */
final class SubscriberOutlet {

	private static final Logger logger = LoggerFactory.getLogger(SubscriberOutlet.class);

	private final String sessionId;

	private final Subscriber subscriber;

	private final BlockingQueue<JsonNode> pending;

	private final Consumer<Subscriber> onFailure;

	private final Thread sender;

	private volatile boolean closed;

	SubscriberOutlet(String sessionId, Subscriber subscriber, int capacity, Consumer<Subscriber> onFailure) {
		this.sessionId = sessionId;
		this.subscriber = subscriber;
		this.pending = new ArrayBlockingQueue<>(capacity);
		this.onFailure = onFailure;
		this.sender = new Thread(this::drain, "session-" + sessionId + "-sender");
		this.sender.setDaemon(true);
	}

	void start() {
		this.sender.start();
	}

	/**
	 * Queue a frame for the sender thread without waiting.
	 * @param frame frame to send
	 * @return {@code false} when the buffer is full or the outlet is closed
	 */
	boolean offer(JsonNode frame) {
		return !this.closed && this.pending.offer(frame);
	}

	Subscriber subscriber() {
		return this.subscriber;
	}

	private void drain() {
		while (!this.closed) {
			JsonNode frame;
			try {
				frame = this.pending.take();
			}
			catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				return;
			}
			try {
				this.subscriber.send(frame);
			}
			catch (IOException ex) {
				logger.debug("Detaching subscriber of session {} after failed send: {}", this.sessionId,
						ex.getMessage());
				this.onFailure.accept(this.subscriber);
				return;
			}
		}
	}

	/**
	 * Stop the sender thread, discard unsent frames and close the subscriber.
	 */
	void close() {
		this.closed = true;
		this.pending.clear();
		if (Thread.currentThread() != this.sender) {
			this.sender.interrupt();
		}
		this.subscriber.close();
	}

}
