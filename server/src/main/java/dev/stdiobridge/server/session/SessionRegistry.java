package dev.stdiobridge.server.session;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns every live {@link Session}. A session exists exactly as long as it is in this map: removing
 * it drains its queue and detaches its subscribers, after which its id resolves to nothing.
 */
public class SessionRegistry {

	private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

	private final Map<String, Session> sessions = new ConcurrentHashMap<>();

	private final int queueCapacity;

	private final Clock clock;

	public SessionRegistry(int queueCapacity, Clock clock) {
		if (queueCapacity < 1) {
			throw new IllegalArgumentException("queueCapacity must be positive");
		}
		this.queueCapacity = queueCapacity;
		this.clock = clock;
	}

	/**
	 * Register a new session with an empty queue and no subscribers.
	 * @return the new session id
	 */
	public String create() {
		String id = UUID.randomUUID().toString().replace("-", "");
		this.sessions.put(id, new Session(id, this.queueCapacity, this.clock));
		logger.info("Registered session {}", id);
		return id;
	}

	/**
	 * Resolve a session.
	 * @param id session id
	 * @return the session
	 * @throws SessionNotFoundException when the id is not registered
	 */
	public Session get(String id) {
		Session session = id == null ? null : this.sessions.get(id);
		if (session == null) {
			throw new SessionNotFoundException(id);
		}
		return session;
	}

	public Optional<Session> find(String id) {
		return id == null ? Optional.empty() : Optional.ofNullable(this.sessions.get(id));
	}

	public boolean contains(String id) {
		return id != null && this.sessions.containsKey(id);
	}

	/**
	 * Remove a session, dropping its queued frames and detaching its subscribers.
	 * @param id session id
	 * @return {@code true} when a session was removed
	 */
	public boolean remove(String id) {
		Session session = id == null ? null : this.sessions.remove(id);
		if (session == null) {
			return false;
		}
		session.close();
		logger.info("Removed session {}", id);
		return true;
	}

	/**
	 * Hand a frame to a session if it is still registered.
	 * @param id target session
	 * @param frame frame to deliver
	 * @return {@code true} when the session exists and queued the frame
	 */
	public boolean deliver(String id, JsonNode frame) {
		Session session = this.sessions.get(id);
		return session != null && session.offer(frame);
	}

	/**
	 * Ids of the sessions registered right now.
	 * @return immutable snapshot
	 */
	public Set<String> ids() {
		return Set.copyOf(this.sessions.keySet());
	}

	public int size() {
		return this.sessions.size();
	}

	public List<SessionInfo> list() {
		List<SessionInfo> infos = new ArrayList<>(this.sessions.size());
		for (Session session : this.sessions.values()) {
			infos.add(session.info());
		}
		return infos;
	}

	/**
	 * Remove every session idle for longer than {@code maxIdle}. Sessions with a live subscriber
	 * attached are kept.
	 * @param maxIdle idle threshold
	 * @return ids of the removed sessions
	 */
	public List<String> sweepIdle(Duration maxIdle) {
		List<String> removed = new ArrayList<>();
		for (Session session : this.sessions.values()) {
			if (session.subscriberCount() == 0 && session.idleFor().compareTo(maxIdle) > 0 && remove(session.id())) {
				removed.add(session.id());
			}
		}
		if (!removed.isEmpty()) {
			logger.info("Swept {} idle session(s): {}", removed.size(), removed);
		}
		return removed;
	}

}
