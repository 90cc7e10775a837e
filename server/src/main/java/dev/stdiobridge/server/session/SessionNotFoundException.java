package dev.stdiobridge.server.session;

/**
 * Thrown when a session id is not registered, either because it never was or because the session
 * has since been removed.
 */
public class SessionNotFoundException extends RuntimeException {

	private final String sessionId;

	public SessionNotFoundException(String sessionId) {
		super("Unknown session " + sessionId);
		this.sessionId = sessionId;
	}

	public String sessionId() {
		return this.sessionId;
	}

}
