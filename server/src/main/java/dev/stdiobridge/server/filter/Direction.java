package dev.stdiobridge.server.filter;

/**
 * Which way a message is travelling across the bridge.
 */
public enum Direction {

	CLIENT_TO_SERVER("client_to_server"),

	SERVER_TO_CLIENT("server_to_client");

	private final String wireName;

	Direction(String wireName) {
		this.wireName = wireName;
	}

	/**
	 * Name used in logs and in the {@code bridge_meta} stamp.
	 * @return lower snake case direction name
	 */
	public String wireName() {
		return this.wireName;
	}

}
