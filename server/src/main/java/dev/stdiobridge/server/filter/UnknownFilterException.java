package dev.stdiobridge.server.filter;

/**
 * Thrown when a filter name does not match any filter in the pipeline.
 */
public class UnknownFilterException extends RuntimeException {

	public UnknownFilterException(String name) {
		super("Unknown filter " + name);
	}

}
