package dev.stdiobridge.server.filter;

/**
 * Modifications a filter may report having made to a message.
 */
public enum FilterAction {

	SANITIZED, PII_REDACTED, SECRETS_MASKED, SUMMARIZED, TRUNCATED, STAMPED

}
