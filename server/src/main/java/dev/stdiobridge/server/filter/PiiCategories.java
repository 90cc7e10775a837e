package dev.stdiobridge.server.filter;

/**
 * Redaction category names reported in {@link FilterResult#redactionCounts()}.
 */
public final class PiiCategories {

	public static final String EMAIL = "email";

	public static final String PHONE = "phone";

	public static final String SSN = "ssn";

	public static final String CREDIT_CARD = "credit_card";

	public static final String SECRET = "secret";

	private PiiCategories() {
	}

}
