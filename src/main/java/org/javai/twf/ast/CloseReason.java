package org.javai.twf.ast;

/**
 * The reason given on a {@code close} statement. {@link #NONE} closes as completed.
 */
public enum CloseReason {
	NONE(""),
	COMPLETED("completed"),
	FAILED("failed");

	private final String label;

	CloseReason(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}
}
