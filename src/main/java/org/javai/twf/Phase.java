package org.javai.twf;

/**
 * The front-end phase that reported a diagnostic.
 */
public enum Phase {
	LEX("lex"),
	PARSE("parse"),
	RESOLVE("resolve");

	private final String label;

	Phase(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}
}
