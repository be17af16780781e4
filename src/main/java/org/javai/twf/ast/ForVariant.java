package org.javai.twf.ast;

public enum ForVariant {
	INFINITE("infinite"),
	CONDITIONAL("conditional"),
	ITERATION("iteration");

	private final String label;

	ForVariant(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}
}
