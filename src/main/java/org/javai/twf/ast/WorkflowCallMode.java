package org.javai.twf.ast;

/**
 * How a workflow call is started.
 */
public enum WorkflowCallMode {
	/** Bare {@code workflow X(...)}: a child workflow whose result is awaited. */
	CHILD("child"),
	/** {@code spawn workflow X(...)}: started without waiting. */
	SPAWN("spawn"),
	/** {@code detach workflow X(...)}: fire-and-forget, cannot bind a result. */
	DETACH("detach");

	private final String label;

	WorkflowCallMode(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}
}
