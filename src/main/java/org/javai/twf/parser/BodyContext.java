package org.javai.twf.parser;

/**
 * The kind of body a statement is being parsed in. Decides which statement table applies
 * and which keywords are rejected.
 */
enum BodyContext {

	WORKFLOW("workflow body", true, true),
	SIGNAL_HANDLER("signal handler", true, false),
	UPDATE_HANDLER("update handler", true, false),
	QUERY_HANDLER("query handler", false, false),
	ACTIVITY("activity body", false, false);

	private final String description;
	private final boolean temporal;
	private final boolean closeAllowed;

	BodyContext(String description, boolean temporal, boolean closeAllowed) {
		this.description = description;
		this.temporal = temporal;
		this.closeAllowed = closeAllowed;
	}

	String description() {
		return description;
	}

	/**
	 * Whether temporal primitives (calls, awaits, timers, continue_as_new) may appear.
	 */
	boolean temporal() {
		return temporal;
	}

	/**
	 * Whether {@code close} may appear. Only a workflow's main body can terminate it.
	 */
	boolean closeAllowed() {
		return closeAllowed;
	}
}
