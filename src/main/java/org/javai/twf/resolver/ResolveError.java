package org.javai.twf.resolver;

import org.javai.twf.ast.Position;

/**
 * A reference or definition problem found during resolution. Resolution never stops
 * on one of these; they are collected and returned.
 */
public record ResolveError(String message, int line, int column) {

	public ResolveError(String message, Position position) {
		this(message, position.line(), position.column());
	}

	@Override
	public String toString() {
		return "resolve error at " + line + ":" + column + ": " + message;
	}
}
