package org.javai.twf.ast;

import java.util.List;

/**
 * A {@code case value:} arm of a switch block. The value is opaque text.
 */
public record SwitchCase(Position position, String value, List<Statement> body) {

	public SwitchCase {
		body = body != null ? List.copyOf(body) : List.of();
	}
}
