package org.javai.twf.ast;

import java.util.List;

/**
 * An activity definition. Its body is restricted to non-temporal statements.
 */
public record ActivityDef(
		Position position,
		String name,
		String params,
		String returnType,
		String options,
		List<Statement> body
) implements Definition {

	public ActivityDef {
		params = params != null ? params : "";
		body = body != null ? List.copyOf(body) : List.of();
	}

	@Override
	public SymbolKind symbolKind() {
		return SymbolKind.ACTIVITY;
	}

	@Override
	public <R> R accept(DefinitionVisitor<R> visitor) {
		return visitor.visitActivity(this);
	}
}
