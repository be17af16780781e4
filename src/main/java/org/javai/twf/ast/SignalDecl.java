package org.javai.twf.ast;

import java.util.List;

/**
 * A signal handler: fire-and-forget, may mutate workflow state, may not close the workflow.
 */
public record SignalDecl(Position position, String name, String params, List<Statement> body) implements HandlerDecl {

	public SignalDecl {
		params = params != null ? params : "";
		body = body != null ? List.copyOf(body) : List.of();
	}

	@Override
	public SymbolKind symbolKind() {
		return SymbolKind.SIGNAL;
	}
}
