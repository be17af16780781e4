package org.javai.twf.ast;

import java.util.List;

/**
 * An update handler: request/response, may mutate state and return a value, may not close the workflow.
 */
public record UpdateDecl(Position position, String name, String params, String returnType, List<Statement> body)
		implements HandlerDecl {

	public UpdateDecl {
		params = params != null ? params : "";
		body = body != null ? List.copyOf(body) : List.of();
	}

	@Override
	public SymbolKind symbolKind() {
		return SymbolKind.UPDATE;
	}
}
