package org.javai.twf.ast;

import java.util.List;

/**
 * A query handler. The body uses the activity statement set and must not mutate
 * workflow state; the latter is a contract for authors, not something checked here.
 */
public record QueryDecl(Position position, String name, String params, String returnType, List<Statement> body)
		implements HandlerDecl {

	public QueryDecl {
		params = params != null ? params : "";
		body = body != null ? List.copyOf(body) : List.of();
	}

	@Override
	public SymbolKind symbolKind() {
		return SymbolKind.QUERY;
	}
}
