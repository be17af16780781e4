package org.javai.twf.ast;

import java.util.List;

/**
 * A workflow definition. Its handler declarations always precede its body in the source.
 *
 * @param position position of the {@code workflow} keyword
 * @param name the workflow name
 * @param params opaque parameter list text
 * @param returnType opaque return type text, or null
 * @param options opaque options text, or null
 * @param signals signal handlers in declaration order
 * @param queries query handlers in declaration order
 * @param updates update handlers in declaration order
 * @param body the main body
 */
public record WorkflowDef(
		Position position,
		String name,
		String params,
		String returnType,
		String options,
		List<SignalDecl> signals,
		List<QueryDecl> queries,
		List<UpdateDecl> updates,
		List<Statement> body
) implements Definition {

	public WorkflowDef {
		params = params != null ? params : "";
		signals = signals != null ? List.copyOf(signals) : List.of();
		queries = queries != null ? List.copyOf(queries) : List.of();
		updates = updates != null ? List.copyOf(updates) : List.of();
		body = body != null ? List.copyOf(body) : List.of();
	}

	@Override
	public SymbolKind symbolKind() {
		return SymbolKind.WORKFLOW;
	}

	@Override
	public <R> R accept(DefinitionVisitor<R> visitor) {
		return visitor.visitWorkflow(this);
	}
}
