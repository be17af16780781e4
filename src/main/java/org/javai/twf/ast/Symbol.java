package org.javai.twf.ast;

/**
 * A named declaration that call and await sites resolve to: a top-level
 * {@link Definition} or a {@link HandlerDecl} owned by a workflow.
 */
public sealed interface Symbol permits Definition, HandlerDecl {

	String name();

	Position position();

	SymbolKind symbolKind();
}
