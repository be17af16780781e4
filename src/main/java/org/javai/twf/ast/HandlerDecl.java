package org.javai.twf.ast;

import java.util.List;

/**
 * A signal, query or update handler declared on a workflow.
 * Handlers are never top-level; their lifetime is that of the owning workflow.
 */
public sealed interface HandlerDecl extends Symbol permits SignalDecl, QueryDecl, UpdateDecl {

	String params();

	List<Statement> body();
}
