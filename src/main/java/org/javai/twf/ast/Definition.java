package org.javai.twf.ast;

import java.util.List;

/**
 * A top-level definition of a TWF file.
 */
public sealed interface Definition extends Symbol permits WorkflowDef, ActivityDef {

	String params();

	/**
	 * The opaque return type text, or null when the definition declares none.
	 */
	String returnType();

	/**
	 * The opaque options text, or null when the definition has no options line.
	 */
	String options();

	List<Statement> body();

	<R> R accept(DefinitionVisitor<R> visitor);
}
