package org.javai.twf.ast;

/**
 * Visitor over the top-level definition kinds.
 *
 * @param <R> the return type of the visitor operations
 */
public interface DefinitionVisitor<R> {

	R visitWorkflow(WorkflowDef workflow);

	R visitActivity(ActivityDef activity);
}
