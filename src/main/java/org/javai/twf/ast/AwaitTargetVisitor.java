package org.javai.twf.ast;

/**
 * Visitor over the {@link AwaitTarget} variants.
 *
 * @param <R> the return type of the visitor operations
 */
public interface AwaitTargetVisitor<R> {

	R visitTimer(AwaitTarget.Timer timer);

	R visitSignal(AwaitTarget.Signal signal);

	R visitUpdate(AwaitTarget.Update update);

	R visitActivity(AwaitTarget.Activity activity);

	R visitWorkflow(AwaitTarget.Workflow workflow);
}
