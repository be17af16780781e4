package org.javai.twf.ast;

/**
 * Visitor over every {@link Statement} kind. Adding a statement kind adds a method here,
 * which every implementation must then handle.
 *
 * @param <R> the return type of the visitor operations
 */
public interface StatementVisitor<R> {

	R visitActivityCall(Statement.ActivityCall call);

	R visitWorkflowCall(Statement.WorkflowCall call);

	R visitAwait(Statement.Await await);

	R visitAwaitAll(Statement.AwaitAll awaitAll);

	R visitAwaitOne(Statement.AwaitOne awaitOne);

	R visitSwitch(Statement.Switch switchBlock);

	R visitIf(Statement.If ifStmt);

	R visitFor(Statement.For forStmt);

	R visitClose(Statement.Close close);

	R visitReturn(Statement.Return returnStmt);

	R visitBreak(Statement.Break breakStmt);

	R visitContinue(Statement.Continue continueStmt);

	R visitContinueAsNew(Statement.ContinueAsNew continueAsNew);

	R visitRaw(Statement.Raw raw);

	R visitComment(Statement.Comment comment);
}
