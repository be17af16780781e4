package org.javai.twf.ast;

import java.util.List;
import java.util.function.Consumer;

/**
 * Utility class for walking statement trees.
 * Visits every statement in pre-order, descending into if/else branches, loop bodies,
 * switch cases and defaults, await-all bodies and await-one cases (including the body
 * of a nested await all).
 */
public final class StatementWalker {

	private StatementWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Walks every statement reachable from the given list.
	 *
	 * @param statements the statements to start from (may be null)
	 * @param action invoked once for every statement, parents before children
	 */
	public static void walk(List<Statement> statements, Consumer<Statement> action) {
		if (statements == null) {
			return;
		}
		for (Statement statement : statements) {
			action.accept(statement);
			statement.accept(new ChildWalker(action));
		}
	}

	/**
	 * Walks a workflow's handler bodies followed by its main body, or an activity's body.
	 */
	public static void walk(Definition definition, Consumer<Statement> action) {
		if (definition instanceof WorkflowDef workflow) {
			workflow.signals().forEach(s -> walk(s.body(), action));
			workflow.queries().forEach(q -> walk(q.body(), action));
			workflow.updates().forEach(u -> walk(u.body(), action));
		}
		walk(definition.body(), action);
	}

	private record ChildWalker(Consumer<Statement> action) implements StatementVisitor<Void> {

		@Override
		public Void visitAwaitAll(Statement.AwaitAll awaitAll) {
			walk(awaitAll.body(), action);
			return null;
		}

		@Override
		public Void visitAwaitOne(Statement.AwaitOne awaitOne) {
			for (AwaitOneCase awaitCase : awaitOne.cases()) {
				if (awaitCase.awaitAll() != null) {
					walk(List.of(awaitCase.awaitAll()), action);
				}
				walk(awaitCase.body(), action);
			}
			return null;
		}

		@Override
		public Void visitSwitch(Statement.Switch switchBlock) {
			for (SwitchCase switchCase : switchBlock.cases()) {
				walk(switchCase.body(), action);
			}
			walk(switchBlock.defaultBody(), action);
			return null;
		}

		@Override
		public Void visitIf(Statement.If ifStmt) {
			walk(ifStmt.body(), action);
			walk(ifStmt.elseBody(), action);
			return null;
		}

		@Override
		public Void visitFor(Statement.For forStmt) {
			walk(forStmt.body(), action);
			return null;
		}

		@Override
		public Void visitActivityCall(Statement.ActivityCall call) {
			return null;
		}

		@Override
		public Void visitWorkflowCall(Statement.WorkflowCall call) {
			return null;
		}

		@Override
		public Void visitAwait(Statement.Await await) {
			return null;
		}

		@Override
		public Void visitClose(Statement.Close close) {
			return null;
		}

		@Override
		public Void visitReturn(Statement.Return returnStmt) {
			return null;
		}

		@Override
		public Void visitBreak(Statement.Break breakStmt) {
			return null;
		}

		@Override
		public Void visitContinue(Statement.Continue continueStmt) {
			return null;
		}

		@Override
		public Void visitContinueAsNew(Statement.ContinueAsNew continueAsNew) {
			return null;
		}

		@Override
		public Void visitRaw(Statement.Raw raw) {
			return null;
		}

		@Override
		public Void visitComment(Statement.Comment comment) {
			return null;
		}
	}
}
