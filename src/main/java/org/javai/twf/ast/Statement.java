package org.javai.twf.ast;

import java.util.List;

/**
 * A statement inside a definition or handler body. Sealed so that every consumer
 * handles every statement kind through {@link StatementVisitor}.
 * <p>
 * Expressions, conditions and argument lists are kept as opaque source text.
 */
public sealed interface Statement {

	Position position();

	<R> R accept(StatementVisitor<R> visitor);

	/**
	 * {@code activity Name(args) [-> result]}, optionally followed by an indented options line.
	 */
	record ActivityCall(
			Position position,
			String name,
			String args,
			String result,
			String options,
			Link<ActivityDef> target
	) implements Statement {

		public ActivityCall(Position position, String name, String args, String result, String options) {
			this(position, name, args, result, options, Link.unbound());
		}

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitActivityCall(this);
		}
	}

	/**
	 * {@code [spawn|detach] [nexus "ns"] workflow Name(args) [-> result]}.
	 */
	record WorkflowCall(
			Position position,
			WorkflowCallMode mode,
			String namespace,
			String name,
			String args,
			String result,
			String options,
			Link<WorkflowDef> target
	) implements Statement {

		public WorkflowCall(Position position, WorkflowCallMode mode, String namespace, String name, String args,
				String result, String options) {
			this(position, mode, namespace, name, args, result, options, Link.unbound());
		}

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitWorkflowCall(this);
		}
	}

	/**
	 * A single {@code await <target>}.
	 */
	record Await(Position position, AwaitTarget target) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitAwait(this);
		}
	}

	/**
	 * {@code await all:}. Every member runs concurrently and the block exits once all have finished.
	 */
	record AwaitAll(Position position, List<Statement> body) implements Statement {

		public AwaitAll {
			body = body != null ? List.copyOf(body) : List.of();
		}

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitAwaitAll(this);
		}
	}

	/**
	 * {@code await one:}. The first case to complete wins. Always has at least one case.
	 */
	record AwaitOne(Position position, List<AwaitOneCase> cases) implements Statement {

		public AwaitOne {
			cases = cases != null ? List.copyOf(cases) : List.of();
		}

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitAwaitOne(this);
		}
	}

	/**
	 * {@code switch (expr):} with at least one case and an optional {@code else:} default.
	 *
	 * @param defaultBody the else body, or null when there is no else arm
	 */
	record Switch(Position position, String expr, List<SwitchCase> cases, List<Statement> defaultBody)
			implements Statement {

		public Switch {
			cases = cases != null ? List.copyOf(cases) : List.of();
			defaultBody = defaultBody != null ? List.copyOf(defaultBody) : null;
		}

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitSwitch(this);
		}
	}

	/**
	 * {@code if (condition):} with an optional {@code else:}.
	 *
	 * @param elseBody the else body, or null when there is no else branch
	 */
	record If(Position position, String condition, List<Statement> body, List<Statement> elseBody)
			implements Statement {

		public If {
			body = body != null ? List.copyOf(body) : List.of();
			elseBody = elseBody != null ? List.copyOf(elseBody) : null;
		}

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitIf(this);
		}
	}

	/**
	 * A loop. Which of condition, variable and iterable are set depends on the variant.
	 */
	record For(
			Position position,
			ForVariant variant,
			String condition,
			String variable,
			String iterable,
			List<Statement> body
	) implements Statement {

		public For {
			body = body != null ? List.copyOf(body) : List.of();
		}

		public static For infinite(Position position, List<Statement> body) {
			return new For(position, ForVariant.INFINITE, null, null, null, body);
		}

		public static For conditional(Position position, String condition, List<Statement> body) {
			return new For(position, ForVariant.CONDITIONAL, condition, null, null, body);
		}

		public static For iteration(Position position, String variable, String iterable, List<Statement> body) {
			return new For(position, ForVariant.ITERATION, null, variable, iterable, body);
		}

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitFor(this);
		}
	}

	/**
	 * {@code close [completed|failed] [value]}. Only valid in a workflow's main body.
	 */
	record Close(Position position, CloseReason reason, String value) implements Statement {

		public Close {
			reason = reason != null ? reason : CloseReason.NONE;
		}

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitClose(this);
		}
	}

	/**
	 * {@code return [value]}.
	 */
	record Return(Position position, String value) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitReturn(this);
		}
	}

	record Break(Position position) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitBreak(this);
		}
	}

	record Continue(Position position) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitContinue(this);
		}
	}

	/**
	 * {@code continue_as_new(args)}.
	 */
	record ContinueAsNew(Position position, String args) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitContinueAsNew(this);
		}
	}

	/**
	 * A line that starts with no recognized keyword, such as an assignment, kept verbatim.
	 */
	record Raw(Position position, String text) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitRaw(this);
		}
	}

	/**
	 * A {@code #} comment, kept in the statement list so tools can render it inline.
	 */
	record Comment(Position position, String text) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitComment(this);
		}
	}
}
