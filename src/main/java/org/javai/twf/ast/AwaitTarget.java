package org.javai.twf.ast;

/**
 * What a single {@code await} statement, or one case of an {@code await one} block, waits on.
 * Every target except the timer refers to a symbol and carries a {@link Link} to it.
 */
public sealed interface AwaitTarget {

	/**
	 * The stable kind name of this target: timer, signal, update, activity or workflow.
	 */
	String kind();

	<R> R accept(AwaitTargetVisitor<R> visitor);

	/**
	 * {@code timer(duration)}.
	 */
	record Timer(String duration) implements AwaitTarget {

		@Override
		public String kind() {
			return "timer";
		}

		@Override
		public <R> R accept(AwaitTargetVisitor<R> visitor) {
			return visitor.visitTimer(this);
		}
	}

	/**
	 * {@code signal Name [-> binding]}.
	 *
	 * @param name the signal name
	 * @param params the optional parameter binding (identifier or parenthesized list), or null
	 * @param target link to the signal declaration of the enclosing workflow
	 */
	record Signal(String name, String params, Link<SignalDecl> target) implements AwaitTarget {

		public Signal(String name, String params) {
			this(name, params, Link.unbound());
		}

		@Override
		public String kind() {
			return "signal";
		}

		@Override
		public <R> R accept(AwaitTargetVisitor<R> visitor) {
			return visitor.visitSignal(this);
		}
	}

	/**
	 * {@code update Name [-> binding]}.
	 */
	record Update(String name, String params, Link<UpdateDecl> target) implements AwaitTarget {

		public Update(String name, String params) {
			this(name, params, Link.unbound());
		}

		@Override
		public String kind() {
			return "update";
		}

		@Override
		public <R> R accept(AwaitTargetVisitor<R> visitor) {
			return visitor.visitUpdate(this);
		}
	}

	/**
	 * {@code activity Name(args) [-> result]}.
	 */
	record Activity(String name, String args, String result, Link<ActivityDef> target) implements AwaitTarget {

		public Activity(String name, String args, String result) {
			this(name, args, result, Link.unbound());
		}

		@Override
		public String kind() {
			return "activity";
		}

		@Override
		public <R> R accept(AwaitTargetVisitor<R> visitor) {
			return visitor.visitActivity(this);
		}
	}

	/**
	 * {@code [spawn|detach] [nexus "ns"] workflow Name(args) [-> result]}.
	 */
	record Workflow(
			WorkflowCallMode mode,
			String namespace,
			String name,
			String args,
			String result,
			Link<WorkflowDef> target
	) implements AwaitTarget {

		public Workflow(WorkflowCallMode mode, String namespace, String name, String args, String result) {
			this(mode, namespace, name, args, result, Link.unbound());
		}

		@Override
		public String kind() {
			return "workflow";
		}

		@Override
		public <R> R accept(AwaitTargetVisitor<R> visitor) {
			return visitor.visitWorkflow(this);
		}
	}
}
