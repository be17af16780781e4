package org.javai.twf.ast;

import java.util.List;

/**
 * One case of an {@code await one} block: either a single {@link AwaitTarget} or a
 * nested {@code await all} block, with the body run when this case wins.
 *
 * @param position position of the case
 * @param target the awaited target, or null for a nested await-all case
 * @param awaitAll the nested block, or null for a target case
 * @param body the statements run when this case completes first (may be empty)
 */
public record AwaitOneCase(Position position, AwaitTarget target, Statement.AwaitAll awaitAll, List<Statement> body) {

	public AwaitOneCase {
		if ((target == null) == (awaitAll == null)) {
			throw new IllegalArgumentException("An await one case has exactly one of a target or a nested await all");
		}
		body = body != null ? List.copyOf(body) : List.of();
	}

	public static AwaitOneCase of(Position position, AwaitTarget target, List<Statement> body) {
		return new AwaitOneCase(position, target, null, body);
	}

	public static AwaitOneCase nested(Position position, Statement.AwaitAll awaitAll) {
		return new AwaitOneCase(position, null, awaitAll, List.of());
	}

	/**
	 * The stable kind name: the target kind, or {@code await_all}.
	 */
	public String kind() {
		return target != null ? target.kind() : "await_all";
	}
}
