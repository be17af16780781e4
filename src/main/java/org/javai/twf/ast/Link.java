package org.javai.twf.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * A resolved reference from a call or await site to the symbol it names.
 * <p>
 * A link is a lookup relationship, not ownership: it is unbound after parsing and bound
 * at most once by the resolver. The target always belongs to the same {@link TwfFile}
 * as the site, so it never outlives it.
 * <p>
 * Two links are equal when both are unbound, or both are bound to symbols of the same
 * kind and name. Equality never descends into the target, so a recursive workflow
 * does not make {@code equals} loop.
 *
 * @param <T> the type of symbol this link can point to
 */
public final class Link<T extends Symbol> {

	private T target;

	public static <T extends Symbol> Link<T> unbound() {
		return new Link<>();
	}

	/**
	 * Binds this link to its target.
	 *
	 * @throws IllegalStateException if the link is already bound to a different symbol
	 */
	public void bind(T symbol) {
		Objects.requireNonNull(symbol, "symbol must not be null");
		if (target != null && target != symbol) {
			throw new IllegalStateException("Link already bound to " + describe(target));
		}
		target = symbol;
	}

	public Optional<T> target() {
		return Optional.ofNullable(target);
	}

	public boolean isBound() {
		return target != null;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Link<?> other)) {
			return false;
		}
		if (target == null || other.target == null) {
			return target == null && other.target == null;
		}
		return target.symbolKind() == other.target.symbolKind() && target.name().equals(other.target.name());
	}

	@Override
	public int hashCode() {
		return target == null ? 0 : Objects.hash(target.symbolKind(), target.name());
	}

	@Override
	public String toString() {
		return target == null ? "Link[unbound]" : "Link[" + describe(target) + "]";
	}

	private static String describe(Symbol symbol) {
		return symbol.symbolKind().keyword() + " " + symbol.name() + " at " + symbol.position();
	}
}
