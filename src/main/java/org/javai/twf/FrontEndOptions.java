package org.javai.twf;

import java.util.Objects;

/**
 * Immutable settings for {@link TwfFrontEnd}.
 */
public final class FrontEndOptions {

	private static final FrontEndOptions DEFAULTS = builder().build();

	private final boolean failFast;
	private final boolean resolve;
	private final String sourceSeparator;

	private FrontEndOptions(Builder builder) {
		this.failFast = builder.failFast;
		this.resolve = builder.resolve;
		this.sourceSeparator = builder.sourceSeparator;
	}

	/**
	 * Collect-all parsing, resolution enabled, sources joined with a newline.
	 */
	public static FrontEndOptions defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * When true, parsing stops at the first error and no AST is produced.
	 */
	public boolean failFast() {
		return failFast;
	}

	/**
	 * When false, call and await sites are left unbound.
	 */
	public boolean resolve() {
		return resolve;
	}

	/**
	 * Text placed between sources analyzed together.
	 */
	public String sourceSeparator() {
		return sourceSeparator;
	}

	public Builder toBuilder() {
		return new Builder().failFast(failFast).resolve(resolve).sourceSeparator(sourceSeparator);
	}

	@Override
	public String toString() {
		return "FrontEndOptions[failFast=" + failFast + ", resolve=" + resolve + "]";
	}

	public static final class Builder {

		private boolean failFast = false;
		private boolean resolve = true;
		private String sourceSeparator = "\n";

		private Builder() {
		}

		public Builder failFast(boolean failFast) {
			this.failFast = failFast;
			return this;
		}

		public Builder resolve(boolean resolve) {
			this.resolve = resolve;
			return this;
		}

		public Builder sourceSeparator(String sourceSeparator) {
			this.sourceSeparator = Objects.requireNonNull(sourceSeparator, "sourceSeparator must not be null");
			return this;
		}

		public FrontEndOptions build() {
			return new FrontEndOptions(this);
		}
	}
}
