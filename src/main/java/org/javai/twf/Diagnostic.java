package org.javai.twf;

import java.util.Objects;
import org.javai.twf.lexer.TwfLexException;
import org.javai.twf.parser.TwfParseException;
import org.javai.twf.resolver.ResolveError;

/**
 * A positioned error tagged with the phase that found it.
 *
 * @param phase the reporting phase
 * @param message human-readable message, without position
 * @param line 1-based line
 * @param column 1-based column
 */
public record Diagnostic(Phase phase, String message, int line, int column) {

	public Diagnostic {
		Objects.requireNonNull(phase, "phase must not be null");
		message = message != null ? message : "";
	}

	public static Diagnostic of(TwfLexException e) {
		return new Diagnostic(Phase.LEX, e.getMessage(), e.line(), e.column());
	}

	public static Diagnostic of(TwfParseException e) {
		return new Diagnostic(Phase.PARSE, e.getMessage(), e.line(), e.column());
	}

	public static Diagnostic of(ResolveError error) {
		return new Diagnostic(Phase.RESOLVE, error.message(), error.line(), error.column());
	}

	@Override
	public String toString() {
		return phase.label() + " error at " + line + ":" + column + ": " + message;
	}
}
