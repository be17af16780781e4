package org.javai.twf.parser;

import java.util.List;
import org.javai.twf.ast.TwfFile;

/**
 * Result of a collect-all parse: every definition that parsed, plus every error found.
 *
 * @param file the definitions that parsed successfully
 * @param errors parse errors in source order
 */
public record ParseResult(TwfFile file, List<TwfParseException> errors) {

	public ParseResult {
		errors = errors != null ? List.copyOf(errors) : List.of();
	}

	public boolean hasErrors() {
		return !errors.isEmpty();
	}
}
