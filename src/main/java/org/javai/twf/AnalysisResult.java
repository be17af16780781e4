package org.javai.twf;

import java.util.List;
import java.util.Optional;
import org.javai.twf.ast.TwfFile;

/**
 * The outcome of analyzing source text.
 *
 * @param file the parsed file, or null after a lex error or a fail-fast parse error
 * @param diagnostics every error found, lex first, then parse, then resolve
 */
public record AnalysisResult(TwfFile file, List<Diagnostic> diagnostics) {

	public AnalysisResult {
		diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
	}

	public Optional<TwfFile> fileIfPresent() {
		return Optional.ofNullable(file);
	}

	public boolean hasErrors() {
		return !diagnostics.isEmpty();
	}

	public List<Diagnostic> diagnostics(Phase phase) {
		return diagnostics.stream().filter(d -> d.phase() == phase).toList();
	}
}
