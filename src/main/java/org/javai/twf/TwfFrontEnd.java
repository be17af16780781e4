package org.javai.twf;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.twf.ast.TwfFile;
import org.javai.twf.lexer.TwfLexException;
import org.javai.twf.lexer.TwfToken;
import org.javai.twf.lexer.TwfTokenizer;
import org.javai.twf.parser.ParseResult;
import org.javai.twf.parser.TwfParseException;
import org.javai.twf.parser.TwfParser;
import org.javai.twf.resolver.ResolveError;
import org.javai.twf.resolver.TwfResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the tokenizer, parser and resolver over TWF source and gathers their errors as
 * {@link Diagnostic}s.
 * <p>
 * A lex error ends the analysis with no AST. In fail-fast mode the first parse error
 * does the same; otherwise every parseable definition is kept and resolved. Instances
 * hold no mutable state and can be shared.
 *
 * <pre>{@code
 * AnalysisResult result = new TwfFrontEnd().analyze(source);
 * result.diagnostics().forEach(d -> System.err.println(d));
 * }</pre>
 */
public class TwfFrontEnd {

	private static final Logger logger = LoggerFactory.getLogger(TwfFrontEnd.class);

	private final FrontEndOptions options;

	public TwfFrontEnd() {
		this(FrontEndOptions.defaults());
	}

	public TwfFrontEnd(FrontEndOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	public FrontEndOptions options() {
		return options;
	}

	/**
	 * Analyzes several sources as one, so that definitions in one can be referenced from another.
	 * Positions refer to the joined text.
	 */
	public AnalysisResult analyze(List<String> sources) {
		return analyze(String.join(options.sourceSeparator(), sources));
	}

	public AnalysisResult analyze(String source) {
		List<Diagnostic> diagnostics = new ArrayList<>();

		List<TwfToken> tokens;
		try {
			tokens = new TwfTokenizer(source).tokenize();
		} catch (TwfLexException e) {
			logger.debug("Lexing failed: {}", e.toString());
			return new AnalysisResult(null, List.of(Diagnostic.of(e)));
		}
		logger.debug("Tokenized {} tokens", tokens.size());

		TwfFile file;
		if (options.failFast()) {
			try {
				file = TwfParser.parse(tokens);
			} catch (TwfParseException e) {
				logger.debug("Parsing failed: {}", e.toString());
				return new AnalysisResult(null, List.of(Diagnostic.of(e)));
			}
		} else {
			ParseResult parsed = TwfParser.parseAll(tokens);
			parsed.errors().forEach(e -> diagnostics.add(Diagnostic.of(e)));
			file = parsed.file();
		}

		if (options.resolve()) {
			for (ResolveError error : new TwfResolver().resolve(file)) {
				diagnostics.add(Diagnostic.of(error));
			}
		}
		return new AnalysisResult(file, diagnostics);
	}
}
