package org.javai.twf.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import org.javai.twf.ast.ActivityDef;
import org.javai.twf.ast.AwaitOneCase;
import org.javai.twf.ast.AwaitTarget;
import org.javai.twf.ast.CloseReason;
import org.javai.twf.ast.Definition;
import org.javai.twf.ast.Position;
import org.javai.twf.ast.QueryDecl;
import org.javai.twf.ast.SignalDecl;
import org.javai.twf.ast.Statement;
import org.javai.twf.ast.SwitchCase;
import org.javai.twf.ast.TwfFile;
import org.javai.twf.ast.UpdateDecl;
import org.javai.twf.ast.WorkflowCallMode;
import org.javai.twf.ast.WorkflowDef;
import org.javai.twf.lexer.TwfToken;
import org.javai.twf.lexer.TwfToken.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for TWF token streams.
 * <p>
 * Statements are dispatched on the kind of their first token through static tables:
 * one for the top level, one for bodies where temporal primitives are allowed (workflow
 * bodies and signal/update handlers) and one for restricted bodies (activities and query
 * handlers). A line that starts with no recognized keyword becomes a {@link Statement.Raw}.
 * <p>
 * Two entry points are offered. {@link #parse(List)} stops at the first error;
 * {@link #parseAll(List)} records the error, skips to the next top-level definition
 * and carries on. Each call runs on its own parser instance.
 */
public final class TwfParser {

	private static final Logger logger = LoggerFactory.getLogger(TwfParser.class);

	private static final Map<Kind, Function<TwfParser, Definition>> TOP_LEVEL = new EnumMap<>(Kind.class);
	private static final Map<Kind, Function<TwfParser, Statement>> WORKFLOW_STATEMENTS = new EnumMap<>(Kind.class);
	private static final Map<Kind, Function<TwfParser, Statement>> ACTIVITY_STATEMENTS = new EnumMap<>(Kind.class);

	/** Keywords rejected in activity bodies and query handlers. */
	private static final Set<Kind> TEMPORAL_KEYWORDS = EnumSet.of(
			Kind.WORKFLOW, Kind.ACTIVITY, Kind.SIGNAL, Kind.QUERY, Kind.UPDATE,
			Kind.SPAWN, Kind.DETACH, Kind.NEXUS, Kind.TIMER, Kind.AWAIT,
			Kind.CONTINUE_AS_NEW, Kind.CLOSE);

	private static final Set<Kind> DECLARATION_KEYWORDS = EnumSet.of(Kind.SIGNAL, Kind.QUERY, Kind.UPDATE);

	static {
		TOP_LEVEL.put(Kind.WORKFLOW, TwfParser::parseWorkflowDef);
		TOP_LEVEL.put(Kind.ACTIVITY, TwfParser::parseActivityDef);

		WORKFLOW_STATEMENTS.put(Kind.ACTIVITY, TwfParser::parseActivityCall);
		WORKFLOW_STATEMENTS.put(Kind.WORKFLOW, TwfParser::parseWorkflowCall);
		WORKFLOW_STATEMENTS.put(Kind.SPAWN, TwfParser::parseWorkflowCall);
		WORKFLOW_STATEMENTS.put(Kind.DETACH, TwfParser::parseWorkflowCall);
		WORKFLOW_STATEMENTS.put(Kind.NEXUS, TwfParser::parseWorkflowCall);
		WORKFLOW_STATEMENTS.put(Kind.AWAIT, TwfParser::parseAwait);
		WORKFLOW_STATEMENTS.put(Kind.SWITCH, TwfParser::parseSwitch);
		WORKFLOW_STATEMENTS.put(Kind.IF, TwfParser::parseIf);
		WORKFLOW_STATEMENTS.put(Kind.FOR, TwfParser::parseFor);
		WORKFLOW_STATEMENTS.put(Kind.CLOSE, TwfParser::parseClose);
		WORKFLOW_STATEMENTS.put(Kind.RETURN, TwfParser::parseReturn);
		WORKFLOW_STATEMENTS.put(Kind.CONTINUE_AS_NEW, TwfParser::parseContinueAsNew);
		WORKFLOW_STATEMENTS.put(Kind.BREAK, TwfParser::parseBreak);
		WORKFLOW_STATEMENTS.put(Kind.CONTINUE, TwfParser::parseContinue);

		ACTIVITY_STATEMENTS.put(Kind.SWITCH, TwfParser::parseSwitch);
		ACTIVITY_STATEMENTS.put(Kind.IF, TwfParser::parseIf);
		ACTIVITY_STATEMENTS.put(Kind.FOR, TwfParser::parseFor);
		ACTIVITY_STATEMENTS.put(Kind.RETURN, TwfParser::parseReturn);
		ACTIVITY_STATEMENTS.put(Kind.BREAK, TwfParser::parseBreak);
		ACTIVITY_STATEMENTS.put(Kind.CONTINUE, TwfParser::parseContinue);
	}

	private final List<TwfToken> tokens;
	private int current = 0;
	private BodyContext context;
	private final List<Statement> trailingComments = new ArrayList<>();

	private TwfParser(List<TwfToken> tokens) {
		if (tokens == null || tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(Kind.EOF)) {
			List<TwfToken> terminated = new ArrayList<>(tokens != null ? tokens : List.of());
			TwfToken last = terminated.isEmpty() ? null : terminated.get(terminated.size() - 1);
			terminated.add(new TwfToken(Kind.EOF, "", last != null ? last.line() : 1, 1));
			this.tokens = terminated;
		} else {
			this.tokens = tokens;
		}
	}

	/**
	 * Parses a token stream, failing on the first error.
	 *
	 * @param tokens tokens produced by the tokenizer
	 * @return the parsed file
	 * @throws TwfParseException at the first syntax error; no partial AST is returned
	 */
	public static TwfFile parse(List<TwfToken> tokens) {
		TwfParser parser = new TwfParser(tokens);
		List<Definition> definitions = new ArrayList<>();
		while (true) {
			parser.skipBlankLinesAndComments();
			if (parser.isAtEnd()) {
				break;
			}
			definitions.add(parser.parseDefinition());
		}
		logger.debug("Parsed {} definitions", definitions.size());
		return new TwfFile(definitions);
	}

	/**
	 * Parses a token stream, collecting every error instead of stopping at the first.
	 * After an error the parser resynchronizes at the next {@code workflow} or
	 * {@code activity} keyword in column 1.
	 *
	 * @param tokens tokens produced by the tokenizer
	 * @return the definitions that parsed, with all errors found
	 */
	public static ParseResult parseAll(List<TwfToken> tokens) {
		TwfParser parser = new TwfParser(tokens);
		List<Definition> definitions = new ArrayList<>();
		List<TwfParseException> errors = new ArrayList<>();
		while (true) {
			parser.skipBlankLinesAndComments();
			if (parser.isAtEnd()) {
				break;
			}
			int start = parser.current;
			try {
				definitions.add(parser.parseDefinition());
			} catch (TwfParseException e) {
				errors.add(e);
				int skipped = parser.recoverTopLevel(start);
				logger.warn("Recovered from parse error at {}:{} ({}); skipped {} tokens",
						e.line(), e.column(), e.getMessage(), skipped);
			}
		}
		logger.debug("Parsed {} definitions with {} errors", definitions.size(), errors.size());
		return new ParseResult(new TwfFile(definitions), errors);
	}

	// ---------------------------------------------------------------------
	// Top level
	// ---------------------------------------------------------------------

	private Definition parseDefinition() {
		context = null;
		trailingComments.clear();
		Function<TwfParser, Definition> rule = TOP_LEVEL.get(peek().kind());
		if (rule == null) {
			throw error("unexpected " + describe(peek()) + " at top level; expected workflow or activity", peek());
		}
		return rule.apply(this);
	}

	/**
	 * Skips to the next top-level definition keyword in column 1, or to the end of input.
	 *
	 * @return the number of tokens skipped
	 */
	private int recoverTopLevel(int failedAt) {
		context = null;
		trailingComments.clear();
		int from = current;
		if (current == failedAt && !isAtEnd()) {
			current++;
		}
		while (!isAtEnd()) {
			TwfToken token = peek();
			if ((token.is(Kind.WORKFLOW) || token.is(Kind.ACTIVITY)) && token.column() == 1) {
				break;
			}
			current++;
		}
		return current - from;
	}

	private WorkflowDef parseWorkflowDef() {
		Position position = positionOf(advance()); // consume 'workflow'
		String name = expect(Kind.IDENT, "workflow name").text();
		String params = expect(Kind.ARGS, "parameter list after workflow " + name).text();
		String returnType = parseOptionalReturnType();
		expectBlockStart("workflow " + name);

		String options = parseOptionalOptionsStatement();
		List<Statement> headerComments = takeTrailingComments();

		List<SignalDecl> signals = new ArrayList<>();
		List<QueryDecl> queries = new ArrayList<>();
		List<UpdateDecl> updates = new ArrayList<>();
		List<Statement> leading = new ArrayList<>();
		while (skipToDeclaration(leading)) {
			switch (peek().kind()) {
				case SIGNAL -> signals.add(parseSignalDecl(leading));
				case QUERY -> queries.add(parseQueryDecl(leading));
				case UPDATE -> updates.add(parseUpdateDecl(leading));
				default -> throw new IllegalStateException("Not a declaration: " + peek());
			}
			leading = new ArrayList<>();
		}

		List<Statement> body = prepend(headerComments, withContext(BodyContext.WORKFLOW, this::parseBody));
		return new WorkflowDef(position, name, params, returnType, options, signals, queries, updates, body);
	}

	private ActivityDef parseActivityDef() {
		Position position = positionOf(advance()); // consume 'activity'
		String name = expect(Kind.IDENT, "activity name").text();
		String params = expect(Kind.ARGS, "parameter list after activity " + name).text();
		String returnType = parseOptionalReturnType();
		expectBlockStart("activity " + name);

		String options = parseOptionalOptionsStatement();
		List<Statement> body = withContext(BodyContext.ACTIVITY, this::parseBody);
		return new ActivityDef(position, name, params, returnType, options, body);
	}

	/**
	 * Positions the parser on the next handler declaration if one follows. Comment lines in
	 * front of it are added to {@code leading} and go to the head of the handler's body.
	 * Comments are left in place when no declaration follows them, so they land in the body.
	 */
	private boolean skipToDeclaration(List<Statement> leading) {
		int lookahead = pastCommentLines(current);
		if (!DECLARATION_KEYWORDS.contains(tokens.get(lookahead).kind())) {
			return false;
		}
		leading.addAll(consumeCommentLines(lookahead));
		return true;
	}

	private SignalDecl parseSignalDecl(List<Statement> leading) {
		Position position = positionOf(advance()); // consume 'signal'
		String name = expect(Kind.IDENT, "signal name").text();
		String params = check(Kind.ARGS) ? advance().text() : "";
		expect(Kind.COLON, "':' after signal " + name);
		List<Statement> body = prepend(leading, withContext(BodyContext.SIGNAL_HANDLER, this::parseOptionalBlock));
		return new SignalDecl(position, name, params, body);
	}

	private QueryDecl parseQueryDecl(List<Statement> leading) {
		TwfToken keyword = advance(); // consume 'query'
		String name = expect(Kind.IDENT, "query name").text();
		String params = expect(Kind.ARGS, "parameter list after query " + name).text();
		String returnType = parseOptionalReturnType();
		if (returnType == null) {
			throw error("query " + name + " requires a return type (-> (Type))", keyword);
		}
		expect(Kind.COLON, "':' after query " + name);
		List<Statement> body = prepend(leading, withContext(BodyContext.QUERY_HANDLER, this::parseOptionalBlock));
		return new QueryDecl(positionOf(keyword), name, params, returnType, body);
	}

	private UpdateDecl parseUpdateDecl(List<Statement> leading) {
		TwfToken keyword = advance(); // consume 'update'
		String name = expect(Kind.IDENT, "update name").text();
		String params = expect(Kind.ARGS, "parameter list after update " + name).text();
		String returnType = parseOptionalReturnType();
		if (returnType == null) {
			throw error("update " + name + " requires a return type (-> (Type))", keyword);
		}
		expect(Kind.COLON, "':' after update " + name);
		List<Statement> body = prepend(leading, withContext(BodyContext.UPDATE_HANDLER, this::parseOptionalBlock));
		return new UpdateDecl(positionOf(keyword), name, params, returnType, body);
	}

	private String parseOptionalReturnType() {
		if (!check(Kind.ARROW)) {
			return null;
		}
		advance(); // consume '->'
		if (check(Kind.ARGS) || check(Kind.IDENT)) {
			return advance().text();
		}
		throw error("expected return type after '->', found " + describe(peek()), peek());
	}

	/**
	 * An {@code options(...)} line at the start of a definition body.
	 */
	private String parseOptionalOptionsStatement() {
		skipBlankLines();
		int at = pastCommentLines(current);
		if (!tokens.get(at).is(Kind.OPTIONS)) {
			return null;
		}
		trailingComments.addAll(consumeCommentLines(at));
		advance(); // consume 'options'
		String options = expect(Kind.ARGS, "'(' after options").text();
		expectLineEnd("options");
		return options;
	}

	// ---------------------------------------------------------------------
	// Bodies
	// ---------------------------------------------------------------------

	/**
	 * Parses statements up to and including the DEDENT closing the current block.
	 */
	private List<Statement> parseBody() {
		List<Statement> statements = new ArrayList<>();
		while (!check(Kind.DEDENT) && !isAtEnd()) {
			flushTrailingComment(statements);
			TwfToken token = peek();
			if (token.is(Kind.NEWLINE)) {
				advance();
				continue;
			}
			if (token.is(Kind.COMMENT)) {
				advance();
				statements.add(new Statement.Comment(positionOf(token), token.text()));
				if (check(Kind.NEWLINE)) {
					advance();
				}
				continue;
			}
			statements.add(parseStatement());
			flushTrailingComment(statements);
		}
		flushTrailingComment(statements);
		if (check(Kind.DEDENT)) {
			advance();
		}
		return statements;
	}

	private Statement parseStatement() {
		TwfToken token = peek();
		Kind kind = token.kind();

		if (!context.temporal() && TEMPORAL_KEYWORDS.contains(kind)) {
			throw error(token.text() + " is not allowed in " + context.description(), token);
		}
		if (kind == Kind.CLOSE && !context.closeAllowed()) {
			throw error("close is not allowed in " + context.description()
					+ "; only the workflow's main body can close it", token);
		}
		if (DECLARATION_KEYWORDS.contains(kind)) {
			if (context == BodyContext.WORKFLOW) {
				throw error(token.text() + " declarations must precede workflow body statements", token);
			}
			throw error(token.text() + " declarations are not allowed in " + context.description(), token);
		}
		switch (kind) {
			case TIMER -> throw error("a timer must be awaited: use 'await timer(...)'", token);
			case OPTIONS -> throw error("options(...) must directly follow a call or a definition header", token);
			case ELSE -> throw error("'else' without a matching if or switch", token);
			case CASE -> throw error("'case' outside of a switch block", token);
			case INDENT -> throw error("unexpected indentation", token);
			default -> {
				// dispatched below
			}
		}

		Map<Kind, Function<TwfParser, Statement>> table = context.temporal() ? WORKFLOW_STATEMENTS : ACTIVITY_STATEMENTS;
		Function<TwfParser, Statement> rule = table.get(kind);
		if (rule == null) {
			return parseRaw();
		}
		return rule.apply(this);
	}

	private <T> T withContext(BodyContext bodyContext, Supplier<T> parse) {
		BodyContext previous = context;
		context = bodyContext;
		try {
			return parse.get();
		} finally {
			context = previous;
		}
	}

	/**
	 * Expects {@code : NEWLINE INDENT} ending a block header.
	 */
	private void expectBlockStart(String header) {
		expect(Kind.COLON, "':' after " + header);
		expectHeaderEnd(header);
		expectIndent(header);
	}

	/**
	 * Parses {@code NEWLINE INDENT body} after a block header's colon.
	 */
	private List<Statement> parseBlock(String header) {
		expectHeaderEnd(header);
		expectIndent(header);
		return parseBody();
	}

	/**
	 * Parses the body after a header whose block may be empty: handlers and await-one cases.
	 */
	private List<Statement> parseOptionalBlock() {
		expectHeaderEnd("':'");
		if (!check(Kind.INDENT)) {
			return List.of();
		}
		advance();
		return parseBody();
	}

	private void expectIndent(String header) {
		if (!check(Kind.INDENT)) {
			throw error("expected an indented block after " + header + ", found " + describe(peek()), peek());
		}
		advance();
	}

	// ---------------------------------------------------------------------
	// Calls
	// ---------------------------------------------------------------------

	private Statement.ActivityCall parseActivityCall() {
		Position position = positionOf(peek());
		AwaitTarget.Activity header = parseActivityHeader();
		expectLineEnd("activity " + header.name());
		String options = parseOptionalOptionsLine("activity " + header.name());
		return new Statement.ActivityCall(position, header.name(), header.args(), header.result(), options);
	}

	private Statement.WorkflowCall parseWorkflowCall() {
		Position position = positionOf(peek());
		AwaitTarget.Workflow header = parseWorkflowHeader();
		expectLineEnd("workflow " + header.name());
		String options = parseOptionalOptionsLine("workflow " + header.name());
		return new Statement.WorkflowCall(position, header.mode(), header.namespace(), header.name(),
				header.args(), header.result(), options);
	}

	/**
	 * {@code activity Name(args) [-> result]}
	 */
	private AwaitTarget.Activity parseActivityHeader() {
		advance(); // consume 'activity'
		String name = expect(Kind.IDENT, "activity name").text();
		String args = expect(Kind.ARGS, "argument list after activity " + name).text();
		String result = parseOptionalResult();
		return new AwaitTarget.Activity(name, args, result);
	}

	/**
	 * {@code [spawn|detach] [nexus "ns"] workflow Name(args) [-> result]}
	 */
	private AwaitTarget.Workflow parseWorkflowHeader() {
		TwfToken start = peek();
		WorkflowCallMode mode = WorkflowCallMode.CHILD;
		if (check(Kind.SPAWN)) {
			advance();
			mode = WorkflowCallMode.SPAWN;
		} else if (check(Kind.DETACH)) {
			advance();
			mode = WorkflowCallMode.DETACH;
		}

		String namespace = null;
		if (check(Kind.NEXUS)) {
			advance();
			namespace = expect(Kind.STRING, "quoted namespace after nexus").text();
		}

		expect(Kind.WORKFLOW, "'workflow'");
		String name = expect(Kind.IDENT, "workflow name").text();
		String args = expect(Kind.ARGS, "argument list after workflow " + name).text();
		String result = parseOptionalResult();
		if (mode == WorkflowCallMode.DETACH && result != null) {
			throw error("detach workflow call cannot bind a result (-> " + result + ")", start);
		}
		return new AwaitTarget.Workflow(mode, namespace, name, args, result);
	}

	private String parseOptionalResult() {
		if (!check(Kind.ARROW)) {
			return null;
		}
		advance(); // consume '->'
		return expect(Kind.IDENT, "result name after '->'").text();
	}

	/**
	 * An indented {@code options(...)} line directly after a call.
	 */
	private String parseOptionalOptionsLine(String call) {
		if (!check(Kind.INDENT)) {
			return null;
		}
		int at = pastCommentLines(current + 1);
		if (!tokens.get(at).is(Kind.OPTIONS)) {
			throw error("only an options(...) line may be indented under " + call, tokens.get(at));
		}
		advance(); // consume INDENT
		trailingComments.addAll(consumeCommentLines(at));
		advance(); // consume 'options'
		String options = expect(Kind.ARGS, "'(' after options").text();
		expectLineEnd("options");
		trailingComments.addAll(consumeCommentLines(pastCommentLines(current)));
		if (!check(Kind.DEDENT) && !isAtEnd()) {
			throw error("a call takes a single options(...) line, found " + describe(peek()), peek());
		}
		if (check(Kind.DEDENT)) {
			advance();
		}
		return options;
	}

	// ---------------------------------------------------------------------
	// Await
	// ---------------------------------------------------------------------

	private Statement parseAwait() {
		TwfToken keyword = advance(); // consume 'await'
		if (check(Kind.ALL)) {
			return parseAwaitAll(keyword);
		}
		if (check(Kind.ONE)) {
			return parseAwaitOne(keyword);
		}
		AwaitTarget target = parseAwaitTarget("after 'await'");
		expectLineEnd("await " + target.kind());
		return new Statement.Await(positionOf(keyword), target);
	}

	private AwaitTarget parseAwaitTarget(String where) {
		TwfToken token = peek();
		return switch (token.kind()) {
			case TIMER -> {
				advance();
				yield new AwaitTarget.Timer(expect(Kind.ARGS, "duration after timer").text());
			}
			case SIGNAL -> {
				advance();
				String name = expect(Kind.IDENT, "signal name").text();
				yield new AwaitTarget.Signal(name, parseOptionalBinding());
			}
			case UPDATE -> {
				advance();
				String name = expect(Kind.IDENT, "update name").text();
				yield new AwaitTarget.Update(name, parseOptionalBinding());
			}
			case ACTIVITY -> parseActivityHeader();
			case SPAWN, DETACH, NEXUS, WORKFLOW -> parseWorkflowHeader();
			default -> throw error("expected timer, signal, update, activity or workflow " + where
					+ ", found " + describe(token), token);
		};
	}

	/**
	 * A parameter binding after '->': one identifier or a parenthesized list.
	 */
	private String parseOptionalBinding() {
		if (!check(Kind.ARROW)) {
			return null;
		}
		advance(); // consume '->'
		if (check(Kind.IDENT)) {
			return advance().text();
		}
		if (check(Kind.ARGS)) {
			return advance().sourceText();
		}
		throw error("expected identifier or (...) after '->', found " + describe(peek()), peek());
	}

	private Statement.AwaitAll parseAwaitAll(TwfToken keyword) {
		advance(); // consume 'all'
		expect(Kind.COLON, "':' after await all");
		return new Statement.AwaitAll(positionOf(keyword), parseBlock("await all"));
	}

	private Statement.AwaitOne parseAwaitOne(TwfToken keyword) {
		advance(); // consume 'one'
		expect(Kind.COLON, "':' after await one");
		expectHeaderEnd("await one");
		if (!check(Kind.INDENT)) {
			throw error("await one must have at least one case", keyword);
		}
		advance();

		List<AwaitOneCase> cases = new ArrayList<>();
		while (!check(Kind.DEDENT) && !isAtEnd()) {
			if (check(Kind.NEWLINE) || check(Kind.COMMENT)) {
				advance();
				continue;
			}
			cases.add(parseAwaitOneCase());
		}
		if (check(Kind.DEDENT)) {
			advance();
		}
		if (cases.isEmpty()) {
			throw error("await one must have at least one case", keyword);
		}
		return new Statement.AwaitOne(positionOf(keyword), cases);
	}

	private AwaitOneCase parseAwaitOneCase() {
		TwfToken start = peek();
		Position position = positionOf(start);
		if (start.is(Kind.AWAIT)) {
			advance();
			if (!check(Kind.ALL)) {
				throw error("only 'await all' may be nested in an await one case, found " + describe(peek()), peek());
			}
			return AwaitOneCase.nested(position, parseAwaitAll(start));
		}

		AwaitTarget target = parseAwaitTarget("in await one case");
		expect(Kind.COLON, "':' after await one case");
		List<Statement> body = parseOptionalBlock();
		return AwaitOneCase.of(position, target, body);
	}

	// ---------------------------------------------------------------------
	// Control flow
	// ---------------------------------------------------------------------

	private Statement.Switch parseSwitch() {
		TwfToken keyword = advance(); // consume 'switch'
		String expr = expect(Kind.ARGS, "(expression) after switch").text();
		expect(Kind.COLON, "':' after switch");
		expectHeaderEnd("switch");
		if (!check(Kind.INDENT)) {
			throw error("switch must have at least one case", keyword);
		}
		advance();

		List<SwitchCase> cases = new ArrayList<>();
		List<Statement> defaultBody = null;
		while (!check(Kind.DEDENT) && !isAtEnd()) {
			TwfToken token = peek();
			if (token.is(Kind.NEWLINE) || token.is(Kind.COMMENT)) {
				advance();
				continue;
			}
			if (token.is(Kind.ELSE)) {
				if (defaultBody != null) {
					throw error("switch already has an else arm", token);
				}
				advance();
				expect(Kind.COLON, "':' after else");
				defaultBody = parseBlock("else");
				continue;
			}
			if (!token.is(Kind.CASE)) {
				throw error("expected case or else in switch, found " + describe(token), token);
			}
			if (defaultBody != null) {
				throw error("case after the else arm of a switch", token);
			}
			advance(); // consume 'case'
			String value = collectRawUntil(EnumSet.of(Kind.COLON, Kind.NEWLINE));
			if (value.isEmpty()) {
				throw error("case requires a value", token);
			}
			expect(Kind.COLON, "':' after case " + value);
			cases.add(new SwitchCase(positionOf(token), value, parseBlock("case " + value)));
		}
		if (check(Kind.DEDENT)) {
			advance();
		}
		if (cases.isEmpty()) {
			throw error("switch must have at least one case", keyword);
		}
		return new Statement.Switch(positionOf(keyword), expr, cases, defaultBody);
	}

	private Statement.If parseIf() {
		TwfToken keyword = advance(); // consume 'if'
		String condition = expect(Kind.ARGS, "(condition) after if").text();
		expect(Kind.COLON, "':' after if");
		List<Statement> body = parseBlock("if");

		List<Statement> elseBody = null;
		int at = pastCommentLines(current);
		if (tokens.get(at).is(Kind.ELSE)) {
			List<Statement> leading = consumeCommentLines(at);
			advance(); // consume 'else'
			expect(Kind.COLON, "':' after else");
			elseBody = prepend(leading, parseBlock("else"));
		}
		return new Statement.If(positionOf(keyword), condition, body, elseBody);
	}

	private Statement.For parseFor() {
		TwfToken keyword = advance(); // consume 'for'
		Position position = positionOf(keyword);

		if (check(Kind.COLON)) {
			advance();
			return Statement.For.infinite(position, parseBlock("for"));
		}

		String header = expect(Kind.ARGS, "'(' or ':' after for").text();
		expect(Kind.COLON, "':' after for (...)");
		List<String> words = Arrays.asList(header.trim().split("\\s+"));
		int in = words.indexOf("in");
		if (in > 0) {
			String variable = String.join(" ", words.subList(0, in));
			String iterable = String.join(" ", words.subList(in + 1, words.size()));
			if (iterable.isEmpty()) {
				throw error("for (" + header + ") is missing the collection after 'in'", keyword);
			}
			return Statement.For.iteration(position, variable, iterable, parseBlock("for"));
		}
		return Statement.For.conditional(position, header, parseBlock("for"));
	}

	private Statement.Close parseClose() {
		TwfToken keyword = advance(); // consume 'close'
		CloseReason reason = CloseReason.NONE;
		if (check(Kind.COMPLETED)) {
			advance();
			reason = CloseReason.COMPLETED;
		} else if (check(Kind.FAILED)) {
			advance();
			reason = CloseReason.FAILED;
		}
		String value = parseOptionalValue();
		expectLineEnd("close");
		return new Statement.Close(positionOf(keyword), reason, value);
	}

	private Statement.Return parseReturn() {
		TwfToken keyword = advance(); // consume 'return'
		String value = parseOptionalValue();
		expectLineEnd("return");
		return new Statement.Return(positionOf(keyword), value);
	}

	private String parseOptionalValue() {
		String value = collectRawUntil(EnumSet.of(Kind.NEWLINE, Kind.COMMENT));
		return value.isEmpty() ? null : value;
	}

	private Statement.ContinueAsNew parseContinueAsNew() {
		TwfToken keyword = advance(); // consume 'continue_as_new'
		String args = expect(Kind.ARGS, "'(' after continue_as_new").text();
		expectLineEnd("continue_as_new");
		return new Statement.ContinueAsNew(positionOf(keyword), args);
	}

	private Statement.Break parseBreak() {
		TwfToken keyword = advance();
		expectLineEnd("break");
		return new Statement.Break(positionOf(keyword));
	}

	private Statement.Continue parseContinue() {
		TwfToken keyword = advance();
		expectLineEnd("continue");
		return new Statement.Continue(positionOf(keyword));
	}

	private Statement.Raw parseRaw() {
		Position position = positionOf(peek());
		String text = collectRawUntil(EnumSet.of(Kind.NEWLINE, Kind.COMMENT));
		expectLineEnd("statement");
		return new Statement.Raw(position, text);
	}

	// ---------------------------------------------------------------------
	// Token helpers
	// ---------------------------------------------------------------------

	/**
	 * Concatenates tokens up to (not including) a terminator, restoring the spacing of the source.
	 */
	private String collectRawUntil(Set<Kind> terminators) {
		StringBuilder sb = new StringBuilder();
		TwfToken previous = null;
		while (!isAtEnd() && !terminators.contains(peek().kind())) {
			TwfToken token = advance();
			String text = token.sourceText();
			if (previous != null) {
				int previousEnd = previous.column() + previous.sourceText().length();
				if (token.line() != previous.line()) {
					sb.append(' ');
				} else if (token.column() > previousEnd) {
					sb.append(" ".repeat(token.column() - previousEnd));
				}
			}
			sb.append(text);
			previous = token;
		}
		return sb.toString().trim();
	}

	/**
	 * Expects the end of a logical line. A trailing comment is kept and emitted after the statement.
	 */
	private void expectLineEnd(String after) {
		if (check(Kind.COMMENT)) {
			TwfToken comment = advance();
			trailingComments.add(new Statement.Comment(positionOf(comment), comment.text()));
		}
		if (check(Kind.NEWLINE)) {
			advance();
			return;
		}
		if (isAtEnd()) {
			return;
		}
		throw error("unexpected " + describe(peek()) + " after " + after, peek());
	}

	/**
	 * Line end of a block header. Comments on header lines are dropped.
	 */
	private void expectHeaderEnd(String header) {
		int pending = trailingComments.size();
		expectLineEnd(header);
		trailingComments.subList(pending, trailingComments.size()).clear();
	}

	private void flushTrailingComment(List<Statement> statements) {
		statements.addAll(trailingComments);
		trailingComments.clear();
	}

	private List<Statement> takeTrailingComments() {
		List<Statement> taken = new ArrayList<>(trailingComments);
		trailingComments.clear();
		return taken;
	}

	/**
	 * Index of the first token at or after {@code from} that is not part of a blank or comment line.
	 */
	private int pastCommentLines(int from) {
		int at = from;
		while (tokens.get(at).is(Kind.NEWLINE) || tokens.get(at).is(Kind.COMMENT)) {
			at++;
		}
		return at;
	}

	/**
	 * Advances to {@code end}, returning the comments passed on the way.
	 */
	private List<Statement> consumeCommentLines(int end) {
		List<Statement> comments = new ArrayList<>();
		while (current < end) {
			TwfToken token = advance();
			if (token.is(Kind.COMMENT)) {
				comments.add(new Statement.Comment(positionOf(token), token.text()));
			}
		}
		return comments;
	}

	private static List<Statement> prepend(List<Statement> leading, List<Statement> body) {
		if (leading.isEmpty()) {
			return body;
		}
		List<Statement> all = new ArrayList<>(leading);
		all.addAll(body);
		return all;
	}

	private void skipBlankLines() {
		while (check(Kind.NEWLINE)) {
			advance();
		}
	}

	private void skipBlankLinesAndComments() {
		while (check(Kind.NEWLINE) || check(Kind.COMMENT)) {
			advance();
		}
	}

	private TwfToken expect(Kind kind, String what) {
		if (!check(kind)) {
			throw error("expected " + what + ", found " + describe(peek()), peek());
		}
		return advance();
	}

	private TwfToken peek() {
		return tokens.get(current);
	}

	private TwfToken advance() {
		TwfToken token = tokens.get(current);
		if (!isAtEnd()) {
			current++;
		}
		return token;
	}

	private boolean check(Kind kind) {
		return peek().kind() == kind;
	}

	private boolean isAtEnd() {
		return peek().is(Kind.EOF);
	}

	private static Position positionOf(TwfToken token) {
		return new Position(token.line(), token.column());
	}

	private static String describe(TwfToken token) {
		return switch (token.kind()) {
			case EOF -> "end of input";
			case NEWLINE -> "end of line";
			case INDENT -> "indentation";
			case DEDENT -> "end of block";
			default -> token.kind() + " '" + token.sourceText() + "'";
		};
	}

	private static TwfParseException error(String message, TwfToken at) {
		return new TwfParseException(message, at);
	}
}
