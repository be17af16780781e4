package org.javai.twf.lexer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Represents a token of a TWF source file.
 *
 * @param kind the token kind
 * @param text the token text; for ARGS, STRING and COMMENT this is the interior text without delimiters
 * @param line the 1-based line the token starts on
 * @param column the 1-based column the token starts at
 */
public record TwfToken(Kind kind, String text, int line, int column) {

	public enum Kind {
		// structural
		EOF,
		NEWLINE,
		INDENT,
		DEDENT,

		// definitions and declarations
		WORKFLOW,
		ACTIVITY,
		SIGNAL,
		QUERY,
		UPDATE,

		// call modifiers
		SPAWN,
		DETACH,
		NEXUS,
		OPTIONS,

		// temporal primitives
		TIMER,
		AWAIT,
		ALL,
		ONE,
		CLOSE,
		COMPLETED,
		FAILED,
		CONTINUE_AS_NEW,

		// control flow
		SWITCH,
		CASE,
		IF,
		ELSE,
		FOR,
		IN,
		RETURN,
		BREAK,
		CONTINUE,

		COLON,         // :
		ARROW,         // ->

		IDENT,
		STRING,        // "quoted", used for nexus namespaces
		ARGS,          // interior of a (...) span
		COMMENT,       // text after #
		RAW_TEXT       // any other single character
	}

	private static final Map<String, Kind> KEYWORDS;

	static {
		Map<String, Kind> keywords = new HashMap<>();
		keywords.put("workflow", Kind.WORKFLOW);
		keywords.put("activity", Kind.ACTIVITY);
		keywords.put("signal", Kind.SIGNAL);
		keywords.put("query", Kind.QUERY);
		keywords.put("update", Kind.UPDATE);
		keywords.put("spawn", Kind.SPAWN);
		keywords.put("detach", Kind.DETACH);
		keywords.put("nexus", Kind.NEXUS);
		keywords.put("options", Kind.OPTIONS);
		keywords.put("timer", Kind.TIMER);
		keywords.put("await", Kind.AWAIT);
		keywords.put("all", Kind.ALL);
		keywords.put("one", Kind.ONE);
		keywords.put("close", Kind.CLOSE);
		keywords.put("completed", Kind.COMPLETED);
		keywords.put("failed", Kind.FAILED);
		keywords.put("continue_as_new", Kind.CONTINUE_AS_NEW);
		keywords.put("switch", Kind.SWITCH);
		keywords.put("case", Kind.CASE);
		keywords.put("if", Kind.IF);
		keywords.put("else", Kind.ELSE);
		keywords.put("for", Kind.FOR);
		keywords.put("in", Kind.IN);
		keywords.put("return", Kind.RETURN);
		keywords.put("break", Kind.BREAK);
		keywords.put("continue", Kind.CONTINUE);
		KEYWORDS = Collections.unmodifiableMap(keywords);
	}

	public TwfToken {
		text = text != null ? text : "";
	}

	/**
	 * Looks up the kind of a bare word: a keyword kind, or {@link Kind#IDENT}.
	 */
	public static Kind lookupWord(String word) {
		return KEYWORDS.getOrDefault(word, Kind.IDENT);
	}

	/**
	 * The keyword spellings, for tooling such as completion.
	 */
	public static Map<String, Kind> keywords() {
		return KEYWORDS;
	}

	public boolean is(Kind expected) {
		return kind == expected;
	}

	/**
	 * The token as it was written in the source, delimiters included.
	 */
	public String sourceText() {
		return switch (kind) {
			case ARGS -> "(" + text + ")";
			case STRING -> "\"" + text + "\"";
			case COMMENT -> "#" + text;
			default -> text;
		};
	}

	@Override
	public String toString() {
		if (text.isEmpty()) {
			return kind + "@" + line + ":" + column;
		}
		return kind + "('" + text + "')@" + line + ":" + column;
	}
}
