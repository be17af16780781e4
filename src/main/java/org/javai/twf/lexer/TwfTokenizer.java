package org.javai.twf.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Indentation-aware tokenizer for TWF source text.
 * <p>
 * Produces a flat token stream in which block structure is made explicit with
 * INDENT and DEDENT tokens, the way Python's tokenizer does. A parenthesized span is
 * captured whole into a single ARGS token; the tokenizer never looks inside it.
 * <p>
 * Full-line comments do not take part in indentation. They are held back until the next
 * line with content. A comment indented at least as deep as a block that line closes is
 * emitted before that block's DEDENT; any other comment follows the INDENT or DEDENT
 * tokens and lands in the block of the statement after it.
 * <p>
 * A tokenizer instance is single-use.
 */
public class TwfTokenizer {

	private final String input;
	private int pos = 0;
	private int line = 1;
	private int lineStart = 0;

	private final Deque<Integer> indents = new ArrayDeque<>();
	private final List<TwfToken> pendingComments = new ArrayList<>();
	private char indentChar = 0;

	public TwfTokenizer(String input) {
		this.input = input != null ? input : "";
		this.indents.push(0);
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return list of tokens, always terminated by an EOF token
	 * @throws TwfLexException on inconsistent indentation or an unterminated span
	 */
	public List<TwfToken> tokenize() {
		List<TwfToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			scanLine(tokens);
		}
		while (indents.size() > 1) {
			closeBlock(tokens);
		}
		flushComments(tokens);
		tokens.add(new TwfToken(TwfToken.Kind.EOF, "", line, column()));
		return tokens;
	}

	private void scanLine(List<TwfToken> tokens) {
		int width = 0;
		boolean spaces = false;
		boolean tabs = false;
		while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) {
			if (advance() == ' ') {
				spaces = true;
			} else {
				tabs = true;
			}
			width++;
		}
		while (!isAtEnd() && peek() == '\r') {
			advance();
		}

		if (isAtEnd()) {
			return;
		}
		if (peek() == '\n') {
			advance();
			return;
		}
		if (peek() == '#') {
			pendingComments.add(scanComment());
			endLine(pendingComments);
			return;
		}

		checkIndentStyle(spaces, tabs);
		applyIndent(width, tokens);
		flushComments(tokens);

		while (true) {
			skipInlineWhitespace();
			if (isAtEnd() || peek() == '\n') {
				endLine(tokens);
				return;
			}
			tokens.add(nextToken());
		}
	}

	private void checkIndentStyle(boolean spaces, boolean tabs) {
		if (spaces && tabs) {
			throw new TwfLexException("mixed tabs and spaces in indentation on line " + line, line, 1);
		}
		if (!spaces && !tabs) {
			return;
		}
		char used = spaces ? ' ' : '\t';
		if (indentChar == 0) {
			indentChar = used;
		} else if (indentChar != used) {
			throw new TwfLexException("inconsistent use of tabs and spaces in indentation on line " + line
					+ ": file is indented with " + (indentChar == ' ' ? "spaces" : "tabs"), line, 1);
		}
	}

	private void applyIndent(int width, List<TwfToken> tokens) {
		int top = indents.peek();
		if (width > top) {
			indents.push(width);
			tokens.add(new TwfToken(TwfToken.Kind.INDENT, "", line, column()));
			return;
		}
		while (width < indents.peek()) {
			closeBlock(tokens);
		}
		if (width != indents.peek()) {
			throw new TwfLexException("inconsistent dedent on line " + line + ": indentation of " + width
					+ " does not match any enclosing block", line, column());
		}
	}

	/**
	 * Emits a DEDENT for the innermost block. Held-back comments indented at least as deep
	 * as that block go out first and stay inside it.
	 */
	private void closeBlock(List<TwfToken> tokens) {
		int width = indents.pop();
		while (!pendingComments.isEmpty() && pendingComments.get(0).column() - 1 >= width) {
			tokens.add(pendingComments.remove(0)); // comment
			tokens.add(pendingComments.remove(0)); // its NEWLINE
		}
		tokens.add(new TwfToken(TwfToken.Kind.DEDENT, "", line, column()));
	}

	private void flushComments(List<TwfToken> tokens) {
		tokens.addAll(pendingComments);
		pendingComments.clear();
	}

	private void endLine(List<TwfToken> tokens) {
		tokens.add(new TwfToken(TwfToken.Kind.NEWLINE, "", line, column()));
		if (!isAtEnd()) {
			advance(); // consume '\n'
		}
	}

	private TwfToken nextToken() {
		char c = peek();

		return switch (c) {
			case '#' -> scanComment();
			case '(' -> scanArgs();
			case '"' -> scanString();
			case ':' -> {
				TwfToken token = new TwfToken(TwfToken.Kind.COLON, ":", line, column());
				advance();
				yield token;
			}
			default -> {
				if (c == '-' && peekNext() == '>') {
					TwfToken token = new TwfToken(TwfToken.Kind.ARROW, "->", line, column());
					advance();
					advance();
					yield token;
				} else if (isIdentifierStart(c)) {
					yield scanWord();
				} else {
					yield scanRawText();
				}
			}
		};
	}

	private TwfToken scanComment() {
		int startColumn = column();
		advance(); // consume '#'
		int start = pos;
		while (!isAtEnd() && peek() != '\n') {
			advance();
		}
		String text = input.substring(start, pos);
		if (text.endsWith("\r")) {
			text = text.substring(0, text.length() - 1);
		}
		return new TwfToken(TwfToken.Kind.COMMENT, text, line, startColumn);
	}

	private TwfToken scanArgs() {
		int startLine = line;
		int startColumn = column();
		advance(); // consume '('
		int start = pos;
		int depth = 1;

		while (true) {
			if (isAtEnd()) {
				throw new TwfLexException("unterminated '(' opened at " + startLine + ":" + startColumn,
						startLine, startColumn);
			}
			char c = peek();
			if (c == '"') {
				skipQuoted();
				continue;
			}
			if (c == '(') {
				depth++;
			} else if (c == ')') {
				depth--;
				if (depth == 0) {
					break;
				}
			}
			advance();
		}

		String text = input.substring(start, pos);
		advance(); // consume ')'
		return new TwfToken(TwfToken.Kind.ARGS, text, startLine, startColumn);
	}

	private TwfToken scanString() {
		int startColumn = column();
		int start = pos + 1;
		skipQuoted();
		return new TwfToken(TwfToken.Kind.STRING, input.substring(start, pos - 1), line, startColumn);
	}

	/**
	 * Skips a double-quoted string including both quotes. Strings do not span lines.
	 */
	private void skipQuoted() {
		int startLine = line;
		int startColumn = column();
		advance(); // consume opening '"'
		while (!isAtEnd() && peek() != '"' && peek() != '\n') {
			if (advance() == '\\' && !isAtEnd() && peek() != '\n') {
				advance();
			}
		}
		if (isAtEnd() || peek() == '\n') {
			throw new TwfLexException("unterminated string starting at " + startLine + ":" + startColumn,
					startLine, startColumn);
		}
		advance(); // consume closing '"'
	}

	private TwfToken scanWord() {
		int startColumn = column();
		int start = pos;
		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}
		String word = input.substring(start, pos);
		return new TwfToken(TwfToken.lookupWord(word), word, line, startColumn);
	}

	private TwfToken scanRawText() {
		int startColumn = column();
		int start = pos;
		advance();
		while (!isAtEnd() && isRawChar(peek())) {
			advance();
		}
		return new TwfToken(TwfToken.Kind.RAW_TEXT, input.substring(start, pos), line, startColumn);
	}

	private void skipInlineWhitespace() {
		while (!isAtEnd() && (peek() == ' ' || peek() == '\t' || peek() == '\r')) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char peekNext() {
		return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
	}

	private char advance() {
		char c = input.charAt(pos++);
		if (c == '\n') {
			line++;
			lineStart = pos;
		}
		return c;
	}

	private int column() {
		return pos - lineStart + 1;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || (c >= '0' && c <= '9');
	}

	private boolean isRawChar(char c) {
		if (isIdentifierStart(c) || Character.isWhitespace(c)) {
			return false;
		}
		if (c == '-' && peekNext() == '>') {
			return false;
		}
		return c != '#' && c != '(' && c != '"' && c != ':';
	}
}
