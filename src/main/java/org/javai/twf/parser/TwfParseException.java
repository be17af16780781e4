package org.javai.twf.parser;

import org.javai.twf.lexer.TwfToken;

/**
 * Exception thrown when a token stream does not match the TWF grammar.
 */
public class TwfParseException extends RuntimeException {

	private final int line;
	private final int column;

	public TwfParseException(String message, int line, int column) {
		super(message);
		this.line = line;
		this.column = column;
	}

	public TwfParseException(String message, TwfToken at) {
		this(message, at.line(), at.column());
	}

	public int line() {
		return line;
	}

	public int column() {
		return column;
	}

	@Override
	public String toString() {
		return "parse error at " + line + ":" + column + ": " + getMessage();
	}
}
