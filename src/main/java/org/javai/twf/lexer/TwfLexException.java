package org.javai.twf.lexer;

/**
 * Exception thrown when a source file cannot be tokenized.
 * Lexing errors are fatal for the whole file.
 */
public class TwfLexException extends RuntimeException {

	private final int line;
	private final int column;

	public TwfLexException(String message, int line, int column) {
		super(message);
		this.line = line;
		this.column = column;
	}

	public int line() {
		return line;
	}

	public int column() {
		return column;
	}

	@Override
	public String toString() {
		return "lex error at " + line + ":" + column + ": " + getMessage();
	}
}
