package org.javai.twf.ast;

/**
 * A 1-based source position.
 */
public record Position(int line, int column) {

	@Override
	public String toString() {
		return line + ":" + column;
	}
}
