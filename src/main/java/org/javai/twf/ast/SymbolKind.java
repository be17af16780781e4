package org.javai.twf.ast;

/**
 * The kinds of named things a call or await site can refer to.
 */
public enum SymbolKind {
	WORKFLOW("workflow"),
	ACTIVITY("activity"),
	SIGNAL("signal"),
	QUERY("query"),
	UPDATE("update");

	private final String keyword;

	SymbolKind(String keyword) {
		this.keyword = keyword;
	}

	/**
	 * The source keyword introducing a symbol of this kind.
	 */
	public String keyword() {
		return keyword;
	}
}
