package org.javai.twf.index;

import java.util.Optional;
import org.javai.twf.ast.Position;
import org.javai.twf.ast.Symbol;
import org.javai.twf.ast.SymbolKind;

/**
 * A call or await site naming a symbol.
 *
 * @param kind the kind of symbol the site refers to
 * @param name the referenced name as written
 * @param position where the site starts
 * @param resolved the symbol the site was linked to, or null when unresolved
 */
public record ReferenceSite(SymbolKind kind, String name, Position position, Symbol resolved) {

	public Optional<Symbol> target() {
		return Optional.ofNullable(resolved);
	}

	public boolean isResolved() {
		return resolved != null;
	}
}
