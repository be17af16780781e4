package org.javai.twf.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.twf.ast.AwaitOneCase;
import org.javai.twf.ast.AwaitTarget;
import org.javai.twf.ast.AwaitTargetVisitor;
import org.javai.twf.ast.Definition;
import org.javai.twf.ast.Link;
import org.javai.twf.ast.Position;
import org.javai.twf.ast.Statement;
import org.javai.twf.ast.StatementWalker;
import org.javai.twf.ast.Symbol;
import org.javai.twf.ast.SymbolKind;
import org.javai.twf.ast.TwfFile;
import org.javai.twf.ast.WorkflowDef;

/**
 * Navigation over a resolved file: the symbols it defines and the sites that reference
 * them. Backs go-to-definition and find-references in editors.
 * <p>
 * The index is a snapshot; build a new one after re-parsing.
 */
public final class SymbolIndex {

	private final List<Symbol> symbols;
	private final List<ReferenceSite> sites;

	private SymbolIndex(List<Symbol> symbols, List<ReferenceSite> sites) {
		this.symbols = List.copyOf(symbols);
		this.sites = List.copyOf(sites);
	}

	public static SymbolIndex of(TwfFile file) {
		List<Symbol> symbols = new ArrayList<>();
		List<ReferenceSite> sites = new ArrayList<>();
		for (Definition definition : file.definitions()) {
			symbols.add(definition);
			if (definition instanceof WorkflowDef workflow) {
				symbols.addAll(workflow.signals());
				symbols.addAll(workflow.queries());
				symbols.addAll(workflow.updates());
			}
			StatementWalker.walk(definition, statement -> collect(statement, sites));
		}
		return new SymbolIndex(symbols, sites);
	}

	/**
	 * Every definition and handler declaration, in source order.
	 */
	public List<Symbol> symbols() {
		return symbols;
	}

	/**
	 * Every call and await site, in walk order.
	 */
	public List<ReferenceSite> referenceSites() {
		return sites;
	}

	/**
	 * The symbol referenced by the first resolved site starting on the given line.
	 */
	public Optional<Symbol> definitionAt(int line) {
		return sites.stream()
				.filter(site -> site.position().line() == line)
				.filter(ReferenceSite::isResolved)
				.map(ReferenceSite::resolved)
				.findFirst();
	}

	public List<ReferenceSite> referencesTo(Symbol symbol) {
		return sites.stream().filter(site -> site.resolved() == symbol).toList();
	}

	public List<ReferenceSite> unresolved() {
		return sites.stream().filter(site -> !site.isResolved()).toList();
	}

	private static void collect(Statement statement, List<ReferenceSite> sites) {
		if (statement instanceof Statement.ActivityCall call) {
			sites.add(site(SymbolKind.ACTIVITY, call.name(), call.position(), call.target()));
		} else if (statement instanceof Statement.WorkflowCall call) {
			sites.add(site(SymbolKind.WORKFLOW, call.name(), call.position(), call.target()));
		} else if (statement instanceof Statement.Await await) {
			siteOf(await.target(), await.position()).ifPresent(sites::add);
		} else if (statement instanceof Statement.AwaitOne awaitOne) {
			for (AwaitOneCase awaitCase : awaitOne.cases()) {
				if (awaitCase.target() != null) {
					siteOf(awaitCase.target(), awaitCase.position()).ifPresent(sites::add);
				}
			}
		}
	}

	private static Optional<ReferenceSite> siteOf(AwaitTarget target, Position position) {
		return target.accept(new AwaitTargetVisitor<Optional<ReferenceSite>>() {
			@Override
			public Optional<ReferenceSite> visitTimer(AwaitTarget.Timer timer) {
				return Optional.empty();
			}

			@Override
			public Optional<ReferenceSite> visitSignal(AwaitTarget.Signal signal) {
				return Optional.of(site(SymbolKind.SIGNAL, signal.name(), position, signal.target()));
			}

			@Override
			public Optional<ReferenceSite> visitUpdate(AwaitTarget.Update update) {
				return Optional.of(site(SymbolKind.UPDATE, update.name(), position, update.target()));
			}

			@Override
			public Optional<ReferenceSite> visitActivity(AwaitTarget.Activity activity) {
				return Optional.of(site(SymbolKind.ACTIVITY, activity.name(), position, activity.target()));
			}

			@Override
			public Optional<ReferenceSite> visitWorkflow(AwaitTarget.Workflow workflow) {
				return Optional.of(site(SymbolKind.WORKFLOW, workflow.name(), position, workflow.target()));
			}
		});
	}

	private static ReferenceSite site(SymbolKind kind, String name, Position position, Link<? extends Symbol> link) {
		return new ReferenceSite(kind, name, position, link.target().orElse(null));
	}
}
