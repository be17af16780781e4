package org.javai.twf.resolver;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.javai.twf.ast.ActivityDef;
import org.javai.twf.ast.AwaitOneCase;
import org.javai.twf.ast.AwaitTarget;
import org.javai.twf.ast.AwaitTargetVisitor;
import org.javai.twf.ast.Definition;
import org.javai.twf.ast.DefinitionVisitor;
import org.javai.twf.ast.HandlerDecl;
import org.javai.twf.ast.Link;
import org.javai.twf.ast.Position;
import org.javai.twf.ast.QueryDecl;
import org.javai.twf.ast.SignalDecl;
import org.javai.twf.ast.Statement;
import org.javai.twf.ast.StatementVisitor;
import org.javai.twf.ast.StatementWalker;
import org.javai.twf.ast.Symbol;
import org.javai.twf.ast.TwfFile;
import org.javai.twf.ast.UpdateDecl;
import org.javai.twf.ast.WorkflowDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Links call and await sites to the definitions and declarations they name.
 * <p>
 * The first pass collects workflow and activity definitions across the whole file. The
 * second pass visits each workflow with maps of its own signal, query and update
 * declarations, walking the handler bodies and then the main body. Links are bound in
 * place. Every problem is collected; resolution never stops early.
 * <p>
 * When a name is defined twice, the first definition wins and the duplicate is reported.
 */
public class TwfResolver {

	private static final Logger logger = LoggerFactory.getLogger(TwfResolver.class);

	/**
	 * Resolves every reference in the file.
	 *
	 * @param file a parsed file; its links are bound as a side effect
	 * @return every resolution error, in source order per pass
	 */
	public List<ResolveError> resolve(TwfFile file) {
		List<ResolveError> errors = new ArrayList<>();
		Map<String, WorkflowDef> workflows = new HashMap<>();
		Map<String, ActivityDef> activities = new HashMap<>();

		for (Definition definition : file.definitions()) {
			definition.accept(new DefinitionVisitor<Void>() {
				@Override
				public Void visitWorkflow(WorkflowDef workflow) {
					register(workflows, workflow, errors);
					return null;
				}

				@Override
				public Void visitActivity(ActivityDef activity) {
					register(activities, activity, errors);
					return null;
				}
			});
		}

		// activity bodies cannot contain call sites
		for (WorkflowDef workflow : file.workflows()) {
			Map<String, SignalDecl> signals = new HashMap<>();
			Map<String, UpdateDecl> updates = new HashMap<>();
			Map<String, QueryDecl> queries = new HashMap<>();
			workflow.signals().forEach(s -> register(signals, s, errors));
			workflow.queries().forEach(q -> register(queries, q, errors));
			workflow.updates().forEach(u -> register(updates, u, errors));

			Linker linker = new Linker(workflows, activities, signals, updates, errors);
			StatementWalker.walk(workflow, statement -> statement.accept(linker));
		}

		logger.debug("Resolved {} definitions with {} errors", file.definitions().size(), errors.size());
		return errors;
	}

	private static <T extends Symbol> void register(Map<String, T> symbols, T symbol, List<ResolveError> errors) {
		if (symbols.putIfAbsent(symbol.name(), symbol) != null) {
			String what = symbol instanceof HandlerDecl ? "declaration" : "definition";
			errors.add(new ResolveError("duplicate " + symbol.symbolKind().keyword() + " " + what + ": "
					+ symbol.name(), symbol.position()));
		}
	}

	/**
	 * Binds the references of one statement. The walker takes care of descending into
	 * nested bodies; only await-one case targets are handled here, since cases are not
	 * statements themselves.
	 */
	private static final class Linker implements StatementVisitor<Void> {

		private final Map<String, WorkflowDef> workflows;
		private final Map<String, ActivityDef> activities;
		private final Map<String, SignalDecl> signals;
		private final Map<String, UpdateDecl> updates;
		private final List<ResolveError> errors;

		private Linker(Map<String, WorkflowDef> workflows, Map<String, ActivityDef> activities,
				Map<String, SignalDecl> signals, Map<String, UpdateDecl> updates, List<ResolveError> errors) {
			this.workflows = workflows;
			this.activities = activities;
			this.signals = signals;
			this.updates = updates;
			this.errors = errors;
		}

		private <T extends Symbol> void link(Link<T> link, Map<String, T> symbols, String kind, String name,
				Position position) {
			T symbol = symbols.get(name);
			if (symbol == null) {
				errors.add(new ResolveError("undefined " + kind + ": " + name, position));
				return;
			}
			link.bind(symbol);
		}

		private void linkTarget(AwaitTarget target, Position position) {
			target.accept(new AwaitTargetVisitor<Void>() {
				@Override
				public Void visitTimer(AwaitTarget.Timer timer) {
					return null;
				}

				@Override
				public Void visitSignal(AwaitTarget.Signal signal) {
					link(signal.target(), signals, "signal", signal.name(), position);
					return null;
				}

				@Override
				public Void visitUpdate(AwaitTarget.Update update) {
					link(update.target(), updates, "update", update.name(), position);
					return null;
				}

				@Override
				public Void visitActivity(AwaitTarget.Activity activity) {
					link(activity.target(), activities, "activity", activity.name(), position);
					return null;
				}

				@Override
				public Void visitWorkflow(AwaitTarget.Workflow workflow) {
					link(workflow.target(), workflows, "workflow", workflow.name(), position);
					return null;
				}
			});
		}

		@Override
		public Void visitActivityCall(Statement.ActivityCall call) {
			link(call.target(), activities, "activity", call.name(), call.position());
			return null;
		}

		@Override
		public Void visitWorkflowCall(Statement.WorkflowCall call) {
			link(call.target(), workflows, "workflow", call.name(), call.position());
			return null;
		}

		@Override
		public Void visitAwait(Statement.Await await) {
			linkTarget(await.target(), await.position());
			return null;
		}

		@Override
		public Void visitAwaitOne(Statement.AwaitOne awaitOne) {
			for (AwaitOneCase awaitCase : awaitOne.cases()) {
				if (awaitCase.target() != null) {
					linkTarget(awaitCase.target(), awaitCase.position());
				}
			}
			return null;
		}

		@Override
		public Void visitAwaitAll(Statement.AwaitAll awaitAll) {
			return null;
		}

		@Override
		public Void visitSwitch(Statement.Switch switchBlock) {
			return null;
		}

		@Override
		public Void visitIf(Statement.If ifStmt) {
			return null;
		}

		@Override
		public Void visitFor(Statement.For forStmt) {
			return null;
		}

		@Override
		public Void visitClose(Statement.Close close) {
			return null;
		}

		@Override
		public Void visitReturn(Statement.Return returnStmt) {
			return null;
		}

		@Override
		public Void visitBreak(Statement.Break breakStmt) {
			return null;
		}

		@Override
		public Void visitContinue(Statement.Continue continueStmt) {
			return null;
		}

		@Override
		public Void visitContinueAsNew(Statement.ContinueAsNew continueAsNew) {
			return null;
		}

		@Override
		public Void visitRaw(Statement.Raw raw) {
			return null;
		}

		@Override
		public Void visitComment(Statement.Comment comment) {
			return null;
		}
	}
}
