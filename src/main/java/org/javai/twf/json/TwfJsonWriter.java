package org.javai.twf.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.javai.twf.AnalysisResult;
import org.javai.twf.Diagnostic;
import org.javai.twf.ast.ActivityDef;
import org.javai.twf.ast.AwaitOneCase;
import org.javai.twf.ast.AwaitTarget;
import org.javai.twf.ast.AwaitTargetVisitor;
import org.javai.twf.ast.Definition;
import org.javai.twf.ast.DefinitionVisitor;
import org.javai.twf.ast.Position;
import org.javai.twf.ast.QueryDecl;
import org.javai.twf.ast.SignalDecl;
import org.javai.twf.ast.Statement;
import org.javai.twf.ast.StatementVisitor;
import org.javai.twf.ast.SwitchCase;
import org.javai.twf.ast.TwfFile;
import org.javai.twf.ast.UpdateDecl;
import org.javai.twf.ast.WorkflowDef;

/**
 * Converts a TWF AST into the JSON tree consumed by editors and the visualizer.
 * <p>
 * Every definition, declaration and statement is an object with a {@code type}
 * discriminant and its {@code line} and {@code column}. Optional fields that are absent
 * are omitted. Resolved references are written as names only.
 */
public final class TwfJsonWriter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private TwfJsonWriter() {
	}

	public static ObjectNode toJsonTree(TwfFile file) {
		ObjectNode node = mapper.createObjectNode();
		ArrayNode definitions = node.putArray("definitions");
		for (Definition definition : file.definitions()) {
			definitions.add(definitionNode(definition));
		}
		return node;
	}

	/**
	 * The AST of an analysis plus its diagnostics. {@code definitions} is empty when no
	 * AST was produced.
	 */
	public static ObjectNode toJsonTree(AnalysisResult result) {
		ObjectNode node = result.file() != null ? toJsonTree(result.file()) : mapper.createObjectNode();
		if (!node.has("definitions")) {
			node.putArray("definitions");
		}
		ArrayNode errors = node.putArray("errors");
		for (Diagnostic diagnostic : result.diagnostics()) {
			ObjectNode error = errors.addObject();
			error.put("phase", diagnostic.phase().label());
			error.put("message", diagnostic.message());
			error.put("line", diagnostic.line());
			error.put("column", diagnostic.column());
		}
		return node;
	}

	public static String toJson(TwfFile file) {
		return write(toJsonTree(file));
	}

	public static String toJson(AnalysisResult result) {
		return write(toJsonTree(result));
	}

	private static String write(JsonNode node) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to write AST as JSON", e);
		}
	}

	private static ObjectNode definitionNode(Definition definition) {
		return definition.accept(new DefinitionVisitor<ObjectNode>() {
			@Override
			public ObjectNode visitWorkflow(WorkflowDef workflow) {
				ObjectNode node = node("workflowDef", workflow.position());
				node.put("name", workflow.name());
				node.put("params", workflow.params());
				putIfPresent(node, "returnType", workflow.returnType());
				putIfPresent(node, "options", workflow.options());
				ArrayNode signals = node.putArray("signals");
				for (SignalDecl signal : workflow.signals()) {
					ObjectNode decl = signals.addObject();
					decl.setAll(node("signalDecl", signal.position()));
					decl.put("name", signal.name());
					decl.put("params", signal.params());
					decl.set("body", statements(signal.body()));
				}
				ArrayNode queries = node.putArray("queries");
				for (QueryDecl query : workflow.queries()) {
					ObjectNode decl = queries.addObject();
					decl.setAll(node("queryDecl", query.position()));
					decl.put("name", query.name());
					decl.put("params", query.params());
					putIfPresent(decl, "returnType", query.returnType());
					decl.set("body", statements(query.body()));
				}
				ArrayNode updates = node.putArray("updates");
				for (UpdateDecl update : workflow.updates()) {
					ObjectNode decl = updates.addObject();
					decl.setAll(node("updateDecl", update.position()));
					decl.put("name", update.name());
					decl.put("params", update.params());
					putIfPresent(decl, "returnType", update.returnType());
					decl.set("body", statements(update.body()));
				}
				node.set("body", statements(workflow.body()));
				return node;
			}

			@Override
			public ObjectNode visitActivity(ActivityDef activity) {
				ObjectNode node = node("activityDef", activity.position());
				node.put("name", activity.name());
				node.put("params", activity.params());
				putIfPresent(node, "returnType", activity.returnType());
				putIfPresent(node, "options", activity.options());
				node.set("body", statements(activity.body()));
				return node;
			}
		});
	}

	private static ArrayNode statements(List<Statement> statements) {
		ArrayNode array = mapper.createArrayNode();
		StatementNodes writer = new StatementNodes();
		for (Statement statement : statements) {
			array.add(statement.accept(writer));
		}
		return array;
	}

	private static ObjectNode node(String type, Position position) {
		ObjectNode node = mapper.createObjectNode();
		node.put("type", type);
		node.put("line", position.line());
		node.put("column", position.column());
		return node;
	}

	private static void putIfPresent(ObjectNode node, String field, String value) {
		if (value != null && !value.isEmpty()) {
			node.put(field, value);
		}
	}

	/**
	 * Writes the fields of an await target onto an await statement or an await-one case,
	 * prefixed by the target kind ({@code signal}, {@code signalParams}, ...).
	 */
	private static void putTarget(ObjectNode node, AwaitTarget target) {
		target.accept(new AwaitTargetVisitor<Void>() {
			@Override
			public Void visitTimer(AwaitTarget.Timer timer) {
				node.put("timer", timer.duration());
				return null;
			}

			@Override
			public Void visitSignal(AwaitTarget.Signal signal) {
				node.put("signal", signal.name());
				putIfPresent(node, "signalParams", signal.params());
				return null;
			}

			@Override
			public Void visitUpdate(AwaitTarget.Update update) {
				node.put("update", update.name());
				putIfPresent(node, "updateParams", update.params());
				return null;
			}

			@Override
			public Void visitActivity(AwaitTarget.Activity activity) {
				node.put("activity", activity.name());
				node.put("activityArgs", activity.args());
				putIfPresent(node, "activityResult", activity.result());
				return null;
			}

			@Override
			public Void visitWorkflow(AwaitTarget.Workflow workflow) {
				node.put("workflow", workflow.name());
				node.put("workflowMode", workflow.mode().label());
				putIfPresent(node, "workflowNamespace", workflow.namespace());
				node.put("workflowArgs", workflow.args());
				putIfPresent(node, "workflowResult", workflow.result());
				return null;
			}
		});
	}

	private static final class StatementNodes implements StatementVisitor<ObjectNode> {

		@Override
		public ObjectNode visitActivityCall(Statement.ActivityCall call) {
			ObjectNode node = node("activityCall", call.position());
			node.put("name", call.name());
			node.put("args", call.args());
			putIfPresent(node, "result", call.result());
			putIfPresent(node, "options", call.options());
			return node;
		}

		@Override
		public ObjectNode visitWorkflowCall(Statement.WorkflowCall call) {
			ObjectNode node = node("workflowCall", call.position());
			node.put("mode", call.mode().label());
			putIfPresent(node, "namespace", call.namespace());
			node.put("name", call.name());
			node.put("args", call.args());
			putIfPresent(node, "result", call.result());
			putIfPresent(node, "options", call.options());
			return node;
		}

		@Override
		public ObjectNode visitAwait(Statement.Await await) {
			ObjectNode node = node("await", await.position());
			node.put("kind", await.target().kind());
			putTarget(node, await.target());
			return node;
		}

		@Override
		public ObjectNode visitAwaitAll(Statement.AwaitAll awaitAll) {
			ObjectNode node = node("awaitAll", awaitAll.position());
			node.set("body", statements(awaitAll.body()));
			return node;
		}

		@Override
		public ObjectNode visitAwaitOne(Statement.AwaitOne awaitOne) {
			ObjectNode node = node("awaitOne", awaitOne.position());
			ArrayNode cases = node.putArray("cases");
			for (AwaitOneCase awaitCase : awaitOne.cases()) {
				ObjectNode caseNode = cases.addObject();
				caseNode.put("kind", awaitCase.kind());
				caseNode.put("line", awaitCase.position().line());
				caseNode.put("column", awaitCase.position().column());
				if (awaitCase.target() != null) {
					putTarget(caseNode, awaitCase.target());
				} else {
					caseNode.set("awaitAll", visitAwaitAll(awaitCase.awaitAll()));
				}
				caseNode.set("body", statements(awaitCase.body()));
			}
			return node;
		}

		@Override
		public ObjectNode visitSwitch(Statement.Switch switchBlock) {
			ObjectNode node = node("switch", switchBlock.position());
			node.put("expr", switchBlock.expr());
			ArrayNode cases = node.putArray("cases");
			for (SwitchCase switchCase : switchBlock.cases()) {
				ObjectNode caseNode = cases.addObject();
				caseNode.put("value", switchCase.value());
				caseNode.put("line", switchCase.position().line());
				caseNode.put("column", switchCase.position().column());
				caseNode.set("body", statements(switchCase.body()));
			}
			if (switchBlock.defaultBody() != null) {
				node.set("default", statements(switchBlock.defaultBody()));
			}
			return node;
		}

		@Override
		public ObjectNode visitIf(Statement.If ifStmt) {
			ObjectNode node = node("if", ifStmt.position());
			node.put("condition", ifStmt.condition());
			node.set("body", statements(ifStmt.body()));
			if (ifStmt.elseBody() != null) {
				node.set("elseBody", statements(ifStmt.elseBody()));
			}
			return node;
		}

		@Override
		public ObjectNode visitFor(Statement.For forStmt) {
			ObjectNode node = node("for", forStmt.position());
			node.put("variant", forStmt.variant().label());
			putIfPresent(node, "condition", forStmt.condition());
			putIfPresent(node, "variable", forStmt.variable());
			putIfPresent(node, "iterable", forStmt.iterable());
			node.set("body", statements(forStmt.body()));
			return node;
		}

		@Override
		public ObjectNode visitClose(Statement.Close close) {
			ObjectNode node = node("close", close.position());
			putIfPresent(node, "reason", close.reason().label());
			putIfPresent(node, "value", close.value());
			return node;
		}

		@Override
		public ObjectNode visitReturn(Statement.Return returnStmt) {
			ObjectNode node = node("return", returnStmt.position());
			putIfPresent(node, "value", returnStmt.value());
			return node;
		}

		@Override
		public ObjectNode visitBreak(Statement.Break breakStmt) {
			return node("break", breakStmt.position());
		}

		@Override
		public ObjectNode visitContinue(Statement.Continue continueStmt) {
			return node("continue", continueStmt.position());
		}

		@Override
		public ObjectNode visitContinueAsNew(Statement.ContinueAsNew continueAsNew) {
			ObjectNode node = node("continueAsNew", continueAsNew.position());
			node.put("args", continueAsNew.args());
			return node;
		}

		@Override
		public ObjectNode visitRaw(Statement.Raw raw) {
			ObjectNode node = node("raw", raw.position());
			node.put("text", raw.text());
			return node;
		}

		@Override
		public ObjectNode visitComment(Statement.Comment comment) {
			ObjectNode node = node("comment", comment.position());
			node.put("text", comment.text());
			return node;
		}
	}
}
