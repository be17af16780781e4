package org.javai.twf.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.twf.ast.ActivityDef;
import org.javai.twf.ast.AwaitOneCase;
import org.javai.twf.ast.AwaitTarget;
import org.javai.twf.ast.CloseReason;
import org.javai.twf.ast.ForVariant;
import org.javai.twf.ast.Statement;
import org.javai.twf.ast.TwfFile;
import org.javai.twf.ast.WorkflowCallMode;
import org.javai.twf.ast.WorkflowDef;
import org.javai.twf.lexer.TwfTokenizer;
import org.javai.twf.testsupport.Fixtures;
import org.javai.twf.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the TWF parser. Sources are tokenized with {@link TwfTokenizer} first.
 */
class TwfParserTest {

	private static TwfFile parse(String source) {
		return TwfParser.parse(new TwfTokenizer(source).tokenize());
	}

	private static ParseResult parseAll(String source) {
		return TwfParser.parseAll(new TwfTokenizer(source).tokenize());
	}

	private static WorkflowDef workflow(String source) {
		return (WorkflowDef) parse(source).definitions().get(0);
	}

	private static List<Statement> body(String source) {
		return workflow(source).body();
	}

	@Test
	void emptySourceHasNoDefinitions() {
		assertThat(parse("").definitions()).isEmpty();
		assertThat(parse("# only a comment\n\n").definitions()).isEmpty();
	}

	@Test
	void parsesCompleteFixture() {
		TwfFile file = parse(Fixtures.read("order_fulfillment.twf"));

		assertThat(file.definitions()).hasSize(12);
		assertThat(file.workflows()).extracting(WorkflowDef::name)
				.containsExactly("OrderFulfillment", "NotifyWarehouse", "ShipOrder");
		assertThat(file.activity("PackItem")).isPresent();
	}

	@Test
	void parsingIsRepeatable() {
		String source = Fixtures.read("order_fulfillment.twf");

		assertThat(parse(source)).isEqualTo(parse(source));
		assertThat(parseAll(source).file()).isEqualTo(parse(source));
	}

	@Test
	void statementAtTopLevelIsAnError() {
		assertThatThrownBy(() -> parse("x = 1\n"))
				.isInstanceOf(TwfParseException.class)
				.hasMessageContaining("at top level");
	}

	@Nested
	@DisplayName("Definitions")
	class Definitions {

		@Test
		void parsesWorkflowHeaderAndOptions() {
			WorkflowDef workflow = workflow("""
					workflow Foo(x: int) -> (Result):
					    options(task_queue: "q")
					    return x
					""");

			assertThat(workflow.name()).isEqualTo("Foo");
			assertThat(workflow.params()).isEqualTo("x: int");
			assertThat(workflow.returnType()).isEqualTo("Result");
			assertThat(workflow.options()).isEqualTo("task_queue: \"q\"");
			assertThat(workflow.body()).singleElement().isInstanceOf(Statement.Return.class);
			assertThat(workflow.position().line()).isEqualTo(1);
			assertThat(workflow.position().column()).isEqualTo(1);
		}

		@Test
		void parsesActivityWithBareReturnType() {
			ActivityDef activity = (ActivityDef) parse("activity Double(x: int) -> int:\n    return x * 2\n")
					.definitions().get(0);

			assertThat(activity.returnType()).isEqualTo("int");
			assertThat(activity.options()).isNull();
			assertThat(((Statement.Return) activity.body().get(0)).value()).isEqualTo("x * 2");
		}

		@Test
		void definitionWithoutReturnTypeHasNullReturnType() {
			WorkflowDef workflow = workflow("workflow W():\n    x = 1\n");

			assertThat(workflow.params()).isEmpty();
			assertThat(workflow.returnType()).isNull();
		}

		@Test
		void definitionRequiresIndentedBody() {
			assertThatThrownBy(() -> parse("workflow W():\nactivity A():\n    x = 1\n"))
					.isInstanceOf(TwfParseException.class)
					.hasMessageContaining("expected an indented block after workflow W");
		}

		@Test
		void parsesHandlerDeclarations() {
			WorkflowDef workflow = workflow("""
					workflow W():
					    signal Go:
					    signal Stop(reason: string):
					        stopped = true
					    query Count() -> (int):
					        return count
					    update Bump(n: int) -> (int):
					        count = count + n
					        return count
					    await signal Go
					""");

			assertThat(workflow.signals()).extracting(s -> s.name()).containsExactly("Go", "Stop");
			assertThat(workflow.signals().get(0).params()).isEmpty();
			assertThat(workflow.signals().get(0).body()).isEmpty();
			assertThat(workflow.signals().get(1).body()).singleElement()
					.isEqualTo(new Statement.Raw(workflow.signals().get(1).body().get(0).position(), "stopped = true"));
			assertThat(workflow.queries()).singleElement().satisfies(q -> {
				assertThat(q.name()).isEqualTo("Count");
				assertThat(q.returnType()).isEqualTo("int");
			});
			assertThat(workflow.updates().get(0).body()).hasSize(2);
			assertThat(workflow.body()).singleElement().isInstanceOf(Statement.Await.class);
		}

		@Test
		void commentBeforeBodyStaysInBody() {
			WorkflowDef workflow = workflow("""
					workflow W():
					    signal Go():
					        x = 1
					    # main body
					    y = 2
					""");

			assertThat(workflow.body()).hasSize(2);
			assertThat(workflow.body().get(0)).isInstanceOf(Statement.Comment.class);
		}

		@Test
		void queryRequiresReturnType() {
			assertThatThrownBy(() -> parse("""
					workflow W():
					    query Q():
					        return 1
					    x = 1
					"""))
					.isInstanceOf(TwfParseException.class)
					.hasMessageContaining("query Q requires a return type");
		}

		@Test
		void updateRequiresReturnType() {
			assertThatThrownBy(() -> parse("""
					workflow W():
					    update U(x: int):
					        y = x
					    z = 1
					"""))
					.isInstanceOf(TwfParseException.class)
					.hasMessageContaining("update U requires a return type");
		}
	}

	@Nested
	@DisplayName("Context rules")
	class ContextRules {

		@Test
		void closeInSignalHandlerIsRejected() {
			assertThatThrownBy(() -> parse("""
					workflow W():
					    signal Stop():
					        close completed
					    x = 1
					"""))
					.isInstanceOf(TwfParseException.class)
					.hasMessageContaining("close is not allowed in signal handler")
					.isInstanceOfSatisfying(TwfParseException.class, e -> {
						assertThat(e.line()).isEqualTo(3);
						assertThat(e.column()).isEqualTo(9);
					});
		}

		@Test
		void closeInUpdateHandlerIsRejected() {
			assertThatThrownBy(() -> parse("""
					workflow W():
					    update U() -> (bool):
					        if (done):
					            close failed
					        return true
					    x = 1
					"""))
					.isInstanceOf(TwfParseException.class)
					.hasMessageContaining("close is not allowed in update handler");
		}

		@Test
		void closeInWorkflowMainBodyIsAccepted() {
			List<Statement> body = body("""
					workflow W():
					    signal Stop():
					        stopped = true
					    if (stopped):
					        close failed "stopped"
					    close completed
					""");

			Statement.If ifStmt = (Statement.If) body.get(0);
			Statement.Close failed = (Statement.Close) ifStmt.body().get(0);
			assertThat(failed.reason()).isEqualTo(CloseReason.FAILED);
			assertThat(failed.value()).isEqualTo("\"stopped\"");
			assertThat(((Statement.Close) body.get(1)).reason()).isEqualTo(CloseReason.COMPLETED);
		}

		@Test
		void temporalPrimitivesAreRejectedInActivities() {
			assertThatThrownBy(() -> parse("activity A():\n    await timer(1s)\n"))
					.isInstanceOf(TwfParseException.class)
					.hasMessage("await is not allowed in activity body");
			assertThatThrownBy(() -> parse("activity A():\n    if (x):\n        spawn workflow B()\n"))
					.hasMessage("spawn is not allowed in activity body");
			assertThatThrownBy(() -> parse("activity A():\n    activity B()\n"))
					.hasMessage("activity is not allowed in activity body");
			assertThatThrownBy(() -> parse("activity A():\n    continue_as_new(x)\n"))
					.hasMessage("continue_as_new is not allowed in activity body");
			assertThatThrownBy(() -> parse("activity A():\n    close completed\n"))
					.hasMessage("close is not allowed in activity body");
		}

		@Test
		void temporalPrimitivesAreRejectedInQueryHandlers() {
			assertThatThrownBy(() -> parse("""
					workflow W():
					    query Q() -> (int):
					        await timer(1s)
					        return 1
					    x = 1
					"""))
					.isInstanceOf(TwfParseException.class)
					.hasMessage("await is not allowed in query handler");
		}

		@Test
		void activitiesAllowControlFlowAndRawStatements() {
			ActivityDef activity = (ActivityDef) parse("""
					activity Sum(xs: list) -> (int):
					    total = 0
					    for (x in xs):
					        if (x > 0):
					            total = total + x
					        else:
					            continue
					    return total
					""").definitions().get(0);

			assertThat(activity.body()).hasSize(3);
			assertThat(activity.body().get(1)).isInstanceOf(Statement.For.class);
		}

		@Test
		void declarationsAfterBodyStatementsAreRejected() {
			assertThatThrownBy(() -> parse("""
					workflow W():
					    x = 1
					    signal S():
					        y = 2
					"""))
					.isInstanceOf(TwfParseException.class)
					.hasMessage("signal declarations must precede workflow body statements");
		}

		@Test
		void declarationsInsideHandlersAreRejected() {
			assertThatThrownBy(() -> parse("""
					workflow W():
					    signal S():
					        update U() -> (int):
					            return 1
					    x = 1
					"""))
					.isInstanceOf(TwfParseException.class)
					.hasMessage("update declarations are not allowed in signal handler");
		}

		@Test
		void bareTimerIsRejected() {
			assertThatThrownBy(() -> parse("workflow W():\n    timer(5s)\n"))
					.isInstanceOf(TwfParseException.class)
					.hasMessageContaining("timer must be awaited");
		}

		@Test
		void strayElseAndCaseAreRejected() {
			assertThatThrownBy(() -> parse("workflow W():\n    else:\n        x = 1\n"))
					.hasMessageContaining("'else' without a matching if or switch");
			assertThatThrownBy(() -> parse("workflow W():\n    case 1:\n        x = 1\n"))
					.hasMessageContaining("'case' outside of a switch block");
		}
	}

	@Nested
	@DisplayName("Calls")
	class Calls {

		@Test
		void parsesActivityCallWithOptions() {
			List<Statement> body = body("""
					workflow W():
					    activity Charge(order, amount) -> receipt
					        options(start_to_close_timeout: 30s)
					    x = 1
					""");

			Statement.ActivityCall call = (Statement.ActivityCall) body.get(0);
			assertThat(call.name()).isEqualTo("Charge");
			assertThat(call.args()).isEqualTo("order, amount");
			assertThat(call.result()).isEqualTo("receipt");
			assertThat(call.options()).isEqualTo("start_to_close_timeout: 30s");
			assertThat(call.target().isBound()).isFalse();
			assertThat(body.get(1)).isInstanceOf(Statement.Raw.class);
		}

		@Test
		void nestedParenthesesStayInArguments() {
			Statement.ActivityCall call = (Statement.ActivityCall) body(
					"workflow W():\n    activity Send(format(msg, (a + b)), \"x)\")\n").get(0);

			assertThat(call.args()).isEqualTo("format(msg, (a + b)), \"x)\"");
		}

		@Test
		void parsesWorkflowCallModes() {
			List<Statement> body = body("""
					workflow W():
					    workflow Child(a) -> r
					    spawn workflow Background(b)
					    detach nexus "billing" workflow Invoice(c)
					""");

			assertThat(body).hasSize(3).allMatch(Statement.WorkflowCall.class::isInstance);
			Statement.WorkflowCall child = (Statement.WorkflowCall) body.get(0);
			assertThat(child.mode()).isEqualTo(WorkflowCallMode.CHILD);
			assertThat(child.result()).isEqualTo("r");
			assertThat(((Statement.WorkflowCall) body.get(1)).mode()).isEqualTo(WorkflowCallMode.SPAWN);
			Statement.WorkflowCall detached = (Statement.WorkflowCall) body.get(2);
			assertThat(detached.mode()).isEqualTo(WorkflowCallMode.DETACH);
			assertThat(detached.namespace()).isEqualTo("billing");
			assertThat(detached.name()).isEqualTo("Invoice");
			assertThat(detached.result()).isNull();
		}

		@Test
		void detachedCallCannotBindResult() {
			assertThatThrownBy(() -> parse("workflow W():\n    detach workflow Fire(x) -> r\n"))
					.isInstanceOf(TwfParseException.class)
					.hasMessageContaining("detach workflow call cannot bind a result");
		}

		@Test
		void optionsMustFollowACall() {
			assertThatThrownBy(() -> parse("""
					workflow W():
					    x = 1
					    options(retry: 3)
					"""))
					.isInstanceOf(TwfParseException.class)
					.hasMessageContaining("options(...) must directly follow a call");
		}

		@Test
		void onlyOptionsMayBeIndentedUnderCall() {
			assertThatThrownBy(() -> parse("""
					workflow W():
					    activity A()
					        x = 1
					"""))
					.isInstanceOf(TwfParseException.class)
					.hasMessageContaining("only an options(...) line may be indented under activity A");
		}

		@Test
		void callTakesASingleOptionsLine() {
			assertThatThrownBy(() -> parse("""
					workflow W():
					    activity A()
					        options(a: 1)
					        options(b: 2)
					"""))
					.isInstanceOf(TwfParseException.class)
					.hasMessageContaining("single options(...) line");
		}
	}

	@Nested
	@DisplayName("Await")
	class Await {

		@Test
		void parsesSingleAwaits() {
			List<Statement> body = body("""
					workflow W():
					    await timer(5m)
					    await signal Approve -> (by, note)
					    await update SetLimit -> limit
					    await activity Fetch(id) -> data
					    await spawn workflow Sub(x) -> y
					""");

			assertThat(body).extracting(s -> ((Statement.Await) s).target().kind())
					.containsExactly("timer", "signal", "update", "activity", "workflow");
			AwaitTarget.Timer timer = (AwaitTarget.Timer) ((Statement.Await) body.get(0)).target();
			assertThat(timer.duration()).isEqualTo("5m");
			AwaitTarget.Signal signal = (AwaitTarget.Signal) ((Statement.Await) body.get(1)).target();
			assertThat(signal.name()).isEqualTo("Approve");
			assertThat(signal.params()).isEqualTo("(by, note)");
			AwaitTarget.Update update = (AwaitTarget.Update) ((Statement.Await) body.get(2)).target();
			assertThat(update.params()).isEqualTo("limit");
			AwaitTarget.Workflow sub = (AwaitTarget.Workflow) ((Statement.Await) body.get(4)).target();
			assertThat(sub.mode()).isEqualTo(WorkflowCallMode.SPAWN);
			assertThat(sub.result()).isEqualTo("y");
		}

		@Test
		void awaitAllCollectsItsBody() {
			Statement.AwaitAll awaitAll = (Statement.AwaitAll) body("""
					workflow W():
					    await all:
					        activity A()
					        workflow B()
					""").get(0);

			assertThat(awaitAll.body()).hasSize(2);
		}

		@Test
		void awaitOneWithoutCasesIsRejected() {
			assertThatThrownBy(() -> parse("""
					workflow W():
					    await one:
					    x = 1
					"""))
					.isInstanceOf(TwfParseException.class)
					.hasMessage("await one must have at least one case")
					.hasToString("parse error at 2:5: await one must have at least one case");
		}

		@Test
		void awaitOneWithSignalAndTimerCases() {
			Statement.AwaitOne awaitOne = (Statement.AwaitOne) body("""
					workflow W():
					    signal Approve():
					        approved = true
					    await one:
					        signal Approve:
					            activity Ship()
					        timer(24h):
					            close failed "timed out"
					""").get(0);

			assertThat(awaitOne.cases()).extracting(AwaitOneCase::kind).containsExactly("signal", "timer");
			assertThat(awaitOne.cases().get(0).body()).singleElement().isInstanceOf(Statement.ActivityCall.class);
			assertThat(awaitOne.cases().get(1).body()).singleElement().isInstanceOf(Statement.Close.class);
		}

		@Test
		void awaitOneCasesMayBeEmptyOrNestAwaitAll() {
			Statement.AwaitOne awaitOne = (Statement.AwaitOne) body("""
					workflow W():
					    await one:
					        timer(1h):
					        await all:
					            activity A()
					            activity B()
					        activity C() -> c:
					            x = c
					        update Resize -> size:
					        workflow Child(x):
					    done = true
					""").get(0);

			List<AwaitOneCase> cases = awaitOne.cases();
			assertThat(cases).extracting(AwaitOneCase::kind)
					.containsExactly("timer", "await_all", "activity", "update", "workflow");
			assertThat(cases.get(0).body()).isEmpty();
			assertThat(cases.get(1).target()).isNull();
			assertThat(cases.get(1).awaitAll().body()).hasSize(2);
			assertThat(cases.get(1).body()).isEmpty();
			assertThat(cases.get(2).body()).hasSize(1);
			assertThat(((AwaitTarget.Activity) cases.get(2).target()).result()).isEqualTo("c");
		}

		@Test
		void awaitOneCaseRequiresColon() {
			assertThatThrownBy(() -> parse("""
					workflow W():
					    await one:
					        signal Go
					"""))
					.isInstanceOf(TwfParseException.class)
					.hasMessageContaining("expected ':' after await one case");
		}

		@Test
		void awaitOneRejectsNonCaseStatement() {
			assertThatThrownBy(() -> parse("""
					workflow W():
					    await one:
					        x = 1
					"""))
					.isInstanceOf(TwfParseException.class)
					.hasMessageContaining("in await one case");
		}

		@Test
		void awaitNeedsATarget() {
			assertThatThrownBy(() -> parse("workflow W():\n    await x\n"))
					.isInstanceOf(TwfParseException.class)
					.hasMessageContaining("expected timer, signal, update, activity or workflow after 'await'");
		}
	}

	@Nested
	@DisplayName("Control flow")
	class ControlFlow {

		@Test
		void parsesIfElse() {
			Statement.If ifStmt = (Statement.If) body("""
					workflow W():
					    if (amount > 100):
					        activity Review(amount)
					    else:
					        approved = true
					""").get(0);

			assertThat(ifStmt.condition()).isEqualTo("amount > 100");
			assertThat(ifStmt.body()).hasSize(1);
			assertThat(ifStmt.elseBody()).hasSize(1);
		}

		@Test
		void ifWithoutElseHasNullElseBody() {
			Statement.If ifStmt = (Statement.If) body("workflow W():\n    if (x):\n        y = 1\n").get(0);

			assertThat(ifStmt.elseBody()).isNull();
		}

		@Test
		void distinguishesForVariants() {
			List<Statement> body = body("""
					workflow W():
					    for:
					        break
					    for (attempts < 3):
					        continue
					    for (item in items):
					        activity Process(item)
					""");

			Statement.For infinite = (Statement.For) body.get(0);
			Statement.For conditional = (Statement.For) body.get(1);
			Statement.For iteration = (Statement.For) body.get(2);
			assertThat(infinite.variant()).isEqualTo(ForVariant.INFINITE);
			assertThat(infinite.body()).singleElement().isInstanceOf(Statement.Break.class);
			assertThat(conditional.variant()).isEqualTo(ForVariant.CONDITIONAL);
			assertThat(conditional.condition()).isEqualTo("attempts < 3");
			assertThat(iteration.variant()).isEqualTo(ForVariant.ITERATION);
			assertThat(iteration.variable()).isEqualTo("item");
			assertThat(iteration.iterable()).isEqualTo("items");
		}

		@Test
		void forConditionContainingInsideWordIsConditional() {
			Statement.For loop = (Statement.For) body("workflow W():\n    for (index < inbox.size):\n        x = 1\n")
					.get(0);

			assertThat(loop.variant()).isEqualTo(ForVariant.CONDITIONAL);
		}

		@Test
		void parsesSwitchWithDefault() {
			Statement.Switch switchBlock = (Statement.Switch) body("""
					workflow W():
					    switch (method):
					        case "card":
					            activity ChargeCard()
					        case "invoice":
					            activity SendInvoice()
					        else:
					            manual = true
					""").get(0);

			assertThat(switchBlock.expr()).isEqualTo("method");
			assertThat(switchBlock.cases()).extracting(c -> c.value()).containsExactly("\"card\"", "\"invoice\"");
			assertThat(switchBlock.defaultBody()).hasSize(1);
		}

		@Test
		void switchWithoutCasesIsRejected() {
			assertThatThrownBy(() -> parse("""
					workflow W():
					    switch (x):
					    y = 1
					"""))
					.isInstanceOf(TwfParseException.class)
					.hasMessage("switch must have at least one case");
		}

		@Test
		void switchWithOnlyElseIsRejected() {
			assertThatThrownBy(() -> parse("""
					workflow W():
					    switch (x):
					        else:
					            y = 1
					"""))
					.isInstanceOf(TwfParseException.class)
					.hasMessage("switch must have at least one case");
		}

		@Test
		void caseAfterElseIsRejected() {
			assertThatThrownBy(() -> parse("""
					workflow W():
					    switch (x):
					        case 1:
					            y = 1
					        else:
					            y = 0
					        case 2:
					            y = 2
					"""))
					.isInstanceOf(TwfParseException.class)
					.hasMessageContaining("case after the else arm");
		}

		@Test
		void parsesTerminators() {
			List<Statement> body = body("""
					workflow W():
					    return
					    close
					    close completed result
					    continue_as_new(cursor, count)
					""");

			assertThat(((Statement.Return) body.get(0)).value()).isNull();
			Statement.Close bare = (Statement.Close) body.get(1);
			assertThat(bare.reason()).isEqualTo(CloseReason.NONE);
			assertThat(bare.value()).isNull();
			assertThat(((Statement.Close) body.get(2)).value()).isEqualTo("result");
			assertThat(((Statement.ContinueAsNew) body.get(3)).args()).isEqualTo("cursor, count");
		}

		@Test
		void breakTakesNoArguments() {
			assertThatThrownBy(() -> parse("workflow W():\n    for:\n        break now\n"))
					.isInstanceOf(TwfParseException.class)
					.hasMessageContaining("after break");
		}
	}

	@Nested
	@DisplayName("Raw statements and comments")
	class RawAndComments {

		@Test
		void rawStatementKeepsSourceSpacing() {
			List<Statement> body = body("""
					workflow W():
					    total = price * qty
					    result = compute(a, b).value
					    items.append("x")
					""");

			assertThat(body).extracting(s -> ((Statement.Raw) s).text())
					.containsExactly("total = price * qty", "result = compute(a, b).value", "items.append(\"x\")");
		}

		@Test
		void commentsBecomeStatements() {
			List<Statement> body = body("""
					workflow W():
					    # first step
					    activity A()  # runs first
					    x = 1 # trailing
					""");

			assertThat(body).hasSize(5);
			assertThat(body.get(0)).isEqualTo(new Statement.Comment(body.get(0).position(), " first step"));
			assertThat(body.get(1)).isInstanceOf(Statement.ActivityCall.class);
			assertThat(((Statement.Comment) body.get(2)).text()).isEqualTo(" runs first");
			assertThat(((Statement.Raw) body.get(3)).text()).isEqualTo("x = 1");
			assertThat(((Statement.Comment) body.get(4)).text()).isEqualTo(" trailing");
		}

		@Test
		void commentBeforeDedentGoesWithFollowingStatement() {
			List<Statement> body = body("""
					workflow W():
					    if (ready):
					        go = true
					    # after the if
					    done = true
					""");

			assertThat(((Statement.If) body.get(0)).body()).hasSize(1);
			assertThat(body.get(1)).isInstanceOf(Statement.Comment.class);
		}

		@Test
		void commentOnBlockHeaderIsDropped() {
			Statement.If ifStmt = (Statement.If) body("""
					workflow W():
					    if (ready):  # check readiness
					        go = true
					""").get(0);

			assertThat(ifStmt.body()).singleElement().isInstanceOf(Statement.Raw.class);
		}

		@Test
		void commentClosingIfBodyDoesNotDetachElse() {
			Statement.If ifStmt = (Statement.If) body("""
					workflow W():
					    if (x):
					        a = 1
					        # note about a
					    else:
					        b = 2
					""").get(0);

			assertThat(ifStmt.body()).hasSize(2);
			assertThat(((Statement.Comment) ifStmt.body().get(1)).text()).isEqualTo(" note about a");
			assertThat(ifStmt.elseBody()).singleElement()
					.isInstanceOfSatisfying(Statement.Raw.class, raw -> assertThat(raw.text()).isEqualTo("b = 2"));
		}

		@Test
		void commentBeforeElseStartsElseBody() {
			Statement.If ifStmt = (Statement.If) body("""
					workflow W():
					    if (x):
					        a = 1
					    # otherwise
					    else:
					        b = 2
					""").get(0);

			assertThat(ifStmt.body()).hasSize(1);
			assertThat(ifStmt.elseBody()).hasSize(2);
			assertThat(((Statement.Comment) ifStmt.elseBody().get(0)).text()).isEqualTo(" otherwise");
		}

		@Test
		void commentBetweenCallAndOptionsLineFollowsCall() {
			List<Statement> body = body("""
					workflow W():
					    activity A()
					        # retry policy
					        options(retry: 3)
					    x = 1
					""");

			assertThat(body).hasSize(3);
			assertThat(((Statement.ActivityCall) body.get(0)).options()).isEqualTo("retry: 3");
			assertThat(((Statement.Comment) body.get(1)).text()).isEqualTo(" retry policy");
			assertThat(((Statement.Raw) body.get(2)).text()).isEqualTo("x = 1");
		}

		@Test
		void commentAfterCallOptionsLineFollowsCall() {
			List<Statement> body = body("""
					workflow W():
					    workflow Child()
					        options(task_queue: "q")
					        # queue is shared
					    x = 1
					""");

			assertThat(body).hasSize(3);
			assertThat(((Statement.WorkflowCall) body.get(0)).options()).isEqualTo("task_queue: \"q\"");
			assertThat(body.get(1)).isInstanceOf(Statement.Comment.class);
		}

		@Test
		void commentBeforeDefinitionOptionsStartsBody() {
			WorkflowDef workflow = workflow("""
					workflow W():
					    # defaults for every run
					    options(execution_timeout: 1h)
					    x = 1
					""");

			assertThat(workflow.options()).isEqualTo("execution_timeout: 1h");
			assertThat(workflow.body()).hasSize(2);
			assertThat(((Statement.Comment) workflow.body().get(0)).text()).isEqualTo(" defaults for every run");
		}

		@Test
		void commentBeforeHandlerDeclarationStartsHandlerBody() {
			WorkflowDef workflow = workflow("""
					workflow W():
					    # handles approval
					    signal Approve():
					        approved = true
					    x = 1
					""");

			assertThat(workflow.signals().get(0).body()).hasSize(2);
			assertThat(((Statement.Comment) workflow.signals().get(0).body().get(0)).text())
					.isEqualTo(" handles approval");
			assertThat(workflow.body()).singleElement().isInstanceOf(Statement.Raw.class);
		}
	}

	@Nested
	@DisplayName("Error collection")
	class ErrorCollection {

		@Test
		void failFastThrowsOnBrokenDefinition() {
			String source = Fixtures.read("one_broken_definition.twf");

			assertThatThrownBy(() -> parse(source))
					.isInstanceOf(TwfParseException.class)
					.hasMessage("await one must have at least one case");
		}

		@Test
		void collectAllKeepsValidDefinitionAfterBrokenOne() {
			ParseResult result = parseAll(Fixtures.read("one_broken_definition.twf"));

			assertThat(result.errors()).hasSize(1);
			assertThat(result.hasErrors()).isTrue();
			assertThat(result.file().definitions()).singleElement()
					.satisfies(d -> assertThat(d.name()).isEqualTo("Valid"));
		}

		@Test
		void collectAllReportsEveryBrokenDefinition() {
			ParseResult result = parseAll("""
					workflow A():
					    detach workflow X() -> r
					activity B():
					    await timer(1s)
					workflow C():
					    x = 1
					activity D:
					    y = 1
					""");

			assertThat(result.errors()).extracting(TwfParseException::line).containsExactly(2, 4, 7);
			assertThat(result.file().definitions()).singleElement()
					.satisfies(d -> assertThat(d.name()).isEqualTo("C"));
		}

		@Test
		void collectAllOnValidInputHasNoErrors() {
			ParseResult result = parseAll(Fixtures.read("order_fulfillment.twf"));

			assertThat(result.hasErrors()).isFalse();
			assertThat(result.file().definitions()).hasSize(12);
		}

		@Test
		void recoveryIsLogged() {
			try (LogCaptorAppender appender = LogCaptorAppender.create(TwfParser.class, Level.WARN)) {
				parseAll(Fixtures.read("one_broken_definition.twf"));

				assertThat(appender.messages(Level.WARN))
						.singleElement()
						.satisfies(msg -> assertThat(msg).startsWith("Recovered from parse error at 2:5"));
			}
		}
	}
}
