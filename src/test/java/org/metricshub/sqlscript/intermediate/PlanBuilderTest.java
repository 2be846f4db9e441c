package org.metricshub.sqlscript.intermediate;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.metricshub.sqlscript.frontend.ScriptTrees.begin;
import static org.metricshub.sqlscript.frontend.ScriptTrees.block;
import static org.metricshub.sqlscript.frontend.ScriptTrees.exitHandler;
import static org.metricshub.sqlscript.frontend.ScriptTrees.forLoop;
import static org.metricshub.sqlscript.frontend.ScriptTrees.ifThen;
import static org.metricshub.sqlscript.frontend.ScriptTrees.iterate;
import static org.metricshub.sqlscript.frontend.ScriptTrees.leave;
import static org.metricshub.sqlscript.frontend.ScriptTrees.loop;
import static org.metricshub.sqlscript.frontend.ScriptTrees.repeat;
import static org.metricshub.sqlscript.frontend.ScriptTrees.simpleCase;
import static org.metricshub.sqlscript.frontend.ScriptTrees.sql;
import static org.metricshub.sqlscript.frontend.ScriptTrees.whileLoop;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.sqlscript.ScriptErrors;
import org.metricshub.sqlscript.SqlScriptException;
import org.metricshub.sqlscript.frontend.CompoundBody;

public class PlanBuilderTest {

	private static CompiledScript compile(CompoundBody tree) {
		return new PlanBuilder().compile(tree);
	}

	private static SqlScriptException compileError(CompoundBody tree) {
		try {
			compile(tree);
		} catch (SqlScriptException e) {
			return e;
		}
		fail("Compilation should have failed");
		return null;
	}

	@Test
	public void indexesAreDepthFirst() {
		CompiledScript script = compile(begin(sql("SELECT 1"), whileLoop("lbl", "i < 3", sql("SELECT i"))));
		assertEquals(6, script.size());

		StatementNode root = script.root();
		assertEquals(NodeKind.BLOCK, root.getKind());
		assertArrayEquals(new int[] { 1, 2 }, root.getChildren());

		assertEquals(NodeKind.LEAF, script.node(1).getKind());
		assertFalse(script.node(1).isGuard());

		StatementNode loop = script.node(2);
		assertEquals(NodeKind.PRETEST_LOOP, loop.getKind());
		assertEquals("lbl", loop.getLabel());
		assertEquals(3, loop.getGuard());
		assertEquals(4, loop.getBody());

		assertTrue(script.node(3).isGuard());
		assertEquals("i < 3", script.node(3).getStatement().getText());
		assertEquals(NodeKind.BLOCK, script.node(4).getKind());
		assertArrayEquals(new int[] { 5 }, script.node(4).getChildren());
		assertEquals("SELECT i", script.node(5).getStatement().getText());
	}

	@Test
	public void repeatConditionFollowsBody() {
		CompiledScript script = compile(begin(repeat("x = 1", sql("SELECT 1"))));
		StatementNode loop = script.node(1);
		assertEquals(NodeKind.POSTTEST_LOOP, loop.getKind());
		assertEquals(2, loop.getBody());
		assertEquals(4, loop.getGuard());
		assertTrue(script.node(4).isGuard());
	}

	@Test
	public void ifBranches() {
		CompiledScript script = compile(begin(ifThen("a", sql("SELECT 1"))
				.elseIf("b", sql("SELECT 2"))
				.orElse(sql("SELECT 3"))
				.build()));
		StatementNode conditional = script.node(1);
		assertEquals(NodeKind.SEARCHED_CONDITIONAL, conditional.getKind());
		assertEquals(2, conditional.getBranchCount());
		assertEquals(2, conditional.getGuard(0));
		assertEquals(3, conditional.getGuard(1));
		assertEquals(4, conditional.getBody(0));
		assertEquals(6, conditional.getBody(1));
		assertEquals(8, conditional.getElseBody());
		assertEquals("SELECT 3", script.node(9).getStatement().getText());
	}

	@Test
	public void simpleCaseWithoutElse() {
		CompiledScript script = compile(begin(simpleCase("x").when("1", sql("SELECT 1")).build()));
		StatementNode conditional = script.node(1);
		assertEquals(NodeKind.SIMPLE_CONDITIONAL, conditional.getKind());
		assertEquals(2, conditional.getGuard());
		assertEquals(3, conditional.getGuard(0));
		assertEquals(4, conditional.getBody(0));
		assertEquals(-1, conditional.getElseBody());
	}

	@Test
	public void forLoopKeepsVariable() {
		CompiledScript script = compile(begin(forLoop("Row", "SELECT * FROM t", sql("SELECT 1"))));
		StatementNode loop = script.node(1);
		assertEquals(NodeKind.CURSOR_LOOP, loop.getKind());
		assertEquals("Row", loop.getVariableName());
		assertEquals("SELECT * FROM t", script.node(loop.getGuard()).getStatement().getText());
		assertNull(loop.getLabel());
	}

	@Test
	public void leaveTargetsEnclosingStatement() {
		CompiledScript script = compile(begin("Outer", loop("inner", leave("OUTER"), iterate("inner"))));
		assertEquals("outer", script.root().getLabel());
		StatementNode leave = script.node(3);
		assertEquals(NodeKind.LEAVE, leave.getKind());
		assertEquals(0, leave.getTarget());
		assertEquals("outer", leave.getTargetLabel());
		StatementNode iterate = script.node(4);
		assertEquals(NodeKind.ITERATE, iterate.getKind());
		assertEquals(1, iterate.getTarget());
	}

	@Test
	public void nestedLabelShadowsOuterOne() {
		CompiledScript script = compile(begin("lbl", begin("lbl", leave("lbl"))));
		assertEquals(1, script.node(2).getTarget());
	}

	@Test
	public void siblingLabelsMustDiffer() {
		SqlScriptException e = compileError(begin(
				whileLoop("lbl", "1 = 1", sql("SELECT 1")),
				whileLoop("LBL", "1 = 1", sql("SELECT 2"))));
		assertEquals(ScriptErrors.LABEL_ALREADY_EXISTS, e.getCondition());
		assertEquals("LBL", e.getParameters().get("label"));
	}

	@Test
	public void labelOutOfScope() {
		SqlScriptException e = compileError(begin(begin("lbl", sql("SELECT 1")), leave("lbl")));
		assertEquals(ScriptErrors.LABEL_DOES_NOT_EXIST, e.getCondition());
		assertEquals("LBL", e.getParameters().get("labelName"));
		assertEquals("LEAVE", e.getParameters().get("statementType"));
	}

	@Test
	public void iterateBlockFails() {
		SqlScriptException e = compileError(begin("lbl", iterate("lbl")));
		assertEquals(ScriptErrors.ITERATE_IN_COMPOUND, e.getCondition());
	}

	@Test
	public void handlersAreRegisteredOnTheirBlock() {
		CompiledScript script = compile(begin(block()
				.label("b")
				.handler(exitHandler(begin(sql("SELECT 'h'"), leave("b")), "SQLEXCEPTION", "SQLSTATE VALUE '22012'"))
				.statements(sql("SELECT 1"))
				.build()));
		StatementNode declaring = script.node(1);
		assertEquals(2, declaring.getHandlers().getEntries().size());
		for (HandlerEntry entry : declaring.getHandlers().getEntries()) {
			assertEquals(1, entry.getBlockIndex());
			assertEquals(NodeKind.BLOCK, script.node(entry.getBodyIndex()).getKind());
		}
		assertTrue(script.root().getHandlers().isEmpty());
	}

	@Test(expected = IllegalStateException.class)
	public void builderIsSingleUse() {
		PlanBuilder builder = new PlanBuilder();
		builder.compile(begin());
		builder.compile(begin());
	}

	@Test
	public void dumpListsEveryNode() {
		CompiledScript script = compile(begin(whileLoop("i < 3", sql("SELECT i"))));
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		script.dump(new PrintStream(out, true));
		String dump = new String(out.toByteArray(), StandardCharsets.UTF_8);
		assertEquals(script.size(), dump.split("\\R").length);
		assertTrue(dump.contains("2 : LEAF ? i < 3"));
	}
}
