package org.metricshub.sqlscript;

import static org.junit.Assert.assertEquals;
import static org.metricshub.sqlscript.ScriptTestSupport.scriptTest;
import static org.metricshub.sqlscript.frontend.ScriptTrees.begin;
import static org.metricshub.sqlscript.frontend.ScriptTrees.forLoop;
import static org.metricshub.sqlscript.frontend.ScriptTrees.ifThen;
import static org.metricshub.sqlscript.frontend.ScriptTrees.iterate;
import static org.metricshub.sqlscript.frontend.ScriptTrees.leave;
import static org.metricshub.sqlscript.frontend.ScriptTrees.loop;
import static org.metricshub.sqlscript.frontend.ScriptTrees.repeat;
import static org.metricshub.sqlscript.frontend.ScriptTrees.searchedCase;
import static org.metricshub.sqlscript.frontend.ScriptTrees.simpleCase;
import static org.metricshub.sqlscript.frontend.ScriptTrees.sql;
import static org.metricshub.sqlscript.frontend.ScriptTrees.whileLoop;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;
import org.metricshub.sqlscript.ScriptTestSupport.TestResult;
import org.metricshub.sqlscript.jrt.QueryResult;
import org.metricshub.sqlscript.jrt.QueryResult.Column;
import org.metricshub.sqlscript.jrt.SqlType;

/**
 * Runs scripts end to end: the tree is compiled, the statements are pulled
 * from the iterator and run by the {@link TestEvaluator}, and the rows of
 * each statement are compared with the expected ones.
 */
public class SqlScriptInterpreterTest {

	private static QueryResult.Builder numbers() {
		return QueryResult
				.withColumns(
						new Column("intCol", SqlType.INT),
						new Column("stringCol", SqlType.STRING),
						new Column("doubleCol", SqlType.DOUBLE));
	}

	private static QueryResult threeNumbers() {
		return numbers().row(1, "first", 1.0).row(2, "second", 2.0).row(3, "third", 3.0).build();
	}

	// Sequences and blocks

	@Test
	public void multiStatementSimple() {
		scriptTest("multi statement - simple")
				.script(begin(
						sql("CREATE TABLE t (a INT, b STRING, c DOUBLE)"),
						sql("INSERT INTO t VALUES (1, 'a', 1.0)"),
						sql("SELECT a, b FROM t WHERE a = 12"),
						sql("SELECT a FROM t")))
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectRow(1)
				.runAndAssert();
	}

	@Test
	public void emptyBeginEnd() {
		scriptTest("empty begin end block")
				.script(begin())
				.runAndAssert();
	}

	@Test
	public void emptyBeginEndBlocksNested() {
		scriptTest("empty begin end blocks - nested")
				.script(begin(
						begin(begin(begin()), begin()),
						begin(),
						sql("SELECT 1"),
						begin(begin())))
				.expectRow(1)
				.runAndAssert();
	}

	@Test
	public void sessionVariablesScoped() {
		scriptTest("variables - declared in nested scopes")
				.script(begin(
						sql("DECLARE x = 1"),
						sql("SELECT x"),
						begin(
								sql("DECLARE x = 2"),
								sql("SELECT x"),
								sql("SET x = x + 10"),
								sql("SELECT x")),
						sql("SELECT x")))
				.expectNoRows()
				.expectRow(1)
				.expectNoRows()
				.expectRow(2)
				.expectNoRows()
				.expectRow(12)
				.expectRow(1)
				.runAndAssert();
	}

	@Test
	public void variableOutOfScope() {
		scriptTest("variables - out of scope")
				.script(begin(
						begin(sql("DECLARE testVarA = 1")),
						sql("SELECT testVarA")))
				.expectError(TestEvaluator.UNRESOLVED_COLUMN)
				.expectParameter("objectName", "`testVarA`")
				.runAndAssert();
	}

	@Test
	public void argumentsAreVariables() {
		TestResult result = scriptTest("arguments")
				.script(begin(sql("SELECT first + second"), sql("SET first = 0"), sql("SELECT FIRST")))
				.argument("first", 40)
				.argument("second", 2)
				.expectRow(42)
				.expectNoRows()
				.expectRow(0)
				.runAndAssert();
		assertEquals(3, result.results().size());
	}

	// IF

	@Test
	public void ifTrue() {
		scriptTest("if")
				.script(begin(ifThen("1 = 1", sql("SELECT 42")).build()))
				.expectRow(42)
				.runAndAssert();
	}

	@Test
	public void ifEmptyBody() {
		scriptTest("if - empty body")
				.script(begin(ifThen("1 = 1").build()))
				.runAndAssert();
	}

	@Test
	public void ifNestedEmptyBody() {
		scriptTest("if - nested empty body")
				.script(begin(ifThen("1 = 1", begin(begin())).build()))
				.runAndAssert();
	}

	@Test
	public void ifNested() {
		scriptTest("if nested")
				.script(begin(ifThen("1 = 1", ifThen("2 = 1", sql("SELECT 41")).orElse(sql("SELECT 42")).build()).build()))
				.expectRow(42)
				.runAndAssert();
	}

	@Test
	public void ifElseGoingInIf() {
		scriptTest("if else going in if")
				.script(begin(ifThen("1 = 1", sql("SELECT 42")).orElse(sql("SELECT 43")).build()))
				.expectRow(42)
				.runAndAssert();
	}

	@Test
	public void ifElseIfGoingInElseIf() {
		scriptTest("if elseif going in elseif")
				.script(begin(ifThen("1 = 2", sql("SELECT 42"))
						.elseIf("1 = 1", sql("SELECT 43"))
						.orElse(sql("SELECT 44"))
						.build()))
				.expectRow(43)
				.runAndAssert();
	}

	@Test
	public void ifElseGoingInElse() {
		scriptTest("if else going in else")
				.script(begin(ifThen("1 = 2", sql("SELECT 42")).orElse(sql("SELECT 43")).build()))
				.expectRow(43)
				.runAndAssert();
	}

	@Test
	public void ifElseIfGoingInElse() {
		scriptTest("if elseif going in else")
				.script(begin(ifThen("1 = 2", sql("SELECT 42"))
						.elseIf("1 = 3", sql("SELECT 43"))
						.orElse(sql("SELECT 44"))
						.build()))
				.expectRow(44)
				.runAndAssert();
	}

	@Test
	public void ifWithTable() {
		scriptTest("if with table")
				.script(begin(
						sql("CREATE TABLE t (a INT, b STRING, c DOUBLE)"),
						sql("INSERT INTO t VALUES (1, 'a', 1.0)"),
						ifThen("(SELECT c FROM t WHERE a = 1) = 1.0", sql("SELECT 42")).build()))
				.expectNoRows()
				.expectNoRows()
				.expectRow(42)
				.runAndAssert();
	}

	@Test
	public void ifConditionMustBeBoolean() {
		scriptTest("if's condition must be a boolean statement")
				.script(begin(ifThen(sql("1", 3), sql("SELECT 45")).build()))
				.expectError(ScriptErrors.INVALID_BOOLEAN_STATEMENT)
				.expectSqlState("22546")
				.expectParameter("invalidStatement", "1")
				.expectLine(3)
				.runAndAssert();
	}

	// Searched CASE

	@Test
	public void searchedCaseFirstBranch() {
		scriptTest("searched case")
				.script(begin(searchedCase().when("1 = 1", sql("SELECT 42")).build()))
				.expectRow(42)
				.runAndAssert();
	}

	@Test
	public void searchedCaseSecondCase() {
		scriptTest("searched case second case")
				.script(begin(searchedCase()
						.when("1 = (SELECT 2)", sql("SELECT 1"))
						.when("2 = (SELECT 2)", sql("SELECT 42"))
						.when("3 = (SELECT 2)", sql("SELECT 43"))
						.build()))
				.expectRow(42)
				.runAndAssert();
	}

	@Test
	public void searchedCaseGoingInElse() {
		scriptTest("searched case going in else")
				.script(begin(searchedCase()
						.when("2 = 1", sql("SELECT 1"))
						.when("3 IS NULL", sql("SELECT 2"))
						.orElse(sql("SELECT 43"))
						.build()))
				.expectRow(43)
				.runAndAssert();
	}

	@Test
	public void searchedCaseNoMatchNoElse() {
		scriptTest("searched case no cases matched no else")
				.script(begin(searchedCase()
						.when("1 = 2", sql("SELECT 42"))
						.when("1 = 3", sql("SELECT 43"))
						.build()))
				.runAndAssert();
	}

	@Test
	public void searchedCaseNestedEmptyBody() {
		scriptTest("searched case - nested empty body")
				.script(begin(searchedCase().when("1 = 1", begin(begin())).orElse(begin()).build()))
				.runAndAssert();
	}

	@Test
	public void searchedCaseNonBooleanCondition() {
		scriptTest("searched case with non boolean condition - constant")
				.script(begin(searchedCase().when(sql("1", 3), sql("SELECT 42")).build()))
				.expectError(ScriptErrors.INVALID_BOOLEAN_STATEMENT)
				.expectParameter("invalidStatement", "1")
				.expectLine(3)
				.runAndAssert();
	}

	// Simple CASE

	@Test
	public void simpleCaseFirstBranch() {
		scriptTest("simple case")
				.script(begin(simpleCase("1").when("1", sql("SELECT 42")).build()))
				.expectRow(42)
				.runAndAssert();
	}

	@Test
	public void simpleCaseGoingInElse() {
		scriptTest("simple case going in else")
				.script(begin(simpleCase("1")
						.when("2", sql("SELECT 1"))
						.when("3", sql("SELECT 2"))
						.orElse(sql("SELECT 43"))
						.build()))
				.expectRow(43)
				.runAndAssert();
	}

	@Test
	public void simpleCaseSecondCase() {
		scriptTest("simple case second case")
				.script(begin(simpleCase("(SELECT 2)")
						.when("1", sql("SELECT 1"))
						.when("2", sql("SELECT 42"))
						.when("3", sql("SELECT 43"))
						.build()))
				.expectRow(42)
				.runAndAssert();
	}

	@Test
	public void simpleCaseNoMatchNoElse() {
		scriptTest("simple case no cases matched no else")
				.script(begin(simpleCase("1").when("2", sql("SELECT 42")).when("3", sql("SELECT 43")).build()))
				.runAndAssert();
	}

	@Test
	public void simpleCaseMismatchedTypesAnsi() {
		scriptTest("simple case mismatched types - ansi")
				.script(begin(simpleCase("1").when("'one'", sql("SELECT 42")).orElse(sql("SELECT 43")).build()))
				.expectError(ScriptErrors.CAST_INVALID_INPUT)
				.expectSqlState("22018")
				.expectParameter("expression", "'one'")
				.expectParameter("sourceType", "\"STRING\"")
				.expectParameter("targetType", "\"BIGINT\"")
				.runAndAssert();
	}

	@Test
	public void simpleCaseMismatchedTypesLenient() {
		scriptTest("simple case mismatched types - not ansi")
				.script(begin(simpleCase("1").when("'one'", sql("SELECT 42")).orElse(sql("SELECT 43")).build()))
				.ansiMode(false)
				.expectRow(43)
				.runAndAssert();
	}

	@Test
	public void simpleCaseNullScrutinee() {
		scriptTest("simple case - null boolean constant 1")
				.script(begin(simpleCase("(NULL::BOOLEAN)")
						.when("NULL::BOOLEAN", sql("SELECT 41"))
						.when("true", sql("SELECT 42"))
						.when("false", sql("SELECT 43"))
						.orElse(sql("SELECT 44"))
						.build()))
				.expectRow(44)
				.runAndAssert();
	}

	@Test
	public void simpleCaseNullValue() {
		scriptTest("simple case - null boolean constant 2")
				.script(begin(
						simpleCase("true").when("(NULL::BOOLEAN)", sql("SELECT 42")).orElse(sql("SELECT 43")).build(),
						simpleCase("false").when("(NULL::BOOLEAN)", sql("SELECT 42")).orElse(sql("SELECT 43")).build()))
				.expectRow(43)
				.expectRow(43)
				.runAndAssert();
	}

	// WHILE

	@Test
	public void whileLoopCountsIterations() {
		TestResult result = scriptTest("while")
				.script(begin(
						sql("DECLARE i = 0"),
						whileLoop("i < 3", sql("SELECT i"), sql("SET i = i + 1"))))
				.expectNoRows()
				.expectRow(0)
				.expectNoRows()
				.expectRow(1)
				.expectNoRows()
				.expectRow(2)
				.expectNoRows()
				.runAndAssert();
		assertEquals(4, result.evaluator().count("i < 3"));
		assertEquals(3, result.evaluator().count("SELECT i"));
	}

	@Test
	public void whileNotEnteringBody() {
		TestResult result = scriptTest("while: not entering body")
				.script(begin(
						sql("DECLARE i = 3"),
						whileLoop("i < 3", sql("SELECT i"), sql("SET i = i + 1"))))
				.expectNoRows()
				.runAndAssert();
		assertEquals(1, result.evaluator().count("i < 3"));
	}

	@Test
	public void nestedWhile() {
		scriptTest("nested while")
				.script(begin(
						sql("DECLARE i = 0"),
						sql("DECLARE j = 0"),
						whileLoop("i < 2",
								sql("SET j = 0"),
								whileLoop("j < 2", sql("SELECT i, j"), sql("SET j = j + 1")),
								sql("SET i = i + 1"))))
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectRow(0, 0)
				.expectNoRows()
				.expectRow(0, 1)
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectRow(1, 0)
				.expectNoRows()
				.expectRow(1, 1)
				.expectNoRows()
				.expectNoRows()
				.runAndAssert();
	}

	@Test
	public void whileNullCondition() {
		scriptTest("while statement - null boolean constant")
				.script(begin(whileLoop("NULL::BOOLEAN", sql("SELECT 42")), sql("SELECT 43")))
				.expectRow(43)
				.runAndAssert();
	}

	// REPEAT

	@Test
	public void repeatLoop() {
		TestResult result = scriptTest("repeat")
				.script(begin(
						sql("DECLARE i = 0"),
						repeat("i = 3", sql("SELECT i"), sql("SET i = i + 1"))))
				.expectNoRows()
				.expectRow(0)
				.expectNoRows()
				.expectRow(1)
				.expectNoRows()
				.expectRow(2)
				.expectNoRows()
				.runAndAssert();
		assertEquals(3, result.evaluator().count("i = 3"));
	}

	@Test
	public void repeatEntersBodyOnce() {
		TestResult result = scriptTest("repeat: enters body only once")
				.script(begin(
						sql("DECLARE i = 3"),
						repeat("i >= 3", sql("SELECT i"), sql("SET i = i + 1"))))
				.expectNoRows()
				.expectRow(3)
				.expectNoRows()
				.runAndAssert();
		assertEquals(1, result.evaluator().count("i >= 3"));
	}

	@Test
	public void repeatEmptyBody() {
		scriptTest("repeat - empty body")
				.script(begin(repeat("1 = 1", begin(begin()))))
				.runAndAssert();
	}

	@Test
	public void repeatNullConditionContinues() {
		scriptTest("repeat statement - null boolean variable")
				.script(begin(
						sql("DECLARE b BOOLEAN"),
						sql("DECLARE i = 0"),
						repeat("b",
								sql("SET i = i + 1"),
								ifThen("i = 2", sql("SET b = true")).build()),
						sql("SELECT i")))
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectRow(2)
				.runAndAssert();
	}

	@Test
	public void repeatNonBooleanCondition() {
		scriptTest("repeat with non boolean condition - constant")
				.script(begin(sql("DECLARE i = 0"), repeat("1", sql("SELECT i"), sql("SET i = i + 1"))))
				.expectError(ScriptErrors.INVALID_BOOLEAN_STATEMENT)
				.expectParameter("invalidStatement", "1")
				.runAndAssert();
	}

	// LEAVE and ITERATE

	@Test
	public void leaveCompoundBlock() {
		scriptTest("leave compound block")
				.script(begin("lbl", sql("SELECT 1"), leave("lbl"), sql("SELECT 2")))
				.expectRow(1)
				.runAndAssert();
	}

	@Test
	public void leaveWhileLoop() {
		scriptTest("leave while loop")
				.script(begin(whileLoop("lbl", "1 = 1", sql("SELECT 1"), leave("lbl")), sql("SELECT 2")))
				.expectRow(1)
				.expectRow(2)
				.runAndAssert();
	}

	@Test
	public void leaveRepeatLoop() {
		scriptTest("leave repeat loop")
				.script(begin(repeat("lbl", "1 = 2", sql("SELECT 1"), leave("lbl"))))
				.expectRow(1)
				.runAndAssert();
	}

	@Test
	public void iterateCompoundBlockFails() {
		scriptTest("iterate compound block - should fail")
				.script(begin("lbl", sql("SELECT 1"), iterate("lbl"), sql("SELECT 2")))
				.expectError(ScriptErrors.ITERATE_IN_COMPOUND)
				.expectSqlState("42K0L")
				.expectParameter("labelName", "LBL")
				.runAndAssert();
	}

	@Test
	public void iterateWhileLoop() {
		scriptTest("iterate while loop")
				.script(begin(
						sql("DECLARE x = 0"),
						whileLoop("lbl", "x < 2",
								sql("SET x = x + 1"),
								iterate("lbl"),
								sql("SET x = 2")),
						sql("SELECT x")))
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectRow(2)
				.runAndAssert();
	}

	@Test
	public void iterateRepeatLoop() {
		scriptTest("iterate repeat loop")
				.script(begin(
						sql("DECLARE x = 0"),
						repeat("lbl", "x > 1",
								sql("SET x = x + 1"),
								iterate("lbl"),
								sql("SET x = 2")),
						sql("SELECT x")))
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectRow(2)
				.runAndAssert();
	}

	@Test
	public void leaveWithWrongLabel() {
		scriptTest("leave with wrong label - should fail")
				.script(begin("lbl", sql("SELECT 1"), leave("randomlbl")))
				.expectError(ScriptErrors.LABEL_DOES_NOT_EXIST)
				.expectParameter("labelName", "RANDOMLBL")
				.expectParameter("statementType", "LEAVE")
				.runAndAssert();
	}

	@Test
	public void iterateWithWrongLabel() {
		scriptTest("iterate with wrong label - should fail")
				.script(begin("lbl", sql("SELECT 1"), iterate("randomlbl")))
				.expectError(ScriptErrors.LABEL_DOES_NOT_EXIST)
				.expectParameter("labelName", "RANDOMLBL")
				.expectParameter("statementType", "ITERATE")
				.runAndAssert();
	}

	@Test
	public void leaveOuterLoopFromNestedRepeat() {
		scriptTest("leave outer loop from nested repeat loop")
				.script(begin(loop("lbl",
						repeat("lbl2", "1 = 2", sql("SELECT 1"), leave("lbl")))))
				.expectRow(1)
				.runAndAssert();
	}

	@Test
	public void leaveOuterLoopFromNestedWhile() {
		scriptTest("leave outer loop from nested while loop")
				.script(begin(
						whileLoop("lbl", "1 = 1",
								whileLoop("lbl2", "2 = 2", sql("SELECT 1"), leave("lbl"))),
						sql("SELECT 2")))
				.expectRow(1)
				.expectRow(2)
				.runAndAssert();
	}

	@Test
	public void iterateOuterLoopFromNestedWhile() {
		scriptTest("iterate outer loop from nested while loop")
				.script(begin(
						sql("DECLARE x = 0"),
						whileLoop("lbl", "x < 2",
								sql("SET x = x + 1"),
								whileLoop("lbl2", "1 = 1", sql("SELECT 1"), iterate("lbl")))))
				.expectNoRows()
				.expectNoRows()
				.expectRow(1)
				.expectNoRows()
				.expectRow(1)
				.runAndAssert();
	}

	@Test
	public void leaveOuterLoopFromInnerCompound() {
		scriptTest("nested compounds in loop - leave in inner compound")
				.script(begin(
						loop("lbl", begin("lbl2", sql("SELECT 1"), leave("lbl"))),
						sql("SELECT 2")))
				.expectRow(1)
				.expectRow(2)
				.runAndAssert();
	}

	@Test
	public void loopWithLeave() {
		TestResult result = scriptTest("loop statement with leave")
				.script(begin(
						loop("lbl",
								sql("SET x = x + 1"),
								sql("SELECT x"),
								ifThen("x > 2", leave("lbl")).build()),
						sql("SELECT x")))
				.argument("x", 0)
				.expectNoRows()
				.expectRow(1)
				.expectNoRows()
				.expectRow(2)
				.expectNoRows()
				.expectRow(3)
				.expectRow(3)
				.runAndAssert();
		assertEquals(7, result.results().size());
	}

	@Test
	public void nestedLoopWithLeave() {
		scriptTest("nested loop statement with leave")
				.script(begin(
						sql("DECLARE x = 0"),
						sql("DECLARE y = 0"),
						loop("lbl",
								sql("SET x = x + 1"),
								loop("lbl2",
										sql("SET y = y + 1"),
										sql("SELECT x, y"),
										ifThen("y > 1", leave("lbl2")).build()),
								sql("SET y = 0"),
								ifThen("x > 1", leave("lbl")).build())))
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectRow(1, 1)
				.expectNoRows()
				.expectRow(1, 2)
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectRow(2, 1)
				.expectNoRows()
				.expectRow(2, 2)
				.expectNoRows()
				.runAndAssert();
	}

	@Test
	public void iterateLoopStatement() {
		scriptTest("iterate loop statement")
				.script(begin(
						sql("DECLARE x = 0"),
						loop("lbl",
								sql("SET x = x + 1"),
								ifThen("x > 1", leave("lbl")).build(),
								iterate("lbl"),
								sql("SET x = x + 2")),
						sql("SELECT x")))
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectRow(2)
				.runAndAssert();
	}

	@Test
	public void iterateOuterLoopFromNestedLoop() {
		scriptTest("iterate outer loop from nested loop statement")
				.script(begin(
						sql("DECLARE x = 0"),
						loop("lbl",
								sql("SET x = x + 1"),
								ifThen("x > 2", leave("lbl")).build(),
								loop("lbl2", sql("SELECT 1"), iterate("lbl"), sql("SET x = 10")))))
				.expectNoRows()
				.expectNoRows()
				.expectRow(1)
				.expectNoRows()
				.expectRow(1)
				.expectNoRows()
				.runAndAssert();
	}

	@Test
	public void labelsAreCaseInsensitive() {
		scriptTest("labels are case insensitive")
				.script(begin(whileLoop("MyLoop", "1 = 1", sql("SELECT 1"), leave("myloop")), sql("SELECT 2")))
				.expectRow(1)
				.expectRow(2)
				.runAndAssert();
	}

	// FOR

	@Test
	public void forEntersBodyOnce() {
		scriptTest("for statement - enters body once")
				.table("t", numbers().row(1, "first", 1.0).build())
				.script(begin(forLoop("x", "SELECT * FROM t",
						sql("SELECT x.intCol"),
						sql("SELECT intCol"),
						sql("SELECT x.stringCol"),
						sql("SELECT doubleCol"))))
				.expectRow(1)
				.expectRow(1)
				.expectRow("first")
				.expectRow(1.0)
				.runAndAssert();
	}

	@Test
	public void forEntersBodyForEachRow() {
		scriptTest("for statement - enters body with multiple statements multiple times")
				.table("t", numbers().row(1, "first", 1.0).row(2, "second", 2.0).build())
				.script(begin(forLoop("x", "SELECT * FROM t",
						sql("SELECT x.intCol"),
						sql("SELECT stringCol"))))
				.expectRow(1)
				.expectRow("first")
				.expectRow(2)
				.expectRow("second")
				.runAndAssert();
	}

	@Test
	public void forMixedCaseVariableNames() {
		scriptTest("for statement - mixed case variable names")
				.table("t", numbers().row(1, "first", 1.0).build())
				.script(begin(forLoop("X", "SELECT * FROM t",
						sql("SELECT x.INTCOL"),
						sql("SELECT IntCol"))))
				.expectRow(1)
				.expectRow(1)
				.runAndAssert();
	}

	@Test
	public void forSumOfColumn() {
		scriptTest("for statement - sum of column from table")
				.table("t", threeNumbers())
				.script(begin(
						sql("DECLARE sumOfCols = 0"),
						forLoop("x", "SELECT * FROM t", sql("SET sumOfCols = sumOfCols + x.intCol")),
						sql("SELECT sumOfCols")))
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectRow(6)
				.runAndAssert();
	}

	@Test
	public void forWithoutVariable() {
		scriptTest("for statement - no variable - sum of column from table")
				.table("t", threeNumbers())
				.script(begin(
						sql("DECLARE sumOfCols = 0"),
						forLoop(null, "SELECT * FROM t", sql("SET sumOfCols = sumOfCols + intCol")),
						sql("SELECT sumOfCols")))
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectRow(6)
				.runAndAssert();
	}

	@Test
	public void forNestedStruct() {
		Map<String, Object> inner = new LinkedHashMap<String, Object>();
		inner.put("a", 1);
		inner.put("b", "x");
		QueryResult table = QueryResult
				.withColumns(new Column("id", SqlType.INT), new Column("structCol", SqlType.STRUCT))
				.row(7, inner)
				.build();
		scriptTest("for statement - nested struct")
				.table("t", table)
				.script(begin(forLoop("x", "SELECT * FROM t",
						sql("SELECT x.structCol.a"),
						sql("SELECT structCol.b"),
						sql("SELECT x.id"))))
				.expectRow(1)
				.expectRow("x")
				.expectRow(7)
				.runAndAssert();
	}

	@Test
	public void forEmptyResult() {
		scriptTest("for statement - empty result")
				.table("t", numbers().build())
				.script(begin(forLoop("x", "SELECT * FROM t", sql("SELECT 1")), sql("SELECT 2")))
				.expectRow(2)
				.runAndAssert();
	}

	@Test
	public void forEmptyBody() {
		TestResult result = scriptTest("for statement - empty body")
				.table("t", threeNumbers())
				.script(begin(forLoop("x", "SELECT * FROM t"), forLoop("y", "SELECT * FROM t", begin(begin()))))
				.runAndAssert();
		assertEquals(2, result.evaluator().count("SELECT * FROM t"));
	}

	@Test
	public void forIterate() {
		scriptTest("for statement iterate")
				.table("t", threeNumbers())
				.script(begin(
						sql("DECLARE sumOfCols = 0"),
						forLoop("lbl", "x", "SELECT * FROM t",
								ifThen("x.intCol = 2", iterate("lbl")).build(),
								sql("SET sumOfCols = sumOfCols + x.intCol")),
						sql("SELECT sumOfCols")))
				.expectNoRows()
				.expectNoRows()
				.expectNoRows()
				.expectRow(4)
				.runAndAssert();
	}

	@Test
	public void forLeave() {
		scriptTest("for statement leave")
				.table("t", threeNumbers())
				.script(begin(
						sql("DECLARE sumOfCols = 0"),
						forLoop("lbl", "x", "SELECT * FROM t",
								ifThen("x.intCol = 2", leave("lbl")).build(),
								sql("SET sumOfCols = sumOfCols + x.intCol")),
						sql("SELECT sumOfCols")))
				.expectNoRows()
				.expectNoRows()
				.expectRow(1)
				.runAndAssert();
	}

	@Test
	public void forNestedInWhile() {
		scriptTest("for statement - nested - in while")
				.table("t", numbers().row(1, "first", 1.0).row(2, "second", 2.0).build())
				.script(begin(
						sql("DECLARE cnt = 0"),
						whileLoop("cnt < 2",
								sql("SET cnt = cnt + 1"),
								forLoop("x", "SELECT * FROM t", sql("SELECT x.intCol")))))
				.expectNoRows()
				.expectNoRows()
				.expectRow(1)
				.expectRow(2)
				.expectNoRows()
				.expectRow(1)
				.expectRow(2)
				.runAndAssert();
	}

	@Test
	public void forNestedInFor() {
		scriptTest("for statement - nested - in other for")
				.table("t", numbers().row(1, "first", 1.0).row(2, "second", 2.0).build())
				.script(begin(forLoop("x", "SELECT * FROM t",
						forLoop("y", "SELECT intCol AS other FROM t", sql("SELECT x.intCol, y.other")))))
				.expectRow(1, 1)
				.expectRow(1, 2)
				.expectRow(2, 1)
				.expectRow(2, 2)
				.runAndAssert();
	}

	@Test
	public void forNestedLeaveOuterLoop() {
		scriptTest("for statement - nested - leave outer loop")
				.table("t", numbers().row(1, "first", 1.0).row(2, "second", 2.0).build())
				.script(begin(
						forLoop("outer", "x", "SELECT * FROM t",
								forLoop("inner", "y", "SELECT intCol AS other FROM t",
										sql("SELECT x.intCol, y.other"),
										leave("outer"))),
						sql("SELECT 3")))
				.expectRow(1, 1)
				.expectRow(3)
				.runAndAssert();
	}

	@Test
	public void forNestedIterateOuterLoop() {
		scriptTest("for statement - nested - iterate outer loop")
				.table("t", numbers().row(1, "first", 1.0).row(2, "second", 2.0).build())
				.script(begin(forLoop("outer", "x", "SELECT * FROM t",
						forLoop("inner", "y", "SELECT intCol AS other FROM t",
								sql("SELECT x.intCol, y.other"),
								iterate("outer")),
						sql("SELECT 99"))))
				.expectRow(1, 1)
				.expectRow(2, 1)
				.runAndAssert();
	}

	@Test
	public void forVariablesOutOfScopeAfterLoop() {
		scriptTest("for statement - variables out of scope after the loop")
				.table("t", numbers().row(1, "first", 1.0).build())
				.script(begin(forLoop("x", "SELECT * FROM t", sql("SELECT 1")), sql("SELECT x.intCol")))
				.expectError(TestEvaluator.UNRESOLVED_COLUMN)
				.runAndAssert();
	}

	// Condition evaluation

	@Test
	public void ifScalarSubqueryMultiColumn() {
		scriptTest("condition evaluation - if statement - scalar exceptions 1")
				.script(begin(ifThen("(SELECT 1, 2)", sql("SELECT 1")).build()))
				.expectError(ScriptErrors.SCALAR_SUBQUERY_MULTI_COLUMN)
				.expectSqlState("42823")
				.expectParameter("number", "2")
				.runAndAssert();
	}

	@Test
	public void ifScalarSubqueryTooManyRows() {
		scriptTest("condition evaluation - if statement - scalar exceptions 2")
				.script(begin(
						sql("CREATE TABLE t (a BOOLEAN)"),
						sql("INSERT INTO t VALUES (true), (true)"),
						ifThen("(SELECT * FROM t)", sql("SELECT 46")).build()))
				.expectError(ScriptErrors.SCALAR_SUBQUERY_TOO_MANY_ROWS)
				.expectSqlState("21000")
				.runAndAssert();
	}

	@Test
	public void ifNonBooleanSubqueryTooManyRows() {
		scriptTest("condition evaluation - if statement - too many rows before type check")
				.table("t", threeNumbers())
				.script(begin(ifThen("(SELECT intCol FROM t)", sql("SELECT 46")).build()))
				.expectError(ScriptErrors.SCALAR_SUBQUERY_TOO_MANY_ROWS)
				.expectSqlState("21000")
				.runAndAssert();
	}

	@Test
	public void whileScalarSubqueryMultiColumn() {
		scriptTest("condition evaluation - while statement - scalar exceptions")
				.script(begin(whileLoop("(SELECT 1, 2)", sql("SELECT 1"))))
				.expectError(ScriptErrors.SCALAR_SUBQUERY_MULTI_COLUMN)
				.runAndAssert();
	}

	@Test
	public void simpleCaseScalarSubqueryTooManyRows() {
		scriptTest("condition evaluation - simple case statement - scalar exceptions")
				.table("t", numbers().row(1, "first", 1.0).row(2, "second", 2.0).build())
				.script(begin(simpleCase("(SELECT intCol FROM t)").when("1", sql("SELECT 42")).build()))
				.expectError(ScriptErrors.SCALAR_SUBQUERY_TOO_MANY_ROWS)
				.runAndAssert();
	}

	@Test
	public void ifNullBooleanConstant() {
		scriptTest("condition evaluation - if statement - null boolean constant")
				.script(begin(ifThen("NULL::BOOLEAN", sql("SELECT 42")).orElse(sql("SELECT 43")).build()))
				.expectRow(43)
				.runAndAssert();
	}

	@Test
	public void ifNullNonBooleanConstant() {
		scriptTest("condition evaluation - if statement - null non-boolean constant")
				.script(begin(ifThen("NULL", sql("SELECT 42")).orElse(sql("SELECT 43")).build()))
				.expectError(ScriptErrors.INVALID_BOOLEAN_STATEMENT)
				.expectParameter("invalidStatement", "NULL")
				.runAndAssert();
	}

	@Test
	public void ifNullBooleanVariable() {
		scriptTest("condition evaluation - if statement - null boolean variable")
				.script(begin(
						sql("DECLARE b BOOLEAN"),
						ifThen("b", sql("SELECT 42")).orElse(sql("SELECT 43")).build()))
				.expectNoRows()
				.expectRow(43)
				.runAndAssert();
	}

	@Test
	public void ifNullBooleanFromTable() {
		scriptTest("condition evaluation - if statement - null boolean from table")
				.script(begin(
						sql("CREATE TABLE t (a BOOLEAN)"),
						sql("INSERT INTO t VALUES (NULL)"),
						ifThen("(SELECT a FROM t)", sql("SELECT 42")).orElse(sql("SELECT 43")).build()))
				.expectNoRows()
				.expectNoRows()
				.expectRow(43)
				.runAndAssert();
	}

	@Test
	public void ifBooleanString() {
		scriptTest("condition evaluation - boolean string")
				.script(begin(ifThen("'true'", sql("SELECT 42")).orElse(sql("SELECT 43")).build()))
				.expectRow(42)
				.runAndAssert();
	}
}
