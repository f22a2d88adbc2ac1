package org.metricshub.square;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Square
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.square.util.ScriptFileSource;
import org.metricshub.square.util.ScriptSource;

public class CliTest {

	@Test
	public void testPrintsSyntaxTreeOfProgramFile() throws Exception {
		SquareTestSupport
				.cliTest("tree of a program file")
				.program("a~1")
				.expectLines(
						"Program (Line 1, Column 1)",
						"  AssignCommand (Line 1, Column 1)",
						"    Identifier \"a\" (Line 1, Column 1)",
						"    IntegerExpression (Line 1, Column 3)",
						"      IntegerLiteral \"1\" (Line 1, Column 3)")
				.runAndAssert();
	}

	@Test
	public void testOtherExtensionStillCompiles() throws Exception {
		String path = SquareTestSupport.programFile("nop", ".txt").toString();
		SquareTestSupport
				.cliTest("program file without the .sq extension")
				.argument(path)
				.expectLines("Program (Line 1, Column 1)", "  BlankCommand (Line 1, Column 1)")
				.runAndAssert();
	}

	@Test
	public void testLongOperatorChain() throws Exception {
		StringBuilder program = new StringBuilder("x ~ 1");
		for (int i = 0; i < 100000; i++) {
			program.append("+1");
		}
		SquareTestSupport.TestResult result = SquareTestSupport
				.cliTest("100000 operators in a row")
				.argument("-e", program.toString())
				.run();
		result.assertExpected();
		// 3 lines above the expression, 2 for the first operand, 4 per operator
		assertEquals(5 + 4 * 100000, result.lines().size());
	}

	@Test
	public void testDumpTokensOnly() throws Exception {
		SquareTestSupport
				.cliTest("--dump-tokens without the tree")
				.argument("--dump-tokens", "--no-dump-syntax", "-e", "f()")
				.expectLines(
						"type=IDENTIFIER, spelling=\"f\", position=Line 1, Column 1",
						"type=LEFT_BRACKET, spelling=\"(\", position=Line 1, Column 2",
						"type=RIGHT_BRACKET, spelling=\")\", position=Line 1, Column 3",
						"type=END_OF_TEXT, spelling=\"\", position=Line 1, Column 4")
				.runAndAssert();
	}

	@Test
	public void testLexicalErrorExitsWithOne() throws Exception {
		SquareTestSupport
				.cliTest("lexical error")
				.argument("-e", "a ~ $")
				.expectExit(1)
				.expectErrorContaining("Lexical error at Line 1, Column 5")
				.runAndAssert();
	}

	@Test
	public void testSyntaxErrorExitsWithOne() throws Exception {
		SquareTestSupport
				.cliTest("syntax error")
				.argument("-e", "if 1 x~1 x~2")
				.expectExit(1)
				.expectErrorContaining("Syntax error at Line 1, Column 10")
				.runAndAssert();
	}

	@Test
	public void testTokensAreDumpedEvenWhenParsingFails() throws Exception {
		SquareTestSupport.TestResult result = SquareTestSupport
				.cliTest("tokens of a malformed program")
				.argument("--dump-tokens", "-e", "~")
				.expectExit(1)
				.run();
		result.assertExpected();
		assertEquals(2, result.lines().size());
		assertTrue(result.lines().get(0).startsWith("type=IS"));
	}

	@Test
	public void testUsage() throws Exception {
		SquareTestSupport.TestResult result = SquareTestSupport.cliTest("usage").argument("-h").run();
		result.assertExpected();
		assertEquals("Usage:", result.lines().get(0));
	}

	@Test
	public void testNoArgumentsPrintsUsage() throws Exception {
		SquareTestSupport.TestResult result = SquareTestSupport.cliTest("no arguments").run();
		result.assertExpected();
		assertEquals("Usage:", result.lines().get(0));
	}

	@Test
	public void testInvalidArguments() throws Exception {
		SquareTestSupport
				.cliTest("unknown option")
				.argument("--optimize", "-e", "nop")
				.expectExit(1)
				.expectErrorContaining("Unknown parameter: --optimize")
				.runAndAssert();
		SquareTestSupport
				.cliTest("missing option value")
				.argument("-e")
				.expectExit(1)
				.expectErrorContaining("Need additional argument for -e")
				.runAndAssert();
		SquareTestSupport
				.cliTest("non-positive depth")
				.argument("--max-depth", "0", "-e", "nop")
				.expectExit(1)
				.expectErrorContaining("positive integer")
				.runAndAssert();
		SquareTestSupport
				.cliTest("missing file")
				.argument("does-not-exist.sq")
				.expectExit(1)
				.expectErrorContaining("Failed to read program 'does-not-exist.sq'")
				.runAndAssert();
		SquareTestSupport
				.cliTest("help with other arguments")
				.argument("-e", "nop", "-h")
				.expectExit(1)
				.runAndAssert();
	}

	@Test
	public void testParseConfiguresSettings() throws Exception {
		Cli cli = new Cli();
		cli.parse(new String[] { "--max-depth", "5", "--dump-tokens", "--no-dump-syntax", "-e", "nop" });
		assertEquals(5, cli.getSettings().getMaxNestingDepth());
		assertTrue(cli.getSettings().isDumpTokens());
		assertFalse(cli.getSettings().isDumpSyntaxTree());
		assertEquals(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, cli.getScriptSource().getDescription());
	}

	@Test
	public void testPositionalArgumentIsProgramFile() throws Exception {
		String path = SquareTestSupport.programFile("nop").toString();
		Cli cli = Cli.parseCommandLineArguments(new String[] { path });
		assertTrue(cli.getScriptSource() instanceof ScriptFileSource);
		assertEquals(path, ((ScriptFileSource) cli.getScriptSource()).getFilePath());
	}

	@Test
	public void testOnlyOneProgramAccepted() throws Exception {
		String path = SquareTestSupport.programFile("nop").toString();
		assertThrows(
				"two programs must be rejected",
				IllegalArgumentException.class,
				() -> new Cli().parse(new String[] { "-f", path, "-e", "nop" }));
		assertThrows(
				"extra positional arguments must be rejected",
				IllegalArgumentException.class,
				() -> new Cli().parse(new String[] { path, path }));
	}

	@Test
	public void testCreateThrowsOnCompileErrors() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		try (PrintStream ps = new PrintStream(out, true, StandardCharsets.UTF_8.name())) {
			SquareCompileException e = assertThrows(
					SquareCompileException.class,
					() -> Cli.create(new String[] { "-e", "while 1 do" }, ps, ps));
			assertFalse(e.getDiagnostics().isEmpty());
		}
	}
}
