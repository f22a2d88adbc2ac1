package org.metricshub.square.frontend.ast;

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
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.square.Square;

public class TreePrinterTest {

	private static String print(String program) {
		return TreePrinter.toString(new Square().compile(program));
	}

	@Test
	public void testAssignment() throws Exception {
		assertEquals(
				"Program (Line 1, Column 1)\n"
						+ "  AssignCommand (Line 1, Column 1)\n"
						+ "    Identifier \"a\" (Line 1, Column 1)\n"
						+ "    IntegerExpression (Line 1, Column 3)\n"
						+ "      IntegerLiteral \"1\" (Line 1, Column 3)\n",
				print("a~1"));
	}

	@Test
	public void testBlankParameter() throws Exception {
		assertEquals(
				"Program (Line 1, Column 1)\n"
						+ "  CallCommand (Line 1, Column 1)\n"
						+ "    Identifier \"f\" (Line 1, Column 1)\n"
						+ "    BlankParameter (Line 1, Column 3)\n",
				print("f()"));
	}

	@Test
	public void testLetCommand() throws Exception {
		assertEquals(
				"Program (Line 1, Column 1)\n"
						+ "  LetCommand (Line 1, Column 1)\n"
						+ "    VarDeclaration (Line 1, Column 5)\n"
						+ "      TypeDenoter (Line 1, Column 9)\n"
						+ "        Identifier \"Int\" (Line 1, Column 9)\n"
						+ "      Identifier \"x\" (Line 1, Column 13)\n"
						+ "    BlankCommand (Line 1, Column 18)\n",
				print("let var Int x in nop"));
	}

	@Test
	public void testExpressions() throws Exception {
		assertEquals(
				"Program (Line 1, Column 1)\n"
						+ "  AssignCommand (Line 1, Column 1)\n"
						+ "    Identifier \"c\" (Line 1, Column 1)\n"
						+ "    BinaryExpression (Line 1, Column 3)\n"
						+ "      UnaryExpression (Line 1, Column 3)\n"
						+ "        Operator \"-\" (Line 1, Column 3)\n"
						+ "        IdExpression (Line 1, Column 4)\n"
						+ "          Identifier \"n\" (Line 1, Column 4)\n"
						+ "      Operator \"<\" (Line 1, Column 5)\n"
						+ "      CharacterExpression (Line 1, Column 6)\n"
						+ "        CharacterLiteral \"'a'\" (Line 1, Column 6)\n",
				print("c~-n<'a'"));
	}

	@Test
	public void testOperatorChain() throws Exception {
		assertEquals(
				"Program (Line 1, Column 1)\n"
						+ "  AssignCommand (Line 1, Column 1)\n"
						+ "    Identifier \"x\" (Line 1, Column 1)\n"
						+ "    BinaryExpression (Line 1, Column 3)\n"
						+ "      BinaryExpression (Line 1, Column 3)\n"
						+ "        IdExpression (Line 1, Column 3)\n"
						+ "          Identifier \"a\" (Line 1, Column 3)\n"
						+ "        Operator \"+\" (Line 1, Column 4)\n"
						+ "        IntegerExpression (Line 1, Column 5)\n"
						+ "          IntegerLiteral \"1\" (Line 1, Column 5)\n"
						+ "      Operator \"*\" (Line 1, Column 6)\n"
						+ "      BinaryExpression (Line 1, Column 8)\n"
						+ "        IdExpression (Line 1, Column 8)\n"
						+ "          Identifier \"b\" (Line 1, Column 8)\n"
						+ "        Operator \"-\" (Line 1, Column 9)\n"
						+ "        IntegerExpression (Line 1, Column 10)\n"
						+ "          IntegerLiteral \"2\" (Line 1, Column 10)\n",
				print("x~a+1*(b-2)"));
	}

	@Test
	public void testVeryLongOperatorChain() throws Exception {
		StringBuilder program = new StringBuilder("x ~ 1");
		for (int i = 0; i < 100000; i++) {
			program.append("+1");
		}
		String printed = print(program.toString());
		assertTrue(printed.startsWith("Program (Line 1, Column 1)\n  AssignCommand (Line 1, Column 1)\n"));
		assertTrue(printed.endsWith("    Operator \"+\" (Line 1, Column 200004)\n"
				+ "    IntegerExpression (Line 1, Column 200005)\n"
				+ "      IntegerLiteral \"1\" (Line 1, Column 200005)\n"));
	}

	@Test
	public void testDump() throws Exception {
		ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		try (PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8.name())) {
			new Square().compile("[nop; nop]").dump(out);
		}
		assertEquals(
				"Program (Line 1, Column 2)\n"
						+ "  SequentialCommand (Line 1, Column 2)\n"
						+ "    BlankCommand (Line 1, Column 2)\n"
						+ "    BlankCommand (Line 1, Column 7)\n",
				buffer.toString(StandardCharsets.UTF_8.name()));
	}
}
