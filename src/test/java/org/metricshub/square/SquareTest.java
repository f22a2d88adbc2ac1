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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.List;
import org.junit.Test;
import org.metricshub.square.frontend.Position;
import org.metricshub.square.frontend.Token;
import org.metricshub.square.frontend.TokenType;
import org.metricshub.square.frontend.ast.ErrorCommandNode;
import org.metricshub.square.frontend.ast.ProgramNode;
import org.metricshub.square.frontend.ast.SequentialCommandNode;
import org.metricshub.square.util.Diagnostic;
import org.metricshub.square.util.ScriptFileSource;
import org.metricshub.square.util.ScriptSource;
import org.metricshub.square.util.SquareSettings;

public class SquareTest {

	@Test
	public void testCompile() throws Exception {
		Square square = new Square();
		ProgramNode tree = square.compile("a~1; b~2");
		assertTrue(tree.getCommand() instanceof SequentialCommandNode);
		assertEquals(8, square.getLastTokens().size());
		assertSame(tree, square.getLastAst());
		assertEquals(0, square.getLastReporter().getErrorCount());
	}

	@Test
	public void testCompileFile() throws Exception {
		String path = SquareTestSupport.programFile("let var Integer n in\n  getint(var n)\n").toString();
		ProgramNode tree = new Square().compile(new ScriptFileSource(path));
		assertEquals(new Position(1, 1), tree.getPosition());
	}

	@Test
	public void testLexicalErrorStopsBeforeParsing() throws Exception {
		Square square = new Square();
		SquareCompileException e = assertThrows(SquareCompileException.class, () -> square.compile("a ~ $"));
		assertTrue(e.getMessage(), e.getMessage().startsWith("Tokenizing"));
		assertEquals(1, e.getDiagnostics().size());
		assertEquals(Diagnostic.Kind.LEXICAL, e.getDiagnostics().get(0).getKind());
		assertEquals(new Position(1, 5), e.getPosition());
		assertNull(square.getLastAst());
		assertEquals(4, square.getLastTokens().size());
	}

	@Test
	public void testSyntaxError() throws Exception {
		Square square = new Square();
		SquareCompileException e = assertThrows(SquareCompileException.class, () -> square.compile("a ~ ;"));
		assertTrue(e.getMessage(), e.getMessage().startsWith("Parsing"));
		assertEquals(Diagnostic.Kind.SYNTAX, e.getDiagnostics().get(0).getKind());
		assertEquals(new Position(1, 5), e.getPosition());
		assertNull(square.getLastAst());
	}

	@Test
	public void testParseReturnsTreeDespiteErrors() throws Exception {
		Square square = new Square();
		ProgramNode tree = square.parse(ScriptSource.fromString("~"));
		assertTrue(tree.getCommand() instanceof ErrorCommandNode);
		assertTrue(square.getLastReporter().hasErrors());
		assertSame(tree, square.getLastAst());
	}

	@Test
	public void testTokenize() throws Exception {
		Square square = new Square();
		assertTrue(square.getLastTokens().isEmpty());
		List<Token> tokens = square.tokenize(ScriptSource.fromString("while x do nop"));
		assertEquals(TokenType.WHILE, tokens.get(0).getType());
		assertEquals(TokenType.NOP, tokens.get(3).getType());
		assertEquals(TokenType.END_OF_TEXT, tokens.get(4).getType());
		assertNull(square.getLastAst());
	}

	@Test
	public void testSettingsReachTheParser() throws Exception {
		SquareSettings settings = new SquareSettings();
		settings.setMaxNestingDepth(2);
		Square square = new Square(settings);
		square.compile("x ~ 1");
		assertThrows(SquareCompileException.class, () -> square.compile("x ~ (1)"));
	}
}
