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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import org.metricshub.square.frontend.Position;

/**
 * Prints a syntax tree as indented text, one node per line, each line
 * indented by two spaces per level of depth:
 *
 * <pre>
 * Program (Line 1, Column 1)
 *   AssignCommand (Line 1, Column 1)
 *     Identifier "a" (Line 1, Column 1)
 *     IntegerExpression (Line 1, Column 3)
 *       IntegerLiteral "1" (Line 1, Column 3)
 * </pre>
 */
public class TreePrinter implements NodeVisitor<Void> {

	private static final String INDENT = "  ";

	private final PrintStream out;
	private int depth;

	public TreePrinter(PrintStream out) {
		this.out = out;
	}

	/**
	 * Renders a tree to a string.
	 *
	 * @param root the node to start from
	 * @return the printed tree
	 */
	public static String toString(AstNode root) {
		ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		try (PrintStream ps = new PrintStream(buffer, true, StandardCharsets.UTF_8.name())) {
			new TreePrinter(ps).print(root);
			return buffer.toString(StandardCharsets.UTF_8.name());
		} catch (UnsupportedEncodingException ex) {
			throw new IllegalStateException(ex);
		}
	}

	/**
	 * Prints {@code root} and its descendants.
	 *
	 * @param root the node to start from
	 */
	public void print(AstNode root) {
		depth = 0;
		root.accept(this);
		out.flush();
	}

	private void line(String label, Position position) {
		for (int i = 0; i < depth; i++) {
			out.print(INDENT);
		}
		out.print(label + " (" + position + ")\n");
	}

	private Void terminal(String label, TerminalNode node) {
		line(label + " \"" + node.getSpelling() + "\"", node.getPosition());
		return null;
	}

	@Override
	public Void visitProgram(ProgramNode node) {
		line("Program", node.getPosition());
		depth++;
		node.getCommand().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitAssignCommand(AssignCommandNode node) {
		line("AssignCommand", node.getPosition());
		depth++;
		node.getIdentifier().accept(this);
		node.getExpression().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitCallCommand(CallCommandNode node) {
		line("CallCommand", node.getPosition());
		depth++;
		node.getIdentifier().accept(this);
		node.getParameter().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitIfCommand(IfCommandNode node) {
		line("IfCommand", node.getPosition());
		depth++;
		node.getExpression().accept(this);
		node.getThenCommand().accept(this);
		node.getElseCommand().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitWhileCommand(WhileCommandNode node) {
		line("WhileCommand", node.getPosition());
		depth++;
		node.getExpression().accept(this);
		node.getCommand().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitLetCommand(LetCommandNode node) {
		line("LetCommand", node.getPosition());
		depth++;
		node.getDeclaration().accept(this);
		node.getCommand().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitDoIfCommand(DoIfCommandNode node) {
		line("DoIfCommand", node.getPosition());
		depth++;
		node.getDoCommand().accept(this);
		node.getExpression().accept(this);
		node.getElseCommand().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitRepeatCommand(RepeatCommandNode node) {
		line("RepeatCommand", node.getPosition());
		depth++;
		node.getCommand().accept(this);
		node.getExpression().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitSequentialCommand(SequentialCommandNode node) {
		line("SequentialCommand", node.getPosition());
		depth++;
		for (CommandNode child : node.getCommands()) {
			child.accept(this);
		}
		depth--;
		return null;
	}

	@Override
	public Void visitBlankCommand(BlankCommandNode node) {
		line("BlankCommand", node.getPosition());
		return null;
	}

	@Override
	public Void visitErrorCommand(ErrorCommandNode node) {
		line("ErrorCommand", node.getPosition());
		return null;
	}

	@Override
	public Void visitConstDeclaration(ConstDeclarationNode node) {
		line("ConstDeclaration", node.getPosition());
		depth++;
		node.getTypeDenoter().accept(this);
		node.getIdentifier().accept(this);
		node.getExpression().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitVarDeclaration(VarDeclarationNode node) {
		line("VarDeclaration", node.getPosition());
		depth++;
		node.getTypeDenoter().accept(this);
		node.getIdentifier().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitSequentialDeclaration(SequentialDeclarationNode node) {
		line("SequentialDeclaration", node.getPosition());
		depth++;
		for (DeclarationNode child : node.getDeclarations()) {
			child.accept(this);
		}
		depth--;
		return null;
	}

	@Override
	public Void visitErrorDeclaration(ErrorDeclarationNode node) {
		line("ErrorDeclaration", node.getPosition());
		return null;
	}

	@Override
	public Void visitIntegerExpression(IntegerExpressionNode node) {
		line("IntegerExpression", node.getPosition());
		depth++;
		node.getIntegerLiteral().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitCharacterExpression(CharacterExpressionNode node) {
		line("CharacterExpression", node.getPosition());
		depth++;
		node.getCharacterLiteral().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitIdExpression(IdExpressionNode node) {
		line("IdExpression", node.getPosition());
		depth++;
		node.getIdentifier().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitCallExpression(CallExpressionNode node) {
		line("CallExpression", node.getPosition());
		depth++;
		node.getIdentifier().accept(this);
		node.getParameter().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitBinaryExpression(BinaryExpressionNode node) {
		// operator chains nest to the left without bound, so walk the left spine with a stack
		Deque<BinaryExpressionNode> spine = new ArrayDeque<BinaryExpressionNode>();
		ExpressionNode left = node;
		while (left instanceof BinaryExpressionNode) {
			BinaryExpressionNode binary = (BinaryExpressionNode) left;
			line("BinaryExpression", binary.getPosition());
			depth++;
			spine.push(binary);
			left = binary.getLeftExpression();
		}
		left.accept(this);
		while (!spine.isEmpty()) {
			BinaryExpressionNode binary = spine.pop();
			binary.getOperator().accept(this);
			binary.getRightExpression().accept(this);
			depth--;
		}
		return null;
	}

	@Override
	public Void visitUnaryExpression(UnaryExpressionNode node) {
		line("UnaryExpression", node.getPosition());
		depth++;
		node.getOperator().accept(this);
		node.getExpression().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitErrorExpression(ErrorExpressionNode node) {
		line("ErrorExpression", node.getPosition());
		return null;
	}

	@Override
	public Void visitExpressionParameter(ExpressionParameterNode node) {
		line("ExpressionParameter", node.getPosition());
		depth++;
		node.getExpression().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitVarParameter(VarParameterNode node) {
		line("VarParameter", node.getPosition());
		depth++;
		node.getIdentifier().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitBlankParameter(BlankParameterNode node) {
		line("BlankParameter", node.getPosition());
		return null;
	}

	@Override
	public Void visitErrorParameter(ErrorParameterNode node) {
		line("ErrorParameter", node.getPosition());
		return null;
	}

	@Override
	public Void visitTypeDenoter(TypeDenoterNode node) {
		line("TypeDenoter", node.getPosition());
		depth++;
		node.getIdentifier().accept(this);
		depth--;
		return null;
	}

	@Override
	public Void visitIdentifier(IdentifierNode node) {
		return terminal("Identifier", node);
	}

	@Override
	public Void visitIntegerLiteral(IntegerLiteralNode node) {
		return terminal("IntegerLiteral", node);
	}

	@Override
	public Void visitCharacterLiteral(CharacterLiteralNode node) {
		return terminal("CharacterLiteral", node);
	}

	@Override
	public Void visitOperator(OperatorNode node) {
		return terminal("Operator", node);
	}
}
