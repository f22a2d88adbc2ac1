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

/**
 * Operation over the syntax tree, with one method per node class.
 * Adding a node class adds a method here, so every visitor has to
 * handle it.
 *
 * @param <R> result of visiting a node
 */
public interface NodeVisitor<R> {
	R visitProgram(ProgramNode node);

	// commands
	R visitAssignCommand(AssignCommandNode node);
	R visitCallCommand(CallCommandNode node);
	R visitIfCommand(IfCommandNode node);
	R visitWhileCommand(WhileCommandNode node);
	R visitLetCommand(LetCommandNode node);
	R visitDoIfCommand(DoIfCommandNode node);
	R visitRepeatCommand(RepeatCommandNode node);
	R visitSequentialCommand(SequentialCommandNode node);
	R visitBlankCommand(BlankCommandNode node);
	R visitErrorCommand(ErrorCommandNode node);

	// declarations
	R visitConstDeclaration(ConstDeclarationNode node);
	R visitVarDeclaration(VarDeclarationNode node);
	R visitSequentialDeclaration(SequentialDeclarationNode node);
	R visitErrorDeclaration(ErrorDeclarationNode node);

	// expressions
	R visitIntegerExpression(IntegerExpressionNode node);
	R visitCharacterExpression(CharacterExpressionNode node);
	R visitIdExpression(IdExpressionNode node);
	R visitCallExpression(CallExpressionNode node);
	R visitBinaryExpression(BinaryExpressionNode node);
	R visitUnaryExpression(UnaryExpressionNode node);
	R visitErrorExpression(ErrorExpressionNode node);

	// parameters
	R visitExpressionParameter(ExpressionParameterNode node);
	R visitVarParameter(VarParameterNode node);
	R visitBlankParameter(BlankParameterNode node);
	R visitErrorParameter(ErrorParameterNode node);

	// terminals
	R visitTypeDenoter(TypeDenoterNode node);
	R visitIdentifier(IdentifierNode node);
	R visitIntegerLiteral(IntegerLiteralNode node);
	R visitCharacterLiteral(CharacterLiteralNode node);
	R visitOperator(OperatorNode node);
}
