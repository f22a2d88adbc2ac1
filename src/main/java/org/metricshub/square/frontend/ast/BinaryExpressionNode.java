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

import org.metricshub.square.frontend.Position;

/**
 * An infix operation. All operators share one precedence level and
 * associate to the left, so {@code a + b * c} is {@code (a + b) * c}.
 */
public final class BinaryExpressionNode extends AstNode implements ExpressionNode {

	private final ExpressionNode leftExpression;
	private final OperatorNode operator;
	private final ExpressionNode rightExpression;

	/**
	 * <p>
	 * Constructor for BinaryExpressionNode.
	 * </p>
	 *
	 * @param leftExpression the left operand
	 * @param operator the operator
	 * @param rightExpression the right operand
	 * @param position where the content of the node begins
	 */
	public BinaryExpressionNode(ExpressionNode leftExpression, OperatorNode operator, ExpressionNode rightExpression, Position position) {
		super(position);
		this.leftExpression = leftExpression;
		this.operator = operator;
		this.rightExpression = rightExpression;
	}

	/**
	 * @return the left operand
	 */
	public ExpressionNode getLeftExpression() {
		return leftExpression;
	}

	/**
	 * @return the operator
	 */
	public OperatorNode getOperator() {
		return operator;
	}

	/**
	 * @return the right operand
	 */
	public ExpressionNode getRightExpression() {
		return rightExpression;
	}

	/** {@inheritDoc} */
	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitBinaryExpression(this);
	}
}
