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
 * A command assigning the value of an expression to a named variable:
 * {@code x ~ expression}.
 */
public final class AssignCommandNode extends AstNode implements CommandNode {

	private final IdentifierNode identifier;
	private final ExpressionNode expression;

	/**
	 * <p>
	 * Constructor for AssignCommandNode.
	 * </p>
	 *
	 * @param identifier the variable being assigned
	 * @param expression the value assigned
	 * @param position where the content of the node begins
	 */
	public AssignCommandNode(IdentifierNode identifier, ExpressionNode expression, Position position) {
		super(position);
		this.identifier = identifier;
		this.expression = expression;
	}

	/**
	 * @return the variable being assigned
	 */
	public IdentifierNode getIdentifier() {
		return identifier;
	}

	/**
	 * @return the value assigned
	 */
	public ExpressionNode getExpression() {
		return expression;
	}

	/** {@inheritDoc} */
	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitAssignCommand(this);
	}
}
