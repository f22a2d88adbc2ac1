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
 * A node corresponding to an if command: {@code if expression command else command}.
 */
public final class IfCommandNode extends AstNode implements CommandNode {

	private final ExpressionNode expression;
	private final CommandNode thenCommand;
	private final CommandNode elseCommand;

	/**
	 * <p>
	 * Constructor for IfCommandNode.
	 * </p>
	 *
	 * @param expression the condition
	 * @param thenCommand the branch taken when the condition holds
	 * @param elseCommand the branch taken otherwise
	 * @param position where the content of the node begins
	 */
	public IfCommandNode(ExpressionNode expression, CommandNode thenCommand, CommandNode elseCommand, Position position) {
		super(position);
		this.expression = expression;
		this.thenCommand = thenCommand;
		this.elseCommand = elseCommand;
	}

	/**
	 * @return the condition
	 */
	public ExpressionNode getExpression() {
		return expression;
	}

	/**
	 * @return the branch taken when the condition holds
	 */
	public CommandNode getThenCommand() {
		return thenCommand;
	}

	/**
	 * @return the branch taken otherwise
	 */
	public CommandNode getElseCommand() {
		return elseCommand;
	}

	/** {@inheritDoc} */
	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitIfCommand(this);
	}
}
