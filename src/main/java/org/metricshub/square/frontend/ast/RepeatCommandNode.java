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
 * A node corresponding to a repeat command: {@code repeat command while expression}.
 */
public final class RepeatCommandNode extends AstNode implements CommandNode {

	private final CommandNode command;
	private final ExpressionNode expression;

	/**
	 * <p>
	 * Constructor for RepeatCommandNode.
	 * </p>
	 *
	 * @param command the loop body
	 * @param expression the loop condition, tested after the body
	 * @param position where the content of the node begins
	 */
	public RepeatCommandNode(CommandNode command, ExpressionNode expression, Position position) {
		super(position);
		this.command = command;
		this.expression = expression;
	}

	/**
	 * @return the loop body
	 */
	public CommandNode getCommand() {
		return command;
	}

	/**
	 * @return the loop condition, tested after the body
	 */
	public ExpressionNode getExpression() {
		return expression;
	}

	/** {@inheritDoc} */
	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitRepeatCommand(this);
	}
}
