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
 * A node corresponding to a do if command:
 * {@code do command if expression else command}. The condition follows the
 * first branch in the source text.
 */
public final class DoIfCommandNode extends AstNode implements CommandNode {

	private final CommandNode doCommand;
	private final ExpressionNode expression;
	private final CommandNode elseCommand;

	/**
	 * <p>
	 * Constructor for DoIfCommandNode.
	 * </p>
	 *
	 * @param doCommand the branch taken when the condition holds
	 * @param expression the condition
	 * @param elseCommand the branch taken otherwise
	 * @param position where the content of the node begins
	 */
	public DoIfCommandNode(CommandNode doCommand, ExpressionNode expression, CommandNode elseCommand, Position position) {
		super(position);
		this.doCommand = doCommand;
		this.expression = expression;
		this.elseCommand = elseCommand;
	}

	/**
	 * @return the branch taken when the condition holds
	 */
	public CommandNode getDoCommand() {
		return doCommand;
	}

	/**
	 * @return the condition
	 */
	public ExpressionNode getExpression() {
		return expression;
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
		return visitor.visitDoIfCommand(this);
	}
}
