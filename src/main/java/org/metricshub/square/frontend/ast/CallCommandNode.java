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
 * A procedure call used as a command: {@code f(parameter)}.
 */
public final class CallCommandNode extends AstNode implements CommandNode {

	private final IdentifierNode identifier;
	private final ParameterNode parameter;

	/**
	 * <p>
	 * Constructor for CallCommandNode.
	 * </p>
	 *
	 * @param identifier the name of the called procedure
	 * @param parameter the single argument, possibly blank
	 * @param position where the content of the node begins
	 */
	public CallCommandNode(IdentifierNode identifier, ParameterNode parameter, Position position) {
		super(position);
		this.identifier = identifier;
		this.parameter = parameter;
	}

	/**
	 * @return the name of the called procedure
	 */
	public IdentifierNode getIdentifier() {
		return identifier;
	}

	/**
	 * @return the single argument, possibly blank
	 */
	public ParameterNode getParameter() {
		return parameter;
	}

	/** {@inheritDoc} */
	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitCallCommand(this);
	}
}
