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
 * Introduces declarations scoped to one command: {@code let declaration in command}.
 */
public final class LetCommandNode extends AstNode implements CommandNode {

	private final DeclarationNode declaration;
	private final CommandNode command;

	/**
	 * <p>
	 * Constructor for LetCommandNode.
	 * </p>
	 *
	 * @param declaration the declarations, possibly sequential
	 * @param command the command the declarations are visible in
	 * @param position where the content of the node begins
	 */
	public LetCommandNode(DeclarationNode declaration, CommandNode command, Position position) {
		super(position);
		this.declaration = declaration;
		this.command = command;
	}

	/**
	 * @return the declarations, possibly sequential
	 */
	public DeclarationNode getDeclaration() {
		return declaration;
	}

	/**
	 * @return the command the declarations are visible in
	 */
	public CommandNode getCommand() {
		return command;
	}

	/** {@inheritDoc} */
	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitLetCommand(this);
	}
}
