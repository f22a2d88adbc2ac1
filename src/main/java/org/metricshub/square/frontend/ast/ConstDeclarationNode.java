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
 * Declares a named constant: {@code const type name ~ expression}.
 */
public final class ConstDeclarationNode extends AstNode implements DeclarationNode {

	private final TypeDenoterNode typeDenoter;
	private final IdentifierNode identifier;
	private final ExpressionNode expression;

	/**
	 * <p>
	 * Constructor for ConstDeclarationNode.
	 * </p>
	 *
	 * @param typeDenoter the declared type
	 * @param identifier the constant name
	 * @param expression the initializing expression
	 * @param position where the content of the node begins
	 */
	public ConstDeclarationNode(TypeDenoterNode typeDenoter, IdentifierNode identifier, ExpressionNode expression, Position position) {
		super(position);
		this.typeDenoter = typeDenoter;
		this.identifier = identifier;
		this.expression = expression;
	}

	/**
	 * @return the declared type
	 */
	public TypeDenoterNode getTypeDenoter() {
		return typeDenoter;
	}

	/**
	 * @return the constant name
	 */
	public IdentifierNode getIdentifier() {
		return identifier;
	}

	/**
	 * @return the initializing expression
	 */
	public ExpressionNode getExpression() {
		return expression;
	}

	/** {@inheritDoc} */
	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitConstDeclaration(this);
	}
}
