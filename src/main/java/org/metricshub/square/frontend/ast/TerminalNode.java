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

import org.metricshub.square.frontend.Token;

/**
 * A leaf of the syntax tree that wraps the token it was parsed from.
 * <p>
 * When the parser expects a terminal but finds another kind of token, it
 * reports a syntax error and still wraps the token it found, without
 * consuming it. The same token may then back several terminals, so check
 * {@link Token#getType()} before trusting {@link #getSpelling()} in a tree
 * built from a program with errors.
 */
public abstract class TerminalNode extends AstNode {

	private final Token token;

	protected TerminalNode(Token token) {
		super(token.getPosition());
		this.token = token;
	}

	public Token getToken() {
		return token;
	}

	/**
	 * @return the characters of the underlying token
	 */
	public String getSpelling() {
		return token.getSpelling();
	}
}
