package org.metricshub.square.frontend;

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
 * A lexical unit produced by the {@link Tokenizer}: its kind, the exact
 * characters it was scanned from, and where it starts.
 */
public final class Token {

	private final TokenType type;
	private final String spelling;
	private final Position position;

	/**
	 * <p>
	 * Constructor for Token.
	 * </p>
	 *
	 * @param type the token kind
	 * @param spelling the characters of the token
	 * @param position where the token starts
	 */
	public Token(TokenType type, String spelling, Position position) {
		this.type = type;
		this.spelling = spelling;
		this.position = position;
	}

	public TokenType getType() {
		return type;
	}

	public String getSpelling() {
		return spelling;
	}

	public Position getPosition() {
		return position;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return "type=" + type + ", spelling=\"" + spelling + "\", position=" + position;
	}
}
