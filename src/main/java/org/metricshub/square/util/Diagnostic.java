package org.metricshub.square.util;

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
 * A positioned error message recorded by the {@link ErrorReporter}.
 */
public final class Diagnostic {

	/**
	 * The compilation phase that detected the error.
	 */
	public enum Kind {
		/** Unrecognized character, malformed character literal or lone {@code =}. */
		LEXICAL("Lexical"),
		/** No grammar alternative matched, or an expected token was missing. */
		SYNTAX("Syntax");

		private final String label;

		Kind(String label) {
			this.label = label;
		}

		public String getLabel() {
			return label;
		}
	}

	private final Kind kind;
	private final Position position;
	private final String message;

	public Diagnostic(Kind kind, Position position, String message) {
		this.kind = kind;
		this.position = position;
		this.message = message;
	}

	public Kind getKind() {
		return kind;
	}

	public Position getPosition() {
		return position;
	}

	public String getMessage() {
		return message;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return kind.getLabel() + " error at " + position + ": " + message;
	}
}
