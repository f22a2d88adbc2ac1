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
 * Location in the source text where a token or syntax tree node begins.
 * Lines and columns are both 1-based.
 * <p>
 * {@link #BUILT_IN} marks content that does not come from the source text,
 * such as nodes synthesized by the compiler itself.
 */
public final class Position {

	/** Sentinel for content that is not taken from the source text. */
	public static final Position BUILT_IN = new Position(-1, -1);

	private final int lineNumber;
	private final int columnNumber;

	/**
	 * Creates a position.
	 *
	 * @param lineNumber 1-based line number
	 * @param columnNumber 1-based column number
	 */
	public Position(int lineNumber, int columnNumber) {
		this.lineNumber = lineNumber;
		this.columnNumber = columnNumber;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public int getColumnNumber() {
		return columnNumber;
	}

	public boolean isBuiltIn() {
		return equals(BUILT_IN);
	}

	/** {@inheritDoc} */
	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof Position)) {
			return false;
		}
		Position that = (Position) other;
		return lineNumber == that.lineNumber && columnNumber == that.columnNumber;
	}

	/** {@inheritDoc} */
	@Override
	public int hashCode() {
		return 31 * lineNumber + columnNumber;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		if (isBuiltIn()) {
			return "System defined";
		}
		return "Line " + lineNumber + ", Column " + columnNumber;
	}
}
