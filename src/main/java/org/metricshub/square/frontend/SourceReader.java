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
 * Pull-based access to the characters of a program, one at a time.
 * <p>
 * The end of the input is signaled by {@link #END_OF_TEXT} rather than by
 * an explicit end-of-stream call.
 */
public interface SourceReader {

	/** Sentinel returned by {@link #current()} once the input is exhausted. */
	char END_OF_TEXT = '\0';

	/**
	 * @return the character at the read position, or {@link #END_OF_TEXT}
	 */
	char current();

	/**
	 * Advances the read position by one character. Does nothing at the end
	 * of the input.
	 */
	void moveNext();

	/**
	 * Advances the read position to the newline ending the current line,
	 * or to the end of the input.
	 */
	void skipRestOfLine();

	/**
	 * @return the position of {@link #current()}
	 */
	Position getCurrentPosition();

	/**
	 * Releases the underlying resource.
	 */
	void close();
}
