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

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import org.metricshub.square.util.ScriptSource;

/**
 * {@link SourceReader} over the reader of a {@link ScriptSource}.
 * Carriage returns are bypassed entirely.
 */
public class ScriptSourceReader implements SourceReader {

	private final ScriptSource source;
	private final Reader reader;
	private int c;
	private int lineNumber = 1;
	private int columnNumber = 1;

	/**
	 * Opens the source and reads its first character.
	 *
	 * @param source the program to read
	 */
	public ScriptSourceReader(ScriptSource source) {
		this.source = source;
		try {
			this.reader = source.getReader();
		} catch (IOException ex) {
			throw new UncheckedIOException("Failed to open " + source.getDescription(), ex);
		}
		try {
			read();
		} catch (UncheckedIOException ex) {
			try {
				reader.close();
			} catch (IOException closeEx) {
				ex.addSuppressed(closeEx);
			}
			throw ex;
		}
	}

	private void read() {
		try {
			c = reader.read();
			// completely bypass \r's
			while (c == '\r') {
				c = reader.read();
			}
		} catch (IOException ex) {
			throw new UncheckedIOException("Failed to read " + source.getDescription(), ex);
		}
	}

	/** {@inheritDoc} */
	@Override
	public char current() {
		return c < 0 ? END_OF_TEXT : (char) c;
	}

	/** {@inheritDoc} */
	@Override
	public void moveNext() {
		if (c < 0) {
			return;
		}
		if (c == '\n') {
			lineNumber++;
			columnNumber = 1;
		} else {
			columnNumber++;
		}
		read();
	}

	/** {@inheritDoc} */
	@Override
	public void skipRestOfLine() {
		while (c >= 0 && c != '\n') {
			moveNext();
		}
	}

	/** {@inheritDoc} */
	@Override
	public Position getCurrentPosition() {
		return new Position(lineNumber, columnNumber);
	}

	/** {@inheritDoc} */
	@Override
	public void close() {
		try {
			reader.close();
		} catch (IOException ex) {
			throw new UncheckedIOException("Failed to close " + source.getDescription(), ex);
		}
	}
}
