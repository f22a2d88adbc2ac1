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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.Test;
import org.metricshub.square.util.ScriptSource;

public class ScriptSourceReaderTest {

	@Test
	public void testPositionsAcrossLines() throws Exception {
		SourceReader reader = new ScriptSourceReader(ScriptSource.fromString("ab\r\ncd"));
		assertEquals('a', reader.current());
		assertEquals(new Position(1, 1), reader.getCurrentPosition());
		reader.moveNext();
		assertEquals('b', reader.current());
		assertEquals(new Position(1, 2), reader.getCurrentPosition());
		reader.moveNext();
		assertEquals("carriage return is bypassed", '\n', reader.current());
		assertEquals(new Position(1, 3), reader.getCurrentPosition());
		reader.moveNext();
		assertEquals('c', reader.current());
		assertEquals(new Position(2, 1), reader.getCurrentPosition());
		reader.close();
	}

	@Test
	public void testEndOfTextIsSticky() throws Exception {
		SourceReader reader = new ScriptSourceReader(ScriptSource.fromString("x"));
		reader.moveNext();
		assertEquals(SourceReader.END_OF_TEXT, reader.current());
		Position end = reader.getCurrentPosition();
		reader.moveNext();
		reader.moveNext();
		assertEquals(SourceReader.END_OF_TEXT, reader.current());
		assertEquals(end, reader.getCurrentPosition());
	}

	@Test
	public void testSkipRestOfLine() throws Exception {
		SourceReader reader = new ScriptSourceReader(ScriptSource.fromString("@ comment\nz"));
		reader.skipRestOfLine();
		assertEquals('\n', reader.current());
		reader.moveNext();
		assertEquals('z', reader.current());

		reader = new ScriptSourceReader(ScriptSource.fromString("@ last line"));
		reader.skipRestOfLine();
		assertEquals(SourceReader.END_OF_TEXT, reader.current());
		assertEquals(new Position(1, 12), reader.getCurrentPosition());
	}

	@Test
	public void testReaderIsClosedWhenFirstReadFails() throws Exception {
		AtomicBoolean closed = new AtomicBoolean();
		Reader broken = new Reader() {
			@Override
			public int read(char[] buffer, int offset, int length) throws IOException {
				throw new IOException("Input/output error");
			}

			@Override
			public void close() {
				closed.set(true);
			}
		};
		UncheckedIOException e = assertThrows(
				UncheckedIOException.class,
				() -> new ScriptSourceReader(new ScriptSource("broken.sq", broken)));
		assertEquals("Failed to read broken.sq", e.getMessage());
		assertTrue("reader must be closed", closed.get());
	}
}
