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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class PositionTest {

	@Test
	public void testToString() throws Exception {
		assertEquals("Line 3, Column 14", new Position(3, 14).toString());
		assertEquals("System defined", Position.BUILT_IN.toString());
	}

	@Test
	public void testBuiltIn() throws Exception {
		assertTrue(Position.BUILT_IN.isBuiltIn());
		assertTrue(new Position(-1, -1).isBuiltIn());
		assertFalse(new Position(1, 1).isBuiltIn());
	}

	@Test
	public void testEquality() throws Exception {
		assertEquals(new Position(2, 5), new Position(2, 5));
		assertEquals(new Position(2, 5).hashCode(), new Position(2, 5).hashCode());
		assertNotEquals(new Position(2, 5), new Position(5, 2));
		assertNotEquals(new Position(2, 5), Position.BUILT_IN);
	}

	@Test
	public void testTokenToString() throws Exception {
		Token token = new Token(TokenType.IDENTIFIER, "x-1", new Position(1, 7));
		assertEquals("type=IDENTIFIER, spelling=\"x-1\", position=Line 1, Column 7", token.toString());
	}
}
