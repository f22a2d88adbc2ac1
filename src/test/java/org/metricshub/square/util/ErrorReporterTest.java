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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.List;
import org.junit.Test;
import org.metricshub.square.frontend.Position;

public class ErrorReporterTest {

	@Test
	public void testCollectsInOrder() throws Exception {
		ErrorReporter reporter = new ErrorReporter();
		assertFalse(reporter.hasErrors());
		assertEquals(0, reporter.getErrorCount());

		reporter.reportError(Diagnostic.Kind.LEXICAL, new Position(1, 2), "Invalid character: $");
		reporter.reportError(Diagnostic.Kind.SYNTAX, new Position(3, 4), "Expecting a command. Found: IS (~)");

		assertTrue(reporter.hasErrors());
		assertEquals(2, reporter.getErrorCount());
		List<Diagnostic> diagnostics = reporter.getDiagnostics();
		assertEquals("Lexical error at Line 1, Column 2: Invalid character: $", diagnostics.get(0).toString());
		assertEquals(
				"Syntax error at Line 3, Column 4: Expecting a command. Found: IS (~)",
				diagnostics.get(1).toString());
	}

	@Test
	public void testDiagnosticsAreReadOnly() throws Exception {
		ErrorReporter reporter = new ErrorReporter();
		reporter.reportError(Diagnostic.Kind.SYNTAX, Position.BUILT_IN, "oops");
		assertThrows(UnsupportedOperationException.class, () -> reporter.getDiagnostics().clear());
		assertEquals("Syntax error at System defined: oops", reporter.getDiagnostics().get(0).toString());
	}
}
