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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.square.frontend.Position;
import org.slf4j.Logger;

/**
 * Collects the diagnostics produced while scanning and parsing one program.
 * <p>
 * Neither the tokenizer nor the parser stops on an error; they record it
 * here and carry on, so the driver must check {@link #hasErrors()} after
 * each phase before trusting its output.
 */
public class ErrorReporter {

	private static final Logger LOGGER = SquareLogger.getLogger(ErrorReporter.class);

	private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

	/**
	 * Records an error.
	 *
	 * @param kind phase that detected the error
	 * @param position where the offending input starts
	 * @param message description of the error
	 */
	public void reportError(Diagnostic.Kind kind, Position position, String message) {
		Diagnostic diagnostic = new Diagnostic(kind, position, message);
		diagnostics.add(diagnostic);
		LOGGER.debug("{}", diagnostic);
	}

	/**
	 * @return {@code true} if at least one error has been recorded
	 */
	public boolean hasErrors() {
		return !diagnostics.isEmpty();
	}

	public int getErrorCount() {
		return diagnostics.size();
	}

	/**
	 * @return the recorded diagnostics, in the order they were reported
	 */
	public List<Diagnostic> getDiagnostics() {
		return Collections.unmodifiableList(diagnostics);
	}
}
