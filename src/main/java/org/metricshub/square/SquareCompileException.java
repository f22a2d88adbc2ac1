package org.metricshub.square;

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
import org.metricshub.square.util.Diagnostic;

/**
 * Thrown by {@link Square#compile(org.metricshub.square.util.ScriptSource)}
 * when scanning or parsing reported at least one error. It carries every
 * diagnostic recorded up to the failing phase.
 */
public class SquareCompileException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final transient List<Diagnostic> diagnostics;

	/**
	 * <p>
	 * Constructor for SquareCompileException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 * @param diagnostics the errors that made the compilation fail, never empty
	 */
	public SquareCompileException(String msg, List<Diagnostic> diagnostics) {
		super(msg + ": " + diagnostics.size() + " error(s), first: " + diagnostics.get(0));
		this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
	}

	/**
	 * @return the errors, in the order they were reported
	 */
	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	/**
	 * Returns the position of the first error.
	 *
	 * @return where the first offending input starts
	 */
	public Position getPosition() {
		return diagnostics.get(0).getPosition();
	}
}
