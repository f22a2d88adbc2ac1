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

/**
 * A simple container for the parameters of a single Square compilation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Square programmatically, from within Java code.
 */
public class SquareSettings {

	/** Default value of {@link #getMaxNestingDepth()}. */
	public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

	/**
	 * How deeply commands and expressions may nest before the parser
	 * gives up on the nested construct and reports an error.
	 */
	private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

	/**
	 * Whether to print the token list;
	 * <code>false</code> by default.
	 */
	private boolean dumpTokens = false;

	/**
	 * Whether to print the syntax tree;
	 * <code>true</code> by default.
	 */
	private boolean dumpSyntaxTree = true;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("maxNestingDepth = ").append(getMaxNestingDepth()).append(newLine);
		desc.append("dumpTokens = ").append(isDumpTokens()).append(newLine);
		desc.append("dumpSyntaxTree = ").append(isDumpSyntaxTree()).append(newLine);

		return desc.toString();
	}

	public int getMaxNestingDepth() {
		return maxNestingDepth;
	}

	/**
	 * @param maxNestingDepth the new nesting limit
	 * @throws IllegalArgumentException if the limit is not positive
	 */
	public void setMaxNestingDepth(int maxNestingDepth) {
		if (maxNestingDepth <= 0) {
			throw new IllegalArgumentException("Maximum nesting depth must be positive: " + maxNestingDepth);
		}
		this.maxNestingDepth = maxNestingDepth;
	}

	public boolean isDumpTokens() {
		return dumpTokens;
	}

	public void setDumpTokens(boolean dumpTokens) {
		this.dumpTokens = dumpTokens;
	}

	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	public void setDumpSyntaxTree(boolean dumpSyntaxTree) {
		this.dumpSyntaxTree = dumpSyntaxTree;
	}
}
