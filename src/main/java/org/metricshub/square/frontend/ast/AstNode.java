package org.metricshub.square.frontend.ast;

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

import java.io.PrintStream;
import org.metricshub.square.frontend.Position;

/**
 * Base class of every node of the syntax tree.
 * <p>
 * Nodes are immutable: children and position are set by the constructor
 * and never change. Each node is owned by exactly one parent.
 */
public abstract class AstNode {

	private final Position position;

	protected AstNode(Position position) {
		this.position = position;
	}

	/**
	 * @return where the content of this node begins in the source text
	 */
	public final Position getPosition() {
		return position;
	}

	/**
	 * Dispatches to the method of {@code visitor} handling this node class.
	 *
	 * @param visitor the operation to apply
	 * @param <R> result type of the operation
	 * @return what the visitor returned
	 */
	public abstract <R> R accept(NodeVisitor<R> visitor);

	/**
	 * Prints this node and its descendants, one node per line.
	 *
	 * @param out where to print
	 */
	public void dump(PrintStream out) {
		new TreePrinter(out).print(this);
	}
}
