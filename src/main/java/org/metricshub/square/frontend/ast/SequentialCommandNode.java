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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.square.frontend.Position;

/**
 * Two or more commands separated by {@code ;} or {@code .}, executed in
 * order. The parser never builds one around a single command.
 */
public final class SequentialCommandNode extends AstNode implements CommandNode {

	private final List<CommandNode> commands;

	/**
	 * <p>
	 * Constructor for SequentialCommandNode.
	 * </p>
	 *
	 * @param commands the commands, in source order
	 * @param position where the first command begins
	 */
	public SequentialCommandNode(List<CommandNode> commands, Position position) {
		super(position);
		this.commands = Collections.unmodifiableList(new ArrayList<CommandNode>(commands));
	}

	/**
	 * @return the commands, in source order
	 */
	public List<CommandNode> getCommands() {
		return commands;
	}

	/** {@inheritDoc} */
	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitSequentialCommand(this);
	}
}
