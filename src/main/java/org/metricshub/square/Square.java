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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Collections;
import java.util.List;
import org.metricshub.square.frontend.ScriptSourceReader;
import org.metricshub.square.frontend.SquareParser;
import org.metricshub.square.frontend.Token;
import org.metricshub.square.frontend.Tokenizer;
import org.metricshub.square.frontend.ast.ProgramNode;
import org.metricshub.square.util.ErrorReporter;
import org.metricshub.square.util.ScriptSource;
import org.metricshub.square.util.SquareLogger;
import org.metricshub.square.util.SquareSettings;
import org.slf4j.Logger;

/**
 * Entry point into the scanning and parsing of a Square program.
 * This entry point is used both when Square is used as a library and when
 * invoked from the command line.
 * <p>
 * The front end works in two phases:
 * <ul>
 * <li>Scan the program text, producing a list of tokens.
 * <li>Parse the tokens, producing an abstract syntax tree.
 * </ul>
 * Neither phase stops on malformed input; errors are recorded in an
 * {@link ErrorReporter}. {@link #compile(ScriptSource)} checks the reporter
 * after each phase and fails if anything was recorded, while
 * {@link #parse(ScriptSource)} returns the best-effort tree regardless.
 */
public class Square {

	private static final Logger LOGGER = SquareLogger.getLogger(Square.class);

	private final SquareSettings settings;

	private ErrorReporter lastReporter;
	private List<Token> lastTokens;
	private ProgramNode lastAst;

	/**
	 * Create a new instance of Square with default settings
	 */
	public Square() {
		this(new SquareSettings());
	}

	/**
	 * @param settings settings applied to every program handled by this instance
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Square(SquareSettings settings) {
		this.settings = settings;
	}

	/**
	 * Scans a program.
	 *
	 * @param source the program
	 * @return its tokens, terminated by exactly one end-of-text token
	 */
	public List<Token> tokenize(ScriptSource source) {
		lastReporter = new ErrorReporter();
		lastAst = null;
		lastTokens = scan(source, lastReporter);
		return lastTokens;
	}

	/**
	 * Scans and parses a program, without checking for errors.
	 *
	 * @param source the program
	 * @return the syntax tree, possibly containing error nodes
	 */
	public ProgramNode parse(ScriptSource source) {
		lastReporter = new ErrorReporter();
		lastTokens = scan(source, lastReporter);
		lastAst = new SquareParser(lastReporter, settings).parse(lastTokens);
		return lastAst;
	}

	/**
	 * Scans and parses a program, failing if either phase reports an error.
	 *
	 * @param source the program
	 * @return the syntax tree, free of error nodes
	 * @throws SquareCompileException if scanning or parsing reported errors
	 */
	public ProgramNode compile(ScriptSource source) {
		lastReporter = new ErrorReporter();
		lastAst = null;

		LOGGER.debug("Tokenizing {}", source);
		lastTokens = scan(source, lastReporter);
		if (lastReporter.hasErrors()) {
			throw new SquareCompileException("Tokenizing " + source + " failed", lastReporter.getDiagnostics());
		}

		LOGGER.debug("Parsing {}", source);
		ProgramNode tree = new SquareParser(lastReporter, settings).parse(lastTokens);
		if (lastReporter.hasErrors()) {
			throw new SquareCompileException("Parsing " + source + " failed", lastReporter.getDiagnostics());
		}
		lastAst = tree;
		return tree;
	}

	/**
	 * Compiles program text supplied as a string.
	 *
	 * @param program the program text
	 * @return the syntax tree
	 * @throws SquareCompileException if scanning or parsing reported errors
	 */
	public ProgramNode compile(String program) {
		return compile(ScriptSource.fromString(program));
	}

	private static List<Token> scan(ScriptSource source, ErrorReporter reporter) {
		return new Tokenizer(new ScriptSourceReader(source), reporter).getAllTokens();
	}

	/**
	 * @return the reporter of the last program handled, or {@code null} if none
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ErrorReporter getLastReporter() {
		return lastReporter;
	}

	/**
	 * @return the tokens of the last program handled, or an empty list if none
	 */
	public List<Token> getLastTokens() {
		return lastTokens == null ? Collections.<Token>emptyList() : Collections.unmodifiableList(lastTokens);
	}

	/**
	 * Returns the last tree produced by {@link #parse(ScriptSource)} or a
	 * successful {@link #compile(ScriptSource)}.
	 *
	 * @return the last {@link ProgramNode}, or {@code null}
	 */
	public ProgramNode getLastAst() {
		return lastAst;
	}
}
