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
import java.io.File;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import org.metricshub.square.frontend.Token;
import org.metricshub.square.frontend.ast.ProgramNode;
import org.metricshub.square.util.Diagnostic;
import org.metricshub.square.util.ScriptFileSource;
import org.metricshub.square.util.ScriptSource;
import org.metricshub.square.util.SquareLogger;
import org.metricshub.square.util.SquareSettings;
import org.slf4j.Logger;

/**
 * Command-line interface for Square.
 */
public final class Cli {

	private static final Logger LOGGER = SquareLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "square.jar";
		}
		JAR_NAME = myName;
	}

	private final SquareSettings settings = new SquareSettings();
	private final PrintStream out;
	private final PrintStream err;

	private ScriptSource scriptSource;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output and error streams.
	 */
	public Cli() {
		this(System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param out stream where tokens and syntax trees are written
	 * @param err stream where diagnostics are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
	}

	/**
	 * Returns the mutable {@link SquareSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public SquareSettings getSettings() {
		return settings;
	}

	/**
	 * @return the program specified on the command line, or {@code null}
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		// Parse the arguments
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: the remaining argument is the program file
				break;
			} else if (arg.equals("-f")) {
				// -f filename : load program from file
				checkParameterHasArgument(args, argIdx);
				setScriptSource(new ScriptFileSource(args[++argIdx]));
			} else if (arg.equals("-e")) {
				// -e text : program supplied on the command line
				checkParameterHasArgument(args, argIdx);
				setScriptSource(ScriptSource.fromString(args[++argIdx]));
			} else if (arg.equals("--dump-tokens")) {
				settings.setDumpTokens(true);
			} else if (arg.equals("--dump-syntax")) {
				settings.setDumpSyntaxTree(true);
			} else if (arg.equals("--no-dump-syntax")) {
				settings.setDumpSyntaxTree(false);
			} else if (arg.equals("--max-depth")) {
				// --max-depth N : limit nesting of commands and expressions
				checkParameterHasArgument(args, argIdx);
				settings.setMaxNestingDepth(parsePositiveInt(args[++argIdx]));
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (argIdx < args.length) {
			setScriptSource(new ScriptFileSource(args[argIdx++]));
		}
		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
		}
		if (scriptSource == null) {
			throw new IllegalArgumentException("Square program not provided.");
		}

		if (scriptSource instanceof ScriptFileSource) {
			ScriptFileSource fileSource = (ScriptFileSource) scriptSource;
			if (!fileSource.hasConventionalExtension()) {
				LOGGER.warn("{} does not have the {} extension", fileSource.getFilePath(), ScriptFileSource.EXTENSION);
			}
			if (!Files.isReadable(Paths.get(fileSource.getFilePath()))) {
				throw new IllegalArgumentException(
						"Failed to read program '" + fileSource.getDescription() + "': file is missing or not readable");
			}
		}
	}

	private void setScriptSource(ScriptSource source) {
		if (scriptSource != null) {
			throw new IllegalArgumentException("Only one Square program can be compiled at a time.");
		}
		scriptSource = source;
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static int parsePositiveInt(String value) {
		int result;
		try {
			result = Integer.parseInt(value);
		} catch (NumberFormatException nfe) {
			throw new IllegalArgumentException("Expecting a positive integer, got: " + value, nfe);
		}
		if (result <= 0) {
			throw new IllegalArgumentException("Expecting a positive integer, got: " + value);
		}
		return result;
	}

	/**
	 * Compiles the program specified by the previously parsed arguments and
	 * prints what was asked for.
	 *
	 * @throws SquareCompileException if the program has lexical or syntax errors
	 */
	public void run() {
		if (printUsage) {
			usage(out);
			return;
		}
		LOGGER.debug("Compiling {} with settings:\n{}", scriptSource, settings.toDescriptionString());
		Square square = new Square(settings);
		ProgramNode tree;
		try {
			tree = square.compile(scriptSource);
		} finally {
			if (settings.isDumpTokens()) {
				dumpTokens(square.getLastTokens());
			}
		}
		if (settings.isDumpSyntaxTree()) {
			tree.dump(out);
		}
		LOGGER.info("Compilation of {} completed successfully", scriptSource);
	}

	private void dumpTokens(List<Token> tokens) {
		for (Token token : tokens) {
			out.print(token + "\n");
		}
		out.flush();
	}

	/**
	 * Parses the arguments and runs, reporting failures on the error stream
	 * instead of throwing.
	 *
	 * @param args command-line arguments
	 * @return the process exit code: 0 on success, 1 otherwise
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public int execute(String[] args) {
		try {
			parse(args);
			run();
			return 0;
		} catch (SquareCompileException e) {
			for (Diagnostic diagnostic : e.getDiagnostics()) {
				err.println(diagnostic);
			}
			return 1;
		} catch (IllegalArgumentException e) {
			err.printf("Failed to parse arguments (%s). Please see the help/usage output (cmd line switch '-h').\n", e.getMessage());
			return 1;
		} catch (UncheckedIOException e) {
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return 1;
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [--dump-tokens]" +
								" [--dump-syntax|--no-dump-syntax]" +
								" [--max-depth N]" +
								" (-f program-filename | -e program-text | program-filename)");
		dest.println();
		dest.println(" -f filename = Compile the contents of filename (conventionally *.sq).");
		dest.println(" -e text = Compile the program text given on the command line.");
		dest.println(" --dump-tokens = Print the tokens of the program.");
		dest.println(" --dump-syntax = Print the syntax tree (default).");
		dest.println(" --no-dump-syntax = Do not print the syntax tree.");
		dest.println(" --max-depth N = Maximum nesting of commands and expressions (default "
				+ SquareSettings.DEFAULT_MAX_NESTING_DEPTH + ").");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param os output stream for tokens and trees
	 * @param es error stream for diagnostic messages
	 * @return configured and executed CLI instance
	 */
	public static Cli create(String[] args, PrintStream os, PrintStream es) {
		Cli cli = new Cli(os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		System.exit(new Cli().execute(args));
	}
}
