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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reusable helpers for building and executing {@link Cli} tests. The class
 * exposes a fluent builder ({@link #cliTest(String)}) that lets tests describe
 * their arguments, program files and expectations declaratively before
 * executing or asserting the results.
 */
public final class SquareTestSupport {

	private static final Path SHARED_TEMP_DIR;

	static {
		try {
			SHARED_TEMP_DIR = Files.createTempDirectory("square-shared");
			SHARED_TEMP_DIR.toFile().deleteOnExit();
		} catch (IOException ex) {
			throw new ExceptionInInitializerError(ex);
		}
	}

	private SquareTestSupport() {}

	/**
	 * Creates a builder for a unit test that exercises the {@link Cli} entry
	 * point. The builder records all inputs and expectations before invoking the
	 * CLI.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * Writes a program to a new <code>*.sq</code> file of the shared temporary
	 * directory.
	 *
	 * @param contents the program text
	 * @return the path of the file
	 * @throws IOException if the file cannot be written
	 */
	public static Path programFile(String contents) throws IOException {
		return programFile(contents, ".sq");
	}

	/**
	 * Writes a program to a new file of the shared temporary directory.
	 *
	 * @param contents the program text
	 * @param suffix the file name suffix, such as <code>.txt</code>
	 * @return the path of the file
	 * @throws IOException if the file cannot be written
	 */
	public static Path programFile(String contents, String suffix) throws IOException {
		Path file = Files.createTempFile(SHARED_TEMP_DIR, "program", suffix);
		Files.write(file, contents.getBytes(StandardCharsets.UTF_8));
		file.toFile().deleteOnExit();
		return file;
	}

	/**
	 * Captures the outcome of executing a configured test including the raw
	 * output, error output and exit code, along with the expectations
	 * configured on the builder.
	 */
	public static final class TestResult {
		private final String description;
		private final String output;
		private final String errorOutput;
		private final int exitCode;
		private final List<String> expectedLines;
		private final List<String> expectedErrorFragments;
		private final int expectedExitCode;

		TestResult(
				String description,
				String output,
				String errorOutput,
				int exitCode,
				List<String> expectedLines,
				List<String> expectedErrorFragments,
				int expectedExitCode) {
			this.description = description;
			this.output = output;
			this.errorOutput = errorOutput;
			this.exitCode = exitCode;
			this.expectedLines = expectedLines;
			this.expectedErrorFragments = expectedErrorFragments;
			this.expectedExitCode = expectedExitCode;
		}

		public String output() {
			return output;
		}

		public String errorOutput() {
			return errorOutput;
		}

		public int exitCode() {
			return exitCode;
		}

		/**
		 * Returns the captured output split into individual lines. Trailing
		 * newline characters are ignored and Windows style line endings are
		 * normalised.
		 *
		 * @return the output split into lines
		 */
		public List<String> lines() {
			if (output.isEmpty()) {
				return Collections.emptyList();
			}
			String normalized = output.replace("\r\n", "\n");
			if (normalized.endsWith("\n")) {
				normalized = normalized.substring(0, normalized.length() - 1);
			}
			return Arrays.asList(normalized.split("\n", -1));
		}

		/**
		 * Verifies that the captured output and exit code match the
		 * expectations defined in the builder.
		 */
		public void assertExpected() {
			assertEquals("Unexpected exit code for " + description, expectedExitCode, exitCode);
			if (expectedLines != null) {
				assertEquals("Unexpected output for " + description, expectedLines, lines());
			}
			for (String fragment : expectedErrorFragments) {
				assertTrue(
						"Error output of " + description + " should contain '" + fragment + "' but was: " + errorOutput,
						errorOutput.contains(fragment));
			}
		}
	}

	/**
	 * Fluent builder for tests that execute the {@link Cli}.
	 */
	public static final class CliTestBuilder {
		private final String description;
		private final List<String> args = new ArrayList<String>();
		private List<String> expectedLines;
		private final List<String> expectedErrorFragments = new ArrayList<String>();
		private int expectedExitCode;

		private CliTestBuilder(String description) {
			this.description = description;
		}

		/**
		 * Appends raw command line arguments.
		 *
		 * @param arguments the arguments to append
		 * @return this builder for method chaining
		 */
		public CliTestBuilder argument(String... arguments) {
			args.addAll(Arrays.asList(arguments));
			return this;
		}

		/**
		 * Writes the program to a temporary <code>*.sq</code> file and appends
		 * its path as the program file argument.
		 *
		 * @param program the program text
		 * @return this builder for method chaining
		 * @throws IOException if the file cannot be written
		 */
		public CliTestBuilder program(String program) throws IOException {
			args.add(programFile(program).toString());
			return this;
		}

		public CliTestBuilder expectLines(String... lines) {
			expectedLines = Arrays.asList(lines);
			return this;
		}

		public CliTestBuilder expectErrorContaining(String fragment) {
			expectedErrorFragments.add(fragment);
			return this;
		}

		public CliTestBuilder expectExit(int code) {
			expectedExitCode = code;
			return this;
		}

		/**
		 * Executes the CLI and captures its streams.
		 *
		 * @return the captured result, not yet asserted
		 * @throws Exception when executing the test fails unexpectedly
		 */
		public TestResult run() throws Exception {
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			ByteArrayOutputStream err = new ByteArrayOutputStream();
			int exitCode;
			try (PrintStream outStream = new PrintStream(out, true, StandardCharsets.UTF_8.name());
					PrintStream errStream = new PrintStream(err, true, StandardCharsets.UTF_8.name())) {
				exitCode = new Cli(outStream, errStream).execute(args.toArray(new String[0]));
			}
			return new TestResult(
					description,
					out.toString(StandardCharsets.UTF_8.name()),
					err.toString(StandardCharsets.UTF_8.name()),
					exitCode,
					expectedLines,
					expectedErrorFragments,
					expectedExitCode);
		}

		public void runAndAssert() throws Exception {
			run().assertExpected();
		}
	}
}
