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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.square.util.Diagnostic;
import org.metricshub.square.util.ErrorReporter;
import org.metricshub.square.util.SquareLogger;
import org.slf4j.Logger;

/**
 * Converts the characters of a Square program into tokens.
 * <p>
 * Scanning never stops on malformed input: an unrecognized character, a
 * malformed character literal or a lone {@code =} becomes an
 * {@link TokenType#ERROR} token (reported to the {@link ErrorReporter})
 * and scanning continues with the next character.
 * <p>
 * A tokenizer reads its {@link SourceReader} once; create a new one for
 * every program.
 */
public class Tokenizer {

	private static final Logger LOGGER = SquareLogger.getLogger(Tokenizer.class);

	/** Starts a comment running to the end of the line. */
	private static final char COMMENT_MARKER = '@';

	private static final String NOP_SPELLING = "nop";

	private final SourceReader reader;
	private final ErrorReporter reporter;

	private final StringBuilder text = new StringBuilder();
	private String errorMessage;

	/**
	 * <p>
	 * Constructor for Tokenizer.
	 * </p>
	 *
	 * @param reader the characters to scan
	 * @param reporter where lexical errors are recorded
	 */
	public Tokenizer(SourceReader reader, ErrorReporter reporter) {
		this.reader = reader;
		this.reporter = reporter;
	}

	/**
	 * Scans the whole program and closes the reader.
	 *
	 * @return the tokens, terminated by exactly one {@link TokenType#END_OF_TEXT} token
	 */
	public List<Token> getAllTokens() {
		List<Token> tokens = new ArrayList<Token>();
		try {
			Token token = nextToken();
			while (token.getType() != TokenType.END_OF_TEXT) {
				tokens.add(token);
				token = nextToken();
			}
			tokens.add(token);
		} finally {
			reader.close();
		}
		return tokens;
	}

	private Token nextToken() {
		skipSeparators();

		Position start = reader.getCurrentPosition();
		TokenType type = scanToken();
		Token token = new Token(type, text.toString(), start);
		LOGGER.trace("Scanned {}", token);

		if (type == TokenType.ERROR) {
			reporter.reportError(Diagnostic.Kind.LEXICAL, start, errorMessage + ": " + token.getSpelling());
		}
		return token;
	}

	/**
	 * Skip all whitespaces and comments
	 */
	private void skipSeparators() {
		while (isWhitespace(reader.current()) || reader.current() == COMMENT_MARKER) {
			if (reader.current() == COMMENT_MARKER) {
				reader.skipRestOfLine();
			} else {
				reader.moveNext();
			}
		}
	}

	private TokenType scanToken() {
		text.setLength(0);
		errorMessage = null;
		char c = reader.current();

		if (Character.isLetter(c)) {
			takeIt();
			while (isLetterDashDigit(reader.current())) {
				takeIt();
			}
			if (TokenType.isKeyword(text)) {
				return TokenType.forKeyword(text);
			}
			if (isNop(text)) {
				return TokenType.NOP;
			}
			return TokenType.IDENTIFIER;
		}

		if (isDigit(c)) {
			// a leading zero is a complete literal on its own
			if (c == '0') {
				takeIt();
				return TokenType.INT_LITERAL;
			}
			takeIt();
			while (isDigit(reader.current())) {
				takeIt();
			}
			return TokenType.INT_LITERAL;
		}

		if (c == '\'') {
			takeIt();
			if (isLetterOrSpace(reader.current())) {
				takeIt();
			}
			if (reader.current() == '\'') {
				takeIt();
				return TokenType.CHAR_LITERAL;
			}
			errorMessage = "Malformed character literal";
			return TokenType.ERROR;
		}

		if (isOperator(c)) {
			takeIt();
			return TokenType.OPERATOR;
		}

		if (c == '=') {
			takeIt();
			if (reader.current() == '=') {
				takeIt();
				return TokenType.OPERATOR;
			}
			errorMessage = "Use == for equality";
			return TokenType.ERROR;
		}

		if (c == ';') {
			takeIt();
			return TokenType.SEMICOLON;
		}
		if (c == '.') {
			takeIt();
			return TokenType.FULL_STOP;
		}
		if (c == '~') {
			takeIt();
			return TokenType.IS;
		}
		if (c == '(') {
			takeIt();
			return TokenType.LEFT_BRACKET;
		}
		if (c == ')') {
			takeIt();
			return TokenType.RIGHT_BRACKET;
		}
		if (c == '[') {
			takeIt();
			return TokenType.LEFT_SQUARE_BRACKET;
		}
		if (c == ']') {
			takeIt();
			return TokenType.RIGHT_SQUARE_BRACKET;
		}

		if (c == SourceReader.END_OF_TEXT) {
			return TokenType.END_OF_TEXT;
		}

		takeIt();
		errorMessage = "Invalid character";
		return TokenType.ERROR;
	}

	private void takeIt() {
		text.append(reader.current());
		reader.moveNext();
	}

	/**
	 * Matches {@code nop} against an already scanned word, one character at a
	 * time.
	 */
	private static boolean isNop(CharSequence word) {
		int state = 0;
		for (int i = 0; i < word.length(); i++) {
			if (state < NOP_SPELLING.length() && word.charAt(i) == NOP_SPELLING.charAt(state)) {
				state++;
			} else {
				return false;
			}
		}
		return state == NOP_SPELLING.length();
	}

	private static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n';
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isOperator(char c) {
		switch (c) {
		case '+':
		case '-':
		case '*':
		case '/':
		case '<':
		case '>':
		case '\\':
			return true;
		default:
			return false;
		}
	}

	private static boolean isLetterDashDigit(char c) {
		return Character.isLetter(c) || c == '-' || isDigit(c);
	}

	private static boolean isLetterOrSpace(char c) {
		return Character.isLetter(c) || c == ' ';
	}
}
