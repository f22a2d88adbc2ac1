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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Lexer token kinds of the Square language.
 */
public enum TokenType {
	// terminals with a variable spelling
	INT_LITERAL,
	IDENTIFIER,
	CHAR_LITERAL,
	OPERATOR,

	// reserved words
	IF,
	WHILE,
	DO,
	LET,
	IN,
	ELSE,
	REPEAT,
	CONST,
	VAR,

	// punctuation
	SEMICOLON,
	IS,
	LEFT_BRACKET,
	RIGHT_BRACKET,
	LEFT_SQUARE_BRACKET,
	RIGHT_SQUARE_BRACKET,
	FULL_STOP,

	// special tokens
	END_OF_TEXT,
	ERROR,
	NOP;

	/**
	 * Mapping of Square keywords to their token values.
	 * <p>
	 * <strong>Note:</strong> {@code nop} is not a keyword. The tokenizer
	 * recognizes it separately.
	 */
	private static final Map<String, TokenType> KEYWORDS;

	static {
		Map<String, TokenType> keywords = new HashMap<String, TokenType>();
		keywords.put("if", IF);
		keywords.put("while", WHILE);
		keywords.put("do", DO);
		keywords.put("let", LET);
		keywords.put("in", IN);
		keywords.put("else", ELSE);
		keywords.put("repeat", REPEAT);
		keywords.put("const", CONST);
		keywords.put("var", VAR);
		KEYWORDS = Collections.unmodifiableMap(keywords);
	}

	/**
	 * @return the keyword table, keyed by spelling
	 */
	public static Map<String, TokenType> keywords() {
		return KEYWORDS;
	}

	/**
	 * @param spelling the spelling to look up
	 * @return {@code true} if the spelling is a reserved word
	 */
	public static boolean isKeyword(CharSequence spelling) {
		return KEYWORDS.containsKey(spelling.toString());
	}

	/**
	 * Returns the token kind of a reserved word.
	 *
	 * @param spelling spelling of a reserved word
	 * @return the matching keyword token kind
	 * @throws IllegalArgumentException if the spelling is not a keyword
	 */
	public static TokenType forKeyword(CharSequence spelling) {
		TokenType type = KEYWORDS.get(spelling.toString());
		if (type == null) {
			throw new IllegalArgumentException("'" + spelling + "' is not a keyword");
		}
		return type;
	}
}
