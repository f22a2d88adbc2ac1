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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;
import org.metricshub.square.util.ErrorReporter;
import org.metricshub.square.util.ScriptSource;

/**
 * Checks every reserved word against the keyword table and the tokenizer.
 */
@RunWith(Parameterized.class)
public class TokenTypeTest {

	@Parameter(0)
	public String spelling;

	@Parameter(1)
	public TokenType expectedType;

	@Parameters(name = "{0}")
	public static Collection<Object[]> data() {
		List<Object[]> data = new ArrayList<Object[]>();
		for (Map.Entry<String, TokenType> entry : TokenType.keywords().entrySet()) {
			data.add(new Object[] { entry.getKey(), entry.getValue() });
		}
		return data;
	}

	@Test
	public void testKeywordTable() throws Exception {
		assertTrue(TokenType.isKeyword(spelling));
		assertEquals(expectedType, TokenType.forKeyword(new StringBuilder(spelling)));
	}

	@Test
	public void testKeywordIsScanned() throws Exception {
		ErrorReporter reporter = new ErrorReporter();
		List<Token> tokens = new Tokenizer(new ScriptSourceReader(ScriptSource.fromString(spelling)), reporter)
				.getAllTokens();
		assertEquals(2, tokens.size());
		assertEquals(expectedType, tokens.get(0).getType());
		assertEquals(spelling, tokens.get(0).getSpelling());
		assertFalse(reporter.hasErrors());
	}

	@Test
	public void testPrefixAndSuffixAreIdentifiers() throws Exception {
		assertFalse(TokenType.isKeyword(spelling + "s"));
		assertFalse(TokenType.isKeyword(spelling.substring(1)));
		assertFalse(TokenType.isKeyword(spelling.toUpperCase()));
	}

	@Test
	public void testNonKeywordsAreRejected() throws Exception {
		assertFalse(TokenType.isKeyword("nop"));
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> TokenType.forKeyword("nop"));
		assertEquals("'nop' is not a keyword", e.getMessage());
		assertThrows(IllegalArgumentException.class, () -> TokenType.forKeyword(spelling + "-"));
	}
}
