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
import org.metricshub.square.frontend.ast.AssignCommandNode;
import org.metricshub.square.frontend.ast.BinaryExpressionNode;
import org.metricshub.square.frontend.ast.BlankCommandNode;
import org.metricshub.square.frontend.ast.BlankParameterNode;
import org.metricshub.square.frontend.ast.CallCommandNode;
import org.metricshub.square.frontend.ast.CallExpressionNode;
import org.metricshub.square.frontend.ast.CharacterExpressionNode;
import org.metricshub.square.frontend.ast.CharacterLiteralNode;
import org.metricshub.square.frontend.ast.CommandNode;
import org.metricshub.square.frontend.ast.ConstDeclarationNode;
import org.metricshub.square.frontend.ast.DeclarationNode;
import org.metricshub.square.frontend.ast.DoIfCommandNode;
import org.metricshub.square.frontend.ast.ErrorCommandNode;
import org.metricshub.square.frontend.ast.ErrorDeclarationNode;
import org.metricshub.square.frontend.ast.ErrorExpressionNode;
import org.metricshub.square.frontend.ast.ErrorParameterNode;
import org.metricshub.square.frontend.ast.ExpressionNode;
import org.metricshub.square.frontend.ast.ExpressionParameterNode;
import org.metricshub.square.frontend.ast.IdExpressionNode;
import org.metricshub.square.frontend.ast.IdentifierNode;
import org.metricshub.square.frontend.ast.IfCommandNode;
import org.metricshub.square.frontend.ast.IntegerExpressionNode;
import org.metricshub.square.frontend.ast.IntegerLiteralNode;
import org.metricshub.square.frontend.ast.LetCommandNode;
import org.metricshub.square.frontend.ast.OperatorNode;
import org.metricshub.square.frontend.ast.ParameterNode;
import org.metricshub.square.frontend.ast.ProgramNode;
import org.metricshub.square.frontend.ast.RepeatCommandNode;
import org.metricshub.square.frontend.ast.SequentialCommandNode;
import org.metricshub.square.frontend.ast.SequentialDeclarationNode;
import org.metricshub.square.frontend.ast.TypeDenoterNode;
import org.metricshub.square.frontend.ast.UnaryExpressionNode;
import org.metricshub.square.frontend.ast.VarDeclarationNode;
import org.metricshub.square.frontend.ast.VarParameterNode;
import org.metricshub.square.frontend.ast.WhileCommandNode;
import org.metricshub.square.util.Diagnostic;
import org.metricshub.square.util.ErrorReporter;
import org.metricshub.square.util.SquareLogger;
import org.metricshub.square.util.SquareSettings;
import org.slf4j.Logger;

/**
 * Predictive recursive descent parser building the syntax tree of a
 * Square program from its tokens.
 * <p>
 * The alternative taken at each production is chosen by the kind of the
 * current token only; the parser never backtracks. It never throws on
 * malformed input either:
 * <ul>
 * <li>a missing expected token is reported to the {@link ErrorReporter}
 * and otherwise ignored (the cursor does not move);
 * <li>when no alternative matches, an error node positioned at the current
 * token takes the place of the expected subtree and parsing carries on;
 * <li>nesting deeper than {@link SquareSettings#getMaxNestingDepth()}
 * produces an error node instead of descending further.
 * </ul>
 * The cursor and depth counter belong to a single call to
 * {@link #parse(List)}, so the same parser can be used for several
 * programs, one at a time.
 */
public class SquareParser {

	private static final Logger LOGGER = SquareLogger.getLogger(SquareParser.class);

	private final ErrorReporter reporter;
	private final int maxNestingDepth;

	/**
	 * Creates a parser with default settings.
	 *
	 * @param reporter where syntax errors are recorded
	 */
	public SquareParser(ErrorReporter reporter) {
		this(reporter, new SquareSettings());
	}

	/**
	 * <p>
	 * Constructor for SquareParser.
	 * </p>
	 *
	 * @param reporter where syntax errors are recorded
	 * @param settings provides the maximum nesting depth
	 */
	public SquareParser(ErrorReporter reporter, SquareSettings settings) {
		this.reporter = reporter;
		this.maxNestingDepth = settings.getMaxNestingDepth();
	}

	/**
	 * Parses a whole program.
	 *
	 * @param tokens the tokens of the program, as produced by {@link Tokenizer#getAllTokens()}
	 * @return the root of the syntax tree
	 * @throws IllegalArgumentException if the list does not end with {@link TokenType#END_OF_TEXT}
	 */
	public ProgramNode parse(List<Token> tokens) {
		if (tokens == null || tokens.isEmpty()) {
			throw new IllegalArgumentException("No tokens supplied");
		}
		if (tokens.get(tokens.size() - 1).getType() != TokenType.END_OF_TEXT) {
			throw new IllegalArgumentException("Token list must end with " + TokenType.END_OF_TEXT);
		}
		return new Descent(tokens).PROGRAM();
	}

	/**
	 * State of one parse: the tokens, the read cursor and the nesting depth.
	 */
	private final class Descent {

		private final List<Token> tokens;
		private int currentIndex;
		private int depth;
		private boolean depthExceeded;

		private Descent(List<Token> tokens) {
			this.tokens = tokens;
		}

		private Token current() {
			return tokens.get(currentIndex);
		}

		private boolean at(TokenType type) {
			return current().getType() == type;
		}

		/**
		 * Moves to the next token. The cursor stays on the last token
		 * (end of text) once it gets there.
		 */
		private void moveNext() {
			if (currentIndex < tokens.size() - 1) {
				currentIndex++;
			}
		}

		private void accept(TokenType expectedType) {
			if (at(expectedType)) {
				LOGGER.trace("Accepted {}", current());
				moveNext();
			} else {
				syntaxError("Expecting " + expectedType.name() + ". Found: " + found());
			}
		}

		private String found() {
			return current().getType().name() + " (" + current().getSpelling() + ")";
		}

		private void syntaxError(String message) {
			reporter.reportError(Diagnostic.Kind.SYNTAX, current().getPosition(), message);
		}

		private boolean descend() {
			if (depth >= maxNestingDepth) {
				if (!depthExceeded) {
					depthExceeded = true;
					syntaxError("Nesting exceeds the maximum depth of " + maxNestingDepth);
				}
				return false;
			}
			depth++;
			return true;
		}

		private void ascend() {
			depth--;
		}

		// RECURSIVE DESCENT PARSER:
		// CHECKSTYLE.OFF: MethodName
		// PROGRAM : COMMAND END_OF_TEXT
		ProgramNode PROGRAM() {
			LOGGER.trace("Parsing program");
			CommandNode command = COMMAND();
			if (!at(TokenType.END_OF_TEXT)) {
				syntaxError("Unexpected " + found() + " after the end of the program");
				currentIndex = tokens.size() - 1;
			}
			return new ProgramNode(command, command.getPosition());
		}

		// COMMAND : SINGLE_COMMAND ( ( ; | . ) SINGLE_COMMAND )*
		CommandNode COMMAND() {
			LOGGER.trace("Parsing command");
			Position start = current().getPosition();
			List<CommandNode> commands = new ArrayList<CommandNode>();
			commands.add(SINGLE_COMMAND());
			while (at(TokenType.SEMICOLON) || at(TokenType.FULL_STOP)) {
				accept(current().getType());
				commands.add(SINGLE_COMMAND());
			}
			if (commands.size() == 1) {
				return commands.get(0);
			}
			return new SequentialCommandNode(commands, start);
		}

		CommandNode SINGLE_COMMAND() {
			if (!descend()) {
				return new ErrorCommandNode(current().getPosition());
			}
			try {
				return SINGLE_COMMAND_BODY();
			} finally {
				ascend();
			}
		}

		// SINGLE_COMMAND : IDENTIFIER ( '(' PARAMETER ')' | '~' EXPRESSION )
		// | if EXPRESSION SINGLE_COMMAND else SINGLE_COMMAND
		// | while EXPRESSION do SINGLE_COMMAND
		// | let DECLARATION in SINGLE_COMMAND
		// | do SINGLE_COMMAND if EXPRESSION else SINGLE_COMMAND
		// | repeat SINGLE_COMMAND while EXPRESSION
		// | '[' COMMAND ']'
		// | nop
		private CommandNode SINGLE_COMMAND_BODY() {
			LOGGER.trace("Parsing single command");
			Position start = current().getPosition();
			if (at(TokenType.IDENTIFIER)) {
				IdentifierNode identifier = IDENTIFIER();
				if (at(TokenType.LEFT_BRACKET)) {
					accept(TokenType.LEFT_BRACKET);
					ParameterNode parameter = PARAMETER();
					accept(TokenType.RIGHT_BRACKET);
					return new CallCommandNode(identifier, parameter, start);
				} else if (at(TokenType.IS)) {
					accept(TokenType.IS);
					ExpressionNode expression = EXPRESSION();
					return new AssignCommandNode(identifier, expression, start);
				}
				syntaxError("Expecting ( or ~ after " + identifier.getSpelling() + ". Found: " + found());
				return new ErrorCommandNode(current().getPosition());
			} else if (at(TokenType.IF)) {
				return IF_COMMAND();
			} else if (at(TokenType.WHILE)) {
				return WHILE_COMMAND();
			} else if (at(TokenType.LET)) {
				return LET_COMMAND();
			} else if (at(TokenType.DO)) {
				return DO_IF_COMMAND();
			} else if (at(TokenType.REPEAT)) {
				return REPEAT_COMMAND();
			} else if (at(TokenType.LEFT_SQUARE_BRACKET)) {
				accept(TokenType.LEFT_SQUARE_BRACKET);
				CommandNode command = COMMAND();
				accept(TokenType.RIGHT_SQUARE_BRACKET);
				return command;
			} else if (at(TokenType.NOP)) {
				accept(TokenType.NOP);
				return new BlankCommandNode(start);
			}
			syntaxError("Expecting a command. Found: " + found());
			return new ErrorCommandNode(start);
		}

		CommandNode IF_COMMAND() {
			LOGGER.trace("Parsing if command");
			Position start = current().getPosition();
			accept(TokenType.IF);
			ExpressionNode expression = EXPRESSION();
			CommandNode thenCommand = SINGLE_COMMAND();
			accept(TokenType.ELSE);
			CommandNode elseCommand = SINGLE_COMMAND();
			return new IfCommandNode(expression, thenCommand, elseCommand, start);
		}

		CommandNode WHILE_COMMAND() {
			LOGGER.trace("Parsing while command");
			Position start = current().getPosition();
			accept(TokenType.WHILE);
			ExpressionNode expression = EXPRESSION();
			accept(TokenType.DO);
			CommandNode command = SINGLE_COMMAND();
			return new WhileCommandNode(expression, command, start);
		}

		CommandNode LET_COMMAND() {
			LOGGER.trace("Parsing let command");
			Position start = current().getPosition();
			accept(TokenType.LET);
			DeclarationNode declaration = DECLARATION();
			accept(TokenType.IN);
			CommandNode command = SINGLE_COMMAND();
			return new LetCommandNode(declaration, command, start);
		}

		CommandNode DO_IF_COMMAND() {
			LOGGER.trace("Parsing do if command");
			Position start = current().getPosition();
			accept(TokenType.DO);
			CommandNode doCommand = SINGLE_COMMAND();
			accept(TokenType.IF);
			ExpressionNode expression = EXPRESSION();
			accept(TokenType.ELSE);
			CommandNode elseCommand = SINGLE_COMMAND();
			return new DoIfCommandNode(doCommand, expression, elseCommand, start);
		}

		CommandNode REPEAT_COMMAND() {
			LOGGER.trace("Parsing repeat command");
			Position start = current().getPosition();
			accept(TokenType.REPEAT);
			CommandNode command = SINGLE_COMMAND();
			accept(TokenType.WHILE);
			ExpressionNode expression = EXPRESSION();
			return new RepeatCommandNode(command, expression, start);
		}

		// DECLARATION : SINGLE_DECLARATION ( ( ; | . ) SINGLE_DECLARATION )*
		DeclarationNode DECLARATION() {
			LOGGER.trace("Parsing declaration");
			Position start = current().getPosition();
			List<DeclarationNode> declarations = new ArrayList<DeclarationNode>();
			declarations.add(SINGLE_DECLARATION());
			while (at(TokenType.SEMICOLON) || at(TokenType.FULL_STOP)) {
				accept(current().getType());
				declarations.add(SINGLE_DECLARATION());
			}
			if (declarations.size() == 1) {
				return declarations.get(0);
			}
			return new SequentialDeclarationNode(declarations, start);
		}

		// SINGLE_DECLARATION : const TYPE_DENOTER IDENTIFIER '~' EXPRESSION
		// | var TYPE_DENOTER IDENTIFIER
		DeclarationNode SINGLE_DECLARATION() {
			LOGGER.trace("Parsing single declaration");
			Position start = current().getPosition();
			if (at(TokenType.CONST)) {
				accept(TokenType.CONST);
				TypeDenoterNode type = TYPE_DENOTER();
				IdentifierNode identifier = IDENTIFIER();
				accept(TokenType.IS);
				ExpressionNode expression = EXPRESSION();
				return new ConstDeclarationNode(type, identifier, expression, start);
			} else if (at(TokenType.VAR)) {
				accept(TokenType.VAR);
				TypeDenoterNode type = TYPE_DENOTER();
				IdentifierNode identifier = IDENTIFIER();
				return new VarDeclarationNode(type, identifier, start);
			}
			syntaxError("Expecting a declaration. Found: " + found());
			return new ErrorDeclarationNode(start);
		}

		// PARAMETER : EXPRESSION | var IDENTIFIER | <empty, before ')'>
		ParameterNode PARAMETER() {
			LOGGER.trace("Parsing parameter");
			Position start = current().getPosition();
			if (startsExpression(current().getType())) {
				return new ExpressionParameterNode(EXPRESSION(), start);
			} else if (at(TokenType.VAR)) {
				accept(TokenType.VAR);
				return new VarParameterNode(IDENTIFIER(), start);
			} else if (at(TokenType.RIGHT_BRACKET)) {
				return new BlankParameterNode(start);
			}
			syntaxError("Expecting a parameter. Found: " + found());
			return new ErrorParameterNode(start);
		}

		// TYPE_DENOTER : IDENTIFIER
		TypeDenoterNode TYPE_DENOTER() {
			LOGGER.trace("Parsing type denoter");
			IdentifierNode identifier = IDENTIFIER();
			return new TypeDenoterNode(identifier, identifier.getPosition());
		}

		// EXPRESSION : PRIMARY_EXPRESSION ( OPERATOR PRIMARY_EXPRESSION )*
		// (all operators share one precedence level, left associative)
		ExpressionNode EXPRESSION() {
			LOGGER.trace("Parsing expression");
			Position start = current().getPosition();
			ExpressionNode left = PRIMARY_EXPRESSION();
			while (at(TokenType.OPERATOR)) {
				OperatorNode operator = OPERATOR();
				ExpressionNode right = PRIMARY_EXPRESSION();
				left = new BinaryExpressionNode(left, operator, right, start);
			}
			return left;
		}

		ExpressionNode PRIMARY_EXPRESSION() {
			if (!descend()) {
				return new ErrorExpressionNode(current().getPosition());
			}
			try {
				return PRIMARY_EXPRESSION_BODY();
			} finally {
				ascend();
			}
		}

		// PRIMARY_EXPRESSION : INT_LITERAL | CHAR_LITERAL
		// | IDENTIFIER [ '(' PARAMETER ')' ]
		// | OPERATOR PRIMARY_EXPRESSION
		// | '(' EXPRESSION ')'
		private ExpressionNode PRIMARY_EXPRESSION_BODY() {
			LOGGER.trace("Parsing primary expression");
			Position start = current().getPosition();
			if (at(TokenType.INT_LITERAL)) {
				return new IntegerExpressionNode(INTEGER_LITERAL(), start);
			} else if (at(TokenType.CHAR_LITERAL)) {
				return new CharacterExpressionNode(CHARACTER_LITERAL(), start);
			} else if (at(TokenType.IDENTIFIER)) {
				IdentifierNode identifier = IDENTIFIER();
				if (at(TokenType.LEFT_BRACKET)) {
					accept(TokenType.LEFT_BRACKET);
					ParameterNode parameter = PARAMETER();
					accept(TokenType.RIGHT_BRACKET);
					return new CallExpressionNode(identifier, parameter, start);
				}
				return new IdExpressionNode(identifier, start);
			} else if (at(TokenType.OPERATOR)) {
				OperatorNode operator = OPERATOR();
				ExpressionNode operand = PRIMARY_EXPRESSION();
				return new UnaryExpressionNode(operator, operand, start);
			} else if (at(TokenType.LEFT_BRACKET)) {
				accept(TokenType.LEFT_BRACKET);
				ExpressionNode expression = EXPRESSION();
				accept(TokenType.RIGHT_BRACKET);
				return expression;
			}
			syntaxError("Expecting an expression. Found: " + found());
			return new ErrorExpressionNode(start);
		}

		IntegerLiteralNode INTEGER_LITERAL() {
			IntegerLiteralNode literal = new IntegerLiteralNode(current());
			accept(TokenType.INT_LITERAL);
			return literal;
		}

		CharacterLiteralNode CHARACTER_LITERAL() {
			CharacterLiteralNode literal = new CharacterLiteralNode(current());
			accept(TokenType.CHAR_LITERAL);
			return literal;
		}

		IdentifierNode IDENTIFIER() {
			IdentifierNode identifier = new IdentifierNode(current());
			accept(TokenType.IDENTIFIER);
			return identifier;
		}

		OperatorNode OPERATOR() {
			OperatorNode operator = new OperatorNode(current());
			accept(TokenType.OPERATOR);
			return operator;
		}
		// CHECKSTYLE.ON MethodName
	}

	private static boolean startsExpression(TokenType type) {
		return type == TokenType.INT_LITERAL
				|| type == TokenType.IDENTIFIER
				|| type == TokenType.CHAR_LITERAL
				|| type == TokenType.OPERATOR
				|| type == TokenType.LEFT_BRACKET;
	}
}
