/*
 * Copyright 2017-18 White Label Dev Ltd, and contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.timewarp;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive descent parser turning an expression string into an {@link Expression} tree.
 * <p>Precedence from loosest to tightest: <code>OR</code>, <code>AND</code>, <code>NOT</code>, comparisons
 * (<code>= == &lt;&gt; != &lt; &lt;= &gt; &gt;=</code>), <code>+ -</code>, <code>* / % MOD</code>, unary
 * <code>+ -</code>, then <code>^</code> which is right associative. In operand position <code>*NAME*</code> is a
 * variable reference, so <code>*A* * 2</code> multiplies A by two.</p>
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public class ExpressionParser {
	/** Token types the parser understands */
	private static enum TokenType {
		NUMBER,
		STRING,
		NAME,
		OPERATOR,
		LEFT_PAREN,
		RIGHT_PAREN,
		COMMA,
		END
	}

	/** Holds a token, the lowest unit of an expression */
	private static final class Token {
		final TokenType type;
		final String text;

		Token (TokenType type, String text) {
			this.type = type;
			this.text = text;
		}
	}

	private final String source;
	private final List<Token> tokens;
	private int position = 0;

	private ExpressionParser (String source) {
		this.source = source;
		this.tokens = tokenise (source);
	}

	/**
	 * Parses a complete expression
	 *
	 * @param source The expression text
	 * @return The root of the tree
	 * @throws ExpressionException If the text is not a well formed expression
	 */
	public static Expression parse (String source) {
		ExpressionParser parser = new ExpressionParser (source);
		Expression expression = parser.or ();

		if (parser.peek ().type != TokenType.END)
			throw new ExpressionException ("Unexpected '" + parser.peek ().text + "' in: " + source);

		return expression;
	}

	private Expression or () {
		Expression expression = and ();
		while (matchWord ("OR"))
			expression = new Expression.Binary (Expression.Operator.OR, expression, and ());

		return expression;
	}

	private Expression and () {
		Expression expression = not ();
		while (matchWord ("AND"))
			expression = new Expression.Binary (Expression.Operator.AND, expression, not ());

		return expression;
	}

	private Expression not () {
		if (matchWord ("NOT"))
			return new Expression.Unary (true, false, not ());

		return comparison ();
	}

	private Expression comparison () {
		Expression expression = additive ();

		while (peek ().type == TokenType.OPERATOR) {
			Expression.Operator operator;
			String text = peek ().text;

			if (text.equals ("=") || text.equals ("=="))
				operator = Expression.Operator.EQUAL;
			else if (text.equals ("<>") || text.equals ("!="))
				operator = Expression.Operator.NOT_EQUAL;
			else if (text.equals ("<"))
				operator = Expression.Operator.LESS;
			else if (text.equals ("<="))
				operator = Expression.Operator.LESS_EQUAL;
			else if (text.equals (">"))
				operator = Expression.Operator.GREATER;
			else if (text.equals (">="))
				operator = Expression.Operator.GREATER_EQUAL;
			else
				break;

			++position;
			expression = new Expression.Binary (operator, expression, additive ());
		}

		return expression;
	}

	private Expression additive () {
		Expression expression = multiplicative ();

		while (true) {
			if (matchOperator ("+"))
				expression = new Expression.Binary (Expression.Operator.ADD, expression, multiplicative ());
			else if (matchOperator ("-"))
				expression = new Expression.Binary (Expression.Operator.SUBTRACT, expression, multiplicative ());
			else
				return expression;
		}
	}

	private Expression multiplicative () {
		Expression expression = unary ();

		while (true) {
			if (matchOperator ("*"))
				expression = new Expression.Binary (Expression.Operator.MULTIPLY, expression, unary ());
			else if (matchOperator ("/"))
				expression = new Expression.Binary (Expression.Operator.DIVIDE, expression, unary ());
			else if (matchOperator ("%") || matchWord ("MOD"))
				expression = new Expression.Binary (Expression.Operator.MODULO, expression, unary ());
			else
				return expression;
		}
	}

	private Expression unary () {
		if (matchOperator ("-"))
			return new Expression.Unary (false, true, unary ());
		if (matchOperator ("+"))
			return new Expression.Unary (false, false, unary ());

		return power ();
	}

	private Expression power () {
		Expression base = primary ();
		if (matchOperator ("^"))
			return new Expression.Binary (Expression.Operator.POWER, base, unary ());

		return base;
	}

	private Expression primary () {
		Token token = next ();

		switch (token.type) {
			case NUMBER:
				return new Expression.Literal (new Value (Double.parseDouble (token.text)));
			case STRING:
				return new Expression.Literal (new Value (token.text));
			case LEFT_PAREN: {
				Expression expression = or ();
				expect (TokenType.RIGHT_PAREN, ")");
				return expression;
			}
			case OPERATOR:
				// Delimited variable reference *NAME*
				if (token.text.equals ("*") && peek ().type == TokenType.NAME) {
					String name = next ().text;
					expect (TokenType.OPERATOR, "*");
					return new Expression.Variable (name);
				}
				break;
			case NAME:
				if (isReserved (token.text))
					break;

				if (peek ().type == TokenType.LEFT_PAREN) {
					++position;
					List<Expression> arguments = new ArrayList<Expression> ();
					if (peek ().type != TokenType.RIGHT_PAREN) {
						do {
							arguments.add (or ());
						} while (match (TokenType.COMMA));
					}
					expect (TokenType.RIGHT_PAREN, ")");
					return new Expression.Call (token.text, arguments);
				}

				return new Expression.Variable (token.text);
			default:
				break;
		}

		throw new ExpressionException (token.type == TokenType.END ? "Unexpected end of expression: " + source : "Unexpected '" + token.text + "' in: " + source);
	}

	private Token peek () {
		return tokens.get (position);
	}

	private Token next () {
		Token token = tokens.get (position);
		if (token.type != TokenType.END)
			++position;

		return token;
	}

	private boolean match (TokenType type) {
		if (peek ().type != type)
			return false;

		++position;
		return true;
	}

	private boolean matchOperator (String operator) {
		if (peek ().type != TokenType.OPERATOR || !peek ().text.equals (operator))
			return false;

		++position;
		return true;
	}

	private boolean matchWord (String word) {
		if (peek ().type != TokenType.NAME || !peek ().text.equalsIgnoreCase (word))
			return false;

		++position;
		return true;
	}

	private void expect (TokenType type, String text) {
		Token token = next ();
		if (token.type != type || (type == TokenType.OPERATOR && !token.text.equals (text)))
			throw new ExpressionException ("Expected '" + text + "' in: " + source);
	}

	private static boolean isReserved (String name) {
		String word = name.toUpperCase (Locale.ROOT);
		return word.equals ("AND") || word.equals ("OR") || word.equals ("NOT") || word.equals ("MOD");
	}

	/**
	 * Splits the expression into tokens; whitespace is dropped and string literals keep their content only
	 */
	private static List<Token> tokenise (String source) {
		List<Token> tokens = new ArrayList<Token> ();
		int i = 0;
		int length = source.length ();

		while (i < length) {
			char c = source.charAt (i);

			if (Character.isWhitespace (c)) {
				++i;
			} else if (Character.isDigit (c) || (c == '.' && i + 1 < length && Character.isDigit (source.charAt (i + 1)))) {
				int start = i;
				while (i < length && (Character.isDigit (source.charAt (i)) || source.charAt (i) == '.'))
					++i;

				// Exponent, only when digits follow
				if (i < length && (source.charAt (i) == 'e' || source.charAt (i) == 'E')) {
					int mark = i + 1;
					if (mark < length && (source.charAt (mark) == '+' || source.charAt (mark) == '-'))
						++mark;
					if (mark < length && Character.isDigit (source.charAt (mark))) {
						i = mark;
						while (i < length && Character.isDigit (source.charAt (i)))
							++i;
					}
				}

				String number = source.substring (start, i);
				if (Value.parseNumber (number) == null)
					throw new ExpressionException ("Malformed number: " + number);

				tokens.add (new Token (TokenType.NUMBER, number));
			} else if (c == '"' || c == '\'') {
				int end = source.indexOf (c, i + 1);
				if (end < 0)
					throw new ExpressionException ("Unterminated string in: " + source);

				tokens.add (new Token (TokenType.STRING, source.substring (i + 1, end)));
				i = end + 1;
			} else if (Character.isLetter (c) || c == '_') {
				int start = i;
				while (i < length && (Character.isLetterOrDigit (source.charAt (i)) || source.charAt (i) == '_'))
					++i;
				if (i < length && source.charAt (i) == '$')
					++i;

				tokens.add (new Token (TokenType.NAME, source.substring (start, i)));
			} else if (c == '(') {
				tokens.add (new Token (TokenType.LEFT_PAREN, "("));
				++i;
			} else if (c == ')') {
				tokens.add (new Token (TokenType.RIGHT_PAREN, ")"));
				++i;
			} else if (c == ',') {
				tokens.add (new Token (TokenType.COMMA, ","));
				++i;
			} else {
				String two = (i + 1 < length ? source.substring (i, i + 2) : "");
				if (two.equals ("<=") || two.equals (">=") || two.equals ("<>") || two.equals ("!=") || two.equals ("==")) {
					tokens.add (new Token (TokenType.OPERATOR, two));
					i += 2;
				} else if ("+-*/%^=<>".indexOf (c) >= 0) {
					tokens.add (new Token (TokenType.OPERATOR, String.valueOf (c)));
					++i;
				} else {
					throw new ExpressionException ("Unexpected character '" + c + "' in: " + source);
				}
			}
		}

		tokens.add (new Token (TokenType.END, ""));
		return tokens;
	}
}
