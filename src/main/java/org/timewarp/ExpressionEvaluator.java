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

import static org.timewarp.TimeWarp.logD;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Evaluates expression strings against a {@link VariableStore}. Evaluation never throws: a failing expression yields
 * a fallback value and a diagnostic so one bad line cannot stop a program.
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public class ExpressionEvaluator {
	private static final String LOG_TAG = ExpressionEvaluator.class.getSimpleName ();
	private static final boolean DEBUG = false;

	/** Result of any division or modulo by zero */
	public static final String DIVISION_BY_ZERO = "ERROR: Division by zero";

	private static final Pattern namePattern = Pattern.compile ("[A-Za-z_][A-Za-z0-9_]*\\$?");
	private static final String expressionCharacters = "+-/()^%<>=";

	/** Receives evaluator diagnostics */
	public interface Reporter {
		/**
		 * A diagnostic that always reaches the transcript
		 */
		void report (String message);

		/**
		 * A diagnostic that reaches the transcript in debug mode only
		 */
		void debug (String message);
	}

	private final VariableStore variables;
	private final Random random;
	private final Reporter reporter;
	private final HashMap<String, Expression> cache = new HashMap<String, Expression> ();

	/**
	 * @param variables The store names resolve against
	 * @param random Source for RND and RANDOM
	 * @param reporter Diagnostic sink, or null to only log
	 */
	public ExpressionEvaluator (VariableStore variables, Random random, Reporter reporter) {
		this.variables = variables;
		this.random = random;
		this.reporter = reporter;
	}

	public VariableStore variables () {
		return variables;
	}

	/**
	 * Evaluates an expression
	 *
	 * @param expression The expression text
	 * @return The result, the division by zero sentinel, or a fallback (the unquoted literal or the trimmed text)
	 */
	public Value evaluate (String expression) {
		String trimmed = (expression == null ? "" : expression.trim ());
		if (trimmed.isEmpty ())
			return Value.EMPTY;

		try {
			Expression tree = cache.get (trimmed);
			if (tree == null) {
				tree = ExpressionParser.parse (trimmed);
				cache.put (trimmed, tree);
			}

			return tree.evaluate (this);
		} catch (ExpressionException e) {
			if (e.isDivisionByZero ()) {
				report ("Expression error: " + e.getMessage ());
				return new Value (DIVISION_BY_ZERO);
			}

			debug ("Expression error: " + e.getMessage ());
		} catch (RuntimeException e) {
			debug ("Expression error: " + e);
		}

		return fallback (trimmed);
	}

	/**
	 * Evaluates a condition using {@link Value#isTrue()}
	 */
	public boolean evaluateCondition (String expression) {
		return evaluate (expression).isTrue ();
	}

	/**
	 * Evaluates an expression to a number, or the default when the result is not numeric
	 */
	public double evaluateNumber (String expression, double numberDefault) {
		return evaluate (expression).toNumber (numberDefault);
	}

	/**
	 * Expands <code>*NAME*</code> and <code>*expression*</code> markers inside display text. Markers that name no
	 * variable and hold no expression are left as written.
	 *
	 * @param text Text to expand
	 * @return The expanded text
	 */
	public String interpolate (String text) {
		if (text == null || text.indexOf ('*') < 0)
			return text;

		StringBuilder builder = new StringBuilder ();
		int i = 0;

		while (i < text.length ()) {
			int start = text.indexOf ('*', i);
			int end = (start < 0 ? -1 : text.indexOf ('*', start + 1));
			if (end < 0) {
				builder.append (text, i, text.length ());
				break;
			}

			builder.append (text, i, start);

			String inner = text.substring (start + 1, end).trim ();
			String replacement = null;

			if (namePattern.matcher (inner).matches () && variables.get (inner) != null) {
				replacement = variables.get (inner).toText ();
			} else if (namePattern.matcher (inner).matches () && variables.hasArray (inner)) {
				replacement = variables.getArray (inner).toString ();
			} else if (Value.parseNumber (inner) != null) {
				replacement = Value.format (Value.parseNumber (inner));
			} else if (!inner.isEmpty () && containsAny (inner, expressionCharacters)) {
				replacement = evaluate (inner).toText ();
			}

			if (replacement != null) {
				builder.append (replacement);
				i = end + 1;
			} else {
				// Not a marker, keep the asterisk and rescan from the next character
				builder.append ('*');
				i = start + 1;
			}
		}

		return builder.toString ();
	}

	/**
	 * Drops the parse cache, needed only if the same instance is reused for a different program
	 */
	public void clearCache () {
		cache.clear ();
	}

	/**
	 * Calls a builtin function
	 *
	 * @param name Upper-cased function name
	 * @param arguments Unevaluated arguments, aggregates read array names from them directly
	 * @return The result
	 * @throws ExpressionException If the function is unknown or the arguments do not fit
	 */
	Value callBuiltin (String name, List<Expression> arguments) {
		if (DEBUG)
			logD (LOG_TAG, "Calling builtin " + name + " with " + arguments.size () + " argument(s)");

		// Aggregates accept an array name or a list of scalars
		if (name.equals ("SUM") || name.equals ("AVG") || name.equals ("MIN") || name.equals ("MAX"))
			return aggregate (name, collect (arguments));

		if (name.equals ("FIND")) {
			arity (name, arguments, 2, 2);
			SparseArray array = arrayArgument (arguments.get (0));
			if (array == null)
				throw new ExpressionException ("FIND needs an array");

			return new Value (array.find (arguments.get (1).evaluate (this)));
		}

		List<Value> values = new ArrayList<Value> ();
		for (Expression argument : arguments)
			values.add (argument.evaluate (this));

		switch (name) {
			case "ABS":
				arity (name, arguments, 1, 1);
				return new Value (Math.abs (number (values.get (0))));
			case "INT":
				arity (name, arguments, 1, 1);
				return new Value ((double) (long) number (values.get (0)));
			case "ROUND": {
				arity (name, arguments, 1, 2);
				int places = (values.size () > 1 ? (int) number (values.get (1)) : 0);
				return new Value (new BigDecimal (Double.toString (number (values.get (0)))).setScale (places, RoundingMode.HALF_UP).doubleValue ());
			}
			case "FLOAT":
			case "VAL":
				arity (name, arguments, 1, 1);
				return new Value (values.get (0).toNumber (0));
			case "SQRT": {
				arity (name, arguments, 1, 1);
				double number = number (values.get (0));
				if (number < 0)
					throw new ExpressionException ("SQRT of negative number");
				return new Value (Math.sqrt (number));
			}
			case "SIN":
				arity (name, arguments, 1, 1);
				return new Value (Math.sin (Math.toRadians (number (values.get (0)))));
			case "COS":
				arity (name, arguments, 1, 1);
				return new Value (Math.cos (Math.toRadians (number (values.get (0)))));
			case "TAN":
				arity (name, arguments, 1, 1);
				return new Value (Math.tan (Math.toRadians (number (values.get (0)))));
			case "RND":
				arity (name, arguments, 0, 1);
				return new Value (random.nextDouble () * (values.isEmpty () ? 1 : number (values.get (0))));
			case "RANDOM":
				arity (name, arguments, 0, 0);
				return new Value (random.nextDouble ());
			case "LEN":
				arity (name, arguments, 1, 1);
				if (arrayArgument (arguments.get (0)) != null)
					return new Value (arrayArgument (arguments.get (0)).size ());
				return new Value (values.get (0).toText ().length ());
			case "MID":
			case "MID$": {
				arity (name, arguments, 2, 3);
				String text = values.get (0).toText ();
				int start = clamp ((int) number (values.get (1)) - 1, 0, text.length ());
				int end = (values.size () > 2 ? clamp (start + (int) number (values.get (2)), start, text.length ()) : text.length ());
				return new Value (text.substring (start, end));
			}
			case "LEFT":
			case "LEFT$": {
				arity (name, arguments, 2, 2);
				String text = values.get (0).toText ();
				return new Value (text.substring (0, clamp ((int) number (values.get (1)), 0, text.length ())));
			}
			case "RIGHT":
			case "RIGHT$": {
				arity (name, arguments, 2, 2);
				String text = values.get (0).toText ();
				return new Value (text.substring (text.length () - clamp ((int) number (values.get (1)), 0, text.length ())));
			}
			case "INSTR":
				arity (name, arguments, 2, 2);
				return new Value (values.get (0).toText ().indexOf (values.get (1).toText ()) + 1);
			case "STR":
			case "STR$":
				arity (name, arguments, 1, 1);
				return new Value (values.get (0).toText ());
			case "CHR":
			case "CHR$":
				arity (name, arguments, 1, 1);
				return new Value (String.valueOf ((char) (int) number (values.get (0))));
			case "ASC": {
				arity (name, arguments, 1, 1);
				String text = values.get (0).toText ();
				return new Value (text.isEmpty () ? 0 : text.charAt (0));
			}
			case "UPPER":
				arity (name, arguments, 1, 1);
				return new Value (values.get (0).toText ().toUpperCase (Locale.ROOT));
			case "LOWER":
				arity (name, arguments, 1, 1);
				return new Value (values.get (0).toText ().toLowerCase (Locale.ROOT));
			default:
				throw new ExpressionException ("Unknown function: " + name);
		}
	}

	/**
	 * Applies SUM, AVG, MIN or MAX to a list of values; an empty list yields 0
	 */
	static Value aggregate (String name, List<Value> values) {
		if (values.isEmpty ())
			return Value.ZERO;

		double result = (name.equals ("SUM") || name.equals ("AVG") ? 0 : number (values.get (0)));
		for (Value value : values) {
			double number = number (value);
			if (name.equals ("MIN"))
				result = Math.min (result, number);
			else if (name.equals ("MAX"))
				result = Math.max (result, number);
			else
				result += number;
		}

		return new Value (name.equals ("AVG") ? result / values.size () : result);
	}

	/**
	 * Compares two values, numerically when both read as numbers, otherwise by text
	 */
	static int compare (Value a, Value b) {
		if (a.isNumeric () && b.isNumeric ())
			return Double.compare (a.toNumber (), b.toNumber ());

		return a.toText ().compareTo (b.toText ());
	}

	/**
	 * Numeric view of a value for arithmetic
	 *
	 * @throws ExpressionException If the value is a non-numeric string
	 */
	static double number (Value value) {
		try {
			return value.toNumber ();
		} catch (NumberFormatException e) {
			throw new ExpressionException ("Cannot use \"" + value.toText () + "\" as a number");
		}
	}

	private List<Value> collect (List<Expression> arguments) {
		if (arguments.size () == 1) {
			SparseArray array = arrayArgument (arguments.get (0));
			if (array != null)
				return array.values ();
		}

		List<Value> values = new ArrayList<Value> ();
		for (Expression argument : arguments)
			values.add (argument.evaluate (this));

		return values;
	}

	private SparseArray arrayArgument (Expression argument) {
		if (argument instanceof Expression.Variable)
			return variables.getArray (((Expression.Variable) argument).name);

		return null;
	}

	private void report (String message) {
		if (DEBUG)
			logD (LOG_TAG, message);

		if (reporter != null)
			reporter.report (message);
	}

	private void debug (String message) {
		if (DEBUG)
			logD (LOG_TAG, message);

		if (reporter != null)
			reporter.debug (message);
	}

	private static Value fallback (String text) {
		if (text.length () >= 2 && (text.charAt (0) == '"' || text.charAt (0) == '\'') && text.charAt (text.length () - 1) == text.charAt (0))
			return new Value (text.substring (1, text.length () - 1));

		return new Value (text);
	}

	private static void arity (String name, List<Expression> arguments, int minimum, int maximum) {
		if (arguments.size () < minimum || arguments.size () > maximum)
			throw new ExpressionException (name + " takes " + (minimum == maximum ? String.valueOf (minimum) : minimum + " to " + maximum) + " argument(s)");
	}

	private static int clamp (int value, int minimum, int maximum) {
		return Math.max (minimum, Math.min (maximum, value));
	}

	private static boolean containsAny (String text, String characters) {
		for (int i = 0; i < characters.length (); ++i) {
			if (text.indexOf (characters.charAt (i)) >= 0)
				return true;
		}

		return false;
	}
}
