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

import static org.timewarp.TimeWarp.logV;

import java.io.File;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs the statements that do not move the program counter: assignment, I/O, turtle and helper commands.
 * <p>Every failure is turned into a diagnostic, a sentinel or a status variable here, so a handler never stops the
 * program.</p>
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public class CommandHandlers {
	private static final String LOG_TAG = CommandHandlers.class.getSimpleName ();
	private static final boolean DEBUG = false;

	/** Where function and array commands leave their result */
	public static final String RESULT = "RESULT";

	/** Where <code>MATH:</code> leaves its result */
	public static final String MATH_RESULT = "MATH_RESULT";

	/** 1 after a successful <code>STORAGE:</code> command, 0 after a failed one */
	public static final String STORAGE_SUCCESS = "STORAGE_SUCCESS";

	/** Where <code>A:</code> without a variable stores the answer */
	public static final String ANSWER = "ANSWER";

	private static final Pattern targetPattern = Pattern.compile ("^([A-Za-z_][A-Za-z0-9_]*\\$?)\\s*(?:\\((.*)\\))?$", Pattern.DOTALL);

	private final ExecutionContext context;
	private final VariableStore variables;
	private final ExpressionEvaluator evaluator;
	private final TurtleGraphicsModel turtle;

	public CommandHandlers (ExecutionContext context) {
		this.context = context;
		this.variables = context.variables ();
		this.evaluator = context.evaluator ();
		this.turtle = context.turtle ();
	}

	/**
	 * Runs one command
	 *
	 * @param command A command whose kind has a handler here
	 * @return False if no handler exists for the kind
	 */
	public boolean execute (Command command) {
		if (DEBUG)
			logV (LOG_TAG, "Handling " + command);

		try {
			switch (command.kind) {
				case LET:
				case ASSIGN:
				case COMPUTE:
					assign (command);
					return true;
				case ASSIGN_ARRAY:
					assignArray (command);
					return true;
				case PRINT:
					print (command);
					return true;
				case TEXT:
				case MATCH_TEXT:
					context.output (evaluator.interpolate (command.argument (0)));
					return true;
				case INPUT:
					input (command.name, command.argument (0));
					return true;
				case ACCEPT: {
					String name = (command.name.isEmpty () ? ANSWER : command.name);
					input (name, "Enter value for " + name + ": ");
					return true;
				}
				case DIM:
					for (String name : command.arguments) {
						if (!variables.hasArray (name))
							variables.setArray (name, new SparseArray ());
					}
					return true;
				case FUNCTION:
					function (command);
					return true;
				case ARRAY_OP:
					arrayOperation (command);
					return true;
				case STRING_OP:
					stringOperation (command);
					return true;
				case DATETIME_OP:
					dateTimeOperation (command);
					return true;
				case MATH_OP:
					mathOperation (command);
					return true;
				case STORAGE:
					storage (command);
					return true;
				default:
					return turtle (command);
			}
		} catch (ExpressionException e) {
			context.diagnostic ("Expression error: " + e.getMessage ());
			return true;
		}
	}

	/**
	 * <code>NAME = expr</code> or <code>NAME(i, j) = expr</code>
	 */
	private void assign (Command command) {
		Value value = evaluator.evaluate (command.argument (0));

		if (command.arguments.size () > 1) {
			variables.setElement (command.name, value, indices (command.arguments.subList (1, command.arguments.size ())));
		} else {
			variables.set (command.name, value);
		}
	}

	private void assignArray (Command command) {
		List<Value> values = new ArrayList<Value> ();
		for (String element : command.arguments)
			values.add (evaluator.evaluate (element));

		variables.setArray (command.name, SparseArray.of (values));
	}

	/**
	 * Comma inserts a tab, semicolon joins, the line always ends
	 */
	private void print (Command command) {
		StringBuilder line = new StringBuilder ();
		for (String item : command.arguments) {
			if (item.equals (","))
				line.append ('\t');
			else if (!item.equals (";"))
				line.append (evaluator.evaluate (item).toText ());
		}

		context.output (line.toString ());
	}

	/**
	 * Asks the host and stores the answer, numeric answers as numbers
	 */
	private void input (String target, String prompt) {
		String text = context.input (prompt);
		if (text == null) {
			context.diagnostic ("No input available for " + target);
			return;
		}

		store (target, Value.coerce (text.trim ()));
	}

	/**
	 * Stores into <code>NAME</code> or <code>NAME(i, j)</code>
	 */
	private void store (String target, Value value) {
		Matcher matcher = targetPattern.matcher (target.trim ());
		if (!matcher.matches ()) {
			context.diagnostic ("Invalid variable: " + target);
			return;
		}

		if (matcher.group (2) == null) {
			variables.set (matcher.group (1), value);
		} else {
			List<String> expressions = new ArrayList<String> ();
			for (String index : CommandParser.splitTopLevel (matcher.group (2), ','))
				expressions.add (index.trim ());

			variables.setElement (matcher.group (1), value, indices (expressions));
		}
	}

	private int[] indices (List<String> expressions) {
		int[] indices = new int[expressions.size ()];
		for (int i = 0; i < indices.length; ++i)
			indices[i] = (int) evaluator.evaluateNumber (expressions.get (i), 0);

		return indices;
	}

	/**
	 * <code>SIN 30</code> evaluates <code>SIN(30)</code> into RESULT and prints it
	 */
	private void function (Command command) {
		StringBuilder call = new StringBuilder (command.name).append ('(');
		for (int i = 0, j = command.arguments.size (); i < j; ++i)
			call.append (i > 0 ? ", " : "").append (command.arguments.get (i));
		call.append (')');

		Value result = evaluator.evaluate (call.toString ());
		variables.set (RESULT, result);
		context.output (call + " = " + result.toText ());
	}

	private void arrayOperation (Command command) {
		String name = command.argument (0);
		SparseArray array = variables.getArray (name);
		if (array == null) {
			context.diagnostic ("Unknown array: " + name);
			return;
		}

		if (command.name.equals ("SORT")) {
			List<Value> values = array.values ();
			Collections.sort (values, new Comparator<Value> () {
				@Override
				public int compare (Value a, Value b) {
					return ExpressionEvaluator.compare (a, b);
				}
			});

			SparseArray sorted = SparseArray.of (values);
			variables.setArray (name, sorted);
			context.output ("SORT(" + name + ") = " + sorted);
			return;
		}

		Value result;
		String call;
		if (command.name.equals ("FIND")) {
			Value wanted = evaluator.evaluate (command.argument (1));
			result = new Value (array.find (wanted));
			call = "FIND(" + name + ", " + wanted.toText () + ")";
		} else {
			result = ExpressionEvaluator.aggregate (command.name, array.values ());
			call = command.name + "(" + name + ")";
		}

		variables.set (RESULT, result);
		context.output (call + " = " + result.toText ());
	}

	/**
	 * <code>S:LENGTH|UPPER|LOWER "text" VAR</code>
	 */
	private void stringOperation (Command command) {
		if (command.arguments.size () < 2) {
			context.diagnostic ("Malformed S:" + command.name + " (expected \"text\" VARIABLE)");
			return;
		}

		String text = evaluator.interpolate (command.argument (0));
		String target = command.argument (1);

		if (command.name.equals ("LENGTH")) {
			variables.set (target, text.length ());
		} else if (command.name.equals ("UPPER")) {
			variables.set (target, text.toUpperCase (Locale.ROOT));
		} else if (command.name.equals ("LOWER")) {
			variables.set (target, text.toLowerCase (Locale.ROOT));
		} else {
			context.diagnostic ("Unknown string operation: " + command.name);
		}
	}

	/**
	 * <code>DT:NOW "format" VAR</code> or <code>DT:TIMESTAMP VAR</code>
	 */
	private void dateTimeOperation (Command command) {
		StringBuilder joined = new StringBuilder ();
		for (String argument : command.arguments)
			joined.append (joined.length () > 0 ? " " : "").append (argument);
		String rest = joined.toString ().trim ();

		if (command.name.equals ("TIMESTAMP")) {
			if (rest.isEmpty ()) {
				context.diagnostic ("Malformed DT:TIMESTAMP (expected VARIABLE)");
				return;
			}

			variables.set (rest, context.clock ().millis () / 1000);
			return;
		}

		if (!command.name.equals ("NOW")) {
			context.diagnostic ("Unknown date operation: " + command.name);
			return;
		}

		String format;
		String target;
		if (rest.startsWith ("\"") && rest.indexOf ('"', 1) > 0) {
			int close = rest.indexOf ('"', 1);
			format = rest.substring (1, close);
			target = rest.substring (close + 1).trim ();
		} else {
			int space = rest.lastIndexOf (' ');
			format = (space < 0 ? "" : rest.substring (0, space).trim ());
			target = (space < 0 ? rest : rest.substring (space + 1));
		}

		if (target.isEmpty ()) {
			context.diagnostic ("Malformed DT:NOW (expected \"format\" VARIABLE)");
			return;
		}

		try {
			DateTimeFormatter formatter = DateTimeFormatter.ofPattern (datePattern (format.isEmpty () ? "YYYY-MM-DD HH:MM:SS" : format), Locale.ROOT);
			variables.set (target, LocalDateTime.now (context.clock ()).format (formatter));
		} catch (IllegalArgumentException e) {
			context.diagnostic ("Invalid date format: " + format);
		}
	}

	/**
	 * Maps the learner-facing tokens YYYY, MM, DD, HH, MM and SS to a formatter pattern; MM after HH means minutes
	 */
	static String datePattern (String format) {
		StringBuilder pattern = new StringBuilder ();
		boolean time = false;

		for (int i = 0; i < format.length ();) {
			if (format.startsWith ("YYYY", i)) {
				pattern.append ("yyyy");
				i += 4;
			} else if (format.startsWith ("DD", i)) {
				pattern.append ("dd");
				i += 2;
			} else if (format.startsWith ("HH", i)) {
				pattern.append ("HH");
				time = true;
				i += 2;
			} else if (format.startsWith ("MM", i)) {
				pattern.append (time ? "mm" : "MM");
				i += 2;
			} else if (format.startsWith ("SS", i)) {
				pattern.append ("ss");
				i += 2;
			} else {
				char c = format.charAt (i++);
				if (Character.isLetter (c) || c == '\'')
					pattern.append ('\'').append (c == '\'' ? "''" : String.valueOf (c)).append ('\'');
				else
					pattern.append (c);
			}
		}

		return pattern.toString ();
	}

	/**
	 * <code>MATH:SIN|COS|TAN|SQRT expr</code> into MATH_RESULT
	 */
	private void mathOperation (Command command) {
		if (!command.name.equals ("SIN") && !command.name.equals ("COS") && !command.name.equals ("TAN") && !command.name.equals ("SQRT")) {
			context.diagnostic ("Unknown math operation: " + command.name);
			return;
		}

		variables.set (MATH_RESULT, evaluator.evaluate (command.name + "(" + command.argument (0) + ")"));
	}

	/**
	 * <code>STORAGE:SAVE file</code> or <code>STORAGE:LOAD file</code>
	 */
	private void storage (Command command) {
		String path = evaluator.interpolate (command.argument (0)).trim ();
		if (path.isEmpty ()) {
			variables.set (STORAGE_SUCCESS, 0);
			context.diagnostic ("STORAGE: Filename cannot be empty");
			return;
		}

		File file = new File (path);
		try {
			if (command.name.equals ("SAVE")) {
				FileStore.saveVariables (file, variables);
				variables.set (STORAGE_SUCCESS, 1);
				context.output ("STORAGE: Variables saved to '" + path + "'");
			} else if (command.name.equals ("LOAD")) {
				FileStore.loadVariables (file, variables);
				variables.set (STORAGE_SUCCESS, 1);
				context.output ("STORAGE: Variables loaded from '" + path + "'");
			} else {
				context.diagnostic ("Unknown storage operation: " + command.name);
			}
		} catch (IOException e) {
			variables.set (STORAGE_SUCCESS, 0);
			context.diagnostic ("STORAGE: " + e.getMessage ());
		}
	}

	/**
	 * Turtle commands; a surface that throws is recorded as a host failure
	 *
	 * @return False if the kind is not a turtle command
	 */
	private boolean turtle (Command command) {
		try {
			switch (command.kind) {
				case FORWARD:
					turtle.forward (finite (command, 0, 50));
					return true;
				case BACK:
					turtle.back (finite (command, 0, 50));
					return true;
				case LEFT:
					turtle.left (finite (command, 0, 90));
					return true;
				case RIGHT:
					turtle.right (finite (command, 0, 90));
					return true;
				case PEN_UP:
					turtle.penUp ();
					return true;
				case PEN_DOWN:
					turtle.penDown ();
					return true;
				case CLEAR_SCREEN:
					turtle.clearScreen ();
					return true;
				case HOME:
					turtle.home ();
					return true;
				case SET_XY:
					if (command.arguments.size () < 2) {
						context.diagnostic ("SETXY needs x and y");
						return true;
					}
					turtle.setPosition (finite (command, 0, 0), finite (command, 1, 0));
					return true;
				case SET_X:
					turtle.setX (finite (command, 0, 0));
					return true;
				case SET_Y:
					turtle.setY (finite (command, 0, 0));
					return true;
				case SET_HEADING:
					turtle.setHeading (finite (command, 0, 0));
					return true;
				case SET_COLOR:
					turtle.setColor (color (command.argument (0)));
					return true;
				case SET_FILL_COLOR:
					turtle.setFillColor (color (command.argument (0)));
					return true;
				case SET_PEN_SIZE:
					turtle.setPenSize (evaluator.evaluateNumber (command.argument (0), 1));
					return true;
				case CIRCLE:
					turtle.circle (evaluator.evaluateNumber (command.argument (0), 50));
					return true;
				case DOT:
					turtle.dot (evaluator.evaluateNumber (command.argument (0), 5));
					return true;
				case RECT: {
					String fill = command.argument (2);
					boolean filled = fill.equalsIgnoreCase ("FILL") || fill.equalsIgnoreCase ("FILLED") || (!fill.isEmpty () && evaluator.evaluateCondition (fill));
					turtle.rect (evaluator.evaluateNumber (command.argument (0), 50), evaluator.evaluateNumber (command.argument (1), 50), filled);
					return true;
				}
				case TURTLE_TEXT:
					turtle.text (evaluator.interpolate (command.argument (0)));
					return true;
				case SHOW_TURTLE:
					turtle.show ();
					return true;
				case HIDE_TURTLE:
					turtle.hide ();
					return true;
				case SHOW_HEADING:
					context.output ("Heading: " + Value.format (turtle.heading ()));
					return true;
				case SHOW_POSITION:
					context.output ("Position: (" + Value.format (turtle.x ()) + ", " + Value.format (turtle.y ()) + ")");
					return true;
				default:
					return false;
			}
		} catch (ExpressionException e) {
			throw e;
		} catch (RuntimeException e) {
			context.hostFailure ("Drawing failed: " + e.getMessage ());
			context.diagnostic ("Drawing failed: " + e.getMessage ());
			return true;
		}
	}

	/**
	 * A numeric turtle argument; a non-finite one is reported and the turtle ignores it
	 */
	private double finite (Command command, int index, double fallback) {
		double value = evaluator.evaluateNumber (command.argument (index), fallback);
		if (!Double.isFinite (value))
			context.diagnostic ("Not a finite number: " + command.argument (index));

		return value;
	}

	/**
	 * A color argument: quoted text, a variable holding a color, or a bare name or palette index
	 */
	private String color (String argument) {
		if (argument.startsWith ("\""))
			return CommandParser.unquote (argument);

		Value value = variables.get (argument);
		if (value != null)
			return value.toText ();

		return argument;
	}
}
