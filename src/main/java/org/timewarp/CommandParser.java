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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.timewarp.Command.Kind;

/**
 * Turns statement text into {@link Command} values. Colon-dialect text parses to colon commands only; the other
 * dialects share one grammar since the unified dialect blends them.
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public final class CommandParser {
	private static final String LOG_TAG = CommandParser.class.getSimpleName ();
	private static final boolean DEBUG = false;

	private static final Pattern jumpIfPattern = Pattern.compile ("^J\\s*\\((.*)\\)\\s*:(.*)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
	private static final Pattern ifPattern = Pattern.compile ("^IF\\s+(.+?)\\s+THEN\\s+(.+?)(?:\\s+ELSE\\s+(.+))?$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
	private static final Pattern forPattern = Pattern.compile ("^FOR\\s+([A-Za-z_][A-Za-z0-9_]*\\$?)\\s*=\\s*(.+?)\\s+TO\\s+(.+?)(?:\\s+STEP\\s+(.+))?$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
	private static final Pattern targetPattern = Pattern.compile ("^([A-Za-z_][A-Za-z0-9_]*\\$?)\\s*(?:\\((.*)\\))?$", Pattern.DOTALL);
	private static final Pattern namePattern = Pattern.compile ("^[A-Za-z_][A-Za-z0-9_]*\\$?$");
	private static final Pattern wordPattern = Pattern.compile ("\"([^\"]*)\"|\\S+");

	private CommandParser () {
	}

	/**
	 * Parses one statement
	 *
	 * @param text Statement text, line number and comments already removed
	 * @param explicitMode Dialect forced by the host, or null to detect
	 * @return The parsed command, never null
	 */
	public static Command parse (String text, Dialect explicitMode) {
		String statement = text.trim ();
		Dialect dialect = CommandClassifier.classify (statement, explicitMode);

		Command command = (dialect == Dialect.COLON ? parseColon (statement) : parseStatement (statement, dialect, explicitMode));

		if (DEBUG)
			logV (LOG_TAG, dialect + ": " + statement + " => " + command);

		return command;
	}

	/**
	 * Parses a source line that may hold several turtle commands, such as <code>FD 10 RT 90</code> or
	 * <code>REPEAT 4 [FD 10 RT 90] HOME</code>; any other line parses to exactly one command
	 *
	 * @param text Logical line text
	 * @param explicitMode Dialect forced by the host, or null to detect
	 * @return The commands in order
	 */
	public static List<Command> parseLine (String text, Dialect explicitMode) {
		String statement = text.trim ();
		Dialect dialect = CommandClassifier.classify (statement, explicitMode);
		String keyword = CommandClassifier.firstWord (statement);

		if (dialect != Dialect.COLON && (CommandClassifier.turtleKeywords.contains (keyword) || keyword.equals ("DEFINE")) && !CommandClassifier.isAssignment (statement))
			return parseBlock (statement, explicitMode);

		return Collections.singletonList (parse (statement, explicitMode));
	}

	/**
	 * Parses the inside of a bracket block into its commands
	 */
	static List<Command> parseBlock (String block, Dialect explicitMode) {
		List<Command> commands = new ArrayList<Command> ();
		for (String statement : splitBlock (block))
			commands.add (parse (statement, explicitMode));

		return commands;
	}

	private static Command parseColon (String statement) {
		if (statement.equalsIgnoreCase ("END"))
			return Command.of (Kind.END, Dialect.COLON, statement, null);

		Matcher jumpIf = jumpIfPattern.matcher (statement);
		if (jumpIf.matches ())
			return Command.of (Kind.JUMP_IF, Dialect.COLON, statement, jumpIf.group (2).trim (), jumpIf.group (1).trim ());

		int colon = statement.indexOf (':');
		if (colon < 0)
			return Command.of (Kind.UNKNOWN, Dialect.COLON, statement, CommandClassifier.firstWord (statement));

		String prefix = statement.substring (0, colon).trim ().toUpperCase (Locale.ROOT);
		String payload = statement.substring (colon + 1).trim ();

		switch (prefix) {
			case "T":
				return Command.of (Kind.TEXT, Dialect.COLON, statement, null, payload);
			case "A":
				return Command.of (Kind.ACCEPT, Dialect.COLON, statement, payload);
			case "Y":
				return Command.of (Kind.YES, Dialect.COLON, statement, null, payload);
			case "N":
				return Command.of (Kind.NO, Dialect.COLON, statement, null, payload);
			case "J":
				return Command.of (Kind.JUMP, Dialect.COLON, statement, payload);
			case "M":
				return Command.of (Kind.MATCH_JUMP, Dialect.COLON, statement, payload);
			case "MT":
				return Command.of (Kind.MATCH_TEXT, Dialect.COLON, statement, null, payload);
			case "C":
			case "U":
				if (payload.isEmpty () && prefix.equals ("C"))
					return Command.of (Kind.RETURN, Dialect.COLON, statement, null);
				if (assignmentOperator (payload) < 0)
					return Command.of (Kind.INVALID, Dialect.COLON, statement, "Malformed " + prefix + ": (expected variable = expression)");

				return parseAssignment (Kind.COMPUTE, payload, statement, Dialect.COLON);
			case "L":
				return Command.of (Kind.LABEL, Dialect.COLON, statement, payload);
			case "R":
				return Command.of (Kind.REMARK, Dialect.COLON, statement, null);
			case "E":
				return Command.of (Kind.END, Dialect.COLON, statement, null);
			case "S": {
				List<String> words = words (payload);
				if (words.isEmpty ())
					return Command.of (Kind.INVALID, Dialect.COLON, statement, "Malformed S: (missing operation)");

				return new Command (Kind.STRING_OP, Dialect.COLON, statement, words.get (0).toUpperCase (Locale.ROOT), words.subList (1, words.size ()), null, null, null);
			}
			case "DT": {
				String[] parts = payload.split ("\\s+", 3);
				if (payload.isEmpty ())
					return Command.of (Kind.INVALID, Dialect.COLON, statement, "Malformed DT: (missing operation)");

				return new Command (Kind.DATETIME_OP, Dialect.COLON, statement, parts[0].toUpperCase (Locale.ROOT), Arrays.asList (parts).subList (1, parts.length), null, null, null);
			}
			case "MATH": {
				String[] parts = payload.split ("\\s+", 2);
				return Command.of (Kind.MATH_OP, Dialect.COLON, statement, parts[0].toUpperCase (Locale.ROOT), parts.length > 1 ? parts[1] : "");
			}
			case "BRANCH": {
				String[] parts = payload.split ("\\s+", 2);
				List<String> pairs = new ArrayList<String> ();
				if (parts.length > 1) {
					for (String pair : splitTopLevel (parts[1], ','))
						pairs.add (pair.trim ());
				}

				return new Command (Kind.BRANCH_MULTI, Dialect.COLON, statement, parts[0].toUpperCase (Locale.ROOT), pairs, null, null, null);
			}
			case "STORAGE": {
				String[] parts = payload.split ("\\s+", 2);
				return Command.of (Kind.STORAGE, Dialect.COLON, statement, parts[0].toUpperCase (Locale.ROOT), parts.length > 1 ? unquote (parts[1].trim ()) : "");
			}
			default:
				return Command.of (Kind.UNKNOWN, Dialect.COLON, statement, prefix + ":");
		}
	}

	private static Command parseStatement (String statement, Dialect dialect, Dialect explicitMode) {
		if (statement.isEmpty ())
			return Command.of (Kind.EMPTY, dialect, statement, null);

		String keyword = CommandClassifier.firstWord (statement);
		String rest = statement.substring (keyword.length ()).trim ();

		if (!CommandClassifier.lineNumberedKeywords.contains (keyword) && CommandClassifier.isAssignment (statement))
			return parseAssignment (Kind.ASSIGN, statement, statement, dialect);

		switch (keyword) {
			// Line-numbered
			case "LET":
				if (assignmentOperator (rest) < 0)
					return Command.of (Kind.INVALID, dialect, statement, "Malformed LET (expected variable = expression)");
				return parseAssignment (Kind.LET, rest, statement, dialect);
			case "PRINT":
			case "?":
				return new Command (Kind.PRINT, dialect, statement, null, printItems (rest), null, null, null);
			case "INPUT":
				return parseInput (rest, statement, dialect);
			case "IF":
				return parseIf (statement, dialect, explicitMode);
			case "FOR": {
				Matcher matcher = forPattern.matcher (statement);
				if (!matcher.matches ())
					return Command.of (Kind.INVALID, dialect, statement, "Malformed FOR (expected FOR V = start TO limit [STEP step])");

				return Command.of (Kind.FOR, dialect, statement, matcher.group (1), matcher.group (2).trim (), matcher.group (3).trim (), matcher.group (4) == null ? "1" : matcher.group (4).trim ());
			}
			case "NEXT":
				return Command.of (Kind.NEXT, dialect, statement, rest);
			case "GOTO":
				return Command.of (Kind.GOTO, dialect, statement, rest);
			case "GOSUB":
				return Command.of (Kind.GOSUB, dialect, statement, rest);
			case "RETURN":
				return Command.of (Kind.RETURN, dialect, statement, null);
			case "END":
				return Command.of (Kind.END, dialect, statement, null);
			case "REM":
				return Command.of (Kind.REMARK, dialect, statement, null);
			case "DIM": {
				List<String> arrays = new ArrayList<String> ();
				for (String declaration : splitTopLevel (rest, ',')) {
					Matcher matcher = targetPattern.matcher (declaration.trim ());
					if (!matcher.matches ())
						return Command.of (Kind.INVALID, dialect, statement, "Malformed DIM: " + declaration.trim ());
					arrays.add (matcher.group (1));
				}

				return new Command (Kind.DIM, dialect, statement, null, arrays, null, null, null);
			}

			// Turtle
			case "FORWARD":
			case "FD":
				return Command.of (Kind.FORWARD, dialect, statement, null, rest);
			case "BACK":
			case "BK":
			case "BACKWARD":
				return Command.of (Kind.BACK, dialect, statement, null, rest);
			case "LEFT":
			case "LT":
				return Command.of (Kind.LEFT, dialect, statement, null, rest);
			case "RIGHT":
			case "RT":
				return Command.of (Kind.RIGHT, dialect, statement, null, rest);
			case "PENUP":
			case "PU":
				return Command.of (Kind.PEN_UP, dialect, statement, null);
			case "PENDOWN":
			case "PD":
				return Command.of (Kind.PEN_DOWN, dialect, statement, null);
			case "CLEARSCREEN":
			case "CS":
				return Command.of (Kind.CLEAR_SCREEN, dialect, statement, null);
			case "HOME":
				return Command.of (Kind.HOME, dialect, statement, null);
			case "SETXY":
				return new Command (Kind.SET_XY, dialect, statement, null, arguments (rest), null, null, null);
			case "SETX":
				return Command.of (Kind.SET_X, dialect, statement, null, rest);
			case "SETY":
				return Command.of (Kind.SET_Y, dialect, statement, null, rest);
			case "SETHEADING":
			case "SETH":
				return Command.of (Kind.SET_HEADING, dialect, statement, null, rest);
			case "SETCOLOR":
			case "SETCOLOUR":
			case "COLOR":
			case "PENCOLOR":
				return Command.of (Kind.SET_COLOR, dialect, statement, null, rest);
			case "FILLCOLOR":
				return Command.of (Kind.SET_FILL_COLOR, dialect, statement, null, rest);
			case "SETPENSIZE":
				return Command.of (Kind.SET_PEN_SIZE, dialect, statement, null, rest);
			case "CIRCLE":
				return Command.of (Kind.CIRCLE, dialect, statement, null, rest);
			case "DOT":
				return Command.of (Kind.DOT, dialect, statement, null, rest);
			case "RECT":
				return new Command (Kind.RECT, dialect, statement, null, arguments (rest), null, null, null);
			case "TEXT":
				return Command.of (Kind.TURTLE_TEXT, dialect, statement, null, unquote (rest));
			case "SHOWTURTLE":
			case "ST":
				return Command.of (Kind.SHOW_TURTLE, dialect, statement, null);
			case "HIDETURTLE":
			case "HT":
				return Command.of (Kind.HIDE_TURTLE, dialect, statement, null);
			case "HEADING":
				return Command.of (Kind.SHOW_HEADING, dialect, statement, null);
			case "POSITION":
				return Command.of (Kind.SHOW_POSITION, dialect, statement, null);
			case "REPEAT":
				return parseRepeat (statement, rest, dialect, explicitMode);

			// Unified
			case "DEFINE":
				return parseDefine (statement, rest, dialect, explicitMode);
			case "CALL":
				if (!namePattern.matcher (rest).matches ())
					return Command.of (Kind.INVALID, dialect, statement, "Malformed CALL (expected a macro name)");
				return Command.of (Kind.CALL, dialect, statement, rest.toUpperCase (Locale.ROOT));
			default:
				break;
		}

		if (CommandClassifier.functionKeywords.contains (keyword))
			return new Command (Kind.FUNCTION, dialect, statement, keyword, arguments (rest), null, null, null);

		if (CommandClassifier.arrayKeywords.contains (keyword)) {
			List<String> arguments = arguments (rest);
			if (arguments.isEmpty ())
				return Command.of (Kind.INVALID, dialect, statement, keyword + " needs an array name");

			return new Command (Kind.ARRAY_OP, dialect, statement, keyword, arguments, null, null, null);
		}

		return Command.of (Kind.UNKNOWN, dialect, statement, keyword.isEmpty () ? statement : keyword);
	}

	/**
	 * <code>name = expr</code>, <code>name(i, j) = expr</code> or <code>name = [a, b, c]</code>
	 */
	private static Command parseAssignment (Kind kind, String assignment, String statement, Dialect dialect) {
		int equals = assignmentOperator (assignment);
		Matcher target = targetPattern.matcher (assignment.substring (0, equals).trim ());
		String expression = assignment.substring (equals + 1).trim ();

		if (!target.matches ())
			return Command.of (Kind.INVALID, dialect, statement, "Malformed assignment target: " + assignment.substring (0, equals).trim ());

		if (target.group (2) == null && expression.startsWith ("[") && expression.endsWith ("]")) {
			List<String> elements = new ArrayList<String> ();
			String inner = expression.substring (1, expression.length () - 1);
			if (!inner.trim ().isEmpty ()) {
				for (String element : splitTopLevel (inner, ','))
					elements.add (element.trim ());
			}

			return new Command (Kind.ASSIGN_ARRAY, dialect, statement, target.group (1), elements, null, null, null);
		}

		List<String> operands = new ArrayList<String> ();
		operands.add (expression);
		if (target.group (2) != null) {
			for (String index : splitTopLevel (target.group (2), ','))
				operands.add (index.trim ());
		}

		return new Command (kind, dialect, statement, target.group (1), operands, null, null, null);
	}

	/**
	 * <code>INPUT "prompt"; var</code> or <code>INPUT var</code>
	 */
	private static Command parseInput (String rest, String statement, Dialect dialect) {
		String prompt;
		String variable;

		int separator = -1;
		if (rest.startsWith ("\"")) {
			int close = rest.indexOf ('"', 1);
			if (close > 0) {
				separator = close + 1;
				while (separator < rest.length () && Character.isWhitespace (rest.charAt (separator)))
					++separator;
				if (separator >= rest.length () || (rest.charAt (separator) != ';' && rest.charAt (separator) != ','))
					separator = -1;
			}
		}

		if (separator > 0) {
			prompt = unquote (rest.substring (0, separator).trim ());
			variable = rest.substring (separator + 1).trim ();
		} else {
			variable = rest;
			prompt = "Enter value for " + rest + ": ";
		}

		if (!targetPattern.matcher (variable).matches ())
			return Command.of (Kind.INVALID, dialect, statement, "Malformed INPUT (expected a variable)");

		return Command.of (Kind.INPUT, dialect, statement, variable, prompt);
	}

	private static Command parseIf (String statement, Dialect dialect, Dialect explicitMode) {
		Matcher matcher = ifPattern.matcher (statement);
		if (!matcher.matches ())
			return Command.of (Kind.INVALID, dialect, statement, "Malformed IF (expected IF condition THEN statement)");

		Command thenBranch = branch (matcher.group (2).trim (), dialect, explicitMode);
		Command elseBranch = (matcher.group (3) == null ? null : branch (matcher.group (3).trim (), dialect, explicitMode));

		return new Command (Kind.IF, dialect, statement, null, Collections.singletonList (matcher.group (1).trim ()), null, thenBranch, elseBranch);
	}

	/**
	 * A THEN or ELSE branch, a bare line number means GOTO
	 */
	private static Command branch (String text, Dialect dialect, Dialect explicitMode) {
		if (text.matches ("\\d+"))
			return Command.of (Kind.GOTO, dialect, text, text);

		return parse (text, explicitMode);
	}

	private static Command parseRepeat (String statement, String rest, Dialect dialect, Dialect explicitMode) {
		int open = indexOutsideQuotes (rest, '[');
		if (open < 0)
			return Command.of (Kind.INVALID, dialect, statement, "Malformed REPEAT syntax");

		int close = matchingBracket (rest, open);
		if (close < 0)
			return Command.of (Kind.INVALID, dialect, statement, "Malformed REPEAT syntax");

		String count = rest.substring (0, open).trim ();
		if (count.isEmpty ())
			return Command.of (Kind.INVALID, dialect, statement, "Malformed REPEAT syntax");

		List<Command> body = parseBlock (rest.substring (open + 1, close), explicitMode);
		return new Command (Kind.REPEAT, dialect, statement, null, Collections.singletonList (count), body, null, null);
	}

	private static Command parseDefine (String statement, String rest, Dialect dialect, Dialect explicitMode) {
		int open = indexOutsideQuotes (rest, '[');
		if (open < 0)
			return Command.of (Kind.INVALID, dialect, statement, "Malformed DEFINE (missing [)");

		int close = matchingBracket (rest, open);
		if (close < 0)
			return Command.of (Kind.INVALID, dialect, statement, "Malformed DEFINE (unmatched ])");

		String name = rest.substring (0, open).trim ();
		if (!namePattern.matcher (name).matches ())
			return Command.of (Kind.INVALID, dialect, statement, "Malformed DEFINE (expected a macro name)");

		List<Command> body = parseBlock (rest.substring (open + 1, close), explicitMode);
		return new Command (Kind.DEFINE, dialect, statement, name.toUpperCase (Locale.ROOT), null, body, null, null);
	}

	/**
	 * Splits PRINT arguments into expressions and the separators <code>,</code> (tab) and <code>;</code> (join)
	 */
	private static List<String> printItems (String text) {
		List<String> items = new ArrayList<String> ();
		StringBuilder current = new StringBuilder ();
		boolean quoted = false;
		int depth = 0;

		for (int i = 0; i < text.length (); ++i) {
			char c = text.charAt (i);

			if (c == '"') {
				quoted = !quoted;
			} else if (!quoted && c == '(') {
				++depth;
			} else if (!quoted && c == ')') {
				depth = Math.max (0, depth - 1);
			} else if (!quoted && depth == 0 && (c == ',' || c == ';')) {
				if (current.toString ().trim ().length () > 0)
					items.add (current.toString ().trim ());
				items.add (String.valueOf (c));
				current.setLength (0);
				continue;
			}

			current.append (c);
		}

		if (current.toString ().trim ().length () > 0)
			items.add (current.toString ().trim ());

		return items;
	}

	/**
	 * Splits a bracket block into statements. A new statement starts at a keyword, a colon command or an assignment;
	 * REPEAT and DEFINE run up to the end of their own block and IF takes the rest of the block.
	 */
	static List<String> splitBlock (String block) {
		List<String> statements = new ArrayList<String> ();
		List<String> tokens = blockTokens (block);
		StringBuilder current = new StringBuilder ();
		String head = "";
		int depth = 0;
		boolean blockSeen = false;

		for (int i = 0; i < tokens.size (); ++i) {
			String token = tokens.get (i);
			String word = token.toUpperCase (Locale.ROOT);

			boolean headOwnsBlock = head.equals ("REPEAT") || head.equals ("DEFINE");
			boolean headComplete = !headOwnsBlock || blockSeen;

			if (depth == 0 && current.length () > 0 && !head.equals ("IF") && headComplete && startsStatement (head, token, word, i + 1 < tokens.size () ? tokens.get (i + 1) : "")) {
				statements.add (current.toString ());
				current.setLength (0);
				blockSeen = false;
			}

			if (current.length () == 0)
				head = CommandClassifier.firstWord (token);
			else
				current.append (' ');
			current.append (token);

			if (token.equals ("[")) {
				++depth;
			} else if (token.equals ("]")) {
				depth = Math.max (0, depth - 1);
				if (depth == 0)
					blockSeen = true;
			}
		}

		if (current.length () > 0)
			statements.add (current.toString ());

		return statements;
	}

	private static boolean startsStatement (String head, String token, String word, String nextToken) {
		if (CommandClassifier.isColonSyntax (token))
			return true;
		if (CommandClassifier.lineNumberedKeywords.contains (word) || CommandClassifier.turtleKeywords.contains (word))
			return true;
		if (word.equals ("DEFINE") || word.equals ("CALL") || CommandClassifier.functionKeywords.contains (word) || CommandClassifier.arrayKeywords.contains (word))
			return true;
		if (CommandClassifier.isAssignment (token))
			return true;

		// NAME = expression split over tokens, except the loop variable of a FOR or LET
		if (head.equals ("FOR") || head.equals ("LET"))
			return false;

		return namePattern.matcher (token).matches () && nextToken.startsWith ("=") && !nextToken.startsWith ("==");
	}

	/**
	 * Whitespace separated tokens, with brackets as tokens of their own and quoted text kept whole
	 */
	private static List<String> blockTokens (String block) {
		List<String> tokens = new ArrayList<String> ();
		StringBuilder current = new StringBuilder ();
		boolean quoted = false;

		for (int i = 0; i < block.length (); ++i) {
			char c = block.charAt (i);

			if (c == '"') {
				quoted = !quoted;
				current.append (c);
			} else if (!quoted && (c == '[' || c == ']')) {
				if (current.length () > 0)
					tokens.add (current.toString ());
				tokens.add (String.valueOf (c));
				current.setLength (0);
			} else if (!quoted && Character.isWhitespace (c)) {
				if (current.length () > 0)
					tokens.add (current.toString ());
				current.setLength (0);
			} else {
				current.append (c);
			}
		}

		if (current.length () > 0)
			tokens.add (current.toString ());

		return tokens;
	}

	/**
	 * Command arguments separated by commas, or by whitespace when there are no top-level commas
	 */
	static List<String> arguments (String text) {
		List<String> arguments = new ArrayList<String> ();
		if (text.trim ().isEmpty ())
			return arguments;

		List<String> parts = splitTopLevel (text, ',');
		if (parts.size () == 1) {
			parts = new ArrayList<String> ();
			StringBuilder current = new StringBuilder ();
			boolean quoted = false;
			int depth = 0;

			for (int i = 0; i < text.length (); ++i) {
				char c = text.charAt (i);
				if (c == '"')
					quoted = !quoted;
				else if (!quoted && c == '(')
					++depth;
				else if (!quoted && c == ')')
					depth = Math.max (0, depth - 1);

				if (!quoted && depth == 0 && Character.isWhitespace (c)) {
					if (current.length () > 0)
						parts.add (current.toString ());
					current.setLength (0);
				} else {
					current.append (c);
				}
			}

			if (current.length () > 0)
				parts.add (current.toString ());
		}

		for (String part : parts) {
			if (!part.trim ().isEmpty ())
				arguments.add (part.trim ());
		}

		return arguments;
	}

	/**
	 * Splits on a separator outside quotes, parentheses and brackets
	 */
	static List<String> splitTopLevel (String text, char separator) {
		List<String> parts = new ArrayList<String> ();
		StringBuilder current = new StringBuilder ();
		boolean quoted = false;
		int depth = 0;

		for (int i = 0; i < text.length (); ++i) {
			char c = text.charAt (i);

			if (c == '"')
				quoted = !quoted;
			else if (!quoted && (c == '(' || c == '['))
				++depth;
			else if (!quoted && (c == ')' || c == ']'))
				depth = Math.max (0, depth - 1);

			if (!quoted && depth == 0 && c == separator) {
				parts.add (current.toString ());
				current.setLength (0);
			} else {
				current.append (c);
			}
		}

		parts.add (current.toString ());
		return parts;
	}

	/**
	 * Index of the assignment <code>=</code> outside quotes and parentheses, skipping comparison operators
	 *
	 * @return The index, or -1 if there is none
	 */
	static int assignmentOperator (String text) {
		boolean quoted = false;
		int depth = 0;

		for (int i = 0; i < text.length (); ++i) {
			char c = text.charAt (i);

			if (c == '"') {
				quoted = !quoted;
			} else if (!quoted && c == '(') {
				++depth;
			} else if (!quoted && c == ')') {
				depth = Math.max (0, depth - 1);
			} else if (!quoted && depth == 0 && c == '=') {
				char before = (i > 0 ? text.charAt (i - 1) : ' ');
				char after = (i + 1 < text.length () ? text.charAt (i + 1) : ' ');
				if (before != '<' && before != '>' && before != '!' && before != '=' && after != '=')
					return i;
			}
		}

		return -1;
	}

	/**
	 * Index of the bracket closing the one at <code>open</code>, ignoring brackets inside quotes
	 *
	 * @return The index, or -1 if unmatched
	 */
	static int matchingBracket (String text, int open) {
		boolean quoted = false;
		int depth = 0;

		for (int i = open; i < text.length (); ++i) {
			char c = text.charAt (i);
			if (c == '"') {
				quoted = !quoted;
			} else if (!quoted && c == '[') {
				++depth;
			} else if (!quoted && c == ']') {
				if (--depth == 0)
					return i;
			}
		}

		return -1;
	}

	private static int indexOutsideQuotes (String text, char wanted) {
		boolean quoted = false;
		for (int i = 0; i < text.length (); ++i) {
			char c = text.charAt (i);
			if (c == '"')
				quoted = !quoted;
			else if (!quoted && c == wanted)
				return i;
		}

		return -1;
	}

	/**
	 * Words of an <code>S:</code> command; quoted words lose their quotes
	 */
	private static List<String> words (String text) {
		List<String> words = new ArrayList<String> ();
		Matcher matcher = wordPattern.matcher (text);
		while (matcher.find ())
			words.add (matcher.group (1) != null ? matcher.group (1) : matcher.group ());

		return words;
	}

	static String unquote (String text) {
		if (text.length () >= 2 && text.startsWith ("\"") && text.endsWith ("\""))
			return text.substring (1, text.length () - 1);

		return text;
	}
}
