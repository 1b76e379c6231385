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

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides which dialect a statement is written in. Pure and stateless.
 * <p>Priority: an explicit mode wins except that colon syntax is always honoured; then colon syntax; then the
 * keyword tables (line-numbered, turtle, unified); then a bare <code>name = expression</code> is a unified
 * assignment; anything else falls back to the colon dialect, which reports it as unknown.</p>
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public final class CommandClassifier {
	/** Keywords that open a line-numbered statement */
	static final Set<String> lineNumberedKeywords = new HashSet<String> (Arrays.asList (
		"LET",
		"PRINT",
		"?",
		"INPUT",
		"GOTO",
		"GOSUB",
		"IF",
		"FOR",
		"NEXT",
		"RETURN",
		"END",
		"REM",
		"DIM"
	));

	/** Keywords that open a turtle statement */
	static final Set<String> turtleKeywords = new HashSet<String> (Arrays.asList (
		"FORWARD", "FD",
		"BACK", "BK", "BACKWARD",
		"LEFT", "LT",
		"RIGHT", "RT",
		"PENUP", "PU",
		"PENDOWN", "PD",
		"CLEARSCREEN", "CS",
		"HOME",
		"SETXY", "SETX", "SETY",
		"SETHEADING", "SETH",
		"SETCOLOR", "SETCOLOUR", "COLOR", "PENCOLOR",
		"FILLCOLOR",
		"SETPENSIZE",
		"CIRCLE",
		"DOT",
		"RECT",
		"TEXT",
		"SHOWTURTLE", "ST",
		"HIDETURTLE", "HT",
		"HEADING",
		"POSITION",
		"REPEAT"
	));

	/** Function commands of the unified dialect, <code>SIN 30</code> stores its answer in RESULT */
	static final Set<String> functionKeywords = new HashSet<String> (Arrays.asList (
		"SIN", "COS", "TAN", "SQRT", "ABS", "INT", "RND", "LEN", "MID", "LEFT$", "RIGHT$", "UPPER", "LOWER"
	));

	/** Array commands of the unified dialect */
	static final Set<String> arrayKeywords = new HashSet<String> (Arrays.asList (
		"SUM", "AVG", "MIN", "MAX", "FIND", "SORT"
	));

	/** Keywords that can never start an assignment */
	private static final Set<String> controlKeywords = new HashSet<String> (Arrays.asList (
		"IF", "FOR", "WHILE", "LET"
	));

	private static final Pattern colonPattern = Pattern.compile ("^(?:[A-Za-z]+|J\\s*\\(.*\\))\\s*:.*", Pattern.DOTALL);
	private static final Pattern assignmentPattern = Pattern.compile ("^[A-Za-z_][A-Za-z0-9_]*\\$?\\s*(?:\\([^=]*\\))?\\s*=(?!=).*", Pattern.DOTALL);

	private CommandClassifier () {
	}

	/**
	 * Classifies a statement
	 *
	 * @param text The statement text
	 * @param explicitMode Dialect forced by the host, or null to detect
	 * @return The dialect the statement belongs to
	 */
	public static Dialect classify (String text, Dialect explicitMode) {
		String statement = (text == null ? "" : text.trim ());

		if (isColonSyntax (statement))
			return Dialect.COLON;
		if (explicitMode != null)
			return explicitMode;
		if (statement.isEmpty ())
			return Dialect.COLON;

		if (Character.isDigit (statement.charAt (0)))
			return Dialect.LINE_NUMBERED;

		String keyword = firstWord (statement);
		if (lineNumberedKeywords.contains (keyword))
			return Dialect.LINE_NUMBERED;
		if (turtleKeywords.contains (keyword))
			return Dialect.TURTLE;
		if (keyword.equals ("DEFINE") || keyword.equals ("CALL") || functionKeywords.contains (keyword) || arrayKeywords.contains (keyword))
			return Dialect.UNIFIED;

		if (isAssignment (statement))
			return Dialect.UNIFIED;

		return Dialect.COLON;
	}

	/**
	 * Whether the statement is written as <code>X:</code>, <code>MT:</code>, <code>J(cond):</code> and so on
	 */
	public static boolean isColonSyntax (String statement) {
		if (statement.length () >= 2 && statement.charAt (1) == ':')
			return true;

		return colonPattern.matcher (statement).matches ();
	}

	/**
	 * Whether the statement is a bare <code>name = expression</code> or <code>name(i) = expression</code>
	 */
	public static boolean isAssignment (String statement) {
		return assignmentPattern.matcher (statement).matches () && !controlKeywords.contains (firstWord (statement));
	}

	/**
	 * Upper-cased leading word; <code>?</code> counts as a word
	 */
	static String firstWord (String statement) {
		if (statement.startsWith ("?"))
			return "?";

		int end = 0;
		while (end < statement.length () && (Character.isLetterOrDigit (statement.charAt (end)) || statement.charAt (end) == '_' || statement.charAt (end) == '$'))
			++end;

		return statement.substring (0, end).toUpperCase (Locale.ROOT);
	}
}
