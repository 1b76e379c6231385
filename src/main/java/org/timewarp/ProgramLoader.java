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
import static org.timewarp.TimeWarp.logV;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns program text into a {@link Program}.
 * <p>Comments are removed first: whole lines starting with <code>;</code>, <code>//</code>, <code>'</code> or an
 * unnumbered <code>REM</code>, and trailing <code>;</code> comments on turtle and bracket lines (elsewhere
 * <code>;</code> is PRINT syntax). Leading line numbers are recorded and removed. A bracket block spanning several
 * lines becomes one logical statement by tracking the bracket balance outside quotes. Blank lines are dropped, so
 * every index is an executable statement, and labels point at their statement index.</p>
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public final class ProgramLoader {
	private static final String LOG_TAG = ProgramLoader.class.getSimpleName ();
	private static final boolean DEBUG = false;

	/** Statements where <code>;</code> is syntax rather than a comment */
	private static final Set<String> semicolonKeywords = new HashSet<String> (Arrays.asList ("PRINT", "?", "INPUT", "IF"));

	private static final Pattern lineNumberPattern = Pattern.compile ("^(\\d+)(?:\\s+(.*))?$", Pattern.DOTALL);

	private ProgramLoader () {
	}

	/**
	 * Loads a program
	 *
	 * @param source Program text
	 * @param explicitMode Dialect forced by the host, or null to detect per statement
	 * @return The loaded program
	 * @throws ProgramLoadException If the bracket structure is corrupt or a label is defined twice
	 */
	public static Program load (String source, Dialect explicitMode) throws ProgramLoadException {
		if (source == null)
			throw new ProgramLoadException (0, "No program given");

		// Remove any UTF BOM
		if (source.startsWith ("\uFEFF"))
			source = source.substring (1);

		// UNIX-ify any line endings
		String[] sourceLines = source.replace ("\r\n", "\n").replace ('\r', '\n').split ("\n", -1);

		List<ProgramLine> lines = new ArrayList<ProgramLine> ();
		HashMap<String, Integer> labels = new HashMap<String, Integer> ();

		StringBuilder pending = null;
		Integer pendingNumber = null;
		int pendingLine = 0;
		int balance = 0;

		for (int i = 0; i < sourceLines.length; ++i) {
			int sourceLine = i + 1;
			String text = sourceLines[i].trim ();

			if (pending != null) {
				// Continuation of an open bracket block
				text = stripComment (text);
				if (text.isEmpty () || isCommentLine (text))
					continue;

				balance = bracketBalance (text, balance);
				if (balance < 0)
					throw new ProgramLoadException (sourceLine, "Unexpected ] without matching [");

				pending.append (' ').append (text);
				if (balance == 0) {
					add (lines, labels, pendingNumber, pending.toString (), pendingLine, explicitMode);
					pending = null;
				}
				continue;
			}

			if (text.isEmpty () || isCommentLine (text))
				continue;

			Integer lineNumber = null;
			Matcher matcher = lineNumberPattern.matcher (text);
			if (matcher.matches ()) {
				lineNumber = Integer.valueOf (matcher.group (1));
				text = (matcher.group (2) == null ? "" : matcher.group (2).trim ());
			} else if (CommandClassifier.firstWord (text).equals ("REM")) {
				// Unnumbered remarks are not statements
				continue;
			}

			if (CommandClassifier.isColonSyntax (text)) {
				add (lines, labels, lineNumber, text, sourceLine, explicitMode);
				continue;
			}

			if (hasTrailingComment (text))
				text = stripComment (text);

			balance = bracketBalance (text, 0);
			if (balance < 0)
				throw new ProgramLoadException (sourceLine, "Unexpected ] without matching [");

			if (balance > 0) {
				pending = new StringBuilder (text);
				pendingNumber = lineNumber;
				pendingLine = sourceLine;
			} else {
				add (lines, labels, lineNumber, text, sourceLine, explicitMode);
			}
		}

		if (pending != null)
			throw new ProgramLoadException (pendingLine, "Unclosed [ block");

		if (DEBUG) {
			logD (LOG_TAG, "Loaded " + lines.size () + " statement(s) and " + labels.size () + " label(s)");
			for (ProgramLine line : lines)
				logV (LOG_TAG, line.toString ());
		}

		return new Program (lines, labels);
	}

	private static void add (List<ProgramLine> lines, HashMap<String, Integer> labels, Integer lineNumber, String text, int sourceLine, Dialect explicitMode) throws ProgramLoadException {
		List<Command> commands = (text.isEmpty () ? Collections.singletonList (CommandParser.parse ("", Dialect.LINE_NUMBERED)) : CommandParser.parseLine (text, explicitMode));

		for (int i = 0, j = commands.size (); i < j; ++i) {
			Command command = commands.get (i);
			int index = lines.size ();

			if (command.kind == Command.Kind.LABEL) {
				String label = command.name.toUpperCase (Locale.ROOT);
				if (label.isEmpty ())
					throw new ProgramLoadException (sourceLine, "Label has no name");
				if (labels.containsKey (label))
					throw new ProgramLoadException (sourceLine, "Duplicate label: " + command.name);

				labels.put (label, index);
			}

			lines.add (new ProgramLine (i == 0 ? lineNumber : null, command.text, index, sourceLine, command));
		}
	}

	/**
	 * Whole-line comments
	 */
	static boolean isCommentLine (String text) {
		return text.startsWith (";") || text.startsWith ("//") || text.startsWith ("'");
	}

	/**
	 * Any non-colon line may end in a <code>;</code> comment, except where <code>;</code> separates PRINT or INPUT
	 * items; an IF may hold a PRINT in either branch
	 */
	private static boolean hasTrailingComment (String text) {
		String keyword = CommandClassifier.firstWord (text);
		return !semicolonKeywords.contains (keyword);
	}

	/**
	 * Removes a <code>;</code> comment outside quotes
	 */
	static String stripComment (String text) {
		boolean quoted = false;
		for (int i = 0; i < text.length (); ++i) {
			char c = text.charAt (i);
			if (c == '"')
				quoted = !quoted;
			else if (!quoted && c == ';')
				return text.substring (0, i).trim ();
		}

		return text;
	}

	/**
	 * Bracket depth after the text, starting from <code>balance</code>; negative as soon as a <code>]</code> has no
	 * matching <code>[</code>
	 */
	static int bracketBalance (String text, int balance) {
		boolean quoted = false;

		for (int i = 0; i < text.length (); ++i) {
			char c = text.charAt (i);
			if (c == '"') {
				quoted = !quoted;
			} else if (!quoted && c == '[') {
				++balance;
			} else if (!quoted && c == ']') {
				if (--balance < 0)
					return balance;
			}
		}

		return balance;
	}
}
