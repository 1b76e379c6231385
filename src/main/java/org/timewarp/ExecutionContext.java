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

import java.time.Clock;
import java.util.Random;

/**
 * Per-run state owner: the variables, the turtle, the evaluator and the transcript, bridged to the host.
 * <p>Program output and diagnostics share one transcript. Diagnostics are prefixed <code>[!] </code> and, while a
 * statement runs, <code>Line N: </code> with N the source line.</p>
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public class ExecutionContext implements ExpressionEvaluator.Reporter {
	private static final String LOG_TAG = ExecutionContext.class.getSimpleName ();
	private static final boolean DEBUG = false;

	/** 1 after a successful host exchange, 0 after a failed one */
	public static final String HOST_STATUS = "HOST_STATUS";

	/** Message of the last failed host exchange */
	public static final String HOST_ERROR = "HOST_ERROR";

	private final VariableStore variables;
	private final TurtleGraphicsModel turtle;
	private final ExpressionEvaluator evaluator;
	private final TimeWarp.Host host;
	private final Clock clock;
	private final StringBuilder transcript = new StringBuilder ();

	private boolean debug = false;
	private int sourceLine = 0;

	/**
	 * @param variables The shared store
	 * @param turtle The graphics model, mirroring into the same store
	 * @param random Source for RND and RANDOM
	 * @param host Output and input adapter, or null when running headless
	 * @param clock Source for date and time commands
	 */
	public ExecutionContext (VariableStore variables, TurtleGraphicsModel turtle, Random random, TimeWarp.Host host, Clock clock) {
		this.variables = variables;
		this.turtle = turtle;
		this.host = host;
		this.clock = clock;
		this.evaluator = new ExpressionEvaluator (variables, random, this);
	}

	public VariableStore variables () {
		return variables;
	}

	public TurtleGraphicsModel turtle () {
		return turtle;
	}

	public ExpressionEvaluator evaluator () {
		return evaluator;
	}

	public Clock clock () {
		return clock;
	}

	public boolean debugGet () {
		return debug;
	}

	public void debugSet (boolean debug) {
		this.debug = debug;
	}

	/**
	 * Sets the source line diagnostics are attributed to, 0 outside a statement
	 */
	public void sourceLineSet (int sourceLine) {
		this.sourceLine = sourceLine;
	}

	/**
	 * Everything output so far, one line per output call
	 */
	public String transcript () {
		return transcript.toString ();
	}

	/**
	 * Writes a line of program output
	 */
	public void output (String text) {
		transcript.append (text).append ('\n');

		if (host == null)
			return;

		try {
			host.output (text);
		} catch (RuntimeException e) {
			hostFailure ("Output failed: " + e.getMessage ());
		}
	}

	/**
	 * Writes a diagnostic
	 */
	public void diagnostic (String message) {
		if (DEBUG)
			logD (LOG_TAG, message);

		output ("[!] " + (sourceLine > 0 ? "Line " + sourceLine + ": " : "") + message);
	}

	/**
	 * Writes a diagnostic only in debug mode
	 */
	public void debug (String message) {
		if (debug)
			diagnostic (message);
	}

	@Override
	public void report (String message) {
		diagnostic (message);
	}

	/**
	 * Asks the host for a line of input
	 *
	 * @param prompt Text shown to the user
	 * @return The input, or null when the host is missing or fails (HOST_STATUS and HOST_ERROR say why)
	 */
	public String input (String prompt) {
		if (host == null) {
			hostFailure ("No input available");
			return null;
		}

		String text;
		try {
			text = host.input (prompt);
		} catch (RuntimeException e) {
			hostFailure ("Input failed: " + e.getMessage ());
			return null;
		}

		if (text == null) {
			hostFailure ("No input available");
			return null;
		}

		variables.set (HOST_STATUS, 1);
		return text;
	}

	/**
	 * Records a failed host or surface exchange in the store; never throws
	 */
	public void hostFailure (String message) {
		if (DEBUG)
			logD (LOG_TAG, "Host failure: " + message);

		variables.set (HOST_STATUS, 0);
		variables.set (HOST_ERROR, message == null ? "Unknown error" : message);
	}
}
