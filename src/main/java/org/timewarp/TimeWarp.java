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

import java.io.File;
import java.io.IOException;
import java.time.Clock;
import java.util.HashSet;
import java.util.Random;

/**
 * TimeWarp for Java: an educational interpreter for four small teaching dialects (colon commands, line-numbered
 * BASIC, turtle graphics and a unified blend of the three) sharing one variable store and one turtle.
 * <p>Typical use is {@link #script(String)} then {@link #run()}, after which {@link #stdout} holds the transcript
 * and the variables stay readable through {@link #variableGet(String)}.</p>
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public class TimeWarp {
	// Public information
	public static final int VERSION_MAJOR = 1;
	public static final int VERSION_MINOR = 0;

	// Internal settings
	private static final String LOG_TAG = TimeWarp.class.getSimpleName ();
	private static final boolean DEBUG = false;

	// Run defaults
	private static final int watchdogTickLimitDefault = 10000;

	private int watchdogTickLimit = watchdogTickLimitDefault;
	private Dialect mode = null;
	private boolean preserve = false;
	private boolean debug = false;
	private Host host = null;
	private Long randomSeed = null;
	private Clock clock = Clock.systemDefaultZone ();
	private final HashSet<Integer> breakpoints = new HashSet<Integer> ();

	// Engine internals
	private final VariableStore variables = new VariableStore ();
	private final TurtleGraphicsModel turtle = new TurtleGraphicsModel (variables);
	private Program program = null;
	private ExecutionContext context = null;
	private ControlFlowEngine engine = null;
	private int lineNumber = 0;

	/** Program output and diagnostics of the last run */
	public String stdout = "";

	/** Load or fatal error output, populated with {@link #error(String)} */
	public String stderr = "";

	/** The console, window or test harness a program talks to */
	public interface Host {
		/**
		 * Shows a line of program output
		 *
		 * @param text The line, without a line ending
		 */
		void output (String text);

		/**
		 * Asks the user for a line of input
		 *
		 * @param prompt Text to show
		 * @return The input, or null when none is available
		 */
		String input (String prompt);
	}

	/**
	 * Constructor
	 */
	public TimeWarp () {
		if (DEBUG)
			logD (LOG_TAG, "Instantiating TimeWarp");
	}

	/**
	 * Gets the watchdog tick limit
	 *
	 * @return Maximum statements per run
	 */
	public int watchdogGet () {
		return watchdogTickLimit;
	}

	/**
	 * Sets the watchdog tick limit, a negative limit restores the default
	 *
	 * @param watchdogTickLimit Maximum statements per run
	 */
	public void watchdogSet (int watchdogTickLimit) {
		this.watchdogTickLimit = (watchdogTickLimit < 0 ? watchdogTickLimitDefault : watchdogTickLimit);

		if (DEBUG)
			logD (LOG_TAG, "Set watchdog tick limit=" + this.watchdogTickLimit);
	}

	public Dialect modeGet () {
		return mode;
	}

	/**
	 * Forces every statement to one dialect, or null to detect per statement; applies from the next
	 * {@link #script(String)}
	 */
	public void modeSet (Dialect mode) {
		this.mode = mode;
	}

	/**
	 * Keeps variables and the turtle across runs instead of starting each run clean
	 */
	public void preserveSet (boolean preserve) {
		this.preserve = preserve;
	}

	/**
	 * Sets the console programs talk to, or null to run headless (input is then unavailable)
	 */
	public void hostSet (Host host) {
		this.host = host;
	}

	/**
	 * Sets the surface turtle drawing goes to, or null to only keep the primitive log
	 */
	public void surfaceSet (RenderSurface surface) {
		turtle.surfaceSet (surface);
	}

	/**
	 * Makes RND and RANDOM repeatable
	 */
	public void randomSeedSet (long seed) {
		randomSeed = seed;
	}

	/**
	 * Sets the clock date and time commands read
	 */
	public void clockSet (Clock clock) {
		this.clock = (clock == null ? Clock.systemDefaultZone () : clock);
	}

	/**
	 * Turns program-level debug diagnostics on or off, including for a run in progress
	 */
	public void debugToggle (boolean debug) {
		this.debug = debug;
		if (context != null)
			context.debugSet (debug);
	}

	/**
	 * Sets or clears a breakpoint before a statement index
	 */
	public void breakpointSet (int index, boolean enabled) {
		if (enabled)
			breakpoints.add (index);
		else
			breakpoints.remove (index);
	}

	/**
	 * Flips a breakpoint
	 *
	 * @return True if the breakpoint is now set
	 */
	public boolean breakpointToggle (int index) {
		boolean enabled = !breakpoints.contains (index);
		breakpointSet (index, enabled);
		return enabled;
	}

	public void breakpointRemoveAll () {
		breakpoints.clear ();
	}

	/**
	 * Resets the instance: output, variables, turtle and any paused run
	 */
	public void reset () {
		lineNumber = 0;
		stdout = stderr = "";
		variableRemoveAll ();
		turtle.reset ();
		context = null;
		engine = null;

		if (DEBUG)
			logD (LOG_TAG, "TimeWarp engine reset");
	}

	/**
	 * Returns whether a variable (scalar or array) is set
	 *
	 * @param key Name of variable, any case
	 */
	public boolean variableHas (String key) {
		return variables.has (key);
	}

	/**
	 * Gets a variable as text
	 *
	 * @param key Name of variable, any case
	 * @return Variable content, or null if no scalar of that name is set
	 */
	public String variableGet (String key) {
		Value value = variables.get (key);
		return value == null ? null : value.toText ();
	}

	/**
	 * Gets a variable
	 *
	 * @param key Name of variable, any case
	 * @return The value, or null if no scalar of that name is set
	 */
	public Value variableValueGet (String key) {
		return variables.get (key);
	}

	/**
	 * Sets a variable, numeric text is stored as a number
	 *
	 * @param key Name of variable, any case
	 * @param value Content of variable
	 */
	public void variableSet (String key, String value) {
		if (DEBUG)
			logV (LOG_TAG, "Setting variable: " + key + "=" + value);

		variables.set (key, Value.coerce (value));
	}

	/**
	 * Sets a variable
	 *
	 * @param key Name of variable, any case
	 * @param value Content of variable
	 */
	public void variableSet (String key, int value) {
		variableSet (key, (double) value);
	}

	/**
	 * Sets a variable
	 *
	 * @param key Name of variable, any case
	 * @param value Content of variable
	 */
	public void variableSet (String key, long value) {
		variableSet (key, (double) value);
	}

	/**
	 * Sets a variable
	 *
	 * @param key Name of variable, any case
	 * @param value Content of variable
	 */
	public void variableSet (String key, double value) {
		if (DEBUG)
			logV (LOG_TAG, "Setting variable: " + key + "=" + value);

		variables.set (key, value);
	}

	/**
	 * Unset a variable
	 *
	 * @param key Name of variable, any case
	 */
	public void variableRemove (String key) {
		if (DEBUG)
			logV (LOG_TAG, "Removing variable: " + key);

		variables.remove (key);
	}

	/**
	 * Unsets all variables
	 */
	public void variableRemoveAll () {
		if (DEBUG)
			logV (LOG_TAG, "Removing all variables");

		variables.clear ();
	}

	/**
	 * Retrieves the complete variable store
	 */
	public VariableStore variableStoreGet () {
		return variables;
	}

	/**
	 * Saves the variables as a JSON document
	 *
	 * @param file Destination
	 * @return True if saved, or false if not (stderr will contain the error reason)
	 */
	public boolean variablesSave (File file) {
		try {
			FileStore.saveVariables (file, variables);
			return true;
		} catch (IOException e) {
			return error ("Cannot save variables: " + e.getMessage ());
		}
	}

	/**
	 * Merges a saved JSON document into the variables
	 *
	 * @param file Source
	 * @return True if loaded, or false if not (stderr will contain the error reason)
	 */
	public boolean variablesLoad (File file) {
		try {
			FileStore.loadVariables (file, variables);
			return true;
		} catch (IOException e) {
			return error ("Cannot load variables: " + e.getMessage ());
		}
	}

	public TurtleGraphicsModel turtleGet () {
		return turtle;
	}

	/**
	 * The last loaded program, or null
	 */
	public Program programGet () {
		return program;
	}

	/**
	 * State of the current run, IDLE when nothing has run since the last load
	 */
	public ControlFlowEngine.State stateGet () {
		return engine == null ? ControlFlowEngine.State.IDLE : engine.state ();
	}

	/**
	 * Loads a program using the mode set with {@link #modeSet(Dialect)}
	 *
	 * @param source Program text
	 * @return True if the program is ready to run, or false if its structure is invalid (stderr will contain the error reason)
	 */
	public boolean script (String source) {
		return script (source, mode);
	}

	/**
	 * Loads a program
	 *
	 * @param source Program text
	 * @param explicitMode Dialect for every statement, or null to detect per statement
	 * @return True if the program is ready to run, or false if its structure is invalid (stderr will contain the error reason)
	 */
	public boolean script (String source, Dialect explicitMode) {
		if (DEBUG)
			logD (LOG_TAG, source == null ? "No input script passed" : "Input script was passed");

		lineNumber = 0;
		stdout = stderr = "";
		program = null;
		context = null;
		engine = null;

		try {
			program = ProgramLoader.load (source, explicitMode);
			return true;
		} catch (ProgramLoadException e) {
			lineNumber = e.getSourceLine ();
			return error (e.getMessage ());
		} catch (Exception e) {
			if (DEBUG)
				e.printStackTrace ();

			return error ("Loader crash: " + e.toString ());
		}
	}

	/**
	 * Runs the program last loaded via {@link #script(String)}
	 * <p>Each run starts with clean variables and a clean turtle unless {@link #preserveSet(boolean)} was turned on.
	 * A breakpoint pauses the run; {@link #resume()} or {@link #step()} carries on.</p>
	 *
	 * @return True if the run ended normally or paused, or false if there was an error (stderr will contain the error reason)
	 */
	public boolean run () {
		try {
			if (!prepare ())
				return false;

			engine.run ();
			return finish ();
		} catch (Exception e) {
			if (DEBUG)
				e.printStackTrace ();

			return error ("Executor crash: " + e.toString ());
		}
	}

	/**
	 * Continues a run paused at a breakpoint
	 *
	 * @return As {@link #run()}
	 */
	public boolean resume () {
		if (engine == null || engine.state () != ControlFlowEngine.State.PAUSED)
			return error ("Program is not paused");

		try {
			engine.resume ();
			return finish ();
		} catch (Exception e) {
			if (DEBUG)
				e.printStackTrace ();

			return error ("Executor crash: " + e.toString ());
		}
	}

	/**
	 * Runs a single statement, starting a new run if none is paused
	 *
	 * @return As {@link #run()}
	 */
	public boolean step () {
		try {
			if ((engine == null || engine.state () == ControlFlowEngine.State.HALTED) && !prepare ())
				return false;

			engine.step ();
			return finish ();
		} catch (Exception e) {
			if (DEBUG)
				e.printStackTrace ();

			return error ("Executor crash: " + e.toString ());
		}
	}

	/**
	 * Stops the current run at the next statement boundary
	 */
	public void stop () {
		if (engine != null)
			engine.stop ();
	}

	/**
	 * Starts a fresh run
	 */
	private boolean prepare () {
		// A failed load keeps its error for any later run
		if (program == null)
			return stderr.isEmpty () ? error ("No program loaded") : false;

		lineNumber = 0;
		stdout = stderr = "";

		if (!preserve) {
			variables.clear ();
			turtle.reset ();
		}

		Random random = (randomSeed == null ? new Random () : new Random (randomSeed));
		context = new ExecutionContext (variables, turtle, random, host, clock);
		context.debugSet (debug);
		engine = new ControlFlowEngine (program, context, breakpoints, watchdogTickLimit);
		return true;
	}

	/**
	 * Publishes the transcript and, once halted, draws the final frame
	 */
	private boolean finish () {
		if (engine.state () == ControlFlowEngine.State.HALTED) {
			try {
				turtle.redraw ();
			} catch (RuntimeException e) {
				context.hostFailure ("Drawing failed: " + e.getMessage ());
			}
		}

		stdout = context.transcript ();

		if (engine.failed ())
			return error ("Program terminated due to error");

		return true;
	}

	/**
	 * Sends an error to stderr with line number (if available)
	 *
	 * @param message Optional string or null of the message to display
	 * @return False (used as a placeholder for returns in other methods)
	 */
	private boolean error (String message) {
		stderr = (lineNumber > 0 ? "Line " + lineNumber + ": " : "") + (message != null ? message : "Unknown error");
		return false;
	}

	/**
	 * Implementation specific logging for Verbose messages
	 *
	 * @param msg The message to log
	 */
	protected static void logV (String tag, String msg) {
		System.out.println ("V: " + (tag.isEmpty () ? "" : tag + ": ") + msg);
	}

	/**
	 * Implementation specific logging for Debug messages
	 *
	 * @param msg The message to log
	 */
	protected static void logD (String tag, String msg) {
		System.out.println ("D: " + (tag.isEmpty () ? "" : tag + ": ") + msg);
	}
}
