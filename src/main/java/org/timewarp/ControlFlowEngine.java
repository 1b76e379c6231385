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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.timewarp.Command.Kind;

/**
 * Drives a loaded {@link Program}: the program counter, labels and line numbers, the GOSUB and FOR stacks, REPEAT
 * and macro expansion, and the one-shot match flag set by <code>Y:</code> and <code>N:</code>.
 * <p>States run <code>IDLE -&gt; RUNNING -&gt; {PAUSED, HALTED}</code>. A paused engine continues with
 * {@link #resume()} or {@link #step()}.</p>
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public class ControlFlowEngine {
	private static final String LOG_TAG = ControlFlowEngine.class.getSimpleName ();
	private static final boolean DEBUG = false;

	/** Sub-statements, and passes, one REPEAT may execute */
	public static final int REPEAT_LIMIT = 5000;

	/** Nested macro calls allowed */
	public static final int MACRO_DEPTH_LIMIT = 16;

	/** Engine states */
	public static enum State {
		IDLE,
		RUNNING,
		PAUSED,
		HALTED
	}

	private final Program program;
	private final ExecutionContext context;
	private final CommandHandlers handlers;
	private final ExpressionEvaluator evaluator;
	private final Set<Integer> breakpoints;
	private final int watchdog;

	private final Deque<Integer> gosubStack = new ArrayDeque<Integer> ();
	private final List<ForFrame> forStack = new ArrayList<ForFrame> ();
	private final HashMap<String, List<Command>> macros = new HashMap<String, List<Command>> ();
	private final List<String> macroCalls = new ArrayList<String> ();

	private State state = State.IDLE;
	private Boolean matchFlag = null;
	private boolean failed = false;
	private boolean stopRequested = false;
	private boolean breakpointPassed = false;
	private int pc = 0;
	private int iterations = 0;

	/**
	 * @param program The loaded program
	 * @param context Per-run state
	 * @param breakpoints Statement indexes to pause before, read live so the host may change them while paused
	 * @param watchdog Maximum top-level statements per run
	 */
	public ControlFlowEngine (Program program, ExecutionContext context, Set<Integer> breakpoints, int watchdog) {
		this.program = program;
		this.context = context;
		this.handlers = new CommandHandlers (context);
		this.evaluator = context.evaluator ();
		this.breakpoints = (breakpoints == null ? new HashSet<Integer> () : breakpoints);
		this.watchdog = watchdog;
	}

	public State state () {
		return state;
	}

	/**
	 * Index of the next statement to run
	 */
	public int pc () {
		return pc;
	}

	/**
	 * Whether the run ended on an unrecoverable error
	 */
	public boolean failed () {
		return failed;
	}

	/**
	 * Pending match flag, null when none
	 */
	public Boolean matchFlag () {
		return matchFlag;
	}

	public int gosubDepth () {
		return gosubStack.size ();
	}

	public int forDepth () {
		return forStack.size ();
	}

	/**
	 * Defined macro names
	 */
	public Set<String> macros () {
		return Collections.unmodifiableSet (macros.keySet ());
	}

	/**
	 * Runs until the program halts or reaches a breakpoint
	 *
	 * @return The state the run stopped in
	 */
	public State run () {
		if (state == State.HALTED)
			return state;

		state = State.RUNNING;
		while (state == State.RUNNING) {
			if (atBreakpoint ()) {
				state = State.PAUSED;
				context.sourceLineSet (0);
				context.output ("[!] Breakpoint hit at line " + program.line (pc).sourceLine);
				break;
			}

			tick ();
		}

		return state;
	}

	/**
	 * Continues a paused run past the breakpoint it stopped on
	 */
	public State resume () {
		if (state != State.PAUSED)
			return state;

		breakpointPassed = true;
		return run ();
	}

	/**
	 * Runs exactly one top-level statement, ignoring breakpoints
	 */
	public State step () {
		if (state == State.HALTED)
			return state;

		state = State.RUNNING;
		tick ();
		if (state == State.RUNNING)
			state = State.PAUSED;

		return state;
	}

	/**
	 * Asks the run to stop at the next statement boundary
	 */
	public void stop () {
		stopRequested = true;
		if (state == State.PAUSED || state == State.IDLE)
			state = State.HALTED;
	}

	private boolean atBreakpoint () {
		boolean passed = breakpointPassed;
		breakpointPassed = false;

		return !passed && pc < program.size () && breakpoints.contains (pc);
	}

	/**
	 * One iteration of the run loop
	 */
	private void tick () {
		context.sourceLineSet (0);
		if (stopRequested) {
			halt ("Program stopped");
			return;
		}

		if (pc < 0 || pc >= program.size ()) {
			halt (null);
			return;
		}

		if (++iterations > watchdog) {
			halt ("Program stopped: Maximum iterations reached");
			return;
		}

		ProgramLine line = program.line (pc);
		context.sourceLineSet (line.sourceLine);
		context.debug ("Executing: " + line.text);

		StepResult result;
		try {
			result = execute (line.command, pc, false);
		} catch (RuntimeException e) {
			if (DEBUG)
				e.printStackTrace ();

			context.diagnostic ("Runtime error: " + e.getMessage ());
			result = StepResult.ERROR;
		}

		if (DEBUG)
			logV (LOG_TAG, pc + ": " + line.command + " => " + result);

		switch (result.type) {
			case CONTINUE:
				++pc;
				break;
			case JUMP:
				pc = result.target;
				break;
			case END:
				halt (null);
				break;
			case ERROR:
				failed = true;
				halt ("Program terminated due to error");
				break;
		}
	}

	private void halt (String message) {
		if (message != null)
			context.diagnostic (message);

		context.sourceLineSet (0);
		state = State.HALTED;

		if (DEBUG)
			logD (LOG_TAG, "Halted after " + iterations + " iteration(s)" + (message == null ? "" : ": " + message));
	}

	/**
	 * Executes a command
	 *
	 * @param command The command
	 * @param index Statement index of the enclosing top-level line
	 * @param nested True inside a REPEAT or macro body, where jumps are ignored
	 * @return What the run loop does next
	 */
	StepResult execute (Command command, int index, boolean nested) {
		// The match flag lives for exactly one statement
		Boolean pending = matchFlag;
		matchFlag = null;

		if (nested && isJump (command.kind)) {
			context.debug (command.kind + " ignored inside a block");
			return StepResult.CONTINUE;
		}

		switch (command.kind) {
			case EMPTY:
			case REMARK:
			case LABEL:
				return StepResult.CONTINUE;
			case UNKNOWN:
				context.diagnostic ("Unknown command: " + command.name);
				return StepResult.CONTINUE;
			case INVALID:
				context.diagnostic (command.name);
				return StepResult.CONTINUE;
			case END:
				return StepResult.END;

			case YES:
			case NO:
				matchFlag = Boolean.valueOf (evaluator.evaluateCondition (command.argument (0)));
				return StepResult.CONTINUE;
			case TEXT:
				if (pending == null || pending)
					handlers.execute (command);
				return StepResult.CONTINUE;
			case MATCH_TEXT:
				if (pending != null && pending)
					handlers.execute (command);
				return StepResult.CONTINUE;
			case JUMP:
				if (pending == null || pending)
					return jumpToLabel (command.name);
				return StepResult.CONTINUE;
			case MATCH_JUMP:
				if (pending != null && pending)
					return jumpToLabel (command.name);
				return StepResult.CONTINUE;
			case JUMP_IF:
				if (evaluator.evaluateCondition (command.argument (0)))
					return jumpToLabel (command.name);
				return StepResult.CONTINUE;
			case BRANCH_MULTI:
				return branch (command);

			case IF:
				if (evaluator.evaluateCondition (command.argument (0)))
					return execute (command.thenBranch, index, nested);
				if (command.elseBranch != null)
					return execute (command.elseBranch, index, nested);
				return StepResult.CONTINUE;
			case FOR:
				return forStart (command, index);
			case NEXT:
				return forNext (command);
			case GOTO:
				return jumpToTarget (command.name);
			case GOSUB: {
				int target = resolve (command.name);
				if (target < 0)
					return StepResult.CONTINUE;

				gosubStack.push (index + 1);
				return StepResult.jump (target);
			}
			case RETURN:
				if (gosubStack.isEmpty ()) {
					context.diagnostic ("RETURN without GOSUB");
					return StepResult.CONTINUE;
				}
				return StepResult.jump (gosubStack.pop ());

			case REPEAT:
				return repeat (command, index);
			case DEFINE:
				macros.put (command.name, command.body);
				context.debug ("Macro " + command.name + " defined");
				return StepResult.CONTINUE;
			case CALL:
				return call (command, index);

			default:
				if (!handlers.execute (command))
					context.diagnostic ("Unknown command: " + command.kind);
				return StepResult.CONTINUE;
		}
	}

	/**
	 * Commands that move the program counter, ignored inside blocks
	 */
	private static boolean isJump (Kind kind) {
		switch (kind) {
			case JUMP:
			case JUMP_IF:
			case MATCH_JUMP:
			case BRANCH_MULTI:
			case FOR:
			case NEXT:
			case GOTO:
			case GOSUB:
			case RETURN:
				return true;
			default:
				return false;
		}
	}

	private StepResult forStart (Command command, int index) {
		double start = evaluator.evaluateNumber (command.argument (0), 0);
		double limit = evaluator.evaluateNumber (command.argument (1), 0);
		double step = evaluator.evaluateNumber (command.argument (2), 1);
		String variable = VariableStore.key (command.name);

		// Re-entering a loop replaces its frame
		for (int i = forStack.size () - 1; i >= 0; --i) {
			if (forStack.get (i).variable.equals (variable))
				forStack.remove (i);
		}

		context.variables ().set (variable, start);
		forStack.add (new ForFrame (variable, limit, step, index + 1));
		return StepResult.CONTINUE;
	}

	private StepResult forNext (Command command) {
		if (forStack.isEmpty ()) {
			context.diagnostic ("NEXT without FOR");
			return StepResult.CONTINUE;
		}

		int found = forStack.size () - 1;
		if (!command.name.isEmpty ()) {
			String variable = VariableStore.key (command.name);
			while (found >= 0 && !forStack.get (found).variable.equals (variable))
				--found;

			if (found < 0) {
				context.diagnostic ("NEXT without FOR: " + command.name);
				return StepResult.CONTINUE;
			}
		}

		// Inner loops left open by the matched NEXT are abandoned
		while (forStack.size () > found + 1)
			forStack.remove (forStack.size () - 1);

		ForFrame frame = forStack.get (found);
		Value current = context.variables ().get (frame.variable);
		double value = (current == null ? 0 : current.toNumber (0)) + frame.step;
		context.variables ().set (frame.variable, value);

		if (frame.continues (value))
			return StepResult.jump (frame.returnIndex);

		forStack.remove (found);
		return StepResult.CONTINUE;
	}

	/**
	 * <code>BRANCH:MULTI cond:label, cond:label</code> jumps to the label of the first true condition
	 */
	private StepResult branch (Command command) {
		if (!command.name.equals ("MULTI")) {
			context.diagnostic ("Unknown branch operation: " + command.name);
			return StepResult.CONTINUE;
		}

		for (String pair : command.arguments) {
			int colon = pair.lastIndexOf (':');
			if (colon < 0) {
				context.diagnostic ("Malformed branch: " + pair);
				continue;
			}

			if (evaluator.evaluateCondition (pair.substring (0, colon)))
				return jumpToLabel (pair.substring (colon + 1).trim ());
		}

		return StepResult.CONTINUE;
	}

	private StepResult repeat (Command command, int index) {
		int count = (int) evaluator.evaluateNumber (command.argument (0), 0);
		int executed = 0;

		// Passes count as well, so an empty body cannot spin
		for (int i = 0; i < count; ++i) {
			if (i >= REPEAT_LIMIT) {
				context.diagnostic ("REPEAT aborted: expansion too large");
				return StepResult.CONTINUE;
			}

			for (Command inner : command.body) {
				if (++executed > REPEAT_LIMIT) {
					context.diagnostic ("REPEAT aborted: expansion too large");
					return StepResult.CONTINUE;
				}

				StepResult result = execute (inner, index, true);
				if (result.type == StepResult.Type.END || result.type == StepResult.Type.ERROR)
					return result;
			}
		}

		return StepResult.CONTINUE;
	}

	private StepResult call (Command command, int index) {
		List<Command> body = macros.get (command.name);
		if (body == null) {
			context.diagnostic ("Unknown macro: " + command.name);
			return StepResult.CONTINUE;
		}

		if (macroCalls.contains (command.name)) {
			context.diagnostic ("Macro recursion detected: " + command.name);
			return StepResult.CONTINUE;
		}

		if (macroCalls.size () >= MACRO_DEPTH_LIMIT) {
			context.diagnostic ("Macro call depth limit exceeded");
			return StepResult.CONTINUE;
		}

		macroCalls.add (command.name);
		try {
			for (Command inner : body) {
				StepResult result = execute (inner, index, true);
				if (result.type == StepResult.Type.END || result.type == StepResult.Type.ERROR)
					return result;
			}
		} finally {
			macroCalls.remove (macroCalls.size () - 1);
		}

		return StepResult.CONTINUE;
	}

	/**
	 * GOTO and GOSUB targets: a line number, otherwise a label
	 */
	private StepResult jumpToTarget (String target) {
		int index = resolve (target);
		return index < 0 ? StepResult.CONTINUE : StepResult.jump (index);
	}

	private int resolve (String target) {
		String trimmed = target.trim ();
		if (trimmed.matches ("\\d+")) {
			int index = program.lineNumberIndex (Integer.parseInt (trimmed));
			if (index < 0)
				context.diagnostic ("Unknown line number: " + trimmed);
			return index;
		}

		int index = program.labelIndex (trimmed.toUpperCase (Locale.ROOT));
		if (index < 0)
			context.diagnostic ("Unknown label: " + trimmed);
		return index;
	}

	private StepResult jumpToLabel (String label) {
		int index = program.labelIndex (label.trim ().toUpperCase (Locale.ROOT));
		if (index < 0) {
			context.diagnostic ("Unknown label: " + label.trim ());
			return StepResult.CONTINUE;
		}

		return StepResult.jump (index);
	}
}
