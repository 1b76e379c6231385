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
import java.util.Collections;
import java.util.List;

/**
 * A statement parsed once at load time. The {@link Kind} tag decides how the operands are read:
 * <ul>
 * <li><code>name</code> is the variable, label, macro, function or sub-command the statement targets; for
 * <code>INVALID</code> it is the reason the statement could not be parsed</li>
 * <li><code>arguments</code> are expression strings (or raw text for <code>T:</code>-style output)</li>
 * <li><code>body</code> holds the commands of a REPEAT or DEFINE block</li>
 * <li><code>thenBranch</code> and <code>elseBranch</code> hold the branches of an IF</li>
 * </ul>
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public final class Command {
	/** Every statement the engine understands */
	public static enum Kind {
		EMPTY,
		UNKNOWN,
		INVALID,
		REMARK,
		END,
		LABEL,

		// Colon dialect
		TEXT,
		ACCEPT,
		YES,
		NO,
		JUMP,
		JUMP_IF,
		MATCH_JUMP,
		MATCH_TEXT,
		COMPUTE,
		STRING_OP,
		DATETIME_OP,
		MATH_OP,
		BRANCH_MULTI,
		STORAGE,

		// Line-numbered dialect
		LET,
		PRINT,
		INPUT,
		IF,
		FOR,
		NEXT,
		GOTO,
		GOSUB,
		RETURN,
		DIM,

		// Turtle dialect
		FORWARD,
		BACK,
		LEFT,
		RIGHT,
		PEN_UP,
		PEN_DOWN,
		CLEAR_SCREEN,
		HOME,
		SET_XY,
		SET_X,
		SET_Y,
		SET_HEADING,
		SET_COLOR,
		SET_FILL_COLOR,
		SET_PEN_SIZE,
		CIRCLE,
		DOT,
		RECT,
		TURTLE_TEXT,
		SHOW_TURTLE,
		HIDE_TURTLE,
		SHOW_HEADING,
		SHOW_POSITION,
		REPEAT,

		// Unified dialect
		ASSIGN,
		ASSIGN_ARRAY,
		DEFINE,
		CALL,
		FUNCTION,
		ARRAY_OP
	}

	public final Kind kind;
	public final Dialect dialect;
	public final String text;
	public final String name;
	public final List<String> arguments;
	public final List<Command> body;
	public final Command thenBranch;
	public final Command elseBranch;

	Command (Kind kind, Dialect dialect, String text, String name, List<String> arguments, List<Command> body, Command thenBranch, Command elseBranch) {
		this.kind = kind;
		this.dialect = dialect;
		this.text = text;
		this.name = (name == null ? "" : name);
		this.arguments = (arguments == null ? Collections.<String>emptyList () : Collections.unmodifiableList (arguments));
		this.body = (body == null ? Collections.<Command>emptyList () : Collections.unmodifiableList (body));
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
	}

	static Command of (Kind kind, Dialect dialect, String text, String name, String... arguments) {
		return new Command (kind, dialect, text, name, Arrays.asList (arguments), null, null, null);
	}

	/**
	 * An argument, or the empty string when absent
	 */
	public String argument (int index) {
		return index < arguments.size () ? arguments.get (index) : "";
	}

	@Override
	public String toString () {
		return kind + (name.isEmpty () ? "" : " " + name) + (arguments.isEmpty () ? "" : " " + arguments) + (body.isEmpty () ? "" : " " + body);
	}
}
