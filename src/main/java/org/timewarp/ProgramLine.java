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

/**
 * One executable statement of a loaded program
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public final class ProgramLine {
	/** The BASIC line number, or null when the line had none */
	public final Integer lineNumber;

	/** Statement text as it was parsed */
	public final String text;

	/** Position in the program, the jump address */
	public final int index;

	/** 1-based line in the source text, for diagnostics */
	public final int sourceLine;

	public final Command command;

	ProgramLine (Integer lineNumber, String text, int index, int sourceLine, Command command) {
		this.lineNumber = lineNumber;
		this.text = text;
		this.index = index;
		this.sourceLine = sourceLine;
		this.command = command;
	}

	@Override
	public String toString () {
		return index + "\t" + (lineNumber != null ? lineNumber + " " : "") + text;
	}
}
