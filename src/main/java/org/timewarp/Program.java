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

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A loaded program: its statements in execution order plus the label index
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public final class Program {
	private final List<ProgramLine> lines;
	private final Map<String, Integer> labels;

	Program (List<ProgramLine> lines, Map<String, Integer> labels) {
		this.lines = Collections.unmodifiableList (lines);
		this.labels = Collections.unmodifiableMap (labels);
	}

	public List<ProgramLine> lines () {
		return lines;
	}

	public ProgramLine line (int index) {
		return lines.get (index);
	}

	public int size () {
		return lines.size ();
	}

	/**
	 * Label name to statement index
	 */
	public Map<String, Integer> labels () {
		return labels;
	}

	/**
	 * Resolves a label
	 *
	 * @return The statement index, or -1 if no such label
	 */
	public int labelIndex (String label) {
		Integer index = labels.get (label);
		return index == null ? -1 : index;
	}

	/**
	 * Finds the statement carrying a BASIC line number; line numbers may be sparse and out of order
	 *
	 * @return The statement index, or -1 if no statement has that number
	 */
	public int lineNumberIndex (int lineNumber) {
		for (int i = 0, j = lines.size (); i < j; ++i) {
			Integer number = lines.get (i).lineNumber;
			if (number != null && number == lineNumber)
				return i;
		}

		return -1;
	}
}
