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
 * An active FOR loop
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
final class ForFrame {
	final String variable;
	final double limit;
	final double step;

	/** Index of the first statement of the loop body */
	final int returnIndex;

	ForFrame (String variable, double limit, double step, int returnIndex) {
		this.variable = variable;
		this.limit = limit;
		this.step = step;
		this.returnIndex = returnIndex;
	}

	/**
	 * Whether the loop runs again with the variable at this value
	 */
	boolean continues (double value) {
		return step >= 0 ? value <= limit : value >= limit;
	}
}
