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
 * Program text whose structure is corrupt, such as unbalanced brackets or a duplicate label
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public class ProgramLoadException extends Exception {
	private static final long serialVersionUID = 1L;

	private final int sourceLine;

	/**
	 * @param sourceLine 1-based source line the problem was found on
	 * @param message What is wrong
	 */
	public ProgramLoadException (int sourceLine, String message) {
		super (message);
		this.sourceLine = sourceLine;
	}

	public int getSourceLine () {
		return sourceLine;
	}
}
