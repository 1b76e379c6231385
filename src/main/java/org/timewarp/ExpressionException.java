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
 * Raised while parsing or walking an expression; {@link ExpressionEvaluator} turns it into a fallback value
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public class ExpressionException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final boolean divisionByZero;

	public ExpressionException (String message) {
		this (message, false);
	}

	private ExpressionException (String message, boolean divisionByZero) {
		super (message);
		this.divisionByZero = divisionByZero;
	}

	/**
	 * The one failure the evaluator reports with a sentinel rather than a fallback
	 */
	public static ExpressionException divisionByZero () {
		return new ExpressionException ("Division by zero", true);
	}

	public boolean isDivisionByZero () {
		return divisionByZero;
	}
}
