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

import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * An immutable scalar held by a variable or produced by an expression, either a number or a string
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public final class Value {
	/** Shared zero, the value of anything unresolved */
	public static final Value ZERO = new Value (0);

	/** Shared empty string */
	public static final Value EMPTY = new Value ("");

	/** Numbers print with at most this many decimals */
	public static final int DECIMAL_SCALE = 6;

	private static final Pattern numberPattern = Pattern.compile ("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

	private final double number;
	private final String text;

	/**
	 * Creates a number value
	 *
	 * @param number The number
	 */
	public Value (double number) {
		this.number = number;
		this.text = null;
	}

	/**
	 * Creates a string value
	 *
	 * @param text The string, null is treated as empty
	 */
	public Value (String text) {
		this.number = 0;
		this.text = (text == null ? "" : text);
	}

	/**
	 * Creates a number value when the text is numeric, otherwise a string value
	 *
	 * @param text The text to coerce
	 * @return The coerced value
	 */
	public static Value coerce (String text) {
		Double parsed = parseNumber (text);
		return parsed != null ? new Value (parsed) : new Value (text);
	}

	/**
	 * Creates a boolean value (1 or 0)
	 */
	public static Value of (boolean truth) {
		return new Value (truth ? 1 : 0);
	}

	public boolean isNumber () {
		return text == null;
	}

	public boolean isString () {
		return text != null;
	}

	/**
	 * Whether the value is a number, or a string that reads as one
	 */
	public boolean isNumeric () {
		return text == null || parseNumber (text) != null;
	}

	/**
	 * Numeric view of the value
	 *
	 * @return The number, or the parsed string
	 * @throws NumberFormatException If the string is not numeric
	 */
	public double toNumber () {
		if (text == null)
			return number;

		Double parsed = parseNumber (text);
		if (parsed == null)
			throw new NumberFormatException ("Not a number: \"" + text + "\"");

		return parsed;
	}

	/**
	 * Numeric view of the value with a fallback
	 */
	public double toNumber (double numberDefault) {
		if (text == null)
			return number;

		Double parsed = parseNumber (text);
		return parsed == null ? numberDefault : parsed;
	}

	/**
	 * Textual form, numbers are formatted with {@link #format(double)}
	 */
	public String toText () {
		return text != null ? text : format (number);
	}

	/**
	 * Truthiness used by conditions: non-zero numbers, and strings that are not empty, "0" or "false"
	 */
	public boolean isTrue () {
		if (text == null)
			return number != 0;

		String trimmed = text.trim ();
		if (trimmed.isEmpty () || trimmed.equalsIgnoreCase ("false"))
			return false;

		Double parsed = parseNumber (trimmed);
		return parsed == null || parsed != 0;
	}

	/**
	 * Formats a number with up to six decimals, HALF_UP rounding and no trailing zeros
	 *
	 * @param number The number to format
	 * @return String of formatted number
	 */
	public static String format (double number) {
		if (Double.isNaN (number))
			return "NaN";
		if (Double.isInfinite (number))
			return number > 0 ? "Infinity" : "-Infinity";

		DecimalFormat decimalFormat = new DecimalFormat ("#." + new String (new char[DECIMAL_SCALE]).replace ("\0", "#"), DecimalFormatSymbols.getInstance (Locale.ROOT));
		decimalFormat.setRoundingMode (RoundingMode.HALF_UP);
		decimalFormat.setGroupingUsed (false);

		String formatted = decimalFormat.format (number);
		return formatted.equals ("-0") ? "0" : formatted;
	}

	/**
	 * Attempts to read a number from a string, accepting plain decimal notation only
	 *
	 * @param text The string to read
	 * @return The number, or null if the string is not numeric
	 */
	public static Double parseNumber (String text) {
		if (text == null)
			return null;

		String trimmed = text.trim ();
		if (!numberPattern.matcher (trimmed).matches ())
			return null;

		try {
			return Double.valueOf (trimmed);
		} catch (NumberFormatException e) {
			return null;
		}
	}

	@Override
	public boolean equals (Object other) {
		if (this == other)
			return true;
		if (!(other instanceof Value))
			return false;

		Value value = (Value) other;
		if (isNumber () != value.isNumber ())
			return false;

		return isNumber () ? Double.compare (number, value.number) == 0 : text.equals (value.text);
	}

	@Override
	public int hashCode () {
		return isNumber () ? Double.hashCode (number) : text.hashCode ();
	}

	@Override
	public String toString () {
		return toText ();
	}
}
