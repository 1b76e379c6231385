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

import java.util.Locale;

/**
 * The teaching languages a statement can be written in
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public enum Dialect {
	/** PILOT style, <code>T:Hello</code> */
	COLON,

	/** BASIC style, <code>10 PRINT X</code> */
	LINE_NUMBERED,

	/** Logo style, <code>FORWARD 50</code> */
	TURTLE,

	/** All of the above plus <code>X = expr</code> and macros */
	UNIFIED;

	/**
	 * Reads a dialect name as given on a command line; accepts the enum names plus pilot, basic and logo
	 *
	 * @param name The name to read
	 * @return The dialect, or null if the name is not recognised
	 */
	public static Dialect fromName (String name) {
		if (name == null)
			return null;

		String key = name.trim ().toUpperCase (Locale.ROOT).replace ('-', '_');
		if (key.equals ("PILOT"))
			return COLON;
		if (key.equals ("BASIC"))
			return LINE_NUMBERED;
		if (key.equals ("LOGO"))
			return TURTLE;

		for (Dialect dialect : values ()) {
			if (dialect.name ().equals (key))
				return dialect;
		}

		return null;
	}
}
