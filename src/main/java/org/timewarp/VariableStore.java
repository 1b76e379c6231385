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

import static org.timewarp.TimeWarp.logV;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Name to value mapping shared by every dialect and by the turtle. Names are case-insensitive and stored upper-cased;
 * each name holds either a {@link Value} or a {@link SparseArray}.
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public class VariableStore {
	private static final String LOG_TAG = VariableStore.class.getSimpleName ();
	private static final boolean DEBUG = false;

	private final LinkedHashMap<String, Object> variables = new LinkedHashMap<String, Object> ();

	/**
	 * Normalises a variable name
	 */
	public static String key (String name) {
		return name.trim ().toUpperCase (Locale.ROOT);
	}

	/**
	 * Returns whether a variable (scalar or array) is set
	 */
	public boolean has (String name) {
		return variables.containsKey (key (name));
	}

	/**
	 * Returns whether a variable holds an array
	 */
	public boolean hasArray (String name) {
		return variables.get (key (name)) instanceof SparseArray;
	}

	/**
	 * Gets a scalar variable
	 *
	 * @param name Name of variable
	 * @return The value, or null if unset or an array
	 */
	public Value get (String name) {
		Object variable = variables.get (key (name));
		return variable instanceof Value ? (Value) variable : null;
	}

	/**
	 * Gets an array variable
	 *
	 * @param name Name of variable
	 * @return The array, or null if unset or a scalar
	 */
	public SparseArray getArray (String name) {
		Object variable = variables.get (key (name));
		return variable instanceof SparseArray ? (SparseArray) variable : null;
	}

	/**
	 * Sets a scalar variable, replacing any array of the same name
	 */
	public void set (String name, Value value) {
		if (DEBUG)
			logV (LOG_TAG, "Setting variable: " + key (name) + "=" + value);

		variables.put (key (name), value);
	}

	public void set (String name, double value) {
		set (name, new Value (value));
	}

	public void set (String name, String value) {
		set (name, new Value (value));
	}

	/**
	 * Sets an array variable, replacing any scalar of the same name
	 */
	public void setArray (String name, SparseArray array) {
		if (DEBUG)
			logV (LOG_TAG, "Setting array: " + key (name) + "=" + array);

		variables.put (key (name), array);
	}

	/**
	 * Writes one array element, turning the variable into an array if it is not one already
	 */
	public void setElement (String name, Value value, int... indices) {
		SparseArray array = getArray (name);
		if (array == null) {
			array = new SparseArray ();
			variables.put (key (name), array);
		}

		array.set (value, indices);
	}

	public void remove (String name) {
		variables.remove (key (name));
	}

	public void clear () {
		if (DEBUG)
			logV (LOG_TAG, "Removing all variables");

		variables.clear ();
	}

	/**
	 * Variable names in insertion order
	 */
	public List<String> names () {
		return new ArrayList<String> (variables.keySet ());
	}

	public int size () {
		return variables.size ();
	}

	/**
	 * Serialises the store as a flat JSON document, arrays become objects keyed by index
	 */
	public JSONObject toJson () {
		JSONObject document = new JSONObject ();
		for (Map.Entry<String, Object> entry : variables.entrySet ())
			document.put (entry.getKey (), toJson (entry.getValue ()));

		return document;
	}

	private static Object toJson (Object variable) {
		if (variable instanceof SparseArray) {
			SparseArray array = (SparseArray) variable;
			JSONObject slots = new JSONObject ();
			for (Integer index : array.indices ())
				slots.put (String.valueOf (index), toJson (array.slot (index)));

			return slots;
		}

		Value value = (Value) variable;
		return value.isNumber () ? (Object) value.toNumber () : value.toText ();
	}

	/**
	 * Merges a JSON document into the store; existing names not in the document are kept
	 *
	 * @param document Flat name to value document as written by {@link #toJson()}
	 * @return Number of variables merged
	 */
	public int merge (JSONObject document) {
		int merged = 0;

		for (String name : document.keySet ()) {
			Object item = document.get (name);
			if (item instanceof JSONObject) {
				setArray (name, arrayFromJson ((JSONObject) item));
			} else if (item instanceof JSONArray) {
				setArray (name, arrayFromJson ((JSONArray) item));
			} else {
				set (name, valueFromJson (item));
			}
			++merged;
		}

		return merged;
	}

	private static SparseArray arrayFromJson (JSONObject slots) {
		SparseArray array = new SparseArray ();
		for (String index : slots.keySet ()) {
			Double parsed = Value.parseNumber (index);
			if (parsed == null)
				continue;

			Object item = slots.get (index);
			if (item instanceof JSONObject)
				array.setArray (parsed.intValue (), arrayFromJson ((JSONObject) item));
			else if (item instanceof JSONArray)
				array.setArray (parsed.intValue (), arrayFromJson ((JSONArray) item));
			else
				array.set (valueFromJson (item), parsed.intValue ());
		}

		return array;
	}

	private static SparseArray arrayFromJson (JSONArray items) {
		SparseArray array = new SparseArray ();
		for (int i = 0, j = items.length (); i < j; ++i) {
			Object item = items.get (i);
			if (item instanceof JSONObject)
				array.setArray (i, arrayFromJson ((JSONObject) item));
			else if (item instanceof JSONArray)
				array.setArray (i, arrayFromJson ((JSONArray) item));
			else
				array.set (valueFromJson (item), i);
		}

		return array;
	}

	private static Value valueFromJson (Object item) {
		if (item instanceof Number)
			return new Value (((Number) item).doubleValue ());
		if (item instanceof Boolean)
			return Value.of ((Boolean) item);
		if (item == JSONObject.NULL)
			return Value.EMPTY;

		return new Value (item.toString ());
	}
}
