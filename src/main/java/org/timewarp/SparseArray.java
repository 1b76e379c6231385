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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * A mapping from integer index to a {@link Value} or a nested SparseArray. Slots are only created when written, so
 * <code>DIM A(1000)</code> costs nothing until used.
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public final class SparseArray {
	private final TreeMap<Integer, Object> slots = new TreeMap<Integer, Object> ();

	/**
	 * Builds a one dimensional array from a list of values, indexed from 0
	 */
	public static SparseArray of (List<Value> values) {
		SparseArray array = new SparseArray ();
		for (int i = 0, j = values.size (); i < j; ++i)
			array.slots.put (i, values.get (i));

		return array;
	}

	/**
	 * Reads an element by (possibly multi-dimensional) index
	 *
	 * @param indices One index per dimension
	 * @return The scalar at the index, or null if unset or the index path ends on a nested array
	 */
	public Value get (int... indices) {
		Object slot = this;
		for (int index : indices) {
			if (!(slot instanceof SparseArray))
				return null;

			slot = ((SparseArray) slot).slots.get (index);
		}

		return slot instanceof Value ? (Value) slot : null;
	}

	/**
	 * Writes an element by (possibly multi-dimensional) index, creating nested arrays as needed
	 *
	 * @param value The scalar to store
	 * @param indices One index per dimension
	 */
	public void set (Value value, int... indices) {
		if (indices.length == 0)
			throw new IllegalArgumentException ("No index given");

		SparseArray target = this;
		for (int i = 0; i < indices.length - 1; ++i) {
			Object slot = target.slots.get (indices[i]);
			if (!(slot instanceof SparseArray)) {
				slot = new SparseArray ();
				target.slots.put (indices[i], slot);
			}
			target = (SparseArray) slot;
		}

		target.slots.put (indices[indices.length - 1], value);
	}

	/**
	 * Stores a nested array at an index
	 */
	public void setArray (int index, SparseArray array) {
		slots.put (index, array);
	}

	/**
	 * Direct slot access, a {@link Value}, a SparseArray or null
	 */
	public Object slot (int index) {
		return slots.get (index);
	}

	public Set<Integer> indices () {
		return slots.keySet ();
	}

	public int size () {
		return slots.size ();
	}

	public boolean isEmpty () {
		return slots.isEmpty ();
	}

	/**
	 * All scalars in index order, nested arrays flattened depth first
	 */
	public List<Value> values () {
		List<Value> values = new ArrayList<Value> ();
		for (Map.Entry<Integer, Object> entry : slots.entrySet ()) {
			if (entry.getValue () instanceof SparseArray)
				values.addAll (((SparseArray) entry.getValue ()).values ());
			else
				values.add ((Value) entry.getValue ());
		}

		return values;
	}

	/**
	 * Index of the first direct element equal to the value, compared numerically when both sides are numeric
	 *
	 * @return The index, or -1 if not found
	 */
	public int find (Value value) {
		for (Map.Entry<Integer, Object> entry : slots.entrySet ()) {
			if (entry.getValue () instanceof Value && ExpressionEvaluator.compare ((Value) entry.getValue (), value) == 0)
				return entry.getKey ();
		}

		return -1;
	}

	@Override
	public String toString () {
		StringBuilder builder = new StringBuilder ("[");
		for (Map.Entry<Integer, Object> entry : slots.entrySet ()) {
			if (builder.length () > 1)
				builder.append (", ");
			builder.append (entry.getValue ().toString ());
		}

		return builder.append (']').toString ();
	}
}
