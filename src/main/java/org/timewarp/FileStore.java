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

import static org.timewarp.TimeWarp.logD;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Local filesystem access for program files and the variable persistence document.
 * <p>
 * <b>WARNING:</b> <code>STORAGE:SAVE</code> and <code>STORAGE:LOAD</code> take their path from the program being
 * run. If you execute TimeWarp in a security context higher than that of the user who wrote the program, they can
 * read or overwrite any file the running process can, so never run untrusted programs as a privileged user.
 * </p>
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public final class FileStore {
	private static final String LOG_TAG = FileStore.class.getSimpleName ();
	private static final boolean DEBUG = false;

	private FileStore () {
	}

	/**
	 * Reads a file from disk as UTF-8 text
	 *
	 * @param file The file to read
	 * @return The file contents
	 * @throws IOException If the file cannot be read
	 */
	public static String readText (File file) throws IOException {
		ByteArrayOutputStream outputStream = new ByteArrayOutputStream ();

		try (InputStream inputStream = new FileInputStream (file)) {
			byte buf[] = new byte[1024];
			int len;

			while ((len = inputStream.read (buf)) != -1)
				outputStream.write (buf, 0, len);
		}

		return new String (outputStream.toByteArray (), StandardCharsets.UTF_8);
	}

	/**
	 * Writes UTF-8 text to a file on disk, replacing any existing content
	 *
	 * @param file The file to write
	 * @param content The text
	 * @throws IOException If the file cannot be written
	 */
	public static void writeText (File file, String content) throws IOException {
		try (OutputStream outputStream = new FileOutputStream (file, false)) {
			outputStream.write (content.getBytes (StandardCharsets.UTF_8));
			outputStream.flush ();
		}
	}

	/**
	 * Saves every variable as a JSON document
	 *
	 * @param file Destination
	 * @param variables The store to save
	 * @throws IOException If the file cannot be written or a value has no JSON form
	 */
	public static void saveVariables (File file, VariableStore variables) throws IOException {
		if (DEBUG)
			logD (LOG_TAG, "Saving " + variables.size () + " variable(s) to " + file.getPath ());

		String document;
		try {
			document = variables.toJson ().toString (2);
		} catch (JSONException e) {
			throw new IOException ("Variables cannot be saved: " + e.getMessage (), e);
		}

		writeText (file, document);
	}

	/**
	 * Merges a saved JSON document into the store; names not in the document are kept
	 *
	 * @param file Source
	 * @param variables The store to merge into
	 * @return Number of variables loaded
	 * @throws IOException If the file cannot be read or is not a JSON object
	 */
	public static int loadVariables (File file, VariableStore variables) throws IOException {
		if (!file.isFile ())
			throw new IOException ("File does not exist: " + file.getPath ());

		JSONObject document;
		try {
			document = new JSONObject (readText (file));
		} catch (JSONException e) {
			throw new IOException ("Not a variables document: " + e.getMessage (), e);
		}

		int count = variables.merge (document);

		if (DEBUG)
			logD (LOG_TAG, "Loaded " + count + " variable(s) from " + file.getPath ());

		return count;
	}
}
