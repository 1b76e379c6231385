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

package org.timewarp.example;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.timewarp.Dialect;
import org.timewarp.FileStore;
import org.timewarp.TimeWarp;

/**
 * TimeWarp for Java
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public class Main {
	/**
	 * Console host, program output goes to stdout and input comes from stdin
	 */
	private static final class ConsoleHost implements TimeWarp.Host {
		private final BufferedReader reader = new BufferedReader (new InputStreamReader (System.in, StandardCharsets.UTF_8));

		@Override
		public void output (String text) {
			System.out.println (text);
		}

		@Override
		public String input (String prompt) {
			System.out.print (prompt);
			System.out.flush ();

			try {
				return reader.readLine ();
			} catch (IOException e) {
				throw new IllegalStateException (e.getMessage (), e);
			}
		}
	}

	/**
	 * @param args The command line options when invoked
	 */
	public static void main (String[] args) {
		/** The return code sent to the invoking shell */
		int returnCode = -1;

		/** The program to run (loaded from disk or internal example) */
		String sourceData = null;

		// Process command line flags
		boolean paramVersion = false;
		boolean paramHelp = false;
		boolean paramExample = false;
		Dialect paramMode = null;
		String modeError = null;
		List<String> files = new ArrayList<String> ();

		for (String arg : args) {
			if (arg.equals ("--v")) {
				paramVersion = true;
			} else if (arg.equals ("--help")) {
				paramHelp = true;
			} else if (arg.equals ("--hello")) {
				paramExample = true;
			} else if (arg.startsWith ("--mode=")) {
				paramMode = Dialect.fromName (arg.substring (7));
				if (paramMode == null)
					modeError = arg.substring (7);
			} else {
				files.add (arg);
			}
		}

		if (modeError != null) { // Called with a dialect nobody knows
			System.err.println ("Unknown mode: " + modeError + " (expected pilot, basic, logo or unified)");
			returnCode = 2;
		} else if (paramVersion || paramHelp || (!paramExample && files.size () != 1)) { // Called with wrong arguments, version or help
			// Show version
			System.out.println ("TimeWarp for Java (v " + TimeWarp.VERSION_MAJOR + "." + TimeWarp.VERSION_MINOR + ")\n");

			// Show usage information
			if (paramHelp || !paramVersion) {
				System.out.println ("Usage:  java -jar timewarp.jar [--mode=dialect] sourcefile");
				System.out.println ("        (to run a TimeWarp program)");
				System.out.println ("Alternatively set run configuration arguments in your IDE");
				System.out.println ("");
				System.out.println ("Options:");
				System.out.println ("    --help     Show this help");
				System.out.println ("       --v     Show version information");
				System.out.println ("   --hello     Run internal example program");
				System.out.println ("    --mode     Force pilot, basic, logo or unified for every line");
			}

			returnCode = 2;
		} else if (paramExample) { // Called to run the internal example program
			/* The example used, one line per dialect:
			 *
			 *  T:Hello world!
			 *  10 LET ANSWER = 2 + 2
			 *  REPEAT 4 [FORWARD 10 RIGHT 90]
			 *  PRINT "2+2=" ; ANSWER
			 */
			sourceData = "T:Hello world!" + "\n" + "10 LET ANSWER = 2 + 2" + "\n" + "REPEAT 4 [FORWARD 10 RIGHT 90]" + "\n" + "PRINT \"2+2=\" ; ANSWER";
		} else { // Called to run a program from disk
			File sourceFile = new File (files.get (0));

			// Attempt to read the file from disk
			if (!sourceFile.exists ()) {
				System.err.println ("File does not exist: " + sourceFile.getPath ());
				returnCode = 3;
			} else if (!sourceFile.canRead ()) {
				System.err.println ("File read permission denied: " + sourceFile.getPath ());
				returnCode = 13;
			} else {
				try {
					sourceData = FileStore.readText (sourceFile);
				} catch (IOException e) {
					System.err.println ("File unknown error: " + sourceFile.getPath () + " (" + e.getMessage () + ")");
					returnCode = 4;
				}
			}
		}

		// If a program is in this variable, run it
		if (sourceData != null) {
			boolean success;

			// Create a new instance, output is written by the host as it happens
			TimeWarp timeWarp = new TimeWarp ();
			timeWarp.hostSet (new ConsoleHost ());
			timeWarp.modeSet (paramMode);

			// Give the program to the instance
			success = timeWarp.script (sourceData);
			if (success) {
				// Run the program
				success = timeWarp.run ();

				/* The transcript is also available in timeWarp.stdout once the run is over,
				 * and the variables the program used stay readable, for example:
				 * timeWarp.variableGet ("ANSWER") equals "4"
				 */
			}

			// Set the return code for the shell (0=success)
			returnCode = (success ? 0 : 1);

			// Write the standard error if there is any
			if (!timeWarp.stderr.isEmpty ())
				System.err.println (timeWarp.stderr);
		}

		System.exit (returnCode);
	}
}
