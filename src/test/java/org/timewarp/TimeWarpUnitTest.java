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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.regex.Pattern;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.junit.BeforeClass;
import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

/**
 * Unit testing for TimeWarp. The tests here drive the public API: loading, running, pausing, the host and the
 * variable store. The dialects themselves are covered by the scripts listed in TimeWarpTestSuite/test_list.json.
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class TimeWarpUnitTest {
	private static JSONObject testList;

	/**
	 * Runs before testing to ensure the TimeWarp Test Suite is loaded and sane
	 */
	@BeforeClass
	public static void setUp () throws Exception {
		System.out.println ("TimeWarp unit testing");
		System.out.println ("Setting up the test environment…");

		String testListStr = readResourceFile ("TimeWarpTestSuite/test_list.json");
		if (testListStr == null) {
			System.out.println ("Could not load the TimeWarp Test Suite, TimeWarpTestSuite/test_list.json is missing from the test resources");
			System.exit (1);
		}

		// Block-style comments are not JSON so remove them before parsing
		Pattern blockComments = Pattern.compile ("/\\*.*?\\*/", Pattern.DOTALL);
		testListStr = blockComments.matcher (testListStr).replaceAll ("");

		try {
			testList = new JSONObject (testListStr);
		} catch (JSONException e) {
			e.printStackTrace ();
		}
		if (testList == null || !testList.getString ("utf8").equals ("✓") || !testList.has ("tests")) {
			System.err.println ("Could not load the TimeWarp Test Suite due to a JSON parsing error");
			System.exit (1);
		}

		System.out.println ("…everything setup correctly, starting testing");
		System.out.println ();
	}

	@Test
	public void _01_Hello () {
		TimeWarp timeWarp = new TimeWarp ();
		boolean success;

		success = timeWarp.script ("T:Hello world!\n10 LET ANSWER = 2 + 2\nREPEAT 4 [FORWARD 10 RIGHT 90]\nPRINT \"2+2=\" ; ANSWER");
		assertEquals (true, success);

		success = timeWarp.run ();
		System.out.println ("Success: " + (success ? "TRUE" : "FALSE"));
		System.out.println (" stdout: " + timeWarp.stdout);
		System.out.println (" stderr: " + timeWarp.stderr);
		assertEquals (true, success);
		assertEquals ("Hello world!\n2+2=4\n", timeWarp.stdout);
		assertEquals ("", timeWarp.stderr);
		assertEquals (4, timeWarp.turtleGet ().count (Primitive.Kind.LINE));
		assertEquals (ControlFlowEngine.State.HALTED, timeWarp.stateGet ());
		System.out.println ("   Test: ✓ PASSED");
		System.out.println ();
	}

	/**
	 * Calling {@link TimeWarp#run()} before any program is loaded
	 */
	@Test
	public void _02_NoProgramRun () {
		TimeWarp timeWarp = new TimeWarp ();

		assertEquals (false, timeWarp.run ());
		assertEquals ("No program loaded", timeWarp.stderr);
		assertEquals (ControlFlowEngine.State.IDLE, timeWarp.stateGet ());
	}

	/**
	 * Attempting to run a program that failed to load still fails with the load error
	 */
	@Test
	public void _03_ErrorRerun () {
		TimeWarp timeWarp = new TimeWarp ();
		boolean success;

		success = timeWarp.script ("T:fine\nREPEAT 2 [FD 10\nT:never");
		assertEquals (false, success);
		assertEquals ("Line 2: Unclosed [ block", timeWarp.stderr);
		assertEquals (null, timeWarp.programGet ());

		success = timeWarp.run ();
		assertEquals (false, success);
		assertEquals ("", timeWarp.stdout);
		assertEquals ("Line 2: Unclosed [ block", timeWarp.stderr);
		System.out.println ("   Test: ✓ PASSED");
		System.out.println ();
	}

	/**
	 * Each run starts clean unless variables are preserved
	 */
	@Test
	public void _04_RerunAndPreserve () {
		TimeWarp timeWarp = new TimeWarp ();

		assertEquals (true, timeWarp.script ("C:N = N + 1\nT:*N*"));
		timeWarp.variableSet ("N", 10);

		assertEquals (true, timeWarp.run ());
		assertEquals ("1\n", timeWarp.stdout);
		assertEquals (true, timeWarp.run ());
		assertEquals ("1\n", timeWarp.stdout);

		timeWarp.preserveSet (true);
		timeWarp.variableSet ("n", "10");
		assertEquals (true, timeWarp.run ());
		assertEquals ("11\n", timeWarp.stdout);
		assertEquals (true, timeWarp.run ());
		assertEquals ("12\n", timeWarp.stdout);
		assertEquals ("12", timeWarp.variableGet ("N"));

		timeWarp.reset ();
		assertEquals (false, timeWarp.variableHas ("N"));
		assertEquals ("", timeWarp.stdout);
		System.out.println ("   Test: ✓ PASSED");
		System.out.println ();
	}

	/**
	 * Breakpoints pause before a statement; step and resume carry on with the same transcript
	 */
	@Test
	public void _05_BreakpointStepResume () {
		TimeWarp timeWarp = new TimeWarp ();
		assertEquals (true, timeWarp.script ("T:a\nT:b\nT:c\nT:d"));
		timeWarp.breakpointSet (1, true);
		assertEquals (true, timeWarp.breakpointToggle (3));
		assertEquals (false, timeWarp.breakpointToggle (3));

		assertEquals (true, timeWarp.run ());
		assertEquals (ControlFlowEngine.State.PAUSED, timeWarp.stateGet ());
		assertEquals ("a\n[!] Breakpoint hit at line 2\n", timeWarp.stdout);

		assertEquals (true, timeWarp.step ());
		assertEquals (ControlFlowEngine.State.PAUSED, timeWarp.stateGet ());
		assertEquals ("a\n[!] Breakpoint hit at line 2\nb\n", timeWarp.stdout);

		assertEquals (true, timeWarp.resume ());
		assertEquals (ControlFlowEngine.State.HALTED, timeWarp.stateGet ());
		assertEquals ("a\n[!] Breakpoint hit at line 2\nb\nc\nd\n", timeWarp.stdout);

		assertEquals (false, timeWarp.resume ());
		assertEquals ("Program is not paused", timeWarp.stderr);

		timeWarp.breakpointRemoveAll ();
		assertEquals (true, timeWarp.run ());
		assertEquals ("a\nb\nc\nd\n", timeWarp.stdout);
		System.out.println ("   Test: ✓ PASSED");
		System.out.println ();
	}

	/**
	 * Stepping from idle starts a run one statement at a time
	 */
	@Test
	public void _06_StepFromIdle () {
		TimeWarp timeWarp = new TimeWarp ();
		assertEquals (true, timeWarp.script ("T:one\nT:two"));

		assertEquals (true, timeWarp.step ());
		assertEquals ("one\n", timeWarp.stdout);
		assertEquals (true, timeWarp.step ());
		assertEquals ("one\ntwo\n", timeWarp.stdout);
		assertEquals (true, timeWarp.step ());
		assertEquals (ControlFlowEngine.State.HALTED, timeWarp.stateGet ());
	}

	/**
	 * The host can stop a run from inside an output call
	 */
	@Test
	public void _07_StopFromHost () {
		final TimeWarp timeWarp = new TimeWarp ();
		final ScriptedHost recorder = new ScriptedHost ();

		timeWarp.hostSet (new TimeWarp.Host () {
			public void output (String text) {
				recorder.output (text);
				timeWarp.stop ();
			}

			public String input (String prompt) {
				return recorder.input (prompt);
			}
		});

		assertEquals (true, timeWarp.script ("L:top\nT:tick\nJ:top"));
		assertEquals (true, timeWarp.run ());
		assertEquals ("tick\n[!] Program stopped\n", timeWarp.stdout);
		assertEquals (2, recorder.outputs.size ());
		System.out.println ("   Test: ✓ PASSED");
		System.out.println ();
	}

	/**
	 * Without a host, input is unavailable and the status variables say so
	 */
	@Test
	public void _08_NoHostInput () {
		TimeWarp timeWarp = new TimeWarp ();

		assertEquals (true, timeWarp.script ("INPUT X\nPRINT \"after\""));
		assertEquals (true, timeWarp.run ());
		assertEquals ("[!] Line 1: No input available for X\nafter\n", timeWarp.stdout);
		assertEquals ("0", timeWarp.variableGet (ExecutionContext.HOST_STATUS));
		assertEquals ("No input available", timeWarp.variableGet (ExecutionContext.HOST_ERROR));
		assertEquals (false, timeWarp.variableHas ("X"));
	}

	@Test
	public void _09_HostSeesOutputAndPrompts () {
		TimeWarp timeWarp = new TimeWarp ();
		ScriptedHost host = new ScriptedHost ("7");
		timeWarp.hostSet (host);

		assertEquals (true, timeWarp.script ("10 INPUT \"How many\"; N\n20 PRINT N * N"));
		assertEquals (true, timeWarp.run ());
		assertEquals ("49\n", timeWarp.stdout);
		assertEquals ("How many", host.prompts.get (0));
		assertEquals ("49", host.outputs.get (0));
		assertEquals ("1", timeWarp.variableGet (ExecutionContext.HOST_STATUS));
		assertEquals (true, timeWarp.variableValueGet ("N").isNumber ());
	}

	/**
	 * Turtle drawing reaches the surface, and the final frame carries the sprite
	 */
	@Test
	public void _10_Surface () {
		TimeWarp timeWarp = new TimeWarp ();
		RecordingSurface surface = new RecordingSurface (600, 400);
		timeWarp.surfaceSet (surface);

		assertEquals (true, timeWarp.script ("REPEAT 4 [FD 10 RT 90]\nCIRCLE 5"));
		assertEquals (true, timeWarp.run ());
		assertEquals (4, surface.count ("line"));
		assertEquals (1, surface.count ("circle"));
		assertEquals (1, surface.count ("polygon"));
		assertEquals ("line 300,200 310,200 black 2", surface.calls.get (0));
	}

	/**
	 * A surface that throws does not stop the program
	 */
	@Test
	public void _11_SurfaceFailure () {
		TimeWarp timeWarp = new TimeWarp ();
		RecordingSurface surface = new RecordingSurface (600, 400);
		timeWarp.surfaceSet (surface);
		surface.failingSet (true);

		assertEquals (true, timeWarp.script ("FORWARD 10\nT:after"));
		assertEquals (true, timeWarp.run ());
		assertEquals ("[!] Line 1: Drawing failed: Surface is gone\nafter\n", timeWarp.stdout);
		assertEquals ("0", timeWarp.variableGet (ExecutionContext.HOST_STATUS));
		assertEquals ("Drawing failed: Surface is gone", timeWarp.variableGet (ExecutionContext.HOST_ERROR));
		assertEquals ("10", timeWarp.variableGet ("TURTLE_X"));
	}

	@Test
	public void _12_VariablesSaveLoad () throws Exception {
		File file = File.createTempFile ("timewarp", ".json");
		file.deleteOnExit ();

		TimeWarp first = new TimeWarp ();
		assertEquals (true, first.script ("X = 42\nNAME$ = \"Ada\"\nA = [1, 2]"));
		assertEquals (true, first.run ());
		assertEquals (true, first.variablesSave (file));

		TimeWarp second = new TimeWarp ();
		second.variableSet ("KEEP", 1);
		assertEquals (true, second.variablesLoad (file));
		assertEquals ("42", second.variableGet ("x"));
		assertEquals ("Ada", second.variableGet ("name$"));
		assertEquals ("2", second.variableStoreGet ().getArray ("A").get (1).toText ());
		assertEquals ("1", second.variableGet ("KEEP"));

		File missing = new File (file.getPath () + ".missing");
		assertEquals (false, second.variablesLoad (missing));
		assertEquals ("Cannot load variables: File does not exist: " + missing.getPath (), second.stderr);
	}

	/**
	 * STORAGE: saves and loads from inside a program
	 */
	@Test
	public void _13_StorageCommands () throws Exception {
		File file = File.createTempFile ("timewarp", ".json");
		file.deleteOnExit ();
		String path = file.getPath ();

		TimeWarp timeWarp = new TimeWarp ();
		assertEquals (true, timeWarp.script ("C:SCORE = 99\nSTORAGE:SAVE \"" + path + "\""));
		assertEquals (true, timeWarp.run ());
		assertEquals ("STORAGE: Variables saved to '" + path + "'\n", timeWarp.stdout);

		assertEquals (true, timeWarp.script ("STORAGE:LOAD " + path + "\nT:Score *SCORE* status *STORAGE_SUCCESS*"));
		assertEquals (true, timeWarp.run ());
		assertEquals ("STORAGE: Variables loaded from '" + path + "'\nScore 99 status 1\n", timeWarp.stdout);

		assertEquals (true, timeWarp.script ("STORAGE:LOAD " + path + ".missing\nT:status *STORAGE_SUCCESS*"));
		assertEquals (true, timeWarp.run ());
		assertEquals ("[!] Line 1: STORAGE: File does not exist: " + path + ".missing\nstatus 0\n", timeWarp.stdout);

		// Infinity has no JSON form, the save fails but the program carries on
		assertEquals (true, timeWarp.script ("C:BIG = 10 ^ 400\nSTORAGE:SAVE " + path + "\nT:status *STORAGE_SUCCESS*\nT:after"));
		assertEquals (true, timeWarp.run ());
		assertTrue (timeWarp.stdout, timeWarp.stdout.startsWith ("[!] Line 2: STORAGE: Variables cannot be saved: "));
		assertTrue (timeWarp.stdout, timeWarp.stdout.endsWith ("\nstatus 0\nafter\n"));
	}

	/**
	 * Date and time commands read the configured clock
	 */
	@Test
	public void _14_FixedClock () {
		TimeWarp timeWarp = new TimeWarp ();
		timeWarp.clockSet (Clock.fixed (Instant.parse ("2024-03-05T14:07:09Z"), ZoneOffset.UTC));

		assertEquals (true, timeWarp.script ("DT:NOW \"YYYY-MM-DD HH:MM:SS\" STAMP\nDT:NOW \"DD/MM/YYYY\" DAY\nDT:TIMESTAMP SECS\nT:*STAMP* *DAY* *SECS*"));
		assertEquals (true, timeWarp.run ());
		assertEquals ("2024-03-05 14:07:09 05/03/2024 1709647629\n", timeWarp.stdout);
	}

	/**
	 * A seed makes RND repeat between runs
	 */
	@Test
	public void _15_RandomSeed () {
		TimeWarp timeWarp = new TimeWarp ();
		timeWarp.randomSeedSet (7);

		assertEquals (true, timeWarp.script ("PRINT RND(1000); \" \"; RND(1000)"));
		assertEquals (true, timeWarp.run ());
		String first = timeWarp.stdout;
		assertEquals (true, timeWarp.run ());
		assertEquals (first, timeWarp.stdout);
	}

	@Test
	public void _16_DebugDiagnostics () {
		TimeWarp timeWarp = new TimeWarp ();
		timeWarp.debugToggle (true);

		assertEquals (true, timeWarp.script ("T:hi"));
		assertEquals (true, timeWarp.run ());
		assertEquals ("[!] Line 1: Executing: T:hi\nhi\n", timeWarp.stdout);
	}

	@Test
	public void _17_Watchdog () {
		TimeWarp timeWarp = new TimeWarp ();
		timeWarp.watchdogSet (3);
		assertEquals (3, timeWarp.watchdogGet ());

		assertEquals (true, timeWarp.script ("T:1\nT:2\nT:3\nT:4"));
		assertEquals (true, timeWarp.run ());
		assertEquals ("1\n2\n3\n[!] Program stopped: Maximum iterations reached\n", timeWarp.stdout);

		timeWarp.watchdogSet (-1);
		assertEquals (10000, timeWarp.watchdogGet ());
	}

	/**
	 * All test files in the resources directory are used in a test_list.json entry somewhere
	 */
	@Test
	public void _18_AllFilesUsed () throws Exception {
		System.out.println ("_18_AllFilesUsed() checking all files on disk are specified in test_list.json");

		JSONArray testListTests = testList.getJSONArray ("tests");

		ClassLoader classLoader = getClass ().getClassLoader ();
		File[] testFiles = new File (classLoader.getResource ("TimeWarpTestSuite/test_scripts").toURI ()).listFiles ();
		for (File testFile : testFiles) {
			int k, l;
			System.out.println ("	Check: " + testFile.getName ());
			for (k = 0, l = testListTests.length (); k < l; ++k) {
				if (testListTests.getJSONObject (k).getString ("filename").equals (testFile.getName ()))
					break;
			}

			if (k == l)
				System.out.println ("FAIL! ^^^ This file is NOT being tested in test_list.json");
			assertEquals (true, k < l);
		}

		System.out.println ("All script files are being tested");
		System.out.println ();
	}

	/**
	 * Every file in the test suite as listed in test_list.json entries is run
	 */
	@Test
	public void _19_TimeWarpTestSuite () throws Exception {
		System.out.println ("_19_TimeWarpTestSuite() running all files specified in the Test Suite\n");

		JSONObject testEntry;
		TimeWarp timeWarp;
		boolean success;

		// tmp_filter can be used to quickly restrict testing to certain files for speed
		String testListTmpFilter = testList.optString ("tmp_filter");
		JSONArray testListTests = testList.getJSONArray ("tests");
		for (int i = 0, j = testListTests.length (); i < j; ++i) {
			testEntry = testListTests.getJSONObject (i);
			String testName = testEntry.getString ("filename");

			if (testListTmpFilter != null && !testListTmpFilter.isEmpty () && !testName.startsWith (testListTmpFilter))
				continue;

			System.out.println ("***** [" + (i + 1) + " of " + j + "] ***********************************************************************");
			System.out.println ("* " + testEntry.getString ("description"));

			timeWarp = new TimeWarp ();
			timeWarp.randomSeedSet (1);

			if (testEntry.has ("mode")) {
				Dialect mode = Dialect.fromName (testEntry.getString ("mode"));
				if (mode == null) {
					System.out.println ("Unknown mode for this test: " + testEntry.getString ("mode"));
					System.exit (1);
				}
				timeWarp.modeSet (mode);
			}

			JSONArray testInputs = testEntry.optJSONArray ("inputs");
			String[] inputs = new String[testInputs == null ? 0 : testInputs.length ()];
			for (int k = 0; k < inputs.length; ++k)
				inputs[k] = testInputs.getString (k);

			ScriptedHost host = new ScriptedHost (inputs);
			timeWarp.hostSet (host);

			String testFile = readResourceFile ("TimeWarpTestSuite/test_scripts/" + testName);
			if (testFile == null) {
				System.out.println ("Could not read the test file!");
				System.exit (1);
			}

			success = timeWarp.script (testFile);
			if (success) {
				timeWarp.watchdogSet (testEntry.getInt ("watchdog"));
				success = timeWarp.run ();
			}

			System.out.println ();
			System.out.println ("   File: " + testName);
			System.out.println ("Success: " + (success ? "TRUE" : "FALSE"));
			System.out.println (" stdout: " + timeWarp.stdout);
			System.out.println (" stderr: " + timeWarp.stderr);

			assertEquals (testName, testEntry.getBoolean ("success"), success);
			assertEquals (testName, testEntry.getString ("stdout"), timeWarp.stdout);
			assertEquals (testName, testEntry.getString ("stderr"), timeWarp.stderr);

			// The host saw exactly the transcript, line by line
			StringBuilder hostOutput = new StringBuilder ();
			for (String line : host.outputs)
				hostOutput.append (line).append ('\n');
			assertEquals (testName, timeWarp.stdout, hostOutput.toString ());

			System.out.println ("   Test: ✓ PASSED");
			System.out.println ();
			System.out.println ();
		}
	}

	/**
	 * Reads a resource file and returns it as a string
	 *
	 * @param fileName The path and filename to load (relative to the resources directory)
	 * @return String containing the file contents, or null if file cannot be read
	 */
	private static String readResourceFile (String fileName) {
		ByteArrayOutputStream outputStream = new ByteArrayOutputStream ();

		try (InputStream inputStream = Thread.currentThread ().getContextClassLoader ().getResourceAsStream (fileName)) {
			if (inputStream == null)
				return null;

			byte buf[] = new byte[1024];
			int len;

			while ((len = inputStream.read (buf)) != -1)
				outputStream.write (buf, 0, len);
		} catch (IOException e) {
			e.printStackTrace ();
		}

		return new String (outputStream.toByteArray (), StandardCharsets.UTF_8);
	}
}
