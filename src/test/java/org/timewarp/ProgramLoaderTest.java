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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

/**
 * Comment removal, line numbers, block flattening, labels and load errors
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class ProgramLoaderTest {
	private static void assertLoadError (String source, int sourceLine, String message) {
		try {
			ProgramLoader.load (source, null);
			fail ("Loaded: " + source);
		} catch (ProgramLoadException e) {
			assertEquals (message, e.getMessage ());
			assertEquals (sourceLine, e.getSourceLine ());
		}
	}

	@Test
	public void _01_CommentsAndBlankLines () throws Exception {
		Program program = ProgramLoader.load ("; comment\n// note\n' quote\nREM note\n\nT:hi", null);

		assertEquals (1, program.size ());
		assertEquals (Command.Kind.TEXT, program.line (0).command.kind);
		assertEquals (6, program.line (0).sourceLine);
	}

	@Test
	public void _02_LineNumbers () throws Exception {
		Program program = ProgramLoader.load ("20 PRINT 2\n10 PRINT 1\n30\n40 REM numbered remarks stay", null);

		assertEquals (4, program.size ());
		assertEquals (Integer.valueOf (20), program.line (0).lineNumber);
		assertEquals (1, program.lineNumberIndex (10));
		assertEquals (Command.Kind.EMPTY, program.line (2).command.kind);
		assertEquals (Command.Kind.REMARK, program.line (3).command.kind);
		assertEquals (-1, program.lineNumberIndex (99));
	}

	/**
	 * A block over several lines becomes one statement
	 */
	@Test
	public void _03_BlockSpanningLines () throws Exception {
		Program program = ProgramLoader.load ("REPEAT 2 [\n  FD 10 ; side\n\n  RT 90\n]\nT:x", null);

		assertEquals (2, program.size ());

		Command repeat = program.line (0).command;
		assertEquals (Command.Kind.REPEAT, repeat.kind);
		assertEquals ("2", repeat.argument (0));
		assertEquals (2, repeat.body.size ());
		assertEquals (Command.Kind.FORWARD, repeat.body.get (0).kind);
		assertEquals (Command.Kind.RIGHT, repeat.body.get (1).kind);

		assertEquals (1, program.line (0).sourceLine);
		assertEquals (6, program.line (1).sourceLine);
	}

	@Test
	public void _04_SeveralTurtleCommandsOnALine () throws Exception {
		Program program = ProgramLoader.load ("FD 10 RT 90 HOME", null);

		assertEquals (3, program.size ());
		assertEquals (Command.Kind.HOME, program.line (2).command.kind);
		assertEquals (2, program.line (2).index);
		assertEquals (1, program.line (2).sourceLine);
	}

	/**
	 * A trailing semicolon starts a comment, except in PRINT where it is a separator
	 */
	@Test
	public void _05_TrailingComments () throws Exception {
		Program program = ProgramLoader.load ("FD 10 ; move\nPRINT 1; 2\nT:a ; b", null);

		assertEquals (Arrays.asList ("10"), program.line (0).command.arguments);
		assertEquals (Arrays.asList ("1", ";", "2"), program.line (1).command.arguments);
		assertEquals ("a ; b", program.line (2).command.argument (0));
	}

	@Test
	public void _06_Labels () throws Exception {
		Program program = ProgramLoader.load ("T:a\nL:Loop\nT:b", null);

		assertEquals (1, program.labelIndex ("LOOP"));
		assertEquals (-1, program.labelIndex ("Loop"));
		assertEquals (-1, program.labelIndex ("NONE"));
	}

	@Test
	public void _07_LineEndingsAndBom () throws Exception {
		Program program = ProgramLoader.load ("\uFEFFT:a\r\nT:b\rT:c", null);

		assertEquals (3, program.size ());
		assertEquals ("a", program.line (0).command.argument (0));
	}

	@Test
	public void _08_ExplicitModeKeepsColonSyntax () throws Exception {
		Program program = ProgramLoader.load ("T:hi\nPRINT 1", Dialect.LINE_NUMBERED);

		assertEquals (Command.Kind.TEXT, program.line (0).command.kind);
		assertEquals (Dialect.COLON, program.line (0).command.dialect);
		assertEquals (Dialect.LINE_NUMBERED, program.line (1).command.dialect);
		assertNull (program.line (1).lineNumber);
	}

	@Test
	public void _09_LoadErrors () {
		assertLoadError ("REPEAT 4 [FD 10", 1, "Unclosed [ block");
		assertLoadError ("T:a\nREPEAT 2 [\nFD 10", 2, "Unclosed [ block");
		assertLoadError ("]", 1, "Unexpected ] without matching [");
		assertLoadError ("REPEAT 2 [\nFD 10\n]]", 3, "Unexpected ] without matching [");
		assertLoadError ("L:start\nL:start", 2, "Duplicate label: start");
		assertLoadError ("L:one\nL:ONE", 2, "Duplicate label: ONE");
		assertLoadError (null, 0, "No program given");
	}

	/**
	 * Brackets inside a trailing comment do not open a block
	 */
	@Test
	public void _10_CommentsHideBrackets () throws Exception {
		Program program = ProgramLoader.load ("DEFINE SQ [ FD 10 ]\nCALL SQ ; draw [square\nX = 5 ; see [note\n10 LET Y = 1 ; ]\nPRINT \"after\"", null);

		assertEquals (5, program.size ());
		assertEquals (Command.Kind.CALL, program.line (1).command.kind);
		assertEquals ("SQ", program.line (1).command.name);
		assertEquals ("X = 5", program.line (2).text);
		assertEquals (Command.Kind.ASSIGN, program.line (2).command.kind);
		assertEquals ("LET Y = 1", program.line (3).text);
		assertEquals (Integer.valueOf (10), program.line (3).lineNumber);
		assertEquals (Command.Kind.PRINT, program.line (4).command.kind);
	}
}
