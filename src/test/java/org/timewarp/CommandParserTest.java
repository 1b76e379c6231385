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

import java.util.Arrays;

import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;
import org.timewarp.Command.Kind;

/**
 * Statement parsing for each dialect
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class CommandParserTest {
	private static Command parse (String statement) {
		return CommandParser.parse (statement, null);
	}

	@Test
	public void _01_ColonCommands () {
		Command jumpIf = parse ("J(X > 1):done");
		assertEquals (Kind.JUMP_IF, jumpIf.kind);
		assertEquals ("done", jumpIf.name);
		assertEquals ("X > 1", jumpIf.argument (0));

		assertEquals (Kind.RETURN, parse ("C:").kind);
		assertEquals (Kind.COMPUTE, parse ("C:X = X + 1").kind);
		assertEquals (Kind.INVALID, parse ("C:X + 1").kind);
		assertEquals ("Malformed C: (expected variable = expression)", parse ("C:X + 1").name);
		assertEquals (Kind.ACCEPT, parse ("A:").kind);
		assertEquals ("", parse ("A:").name);
		assertEquals (Kind.UNKNOWN, parse ("Q:what").kind);
		assertEquals ("Q:", parse ("Q:what").name);
	}

	@Test
	public void _02_ColonOperations () {
		Command string = parse ("S:UPPER \"hi there\" SHOUT");
		assertEquals (Kind.STRING_OP, string.kind);
		assertEquals ("UPPER", string.name);
		assertEquals (Arrays.asList ("hi there", "SHOUT"), string.arguments);

		Command date = parse ("DT:now \"YYYY-MM-DD\" TODAY");
		assertEquals ("NOW", date.name);
		assertEquals (Arrays.asList ("\"YYYY-MM-DD\"", "TODAY"), date.arguments);

		Command branch = parse ("BRANCH:MULTI X > 1:big, X > 0:small");
		assertEquals (Kind.BRANCH_MULTI, branch.kind);
		assertEquals (Arrays.asList ("X > 1:big", "X > 0:small"), branch.arguments);

		Command storage = parse ("STORAGE:SAVE \"vars.json\"");
		assertEquals ("SAVE", storage.name);
		assertEquals ("vars.json", storage.argument (0));

		assertEquals ("16", parse ("MATH:SQRT 16").argument (0));
	}

	@Test
	public void _03_IfThenElse () {
		Command command = parse ("IF X > 3 THEN PRINT \"big\" ELSE 60");

		assertEquals (Kind.IF, command.kind);
		assertEquals ("X > 3", command.argument (0));
		assertEquals (Kind.PRINT, command.thenBranch.kind);
		assertEquals (Kind.GOTO, command.elseBranch.kind);
		assertEquals ("60", command.elseBranch.name);

		assertNull (parse ("IF X THEN 20").elseBranch);
		assertEquals (Kind.INVALID, parse ("IF X PRINT 1").kind);
	}

	@Test
	public void _04_ForAndNext () {
		Command command = parse ("FOR I = 1 TO N * 2 STEP -1");
		assertEquals (Kind.FOR, command.kind);
		assertEquals ("I", command.name);
		assertEquals (Arrays.asList ("1", "N * 2", "-1"), command.arguments);

		assertEquals ("1", parse ("FOR J = 0 TO 9").argument (2));
		assertEquals ("I", parse ("NEXT I").name);
		assertEquals ("", parse ("NEXT").name);
	}

	@Test
	public void _05_PrintAndInput () {
		assertEquals (Arrays.asList ("\"A, B\"", ",", "X", ";", "LEN(\"a;b\")"), parse ("PRINT \"A, B\", X; LEN(\"a;b\")").arguments);

		Command prompted = parse ("INPUT \"Name\"; N$");
		assertEquals ("N$", prompted.name);
		assertEquals ("Name", prompted.argument (0));

		Command plain = parse ("INPUT A");
		assertEquals ("A", plain.name);
		assertEquals ("Enter value for A: ", plain.argument (0));
	}

	@Test
	public void _06_Assignments () {
		Command element = parse ("A(1, 2) = 5");
		assertEquals (Kind.ASSIGN, element.kind);
		assertEquals ("A", element.name);
		assertEquals (Arrays.asList ("5", "1", "2"), element.arguments);

		Command array = parse ("LIST = [1, \"two\", 3]");
		assertEquals (Kind.ASSIGN_ARRAY, array.kind);
		assertEquals (Arrays.asList ("1", "\"two\"", "3"), array.arguments);

		assertEquals (Kind.LET, parse ("LET X = 1").kind);
		assertEquals (Kind.INVALID, parse ("LET X").kind);
		assertEquals (Arrays.asList ("A", "B"), parse ("DIM A(10), B(3, 3)").arguments);
	}

	@Test
	public void _07_TurtleCommands () {
		assertEquals (Kind.FORWARD, parse ("FD 10").kind);
		assertEquals (Arrays.asList ("10", "20"), parse ("SETXY 10 20").arguments);
		assertEquals (Arrays.asList ("10", "-20"), parse ("SETXY 10, -20").arguments);
		assertEquals (Arrays.asList ("30", "40", "FILL"), parse ("RECT 30 40 FILL").arguments);
		assertEquals ("hello there", parse ("TEXT \"hello there\"").argument (0));
		assertEquals (Kind.SHOW_HEADING, parse ("HEADING").kind);
	}

	@Test
	public void _08_BlocksAndMacros () {
		Command repeat = parse ("REPEAT 4 [FD 10 RT 90]");
		assertEquals (Kind.REPEAT, repeat.kind);
		assertEquals ("4", repeat.argument (0));
		assertEquals (2, repeat.body.size ());

		Command define = parse ("DEFINE square [REPEAT 4 [FD 10 RT 90]]");
		assertEquals ("SQUARE", define.name);
		assertEquals (1, define.body.size ());
		assertEquals (Kind.REPEAT, define.body.get (0).kind);

		assertEquals ("SQUARE", parse ("CALL square").name);
		assertEquals (Kind.INVALID, parse ("REPEAT [FD 10]").kind);
		assertEquals ("Malformed REPEAT syntax", parse ("REPEAT 4 FD 10").name);
		assertEquals (Kind.INVALID, parse ("CALL 9LIVES").kind);
	}

	/**
	 * Block statements start at keywords, colon commands and assignments; IF takes the rest
	 */
	@Test
	public void _09_SplitBlock () {
		assertEquals (Arrays.asList ("T:hello world", "FD 10", "X = X + 1", "IF X > 1 THEN FD 5 RT 90"), CommandParser.splitBlock ("T:hello world FD 10 X = X + 1 IF X > 1 THEN FD 5 RT 90"));
		assertEquals (Arrays.asList ("REPEAT 2 [ FD 1 ]", "HOME"), CommandParser.splitBlock ("REPEAT 2 [FD 1] HOME"));
		assertEquals (Arrays.asList ("T:\"a [b]\"", "END"), CommandParser.splitBlock ("T:\"a [b]\" END"));
	}

	@Test
	public void _10_ParseLine () {
		assertEquals (3, CommandParser.parseLine ("FD 10 RT 90 FD 10", null).size ());
		assertEquals (1, CommandParser.parseLine ("PRINT 1; 2", null).size ());
		assertEquals (1, CommandParser.parseLine ("T:FD 10 RT 90", null).size ());
	}
}
