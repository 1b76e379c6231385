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

import org.junit.Before;
import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

/**
 * Turtle state, the drawing log and surface-space conversion
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class TurtleGraphicsModelTest {
	private static final double DELTA = 1e-9;

	private VariableStore variables;
	private TurtleGraphicsModel turtle;

	@Before
	public void setUp () {
		variables = new VariableStore ();
		turtle = new TurtleGraphicsModel (variables);
	}

	/**
	 * Forward, right turn, forward ends facing down with two lines drawn
	 */
	@Test
	public void _01_ForwardTurnForward () {
		turtle.forward (100);
		turtle.right (90);
		turtle.forward (100);

		assertEquals (270, turtle.heading (), DELTA);
		assertEquals (100, turtle.x (), DELTA);
		assertEquals (-100, turtle.y (), DELTA);
		assertEquals (2, turtle.count (Primitive.Kind.LINE));

		assertEquals ("100", variables.get ("TURTLE_X").toText ());
		assertEquals ("-100", variables.get ("TURTLE_Y").toText ());
		assertEquals ("270", variables.get ("TURTLE_HEADING").toText ());
	}

	@Test
	public void _02_PenUpMovesWithoutDrawing () {
		turtle.penUp ();
		turtle.forward (50);
		turtle.circle (10);
		turtle.text ("hidden");

		assertEquals (50, turtle.x (), DELTA);
		assertEquals (0, turtle.primitives ().size ());

		turtle.penDown ();
		turtle.back (20);
		assertEquals (30, turtle.x (), DELTA);
		assertEquals (1, turtle.count (Primitive.Kind.LINE));
	}

	@Test
	public void _03_HeadingStaysInRange () {
		turtle.setHeading (-450);
		assertEquals (270, turtle.heading (), DELTA);

		turtle.turn (450);
		assertEquals (0, turtle.heading (), DELTA);

		turtle.left (360);
		assertEquals (0, turtle.heading (), DELTA);

		turtle.right (1);
		assertEquals (359, turtle.heading (), DELTA);
	}

	/**
	 * Surface space is (x + w/2, h/2 - y)
	 */
	@Test
	public void _04_SurfaceMapping () {
		RecordingSurface surface = new RecordingSurface (600, 400);
		turtle.surfaceSet (surface);

		turtle.left (90);
		turtle.forward (50);

		assertEquals (1, surface.count ("line"));
		assertEquals (true, surface.calls.contains ("line 300,200 300,150 black 2"));
		assertEquals (300, turtle.surfaceX (0), DELTA);
		assertEquals (150, turtle.surfaceY (50), DELTA);
	}

	@Test
	public void _05_RedrawReplaysLogAndSprite () {
		RecordingSurface surface = new RecordingSurface (200, 200);
		turtle.surfaceSet (surface);
		turtle.forward (10);
		turtle.forward (10);

		turtle.redraw ();
		assertEquals (2, surface.count ("line"));
		assertEquals (1, surface.count ("polygon"));

		turtle.hide ();
		assertEquals (2, surface.count ("line"));
		assertEquals (0, surface.count ("polygon"));
	}

	@Test
	public void _06_ClearScreenKeepsPosition () {
		turtle.forward (30);
		turtle.clearScreen ();

		assertEquals (0, turtle.primitives ().size ());
		assertEquals (30, turtle.x (), DELTA);
	}

	@Test
	public void _07_ColorsAndPen () {
		turtle.setColor ("1");
		assertEquals ("red", turtle.penColor ());

		turtle.setColor ("9");
		assertEquals ("red", turtle.penColor ());

		turtle.setColor ("Blue");
		assertEquals ("blue", turtle.penColor ());

		turtle.setPenSize (0);
		assertEquals (1, turtle.penSize (), DELTA);
	}

	@Test
	public void _08_ShapesUseTurtlePosition () {
		turtle.setPosition (10, 20);
		turtle.setFillColor ("orange");
		turtle.rect (30, 40, true);
		turtle.rect (5, 5, false);
		turtle.dot (4);

		assertEquals (3, turtle.primitives ().size ());

		Primitive filled = turtle.primitives ().get (0);
		assertEquals (Primitive.Kind.RECT, filled.kind);
		assertEquals (10, filled.x, DELTA);
		assertEquals (20, filled.y, DELTA);
		assertEquals ("orange", filled.fill);
		assertNull (turtle.primitives ().get (1).fill);
		assertEquals (Primitive.Kind.DOT, turtle.primitives ().get (2).kind);
	}

	@Test
	public void _09_HomeAndReset () {
		turtle.setPosition (5, 5);
		turtle.setHeading (45);
		turtle.home ();

		assertEquals (0, turtle.x (), DELTA);
		assertEquals (0, turtle.heading (), DELTA);

		turtle.penUp ();
		turtle.setColor ("red");
		turtle.reset ();

		assertEquals (true, turtle.isPenDown ());
		assertEquals (TurtleGraphicsModel.DEFAULT_COLOR, turtle.penColor ());
		assertEquals (true, turtle.isVisible ());
	}

	@Test
	public void _10_NonFiniteValuesIgnored () {
		turtle.forward (10);
		turtle.setHeading (Double.POSITIVE_INFINITY);
		turtle.turn (Double.NaN);
		turtle.forward (Double.NEGATIVE_INFINITY);
		turtle.setPosition (Double.NaN, 5);

		assertEquals (0, turtle.heading (), DELTA);
		assertEquals (10, turtle.x (), DELTA);
		assertEquals (0, turtle.y (), DELTA);
		assertEquals (1, turtle.count (Primitive.Kind.LINE));
		assertEquals ("10", variables.get ("TURTLE_X").toText ());
		assertEquals ("0", variables.get ("TURTLE_HEADING").toText ());
	}
}
