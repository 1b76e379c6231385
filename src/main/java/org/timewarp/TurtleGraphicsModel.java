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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * The turtle: position, heading and pen state plus the log of everything drawn.
 * <p>Turtle space has its origin in the centre with Y pointing up, and heading 0 points along +X; positive turns are
 * counter-clockwise. A point maps to surface space as <code>(x + width/2, height/2 - y)</code>. Drawing while the pen
 * is up only moves the turtle. Moves and turns by a non-finite amount are ignored. After every change the position and heading are mirrored into the variables
 * <code>TURTLE_X</code>, <code>TURTLE_Y</code> and <code>TURTLE_HEADING</code>.</p>
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public class TurtleGraphicsModel {
	private static final String LOG_TAG = TurtleGraphicsModel.class.getSimpleName ();
	private static final boolean DEBUG = false;

	/** Colors selected by number with <code>SETCOLOR n</code> */
	public static final String[] PALETTE = {
		"black",
		"red",
		"blue",
		"green",
		"purple",
		"orange",
		"teal",
		"magenta"
	};

	public static final int DEFAULT_WIDTH = 600;
	public static final int DEFAULT_HEIGHT = 400;
	public static final String DEFAULT_COLOR = "black";
	public static final double DEFAULT_PEN_SIZE = 2;

	/** Size of the turtle sprite triangle */
	private static final double SPRITE_SIZE = 10;
	private static final String SPRITE_COLOR = "green";

	private final VariableStore variables;
	private final ArrayList<Primitive> primitives = new ArrayList<Primitive> ();
	private RenderSurface surface = null;

	private double x;
	private double y;
	private double heading;
	private boolean penDown;
	private String penColor;
	private double penSize;
	private boolean visible;
	private String fillColor;

	/**
	 * @param variables Store that receives the mirrored turtle variables
	 */
	public TurtleGraphicsModel (VariableStore variables) {
		this.variables = variables;
		reset ();
	}

	/**
	 * Attaches a render surface, or detaches with null; the log is replayed onto a new surface
	 */
	public void surfaceSet (RenderSurface surface) {
		this.surface = surface;
		redraw ();
	}

	public RenderSurface surfaceGet () {
		return surface;
	}

	/**
	 * Back to the centre facing east with a clean log and default pen
	 */
	public void reset () {
		x = y = heading = 0;
		penDown = true;
		penColor = DEFAULT_COLOR;
		penSize = DEFAULT_PEN_SIZE;
		visible = true;
		fillColor = DEFAULT_COLOR;
		primitives.clear ();
		mirror ();
	}

	public void forward (double distance) {
		if (!Double.isFinite (distance))
			return;

		double radians = Math.toRadians (heading);
		double fromX = x;
		double fromY = y;

		x = snap (x + distance * Math.cos (radians));
		y = snap (y + distance * Math.sin (radians));
		mirror ();

		// The move stands even when the surface fails to draw it
		if (penDown)
			draw (Primitive.line (fromX, fromY, x, y, penColor, penSize));
	}

	public void back (double distance) {
		forward (-distance);
	}

	/**
	 * Turns counter-clockwise by the angle in degrees, negative turns clockwise
	 */
	public void turn (double angle) {
		if (!Double.isFinite (angle))
			return;

		heading = normalise (heading + angle);
		mirror ();
	}

	public void left (double angle) {
		turn (angle);
	}

	public void right (double angle) {
		turn (-angle);
	}

	/**
	 * Moves without drawing
	 */
	public void setPosition (double x, double y) {
		if (!Double.isFinite (x) || !Double.isFinite (y))
			return;

		this.x = x;
		this.y = y;
		mirror ();
	}

	public void setX (double x) {
		setPosition (x, y);
	}

	public void setY (double y) {
		setPosition (x, y);
	}

	public void setHeading (double heading) {
		if (!Double.isFinite (heading))
			return;

		this.heading = normalise (heading);
		mirror ();
	}

	public void home () {
		x = y = heading = 0;
		mirror ();
	}

	public void penUp () {
		penDown = false;
	}

	public void penDown () {
		penDown = true;
	}

	/**
	 * Sets the pen color by name, or by {@link #PALETTE} index when numeric
	 */
	public void setColor (String color) {
		penColor = resolveColor (color);
	}

	public void setFillColor (String color) {
		fillColor = resolveColor (color);
	}

	public void setPenSize (double size) {
		penSize = Math.max (1, size);
	}

	/**
	 * Circle centred on the turtle
	 */
	public void circle (double radius) {
		if (penDown)
			draw (Primitive.circle (x, y, Math.abs (radius), penColor, penSize));
	}

	/**
	 * Filled dot centred on the turtle
	 */
	public void dot (double size) {
		if (penDown)
			draw (Primitive.dot (x, y, Math.abs (size), penColor));
	}

	/**
	 * Rectangle with its top left corner on the turtle
	 */
	public void rect (double width, double height, boolean filled) {
		if (penDown)
			draw (Primitive.rect (x, y, width, height, penColor, penSize, filled ? fillColor : null));
	}

	public void text (String text) {
		if (penDown)
			draw (Primitive.text (x, y, text, penColor));
	}

	/**
	 * Empties the drawing log and redraws; the turtle stays where it is
	 */
	public void clearScreen () {
		if (DEBUG)
			logD (LOG_TAG, "Clearing " + primitives.size () + " primitive(s)");

		primitives.clear ();
		redraw ();
	}

	public void show () {
		visible = true;
		redraw ();
	}

	public void hide () {
		visible = false;
		redraw ();
	}

	/**
	 * Clears the surface, replays the log and draws the turtle sprite when visible
	 */
	public void redraw () {
		if (surface == null)
			return;

		double centerX = centerX ();
		double centerY = centerY ();

		surface.clear ();
		for (int i = 0, j = primitives.size (); i < j; ++i)
			primitives.get (i).render (surface, centerX, centerY);

		if (visible)
			surface.drawPolygon (sprite (), SPRITE_COLOR, SPRITE_COLOR);
	}

	/**
	 * The turtle sprite, a triangle pointing along the heading, in surface space
	 */
	double[] sprite () {
		double sx = centerX () + x;
		double sy = centerY () - y;
		double radians = Math.toRadians (heading);

		return new double[] {
			sx + SPRITE_SIZE * Math.cos (radians), sy - SPRITE_SIZE * Math.sin (radians),
			sx + SPRITE_SIZE * 0.6 * Math.cos (radians + 2.5), sy - SPRITE_SIZE * 0.6 * Math.sin (radians + 2.5),
			sx + SPRITE_SIZE * 0.6 * Math.cos (radians - 2.5), sy - SPRITE_SIZE * 0.6 * Math.sin (radians - 2.5)
		};
	}

	/**
	 * Converts a turtle-space X to surface space
	 */
	public double surfaceX (double turtleX) {
		return centerX () + turtleX;
	}

	/**
	 * Converts a turtle-space Y to surface space
	 */
	public double surfaceY (double turtleY) {
		return centerY () - turtleY;
	}

	public double x () {
		return x;
	}

	public double y () {
		return y;
	}

	public double heading () {
		return heading;
	}

	public boolean isPenDown () {
		return penDown;
	}

	public String penColor () {
		return penColor;
	}

	public double penSize () {
		return penSize;
	}

	public boolean isVisible () {
		return visible;
	}

	public String fillColor () {
		return fillColor;
	}

	/**
	 * The drawing log, oldest first
	 */
	public List<Primitive> primitives () {
		return Collections.unmodifiableList (primitives);
	}

	/**
	 * Number of logged primitives of one kind
	 */
	public int count (Primitive.Kind kind) {
		int count = 0;
		for (Primitive primitive : primitives) {
			if (primitive.kind == kind)
				++count;
		}

		return count;
	}

	private void draw (Primitive primitive) {
		primitives.add (primitive);

		if (surface != null)
			primitive.render (surface, centerX (), centerY ());
	}

	private void mirror () {
		variables.set ("TURTLE_X", x);
		variables.set ("TURTLE_Y", y);
		variables.set ("TURTLE_HEADING", heading);
	}

	private double centerX () {
		return (surface != null ? surface.width () : DEFAULT_WIDTH) / 2.0;
	}

	private double centerY () {
		return (surface != null ? surface.height () : DEFAULT_HEIGHT) / 2.0;
	}

	private static String resolveColor (String color) {
		String name = (color == null ? "" : color.trim ());
		if (name.isEmpty ())
			return DEFAULT_COLOR;

		Double index = Value.parseNumber (name);
		if (index != null)
			return PALETTE[Math.floorMod (index.intValue (), PALETTE.length)];

		return name.toLowerCase (Locale.ROOT);
	}

	/**
	 * Keeps a heading in [0,360)
	 */
	static double normalise (double heading) {
		double normalised = snap (heading % 360);
		if (normalised < 0)
			normalised += 360;

		return normalised >= 360 ? 0 : normalised;
	}

	/**
	 * Drops floating point noise left by trigonometry, e.g. cos(90) is not exactly 0
	 */
	private static double snap (double value) {
		double snapped = Math.rint (value * 1e9) / 1e9;
		return snapped == 0 ? 0 : snapped;
	}
}
