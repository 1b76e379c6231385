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

/**
 * One entry of the turtle's drawing log, in turtle-space coordinates so the log can be replayed onto any surface
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public final class Primitive {
	/** Primitive shapes */
	public static enum Kind {
		LINE,
		CIRCLE,
		DOT,
		RECT,
		TEXT
	}

	public final Kind kind;
	public final double x;
	public final double y;
	public final double x2;
	public final double y2;
	public final double size;
	public final String color;
	public final String fill;
	public final String text;

	private Primitive (Kind kind, double x, double y, double x2, double y2, double size, String color, String fill, String text) {
		this.kind = kind;
		this.x = x;
		this.y = y;
		this.x2 = x2;
		this.y2 = y2;
		this.size = size;
		this.color = color;
		this.fill = fill;
		this.text = text;
	}

	public static Primitive line (double x1, double y1, double x2, double y2, String color, double width) {
		return new Primitive (Kind.LINE, x1, y1, x2, y2, width, color, null, null);
	}

	/**
	 * Circle centred on (x, y); size is the pen width
	 */
	public static Primitive circle (double x, double y, double radius, String color, double width) {
		return new Primitive (Kind.CIRCLE, x, y, radius, 0, width, color, null, null);
	}

	public static Primitive dot (double x, double y, double diameter, String color) {
		return new Primitive (Kind.DOT, x, y, diameter / 2, 0, 1, color, color, null);
	}

	/**
	 * Rectangle with its top left corner at (x, y), extending right by x2 and down by y2
	 */
	public static Primitive rect (double x, double y, double width, double height, String color, double lineWidth, String fill) {
		return new Primitive (Kind.RECT, x, y, width, height, lineWidth, color, fill, null);
	}

	public static Primitive text (double x, double y, String text, String color) {
		return new Primitive (Kind.TEXT, x, y, 0, 0, 0, color, null, text);
	}

	/**
	 * Draws this primitive onto a surface whose turtle origin is at (centerX, centerY)
	 */
	void render (RenderSurface surface, double centerX, double centerY) {
		double sx = centerX + x;
		double sy = centerY - y;

		switch (kind) {
			case LINE:
				surface.drawLine (sx, sy, centerX + x2, centerY - y2, color, size);
				break;
			case CIRCLE:
				surface.drawCircle (sx, sy, x2, color, size, null);
				break;
			case DOT:
				surface.drawCircle (sx, sy, x2, color, size, fill);
				break;
			case RECT:
				surface.drawRect (sx, sy, x2, y2, color, size, fill);
				break;
			case TEXT:
				surface.drawText (sx, sy, text, color);
				break;
		}
	}

	@Override
	public String toString () {
		return kind + "(" + Value.format (x) + "," + Value.format (y) + (kind == Kind.LINE ? " -> " + Value.format (x2) + "," + Value.format (y2) : "") + ")";
	}
}
