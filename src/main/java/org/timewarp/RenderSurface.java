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
 * Drawing target for the turtle, independent of any windowing toolkit. All coordinates are surface coordinates
 * (origin top left, Y down); colors are names such as <code>red</code> or <code>#ff8800</code>, and a null fill
 * means an outline only.
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public interface RenderSurface {
	void drawLine (double x1, double y1, double x2, double y2, String color, double width);

	void drawCircle (double centerX, double centerY, double radius, String color, double width, String fill);

	void drawRect (double x, double y, double width, double height, String color, double lineWidth, String fill);

	/**
	 * @param points Alternating x and y coordinates
	 */
	void drawPolygon (double[] points, String color, String fill);

	void drawText (double x, double y, String text, String color);

	/**
	 * Removes everything drawn so far
	 */
	void clear ();

	int width ();

	int height ();
}
