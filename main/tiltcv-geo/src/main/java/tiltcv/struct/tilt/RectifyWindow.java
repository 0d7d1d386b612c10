/*
 * Copyright (c) 2020, The TiltCV Authors. All Rights Reserved.
 *
 * This file is part of TiltCV.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package tiltcv.struct.tilt;

/**
 * <p>
 * Specifies the two coordinate systems used when rectifying a patch. The input image's origin is placed at
 * pixel ({@link #centerX},{@link #centerY}). The rectified patch is {@link #width} by {@link #height} pixels
 * and its origin is at the patch's center pixel. A transform maps rectified coordinates into input coordinates.
 * </p>
 *
 * <pre>
 * rectified x = col - focusCenterX    x in [ -focusCenterX , width-1-focusCenterX ]
 * input pixel = input x + centerX
 * </pre>
 *
 * @author TiltCV Authors
 */
public class RectifyWindow {
	/** Input image pixel which is the origin of the input coordinate system */
	public int centerX, centerY;
	/** Shape of the rectified patch */
	public int width, height;

	public RectifyWindow( int centerX, int centerY, int width, int height ) {
		setTo(centerX, centerY, width, height);
	}

	public RectifyWindow() {}

	public RectifyWindow setTo( int centerX, int centerY, int width, int height ) {
		this.centerX = centerX;
		this.centerY = centerY;
		this.width = width;
		this.height = height;
		return this;
	}

	public RectifyWindow setTo( RectifyWindow src ) {
		return setTo(src.centerX, src.centerY, src.width, src.height);
	}

	/** Column in the rectified patch which has an x-coordinate of zero */
	public int getFocusCenterX() {
		return (width + 1)/2 - 1;
	}

	/** Row in the rectified patch which has a y-coordinate of zero */
	public int getFocusCenterY() {
		return (height + 1)/2 - 1;
	}

	/** Rectified x-coordinate of the specified column */
	public double outputX( int col ) {
		return col - getFocusCenterX();
	}

	/** Rectified y-coordinate of the specified row */
	public double outputY( int row ) {
		return row - getFocusCenterY();
	}

	public double getX0() { return -getFocusCenterX(); }

	public double getX1() { return width - 1 - getFocusCenterX(); }

	public double getY0() { return -getFocusCenterY(); }

	public double getY1() { return height - 1 - getFocusCenterY(); }

	/** Number of pixels in the rectified patch */
	public int getPixelCount() {
		return width*height;
	}

	/** True if the rectified patch contains at least one pixel */
	public boolean isValid() {
		return width > 0 && height > 0;
	}

	public RectifyWindow copy() {
		return new RectifyWindow(centerX, centerY, width, height);
	}

	@Override
	public String toString() {
		return "RectifyWindow{center=(" + centerX + "," + centerY + "), shape=" + width + "x" + height +
				", x=[" + getX0() + "," + getX1() + "], y=[" + getY0() + "," + getY1() + "]}";
	}
}
