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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author TiltCV Authors
 */
class TestRectifyWindow {
	@Test
	void coordinates_even() {
		var alg = new RectifyWindow(60, 70, 100, 20);
		assertEquals(49, alg.getFocusCenterX());
		assertEquals(9, alg.getFocusCenterY());
		assertEquals(-49, alg.getX0());
		assertEquals(50, alg.getX1());
		assertEquals(-9, alg.getY0());
		assertEquals(10, alg.getY1());
		assertEquals(0.0, alg.outputX(49));
		assertEquals(2000, alg.getPixelCount());
	}

	@Test
	void coordinates_odd() {
		var alg = new RectifyWindow(0, 0, 41, 7);
		assertEquals(-20, alg.getX0());
		assertEquals(20, alg.getX1());
		assertEquals(-3, alg.getY0());
		assertEquals(3, alg.getY1());
		assertEquals(-20, alg.outputX(0));
		assertEquals(3, alg.outputY(6));
	}

	@Test
	void isValid() {
		assertTrue(new RectifyWindow(0, 0, 1, 1).isValid());
		assertFalse(new RectifyWindow(0, 0, 0, 5).isValid());
		assertFalse(new RectifyWindow(0, 0, 5, -1).isValid());
	}

	@Test
	void copy() {
		var a = new RectifyWindow(1, 2, 3, 4);
		var b = a.copy();
		a.setTo(5, 6, 7, 8);
		assertEquals(1, b.centerX);
		assertEquals(2, b.centerY);
		assertEquals(3, b.width);
		assertEquals(4, b.height);
		b.setTo(a);
		assertEquals(8, b.height);
	}
}
