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

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author TiltCV Authors
 */
class TestTransformFamily {
	@Test
	void counts() {
		assertEquals(3, TransformFamily.EUCLIDEAN.getParameterCount());
		assertEquals(1, TransformFamily.EUCLIDEAN_NO_TRANSLATION.getParameterCount());
		assertEquals(6, TransformFamily.AFFINE.getParameterCount());
		assertEquals(4, TransformFamily.AFFINE_NO_TRANSLATION.getParameterCount());
		assertEquals(8, TransformFamily.HOMOGRAPHY.getParameterCount());
		assertEquals(8, TransformFamily.HOMOGRAPHY_NO_TRANSLATION.getParameterCount());

		assertEquals(0, TransformFamily.EUCLIDEAN.getConstraintCount());
		assertEquals(2, TransformFamily.AFFINE_NO_TRANSLATION.getConstraintCount());
		assertEquals(2, TransformFamily.HOMOGRAPHY.getConstraintCount());
		assertEquals(4, TransformFamily.HOMOGRAPHY_NO_TRANSLATION.getConstraintCount());
	}

	@Test
	void withoutTranslation() {
		for (TransformFamily family : TransformFamily.values()) {
			TransformFamily found = family.withoutTranslation();
			assertTrue(found.isNoTranslation());
			assertEquals(found, found.withoutTranslation());
		}
		assertEquals(TransformFamily.AFFINE_NO_TRANSLATION, TransformFamily.AFFINE.withoutTranslation());
	}

	@Test
	void fromName() {
		assertEquals(TransformFamily.AFFINE, TransformFamily.fromName("affine"));
		assertEquals(TransformFamily.EUCLIDEAN, TransformFamily.fromName(" Euclidean "));
		assertEquals(TransformFamily.HOMOGRAPHY_NO_TRANSLATION, TransformFamily.fromName("homography_notranslation"));
		assertThrows(IllegalArgumentException.class, () -> TransformFamily.fromName("similarity"));
	}

	/**
	 * Upper case names must not depend on the default locale. In Turkish 'I' becomes a dotless i.
	 */
	@Test
	void fromName_locale() {
		Locale previous = Locale.getDefault();
		try {
			Locale.setDefault(new Locale("tr", "TR"));
			assertEquals(TransformFamily.AFFINE_NO_TRANSLATION, TransformFamily.fromName("AFFINE_NOTRANSLATION"));
			assertEquals(TransformFamily.EUCLIDEAN, TransformFamily.fromName("EUCLIDEAN"));
		} finally {
			Locale.setDefault(previous);
		}
	}
}
