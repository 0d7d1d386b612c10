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

import java.util.Locale;

/**
 * Parametric family of the geometric transform which maps the rectified window into the input image. Each
 * family declares the length of its parameter vector and the number of linear constraints imposed on a
 * parameter update.
 *
 * <table>
 *     <caption>Parameter layout</caption>
 *     <tr><th>Family</th><th>Parameters</th></tr>
 *     <tr><td>EUCLIDEAN</td><td>(&theta;, tx, ty)</td></tr>
 *     <tr><td>AFFINE</td><td>(a11, a12, tx, a21, a22, ty)</td></tr>
 *     <tr><td>HOMOGRAPHY</td><td>window corners after the transform (u1,v1, ... ,u4,v4)</td></tr>
 * </table>
 *
 * Variants without translation drop tx and ty. For a homography the parameters stay the same and the centroid
 * of the corners is constrained instead.
 *
 * @author TiltCV Authors
 */
public enum TransformFamily {
	EUCLIDEAN(3, 0, false),
	EUCLIDEAN_NO_TRANSLATION(1, 0, true),
	AFFINE(6, 2, false),
	AFFINE_NO_TRANSLATION(4, 2, true),
	HOMOGRAPHY(8, 2, false),
	HOMOGRAPHY_NO_TRANSLATION(8, 4, true);

	final int parameterCount;
	final int constraintCount;
	final boolean noTranslation;

	TransformFamily( int parameterCount, int constraintCount, boolean noTranslation ) {
		this.parameterCount = parameterCount;
		this.constraintCount = constraintCount;
		this.noTranslation = noTranslation;
	}

	/** Number of free parameters in the parameter vector */
	public int getParameterCount() {
		return parameterCount;
	}

	/** Number of rows in the constraint matrix. Can be zero. */
	public int getConstraintCount() {
		return constraintCount;
	}

	/** True if translation is not estimated */
	public boolean isNoTranslation() {
		return noTranslation;
	}

	/**
	 * Returns the variant of this family which does not estimate translation
	 */
	public TransformFamily withoutTranslation() {
		switch (this) {
			case EUCLIDEAN:
			case EUCLIDEAN_NO_TRANSLATION:
				return EUCLIDEAN_NO_TRANSLATION;
			case AFFINE:
			case AFFINE_NO_TRANSLATION:
				return AFFINE_NO_TRANSLATION;
			case HOMOGRAPHY:
			case HOMOGRAPHY_NO_TRANSLATION:
				return HOMOGRAPHY_NO_TRANSLATION;
			default:
				throw new IllegalArgumentException("Unknown family " + this);
		}
	}

	/**
	 * Looks up a family from its lower case name, e.g. "affine" or "homography_notranslation"
	 */
	public static TransformFamily fromName( String name ) {
		String lower = name.trim().toLowerCase(Locale.ROOT);
		boolean noTranslation = lower.endsWith("_notranslation");
		if (noTranslation)
			lower = lower.substring(0, lower.length() - "_notranslation".length());

		TransformFamily family;
		switch (lower) {
			case "euclidean": family = EUCLIDEAN; break;
			case "affine": family = AFFINE; break;
			case "homography": family = HOMOGRAPHY; break;
			default: throw new IllegalArgumentException("Unknown transform family '" + name + "'");
		}
		return noTranslation ? family.withoutTranslation() : family;
	}
}
