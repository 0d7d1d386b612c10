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

package tiltcv.factory.geo;

import tiltcv.abst.geo.tilt.TiltTransformModel;
import tiltcv.abst.geo.tilt.WrapTiltTransformFamily;
import tiltcv.struct.tilt.TransformFamily;

/**
 * Creates the geometric models used to rectify low-rank textures
 *
 * @author TiltCV Authors
 */
public class FactoryTiltModel {
	/**
	 * Model for one of the built in transform families
	 */
	public static TiltTransformModel family( TransformFamily family ) {
		if (family == null)
			throw new IllegalArgumentException("family can't be null");
		return new WrapTiltTransformFamily(family);
	}
}
