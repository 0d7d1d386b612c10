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

package tiltcv.factory.tilt;

import tiltcv.alg.tilt.LadmapLowRankSparse;
import tiltcv.alg.tilt.PyramidTilt;
import tiltcv.alg.tilt.TransformInvariantLowRankTexture;
import tiltcv.factory.geo.FactoryTiltModel;
import tiltcv.struct.tilt.TransformFamily;

import javax.annotation.Nullable;

/**
 * Factory for creating algorithms which rectify low-rank textures
 *
 * @author TiltCV Authors
 */
public class FactoryTilt {
	/**
	 * Solver for the linearized low-rank plus sparse decomposition
	 *
	 * @param config Configuration. If null then default is used.
	 */
	public static LadmapLowRankSparse ladmap( @Nullable ConfigLadmap config ) {
		if (config == null)
			config = new ConfigLadmap();
		return new LadmapLowRankSparse(config);
	}

	/**
	 * Rectifies a single focus region at the image's resolution
	 *
	 * @param config Configuration. If null then default is used.
	 * @param family Which family of transforms is estimated
	 */
	public static TransformInvariantLowRankTexture tilt( @Nullable ConfigTilt config, TransformFamily family ) {
		if (config == null)
			config = new ConfigTilt();
		return new TransformInvariantLowRankTexture(config, FactoryTiltModel.family(family));
	}

	/**
	 * Rectifies a focus region coarse to fine with optional blurring
	 *
	 * @param config Configuration. If null then default is used.
	 * @param family Which family of transforms is estimated
	 */
	public static PyramidTilt pyramid( @Nullable ConfigTiltPyramid config, TransformFamily family ) {
		if (config == null)
			config = new ConfigTiltPyramid();
		config.checkValidity();
		// the pyramid modifies the tolerance of this copy
		TransformInvariantLowRankTexture tilt = tilt(config.tilt.copy(), family);
		return new PyramidTilt(config, tilt);
	}
}
