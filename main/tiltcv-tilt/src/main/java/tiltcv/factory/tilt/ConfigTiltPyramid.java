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

import boofcv.struct.Configuration;

/**
 * Configuration for {@link tiltcv.alg.tilt.PyramidTilt}
 *
 * @author TiltCV Authors
 */
public class ConfigTiltPyramid implements Configuration {
	/** Blur the input image before rectifying it */
	public boolean blur = true;

	/** Process large focus regions coarse to fine */
	public boolean pyramid = true;

	/** Focus regions are down sampled until their smaller side is about this many pixels */
	public int focusThreshold = 50;

	/** After each pyramid level the outer tolerance is multiplied by this amount */
	public double outerToleranceStep = 10;

	/** Gaussian kernel size is this value times the level's scale factor */
	public double blurSizeK = 3;

	/** Gaussian sigma is this value times the level's scale factor */
	public double blurSigmaK = 3;

	/** Maximum number of pyramid levels which are processed */
	public int pyramidMaxLevel = 2;

	/**
	 * Configuration for each level. Used by {@link FactoryTilt#pyramid} to create the level algorithm. When a
	 * {@link tiltcv.alg.tilt.PyramidTilt} is constructed directly, the level algorithm's own configuration is
	 * used and this field is ignored.
	 */
	public ConfigTilt tilt = new ConfigTilt();

	@Override
	public void checkValidity() {
		if (focusThreshold <= 0)
			throw new IllegalArgumentException("focusThreshold must be positive");
		if (outerToleranceStep <= 0)
			throw new IllegalArgumentException("outerToleranceStep must be positive");
		if (blurSizeK <= 0 || blurSigmaK <= 0)
			throw new IllegalArgumentException("Blur parameters must be positive");
		if (pyramidMaxLevel <= 0)
			throw new IllegalArgumentException("pyramidMaxLevel must be positive");
		tilt.checkValidity();
	}

	public ConfigTiltPyramid setTo( ConfigTiltPyramid src ) {
		this.blur = src.blur;
		this.pyramid = src.pyramid;
		this.focusThreshold = src.focusThreshold;
		this.outerToleranceStep = src.outerToleranceStep;
		this.blurSizeK = src.blurSizeK;
		this.blurSigmaK = src.blurSigmaK;
		this.pyramidMaxLevel = src.pyramidMaxLevel;
		this.tilt.setTo(src.tilt);
		return this;
	}

	public ConfigTiltPyramid copy() {
		return new ConfigTiltPyramid().setTo(this);
	}
}
