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
 * Configuration for {@link tiltcv.alg.tilt.TransformInvariantLowRankTexture}
 *
 * @author TiltCV Authors
 */
public class ConfigTilt implements Configuration {
	/** Stops when the objective changes by less than this amount between outer iterations */
	public double outerTolerance = 1e-4;

	/** Maximum number of outer iterations */
	public int outerMaxIterations = 50;

	/** How often, in outer iterations, verbose output is printed */
	public int outerDisplayPeriod = 1;

	/** If true the inner solver starts from the previous outer iteration's solution */
	public boolean warmStart = true;

	/** On a warm start the previous penalty is divided by rho raised to this power */
	public double warmStartDecayExponent = 8;

	/**
	 * Pixels whose sparse error is larger than this multiple of the normalized patch's RMS intensity are
	 * treated as outliers. At the next linearization they and their 8 neighbors are removed from the Jacobian,
	 * since the image derivatives around an outlier describe the outlier and not the texture. Zero disables.
	 */
	public double outlierMaskThreshold = 0.5;

	/** Configuration for the inner solver */
	public ConfigLadmap inner = new ConfigLadmap();

	@Override
	public void checkValidity() {
		if (outerTolerance <= 0)
			throw new IllegalArgumentException("outerTolerance must be positive");
		if (outerMaxIterations <= 0)
			throw new IllegalArgumentException("outerMaxIterations must be positive");
		if (outerDisplayPeriod <= 0)
			throw new IllegalArgumentException("outerDisplayPeriod must be positive");
		if (warmStartDecayExponent < 0)
			throw new IllegalArgumentException("warmStartDecayExponent can't be negative");
		if (outlierMaskThreshold < 0)
			throw new IllegalArgumentException("outlierMaskThreshold can't be negative");
		inner.checkValidity();
	}

	public ConfigTilt setTo( ConfigTilt src ) {
		this.outerTolerance = src.outerTolerance;
		this.outerMaxIterations = src.outerMaxIterations;
		this.outerDisplayPeriod = src.outerDisplayPeriod;
		this.warmStart = src.warmStart;
		this.warmStartDecayExponent = src.warmStartDecayExponent;
		this.outlierMaskThreshold = src.outlierMaskThreshold;
		this.inner.setTo(src.inner);
		return this;
	}

	public ConfigTilt copy() {
		return new ConfigTilt().setTo(this);
	}
}
