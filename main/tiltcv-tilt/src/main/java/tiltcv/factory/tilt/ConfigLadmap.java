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
 * Configuration for {@link tiltcv.alg.tilt.LadmapLowRankSparse}, the linearized alternating direction solver
 * with an adaptive penalty.
 *
 * @author TiltCV Authors
 */
public class ConfigLadmap implements Configuration {
	/** Sparsity weight is lambda = c/sqrt(m), where m is the number of rows in the patch */
	public double c = 1.0;

	/** If positive then this sparsity weight is used and {@link #c} is ignored */
	public double lambda = 0.0;

	/** Initial penalty. If zero or less it's set to 1.25/||D||<sub>2</sub> on a cold start */
	public double mu = 0.0;

	/** Upper limit on the penalty */
	public double muMax = 1e10;

	/** Penalty growth factor. Must be more than one. */
	public double rho = 4.0;

	/** Tolerance on the relative primal residual */
	public double tol1 = 1e-7;

	/** Tolerance on the relative change between iterations */
	public double tol2 = 1e-2;

	/** Maximum number of iterations */
	public int maxIterations = 1000;

	/** How often, in iterations, verbose output is printed */
	public int displayPeriod = 100;

	/** Solution is degenerate if ||A||<sub>*</sub> is less than this fraction of ||D||<sub>*</sub> */
	public double degenerateRatio = 1e-3;

	@Override
	public void checkValidity() {
		if (c <= 0)
			throw new IllegalArgumentException("c must be positive");
		if (lambda < 0)
			throw new IllegalArgumentException("lambda can't be negative");
		if (mu < 0)
			throw new IllegalArgumentException("mu can't be negative");
		if (muMax <= 0)
			throw new IllegalArgumentException("muMax must be positive");
		if (rho <= 1.0)
			throw new IllegalArgumentException("rho must be more than one");
		if (tol1 <= 0 || tol2 <= 0)
			throw new IllegalArgumentException("Tolerances must be positive");
		if (maxIterations <= 0)
			throw new IllegalArgumentException("maxIterations must be positive");
		if (displayPeriod <= 0)
			throw new IllegalArgumentException("displayPeriod must be positive");
		if (degenerateRatio < 0 || degenerateRatio >= 1.0)
			throw new IllegalArgumentException("degenerateRatio must be in [0,1)");
	}

	public ConfigLadmap setTo( ConfigLadmap src ) {
		this.c = src.c;
		this.lambda = src.lambda;
		this.mu = src.mu;
		this.muMax = src.muMax;
		this.rho = src.rho;
		this.tol1 = src.tol1;
		this.tol2 = src.tol2;
		this.maxIterations = src.maxIterations;
		this.displayPeriod = src.displayPeriod;
		this.degenerateRatio = src.degenerateRatio;
		return this;
	}

	public ConfigLadmap copy() {
		return new ConfigLadmap().setTo(this);
	}
}
