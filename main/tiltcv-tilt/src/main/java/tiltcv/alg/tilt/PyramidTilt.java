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

package tiltcv.alg.tilt;

import boofcv.struct.image.GrayF32;
import lombok.Getter;
import org.ddogleg.struct.VerbosePrint;
import org.ejml.data.DMatrixRMaj;
import tiltcv.alg.distort.tilt.WarpRectifyWindow;
import tiltcv.factory.tilt.ConfigTilt;
import tiltcv.factory.tilt.ConfigTiltPyramid;
import tiltcv.struct.tilt.TiltFocusRegion;

import javax.annotation.Nullable;
import java.io.PrintStream;
import java.util.Set;

/**
 * <p>
 * Rectifies a focus region coarse to fine. Large regions are first rectified in a down sampled and blurred
 * image, where the basin of convergence is wider and each iteration is cheaper. The found transform then
 * initializes the next finer level. The outer tolerance is loosened after each level since the finer levels
 * only need to polish the solution.
 * </p>
 *
 * <p>
 * Level s is down sampled by 2<sup>s</sup> and the transform is scaled with P*H*P<sup>-1</sup> where
 * P = diag(2<sup>-s</sup>,2<sup>-s</sup>,1). The number of levels is the smallest which brings the focus region
 * close to {@link ConfigTiltPyramid#focusThreshold} pixels, but no more than
 * {@link ConfigTiltPyramid#pyramidMaxLevel} levels are processed, starting with the coarsest.
 * </p>
 *
 * @author TiltCV Authors
 */
public class PyramidTilt implements VerbosePrint {
	@Getter final ConfigTiltPyramid config;
	@Getter final TransformInvariantLowRankTexture tilt;

	// Configuration of tilt. Its tolerance is adjusted at each level
	final ConfigTilt levelConfig;

	@Nullable PrintStream verbose;

	final WarpRectifyWindow warp = new WarpRectifyWindow();
	final GrayF32 blurred = new GrayF32(1, 1);
	final GrayF32 levelImage = new GrayF32(1, 1);
	final TiltResult levelResult = new TiltResult();
	final DMatrixRMaj H = new DMatrixRMaj(3, 3);
	final DMatrixRMaj levelH = new DMatrixRMaj(3, 3);

	/**
	 * @param config Configuration. {@link ConfigTiltPyramid#tilt} is ignored, each level is configured by
	 * the tilt algorithm's own configuration. Its outer tolerance is adjusted while processing and restored
	 * afterwards.
	 * @param tilt Algorithm used to rectify each level
	 */
	public PyramidTilt( ConfigTiltPyramid config, TransformInvariantLowRankTexture tilt ) {
		config.checkValidity();
		this.config = config;
		this.tilt = tilt;
		this.levelConfig = tilt.getConfig();
	}

	/**
	 * Rectifies the focus region
	 *
	 * @param image (Input) image containing the texture
	 * @param region (Input) focus region and initial transform
	 * @return results at the input image's resolution
	 */
	public TiltResult process( GrayF32 image, TiltFocusRegion region ) {
		var result = new TiltResult();
		process(image, region, result);
		return result;
	}

	public void process( GrayF32 image, TiltFocusRegion region, TiltResult result ) {
		if (!region.isValid())
			throw new IllegalArgumentException("Focus region must have a positive size");

		double originalTolerance = levelConfig.outerTolerance;
		try {
			if (config.pyramid) {
				processPyramid(image, region, result);
			} else {
				processSingle(image, region, result);
			}
		} finally {
			levelConfig.outerTolerance = originalTolerance;
		}
	}

	void processSingle( GrayF32 image, TiltFocusRegion region, TiltResult result ) {
		GrayF32 input = image;
		if (config.blur) {
			double factor = Math.max(image.width, image.height)/50.0;
			TiltImageOps.blur(image, Math.ceil(config.blurSizeK*factor), Math.ceil(config.blurSigmaK*factor), blurred);
			input = blurred;
		}
		tilt.refine(input, region.centerX, region.centerY, region.width, region.height, region.transform, result);
		warp.apply(image, result.transform, result.window, result.rectified);
	}

	void processPyramid( GrayF32 image, TiltFocusRegion region, TiltResult result ) {
		int total = numberOfLevels(region.width, region.height, config.focusThreshold);
		H.set(region.transform);

		double elapsed = 0;
		int outerIterations = 0;
		int innerIterations = 0;
		boolean processed = false;

		for (int level = total; level >= 0; level--) {
			if (total - level >= config.pyramidMaxLevel)
				break;

			int factor = 1 << level;
			int levelWidth = region.width/factor;
			int levelHeight = region.height/factor;
			if (levelWidth <= 0 || levelHeight <= 0)
				continue;

			GrayF32 input = image;
			if (config.blur && level != 0) {
				TiltImageOps.blur(image, Math.ceil(config.blurSizeK*factor), Math.ceil(config.blurSigmaK*factor), blurred);
				input = blurred;
			}
			TiltImageOps.downsample(input, level, levelImage);
			scaleTransform(H, 1.0/factor, levelH);

			int levelCenterX = Math.min(region.centerX/factor, levelImage.width - 1);
			int levelCenterY = Math.min(region.centerY/factor, levelImage.height - 1);

			if (verbose != null)
				verbose.printf("level %d scale 1/%d focus %dx%d tol=%.2e\n", level, factor, levelWidth, levelHeight,
						levelConfig.outerTolerance);

			tilt.refine(levelImage, levelCenterX, levelCenterY, levelWidth, levelHeight, levelH, levelResult);
			processed = true;
			elapsed += levelResult.elapsedSeconds;
			outerIterations += levelResult.outerIterations;
			innerIterations += levelResult.innerIterations;

			if (levelResult.status == TiltStatus.DEGENERATE) {
				if (verbose != null) verbose.println("degenerate at level " + level);
				break;
			}

			scaleTransform(levelResult.transform, factor, H);
			levelConfig.outerTolerance *= config.outerToleranceStep;
		}

		if (!processed)
			throw new IllegalArgumentException("Focus region is too small for any pyramid level");

		result.setTo(levelResult);
		result.transform.set(H);
		result.window.setTo(region.centerX, region.centerY, region.width, region.height);
		result.elapsedSeconds = elapsed;
		result.outerIterations = outerIterations;
		result.innerIterations = innerIterations;
		warp.apply(image, H, result.window, result.rectified);
	}

	/**
	 * Number of times the focus region is halved, ceil(max(log2(min(width,height)/threshold),0))
	 */
	public static int numberOfLevels( int width, int height, int threshold ) {
		double ratio = Math.min(width, height)/(double)threshold;
		return (int)Math.ceil(Math.max(Math.log(ratio)/Math.log(2), 0));
	}

	/**
	 * Changes the pixel scale of a transform which maps rectified to input coordinates. Computes
	 * P*H*P<sup>-1</sup> with P = diag(scale, scale, 1).
	 */
	public static void scaleTransform( DMatrixRMaj H, double scale, DMatrixRMaj output ) {
		output.set(H);
		output.set(0, 2, H.get(0, 2)*scale);
		output.set(1, 2, H.get(1, 2)*scale);
		output.set(2, 0, H.get(2, 0)/scale);
		output.set(2, 1, H.get(2, 1)/scale);
	}

	@Override
	public void setVerbose( @Nullable PrintStream out, @Nullable Set<String> configuration ) {
		this.verbose = out;
		tilt.setVerbose(out, configuration);
	}
}
