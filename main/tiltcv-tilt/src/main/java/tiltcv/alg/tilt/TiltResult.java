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
import lombok.Setter;
import org.ejml.data.DMatrixRMaj;
import tiltcv.struct.tilt.RectifyWindow;
import tiltcv.struct.tilt.TransformFamily;

/**
 * Output of a rectification
 *
 * @author TiltCV Authors
 */
@Getter @Setter
public class TiltResult {
	/** Input image sampled through the final transform. Not normalized. */
	GrayF32 rectified = new GrayF32(1, 1);
	/** Low-rank component of the normalized patch */
	DMatrixRMaj lowRank = new DMatrixRMaj(1, 1);
	/** Sparse error of the normalized patch */
	DMatrixRMaj sparse = new DMatrixRMaj(1, 1);
	/** Transform from rectified coordinates to input coordinates */
	DMatrixRMaj transform = new DMatrixRMaj(3, 3);
	/** Coordinate systems */
	RectifyWindow window = new RectifyWindow();
	/** Family of the transform */
	TransformFamily family = TransformFamily.AFFINE;
	/** Final value of the objective */
	double objective = Double.NaN;
	/** Frobenius norm which the last linearized patch was divided by */
	double scale = 1.0;
	/** true if the solution is degenerate */
	boolean errorSign;
	TiltStatus status = TiltStatus.MAX_ITERATIONS;
	int outerIterations;
	/** Sum of inner iterations across all outer iterations */
	int innerIterations;
	/** Processing time in seconds */
	double elapsedSeconds;

	/**
	 * Low-rank component at the intensity of the input image
	 */
	public DMatrixRMaj scaledLowRank( DMatrixRMaj output ) {
		output.reshape(lowRank.numRows, lowRank.numCols);
		for (int i = 0; i < lowRank.getNumElements(); i++) {
			output.data[i] = lowRank.data[i]*scale;
		}
		return output;
	}

	public void setTo( TiltResult src ) {
		rectified.setTo(src.rectified);
		lowRank.set(src.lowRank);
		sparse.set(src.sparse);
		transform.set(src.transform);
		window.setTo(src.window);
		family = src.family;
		objective = src.objective;
		scale = src.scale;
		errorSign = src.errorSign;
		status = src.status;
		outerIterations = src.outerIterations;
		innerIterations = src.innerIterations;
		elapsedSeconds = src.elapsedSeconds;
	}
}
