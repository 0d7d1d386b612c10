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
import org.ddogleg.struct.VerbosePrint;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.NormOps_DDRM;
import tiltcv.abst.geo.tilt.TiltTransformModel;
import tiltcv.alg.distort.tilt.WarpRectifyWindow;
import tiltcv.factory.tilt.ConfigTilt;
import tiltcv.struct.tilt.RectifyWindow;

import javax.annotation.Nullable;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Set;

/**
 * <p>
 * Transform Invariant Low-rank Textures (TILT). Finds the transform which makes a patch of the image as
 * low-rank as possible while allowing for sparse errors. The transform is refined by repeatedly
 * linearizing the warp around the current estimate, decomposing the linearized patch with
 * {@link LadmapLowRankSparse}, then applying the parameter update.
 * </p>
 *
 * <pre>
 * min ||A||<sub>*</sub> + &lambda;||E||<sub>1</sub>   subject to   D&#8728;&tau; = A + E
 * </pre>
 *
 * <p>
 * The patch is normalized to have a Frobenius norm of one before each linearization. Later outer iterations
 * can start the inner solver from the previous solution. In that case the multiplier is projected off the
 * range of the new Jacobian and the penalty is relaxed. Iterations stop when the objective changes by less
 * than the tolerance or the iteration limit is reached.
 * </p>
 *
 * <p>
 * Pixels found to be outliers by the previous decomposition, and their neighbors, are left out of the
 * Jacobian. Derivatives around a gross outlier describe the outlier and not the texture.
 * </p>
 *
 * <p>
 * Reference: Zhengdong Zhang, Xiao Liang, Arvind Ganesh, and Yi Ma, "TILT: Transform Invariant Low-rank
 * Textures" ACCV 2010
 * </p>
 *
 * @author TiltCV Authors
 */
public class TransformInvariantLowRankTexture implements VerbosePrint {
	@Getter final ConfigTilt config;
	@Getter final TiltTransformModel model;
	@Getter final LadmapLowRankSparse inner;

	/** Optional. Called after each outer iteration. */
	@Getter @Setter @Nullable TiltIterationListener listener;

	@Nullable PrintStream verbose;

	final WarpRectifyWindow warp = new WarpRectifyWindow();
	final LowRankSparseState state = new LowRankSparseState();

	// Derivatives of the input image
	final GrayF32 derivX = new GrayF32(1, 1);
	final GrayF32 derivY = new GrayF32(1, 1);

	// Work space
	final RectifyWindow window = new RectifyWindow();
	final DMatrixRMaj H = new DMatrixRMaj(3, 3);
	final DMatrixRMaj tau = new DMatrixRMaj(1, 1);
	final DMatrixRMaj rectified = new DMatrixRMaj(1, 1);
	final DMatrixRMaj D = new DMatrixRMaj(1, 1);
	final DMatrixRMaj du = new DMatrixRMaj(1, 1);
	final DMatrixRMaj dv = new DMatrixRMaj(1, 1);
	final DMatrixRMaj J = new DMatrixRMaj(1, 1);
	final DMatrixRMaj S = new DMatrixRMaj(1, 1);
	final DMatrixRMaj Ginv = new DMatrixRMaj(1, 1);
	final DMatrixRMaj JtY = new DMatrixRMaj(1, 1);
	final DMatrixRMaj GJtY = new DMatrixRMaj(1, 1);
	final DMatrixRMaj projected = new DMatrixRMaj(1, 1);

	// Frobenius norm of the most recent patch before it was normalized
	double scale;

	// true for pixels in the rectified patch whose derivatives are ignored
	boolean[] outlierMask = new boolean[0];
	boolean maskActive;

	public TransformInvariantLowRankTexture( ConfigTilt config, TiltTransformModel model ) {
		config.checkValidity();
		this.config = config;
		this.model = model;
		this.inner = new LadmapLowRankSparse(config.inner);
	}

	/**
	 * Rectifies the focus region
	 *
	 * @param image (Input) image which contains the texture
	 * @param centerX (Input) origin of input coordinates, x-axis
	 * @param centerY (Input) origin of input coordinates, y-axis
	 * @param focusWidth (Input) width of the rectified patch
	 * @param focusHeight (Input) height of the rectified patch
	 * @param initialH (Input) initial transform from rectified to input coordinates
	 * @return the results
	 */
	public TiltResult refine( GrayF32 image, int centerX, int centerY, int focusWidth, int focusHeight,
							  DMatrixRMaj initialH ) {
		var result = new TiltResult();
		refine(image, centerX, centerY, focusWidth, focusHeight, initialH, result);
		return result;
	}

	/**
	 * Same as {@link #refine(GrayF32, int, int, int, int, DMatrixRMaj)} but writes into the provided result
	 */
	public void refine( GrayF32 image, int centerX, int centerY, int focusWidth, int focusHeight,
						DMatrixRMaj initialH, TiltResult result ) {
		checkInputs(image, centerX, centerY, focusWidth, focusHeight, initialH);

		long time0 = System.nanoTime();
		window.setTo(centerX, centerY, focusWidth, focusHeight);
		int numParam = model.getParameterCount();
		TiltImageOps.derivatives(image, derivX, derivY);

		// parameterize first so that the initial warp matches what the model can express
		model.matrixToParameters(initialH, window, tau);
		model.parametersToMatrix(tau, window, H);
		state.reshape(focusHeight, focusWidth, numParam);
		maskActive = false;

		warp.apply(image, H, window, rectified);

		TiltStatus status;
		int outerIterations = 0;
		int innerIterations = 0;

		if (!linearize()) {
			status = TiltStatus.DEGENERATE;
		} else {
			double previousF = LadmapLowRankSparse.nuclearNorm(D);

			while (true) {
				outerIterations++;
				if (outerIterations == 1 || !config.warmStart) {
					state.coldStart(D, numParam, config.inner.mu);
				} else if (!warmStart()) {
					status = TiltStatus.DEGENERATE;
					break;
				}

				boolean success = inner.process(D, J, S, state);
				innerIterations += inner.getIterations();
				if (!success) {
					status = TiltStatus.DEGENERATE;
					break;
				}
				double f = state.objective;
				updateOutlierMask();

				if (verbose != null && outerIterations%config.outerDisplayPeriod == 0) {
					verbose.printf("outer %3d f=%.7f rank(A)=%d ||E||_1=%.5f inner=%d\n", outerIterations, f,
							inner.getRankA(), CommonOps_DDRM.elementSumAbs(state.E), inner.getIterations());
				}

				CommonOps_DDRM.addEquals(tau, state.deltaTau);
				if (!updateTransform()) {
					status = TiltStatus.DEGENERATE;
					break;
				}
				warp.apply(image, H, window, rectified);

				if (listener != null)
					listener.outerIteration(outerIterations, f, H, rectified);

				if (outerIterations >= config.outerMaxIterations) {
					status = TiltStatus.MAX_ITERATIONS;
					break;
				}
				if (Math.abs(f - previousF) < config.outerTolerance) {
					status = TiltStatus.CONVERGED;
					break;
				}
				previousF = f;

				if (!linearize()) {
					status = TiltStatus.DEGENERATE;
					break;
				}
			}
		}

		if (verbose != null) verbose.println("status=" + status + " outer=" + outerIterations + " inner=" + innerIterations);

		result.family = model.getFamily();
		result.window.setTo(window);
		result.transform.set(H);
		TiltImageOps.matrixToGray(rectified, result.rectified);
		result.status = status;
		result.errorSign = status == TiltStatus.DEGENERATE;
		result.outerIterations = outerIterations;
		result.innerIterations = innerIterations;
		result.scale = scale;
		if (result.errorSign) {
			result.lowRank.reshape(focusHeight, focusWidth);
			result.sparse.reshape(focusHeight, focusWidth);
			result.lowRank.zero();
			result.sparse.zero();
			result.objective = Double.NaN;
		} else {
			result.lowRank.set(state.A);
			result.sparse.set(state.E);
			result.objective = state.objective;
		}
		result.elapsedSeconds = (System.nanoTime() - time0)*1e-9;
	}

	/**
	 * Normalizes the current rectified patch, warps the derivatives, and computes the Jacobian and constraints
	 *
	 * @return false if the patch is degenerate
	 */
	boolean linearize() {
		D.set(rectified);
		warp.apply(derivX, H, window, du);
		warp.apply(derivY, H, window, dv);
		scale = TiltImageOps.normalize(D, du, dv);
		if (scale == 0.0 || !Double.isFinite(scale)) {
			if (verbose != null) verbose.println("Degenerate: patch has a norm of " + scale);
			return false;
		}
		if (maskActive) {
			for (int i = 0; i < outlierMask.length; i++) {
				if (outlierMask[i]) {
					du.data[i] = 0;
					dv.data[i] = 0;
				}
			}
		}
		model.computeSensitivity(du, dv, window, tau, J, S);
		return !MatrixFeatures_DDRM.hasUncountable(J) && !MatrixFeatures_DDRM.hasUncountable(S);
	}

	/**
	 * Marks pixels with a large sparse error along with their 8 neighbors
	 */
	void updateOutlierMask() {
		maskActive = false;
		if (config.outlierMaskThreshold <= 0)
			return;

		DMatrixRMaj E = state.E;
		int rows = E.numRows, cols = E.numCols;
		if (outlierMask.length != rows*cols)
			outlierMask = new boolean[rows*cols];
		Arrays.fill(outlierMask, false);

		// the patch has a Frobenius norm of one
		double threshold = config.outlierMaskThreshold/Math.sqrt(rows*cols);
		int total = 0;
		for (int row = 0; row < rows; row++) {
			for (int col = 0; col < cols; col++) {
				if (Math.abs(E.data[row*cols + col]) <= threshold)
					continue;
				total++;
				for (int y = Math.max(0, row - 1); y <= Math.min(rows - 1, row + 1); y++) {
					for (int x = Math.max(0, col - 1); x <= Math.min(cols - 1, col + 1); x++) {
						outlierMask[y*cols + x] = true;
					}
				}
			}
		}
		maskActive = total > 0;
		if (verbose != null && maskActive) verbose.println("  outliers " + total);
	}

	/**
	 * Starts from the previous decomposition. The multiplier is projected onto the orthogonal complement of the
	 * new Jacobian's range, Y = Y - J*inv(J'J + S'S)*J'Y, and the penalty is relaxed. The relaxed penalty is
	 * never smaller than the one a cold start would use.
	 *
	 * @return false if the normal equations are degenerate
	 */
	boolean warmStart() {
		if (!LadmapLowRankSparse.computeNormalInverse(J, S, Ginv))
			return false;

		DMatrixRMaj Y = DMatrixRMaj.wrap(J.numRows, 1, state.Y.data);
		CommonOps_DDRM.multTransA(J, Y, JtY);
		CommonOps_DDRM.mult(Ginv, JtY, GJtY);
		CommonOps_DDRM.mult(J, GJtY, projected);
		CommonOps_DDRM.subtractEquals(Y, projected);

		state.deltaTau.zero();
		double coldMu = config.inner.mu > 0 ? config.inner.mu : 1.25/NormOps_DDRM.normP2(D);
		state.mu = Math.max(state.mu/Math.pow(config.inner.rho, config.warmStartDecayExponent), coldMu);
		return true;
	}

	/**
	 * Converts the parameters into a transform. A homography whose corners have collapsed can't be converted.
	 */
	boolean updateTransform() {
		if (MatrixFeatures_DDRM.hasUncountable(tau))
			return false;
		try {
			model.parametersToMatrix(tau, window, H);
		} catch (IllegalArgumentException e) {
			if (verbose != null) verbose.println("Degenerate: " + e.getMessage());
			return false;
		}
		return true;
	}

	private static void checkInputs( @Nullable GrayF32 image, int centerX, int centerY, int focusWidth, int focusHeight,
									 @Nullable DMatrixRMaj initialH ) {
		if (image == null)
			throw new IllegalArgumentException("image can't be null");
		if (focusWidth <= 0 || focusHeight <= 0)
			throw new IllegalArgumentException("Focus region must have a positive size. " + focusWidth + "x" + focusHeight);
		if (!image.isInBounds(centerX, centerY))
			throw new IllegalArgumentException("Center must be inside the image. (" + centerX + "," + centerY + ")");
		if (initialH == null || initialH.numRows != 3 || initialH.numCols != 3)
			throw new IllegalArgumentException("Initial transform must be 3x3");
		if (MatrixFeatures_DDRM.hasUncountable(initialH))
			throw new IllegalArgumentException("Initial transform has elements which are not finite");
		if (initialH.get(2, 2) == 0.0)
			throw new IllegalArgumentException("Initial transform can't have H(2,2) = 0");
	}

	@Override
	public void setVerbose( @Nullable PrintStream out, @Nullable Set<String> configuration ) {
		this.verbose = out;
		inner.setVerbose(out, configuration);
	}
}
