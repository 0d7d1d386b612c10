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

package tiltcv.alg.geo.tilt;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.NormOps_DDRM;
import tiltcv.struct.tilt.RectifyWindow;
import tiltcv.struct.tilt.TransformFamily;

/**
 * <p>
 * Linearizes how the rectified patch changes with the transform's parameters. Given the image derivatives
 * sampled on the rectified grid, it computes the Jacobian J with one row for each pixel and one column for each
 * parameter. It also computes the constraint matrix S which restricts a parameter update dtau to S*dtau = 0.
 * </p>
 *
 * Constraints:
 * <ul>
 *     <li>Euclidean: none</li>
 *     <li>Affine: area (determinant) and the ratio of the two column lengths are preserved</li>
 *     <li>Homography: area and edge length ratio of the transformed window are preserved. Without translation
 *     the centroid of the corners is also fixed.</li>
 * </ul>
 * Each constraint row is scaled to have the same Frobenius norm as J so that it carries a weight comparable
 * to the image term in the normal equations.
 *
 * <p>Pixels are ordered row-major.</p>
 *
 * @author TiltCV Authors
 */
public class ComputeTiltJacobian {

	// Work space for homographies
	DMatrixRMaj H = new DMatrixRMaj(3, 3);
	DMatrixRMaj M = new DMatrixRMaj(8, 8);
	DMatrixRMaj Minv = new DMatrixRMaj(8, 8);
	DMatrixRMaj dHdP = new DMatrixRMaj(8, 8);
	DMatrixRMaj dIdH = new DMatrixRMaj(1, 8);

	/**
	 * Computes the Jacobian and constraints at the specified parameters.
	 *
	 * @param du (Input) x-derivative sampled on the rectified grid. height x width
	 * @param dv (Input) y-derivative sampled on the rectified grid. height x width
	 * @param window (Input) coordinate systems
	 * @param tau (Input) current parameters
	 * @param family (Input) transform family
	 * @param jacobian (Output) N x p Jacobian, N = number of pixels
	 * @param constraints (Output) k x p constraint matrix. k might be zero.
	 */
	public void process( DMatrixRMaj du, DMatrixRMaj dv, RectifyWindow window,
						 DMatrixRMaj tau, TransformFamily family,
						 DMatrixRMaj jacobian, DMatrixRMaj constraints ) {
		if (du.numRows != window.height || du.numCols != window.width)
			throw new IllegalArgumentException("du has an unexpected shape");
		if (dv.numRows != window.height || dv.numCols != window.width)
			throw new IllegalArgumentException("dv has an unexpected shape");
		if (tau.getNumElements() != family.getParameterCount())
			throw new IllegalArgumentException("Unexpected number of parameters");

		jacobian.reshape(window.getPixelCount(), family.getParameterCount());
		constraints.reshape(family.getConstraintCount(), family.getParameterCount());
		constraints.zero();

		switch (family) {
			case EUCLIDEAN:
			case EUCLIDEAN_NO_TRANSLATION:
				jacobianEuclidean(du, dv, window, tau.data[0], family == TransformFamily.EUCLIDEAN, jacobian);
				break;

			case AFFINE:
				jacobianAffine(du, dv, window, true, jacobian);
				constraintsAffine(tau.data[0], tau.data[1], tau.data[3], tau.data[4], new int[]{0, 1, 3, 4}, constraints);
				break;

			case AFFINE_NO_TRANSLATION:
				jacobianAffine(du, dv, window, false, jacobian);
				constraintsAffine(tau.data[0], tau.data[1], tau.data[2], tau.data[3], new int[]{0, 1, 2, 3}, constraints);
				break;

			case HOMOGRAPHY:
			case HOMOGRAPHY_NO_TRANSLATION:
				jacobianHomography(du, dv, window, tau, jacobian);
				constraintsHomography(tau.data, family.isNoTranslation(), constraints);
				break;

			default:
				throw new IllegalArgumentException("Unknown family " + family);
		}

		scaleConstraints(NormOps_DDRM.normF(jacobian), constraints);
	}

	void jacobianEuclidean( DMatrixRMaj du, DMatrixRMaj dv, RectifyWindow window,
							double theta, boolean translation, DMatrixRMaj jacobian ) {
		double c = Math.cos(theta), s = Math.sin(theta);
		int p = jacobian.numCols;

		for (int row = 0; row < window.height; row++) {
			double y = window.outputY(row);
			for (int col = 0; col < window.width; col++) {
				double x = window.outputX(col);
				int pixel = row*window.width + col;
				double Iu = du.data[pixel];
				double Iv = dv.data[pixel];

				int index = pixel*p;
				jacobian.data[index] = Iu*(-s*x - c*y) + Iv*(c*x - s*y);
				if (translation) {
					jacobian.data[index + 1] = Iu;
					jacobian.data[index + 2] = Iv;
				}
			}
		}
	}

	void jacobianAffine( DMatrixRMaj du, DMatrixRMaj dv, RectifyWindow window,
						 boolean translation, DMatrixRMaj jacobian ) {
		int p = jacobian.numCols;

		for (int row = 0; row < window.height; row++) {
			double y = window.outputY(row);
			for (int col = 0; col < window.width; col++) {
				double x = window.outputX(col);
				int pixel = row*window.width + col;
				double Iu = du.data[pixel];
				double Iv = dv.data[pixel];

				int index = pixel*p;
				if (translation) {
					jacobian.data[index++] = Iu*x;
					jacobian.data[index++] = Iu*y;
					jacobian.data[index++] = Iu;
					jacobian.data[index++] = Iv*x;
					jacobian.data[index++] = Iv*y;
					jacobian.data[index] = Iv;
				} else {
					jacobian.data[index++] = Iu*x;
					jacobian.data[index++] = Iu*y;
					jacobian.data[index++] = Iv*x;
					jacobian.data[index] = Iv*y;
				}
			}
		}
	}

	/**
	 * Chain rule through the homography. dI/dp = dI/dh * dh/dp where h are the 8 free elements of H. Column
	 * k of dh/dp is column k of M<sup>-1</sup> scaled by the projective denominator of the corner it belongs to,
	 * which follows from differentiating M(p)*h = p.
	 */
	void jacobianHomography( DMatrixRMaj du, DMatrixRMaj dv, RectifyWindow window,
							 DMatrixRMaj tau, DMatrixRMaj jacobian ) {
		double[] cx = TiltTransformOps.cornersX(window);
		double[] cy = TiltTransformOps.cornersY(window);

		TiltTransformOps.cornerSystem(cx, cy, tau.data, M);
		if (!CommonOps_DDRM.invert(M, Minv))
			throw new IllegalArgumentException("Corners are degenerate, can't linearize homography");
		TiltTransformOps.parametersToMatrix(tau, window, TransformFamily.HOMOGRAPHY, H);

		double h11 = H.data[0], h12 = H.data[1], h13 = H.data[2];
		double h21 = H.data[3], h22 = H.data[4], h23 = H.data[5];
		double h31 = H.data[6], h32 = H.data[7];

		for (int k = 0; k < 8; k++) {
			int corner = k/2;
			double w = h31*cx[corner] + h32*cy[corner] + 1.0;
			for (int i = 0; i < 8; i++) {
				dHdP.data[i*8 + k] = Minv.data[i*8 + k]*w;
			}
		}

		dIdH.reshape(window.getPixelCount(), 8);
		for (int row = 0; row < window.height; row++) {
			double y = window.outputY(row);
			for (int col = 0; col < window.width; col++) {
				double x = window.outputX(col);
				int pixel = row*window.width + col;
				double Iu = du.data[pixel];
				double Iv = dv.data[pixel];

				double w = h31*x + h32*y + 1.0;
				double u = (h11*x + h12*y + h13)/w;
				double v = (h21*x + h22*y + h23)/w;
				double proj = -(Iu*u + Iv*v)/w;

				int index = pixel*8;
				dIdH.data[index++] = Iu*x/w;
				dIdH.data[index++] = Iu*y/w;
				dIdH.data[index++] = Iu/w;
				dIdH.data[index++] = Iv*x/w;
				dIdH.data[index++] = Iv*y/w;
				dIdH.data[index++] = Iv/w;
				dIdH.data[index++] = proj*x;
				dIdH.data[index] = proj*y;
			}
		}

		CommonOps_DDRM.mult(dIdH, dHdP, jacobian);
	}

	/**
	 * Gradients of the determinant and of log(|col1|^2) - log(|col2|^2) with respect to the linear part
	 *
	 * @param indexes location of a11, a12, a21, a22 in the parameter vector
	 */
	static void constraintsAffine( double a, double b, double c, double d, int[] indexes, DMatrixRMaj S ) {
		S.set(0, indexes[0], d);
		S.set(0, indexes[1], -c);
		S.set(0, indexes[2], -b);
		S.set(0, indexes[3], a);

		double n1 = a*a + c*c;
		double n2 = b*b + d*d;
		if (n1 == 0.0 || n2 == 0.0)
			return;
		S.set(1, indexes[0], 2*a/n1);
		S.set(1, indexes[2], 2*c/n1);
		S.set(1, indexes[1], -2*b/n2);
		S.set(1, indexes[3], -2*d/n2);
	}

	static void constraintsHomography( double[] p, boolean noTranslation, DMatrixRMaj S ) {
		// area of the quadrilateral, shoelace formula
		for (int i = 0; i < 4; i++) {
			int next = (i + 1)%4;
			int prev = (i + 3)%4;
			S.set(0, i*2, 0.5*(p[next*2 + 1] - p[prev*2 + 1]));
			S.set(0, i*2 + 1, 0.5*(p[prev*2] - p[next*2]));
		}

		// ratio of the horizontal edges to the vertical edges
		double[] gradH = new double[8];
		double[] gradV = new double[8];
		double sumH = edge(p, 0, 1, gradH) + edge(p, 3, 2, gradH);
		double sumV = edge(p, 0, 3, gradV) + edge(p, 1, 2, gradV);
		if (sumH > 0.0 && sumV > 0.0) {
			for (int i = 0; i < 8; i++) {
				S.set(1, i, gradH[i]/sumH - gradV[i]/sumV);
			}
		}

		if (noTranslation) {
			for (int i = 0; i < 4; i++) {
				S.set(2, i*2, 1.0);
				S.set(3, i*2 + 1, 1.0);
			}
		}
	}

	/**
	 * Squared length of the edge from corner a to corner b. Its gradient is added to grad.
	 */
	private static double edge( double[] p, int a, int b, double[] grad ) {
		double dx = p[b*2] - p[a*2];
		double dy = p[b*2 + 1] - p[a*2 + 1];
		grad[a*2] -= 2*dx;
		grad[a*2 + 1] -= 2*dy;
		grad[b*2] += 2*dx;
		grad[b*2 + 1] += 2*dy;
		return dx*dx + dy*dy;
	}

	/**
	 * Normalizes each row then scales it by the specified magnitude
	 */
	static void scaleConstraints( double magnitude, DMatrixRMaj S ) {
		if (magnitude == 0.0 || !Double.isFinite(magnitude))
			magnitude = 1.0;
		for (int row = 0; row < S.numRows; row++) {
			double norm = 0;
			for (int col = 0; col < S.numCols; col++) {
				double v = S.get(row, col);
				norm += v*v;
			}
			norm = Math.sqrt(norm);
			if (norm == 0.0)
				continue;
			for (int col = 0; col < S.numCols; col++) {
				S.set(row, col, S.get(row, col)*magnitude/norm);
			}
		}
	}
}
