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

import georegression.struct.point.Point2D_F64;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import tiltcv.struct.tilt.RectifyWindow;
import tiltcv.struct.tilt.TransformFamily;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Conversions between a {@link TransformFamily family's} parameter vector and its 3x3 transform matrix. The
 * matrix maps rectified coordinates into input image coordinates, see {@link RectifyWindow}.
 *
 * <p>A homography is parameterized by where the four corners of the rectified window land in the input image.
 * Corners are ordered top-left, top-right, bottom-right, bottom-left and the parameter vector is
 * (u1,v1,u2,v2,u3,v3,u4,v4).</p>
 *
 * @author TiltCV Authors
 */
public class TiltTransformOps {

	/**
	 * Converts a parameter vector into a transform matrix
	 *
	 * @param tau (Input) parameter vector
	 * @param window (Input) coordinate systems. Used by homographies
	 * @param family (Input) which family the parameters belong to
	 * @param H (Output) 3x3 transform matrix. If null a new matrix is declared
	 * @return the transform matrix
	 */
	public static DMatrixRMaj parametersToMatrix( DMatrixRMaj tau, RectifyWindow window,
												  TransformFamily family, @Nullable DMatrixRMaj H ) {
		checkParameters(tau, family);
		if (H == null)
			H = new DMatrixRMaj(3, 3);
		else
			H.reshape(3, 3);

		double[] p = tau.data;
		CommonOps_DDRM.setIdentity(H);
		switch (family) {
			case EUCLIDEAN:
			case EUCLIDEAN_NO_TRANSLATION: {
				double c = Math.cos(p[0]), s = Math.sin(p[0]);
				H.set(0, 0, c);
				H.set(0, 1, -s);
				H.set(1, 0, s);
				H.set(1, 1, c);
				if (family == TransformFamily.EUCLIDEAN) {
					H.set(0, 2, p[1]);
					H.set(1, 2, p[2]);
				}
			} break;

			case AFFINE:
				for (int i = 0; i < 6; i++) {
					H.data[i] = p[i];
				}
				break;

			case AFFINE_NO_TRANSLATION:
				H.set(0, 0, p[0]);
				H.set(0, 1, p[1]);
				H.set(1, 0, p[2]);
				H.set(1, 1, p[3]);
				break;

			case HOMOGRAPHY:
			case HOMOGRAPHY_NO_TRANSLATION: {
				double[] x = cornersX(window);
				double[] y = cornersY(window);
				if (!homographyFromCorners(x, y, p, H))
					throw new IllegalArgumentException("Corners are degenerate, can't compute homography");
			} break;

			default:
				throw new IllegalArgumentException("Unknown family " + family);
		}
		return H;
	}

	/**
	 * Converts a transform matrix into a parameter vector. The matrix is normalized so that H(2,2) = 1.
	 *
	 * @param H (Input) 3x3 transform matrix
	 * @param window (Input) coordinate systems. Used by homographies
	 * @param family (Input) family of the output parameters
	 * @param tau (Output) parameter vector. If null a new matrix is declared
	 * @return the parameter vector
	 */
	public static DMatrixRMaj matrixToParameters( DMatrixRMaj H, RectifyWindow window,
												  TransformFamily family, @Nullable DMatrixRMaj tau ) {
		if (H.numRows != 3 || H.numCols != 3)
			throw new IllegalArgumentException("Transform must be 3x3");
		if (tau == null)
			tau = new DMatrixRMaj(family.getParameterCount(), 1);
		else
			tau.reshape(family.getParameterCount(), 1);

		double w = H.get(2, 2);
		if (w == 0.0)
			throw new IllegalArgumentException("H(2,2) is zero, can't normalize transform");

		double[] p = tau.data;
		switch (family) {
			case EUCLIDEAN:
				p[0] = Math.atan2(H.get(1, 0), H.get(0, 0));
				p[1] = H.get(0, 2)/w;
				p[2] = H.get(1, 2)/w;
				break;

			case EUCLIDEAN_NO_TRANSLATION:
				p[0] = Math.atan2(H.get(1, 0), H.get(0, 0));
				break;

			case AFFINE:
				for (int i = 0; i < 6; i++) {
					p[i] = H.data[i]/w;
				}
				break;

			case AFFINE_NO_TRANSLATION:
				p[0] = H.get(0, 0)/w;
				p[1] = H.get(0, 1)/w;
				p[2] = H.get(1, 0)/w;
				p[3] = H.get(1, 1)/w;
				break;

			case HOMOGRAPHY:
			case HOMOGRAPHY_NO_TRANSLATION: {
				double[] x = cornersX(window);
				double[] y = cornersY(window);
				for (int i = 0; i < 4; i++) {
					double z = H.get(2, 0)*x[i] + H.get(2, 1)*y[i] + H.get(2, 2);
					p[i*2] = (H.get(0, 0)*x[i] + H.get(0, 1)*y[i] + H.get(0, 2))/z;
					p[i*2 + 1] = (H.get(1, 0)*x[i] + H.get(1, 1)*y[i] + H.get(1, 2))/z;
				}
			} break;

			default:
				throw new IllegalArgumentException("Unknown family " + family);
		}
		return tau;
	}

	/**
	 * Computes the homography, normalized so that H(2,2) = 1, which maps the four source points onto the four
	 * destination points.
	 *
	 * @param srcX (Input) x-coordinate of source points
	 * @param srcY (Input) y-coordinate of source points
	 * @param dst (Input) destination points interleaved as (u1,v1,...,u4,v4)
	 * @param H (Output) homography
	 * @return true if successful or false if the points are degenerate
	 */
	public static boolean homographyFromCorners( double[] srcX, double[] srcY, double[] dst, DMatrixRMaj H ) {
		double[] dstX = new double[4];
		double[] dstY = new double[4];
		for (int i = 0; i < 4; i++) {
			dstX[i] = dst[i*2];
			dstY[i] = dst[i*2 + 1];
		}
		if (hasCollinearTriple(srcX, srcY) || hasCollinearTriple(dstX, dstY))
			return false;

		DMatrixRMaj M = new DMatrixRMaj(8, 8);
		DMatrixRMaj b = new DMatrixRMaj(8, 1);
		DMatrixRMaj h = new DMatrixRMaj(8, 1);

		cornerSystem(srcX, srcY, dst, M);
		System.arraycopy(dst, 0, b.data, 0, 8);
		if (!CommonOps_DDRM.solve(M, b, h))
			return false;

		H.reshape(3, 3);
		System.arraycopy(h.data, 0, H.data, 0, 8);
		H.data[8] = 1.0;

		for (int i = 0; i < 9; i++) {
			if (!Double.isFinite(H.data[i]))
				return false;
		}
		return true;
	}

	/**
	 * Computes the homography which maps each source point onto its destination point
	 *
	 * @param src (Input) four source points
	 * @param dst (Input) four destination points
	 * @param H (Output) homography
	 * @return true if successful or false if the points are degenerate
	 */
	public static boolean homographyFromCorners( List<Point2D_F64> src, List<Point2D_F64> dst, DMatrixRMaj H ) {
		if (src.size() != 4 || dst.size() != 4)
			throw new IllegalArgumentException("Exactly four points are required");
		double[] x = new double[4];
		double[] y = new double[4];
		double[] uv = new double[8];
		for (int i = 0; i < 4; i++) {
			x[i] = src.get(i).x;
			y[i] = src.get(i).y;
			uv[i*2] = dst.get(i).x;
			uv[i*2 + 1] = dst.get(i).y;
		}
		return homographyFromCorners(x, y, uv, H);
	}

	/**
	 * Linear system M*h = dst for the eight unknown homography elements (h11,h12,h13,h21,h22,h23,h31,h32)
	 * with h33 = 1. Row 2*i is the u constraint of point i and row 2*i+1 the v constraint.
	 */
	public static void cornerSystem( double[] srcX, double[] srcY, double[] dst, DMatrixRMaj M ) {
		M.reshape(8, 8);
		M.zero();
		for (int i = 0; i < 4; i++) {
			double x = srcX[i], y = srcY[i];
			double u = dst[i*2], v = dst[i*2 + 1];

			int row = i*2;
			M.set(row, 0, x);
			M.set(row, 1, y);
			M.set(row, 2, 1);
			M.set(row, 6, -u*x);
			M.set(row, 7, -u*y);

			row++;
			M.set(row, 3, x);
			M.set(row, 4, y);
			M.set(row, 5, 1);
			M.set(row, 6, -v*x);
			M.set(row, 7, -v*y);
		}
	}

	/** x-coordinates of the rectified window's corners */
	public static double[] cornersX( RectifyWindow window ) {
		return new double[]{window.getX0(), window.getX1(), window.getX1(), window.getX0()};
	}

	/** y-coordinates of the rectified window's corners */
	public static double[] cornersY( RectifyWindow window ) {
		return new double[]{window.getY0(), window.getY0(), window.getY1(), window.getY1()};
	}

	/**
	 * Applies the transform to the window's corners and writes the input image pixel coordinates of each corner
	 *
	 * @param H (Input) transform from rectified to input coordinates
	 * @param window (Input) coordinate systems
	 * @param corners (Output) four points in input pixel coordinates
	 */
	public static void windowCornersInImage( DMatrixRMaj H, RectifyWindow window, List<Point2D_F64> corners ) {
		double[] x = cornersX(window);
		double[] y = cornersY(window);
		corners.clear();
		for (int i = 0; i < 4; i++) {
			var p = new Point2D_F64();
			transform(H, x[i], y[i], p);
			p.x += window.centerX;
			p.y += window.centerY;
			corners.add(p);
		}
	}

	/**
	 * Applies a projective transform to a point
	 */
	public static void transform( DMatrixRMaj H, double x, double y, Point2D_F64 output ) {
		double z = H.get(2, 0)*x + H.get(2, 1)*y + H.get(2, 2);
		output.x = (H.get(0, 0)*x + H.get(0, 1)*y + H.get(0, 2))/z;
		output.y = (H.get(1, 0)*x + H.get(1, 1)*y + H.get(1, 2))/z;
	}

	/**
	 * Four points define a homography only if no three of them lie on a line
	 */
	static boolean hasCollinearTriple( double[] x, double[] y ) {
		double scale = 0;
		for (int i = 0; i < 4; i++) {
			if (!Double.isFinite(x[i]) || !Double.isFinite(y[i]))
				return true;
			for (int j = i + 1; j < 4; j++) {
				scale = Math.max(scale, Math.abs(x[i] - x[j]) + Math.abs(y[i] - y[j]));
			}
		}
		if (scale == 0.0)
			return true;

		double tol = 1e-10*scale*scale;
		for (int skip = 0; skip < 4; skip++) {
			int a = skip == 0 ? 1 : 0;
			int b = skip <= 1 ? 2 : 1;
			int c = skip <= 2 ? 3 : 2;
			double cross = (x[b] - x[a])*(y[c] - y[a]) - (y[b] - y[a])*(x[c] - x[a]);
			if (Math.abs(cross) <= tol)
				return true;
		}
		return false;
	}

	private static void checkParameters( DMatrixRMaj tau, TransformFamily family ) {
		if (tau.getNumElements() != family.getParameterCount())
			throw new IllegalArgumentException("Expected " + family.getParameterCount() +
					" parameters for " + family + " not " + tau.getNumElements());
	}
}
