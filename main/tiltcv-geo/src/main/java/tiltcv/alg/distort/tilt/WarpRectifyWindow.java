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

package tiltcv.alg.distort.tilt;

import boofcv.alg.interpolate.InterpolatePixelS;
import boofcv.factory.interpolate.FactoryInterpolation;
import boofcv.struct.border.BorderType;
import boofcv.struct.image.GrayF32;
import org.ejml.data.DMatrixRMaj;
import tiltcv.struct.tilt.RectifyWindow;

/**
 * Resamples an image onto the rectified grid. Output pixel (row,col) has rectified coordinate
 * (x,y) = (col - focusCenterX, row - focusCenterY) and is sampled from the input image at
 * &pi;(H*[x,y,1]) + (centerX,centerY) using bilinear interpolation. Samples which fall outside the input
 * image are zero.
 *
 * @author TiltCV Authors
 */
public class WarpRectifyWindow {

	InterpolatePixelS<GrayF32> interpolate = FactoryInterpolation.bilinearPixelS(GrayF32.class, BorderType.ZERO);

	/**
	 * Warps the image into a matrix with the same shape as the window
	 *
	 * @param image (Input) image being sampled
	 * @param H (Input) transform from rectified to input coordinates
	 * @param window (Input) coordinate systems
	 * @param output (Output) height x width matrix. Reshaped.
	 */
	public void apply( GrayF32 image, DMatrixRMaj H, RectifyWindow window, DMatrixRMaj output ) {
		output.reshape(window.height, window.width);
		interpolate.setImage(image);

		double h11 = H.data[0], h12 = H.data[1], h13 = H.data[2];
		double h21 = H.data[3], h22 = H.data[4], h23 = H.data[5];
		double h31 = H.data[6], h32 = H.data[7], h33 = H.data[8];

		int index = 0;
		for (int row = 0; row < window.height; row++) {
			double y = window.outputY(row);
			for (int col = 0; col < window.width; col++) {
				double x = window.outputX(col);
				double w = h31*x + h32*y + h33;
				double u = (h11*x + h12*y + h13)/w + window.centerX;
				double v = (h21*x + h22*y + h23)/w + window.centerY;

				if (w == 0.0 || !Double.isFinite(u) || !Double.isFinite(v)) {
					output.data[index++] = 0.0;
				} else {
					output.data[index++] = interpolate.get((float)u, (float)v);
				}
			}
		}
	}

	/**
	 * Warps the image into an image with the same shape as the window
	 *
	 * @param image (Input) image being sampled
	 * @param H (Input) transform from rectified to input coordinates
	 * @param window (Input) coordinate systems
	 * @param output (Output) rectified image. Reshaped.
	 */
	public void apply( GrayF32 image, DMatrixRMaj H, RectifyWindow window, GrayF32 output ) {
		var work = new DMatrixRMaj(1, 1);
		apply(image, H, window, work);

		output.reshape(window.width, window.height);
		for (int row = 0; row < window.height; row++) {
			int indexOut = output.startIndex + row*output.stride;
			int indexIn = row*window.width;
			for (int col = 0; col < window.width; col++) {
				output.data[indexOut++] = (float)work.data[indexIn++];
			}
		}
	}
}
