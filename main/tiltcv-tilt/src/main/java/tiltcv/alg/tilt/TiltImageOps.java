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

import boofcv.alg.filter.blur.BlurImageOps;
import boofcv.alg.filter.derivative.GradientSobel;
import boofcv.alg.interpolate.InterpolatePixelS;
import boofcv.alg.misc.ImageMiscOps;
import boofcv.alg.misc.PixelMath;
import boofcv.factory.interpolate.FactoryInterpolation;
import boofcv.struct.border.BorderType;
import boofcv.struct.image.GrayF32;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.NormOps_DDRM;

/**
 * Image operations used while rectifying low-rank textures
 *
 * @author TiltCV Authors
 */
public class TiltImageOps {

	/**
	 * Image derivatives computed with a 3x3 Sobel kernel. BoofCV's kernel has weights of 1/4 and 1/2, which
	 * gives twice the slope, so the output is halved to be in units of intensity per pixel. The outer most
	 * ring of pixels is set to zero.
	 */
	public static void derivatives( GrayF32 image, GrayF32 derivX, GrayF32 derivY ) {
		derivX.reshape(image.width, image.height);
		derivY.reshape(image.width, image.height);
		ImageMiscOps.fill(derivX, 0);
		ImageMiscOps.fill(derivY, 0);
		GradientSobel.process(image, derivX, derivY, null);
		PixelMath.divide(derivX, 2.0f, derivX);
		PixelMath.divide(derivY, 2.0f, derivY);
	}

	/**
	 * Divides the patch by its Frobenius norm s and adjusts the warped derivatives so that they are the
	 * derivatives of the normalized patch, i.e. du = du/s - (&lang;D,du&rang;/s<sup>3</sup>)*D.
	 *
	 * @return the Frobenius norm of the input patch. If zero or not finite then nothing is modified.
	 */
	public static double normalize( DMatrixRMaj D, DMatrixRMaj du, DMatrixRMaj dv ) {
		double s = NormOps_DDRM.normF(D);
		if (s == 0.0 || !Double.isFinite(s))
			return s;

		int N = D.getNumElements();
		double dotU = 0, dotV = 0;
		for (int i = 0; i < N; i++) {
			dotU += D.data[i]*du.data[i];
			dotV += D.data[i]*dv.data[i];
		}
		double s3 = s*s*s;
		for (int i = 0; i < N; i++) {
			du.data[i] = du.data[i]/s - dotU*D.data[i]/s3;
			dv.data[i] = dv.data[i]/s - dotV*D.data[i]/s3;
			D.data[i] /= s;
		}
		return s;
	}

	/**
	 * Gaussian blur, where size is the total width of the kernel
	 */
	public static void blur( GrayF32 input, double size, double sigma, GrayF32 output ) {
		int radius = Math.max(1, (int)Math.ceil(size)/2);
		output.reshape(input.width, input.height);
		BlurImageOps.gaussian(input, output, Math.ceil(sigma), radius, null);
	}

	/**
	 * Down samples the image by 2<sup>level</sup>. Output pixel (x,y) is sampled at (x,y)*2<sup>level</sup>
	 * using bilinear interpolation.
	 */
	public static void downsample( GrayF32 input, int level, GrayF32 output ) {
		if (level == 0) {
			output.setTo(input);
			return;
		}
		int factor = 1 << level;
		output.reshape(Math.max(1, input.width/factor), Math.max(1, input.height/factor));

		InterpolatePixelS<GrayF32> interpolate = FactoryInterpolation.bilinearPixelS(GrayF32.class, BorderType.EXTENDED);
		interpolate.setImage(input);
		for (int y = 0; y < output.height; y++) {
			for (int x = 0; x < output.width; x++) {
				output.unsafe_set(x, y, interpolate.get(x*factor, y*factor));
			}
		}
	}

	public static void matrixToGray( DMatrixRMaj input, GrayF32 output ) {
		output.reshape(input.numCols, input.numRows);
		int index = 0;
		for (int y = 0; y < output.height; y++) {
			int indexOut = output.startIndex + y*output.stride;
			for (int x = 0; x < output.width; x++) {
				output.data[indexOut++] = (float)input.data[index++];
			}
		}
	}
}
