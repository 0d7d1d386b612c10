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
import georegression.struct.point.Point2D_F64;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import tiltcv.alg.geo.tilt.TiltTransformOps;

import java.util.Random;

/**
 * Renders synthetic textures seen through a known transform
 *
 * @author TiltCV Authors
 */
class SyntheticTexture {
	/** Texture's value at rectified coordinate (x,y) */
	interface Texture {
		double value( double x, double y );
	}

	/** Rank one texture. Product of a function of x and a function of y */
	static Texture separable( double period ) {
		return ( x, y ) -> (1.5 + Math.cos(2*Math.PI*x/period))*(1.5 + Math.cos(2*Math.PI*y/period));
	}

	/** Rank two texture, a constant plus a checkerboard like product */
	static Texture checker( double period ) {
		return ( x, y ) -> 1.0 + 0.5*Math.cos(2*Math.PI*(x - 0.5)/period)*Math.cos(2*Math.PI*(y - 0.5)/period);
	}

	/**
	 * Renders an image where the texture's rectified coordinate x is seen at pixel H*x + center
	 */
	static GrayF32 render( int width, int height, int centerX, int centerY, DMatrixRMaj H, Texture texture ) {
		var Hinv = new DMatrixRMaj(3, 3);
		if (!CommonOps_DDRM.invert(H, Hinv))
			throw new IllegalArgumentException("Can't invert");

		var image = new GrayF32(width, height);
		var p = new Point2D_F64();
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				TiltTransformOps.transform(Hinv, x - centerX, y - centerY, p);
				image.set(x, y, (float)texture.value(p.x, p.y));
			}
		}
		return image;
	}

	/**
	 * Adds a value to a random fraction of the pixels
	 *
	 * @return which pixels were modified, indexed by y*width + x
	 */
	static boolean[] addOutliers( GrayF32 image, double fraction, float magnitude, Random rand ) {
		boolean[] outliers = new boolean[image.width*image.height];
		for (int y = 0; y < image.height; y++) {
			for (int x = 0; x < image.width; x++) {
				if (rand.nextDouble() < fraction) {
					outliers[y*image.width + x] = true;
					image.set(x, y, image.get(x, y) + magnitude);
				}
			}
		}
		return outliers;
	}

	static DMatrixRMaj rotation( double theta ) {
		var R = CommonOps_DDRM.identity(3);
		R.set(0, 0, Math.cos(theta));
		R.set(0, 1, -Math.sin(theta));
		R.set(1, 0, Math.sin(theta));
		R.set(1, 1, Math.cos(theta));
		return R;
	}
}
