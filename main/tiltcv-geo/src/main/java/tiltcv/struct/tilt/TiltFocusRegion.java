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

package tiltcv.struct.tilt;

import georegression.struct.point.Point2D_F64;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import tiltcv.alg.geo.tilt.TiltTransformOps;

import java.util.List;

/**
 * Region of the input image which is rectified along with an initial guess of the transform. Can be created
 * from two points bounding the texture or from four points on the texture's corners.
 *
 * @author TiltCV Authors
 */
public class TiltFocusRegion {
	/** Origin of the input coordinate system, in pixels */
	public int centerX, centerY;
	/** Size of the rectified patch */
	public int width, height;
	/** Initial transform from rectified to input coordinates */
	public final DMatrixRMaj transform = CommonOps_DDRM.identity(3);

	public TiltFocusRegion( int centerX, int centerY, int width, int height ) {
		this.centerX = centerX;
		this.centerY = centerY;
		this.width = width;
		this.height = height;
	}

	public TiltFocusRegion() {}

	/**
	 * Axis aligned region between two opposite corners. The transform is the identity.
	 */
	public static TiltFocusRegion fromBoundingPoints( Point2D_F64 p0, Point2D_F64 p1 ) {
		var region = new TiltFocusRegion();
		region.centerX = (int)Math.floor((p0.x + p1.x)/2.0);
		region.centerY = (int)Math.floor((p0.y + p1.y)/2.0);
		region.width = (int)Math.floor(Math.abs(p1.x - p0.x)) + 1;
		region.height = (int)Math.floor(Math.abs(p1.y - p0.y)) + 1;
		return region;
	}

	/**
	 * Region around a quadrilateral. The center is the average of the corners and the size is twice their
	 * average distance from the center along each axis. The transform is the homography which maps the
	 * rectified window's corners onto the provided corners.
	 *
	 * @param corners top-left, top-right, bottom-right, bottom-left
	 */
	public static TiltFocusRegion fromCorners( List<Point2D_F64> corners ) {
		if (corners.size() != 4)
			throw new IllegalArgumentException("Four corners are required");

		double meanX = 0, meanY = 0;
		for (int i = 0; i < 4; i++) {
			meanX += corners.get(i).x/4.0;
			meanY += corners.get(i).y/4.0;
		}

		var region = new TiltFocusRegion();
		region.centerX = (int)Math.floor(meanX);
		region.centerY = (int)Math.floor(meanY);

		double spreadX = 0, spreadY = 0;
		for (int i = 0; i < 4; i++) {
			spreadX += Math.abs(corners.get(i).x - region.centerX)/4.0;
			spreadY += Math.abs(corners.get(i).y - region.centerY)/4.0;
		}
		region.width = (int)Math.floor(2.0*spreadX);
		region.height = (int)Math.floor(2.0*spreadY);
		if (region.width <= 0 || region.height <= 0)
			throw new IllegalArgumentException("Corners enclose an empty region");

		RectifyWindow window = region.toWindow();
		double[] x = TiltTransformOps.cornersX(window);
		double[] y = TiltTransformOps.cornersY(window);
		double[] dst = new double[8];
		for (int i = 0; i < 4; i++) {
			dst[i*2] = corners.get(i).x - region.centerX;
			dst[i*2 + 1] = corners.get(i).y - region.centerY;
		}
		if (!TiltTransformOps.homographyFromCorners(x, y, dst, region.transform))
			throw new IllegalArgumentException("Corners are degenerate");
		return region;
	}

	/** Coordinate systems of this region */
	public RectifyWindow toWindow() {
		return new RectifyWindow(centerX, centerY, width, height);
	}

	public boolean isValid() {
		return width > 0 && height > 0;
	}
}
