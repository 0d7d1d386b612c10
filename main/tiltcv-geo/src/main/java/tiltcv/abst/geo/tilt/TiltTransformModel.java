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

package tiltcv.abst.geo.tilt;

import org.ejml.data.DMatrixRMaj;
import tiltcv.struct.tilt.RectifyWindow;
import tiltcv.struct.tilt.TransformFamily;

/**
 * Geometric model used when rectifying a low-rank texture. Converts between the parameter vector and the
 * 3x3 transform matrix, and linearizes the rectified patch with respect to the parameters.
 *
 * @author TiltCV Authors
 */
public interface TiltTransformModel {

	/** The family of transforms which this model describes */
	TransformFamily getFamily();

	/** Number of elements in the parameter vector */
	int getParameterCount();

	/**
	 * Converts parameters into a transform from rectified to input coordinates
	 *
	 * @param tau (Input) parameters
	 * @param window (Input) coordinate systems
	 * @param H (Output) 3x3 transform
	 */
	void parametersToMatrix( DMatrixRMaj tau, RectifyWindow window, DMatrixRMaj H );

	/**
	 * Converts a transform into parameters
	 *
	 * @param H (Input) 3x3 transform
	 * @param window (Input) coordinate systems
	 * @param tau (Output) parameters
	 */
	void matrixToParameters( DMatrixRMaj H, RectifyWindow window, DMatrixRMaj tau );

	/**
	 * Computes the Jacobian of the rectified patch and the constraints on a parameter update
	 *
	 * @param du (Input) warped x-derivative. height x width
	 * @param dv (Input) warped y-derivative. height x width
	 * @param window (Input) coordinate systems
	 * @param tau (Input) current parameters
	 * @param jacobian (Output) N x p Jacobian
	 * @param constraints (Output) k x p constraints
	 */
	void computeSensitivity( DMatrixRMaj du, DMatrixRMaj dv, RectifyWindow window, DMatrixRMaj tau,
							 DMatrixRMaj jacobian, DMatrixRMaj constraints );
}
