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

import lombok.Getter;
import org.ejml.data.DMatrixRMaj;
import tiltcv.alg.geo.tilt.ComputeTiltJacobian;
import tiltcv.alg.geo.tilt.TiltTransformOps;
import tiltcv.struct.tilt.RectifyWindow;
import tiltcv.struct.tilt.TransformFamily;

/**
 * Implementation of {@link TiltTransformModel} for one of the built in {@link TransformFamily families}.
 *
 * @author TiltCV Authors
 */
public class WrapTiltTransformFamily implements TiltTransformModel {
	@Getter final TransformFamily family;
	final ComputeTiltJacobian jacobian = new ComputeTiltJacobian();

	public WrapTiltTransformFamily( TransformFamily family ) {
		this.family = family;
	}

	@Override
	public int getParameterCount() {
		return family.getParameterCount();
	}

	@Override
	public void parametersToMatrix( DMatrixRMaj tau, RectifyWindow window, DMatrixRMaj H ) {
		TiltTransformOps.parametersToMatrix(tau, window, family, H);
	}

	@Override
	public void matrixToParameters( DMatrixRMaj H, RectifyWindow window, DMatrixRMaj tau ) {
		TiltTransformOps.matrixToParameters(H, window, family, tau);
	}

	@Override
	public void computeSensitivity( DMatrixRMaj du, DMatrixRMaj dv, RectifyWindow window, DMatrixRMaj tau,
									DMatrixRMaj J, DMatrixRMaj S ) {
		jacobian.process(du, dv, window, tau, family, J, S);
	}
}
