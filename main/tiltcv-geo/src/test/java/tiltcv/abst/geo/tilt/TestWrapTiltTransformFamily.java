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
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.junit.jupiter.api.Test;
import tiltcv.factory.geo.FactoryTiltModel;
import tiltcv.struct.tilt.RectifyWindow;
import tiltcv.struct.tilt.TransformFamily;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author TiltCV Authors
 */
class TestWrapTiltTransformFamily {
	@Test
	void describesFamily() {
		for (TransformFamily family : TransformFamily.values()) {
			TiltTransformModel model = FactoryTiltModel.family(family);
			assertEquals(family, model.getFamily());
			assertEquals(family.getParameterCount(), model.getParameterCount());
		}
	}

	@Test
	void conversions() {
		var window = new RectifyWindow(10, 10, 9, 7);
		TiltTransformModel model = FactoryTiltModel.family(TransformFamily.AFFINE);
		var H = new DMatrixRMaj(3, 3, true, 1.1, 0.1, 2, -0.1, 0.9, -1, 0, 0, 1);
		var tau = new DMatrixRMaj(1, 1);
		var found = new DMatrixRMaj(1, 1);
		model.matrixToParameters(H, window, tau);
		assertEquals(6, tau.getNumElements());
		model.parametersToMatrix(tau, window, found);
		assertTrue(MatrixFeatures_DDRM.isIdentical(H, found, 1e-12));
	}

	@Test
	void computeSensitivity() {
		var window = new RectifyWindow(0, 0, 5, 4);
		TiltTransformModel model = FactoryTiltModel.family(TransformFamily.AFFINE_NO_TRANSLATION);
		var du = new DMatrixRMaj(4, 5);
		var dv = new DMatrixRMaj(4, 5);
		CommonOps_DDRM.fill(du, 1.0);
		var tau = new DMatrixRMaj(4, 1, true, 1, 0, 0, 1);
		var J = new DMatrixRMaj(1, 1);
		var S = new DMatrixRMaj(1, 1);
		model.computeSensitivity(du, dv, window, tau, J, S);

		assertEquals(20, J.numRows);
		assertEquals(4, J.numCols);
		assertEquals(2, S.numRows);
		// first column is Iu*x
		assertEquals(window.outputX(3), J.get(3, 0), 1e-12);
		assertEquals(0.0, J.get(3, 2), 1e-12);
	}

	@Test
	void nullFamily() {
		assertThrows(IllegalArgumentException.class, () -> FactoryTiltModel.family(null));
	}
}
