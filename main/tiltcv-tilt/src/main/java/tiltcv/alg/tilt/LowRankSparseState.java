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

import org.ejml.data.DMatrixRMaj;

/**
 * Variables of the low-rank plus sparse decomposition. Used both as the initial state of the inner solver and
 * as its solution.
 *
 * @author TiltCV Authors
 */
public class LowRankSparseState {
	/** Low-rank component. Same shape as the patch. */
	public final DMatrixRMaj A = new DMatrixRMaj(1, 1);
	/** Sparse error. Same shape as the patch. */
	public final DMatrixRMaj E = new DMatrixRMaj(1, 1);
	/** Lagrange multiplier for D + J*dtau = A + E, stored in the patch's shape */
	public final DMatrixRMaj Y = new DMatrixRMaj(1, 1);
	/** Parameter update */
	public final DMatrixRMaj deltaTau = new DMatrixRMaj(1, 1);
	/** Penalty. If zero or less the solver selects it. */
	public double mu;
	/** Objective at the solution, sum of shrunk singular values plus lambda*||E||<sub>1</sub> */
	public double objective;

	/**
	 * Resizes all the matrices and zeros them
	 */
	public void reshape( int rows, int cols, int numParam ) {
		A.reshape(rows, cols);
		E.reshape(rows, cols);
		Y.reshape(rows, cols);
		deltaTau.reshape(numParam, 1);
		A.zero();
		E.zero();
		Y.zero();
		deltaTau.zero();
		mu = 0;
		objective = 0;
	}

	/**
	 * Starts from the trivial decomposition A = D, E = 0, Y = 0
	 *
	 * @param D patch
	 * @param numParam number of parameters
	 * @param mu initial penalty. zero or less for automatic.
	 */
	public void coldStart( DMatrixRMaj D, int numParam, double mu ) {
		reshape(D.numRows, D.numCols, numParam);
		A.set(D);
		this.mu = mu;
	}
}
