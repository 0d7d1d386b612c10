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
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.NormOps_DDRM;
import org.junit.jupiter.api.Test;
import tiltcv.factory.tilt.ConfigLadmap;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author TiltCV Authors
 */
class TestLadmapLowRankSparse {
	Random rand = new Random(234);

	/**
	 * A rank one matrix can't be made any more low rank, the solution should be the trivial decomposition
	 */
	@Test
	void rankOne_noJacobian() {
		DMatrixRMaj D = rankOne(20, 15);
		var J = new DMatrixRMaj(300, 2);
		var S = new DMatrixRMaj(0, 2);

		var state = new LowRankSparseState();
		state.coldStart(D, 2, 0);

		var alg = new LadmapLowRankSparse(new ConfigLadmap());
		assertTrue(alg.process(D, J, S, state));
		assertTrue(alg.isConverged());

		assertEquals(0.0, NormOps_DDRM.normF(diff(D, state.A)), 1e-2);
		assertEquals(0.0, NormOps_DDRM.normF(state.E), 1e-2);
		assertEquals(LadmapLowRankSparse.nuclearNorm(D), state.objective, 1e-2);
		assertEquals(0.0, NormOps_DDRM.normF(state.deltaTau), 1e-12);
	}

	/**
	 * Robust PCA. Low-rank matrix corrupted by sparse spikes
	 */
	@Test
	void recoverSparseSpikes() {
		int m = 40, n = 40;
		DMatrixRMaj L = rankOne(m, n);
		CommonOps_DDRM.scale(1.0/NormOps_DDRM.normF(L), L);
		double spike = 4.0*CommonOps_DDRM.elementSumAbs(L)/(m*n);

		var D = L.copy();
		boolean[] corrupted = new boolean[m*n];
		for (int i = 0; i < m*n; i++) {
			if (rand.nextDouble() < 0.05) {
				corrupted[i] = true;
				D.data[i] += rand.nextBoolean() ? spike : -spike;
			}
		}
		double scale = NormOps_DDRM.normF(D);
		CommonOps_DDRM.scale(1.0/scale, D);
		CommonOps_DDRM.scale(1.0/scale, L);

		var J = new DMatrixRMaj(m*n, 1);
		var S = new DMatrixRMaj(0, 1);
		var state = new LowRankSparseState();
		state.coldStart(D, 1, 0);

		var alg = new LadmapLowRankSparse(new ConfigLadmap());
		assertTrue(alg.process(D, J, S, state));

		double error = NormOps_DDRM.normF(diff(state.A, L))/NormOps_DDRM.normF(L);
		assertTrue(error < 0.05, "relative error " + error);

		double spikeNorm = spike/scale;
		for (int i = 0; i < m*n; i++) {
			double expected = D.data[i] - L.data[i];
			if (corrupted[i])
				assertEquals(expected, state.E.data[i], 0.25*spikeNorm);
			else
				assertEquals(0.0, state.E.data[i], 0.1*spikeNorm);
		}
	}

	@Test
	void zeroPatch_degenerate() {
		var D = new DMatrixRMaj(10, 12);
		var J = new DMatrixRMaj(120, 3);
		var S = new DMatrixRMaj(0, 3);
		var state = new LowRankSparseState();
		state.coldStart(D, 3, 0);

		var alg = new LadmapLowRankSparse(new ConfigLadmap());
		assertFalse(alg.process(D, J, S, state));
	}

	/**
	 * Identical columns make the normal equations singular. The pseudo inverse should split the update evenly.
	 */
	@Test
	void singularNormalEquations() {
		DMatrixRMaj D = rankOne(12, 10);
		var J = new DMatrixRMaj(120, 2);
		for (int i = 0; i < 120; i++) {
			double v = rand.nextGaussian()*0.01;
			J.set(i, 0, v);
			J.set(i, 1, v);
		}
		var S = new DMatrixRMaj(0, 2);
		var state = new LowRankSparseState();
		state.coldStart(D, 2, 0);

		var alg = new LadmapLowRankSparse(new ConfigLadmap());
		assertTrue(alg.process(D, J, S, state));
		assertFalse(MatrixFeatures_DDRM.hasUncountable(state.A));
		assertFalse(MatrixFeatures_DDRM.hasUncountable(state.E));
		assertFalse(MatrixFeatures_DDRM.hasUncountable(state.deltaTau));
		assertEquals(state.deltaTau.get(0), state.deltaTau.get(1), 1e-8);
	}

	/**
	 * A heavily weighted constraint should prevent the parameter from changing
	 */
	@Test
	void constraintsRestrictUpdate() {
		DMatrixRMaj D = rankOne(12, 10);
		var J = new DMatrixRMaj(120, 1);
		for (int i = 0; i < 120; i++) {
			J.set(i, 0, rand.nextGaussian()*0.1);
		}
		var S = new DMatrixRMaj(1, 1, true, 1e6);
		var state = new LowRankSparseState();
		state.coldStart(D, 1, 0);

		var alg = new LadmapLowRankSparse(new ConfigLadmap());
		assertTrue(alg.process(D, J, S, state));
		assertEquals(0.0, state.deltaTau.get(0), 1e-6);
	}

	/**
	 * Corrupted input with a tight tolerance can't be solved in a few iterations
	 */
	@Test
	void iterationLimit() {
		DMatrixRMaj D = rankOne(20, 20);
		for (int i = 0; i < D.getNumElements(); i += 13) {
			D.data[i] += (i%2 == 0) ? 0.2 : -0.2;
		}
		CommonOps_DDRM.scale(1.0/NormOps_DDRM.normF(D), D);

		var config = new ConfigLadmap();
		config.maxIterations = 3;
		config.tol1 = 1e-14;
		var state = new LowRankSparseState();
		state.coldStart(D, 1, 0);

		var alg = new LadmapLowRankSparse(config);
		assertTrue(alg.process(D, new DMatrixRMaj(400, 1), new DMatrixRMaj(0, 1), state));
		assertEquals(3, alg.getIterations());
		assertFalse(alg.isConverged());
		assertTrue(alg.getPrimalResidual() > config.tol1);
	}

	/**
	 * When the sparse term is nearly free the error absorbs the whole patch and nothing is left for the
	 * low-rank component
	 */
	@Test
	void sparseAbsorbsPatch_degenerate() {
		DMatrixRMaj D = rankOne(12, 10);
		var config = new ConfigLadmap();
		config.c = 1e-6;
		var state = new LowRankSparseState();
		state.coldStart(D, 1, 0);

		var alg = new LadmapLowRankSparse(config);
		assertFalse(alg.process(D, new DMatrixRMaj(120, 1), new DMatrixRMaj(0, 1), state));
		assertEquals(0.0, NormOps_DDRM.normF(diff(D, state.E)), 1e-3);

		// the same input passes when the check is turned off
		config.degenerateRatio = 0.0;
		state.coldStart(D, 1, 0);
		assertTrue(new LadmapLowRankSparse(config).process(D, new DMatrixRMaj(120, 1), new DMatrixRMaj(0, 1), state));
	}

	@Test
	void automaticPenalty() {
		DMatrixRMaj D = rankOne(12, 10);
		var state = new LowRankSparseState();
		state.coldStart(D, 1, 0);

		var config = new ConfigLadmap();
		config.maxIterations = 1;
		var alg = new LadmapLowRankSparse(config);
		alg.process(D, new DMatrixRMaj(120, 1), new DMatrixRMaj(0, 1), state);

		// one iteration can at most multiply the penalty by rho
		double expected = 1.25/NormOps_DDRM.normP2(D);
		assertTrue(state.mu == expected || state.mu == expected*config.rho);
		assertEquals(1.0/Math.sqrt(12), alg.getLambda(), 1e-12);
	}

	@Test
	void badShapes() {
		DMatrixRMaj D = rankOne(12, 10);
		var state = new LowRankSparseState();
		state.coldStart(D, 1, 0);
		var alg = new LadmapLowRankSparse(new ConfigLadmap());

		assertThrows(IllegalArgumentException.class, () ->
				alg.process(D, new DMatrixRMaj(100, 1), new DMatrixRMaj(0, 1), state));
		assertThrows(IllegalArgumentException.class, () ->
				alg.process(D, new DMatrixRMaj(120, 1), new DMatrixRMaj(0, 2), state));
		assertThrows(IllegalArgumentException.class, () ->
				alg.process(D, new DMatrixRMaj(120, 2), new DMatrixRMaj(0, 2), state));
	}

	@Test
	void computeNormalInverse() {
		var J = new DMatrixRMaj(3, 2, true, 1, 0, 0, 2, 0, 0);
		var S = new DMatrixRMaj(0, 2);
		var Ginv = new DMatrixRMaj(1, 1);
		assertTrue(LadmapLowRankSparse.computeNormalInverse(J, S, Ginv));
		assertTrue(MatrixFeatures_DDRM.isIdentical(new DMatrixRMaj(2, 2, true, 1, 0, 0, 0.25), Ginv, 1e-12));

		// constraints add to the diagonal
		S = new DMatrixRMaj(1, 2, true, 0, 2);
		assertTrue(LadmapLowRankSparse.computeNormalInverse(J, S, Ginv));
		assertEquals(1.0/8.0, Ginv.get(1, 1), 1e-12);

		// all zeros has a pseudo inverse of zero
		assertTrue(LadmapLowRankSparse.computeNormalInverse(new DMatrixRMaj(3, 2), new DMatrixRMaj(0, 2), Ginv));
		assertEquals(0.0, NormOps_DDRM.normF(Ginv), 1e-12);
	}

	@Test
	void shrink() {
		assertEquals(0.5, LadmapLowRankSparse.shrink(1.5, 1.0), 1e-12);
		assertEquals(-0.5, LadmapLowRankSparse.shrink(-1.5, 1.0), 1e-12);
		assertEquals(0.0, LadmapLowRankSparse.shrink(0.7, 1.0), 1e-12);
		assertEquals(0.0, LadmapLowRankSparse.shrink(-1.0, 1.0), 1e-12);
	}

	@Test
	void nuclearNorm() {
		var M = new DMatrixRMaj(3, 3, true, 3, 0, 0, 0, -2, 0, 0, 0, 0.5);
		assertEquals(5.5, LadmapLowRankSparse.nuclearNorm(M), 1e-12);
	}

	/**
	 * Positive rank one matrix with a Frobenius norm of one
	 */
	private DMatrixRMaj rankOne( int m, int n ) {
		var D = new DMatrixRMaj(m, n);
		for (int i = 0; i < m; i++) {
			double u = 1.0 + 0.5*Math.sin(i*0.7);
			for (int j = 0; j < n; j++) {
				double v = 1.0 + 0.3*Math.cos(j*0.4);
				D.set(i, j, u*v);
			}
		}
		CommonOps_DDRM.scale(1.0/NormOps_DDRM.normF(D), D);
		return D;
	}

	private static DMatrixRMaj diff( DMatrixRMaj a, DMatrixRMaj b ) {
		var c = new DMatrixRMaj(a.numRows, a.numCols);
		CommonOps_DDRM.subtract(a, b, c);
		return c;
	}
}
