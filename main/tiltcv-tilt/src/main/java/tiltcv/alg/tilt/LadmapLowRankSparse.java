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

import lombok.Getter;
import org.ddogleg.struct.VerbosePrint;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.NormOps_DDRM;
import org.ejml.dense.row.SpecializedOps_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.dense.row.linsol.svd.SolvePseudoInverseSvd_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;
import tiltcv.factory.tilt.ConfigLadmap;

import javax.annotation.Nullable;
import java.io.PrintStream;
import java.util.Set;

/**
 * <p>
 * Linearized alternating direction method with adaptive penalty (LADMAP) for decomposing a linearized patch
 * into a low-rank and a sparse component:
 * </p>
 * <pre>
 * min ||A||<sub>*</sub> + &lambda;||E||<sub>1</sub>   subject to   D + J*&Delta;&tau; = A + E,  S*&Delta;&tau; = 0
 * </pre>
 *
 * <p>
 * Each iteration updates the low-rank component by singular value thresholding, the sparse component by
 * soft thresholding, then the parameter update by solving the normal equations (J'J + S'S)&Delta;&tau; = J'(...).
 * The constraints enter through the normal equations. Afterwards the multiplier Y takes a step along the
 * residual and the penalty &mu; is increased by &rho; once the iterates stop changing.
 * </p>
 *
 * <p>
 * Iterations stop once the relative primal residual is below tol1 and the relative change is below tol2, or
 * when the iteration limit is hit. A solution where the low-rank component collapsed is reported as
 * degenerate.
 * </p>
 *
 * <p>
 * Reference: Xiang Ren and Zhouchen Lin, "Linearized Alternating Direction Method with Adaptive Penalty
 * for Fast Solving Transform Invariant Low-rank Texture"
 * </p>
 *
 * @author TiltCV Authors
 */
public class LadmapLowRankSparse implements VerbosePrint {
	/** Relative tolerance for singular values in the pseudo inverse of the normal equations */
	public static final double PINV_TOLERANCE = 1e-12;

	@Getter final ConfigLadmap config;

	/** Number of iterations in the most recent call to process */
	@Getter int iterations;
	/** True if the most recent call stopped because the tolerances were met */
	@Getter boolean converged;
	/** Sparsity weight used in the most recent call */
	@Getter double lambda;
	/** Relative primal residual at the last iteration */
	@Getter double primalResidual;
	/** Relative change at the last iteration */
	@Getter double changeResidual;
	/** Rank of the low-rank component at the last iteration */
	@Getter int rankA;

	@Nullable PrintStream verbose;

	SingularValueDecomposition_F64<DMatrixRMaj> svd = DecompositionFactory_DDRM.svd(10, 10, true, true, true);

	// sum of the thresholded singular values, i.e. nuclear norm of A
	double nuclearA;

	// Work space
	DMatrixRMaj Ginv = new DMatrixRMaj(1, 1);
	DMatrixRMaj GJt = new DMatrixRMaj(1, 1);
	DMatrixRMaj Jdt = new DMatrixRMaj(1, 1);
	DMatrixRMaj prevJdt = new DMatrixRMaj(1, 1);
	DMatrixRMaj prevA = new DMatrixRMaj(1, 1);
	DMatrixRMaj prevE = new DMatrixRMaj(1, 1);
	DMatrixRMaj target = new DMatrixRMaj(1, 1);
	DMatrixRMaj residual = new DMatrixRMaj(1, 1);
	@Nullable DMatrixRMaj U, Vt;

	public LadmapLowRankSparse( ConfigLadmap config ) {
		config.checkValidity();
		this.config = config;
	}

	/**
	 * Decomposes the linearized patch.
	 *
	 * @param D (Input) patch. m x n with a Frobenius norm of one.
	 * @param J (Input) Jacobian. (m*n) x p with rows in row-major pixel order
	 * @param S (Input) Constraints. k x p, k can be zero.
	 * @param state (Input) Initial state. (Output) solution. A, E and Y must be m x n and deltaTau p x 1.
	 * If mu is zero or less it will be selected automatically.
	 * @return true if successful or false if the solution is degenerate
	 */
	public boolean process( DMatrixRMaj D, DMatrixRMaj J, DMatrixRMaj S, LowRankSparseState state ) {
		final int m = D.numRows, n = D.numCols, N = m*n, p = J.numCols;
		if (J.numRows != N)
			throw new IllegalArgumentException("J must have one row for each pixel. " + J.numRows + " != " + N);
		if (S.numCols != p)
			throw new IllegalArgumentException("S and J must have the same number of columns");
		checkShape(state.A, m, n, "A");
		checkShape(state.E, m, n, "E");
		checkShape(state.Y, m, n, "Y");
		checkShape(state.deltaTau, p, 1, "deltaTau");

		iterations = 0;
		converged = false;
		rankA = 0;

		double normD = NormOps_DDRM.normF(D);
		if (normD == 0.0 || !Double.isFinite(normD)) {
			if (verbose != null) verbose.println("Degenerate: ||D|| = " + normD);
			return false;
		}

		lambda = config.lambda > 0 ? config.lambda : config.c/Math.sqrt(m);

		if (!computeNormalInverse(J, S, Ginv)) {
			if (verbose != null) verbose.println("Degenerate: normal equations can't be inverted");
			return false;
		}
		CommonOps_DDRM.multTransB(Ginv, J, GJt);

		double mu = state.mu;
		if (mu <= 0)
			mu = config.mu > 0 ? config.mu : 1.25/NormOps_DDRM.normP2(D);
		if (!Double.isFinite(mu))
			return false;

		Jdt.reshape(N, 1);
		residual.reshape(N, 1);
		target.reshape(m, n);
		CommonOps_DDRM.mult(J, state.deltaTau, Jdt);

		final double[] d = D.data;
		final double[] y = state.Y.data;
		final double[] e = state.E.data;
		final double[] jdt = Jdt.data;
		final double[] t = target.data;
		final double[] r = residual.data;

		double objective = Double.NaN;
		while (iterations < config.maxIterations) {
			iterations++;
			prevA.set(state.A);
			prevE.set(state.E);
			prevJdt.set(Jdt);
			double invMu = 1.0/mu;

			// low-rank component
			for (int i = 0; i < N; i++) {
				t[i] = d[i] + jdt[i] + y[i]*invMu - e[i];
			}
			if (!singularValueThreshold(target, invMu, state.A))
				return false;
			final double[] a = state.A.data;

			// sparse component
			double threshold = lambda*invMu;
			for (int i = 0; i < N; i++) {
				e[i] = shrink(d[i] + jdt[i] + y[i]*invMu - a[i], threshold);
			}

			// parameter update
			for (int i = 0; i < N; i++) {
				r[i] = a[i] + e[i] - d[i] - y[i]*invMu;
			}
			CommonOps_DDRM.mult(GJt, residual, state.deltaTau);
			CommonOps_DDRM.mult(J, state.deltaTau, Jdt);

			// multiplier
			double sumR = 0;
			for (int i = 0; i < N; i++) {
				double v = d[i] + jdt[i] - a[i] - e[i];
				y[i] += mu*v;
				sumR += v*v;
			}

			primalResidual = Math.sqrt(sumR)/normD;
			double change = Math.max(SpecializedOps_DDRM.diffNormF(state.A, prevA),
					SpecializedOps_DDRM.diffNormF(state.E, prevE));
			change = Math.max(change, SpecializedOps_DDRM.diffNormF(Jdt, prevJdt));
			changeResidual = mu*change/normD;
			objective = nuclearA + lambda*CommonOps_DDRM.elementSumAbs(state.E);

			if (!Double.isFinite(primalResidual) || !Double.isFinite(changeResidual) ||
					!Double.isFinite(objective) || MatrixFeatures_DDRM.hasUncountable(state.deltaTau)) {
				if (verbose != null) verbose.println("Degenerate: non-finite iterate at " + iterations);
				return false;
			}

			if (verbose != null && iterations%config.displayPeriod == 0) {
				verbose.printf("  inner %4d mu=%.3e primal=%.3e change=%.3e rank(A)=%d f=%.6f\n",
						iterations, mu, primalResidual, changeResidual, rankA, objective);
			}

			if (primalResidual < config.tol1 && changeResidual < config.tol2) {
				converged = true;
				break;
			}
			if (changeResidual < config.tol2)
				mu = Math.min(mu*config.rho, config.muMax);
		}

		state.mu = mu;
		state.objective = objective;

		double nuclearD = nuclearNorm(D);
		if (nuclearA < config.degenerateRatio*nuclearD) {
			if (verbose != null) verbose.printf("Degenerate: ||A||_* = %.3e ||D||_* = %.3e\n", nuclearA, nuclearD);
			return false;
		}

		return true;
	}

	/**
	 * Computes the pseudo inverse of the normal equations G = J'J + S'S. Singular values smaller than
	 * {@link #PINV_TOLERANCE} times the number of parameters times the largest are treated as zero.
	 *
	 * @return true if the inverse is finite
	 */
	public static boolean computeNormalInverse( DMatrixRMaj J, DMatrixRMaj S, DMatrixRMaj Ginv ) {
		int p = J.numCols;
		var G = new DMatrixRMaj(p, p);
		CommonOps_DDRM.multInner(J, G);
		if (S.numRows > 0) {
			var StS = new DMatrixRMaj(p, p);
			CommonOps_DDRM.multInner(S, StS);
			CommonOps_DDRM.addEquals(G, StS);
		}
		if (MatrixFeatures_DDRM.hasUncountable(G))
			return false;

		var pinv = new SolvePseudoInverseSvd_DDRM(p, p);
		pinv.setThreshold(PINV_TOLERANCE);
		if (!pinv.setA(G))
			return false;
		Ginv.reshape(p, p);
		pinv.invert(Ginv);
		return !MatrixFeatures_DDRM.hasUncountable(Ginv);
	}

	/**
	 * A = U*max(&Sigma; - tau, 0)*V'. Updates {@link #rankA} and {@link #nuclearA}.
	 */
	boolean singularValueThreshold( DMatrixRMaj input, double tau, DMatrixRMaj output ) {
		int m = input.numRows, n = input.numCols;
		if (!svd.decompose(input))
			return false;
		U = svd.getU(U, false);
		Vt = svd.getV(Vt, true);
		double[] sv = svd.getSingularValues();
		int numSv = svd.numberOfSingularValues();

		output.reshape(m, n);
		output.zero();
		rankA = 0;
		nuclearA = 0;
		int numColsU = U.numCols;
		for (int k = 0; k < numSv; k++) {
			double s = sv[k] - tau;
			if (s <= 0)
				continue;
			rankA++;
			nuclearA += s;

			for (int row = 0; row < m; row++) {
				double u = U.data[row*numColsU + k]*s;
				if (u == 0.0)
					continue;
				int indexOut = row*n;
				int indexV = k*n;
				for (int col = 0; col < n; col++) {
					output.data[indexOut++] += u*Vt.data[indexV++];
				}
			}
		}
		return true;
	}

	/**
	 * Sum of singular values
	 */
	public static double nuclearNorm( DMatrixRMaj M ) {
		SingularValueDecomposition_F64<DMatrixRMaj> svd =
				DecompositionFactory_DDRM.svd(M.numRows, M.numCols, false, false, true);
		if (!svd.decompose(M.copy()))
			return Double.NaN;
		double[] sv = svd.getSingularValues();
		double total = 0;
		for (int i = 0; i < svd.numberOfSingularValues(); i++) {
			total += sv[i];
		}
		return total;
	}

	/** sign(x)*max(|x| - threshold, 0) */
	static double shrink( double x, double threshold ) {
		if (x > threshold)
			return x - threshold;
		else if (x < -threshold)
			return x + threshold;
		return 0.0;
	}

	private static void checkShape( DMatrixRMaj M, int rows, int cols, String name ) {
		if (M.numRows != rows || M.numCols != cols)
			throw new IllegalArgumentException(name + " is " + M.numRows + "x" + M.numCols +
					" and not " + rows + "x" + cols);
	}

	@Override
	public void setVerbose( @Nullable PrintStream out, @Nullable Set<String> configuration ) {
		this.verbose = out;
	}
}
