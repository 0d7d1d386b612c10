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
 * Receives the state after each outer iteration. Arguments are owned by the algorithm and are modified in the
 * next iteration, copy them if they need to be saved.
 *
 * @author TiltCV Authors
 */
@FunctionalInterface
public interface TiltIterationListener {
	/**
	 * @param iteration outer iteration which just finished, starting from 1
	 * @param objective objective returned by the inner solver
	 * @param transform transform after the parameter update
	 * @param rectified patch warped with the updated transform, not normalized
	 */
	void outerIteration( int iteration, double objective, DMatrixRMaj transform, DMatrixRMaj rectified );
}
