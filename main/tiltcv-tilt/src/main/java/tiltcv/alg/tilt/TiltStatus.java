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

/**
 * Why the rectification stopped
 *
 * @author TiltCV Authors
 */
public enum TiltStatus {
	/** Change in the objective between outer iterations dropped below the tolerance */
	CONVERGED,
	/** Outer iteration limit was reached. The best estimate is still returned. */
	MAX_ITERATIONS,
	/** The patch or the decomposition collapsed and no meaningful solution exists */
	DEGENERATE
}
