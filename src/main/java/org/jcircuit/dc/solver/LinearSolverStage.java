/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.solver;

/**
 * Stage of {@link LinearSystemSolver} that produced a solution, in the order they are tried.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public enum LinearSolverStage {
    /**
     * LU decomposition of the system as built.
     */
    DIRECT,
    /**
     * LU decomposition after a small value has been added to every diagonal entry.
     */
    RIDGE,
    /**
     * Least norm solution computed from the singular value decomposition.
     */
    PSEUDO_INVERSE,
}
