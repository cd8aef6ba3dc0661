/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.solver;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.PowsyblException;
import com.powsybl.math.matrix.DenseMatrix;
import org.apache.commons.math3.linear.*;
import org.jcircuit.dc.DcSolverParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.jcircuit.dc.util.Markers.PERFORMANCE_MARKER;

/**
 * Solves a square linear system, falling back on a ridge regularized solve then on a least norm
 * solve when the system is singular. Numerical singularity is never reported as an error as long as
 * the pseudo inverse stage is enabled.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public class LinearSystemSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(LinearSystemSolver.class);

    private final DcSolverParameters parameters;

    public LinearSystemSolver(DcSolverParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public LinearSolverResult solve(DenseMatrix a, double[] b) {
        Objects.requireNonNull(a);
        Objects.requireNonNull(b);
        int size = b.length;
        if (a.getRowCount() != size || a.getColumnCount() != size) {
            throw new IllegalArgumentException("Incompatible system dimensions: " + a.getRowCount() + "x" + a.getColumnCount()
                    + " matrix, " + size + " right hand side");
        }
        if (size == 0) {
            return new LinearSolverResult(new double[0], LinearSolverStage.DIRECT);
        }

        Stopwatch stopwatch = Stopwatch.createStarted();

        RealMatrix matrix = toRealMatrix(a);
        RealVector rhs = new ArrayRealVector(b);
        LinearSolverResult result = solve(matrix, rhs);

        stopwatch.stop();
        LOGGER.debug(PERFORMANCE_MARKER, "Linear system of size {} solved at stage {} in {} us",
                size, result.stage(), stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return result;
    }

    private LinearSolverResult solve(RealMatrix matrix, RealVector rhs) {
        Optional<double[]> x = solveLu(matrix, rhs);
        if (x.isPresent()) {
            return new LinearSolverResult(x.get(), LinearSolverStage.DIRECT);
        }

        if (parameters.isRidgeEnabled()) {
            RealMatrix ridgeMatrix = matrix.copy();
            for (int i = 0; i < ridgeMatrix.getRowDimension(); i++) {
                ridgeMatrix.addToEntry(i, i, parameters.getRidgeRegularization());
            }
            x = solveLu(ridgeMatrix, rhs);
            if (x.isPresent()) {
                LOGGER.warn("Singular linear system of size {}, solved with a ridge regularization of {}",
                        matrix.getRowDimension(), parameters.getRidgeRegularization());
                return new LinearSolverResult(x.get(), LinearSolverStage.RIDGE);
            }
        }

        if (parameters.isPseudoInverseEnabled()) {
            double[] leastNormX = new SingularValueDecomposition(matrix).getSolver().solve(rhs).toArray();
            LOGGER.warn("Singular linear system of size {}, solved with a pseudo inverse", matrix.getRowDimension());
            return new LinearSolverResult(leastNormX, LinearSolverStage.PSEUDO_INVERSE);
        }

        throw new PowsyblException("Singular linear system of size " + matrix.getRowDimension());
    }

    private Optional<double[]> solveLu(RealMatrix matrix, RealVector rhs) {
        try {
            double[] x = new LUDecomposition(matrix, parameters.getSingularityThreshold())
                    .getSolver()
                    .solve(rhs)
                    .toArray();
            if (Arrays.stream(x).allMatch(Double::isFinite)) {
                return Optional.of(x);
            }
            LOGGER.debug("LU solution of linear system has non finite values");
        } catch (SingularMatrixException e) {
            LOGGER.debug("LU decomposition failed: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private static RealMatrix toRealMatrix(DenseMatrix a) {
        RealMatrix matrix = new Array2DRowRealMatrix(a.getRowCount(), a.getColumnCount());
        for (int i = 0; i < a.getRowCount(); i++) {
            for (int j = 0; j < a.getColumnCount(); j++) {
                matrix.setEntry(i, j, a.get(i, j));
            }
        }
        return matrix;
    }
}
