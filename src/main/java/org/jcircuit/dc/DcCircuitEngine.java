/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc;

import com.google.common.base.Stopwatch;
import org.jcircuit.dc.equations.MnaSystem;
import org.jcircuit.dc.equations.MnaSystemBuilder;
import org.jcircuit.dc.network.*;
import org.jcircuit.dc.solver.LinearSolverResult;
import org.jcircuit.dc.solver.LinearSystemSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static org.jcircuit.dc.util.Markers.PERFORMANCE_MARKER;

/**
 * Computes the DC operating point of a circuit: net resolution, MNA system building, linear solving and
 * result extraction. Stateless, a single engine can be shared between threads.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public class DcCircuitEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(DcCircuitEngine.class);

    private final DcSolverParameters parameters;

    public DcCircuitEngine(DcSolverParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public DcSolverParameters getParameters() {
        return parameters;
    }

    public DcCircuitResult run(Circuit circuit) {
        Objects.requireNonNull(circuit);
        Stopwatch stopwatch = Stopwatch.createStarted();

        NetIndex netIndex = NetResolver.resolve(circuit);
        List<DcElement> elements = DcElementFactory.create(circuit, netIndex);
        MnaSystem system = new MnaSystemBuilder(netIndex, elements, parameters).build();
        LinearSolverResult solverResult = new LinearSystemSolver(parameters).solve(system.getMatrix(), system.getRhs());
        DcCircuitResult result = DcResultExtractor.extract(circuit, system, solverResult);
        if (parameters.isTeachingMode()) {
            result = result.withSteps(createSteps(system, result));
        }

        stopwatch.stop();
        LOGGER.debug(PERFORMANCE_MARKER, "DC analysis of circuit with {} components done in {} ms",
                circuit.getComponents().size(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
        LOGGER.info("DC analysis complete (solverStage={}, unknowns={})", result.getSolverStage(), system.getSize());

        return result;
    }

    private static List<String> createSteps(MnaSystem system, DcCircuitResult result) {
        NetIndex netIndex = system.getNetIndex();
        List<String> steps = new ArrayList<>();
        steps.add("Ground net: " + netIndex.getGroundNetName());
        steps.add("Unknowns: " + system.getUnknownNames());
        steps.addAll(system.getEquations());
        steps.add("Solved by " + result.getSolverStage());
        for (String net : netIndex.getNets()) {
            steps.add("V(" + net + ") = " + result.getNodeVoltage(net));
        }
        return steps;
    }
}
