/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc;

import com.powsybl.commons.PowsyblException;
import org.jcircuit.dc.solver.LinearSolverStage;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Operating point of a DC circuit.
 *
 * <p>Node voltages are given by net name, the ground net being present at 0 V under its declared name and
 * under the {@code gnd} alias. Branch currents, element voltages, probe readings and source currents are given by
 * component id. Solving steps are only filled in teaching mode.</p>
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public class DcCircuitResult {

    private final Map<String, Double> nodeVoltages;

    private final Map<String, Double> branchCurrents;

    private final Map<String, Double> elementVoltages;

    private final Map<String, Double> probeReadings;

    private final Map<String, Double> sourceCurrents;

    private final LinearSolverStage solverStage;

    private final List<String> steps;

    public DcCircuitResult(Map<String, Double> nodeVoltages, Map<String, Double> branchCurrents,
                           Map<String, Double> elementVoltages, Map<String, Double> probeReadings,
                           Map<String, Double> sourceCurrents, LinearSolverStage solverStage, List<String> steps) {
        this.nodeVoltages = Collections.unmodifiableMap(new TreeMap<>(nodeVoltages));
        this.branchCurrents = Collections.unmodifiableMap(new TreeMap<>(branchCurrents));
        this.elementVoltages = Collections.unmodifiableMap(new TreeMap<>(elementVoltages));
        this.probeReadings = Collections.unmodifiableMap(new TreeMap<>(probeReadings));
        this.sourceCurrents = Collections.unmodifiableMap(new TreeMap<>(sourceCurrents));
        this.solverStage = Objects.requireNonNull(solverStage);
        this.steps = List.copyOf(steps);
    }

    /**
     * Copy of this result with the given solving steps.
     */
    public DcCircuitResult withSteps(List<String> newSteps) {
        return new DcCircuitResult(nodeVoltages, branchCurrents, elementVoltages, probeReadings, sourceCurrents, solverStage, newSteps);
    }

    public Map<String, Double> getNodeVoltages() {
        return nodeVoltages;
    }

    public Map<String, Double> getBranchCurrents() {
        return branchCurrents;
    }

    public Map<String, Double> getElementVoltages() {
        return elementVoltages;
    }

    public Map<String, Double> getProbeReadings() {
        return probeReadings;
    }

    /**
     * Current delivered out of the positive terminal of each independent voltage source, VCVS and CCVS.
     */
    public Map<String, Double> getSourceCurrents() {
        return sourceCurrents;
    }

    public LinearSolverStage getSolverStage() {
        return solverStage;
    }

    public List<String> getSteps() {
        return steps;
    }

    public double getNodeVoltage(String netName) {
        Double v = nodeVoltages.get(netName);
        if (v == null) {
            throw new PowsyblException("Net '" + netName + "' not found");
        }
        return v;
    }

    public double getBranchCurrent(String componentId) {
        Double i = branchCurrents.get(componentId);
        if (i == null) {
            throw new PowsyblException("No current for component '" + componentId + "'");
        }
        return i;
    }

    @Override
    public String toString() {
        return "DcCircuitResult(nodeVoltages=" + nodeVoltages
                + ", branchCurrents=" + branchCurrents
                + ", solverStage=" + solverStage
                + ")";
    }
}
