/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc;

import org.jcircuit.dc.equations.MnaSystem;
import org.jcircuit.dc.equations.ReferenceCurrent;
import org.jcircuit.dc.equations.VoltageBranch;
import org.jcircuit.dc.network.*;
import org.jcircuit.dc.solver.LinearSolverResult;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps the solution vector of an MNA system back to circuit quantities.
 *
 * <p>Resistor, current source, VCCS and current probe currents flow from the first to the second terminal
 * through the element. Voltage sources and VCVS report the current delivered out of their positive terminal.
 * CCVS and CCCS report {@code gain} times their control current. The current delivered by each voltage
 * defining source is also given in the source current map. Sensing branches are not reported.</p>
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public final class DcResultExtractor {

    private DcResultExtractor() {
    }

    public static DcCircuitResult extract(Circuit circuit, MnaSystem system, LinearSolverResult solverResult) {
        Objects.requireNonNull(circuit);
        Objects.requireNonNull(system);
        Objects.requireNonNull(solverResult);
        double[] x = solverResult.x();
        if (x.length != system.getSize()) {
            throw new IllegalArgumentException("Solution size " + x.length + " does not match system size " + system.getSize());
        }
        NetIndex netIndex = system.getNetIndex();

        Map<String, Double> nodeVoltages = new HashMap<>();
        for (int num = 0; num < netIndex.getNetCount(); num++) {
            nodeVoltages.put(netIndex.getNetName(num), x[num]);
        }
        nodeVoltages.put(netIndex.getGroundNetName(), 0.0);
        nodeVoltages.put(NetIndex.GROUND_ALIAS, 0.0);

        Map<String, Double> branchCurrents = new HashMap<>();
        Map<String, Double> elementVoltages = new HashMap<>();
        Map<String, Double> probeReadings = new HashMap<>();
        Map<String, Double> sourceCurrents = new HashMap<>();
        for (DcElement element : system.getElements()) {
            double u = v(x, element.pos()) - v(x, element.neg());
            elementVoltages.put(element.id(), u);
            double i;
            if (element instanceof Resistor resistor) {
                i = u * resistor.getConductance();
            } else if (element instanceof CurrentSource source) {
                i = source.current();
            } else if (element instanceof VoltageSource source) {
                double branchCurrent = branchCurrent(x, system, source.id());
                if (source.kind() == VoltageSource.Kind.CURRENT_PROBE) {
                    i = branchCurrent;
                    probeReadings.put(source.id(), i);
                } else {
                    i = -branchCurrent;
                    sourceCurrents.put(source.id(), i);
                }
            } else if (element instanceof Vcvs vcvs) {
                i = -branchCurrent(x, system, vcvs.id());
                sourceCurrents.put(vcvs.id(), i);
            } else if (element instanceof Ccvs ccvs) {
                sourceCurrents.put(ccvs.id(), -branchCurrent(x, system, ccvs.id()));
                i = ccvs.gain() * referenceCurrent(x, system, ccvs.id());
            } else if (element instanceof Vccs vccs) {
                i = vccs.gain() * (v(x, vccs.controlPos()) - v(x, vccs.controlNeg()));
            } else if (element instanceof Cccs cccs) {
                i = cccs.gain() * referenceCurrent(x, system, cccs.id());
            } else {
                throw new IllegalStateException("Unknown element type: " + element.getClass().getSimpleName());
            }
            branchCurrents.put(element.id(), i);
        }

        // voltage probes have no element, read them from the circuit
        for (CircuitComponent component : circuit.getComponents()) {
            if (component.getComponentType() == ComponentType.VOLTAGE_PROBE) {
                String net = netIndex.resolveName(component.getRequiredNet(Terminals.NODE));
                probeReadings.put(component.getId(), nodeVoltages.get(net));
            }
        }

        return new DcCircuitResult(nodeVoltages, branchCurrents, elementVoltages, probeReadings, sourceCurrents,
                solverResult.stage(), List.of());
    }

    private static double v(double[] x, int num) {
        return num == NetIndex.GROUND_NUM ? 0 : x[num];
    }

    /**
     * Control current of a current controlled source, flowing from its control positive to its control
     * negative net.
     */
    private static double referenceCurrent(double[] x, MnaSystem system, String elementId) {
        ReferenceCurrent referenceCurrent = system.getReferenceCurrents().get(elementId);
        return referenceCurrent.sign() * x[system.getBranchColumn(referenceCurrent.branchNum())];
    }

    private static double branchCurrent(double[] x, MnaSystem system, String elementId) {
        VoltageBranch branch = system.getBranch(elementId)
                .orElseThrow(() -> new IllegalStateException("No voltage defining branch for element '" + elementId + "'"));
        return x[system.getBranchColumn(branch.num())];
    }
}
