/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc;

import org.jcircuit.dc.network.Circuit;
import org.jcircuit.dc.network.CircuitComponent;
import org.jcircuit.dc.network.ComponentType;
import org.jcircuit.dc.network.NetIndex;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public final class CircuitAssert {

    public static final double DELTA_V = 1E-9d;
    /**
     * Voltage tolerance when the ridge regularized system is solved, the regularization shifting voltages
     * by a few nano volts.
     */
    public static final double DELTA_V_RIDGE = 1E-6d;
    public static final double DELTA_I = 1E-9d;
    public static final double DELTA_KCL = 1E-9d;
    public static final double DELTA_R = 1E-3d;

    private CircuitAssert() {
    }

    public static void assertVoltageEquals(double v, String net, DcCircuitResult result) {
        assertEquals(v, result.getNodeVoltage(net), DELTA_V, "Voltage of net " + net);
    }

    public static void assertVoltageEquals(double v, String net, DcCircuitResult result, double delta) {
        assertEquals(v, result.getNodeVoltage(net), delta, "Voltage of net " + net);
    }

    public static void assertCurrentEquals(double i, String componentId, DcCircuitResult result) {
        assertEquals(i, result.getBranchCurrent(componentId), DELTA_I, "Current of " + componentId);
    }

    /**
     * Check that the sum of currents leaving each non ground net through component terminals is zero. Sensing
     * branches are not components, so current controlled sources must be controlled by a voltage source.
     */
    public static void assertKirchhoffCurrentLaw(Circuit circuit, DcCircuitResult result) {
        Map<String, Double> leavingCurrents = new HashMap<>();
        for (CircuitComponent component : circuit.getComponents()) {
            ComponentType type = component.getComponentType();
            String first;
            String second;
            double i;
            switch (type) {
                case RESISTOR, CURRENT_PROBE -> {
                    first = component.getRequiredNet("p");
                    second = component.getRequiredNet("n");
                    i = result.getBranchCurrent(component.getId());
                }
                case ISOURCE_DC, VCCS, CCCS -> {
                    first = component.getRequiredNet("pos");
                    second = component.getRequiredNet("neg");
                    i = result.getBranchCurrent(component.getId());
                }
                case VSOURCE_DC, VCVS -> {
                    // delivered current enters the positive net
                    first = component.getRequiredNet("pos");
                    second = component.getRequiredNet("neg");
                    i = -result.getBranchCurrent(component.getId());
                }
                case CCVS -> {
                    first = component.getRequiredNet("pos");
                    second = component.getRequiredNet("neg");
                    i = -result.getSourceCurrents().get(component.getId());
                }
                default -> {
                    continue;
                }
            }
            leavingCurrents.merge(first, i, Double::sum);
            leavingCurrents.merge(second, -i, Double::sum);
        }
        leavingCurrents.forEach((net, i) -> {
            if (!net.equals(NetIndex.GROUND_ALIAS)) {
                assertEquals(0, i, DELTA_KCL, "Current balance of net " + net);
            }
        });
    }
}
