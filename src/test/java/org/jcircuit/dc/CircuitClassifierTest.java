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
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.jcircuit.dc.AbstractCircuitFactory.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
class CircuitClassifierTest {

    @Test
    void testEligibleTypes() {
        EnumSet<ComponentType> ineligibleTypes = EnumSet.of(ComponentType.CAPACITOR, ComponentType.INDUCTOR,
                ComponentType.VSOURCE_AC, ComponentType.ISOURCE_AC);
        for (ComponentType type : ComponentType.values()) {
            assertEquals(!ineligibleTypes.contains(type), CircuitClassifier.isDcEligible(type), type.getTag());
        }
    }

    @Test
    void testSelectMethod() {
        assertEquals(AnalysisMethod.DC_NODE_VOLTAGE, CircuitClassifier.selectMethod(ControlledSourcesCircuitFactory.create().getComponents()));

        Circuit circuit = createCircuit(
                voltageSource("V1", "a", "gnd", 5),
                resistor("R1", "a", "b", 1000),
                capacitor("C1", "b", "gnd", 1e-6));
        assertFalse(CircuitClassifier.isDcEligible(circuit.getComponents()));
        assertEquals(AnalysisMethod.TRANSIENT, CircuitClassifier.selectMethod(circuit.getComponents()));
        assertEquals(List.of("C1"), CircuitClassifier.getDcIneligibleComponents(circuit.getComponents()).stream().map(CircuitComponent::getId).toList());
    }

    @Test
    void testCheckDcEligible() {
        List<CircuitComponent> components = List.of(
                new CircuitComponent("V1", "vsource_ac", Map.of("amplitude", 1.0, "frequency", 50.0), Map.of("pos", "a", "neg", "gnd")),
                capacitor("C1", "a", "gnd", 1e-6),
                resistor("R1", "a", "gnd", 10));

        CircuitValidationException e = assertThrows(CircuitValidationException.class, () -> CircuitClassifier.checkDcEligible(components));
        assertEquals(CircuitValidationException.Category.ELIGIBILITY, e.getCategory());
        assertEquals("V1,C1", e.getContext().get(CircuitValidationException.COMPONENT));
        assertEquals("vsource_ac,capacitor", e.getContext().get(CircuitValidationException.TYPE));

        assertDoesNotThrow(() -> CircuitClassifier.checkDcEligible(VoltageDividerCircuitFactory.create().getComponents()));
    }

    @Test
    void testUnknownType() {
        List<CircuitComponent> components = List.of(new CircuitComponent("X1", "diode", Map.of(), Map.of()));
        CircuitValidationException e = assertThrows(CircuitValidationException.class, () -> CircuitClassifier.isDcEligible(components));
        assertEquals(CircuitValidationException.Category.SCHEMA, e.getCategory());
        assertEquals("diode", e.getContext().get(CircuitValidationException.TYPE));
    }
}
