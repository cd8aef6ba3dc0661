/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc;

import com.powsybl.commons.PowsyblException;
import org.jcircuit.dc.network.Circuit;
import org.jcircuit.dc.network.CircuitComponent;
import org.jcircuit.dc.network.ComponentParameters;
import org.jcircuit.dc.solver.LinearSolverStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.jcircuit.dc.AbstractCircuitFactory.*;
import static org.jcircuit.dc.CircuitAssert.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
class DcCircuitEngineTest {

    private DcCircuitEngine engine;

    @BeforeEach
    void setUp() {
        engine = new DcCircuitEngine(new DcSolverParameters());
    }

    @Test
    void testVoltageDivider() {
        Circuit circuit = VoltageDividerCircuitFactory.create();
        DcCircuitResult result = engine.run(circuit);

        assertEquals(LinearSolverStage.DIRECT, result.getSolverStage());
        assertVoltageEquals(9, "in", result);
        assertVoltageEquals(6, "n1", result);
        assertVoltageEquals(0, "gnd", result);
        assertCurrentEquals(1e-3, "V1", result);
        assertCurrentEquals(1e-3, "R1", result);
        assertCurrentEquals(1e-3, "R2", result);
        assertEquals(3, result.getElementVoltages().get("R1"), DELTA_V);
        assertEquals(9, result.getElementVoltages().get("V1"), DELTA_V);
        assertFalse(result.getBranchCurrents().containsKey("GND1"));
        assertKirchhoffCurrentLaw(circuit, result);
    }

    @Test
    void testGroundDeclaredUnderAnotherName() {
        Circuit circuit = createCircuit(
                voltageSource("V1", "in", "0", 5),
                resistor("R1", "in", "0", 1000),
                ground("GND1", "0"));
        DcCircuitResult result = engine.run(circuit);

        assertVoltageEquals(5, "in", result);
        assertVoltageEquals(0, "0", result);
        assertVoltageEquals(0, "gnd", result);
        assertEquals(Set.of("0", "gnd", "in"), result.getNodeVoltages().keySet());
    }

    @Test
    void testControlledSources() {
        Circuit circuit = ControlledSourcesCircuitFactory.create();
        DcCircuitResult result = engine.run(circuit);

        assertEquals(LinearSolverStage.DIRECT, result.getSolverStage());
        assertVoltageEquals(12, "a", result);
        assertVoltageEquals(8, "b", result);
        assertVoltageEquals(8, "c", result);
        assertVoltageEquals(16, "d", result);
        assertVoltageEquals(8, "e", result);
        assertVoltageEquals(-0.2, "f", result);
        assertCurrentEquals(4e-3, "V1", result);
        assertCurrentEquals(4e-3, "CP1", result);
        assertCurrentEquals(0.016, "E1", result);
        assertCurrentEquals(8e-3, "G1", result);
        assertCurrentEquals(2e-3, "F1", result);
        assertCurrentEquals(-2e-3, "R5", result);
        assertEquals(4e-3, result.getProbeReadings().get("CP1"), DELTA_I);
        assertEquals(16, result.getProbeReadings().get("VP1"), DELTA_V);
        assertKirchhoffCurrentLaw(circuit, result);
    }

    @Test
    void testTeachingSteps() {
        Circuit circuit = VoltageDividerCircuitFactory.create();
        assertTrue(engine.run(circuit).getSteps().isEmpty());

        DcCircuitResult result = new DcCircuitEngine(new DcSolverParameters().setTeachingMode(true)).run(circuit);
        List<String> steps = result.getSteps();
        assertEquals("Ground net: gnd", steps.get(0));
        assertEquals("Unknowns: [V(in), V(n1), I(V1)]", steps.get(1));
        assertTrue(steps.get(2).startsWith("KCL(in): "));
        assertTrue(steps.get(3).startsWith("KCL(n1): "));
        assertEquals("U(V1): 1.0*V(in) = 9.0", steps.get(4));
        assertEquals("Solved by DIRECT", steps.get(5));
        assertTrue(steps.get(6).startsWith("V(in) = "));
        assertTrue(steps.get(7).startsWith("V(n1) = "));
        assertEquals(8, steps.size());
        assertVoltageEquals(6, "n1", result);
    }

    @Test
    void testCcvsWithSensingBranch() {
        Circuit circuit = createCircuit(
                voltageSource("V1", "a", "gnd", 10),
                resistor("R1", "a", "b", 1000),
                ccvs("H1", "c", "gnd", "b", "gnd", 500),
                resistor("R2", "c", "gnd", 1000));
        DcCircuitResult result = engine.run(circuit);

        // the sensing branch shorts b to ground
        assertVoltageEquals(0, "b", result);
        assertVoltageEquals(5, "c", result);
        assertCurrentEquals(1e-2, "V1", result);
        // gain times the 10 mA control current
        assertCurrentEquals(5, "H1", result);
        assertEquals(5e-3, result.getSourceCurrents().get("H1"), DELTA_I);
        assertEquals(5, result.getElementVoltages().get("H1"), DELTA_V);
        assertEquals(Set.of("R1", "R2", "V1", "H1"), result.getBranchCurrents().keySet());
        assertEquals(Set.of("V1", "H1"), result.getSourceCurrents().keySet());
    }

    @Test
    void testCcvsCurrentDoesNotDependOnLoad() {
        Circuit circuit = createCircuit(
                voltageSource("V1", "a", "gnd", 10),
                resistor("R1", "a", "b", 1000),
                ccvs("H1", "c", "gnd", "b", "gnd", 500),
                resistor("R2", "c", "gnd", 2000));
        DcCircuitResult result = engine.run(circuit);

        assertVoltageEquals(5, "c", result);
        assertCurrentEquals(5, "H1", result);
        assertEquals(2.5e-3, result.getSourceCurrents().get("H1"), DELTA_I);
        assertCurrentEquals(2.5e-3, "R2", result);
    }

    @Test
    void testCcvsReusingVoltageSource() {
        Circuit circuit = createCircuit(
                voltageSource("V1", "a", "gnd", 10),
                resistor("R1", "a", "gnd", 1000),
                ccvs("H1", "c", "gnd", "gnd", "a", 500),
                resistor("R2", "c", "gnd", 2000));
        DcCircuitResult result = engine.run(circuit);

        assertVoltageEquals(5, "c", result);
        assertCurrentEquals(5, "H1", result);
        assertEquals(2.5e-3, result.getSourceCurrents().get("H1"), DELTA_I);
        assertKirchhoffCurrentLaw(circuit, result);
    }

    @Test
    void testCccsReusingReversedVoltageSource() {
        Circuit circuit = createCircuit(
                voltageSource("V1", "a", "gnd", 10),
                resistor("R1", "a", "gnd", 1000),
                cccs("F1", "b", "gnd", "gnd", "a", 2),
                resistor("R2", "b", "gnd", 100));
        DcCircuitResult result = engine.run(circuit);

        // control current flows from gnd to a through V1, i.e. the 10 mA delivered by V1
        assertCurrentEquals(2e-2, "F1", result);
        assertVoltageEquals(-2, "b", result);
        assertKirchhoffCurrentLaw(circuit, result);
    }

    @Test
    void testSuperposition() {
        Circuit circuit = createCircuit(
                voltageSource("V1", "a", "gnd", 10),
                resistor("R1", "a", "b", 1000),
                resistor("R2", "b", "gnd", 1000),
                currentSource("I1", "gnd", "b", 2e-3));
        DcCircuitResult both = engine.run(circuit);
        DcCircuitResult voltageOnly = engine.run(withZeroSource(circuit, "I1"));
        DcCircuitResult currentOnly = engine.run(withZeroSource(circuit, "V1"));

        assertVoltageEquals(6, "b", both);
        for (String net : both.getNodeVoltages().keySet()) {
            assertEquals(both.getNodeVoltage(net), voltageOnly.getNodeVoltage(net) + currentOnly.getNodeVoltage(net), DELTA_V);
        }
        for (String id : both.getBranchCurrents().keySet()) {
            assertEquals(both.getBranchCurrent(id), voltageOnly.getBranchCurrent(id) + currentOnly.getBranchCurrent(id), DELTA_I);
        }
    }

    private static Circuit withZeroSource(Circuit circuit, String sourceId) {
        CircuitComponent source = circuit.getComponent(sourceId).orElseThrow();
        Circuit zeroed = circuit.withReplacedComponent(source.withParameters(Map.of(ComponentParameters.DC, 0.0)));
        assertEquals(0.0, zeroed.getComponent(sourceId).orElseThrow().getParameters().get(ComponentParameters.DC));
        assertEquals(circuit.getNets(), zeroed.getNets());
        return zeroed;
    }

    @Test
    void testSelfShortedVoltageSource() {
        Circuit circuit = createCircuit(
                voltageSource("V1", "a", "gnd", 10),
                resistor("R1", "a", "b", 1000),
                resistor("R2", "b", "gnd", 1000),
                voltageSource("V2", "x", "x", 5));
        DcCircuitResult result = assertDoesNotThrow(() -> engine.run(circuit));

        assertEquals(LinearSolverStage.RIDGE, result.getSolverStage());
        assertVoltageEquals(10, "a", result, DELTA_V_RIDGE);
        assertVoltageEquals(5, "b", result, DELTA_V_RIDGE);
        result.getNodeVoltages().values().forEach(v -> assertTrue(Double.isFinite(v)));
        result.getBranchCurrents().values().forEach(i -> assertTrue(Double.isFinite(i)));
    }

    @Test
    void testFloatingIsland() {
        Circuit circuit = createCircuit(
                voltageSource("V1", "a", "gnd", 10),
                resistor("R1", "a", "gnd", 1000),
                resistor("R2", "x", "y", 1000),
                resistor("R3", "x", "y", 1000));
        DcCircuitResult result = assertDoesNotThrow(() -> engine.run(circuit));

        assertEquals(LinearSolverStage.RIDGE, result.getSolverStage());
        assertVoltageEquals(10, "a", result, DELTA_V_RIDGE);
        assertEquals(1e-2, result.getBranchCurrent("V1"), 1e-9);
        assertTrue(Double.isFinite(result.getNodeVoltage("x")));
        assertTrue(Double.isFinite(result.getNodeVoltage("y")));
        assertCurrentEquals(0, "R2", result);
    }

    @Test
    void testDuplicateVoltageSources() {
        Circuit circuit = createCircuit(
                voltageSource("V1", "a", "gnd", 5),
                voltageSource("V2", "a", "gnd", 5),
                resistor("R1", "a", "gnd", 1000));
        DcCircuitResult result = assertDoesNotThrow(() -> engine.run(circuit));

        assertVoltageEquals(5, "a", result);
        assertEquals(5e-3, result.getBranchCurrent("V1") + result.getBranchCurrent("V2"), DELTA_I);
        assertKirchhoffCurrentLaw(circuit, result);
    }

    @Test
    void testDuplicateVoltageSourcesScaledRegularization() {
        engine = new DcCircuitEngine(new DcSolverParameters()
                .setDuplicateBranchRegularizationMode(DcSolverParameters.RegularizationMode.SCALED));
        Circuit circuit = createCircuit(
                voltageSource("V1", "a", "gnd", 5),
                voltageSource("V2", "gnd", "a", -5),
                resistor("R1", "a", "gnd", 1e-3));
        DcCircuitResult result = engine.run(circuit);

        assertVoltageEquals(5, "a", result);
        assertEquals(5000, result.getBranchCurrent("V1") - result.getBranchCurrent("V2"), 1e-6);
    }

    @Test
    void testIdempotence() {
        Circuit circuit = ControlledSourcesCircuitFactory.create();
        DcCircuitResult result1 = engine.run(circuit);
        DcCircuitResult result2 = engine.run(circuit);
        assertEquals(result1.getNodeVoltages(), result2.getNodeVoltages());
        assertEquals(result1.getBranchCurrents(), result2.getBranchCurrents());
        assertEquals(result1.getElementVoltages(), result2.getElementVoltages());
    }

    @Test
    void testCapacitorIsRejected() {
        Circuit circuit = createCircuit(
                voltageSource("V1", "a", "gnd", 5),
                capacitor("C1", "a", "gnd", 1e-6));
        CircuitValidationException e = assertThrows(CircuitValidationException.class, () -> engine.run(circuit));
        assertEquals(CircuitValidationException.Category.ELIGIBILITY, e.getCategory());
        assertEquals("C1", e.getContext().get(CircuitValidationException.COMPONENT));
    }

    @Test
    void testUnknownNetQuery() {
        DcCircuitResult result = engine.run(VoltageDividerCircuitFactory.create());
        assertThrows(PowsyblException.class, () -> result.getNodeVoltage("foo"));
        assertThrows(PowsyblException.class, () -> result.getBranchCurrent("foo"));
    }
}
