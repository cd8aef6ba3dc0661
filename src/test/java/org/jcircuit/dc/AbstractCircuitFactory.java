/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc;

import org.jcircuit.dc.network.*;

import java.util.*;

import static org.jcircuit.dc.network.ComponentParameters.*;
import static org.jcircuit.dc.network.Terminals.*;

/**
 * Helpers to build test circuits: components are created with their connections and nets are derived from
 * the connections, in order of first appearance.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public abstract class AbstractCircuitFactory {

    public static Circuit createCircuit(CircuitComponent... components) {
        return createCircuit(Arrays.asList(components));
    }

    public static Circuit createCircuit(List<CircuitComponent> components) {
        Map<String, List<TerminalRef>> nodesByNet = new LinkedHashMap<>();
        for (CircuitComponent component : components) {
            for (Map.Entry<String, String> e : component.getConnections().entrySet()) {
                nodesByNet.computeIfAbsent(e.getValue(), k -> new ArrayList<>())
                        .add(TerminalRef.of(component.getId(), e.getKey()));
            }
        }
        List<CircuitNet> nets = new ArrayList<>();
        nodesByNet.forEach((name, nodes) -> nets.add(new CircuitNet(name, nodes)));
        return new Circuit(components, nets);
    }

    public static CircuitComponent resistor(String id, String p, String n, double resistance) {
        return new CircuitComponent(id, ComponentType.RESISTOR.getTag(), Map.of(VALUE, resistance), connections(P, p, N, n));
    }

    public static CircuitComponent capacitor(String id, String p, String n, double capacitance) {
        return new CircuitComponent(id, ComponentType.CAPACITOR.getTag(), Map.of(VALUE, capacitance), connections(P, p, N, n));
    }

    public static CircuitComponent voltageSource(String id, String pos, String neg, double voltage) {
        return new CircuitComponent(id, ComponentType.VSOURCE_DC.getTag(), Map.of(DC, voltage), connections(POS, pos, NEG, neg));
    }

    public static CircuitComponent currentSource(String id, String pos, String neg, double current) {
        return new CircuitComponent(id, ComponentType.ISOURCE_DC.getTag(), Map.of(DC, current), connections(POS, pos, NEG, neg));
    }

    public static CircuitComponent vcvs(String id, String pos, String neg, String cp, String cn, double gain) {
        return controlledSource(ComponentType.VCVS, id, pos, neg, cp, cn, gain);
    }

    public static CircuitComponent vccs(String id, String pos, String neg, String cp, String cn, double gain) {
        return controlledSource(ComponentType.VCCS, id, pos, neg, cp, cn, gain);
    }

    public static CircuitComponent ccvs(String id, String pos, String neg, String cp, String cn, double gain) {
        return controlledSource(ComponentType.CCVS, id, pos, neg, cp, cn, gain);
    }

    public static CircuitComponent cccs(String id, String pos, String neg, String cp, String cn, double gain) {
        return controlledSource(ComponentType.CCCS, id, pos, neg, cp, cn, gain);
    }

    private static CircuitComponent controlledSource(ComponentType type, String id, String pos, String neg, String cp, String cn, double gain) {
        Map<String, String> connections = new LinkedHashMap<>();
        connections.put(POS, pos);
        connections.put(NEG, neg);
        connections.put(CONTROL_POS, cp);
        connections.put(CONTROL_NEG, cn);
        return new CircuitComponent(id, type.getTag(), Map.of(GAIN, gain), connections);
    }

    public static CircuitComponent ground(String id, String net) {
        return new CircuitComponent(id, ComponentType.GROUND.getTag(), Map.of(), Map.of(GND, net));
    }

    public static CircuitComponent voltageProbe(String id, String net) {
        return new CircuitComponent(id, ComponentType.VOLTAGE_PROBE.getTag(), Map.of(), Map.of(NODE, net));
    }

    public static CircuitComponent currentProbe(String id, String p, String n) {
        return new CircuitComponent(id, ComponentType.CURRENT_PROBE.getTag(), Map.of(), connections(P, p, N, n));
    }

    private static Map<String, String> connections(String terminal1, String net1, String terminal2, String net2) {
        Map<String, String> connections = new LinkedHashMap<>();
        connections.put(terminal1, net1);
        connections.put(terminal2, net2);
        return connections;
    }
}
