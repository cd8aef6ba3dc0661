/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.network;

import org.apache.commons.lang3.tuple.Pair;
import org.jcircuit.dc.CircuitValidationException;
import org.jgrapht.alg.util.UnionFind;

import java.util.*;

/**
 * Builds a {@link Circuit} from components and the wires drawn between their terminals: terminals
 * linked by wires, directly or transitively, end up in the same net.
 *
 * <p>The net holding a ground component terminal is named {@value NetIndex#GROUND_ALIAS}, the other nets
 * are named {@code n1}, {@code n2}... in order of first appearance in the wire list.</p>
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public class NetBuilder {

    private final Map<String, Pair<ComponentType, Map<String, Double>>> components = new LinkedHashMap<>();

    private final List<Pair<TerminalRef, TerminalRef>> wires = new ArrayList<>();

    public NetBuilder addComponent(String id, String type, Map<String, Double> parameters) {
        Objects.requireNonNull(id);
        Objects.requireNonNull(parameters);
        if (components.containsKey(id)) {
            throw CircuitValidationException.topology("Duplicate component id '" + id + "'", CircuitValidationException.COMPONENT, id);
        }
        components.put(id, Pair.of(ComponentType.fromTag(id, type), parameters));
        return this;
    }

    public NetBuilder addWire(TerminalRef terminal1, TerminalRef terminal2) {
        wires.add(Pair.of(checkTerminal(terminal1), checkTerminal(terminal2)));
        return this;
    }

    public NetBuilder addWire(String componentId1, String terminal1, String componentId2, String terminal2) {
        return addWire(TerminalRef.of(componentId1, terminal1), TerminalRef.of(componentId2, terminal2));
    }

    private TerminalRef checkTerminal(TerminalRef terminal) {
        Objects.requireNonNull(terminal);
        Pair<ComponentType, Map<String, Double>> component = components.get(terminal.componentId());
        if (component == null) {
            throw CircuitValidationException.topology("Wire references unknown component '" + terminal.componentId() + "'",
                    CircuitValidationException.COMPONENT, terminal.componentId());
        }
        if (!component.getLeft().hasTerminal(terminal.terminal())) {
            throw CircuitValidationException.topology("Component '" + terminal.componentId() + "' has no terminal '" + terminal.terminal() + "'",
                    CircuitValidationException.COMPONENT, terminal.componentId(),
                    CircuitValidationException.TERMINAL, terminal.terminal());
        }
        return terminal;
    }

    public Circuit build() {
        Set<TerminalRef> terminals = new LinkedHashSet<>();
        for (Pair<TerminalRef, TerminalRef> wire : wires) {
            terminals.add(wire.getLeft());
            terminals.add(wire.getRight());
        }
        UnionFind<TerminalRef> unionFind = new UnionFind<>(terminals);
        for (Pair<TerminalRef, TerminalRef> wire : wires) {
            unionFind.union(wire.getLeft(), wire.getRight());
        }

        // group terminals by representative, keeping the order of first appearance
        Map<TerminalRef, List<TerminalRef>> groups = new LinkedHashMap<>();
        for (TerminalRef terminal : terminals) {
            groups.computeIfAbsent(unionFind.find(terminal), k -> new ArrayList<>()).add(terminal);
        }

        List<CircuitNet> nets = new ArrayList<>(groups.size());
        Map<String, Map<String, String>> connections = new HashMap<>();
        int netNum = 1;
        int groundNetCount = 0;
        for (List<TerminalRef> group : groups.values()) {
            boolean ground = group.stream().anyMatch(t -> components.get(t.componentId()).getLeft() == ComponentType.GROUND);
            String name;
            if (ground) {
                name = groundNetCount == 0 ? NetIndex.GROUND_ALIAS : NetIndex.GROUND_ALIAS + (groundNetCount + 1);
                groundNetCount++;
            } else {
                name = "n" + netNum++;
            }
            if (group.size() < 2) {
                throw CircuitValidationException.topology("Net '" + name + "' has less than 2 terminals",
                        CircuitValidationException.NET, name);
            }
            nets.add(new CircuitNet(name, group));
            for (TerminalRef terminal : group) {
                connections.computeIfAbsent(terminal.componentId(), k -> new LinkedHashMap<>()).put(terminal.terminal(), name);
            }
        }

        List<CircuitComponent> circuitComponents = new ArrayList<>(components.size());
        for (Map.Entry<String, Pair<ComponentType, Map<String, Double>>> e : components.entrySet()) {
            String id = e.getKey();
            circuitComponents.add(new CircuitComponent(id, e.getValue().getLeft().getTag(), e.getValue().getRight(),
                    connections.getOrDefault(id, Collections.emptyMap())));
        }
        return new Circuit(circuitComponents, nets);
    }
}
