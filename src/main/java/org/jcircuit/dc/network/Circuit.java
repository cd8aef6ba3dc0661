/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.network;

import org.jcircuit.dc.CircuitValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the components of a circuit and of the nets connecting their terminals.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public class Circuit {

    private final List<CircuitComponent> components;

    private final List<CircuitNet> nets;

    public Circuit(List<CircuitComponent> components, List<CircuitNet> nets) {
        this.components = List.copyOf(components);
        this.nets = List.copyOf(nets);
    }

    public List<CircuitComponent> getComponents() {
        return components;
    }

    public List<CircuitNet> getNets() {
        return nets;
    }

    public Optional<CircuitComponent> getComponent(String id) {
        return components.stream().filter(c -> c.getId().equals(id)).findFirst();
    }

    public Optional<CircuitNet> getNet(String name) {
        return nets.stream().filter(n -> n.getName().equals(name)).findFirst();
    }

    /**
     * Copy of this circuit with an additional component, its terminals being appended to the nets
     * named by its connections.
     */
    public Circuit withComponent(CircuitComponent component) {
        List<CircuitComponent> newComponents = new ArrayList<>(components);
        newComponents.add(component);
        List<CircuitNet> newNets = new ArrayList<>(nets);
        for (Map.Entry<String, String> e : component.getConnections().entrySet()) {
            String terminal = e.getKey();
            String netName = e.getValue();
            int i = indexOfNet(newNets, netName);
            if (i == -1) {
                throw CircuitValidationException.topology("Component '" + component.getId() + "' references unknown net '" + netName + "'",
                        CircuitValidationException.COMPONENT, component.getId(),
                        CircuitValidationException.NET, netName);
            }
            newNets.set(i, newNets.get(i).withNode(TerminalRef.of(component.getId(), terminal)));
        }
        return new Circuit(newComponents, newNets);
    }

    /**
     * Copy of this circuit where the component with the same id is replaced.
     */
    public Circuit withReplacedComponent(CircuitComponent component) {
        List<CircuitComponent> newComponents = new ArrayList<>(components.size());
        for (CircuitComponent c : components) {
            newComponents.add(c.getId().equals(component.getId()) ? component : c);
        }
        return new Circuit(newComponents, nets);
    }

    private static int indexOfNet(List<CircuitNet> nets, String name) {
        for (int i = 0; i < nets.size(); i++) {
            if (nets.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }
}
