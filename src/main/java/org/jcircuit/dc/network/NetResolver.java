/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.network;

import org.jcircuit.dc.CircuitValidationException;
import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.Pseudograph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Validates the nets of a circuit and numbers them.
 *
 * <p>The ground net is the net named {@value NetIndex#GROUND_ALIAS} if any, otherwise the net holding the
 * terminal of the ground components. All ground components must agree on a single net.</p>
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public final class NetResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetResolver.class);

    private NetResolver() {
    }

    public static NetIndex resolve(Circuit circuit) {
        Objects.requireNonNull(circuit);
        if (circuit.getComponents().isEmpty()) {
            throw CircuitValidationException.topology("Circuit is empty");
        }
        if (circuit.getNets().isEmpty()) {
            throw CircuitValidationException.topology("No net declared");
        }

        Map<String, CircuitComponent> componentsById = indexComponents(circuit);
        Map<String, CircuitNet> netsByName = indexNets(circuit);
        Map<TerminalRef, String> netByTerminal = checkNetMembers(circuit, componentsById);
        checkConnections(componentsById, netsByName, netByTerminal);

        String groundNetName = findGroundNet(netsByName, componentsById);

        List<String> nonGroundNets = new ArrayList<>(netsByName.keySet());
        nonGroundNets.remove(groundNetName);
        Collections.sort(nonGroundNets);

        NetIndex netIndex = new NetIndex(groundNetName, nonGroundNets);

        LOGGER.debug("Circuit has {} components, {} nets, ground net is '{}'",
                componentsById.size(), netsByName.size(), groundNetName);

        logFloatingNets(circuit, groundNetName);

        return netIndex;
    }

    private static Map<String, CircuitComponent> indexComponents(Circuit circuit) {
        Map<String, CircuitComponent> componentsById = new LinkedHashMap<>();
        for (CircuitComponent component : circuit.getComponents()) {
            if (componentsById.put(component.getId(), component) != null) {
                throw CircuitValidationException.topology("Duplicate component id '" + component.getId() + "'",
                        CircuitValidationException.COMPONENT, component.getId());
            }
            // fail early on unknown types
            component.getComponentType();
        }
        return componentsById;
    }

    private static Map<String, CircuitNet> indexNets(Circuit circuit) {
        Map<String, CircuitNet> netsByName = new LinkedHashMap<>();
        for (CircuitNet net : circuit.getNets()) {
            if (netsByName.put(net.getName(), net) != null) {
                throw CircuitValidationException.topology("Duplicate net '" + net.getName() + "'",
                        CircuitValidationException.NET, net.getName());
            }
            if (net.getNodes().size() < 2) {
                throw CircuitValidationException.topology("Net '" + net.getName() + "' has less than 2 terminals",
                        CircuitValidationException.NET, net.getName());
            }
        }
        return netsByName;
    }

    private static Map<TerminalRef, String> checkNetMembers(Circuit circuit, Map<String, CircuitComponent> componentsById) {
        Map<TerminalRef, String> netByTerminal = new HashMap<>();
        for (CircuitNet net : circuit.getNets()) {
            for (TerminalRef node : net.getNodes()) {
                CircuitComponent component = componentsById.get(node.componentId());
                if (component == null) {
                    throw CircuitValidationException.topology("Net '" + net.getName() + "' references unknown component '" + node.componentId() + "'",
                            CircuitValidationException.NET, net.getName(),
                            CircuitValidationException.COMPONENT, node.componentId());
                }
                if (!component.getComponentType().hasTerminal(node.terminal())) {
                    throw CircuitValidationException.topology("Net '" + net.getName() + "' references unknown terminal '" + node + "'",
                            CircuitValidationException.NET, net.getName(),
                            CircuitValidationException.COMPONENT, node.componentId(),
                            CircuitValidationException.TERMINAL, node.terminal());
                }
                String otherNet = netByTerminal.put(node, net.getName());
                if (otherNet != null && !otherNet.equals(net.getName())) {
                    throw CircuitValidationException.topology("Terminal '" + node + "' belongs to nets '" + otherNet + "' and '" + net.getName() + "'",
                            CircuitValidationException.NET, net.getName(),
                            CircuitValidationException.COMPONENT, node.componentId(),
                            CircuitValidationException.TERMINAL, node.terminal());
                }
                String declaredNet = component.getConnections().get(node.terminal());
                if (declaredNet != null && !declaredNet.equals(net.getName())) {
                    throw CircuitValidationException.topology("Terminal '" + node + "' is declared on net '" + declaredNet + "' but listed in net '" + net.getName() + "'",
                            CircuitValidationException.NET, net.getName(),
                            CircuitValidationException.COMPONENT, node.componentId(),
                            CircuitValidationException.TERMINAL, node.terminal());
                }
            }
        }
        return netByTerminal;
    }

    private static void checkConnections(Map<String, CircuitComponent> componentsById, Map<String, CircuitNet> netsByName,
                                         Map<TerminalRef, String> netByTerminal) {
        for (CircuitComponent component : componentsById.values()) {
            ComponentType type = component.getComponentType();
            for (Map.Entry<String, String> e : component.getConnections().entrySet()) {
                String terminal = e.getKey();
                String netName = e.getValue();
                if (!type.hasTerminal(terminal)) {
                    throw CircuitValidationException.schema("Component '" + component.getId() + "' of type '" + type.getTag() + "' has no terminal '" + terminal + "'",
                            CircuitValidationException.COMPONENT, component.getId(),
                            CircuitValidationException.TERMINAL, terminal);
                }
                if (!netsByName.containsKey(netName)) {
                    throw CircuitValidationException.topology("Component '" + component.getId() + "' references unknown net '" + netName + "'",
                            CircuitValidationException.COMPONENT, component.getId(),
                            CircuitValidationException.NET, netName);
                }
                if (!netName.equals(netByTerminal.get(TerminalRef.of(component.getId(), terminal)))) {
                    throw CircuitValidationException.topology("Terminal '" + component.getId() + ":" + terminal + "' is not a member of net '" + netName + "'",
                            CircuitValidationException.COMPONENT, component.getId(),
                            CircuitValidationException.TERMINAL, terminal,
                            CircuitValidationException.NET, netName);
                }
            }
        }
    }

    private static String findGroundNet(Map<String, CircuitNet> netsByName, Map<String, CircuitComponent> componentsById) {
        Set<String> groundComponentNets = new TreeSet<>();
        for (CircuitNet net : netsByName.values()) {
            for (TerminalRef node : net.getNodes()) {
                if (componentsById.get(node.componentId()).getComponentType() == ComponentType.GROUND) {
                    groundComponentNets.add(net.getName());
                }
            }
        }

        if (netsByName.containsKey(NetIndex.GROUND_ALIAS)) {
            if (!groundComponentNets.isEmpty() && !groundComponentNets.equals(Set.of(NetIndex.GROUND_ALIAS))) {
                throw CircuitValidationException.topology("Ground components are connected to nets " + groundComponentNets
                                + " which disagree with net '" + NetIndex.GROUND_ALIAS + "'",
                        CircuitValidationException.NET, String.join(",", groundComponentNets));
            }
            return NetIndex.GROUND_ALIAS;
        }
        if (groundComponentNets.isEmpty()) {
            throw CircuitValidationException.topology("Circuit has no ground",
                    CircuitValidationException.MISSING, "ground");
        }
        if (groundComponentNets.size() > 1) {
            throw CircuitValidationException.topology("Ground components are connected to several nets " + groundComponentNets,
                    CircuitValidationException.NET, String.join(",", groundComponentNets));
        }
        return groundComponentNets.iterator().next();
    }

    private static void logFloatingNets(Circuit circuit, String groundNetName) {
        if (!LOGGER.isWarnEnabled()) {
            return;
        }
        Graph<String, Object> graph = new Pseudograph<>(null, null, false);
        for (CircuitNet net : circuit.getNets()) {
            graph.addVertex(net.getName());
        }
        for (CircuitComponent component : circuit.getComponents()) {
            String firstNet = null;
            for (String terminal : component.getComponentType().getTerminals()) {
                String net = component.getConnections().get(terminal);
                if (net != null) {
                    if (firstNet == null) {
                        firstNet = net;
                    } else {
                        graph.addEdge(firstNet, net, new Object());
                    }
                }
            }
        }
        ConnectivityInspector<String, Object> inspector = new ConnectivityInspector<>(graph);
        Set<String> groundedNets = inspector.connectedSetOf(groundNetName);
        if (groundedNets.size() < graph.vertexSet().size()) {
            Set<String> floatingNets = new TreeSet<>(graph.vertexSet());
            floatingNets.removeAll(groundedNets);
            LOGGER.warn("Nets {} have no path to ground net '{}'", floatingNets, groundNetName);
        }
    }
}
