/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.network;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A set of terminals held at the same potential.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public class CircuitNet {

    private final String name;

    private final List<TerminalRef> nodes;

    public CircuitNet(String name, List<TerminalRef> nodes) {
        this.name = Objects.requireNonNull(name);
        this.nodes = List.copyOf(nodes);
    }

    public String getName() {
        return name;
    }

    public List<TerminalRef> getNodes() {
        return nodes;
    }

    CircuitNet withNode(TerminalRef node) {
        List<TerminalRef> newNodes = new ArrayList<>(nodes);
        newNodes.add(node);
        return new CircuitNet(name, newNodes);
    }

    @Override
    public String toString() {
        return "CircuitNet(name=" + name + ", nodes=" + nodes + ")";
    }
}
