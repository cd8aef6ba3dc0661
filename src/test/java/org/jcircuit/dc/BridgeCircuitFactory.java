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

import java.util.ArrayList;
import java.util.List;

/**
 * Resistive bridge fed by a 10 V source: R1 (1k) a-c, R2 (2k) c-gnd, R3 (3k) a-d, R4 (1k) d-gnd. Seen from
 * port (c, d): Vth = 25/6 V, Rth = 4250/3 ohms.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public class BridgeCircuitFactory extends AbstractCircuitFactory {

    public static final double VTH = 25.0 / 6;

    public static final double RTH = 4250.0 / 3;

    public static Circuit create() {
        return createCircuit(createComponents());
    }

    /**
     * The bridge with a load resistor across port (c, d).
     */
    public static Circuit createLoaded(double loadResistance) {
        List<CircuitComponent> components = createComponents();
        components.add(resistor("RL", "c", "d", loadResistance));
        return createCircuit(components);
    }

    private static List<CircuitComponent> createComponents() {
        List<CircuitComponent> components = new ArrayList<>();
        components.add(voltageSource("V1", "a", "gnd", 10));
        components.add(resistor("R1", "a", "c", 1000));
        components.add(resistor("R2", "c", "gnd", 2000));
        components.add(resistor("R3", "a", "d", 3000));
        components.add(resistor("R4", "d", "gnd", 1000));
        components.add(ground("GND1", "gnd"));
        return components;
    }
}
