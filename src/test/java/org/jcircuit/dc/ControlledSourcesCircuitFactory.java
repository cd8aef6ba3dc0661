/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc;

import org.jcircuit.dc.network.Circuit;

/**
 * A circuit holding a VCVS, a VCCS, a CCCS and a current probe.
 *
 * <ul>
 *     <li>V1 (12 V) feeds R1 (1k), CP1 and R2 (2k) in series: V(b) = V(c) = 8 V, I(CP1) = 4 mA</li>
 *     <li>E1 (VCVS, gain 2, controlled by V(c)) sets V(d) = 16 V</li>
 *     <li>R3 (500) from d to e, G1 (VCCS, 1 mS, controlled by V(b)) and R4 (1k) from e to ground: V(e) = 8 V</li>
 *     <li>F1 (CCCS, gain 0.5, controlled by the current of CP1) drives R5 (100): V(f) = -0.2 V</li>
 * </ul>
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public class ControlledSourcesCircuitFactory extends AbstractCircuitFactory {

    public static Circuit create() {
        return createCircuit(
                voltageSource("V1", "a", "gnd", 12),
                resistor("R1", "a", "b", 1000),
                currentProbe("CP1", "b", "c"),
                resistor("R2", "c", "gnd", 2000),
                vcvs("E1", "d", "gnd", "c", "gnd", 2),
                resistor("R3", "d", "e", 500),
                vccs("G1", "e", "gnd", "b", "gnd", 1e-3),
                resistor("R4", "e", "gnd", 1000),
                cccs("F1", "f", "gnd", "b", "c", 0.5),
                resistor("R5", "f", "gnd", 100),
                voltageProbe("VP1", "d"));
    }
}
