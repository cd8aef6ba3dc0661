/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.network;

/**
 * Electrical element taking part in the DC equations. Net numbers are those of {@link NetIndex},
 * {@link NetIndex#GROUND_NUM} standing for the ground net.
 *
 * <p>Ground and voltage probe components have no element: they do not contribute to the equations.</p>
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public sealed interface DcElement permits Resistor, CurrentSource, VoltageSource, Vcvs, Vccs, Ccvs, Cccs {

    String id();

    /**
     * Net number of the positive terminal of the element (output positive for controlled sources).
     */
    int pos();

    /**
     * Net number of the negative terminal of the element (output negative for controlled sources).
     */
    int neg();
}
