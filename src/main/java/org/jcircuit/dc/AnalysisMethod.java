/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc;

/**
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public enum AnalysisMethod {
    DC_NODE_VOLTAGE,
    THEVENIN,
    /**
     * Time domain simulation, required as soon as the circuit holds reactive or AC components. Not
     * provided by this library.
     */
    TRANSIENT,
}
