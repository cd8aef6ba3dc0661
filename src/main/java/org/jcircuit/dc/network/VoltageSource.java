/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.network;

/**
 * Independent voltage source. A current probe is modeled as a zero volt source.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public record VoltageSource(String id, int pos, int neg, double voltage, Kind kind) implements DcElement {

    public enum Kind {
        SOURCE,
        CURRENT_PROBE,
    }
}
