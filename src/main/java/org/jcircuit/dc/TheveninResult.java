/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc;

import java.util.Objects;

/**
 * @param vth open circuit voltage of the port
 * @param rth equivalent resistance, the open port resistance sentinel when no current flows through the shorted port
 * @param shortCircuitCurrent current through the port short, from positive to negative net
 * @param openPort true if the shorted port carries no current
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public record TheveninResult(double vth, double rth, double shortCircuitCurrent, TheveninPort port, boolean openPort) {

    public TheveninResult {
        Objects.requireNonNull(port);
    }
}
