/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.network;

/**
 * Terminal names used by the component palette.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public final class Terminals {

    public static final String P = "p";
    public static final String N = "n";
    public static final String POS = "pos";
    public static final String NEG = "neg";
    public static final String CONTROL_POS = "cp";
    public static final String CONTROL_NEG = "cn";
    public static final String GND = "gnd";
    public static final String NODE = "node";

    private Terminals() {
    }
}
