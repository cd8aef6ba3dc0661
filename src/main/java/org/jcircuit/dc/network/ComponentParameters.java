/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.network;

/**
 * Parameter keys used by the component palette.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public final class ComponentParameters {

    public static final String VALUE = "value";
    public static final String DC = "dc";
    public static final String AMPLITUDE = "amplitude";
    public static final String FREQUENCY = "frequency";
    public static final String GAIN = "gain";

    private ComponentParameters() {
    }
}
