/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc;

import org.jcircuit.dc.network.NetIndex;

import java.util.Objects;

/**
 * The pair of nets a Thevenin equivalent is seen from.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public record TheveninPort(String positive, String negative) {

    public TheveninPort {
        Objects.requireNonNull(positive);
        Objects.requireNonNull(negative);
    }

    /**
     * Port between a net and ground.
     */
    public static TheveninPort of(String positive) {
        return new TheveninPort(positive, NetIndex.GROUND_ALIAS);
    }

    public static TheveninPort of(String positive, String negative) {
        return new TheveninPort(positive, negative);
    }
}
