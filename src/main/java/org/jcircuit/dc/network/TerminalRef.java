/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.network;

import java.util.Objects;

/**
 * A terminal of a component, identified by the component id and the terminal name.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public record TerminalRef(String componentId, String terminal) {

    public TerminalRef {
        Objects.requireNonNull(componentId);
        Objects.requireNonNull(terminal);
    }

    public static TerminalRef of(String componentId, String terminal) {
        return new TerminalRef(componentId, terminal);
    }

    @Override
    public String toString() {
        return componentId + ":" + terminal;
    }
}
