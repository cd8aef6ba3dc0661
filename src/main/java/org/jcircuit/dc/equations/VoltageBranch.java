/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.equations;

import org.jcircuit.dc.network.NetIndex;

/**
 * A voltage defining branch of the MNA system. Each branch owns one constraint row and one current
 * unknown, the current flowing from {@code pos} to {@code neg} through the branch.
 *
 * @param num branch number, the unknown being at column {@code netCount + num}
 * @param elementId id of the element owning the branch, {@code null} for a sensing branch
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public record VoltageBranch(int num, String elementId, int pos, int neg, Kind kind) {

    public enum Kind {
        VOLTAGE_SOURCE,
        CURRENT_PROBE,
        VCVS,
        CCVS,
        /**
         * Zero volt branch synthesized to measure the control current of a current controlled source.
         */
        SENSING,
    }

    public boolean isSynthetic() {
        return kind == Kind.SENSING;
    }

    /**
     * True if the branch connects the given nets, in any direction.
     */
    public boolean connects(int net1, int net2) {
        return pos == net1 && neg == net2 || pos == net2 && neg == net1;
    }

    public String getName(NetIndex netIndex) {
        return isSynthetic() ? "sense(" + netIndex.getNetName(pos) + "," + netIndex.getNetName(neg) + ")" : elementId;
    }
}
