/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.equations;

/**
 * Control current of a current controlled source: {@code sign} times the current unknown of a voltage
 * defining branch.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public record ReferenceCurrent(Kind kind, int branchNum, double sign) {

    public enum Kind {
        /**
         * An existing voltage defining branch between the control nets carries the control current.
         */
        REUSED,
        /**
         * A zero volt sensing branch has been inserted between the control nets.
         */
        SYNTHESIZED,
    }

    public static ReferenceCurrent reused(int branchNum, double sign) {
        return new ReferenceCurrent(Kind.REUSED, branchNum, sign);
    }

    public static ReferenceCurrent synthesized(int branchNum, double sign) {
        return new ReferenceCurrent(Kind.SYNTHESIZED, branchNum, sign);
    }
}
