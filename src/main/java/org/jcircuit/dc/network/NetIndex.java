/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.network;

import org.jcircuit.dc.CircuitValidationException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Numbering of the non ground nets of a circuit. Nets are numbered from 0 in lexicographic order of
 * their names, the ground net has number {@link #GROUND_NUM}.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public class NetIndex {

    public static final int GROUND_NUM = -1;

    public static final String GROUND_ALIAS = "gnd";

    private final String groundNetName;

    private final List<String> nets;

    private final Map<String, Integer> numByName = new HashMap<>();

    NetIndex(String groundNetName, List<String> sortedNonGroundNets) {
        this.groundNetName = Objects.requireNonNull(groundNetName);
        this.nets = List.copyOf(sortedNonGroundNets);
        for (int num = 0; num < nets.size(); num++) {
            numByName.put(nets.get(num), num);
        }
    }

    public String getGroundNetName() {
        return groundNetName;
    }

    /**
     * Non ground net names, ordered by number.
     */
    public List<String> getNets() {
        return nets;
    }

    public int getNetCount() {
        return nets.size();
    }

    public String getNetName(int num) {
        return num == GROUND_NUM ? groundNetName : nets.get(num);
    }

    public boolean isGround(String name) {
        return groundNetName.equals(name) || GROUND_ALIAS.equals(name);
    }

    public boolean contains(String name) {
        return isGround(name) || numByName.containsKey(name);
    }

    /**
     * Map the ground alias to the declared ground net name.
     */
    public String resolveName(String name) {
        if (isGround(name)) {
            return groundNetName;
        }
        if (!numByName.containsKey(name)) {
            throw CircuitValidationException.topology("Unknown net '" + name + "'", CircuitValidationException.NET, name);
        }
        return name;
    }

    public int getNum(String name) {
        if (isGround(name)) {
            return GROUND_NUM;
        }
        Integer num = numByName.get(name);
        if (num == null) {
            throw CircuitValidationException.topology("Unknown net '" + name + "'", CircuitValidationException.NET, name);
        }
        return num;
    }
}
