/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.network;

import org.jcircuit.dc.CircuitValidationException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.jcircuit.dc.network.ComponentParameters.*;
import static org.jcircuit.dc.network.Terminals.*;

/**
 * Component palette: type tag, terminal names and required parameters of each component kind.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public enum ComponentType {
    RESISTOR("resistor", List.of(P, N), List.of(VALUE)),
    CAPACITOR("capacitor", List.of(P, N), List.of(VALUE)),
    INDUCTOR("inductor", List.of(P, N), List.of(VALUE)),
    VSOURCE_DC("vsource_dc", List.of(POS, NEG), List.of(DC)),
    VSOURCE_AC("vsource_ac", List.of(POS, NEG), List.of(AMPLITUDE, FREQUENCY)),
    ISOURCE_DC("isource_dc", List.of(POS, NEG), List.of(DC)),
    ISOURCE_AC("isource_ac", List.of(POS, NEG), List.of(AMPLITUDE, FREQUENCY)),
    VCVS("vcvs", List.of(POS, NEG, CONTROL_POS, CONTROL_NEG), List.of(GAIN)),
    CCVS("ccvs", List.of(POS, NEG, CONTROL_POS, CONTROL_NEG), List.of(GAIN)),
    VCCS("vccs", List.of(POS, NEG, CONTROL_POS, CONTROL_NEG), List.of(GAIN)),
    CCCS("cccs", List.of(POS, NEG, CONTROL_POS, CONTROL_NEG), List.of(GAIN)),
    GROUND("ground", List.of(GND), List.of()),
    VOLTAGE_PROBE("voltage_probe", List.of(NODE), List.of()),
    CURRENT_PROBE("current_probe", List.of(P, N), List.of());

    private static final Map<String, ComponentType> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toMap(ComponentType::getTag, Function.identity()));

    private final String tag;

    private final List<String> terminals;

    private final List<String> requiredParameters;

    ComponentType(String tag, List<String> terminals, List<String> requiredParameters) {
        this.tag = tag;
        this.terminals = terminals;
        this.requiredParameters = requiredParameters;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Terminal names, output port first for two-port elements.
     */
    public List<String> getTerminals() {
        return terminals;
    }

    public List<String> getRequiredParameters() {
        return requiredParameters;
    }

    public boolean hasTerminal(String terminal) {
        return terminals.contains(terminal);
    }

    public static Optional<ComponentType> find(String tag) {
        return Optional.ofNullable(BY_TAG.get(tag));
    }

    public static ComponentType fromTag(String componentId, String tag) {
        return find(tag).orElseThrow(() -> CircuitValidationException.schema("Unsupported component type '" + tag + "'",
                CircuitValidationException.COMPONENT, componentId,
                CircuitValidationException.TYPE, tag));
    }
}
