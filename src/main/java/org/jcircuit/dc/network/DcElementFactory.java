/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.network;

import org.jcircuit.dc.CircuitValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static org.jcircuit.dc.network.ComponentParameters.*;
import static org.jcircuit.dc.network.Terminals.*;

/**
 * Builds the DC elements of a circuit from the supplied components, checking terminals and parameters
 * against the component palette.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public final class DcElementFactory {

    private DcElementFactory() {
    }

    public static List<DcElement> create(Circuit circuit, NetIndex netIndex) {
        Objects.requireNonNull(circuit);
        Objects.requireNonNull(netIndex);
        List<DcElement> elements = new ArrayList<>(circuit.getComponents().size());
        for (CircuitComponent component : circuit.getComponents()) {
            create(component, netIndex).ifPresent(elements::add);
        }
        return elements;
    }

    public static Optional<DcElement> create(CircuitComponent component, NetIndex netIndex) {
        ComponentType type = component.getComponentType();
        for (String terminal : type.getTerminals()) {
            component.getRequiredNet(terminal);
        }
        for (String parameter : type.getRequiredParameters()) {
            component.getRequiredParameter(parameter);
        }

        String id = component.getId();
        switch (type) {
            case RESISTOR:
                return Optional.of(new Resistor(id, num(component, P, netIndex), num(component, N, netIndex), getResistance(component)));

            case VSOURCE_DC:
                return Optional.of(new VoltageSource(id, num(component, POS, netIndex), num(component, NEG, netIndex),
                        component.getRequiredParameter(DC), VoltageSource.Kind.SOURCE));

            case CURRENT_PROBE:
                return Optional.of(new VoltageSource(id, num(component, P, netIndex), num(component, N, netIndex),
                        0, VoltageSource.Kind.CURRENT_PROBE));

            case ISOURCE_DC:
                return Optional.of(new CurrentSource(id, num(component, POS, netIndex), num(component, NEG, netIndex),
                        component.getRequiredParameter(DC)));

            case VCVS:
                return Optional.of(new Vcvs(id, num(component, POS, netIndex), num(component, NEG, netIndex),
                        num(component, CONTROL_POS, netIndex), num(component, CONTROL_NEG, netIndex), component.getRequiredParameter(GAIN)));

            case VCCS:
                return Optional.of(new Vccs(id, num(component, POS, netIndex), num(component, NEG, netIndex),
                        num(component, CONTROL_POS, netIndex), num(component, CONTROL_NEG, netIndex), component.getRequiredParameter(GAIN)));

            case CCVS:
                return Optional.of(new Ccvs(id, num(component, POS, netIndex), num(component, NEG, netIndex),
                        num(component, CONTROL_POS, netIndex), num(component, CONTROL_NEG, netIndex), component.getRequiredParameter(GAIN)));

            case CCCS:
                return Optional.of(new Cccs(id, num(component, POS, netIndex), num(component, NEG, netIndex),
                        num(component, CONTROL_POS, netIndex), num(component, CONTROL_NEG, netIndex), component.getRequiredParameter(GAIN)));

            case GROUND, VOLTAGE_PROBE:
                return Optional.empty();

            default:
                throw CircuitValidationException.eligibility("Component '" + id + "' of type '" + type.getTag() + "' is not supported by DC analysis",
                        CircuitValidationException.COMPONENT, id,
                        CircuitValidationException.TYPE, type.getTag());
        }
    }

    private static double getResistance(CircuitComponent component) {
        double resistance = component.getRequiredParameter(VALUE);
        if (resistance == 0) {
            throw CircuitValidationException.schema("Resistance of component '" + component.getId() + "' must not be zero",
                    CircuitValidationException.COMPONENT, component.getId(),
                    CircuitValidationException.PARAMETER, VALUE);
        }
        return resistance;
    }

    private static int num(CircuitComponent component, String terminal, NetIndex netIndex) {
        return netIndex.getNum(component.getRequiredNet(terminal));
    }
}
