/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.network;

import org.jcircuit.dc.CircuitValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A component of the circuit as supplied by the caller: an id, a type tag, real valued parameters and
 * the net each terminal is connected to. Immutable.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public class CircuitComponent {

    private final String id;

    private final String type;

    private final Map<String, Double> parameters;

    private final Map<String, String> connections;

    public CircuitComponent(String id, String type, Map<String, Double> parameters, Map<String, String> connections) {
        this.id = Objects.requireNonNull(id);
        this.type = Objects.requireNonNull(type);
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(parameters)));
        this.connections = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(connections)));
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public ComponentType getComponentType() {
        return ComponentType.fromTag(id, type);
    }

    public Map<String, Double> getParameters() {
        return parameters;
    }

    /**
     * Terminal name to net name.
     */
    public Map<String, String> getConnections() {
        return connections;
    }

    public Optional<String> getNet(String terminal) {
        return Optional.ofNullable(connections.get(terminal));
    }

    public double getRequiredParameter(String key) {
        Double value = parameters.get(key);
        if (value == null) {
            throw CircuitValidationException.schema("Missing parameter '" + key + "' on component '" + id + "'",
                    CircuitValidationException.COMPONENT, id,
                    CircuitValidationException.PARAMETER, key);
        }
        if (!Double.isFinite(value)) {
            throw CircuitValidationException.schema("Parameter '" + key + "' of component '" + id + "' is not a finite number",
                    CircuitValidationException.COMPONENT, id,
                    CircuitValidationException.PARAMETER, key);
        }
        return value;
    }

    public String getRequiredNet(String terminal) {
        return getNet(terminal).orElseThrow(() -> CircuitValidationException.schema("Terminal '" + terminal + "' of component '" + id + "' is not connected",
                CircuitValidationException.COMPONENT, id,
                CircuitValidationException.TERMINAL, terminal));
    }

    /**
     * Copy of this component with different parameter values, connections unchanged.
     */
    public CircuitComponent withParameters(Map<String, Double> newParameters) {
        return new CircuitComponent(id, type, newParameters, connections);
    }

    @Override
    public String toString() {
        return "CircuitComponent(id=" + id
                + ", type=" + type
                + ", parameters=" + parameters
                + ", connections=" + connections
                + ")";
    }
}
