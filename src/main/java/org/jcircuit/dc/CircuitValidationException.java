/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc;

import com.powsybl.commons.PowsyblException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Raised when a circuit description cannot be analysed. The context map names the offending
 * component, net, terminal or parameter so that a precise message can be rendered to the user.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public class CircuitValidationException extends PowsyblException {

    public static final String COMPONENT = "component";
    public static final String NET = "net";
    public static final String TERMINAL = "terminal";
    public static final String PARAMETER = "parameter";
    public static final String TYPE = "type";
    public static final String MISSING = "missing";

    public enum Category {
        /**
         * Net with less than two members, missing or ambiguous ground, reference to an undeclared net or component.
         */
        TOPOLOGY,
        /**
         * Unknown component type, missing parameter, unconnected terminal.
         */
        SCHEMA,
        /**
         * Component type not supported by the requested analysis.
         */
        ELIGIBILITY,
    }

    private final Category category;

    private final Map<String, String> context;

    public CircuitValidationException(Category category, String message, Map<String, String> context) {
        super(message);
        this.category = Objects.requireNonNull(category);
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static CircuitValidationException topology(String message, String... context) {
        return new CircuitValidationException(Category.TOPOLOGY, message, toMap(context));
    }

    public static CircuitValidationException schema(String message, String... context) {
        return new CircuitValidationException(Category.SCHEMA, message, toMap(context));
    }

    public static CircuitValidationException eligibility(String message, String... context) {
        return new CircuitValidationException(Category.ELIGIBILITY, message, toMap(context));
    }

    private static Map<String, String> toMap(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Context must be given as key/value pairs");
        }
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    public Category getCategory() {
        return category;
    }

    public Map<String, String> getContext() {
        return context;
    }
}
