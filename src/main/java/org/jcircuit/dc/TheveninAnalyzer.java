/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc;

import org.jcircuit.dc.network.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Computes the Thevenin equivalent of a circuit seen from a port with two DC solves: the open circuit
 * voltage on the unmodified circuit, then the current through a small resistor shorting the port.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public class TheveninAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(TheveninAnalyzer.class);

    private static final String SHORT_RESISTOR_ID_PREFIX = "__thevenin_short";

    private final DcSolverParameters parameters;

    private final DcCircuitEngine engine;

    public TheveninAnalyzer(DcSolverParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
        this.engine = new DcCircuitEngine(parameters);
    }

    public TheveninResult analyze(Circuit circuit, TheveninPort port) {
        Objects.requireNonNull(circuit);
        Objects.requireNonNull(port);

        NetIndex netIndex = NetResolver.resolve(circuit);
        String positive = netIndex.resolveName(port.positive());
        String negative = netIndex.resolveName(port.negative());
        if (positive.equals(negative)) {
            throw CircuitValidationException.topology("Thevenin port nets must be distinct, both are '" + positive + "'",
                    CircuitValidationException.NET, positive);
        }

        DcCircuitResult openCircuitResult = engine.run(circuit);
        double vth = openCircuitResult.getNodeVoltage(positive) - openCircuitResult.getNodeVoltage(negative);

        String shortId = createShortResistorId(circuit);
        CircuitComponent shortResistor = new CircuitComponent(shortId, ComponentType.RESISTOR.getTag(),
                Map.of(ComponentParameters.VALUE, parameters.getTheveninShortResistance()),
                Map.of(Terminals.P, positive, Terminals.N, negative));
        DcCircuitResult shortCircuitResult = engine.run(circuit.withComponent(shortResistor));
        double isc = shortCircuitResult.getBranchCurrent(shortId);

        boolean openPort = Math.abs(isc) <= parameters.getTheveninOpenCurrentThreshold();
        double rth = openPort ? parameters.getTheveninOpenResistance() : Math.abs(vth / isc);

        LOGGER.debug("Thevenin equivalent of port ({}, {}): vth={}, isc={}, rth={}, open={}",
                positive, negative, vth, isc, rth, openPort);

        return new TheveninResult(vth, rth, isc, port, openPort);
    }

    private static String createShortResistorId(Circuit circuit) {
        String id = SHORT_RESISTOR_ID_PREFIX;
        int i = 1;
        while (circuit.getComponent(id).isPresent()) {
            id = SHORT_RESISTOR_ID_PREFIX + i++;
        }
        return id;
    }
}
