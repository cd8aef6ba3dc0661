/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc;

import org.jcircuit.dc.network.Circuit;

import java.util.Objects;

/**
 * Entry point of DC circuit analysis. Both analyses reject circuits holding components which are not
 * supported by linear DC analysis.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public class DcCircuitAnalysis {

    private final DcSolverParameters parameters;

    public DcCircuitAnalysis() {
        this(new DcSolverParameters());
    }

    public DcCircuitAnalysis(DcSolverParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public DcSolverParameters getParameters() {
        return parameters;
    }

    public AnalysisMethod selectMethod(Circuit circuit) {
        return CircuitClassifier.selectMethod(circuit.getComponents());
    }

    public DcCircuitResult runDc(Circuit circuit) {
        Objects.requireNonNull(circuit);
        CircuitClassifier.checkDcEligible(circuit.getComponents());
        return new DcCircuitEngine(parameters).run(circuit);
    }

    public TheveninResult runThevenin(Circuit circuit, TheveninPort port) {
        Objects.requireNonNull(circuit);
        CircuitClassifier.checkDcEligible(circuit.getComponents());
        return new TheveninAnalyzer(parameters).analyze(circuit, port);
    }
}
