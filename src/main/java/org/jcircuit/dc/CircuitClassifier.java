/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc;

import org.jcircuit.dc.network.CircuitComponent;
import org.jcircuit.dc.network.ComponentType;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tells whether a circuit can be solved by linear DC analysis, only from the types of its components.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public final class CircuitClassifier {

    private static final Set<ComponentType> DC_ELIGIBLE_TYPES = EnumSet.of(
            ComponentType.RESISTOR,
            ComponentType.VSOURCE_DC,
            ComponentType.ISOURCE_DC,
            ComponentType.GROUND,
            ComponentType.VOLTAGE_PROBE,
            ComponentType.CURRENT_PROBE,
            ComponentType.VCVS,
            ComponentType.VCCS,
            ComponentType.CCVS,
            ComponentType.CCCS);

    private CircuitClassifier() {
    }

    public static boolean isDcEligible(ComponentType type) {
        return DC_ELIGIBLE_TYPES.contains(Objects.requireNonNull(type));
    }

    public static boolean isDcEligible(Collection<CircuitComponent> components) {
        return getDcIneligibleComponents(components).isEmpty();
    }

    public static List<CircuitComponent> getDcIneligibleComponents(Collection<CircuitComponent> components) {
        Objects.requireNonNull(components);
        return components.stream()
                .filter(c -> !isDcEligible(c.getComponentType()))
                .toList();
    }

    public static AnalysisMethod selectMethod(Collection<CircuitComponent> components) {
        return isDcEligible(components) ? AnalysisMethod.DC_NODE_VOLTAGE : AnalysisMethod.TRANSIENT;
    }

    public static void checkDcEligible(Collection<CircuitComponent> components) {
        List<CircuitComponent> ineligibleComponents = getDcIneligibleComponents(components);
        if (!ineligibleComponents.isEmpty()) {
            String ids = ineligibleComponents.stream().map(CircuitComponent::getId).collect(Collectors.joining(","));
            String types = ineligibleComponents.stream().map(CircuitComponent::getType).distinct().collect(Collectors.joining(","));
            throw CircuitValidationException.eligibility("Components " + ineligibleComponents.stream()
                            .map(c -> c.getId() + " (" + c.getType() + ")")
                            .collect(Collectors.joining(", ")) + " are not supported by DC analysis",
                    CircuitValidationException.COMPONENT, ids,
                    CircuitValidationException.TYPE, types);
        }
    }
}
