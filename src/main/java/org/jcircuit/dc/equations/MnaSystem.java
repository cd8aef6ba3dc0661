/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.equations;

import com.powsybl.math.matrix.DenseMatrix;
import org.jcircuit.dc.network.DcElement;
import org.jcircuit.dc.network.NetIndex;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Modified nodal analysis linear system {@code A x = b}.
 *
 * <p>Unknowns 0 to {@code netCount - 1} are the voltages of the non ground nets, in {@link NetIndex} order,
 * unknowns {@code netCount} to {@code netCount + branchCount - 1} are the currents of the voltage defining
 * branches. Row {@code i} of a net is its current balance (sum of currents leaving the net), row
 * {@code netCount + k} is the constraint of branch {@code k}.</p>
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public class MnaSystem {

    private final NetIndex netIndex;

    private final List<DcElement> elements;

    private final List<VoltageBranch> branches;

    private final Map<String, VoltageBranch> branchByElementId = new HashMap<>();

    private final Map<String, ReferenceCurrent> referenceCurrents;

    private final DenseMatrix matrix;

    private final double[] rhs;

    MnaSystem(NetIndex netIndex, List<DcElement> elements, List<VoltageBranch> branches,
              Map<String, ReferenceCurrent> referenceCurrents, DenseMatrix matrix, double[] rhs) {
        this.netIndex = Objects.requireNonNull(netIndex);
        this.elements = List.copyOf(elements);
        this.branches = List.copyOf(branches);
        this.referenceCurrents = Collections.unmodifiableMap(new LinkedHashMap<>(referenceCurrents));
        this.matrix = Objects.requireNonNull(matrix);
        this.rhs = Objects.requireNonNull(rhs);
        for (VoltageBranch branch : branches) {
            if (!branch.isSynthetic()) {
                branchByElementId.put(branch.elementId(), branch);
            }
        }
    }

    public NetIndex getNetIndex() {
        return netIndex;
    }

    public List<DcElement> getElements() {
        return elements;
    }

    public List<VoltageBranch> getBranches() {
        return branches;
    }

    public Optional<VoltageBranch> getBranch(String elementId) {
        return Optional.ofNullable(branchByElementId.get(elementId));
    }

    /**
     * Control current of each current controlled source, by element id.
     */
    public Map<String, ReferenceCurrent> getReferenceCurrents() {
        return referenceCurrents;
    }

    public int getNetCount() {
        return netIndex.getNetCount();
    }

    public int getBranchCount() {
        return branches.size();
    }

    public int getSize() {
        return getNetCount() + getBranchCount();
    }

    public int getBranchColumn(int branchNum) {
        return getNetCount() + branchNum;
    }

    public DenseMatrix getMatrix() {
        return matrix;
    }

    public double[] getRhs() {
        return rhs;
    }

    public List<String> getUnknownNames() {
        List<String> names = new ArrayList<>(getSize());
        for (String net : netIndex.getNets()) {
            names.add("V(" + net + ")");
        }
        for (VoltageBranch branch : branches) {
            names.add("I(" + branch.getName(netIndex) + ")");
        }
        return names;
    }

    public List<String> getRowNames() {
        List<String> names = new ArrayList<>(getSize());
        for (String net : netIndex.getNets()) {
            names.add("KCL(" + net + ")");
        }
        for (VoltageBranch branch : branches) {
            names.add("U(" + branch.getName(netIndex) + ")");
        }
        return names;
    }

    /**
     * One readable equation per row, for instance {@code KCL(a): 0.001*V(a) - 0.001*V(b) + 1.0*I(V1) = 0.0}.
     */
    public List<String> getEquations() {
        List<String> unknownNames = getUnknownNames();
        List<String> rowNames = getRowNames();
        List<String> equations = new ArrayList<>(getSize());
        for (int i = 0; i < getSize(); i++) {
            StringBuilder equation = new StringBuilder(rowNames.get(i)).append(": ");
            boolean first = true;
            for (int j = 0; j < getSize(); j++) {
                double a = matrix.get(i, j);
                if (a == 0) {
                    continue;
                }
                if (first) {
                    equation.append(a < 0 ? "-" : "");
                } else {
                    equation.append(a < 0 ? " - " : " + ");
                }
                equation.append(Math.abs(a)).append('*').append(unknownNames.get(j));
                first = false;
            }
            if (first) {
                equation.append('0');
            }
            equation.append(" = ").append(rhs[i]);
            equations.add(equation.toString());
        }
        return equations;
    }

    public String print() {
        ByteArrayOutputStream os = new ByteArrayOutputStream();
        try (PrintStream ps = new PrintStream(os, true, StandardCharsets.UTF_8)) {
            ps.println("rows=" + getRowNames());
            ps.println("unknowns=" + getUnknownNames());
            ps.println("A=");
            matrix.print(ps);
            ps.println("b=");
            ps.println(Arrays.toString(rhs));
        }
        return os.toString(StandardCharsets.UTF_8);
    }
}
