/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc.equations;

import com.powsybl.math.matrix.DenseMatrix;
import org.apache.commons.lang3.tuple.Pair;
import org.jcircuit.dc.DcSolverParameters;
import org.jcircuit.dc.network.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Stamps the contribution of each DC element into the modified nodal analysis system.
 *
 * <p>Independent voltage sources, current probes, VCVS and CCVS each own a voltage defining branch.
 * The control current of a CCVS or CCCS is the current of the single voltage defining branch connecting
 * its control nets when there is exactly one, otherwise of a zero volt sensing branch synthesized between
 * the control nets (and shared by all controlled sources having the same control nets).</p>
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public class MnaSystemBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(MnaSystemBuilder.class);

    private final NetIndex netIndex;

    private final List<DcElement> elements;

    private final DcSolverParameters parameters;

    public MnaSystemBuilder(NetIndex netIndex, List<DcElement> elements, DcSolverParameters parameters) {
        this.netIndex = Objects.requireNonNull(netIndex);
        this.elements = List.copyOf(elements);
        this.parameters = Objects.requireNonNull(parameters);
    }

    public MnaSystem build() {
        List<VoltageBranch> branches = createElementBranches();
        Map<String, VoltageBranch> branchByElementId = new HashMap<>();
        for (VoltageBranch branch : branches) {
            branchByElementId.put(branch.elementId(), branch);
        }
        Map<String, ReferenceCurrent> referenceCurrents = resolveReferenceCurrents(branches);

        int netCount = netIndex.getNetCount();
        int size = netCount + branches.size();
        DenseMatrix a = new DenseMatrix(size, size);
        double[] b = new double[size];
        Stamper stamper = new Stamper(a, b, netCount);

        for (DcElement element : elements) {
            stamper.stamp(element, branchByElementId.get(element.id()), referenceCurrents.get(element.id()));
        }
        for (VoltageBranch branch : branches) {
            if (branch.isSynthetic()) {
                stamper.stampVoltageBranch(branch, 0);
            }
        }

        regularizeDuplicateBranches(branches, stamper);

        LOGGER.debug("MNA system built: {} nets, {} voltage defining branches ({} sensing)", netCount, branches.size(),
                branches.stream().filter(VoltageBranch::isSynthetic).count());

        MnaSystem system = new MnaSystem(netIndex, elements, branches, referenceCurrents, a, b);
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("{}", system.print());
        }
        return system;
    }

    private List<VoltageBranch> createElementBranches() {
        List<VoltageBranch> branches = new ArrayList<>();
        for (DcElement element : elements) {
            if (element instanceof VoltageSource source) {
                VoltageBranch.Kind kind = source.kind() == VoltageSource.Kind.CURRENT_PROBE ? VoltageBranch.Kind.CURRENT_PROBE : VoltageBranch.Kind.VOLTAGE_SOURCE;
                branches.add(new VoltageBranch(branches.size(), source.id(), source.pos(), source.neg(), kind));
            } else if (element instanceof Vcvs vcvs) {
                branches.add(new VoltageBranch(branches.size(), vcvs.id(), vcvs.pos(), vcvs.neg(), VoltageBranch.Kind.VCVS));
            } else if (element instanceof Ccvs ccvs) {
                branches.add(new VoltageBranch(branches.size(), ccvs.id(), ccvs.pos(), ccvs.neg(), VoltageBranch.Kind.CCVS));
            }
        }
        return branches;
    }

    /**
     * Resolve the control current of current controlled sources, appending the synthesized sensing
     * branches to the branch list.
     */
    private Map<String, ReferenceCurrent> resolveReferenceCurrents(List<VoltageBranch> branches) {
        Map<String, ReferenceCurrent> referenceCurrents = new LinkedHashMap<>();
        Map<Pair<Integer, Integer>, VoltageBranch> sensingBranches = new HashMap<>();
        int elementBranchCount = branches.size();
        for (DcElement element : elements) {
            int controlPos;
            int controlNeg;
            if (element instanceof Ccvs ccvs) {
                controlPos = ccvs.controlPos();
                controlNeg = ccvs.controlNeg();
            } else if (element instanceof Cccs cccs) {
                controlPos = cccs.controlPos();
                controlNeg = cccs.controlNeg();
            } else {
                continue;
            }

            List<VoltageBranch> candidates = new ArrayList<>(1);
            for (VoltageBranch branch : branches.subList(0, elementBranchCount)) {
                if (!branch.elementId().equals(element.id()) && branch.connects(controlPos, controlNeg)) {
                    candidates.add(branch);
                }
            }

            ReferenceCurrent referenceCurrent;
            if (candidates.size() == 1 && controlPos != controlNeg) {
                VoltageBranch reused = candidates.get(0);
                referenceCurrent = ReferenceCurrent.reused(reused.num(), reused.pos() == controlPos ? 1 : -1);
                LOGGER.debug("Control current of '{}' is the current of '{}'", element.id(), reused.elementId());
            } else {
                Pair<Integer, Integer> controlNets = Pair.of(Math.min(controlPos, controlNeg), Math.max(controlPos, controlNeg));
                VoltageBranch sensing = sensingBranches.computeIfAbsent(controlNets, k -> {
                    VoltageBranch branch = new VoltageBranch(branches.size(), null, controlPos, controlNeg, VoltageBranch.Kind.SENSING);
                    branches.add(branch);
                    return branch;
                });
                referenceCurrent = ReferenceCurrent.synthesized(sensing.num(), sensing.pos() == controlPos ? 1 : -1);
                LOGGER.debug("Control current of '{}' is measured by a sensing branch between nets '{}' and '{}' ({} candidate branches)",
                        element.id(), netIndex.getNetName(controlPos), netIndex.getNetName(controlNeg), candidates.size());
            }
            referenceCurrents.put(element.id(), referenceCurrent);
        }
        return referenceCurrents;
    }

    /**
     * Voltage defining branches in parallel make the system singular: all of them but the first get a
     * small term on the diagonal of their constraint row.
     */
    private void regularizeDuplicateBranches(List<VoltageBranch> branches, Stamper stamper) {
        Map<Pair<Integer, Integer>, List<VoltageBranch>> branchesByNets = new LinkedHashMap<>();
        for (VoltageBranch branch : branches) {
            Pair<Integer, Integer> nets = Pair.of(Math.min(branch.pos(), branch.neg()), Math.max(branch.pos(), branch.neg()));
            branchesByNets.computeIfAbsent(nets, k -> new ArrayList<>()).add(branch);
        }
        double epsilon = parameters.getDuplicateBranchRegularization();
        if (parameters.getDuplicateBranchRegularizationMode() == DcSolverParameters.RegularizationMode.SCALED) {
            epsilon *= stamper.getMaxAbsValue();
        }
        for (List<VoltageBranch> parallelBranches : branchesByNets.values()) {
            for (VoltageBranch branch : parallelBranches.subList(1, parallelBranches.size())) {
                int column = stamper.branchColumn(branch);
                stamper.add(column, column, epsilon);
                LOGGER.debug("Branch '{}' is parallel to '{}', regularized with {}", branch.getName(netIndex),
                        parallelBranches.get(0).getName(netIndex), epsilon);
            }
        }
    }

    private static final class Stamper {

        private final DenseMatrix a;

        private final double[] b;

        private final int netCount;

        private Stamper(DenseMatrix a, double[] b, int netCount) {
            this.a = a;
            this.b = b;
            this.netCount = netCount;
        }

        private int branchColumn(VoltageBranch branch) {
            return netCount + branch.num();
        }

        private void add(int row, int column, double value) {
            if (row != NetIndex.GROUND_NUM && column != NetIndex.GROUND_NUM) {
                a.add(row, column, value);
            }
        }

        private void addRhs(int row, double value) {
            if (row != NetIndex.GROUND_NUM) {
                b[row] += value;
            }
        }

        private double getMaxAbsValue() {
            double max = 0;
            for (int i = 0; i < a.getRowCount(); i++) {
                for (int j = 0; j < a.getColumnCount(); j++) {
                    max = Math.max(max, Math.abs(a.get(i, j)));
                }
            }
            return max;
        }

        private void stamp(DcElement element, VoltageBranch branch, ReferenceCurrent referenceCurrent) {
            if (element instanceof Resistor resistor) {
                stampConductance(resistor.pos(), resistor.neg(), resistor.getConductance());
            } else if (element instanceof CurrentSource source) {
                addRhs(source.pos(), -source.current());
                addRhs(source.neg(), source.current());
            } else if (element instanceof VoltageSource source) {
                stampVoltageBranch(branch, source.voltage());
            } else if (element instanceof Vcvs vcvs) {
                // V(pos) - V(neg) - gain * (V(cp) - V(cn)) = 0
                stampVoltageBranch(branch, 0);
                int row = branchColumn(branch);
                add(row, vcvs.controlPos(), -vcvs.gain());
                add(row, vcvs.controlNeg(), vcvs.gain());
            } else if (element instanceof Vccs vccs) {
                add(vccs.pos(), vccs.controlPos(), vccs.gain());
                add(vccs.pos(), vccs.controlNeg(), -vccs.gain());
                add(vccs.neg(), vccs.controlPos(), -vccs.gain());
                add(vccs.neg(), vccs.controlNeg(), vccs.gain());
            } else if (element instanceof Ccvs ccvs) {
                // V(pos) - V(neg) - gain * Iref = 0
                stampVoltageBranch(branch, 0);
                add(branchColumn(branch), netCount + referenceCurrent.branchNum(), -ccvs.gain() * referenceCurrent.sign());
            } else if (element instanceof Cccs cccs) {
                int column = netCount + referenceCurrent.branchNum();
                add(cccs.pos(), column, cccs.gain() * referenceCurrent.sign());
                add(cccs.neg(), column, -cccs.gain() * referenceCurrent.sign());
            } else {
                throw new IllegalStateException("Unknown element type: " + element.getClass().getSimpleName());
            }
        }

        private void stampConductance(int pos, int neg, double g) {
            add(pos, pos, g);
            add(neg, neg, g);
            add(pos, neg, -g);
            add(neg, pos, -g);
        }

        private void stampVoltageBranch(VoltageBranch branch, double voltage) {
            int k = branchColumn(branch);
            add(branch.pos(), k, 1);
            add(branch.neg(), k, -1);
            add(k, branch.pos(), 1);
            add(k, branch.neg(), -1);
            b[k] = voltage;
        }
    }
}
