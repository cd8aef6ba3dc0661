/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.jcircuit.dc;

import com.powsybl.commons.config.PlatformConfig;

import java.util.Objects;

/**
 * Numerical tolerances of the DC solver and of the Thevenin analyzer.
 *
 * @author JCircuit developers {@literal <dev at jcircuit.org>}
 */
public class DcSolverParameters {

    public static final String MODULE_NAME = "jcircuit-dc-solver-default-parameters";

    public static final String SINGULARITY_THRESHOLD_PARAM_NAME = "singularityThreshold";
    public static final String RIDGE_ENABLED_PARAM_NAME = "ridgeEnabled";
    public static final String RIDGE_REGULARIZATION_PARAM_NAME = "ridgeRegularization";
    public static final String PSEUDO_INVERSE_ENABLED_PARAM_NAME = "pseudoInverseEnabled";
    public static final String DUPLICATE_BRANCH_REGULARIZATION_PARAM_NAME = "duplicateBranchRegularization";
    public static final String DUPLICATE_BRANCH_REGULARIZATION_MODE_PARAM_NAME = "duplicateBranchRegularizationMode";
    public static final String THEVENIN_SHORT_RESISTANCE_PARAM_NAME = "theveninShortResistance";
    public static final String THEVENIN_OPEN_CURRENT_THRESHOLD_PARAM_NAME = "theveninOpenCurrentThreshold";
    public static final String THEVENIN_OPEN_RESISTANCE_PARAM_NAME = "theveninOpenResistance";
    public static final String TEACHING_MODE_PARAM_NAME = "teachingMode";

    public static final double SINGULARITY_THRESHOLD_DEFAULT_VALUE = 1e-15;
    public static final boolean RIDGE_ENABLED_DEFAULT_VALUE = true;
    public static final double RIDGE_REGULARIZATION_DEFAULT_VALUE = 1e-12;
    public static final boolean PSEUDO_INVERSE_ENABLED_DEFAULT_VALUE = true;
    public static final double DUPLICATE_BRANCH_REGULARIZATION_DEFAULT_VALUE = 1e-12;
    public static final RegularizationMode DUPLICATE_BRANCH_REGULARIZATION_MODE_DEFAULT_VALUE = RegularizationMode.UNIFORM;
    public static final double THEVENIN_SHORT_RESISTANCE_DEFAULT_VALUE = 1e-6;
    public static final double THEVENIN_OPEN_CURRENT_THRESHOLD_DEFAULT_VALUE = 1e-12;
    public static final double THEVENIN_OPEN_RESISTANCE_DEFAULT_VALUE = 1e12;
    public static final boolean TEACHING_MODE_DEFAULT_VALUE = false;

    public enum RegularizationMode {
        /**
         * The regularization value is added as is.
         */
        UNIFORM,
        /**
         * The regularization value is multiplied by the largest absolute entry of the matrix.
         */
        SCALED,
    }

    private double singularityThreshold = SINGULARITY_THRESHOLD_DEFAULT_VALUE;

    private boolean ridgeEnabled = RIDGE_ENABLED_DEFAULT_VALUE;

    private double ridgeRegularization = RIDGE_REGULARIZATION_DEFAULT_VALUE;

    private boolean pseudoInverseEnabled = PSEUDO_INVERSE_ENABLED_DEFAULT_VALUE;

    private double duplicateBranchRegularization = DUPLICATE_BRANCH_REGULARIZATION_DEFAULT_VALUE;

    private RegularizationMode duplicateBranchRegularizationMode = DUPLICATE_BRANCH_REGULARIZATION_MODE_DEFAULT_VALUE;

    private double theveninShortResistance = THEVENIN_SHORT_RESISTANCE_DEFAULT_VALUE;

    private double theveninOpenCurrentThreshold = THEVENIN_OPEN_CURRENT_THRESHOLD_DEFAULT_VALUE;

    private double theveninOpenResistance = THEVENIN_OPEN_RESISTANCE_DEFAULT_VALUE;

    private boolean teachingMode = TEACHING_MODE_DEFAULT_VALUE;

    public static DcSolverParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static DcSolverParameters load(PlatformConfig platformConfig) {
        DcSolverParameters parameters = new DcSolverParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setSingularityThreshold(config.getDoubleProperty(SINGULARITY_THRESHOLD_PARAM_NAME, SINGULARITY_THRESHOLD_DEFAULT_VALUE))
                .setRidgeEnabled(config.getBooleanProperty(RIDGE_ENABLED_PARAM_NAME, RIDGE_ENABLED_DEFAULT_VALUE))
                .setRidgeRegularization(config.getDoubleProperty(RIDGE_REGULARIZATION_PARAM_NAME, RIDGE_REGULARIZATION_DEFAULT_VALUE))
                .setPseudoInverseEnabled(config.getBooleanProperty(PSEUDO_INVERSE_ENABLED_PARAM_NAME, PSEUDO_INVERSE_ENABLED_DEFAULT_VALUE))
                .setDuplicateBranchRegularization(config.getDoubleProperty(DUPLICATE_BRANCH_REGULARIZATION_PARAM_NAME, DUPLICATE_BRANCH_REGULARIZATION_DEFAULT_VALUE))
                .setDuplicateBranchRegularizationMode(config.getEnumProperty(DUPLICATE_BRANCH_REGULARIZATION_MODE_PARAM_NAME, RegularizationMode.class, DUPLICATE_BRANCH_REGULARIZATION_MODE_DEFAULT_VALUE))
                .setTheveninShortResistance(config.getDoubleProperty(THEVENIN_SHORT_RESISTANCE_PARAM_NAME, THEVENIN_SHORT_RESISTANCE_DEFAULT_VALUE))
                .setTheveninOpenCurrentThreshold(config.getDoubleProperty(THEVENIN_OPEN_CURRENT_THRESHOLD_PARAM_NAME, THEVENIN_OPEN_CURRENT_THRESHOLD_DEFAULT_VALUE))
                .setTheveninOpenResistance(config.getDoubleProperty(THEVENIN_OPEN_RESISTANCE_PARAM_NAME, THEVENIN_OPEN_RESISTANCE_DEFAULT_VALUE))
                .setTeachingMode(config.getBooleanProperty(TEACHING_MODE_PARAM_NAME, TEACHING_MODE_DEFAULT_VALUE)));
        return parameters;
    }

    private static double checkPositive(double value, String name) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Invalid " + name + " value: " + value);
        }
        return value;
    }

    public double getSingularityThreshold() {
        return singularityThreshold;
    }

    public DcSolverParameters setSingularityThreshold(double singularityThreshold) {
        if (singularityThreshold < 0 || Double.isNaN(singularityThreshold)) {
            throw new IllegalArgumentException("Invalid singularity threshold value: " + singularityThreshold);
        }
        this.singularityThreshold = singularityThreshold;
        return this;
    }

    public boolean isRidgeEnabled() {
        return ridgeEnabled;
    }

    public DcSolverParameters setRidgeEnabled(boolean ridgeEnabled) {
        this.ridgeEnabled = ridgeEnabled;
        return this;
    }

    public double getRidgeRegularization() {
        return ridgeRegularization;
    }

    public DcSolverParameters setRidgeRegularization(double ridgeRegularization) {
        this.ridgeRegularization = checkPositive(ridgeRegularization, RIDGE_REGULARIZATION_PARAM_NAME);
        return this;
    }

    public boolean isPseudoInverseEnabled() {
        return pseudoInverseEnabled;
    }

    public DcSolverParameters setPseudoInverseEnabled(boolean pseudoInverseEnabled) {
        this.pseudoInverseEnabled = pseudoInverseEnabled;
        return this;
    }

    public double getDuplicateBranchRegularization() {
        return duplicateBranchRegularization;
    }

    public DcSolverParameters setDuplicateBranchRegularization(double duplicateBranchRegularization) {
        this.duplicateBranchRegularization = checkPositive(duplicateBranchRegularization, DUPLICATE_BRANCH_REGULARIZATION_PARAM_NAME);
        return this;
    }

    public RegularizationMode getDuplicateBranchRegularizationMode() {
        return duplicateBranchRegularizationMode;
    }

    public DcSolverParameters setDuplicateBranchRegularizationMode(RegularizationMode duplicateBranchRegularizationMode) {
        this.duplicateBranchRegularizationMode = Objects.requireNonNull(duplicateBranchRegularizationMode);
        return this;
    }

    public double getTheveninShortResistance() {
        return theveninShortResistance;
    }

    public DcSolverParameters setTheveninShortResistance(double theveninShortResistance) {
        this.theveninShortResistance = checkPositive(theveninShortResistance, THEVENIN_SHORT_RESISTANCE_PARAM_NAME);
        return this;
    }

    public double getTheveninOpenCurrentThreshold() {
        return theveninOpenCurrentThreshold;
    }

    public DcSolverParameters setTheveninOpenCurrentThreshold(double theveninOpenCurrentThreshold) {
        this.theveninOpenCurrentThreshold = checkPositive(theveninOpenCurrentThreshold, THEVENIN_OPEN_CURRENT_THRESHOLD_PARAM_NAME);
        return this;
    }

    public double getTheveninOpenResistance() {
        return theveninOpenResistance;
    }

    public DcSolverParameters setTheveninOpenResistance(double theveninOpenResistance) {
        this.theveninOpenResistance = checkPositive(theveninOpenResistance, THEVENIN_OPEN_RESISTANCE_PARAM_NAME);
        return this;
    }

    /**
     * When enabled, DC results carry the solving steps: unknowns, equations, solver stage and node voltages.
     */
    public boolean isTeachingMode() {
        return teachingMode;
    }

    public DcSolverParameters setTeachingMode(boolean teachingMode) {
        this.teachingMode = teachingMode;
        return this;
    }

    @Override
    public String toString() {
        return "DcSolverParameters(" +
                "singularityThreshold=" + singularityThreshold +
                ", ridgeEnabled=" + ridgeEnabled +
                ", ridgeRegularization=" + ridgeRegularization +
                ", pseudoInverseEnabled=" + pseudoInverseEnabled +
                ", duplicateBranchRegularization=" + duplicateBranchRegularization +
                ", duplicateBranchRegularizationMode=" + duplicateBranchRegularizationMode +
                ", theveninShortResistance=" + theveninShortResistance +
                ", theveninOpenCurrentThreshold=" + theveninOpenCurrentThreshold +
                ", theveninOpenResistance=" + theveninOpenResistance +
                ", teachingMode=" + teachingMode +
                ')';
    }
}
