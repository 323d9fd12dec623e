package com.cee.reconciliation.rule;

import com.cee.graph.model.FactorType;

import java.util.List;

/** Values filled into controllable factors missing their required data. */
final class ControllableDefaults {

    static final FactorType FACTOR_TYPE = FactorType.OTHER;
    static final List<String> UNCERTAINTY_DRIVERS = List.of("Estimation uncertainty");

    private ControllableDefaults() {
    }

    static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}
