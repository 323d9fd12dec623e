package com.cee.reconciliation;

/** Machine-readable codes of reconciliation mutations. */
public enum MutationCode {
    CATEGORY_OVERRIDE,
    ENUM_VALUE_CORRECTED,
    CONSTRAINT_REMAPPED,
    CONSTRAINT_DROPPED,
    SIGN_CORRECTED,
    CONTROLLABLE_DATA_FILLED
}
