/**
 * Structural truth reconciliation pass. Entry point {@link com.cee.reconciliation.StructuralReconciler};
 * every field change is reported as a {@link com.cee.reconciliation.StrpMutation}.
 * {@link com.cee.reconciliation.ConstraintTargetNormaliser} can also be used on its own.
 */
package com.cee.reconciliation;
