package com.cee.reconciliation.rule;

import com.cee.reconciliation.StrpMutation;

import java.util.List;

/**
 * One reconciliation rule. A rule writes only through {@link ReconciliationContext#writer()} and reports
 * every field it changes as exactly one mutation. Applying a rule to its own output changes nothing.
 */
public interface ReconciliationRule {

    /** Stable name recorded on each mutation and in telemetry. */
    String name();

    List<StrpMutation> apply(ReconciliationContext context);
}
