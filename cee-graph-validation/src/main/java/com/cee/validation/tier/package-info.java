/**
 * Validation tiers. Each tier is a stateless check over a {@link com.cee.validation.index.GraphAnalysis}
 * returning its own issue list:
 * <ul>
 *   <li>{@link com.cee.validation.tier.StructuralTier} - cardinalities, limits, edge references</li>
 *   <li>{@link com.cee.validation.tier.TopologyTier} - sink/source roles, allowed edge types, acyclicity</li>
 *   <li>{@link com.cee.validation.tier.ReachabilityTier} - decision-to-goal connectivity</li>
 *   <li>{@link com.cee.validation.tier.FactorDataTier} - data required or forbidden per factor category</li>
 *   <li>{@link com.cee.validation.tier.SemanticTier} - option effect, duplicate options, label heuristics</li>
 *   <li>{@link com.cee.validation.tier.NumericTier} - finite numbers</li>
 * </ul>
 * {@link com.cee.validation.tier.WarningCollector} runs alongside and only produces warnings.
 */
package com.cee.validation.tier;
