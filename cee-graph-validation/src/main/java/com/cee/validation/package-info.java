/**
 * Graph validation. Entry points:
 * <ul>
 *   <li>{@link com.cee.validation.GraphValidator} - six tiers, warnings and the controllability summary</li>
 *   <li>{@link com.cee.validation.PostNormalisationValidator} - sign agreement after clamping</li>
 * </ul>
 * Problems are reported as {@link com.cee.validation.ValidationIssue}s, never thrown; only caller contract
 * violations raise {@link com.cee.graph.GraphContractException}.
 */
package com.cee.validation;
