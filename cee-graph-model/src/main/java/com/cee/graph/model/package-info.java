/**
 * Decision graph types.
 *
 * <ul>
 *   <li>{@link com.cee.graph.model.Graph}, {@link com.cee.graph.model.GraphNode}, {@link com.cee.graph.model.GraphEdge} - structure as supplied by the generator</li>
 *   <li>{@link com.cee.graph.model.FactorData}, {@link com.cee.graph.model.OptionData}, {@link com.cee.graph.model.GenericNodeData} - kind-specific node payloads</li>
 *   <li>{@link com.cee.graph.model.NodeKind}, {@link com.cee.graph.model.FactorCategory}, {@link com.cee.graph.model.FactorType},
 *       {@link com.cee.graph.model.ExtractionType}, {@link com.cee.graph.model.EffectDirection} - valid value sets; raw strings stay on the model</li>
 *   <li>{@link com.cee.graph.model.GoalConstraint} - external constraint targeting a node id</li>
 * </ul>
 */
package com.cee.graph.model;
