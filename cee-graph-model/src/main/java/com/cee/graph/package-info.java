/**
 * Decision graph model and JSON codec.
 * <ul>
 *   <li>{@link com.cee.graph.model.Graph} - nodes and edges; topology fixed after construction</li>
 *   <li>{@link com.cee.graph.model.GraphFieldWriter} - the only write path, limited to reconcilable metadata</li>
 *   <li>{@link com.cee.graph.GraphJson} - Jackson codec accepting non-finite number literals</li>
 *   <li>{@link com.cee.graph.GraphContractException} - caller contract violations, distinct from validation issues</li>
 * </ul>
 */
package com.cee.graph;
