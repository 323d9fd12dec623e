package com.cee.graph.model;

/**
 * Kind-specific payload of a node ({@code data}). Factor nodes carry {@link FactorData},
 * option nodes carry {@link OptionData}; any other payload is kept verbatim as {@link GenericNodeData}.
 */
public interface NodeData {
}
