/**
 * Read-only views over one graph shared by validation and reconciliation:
 * id/kind lookup and adjacency ({@link com.cee.validation.index.GraphIndex}), structural factor categories
 * ({@link com.cee.validation.index.FactorCategoryInferencer}) and traversals
 * ({@link com.cee.validation.index.Reachability}).
 */
package com.cee.validation.index;
