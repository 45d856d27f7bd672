package com.fincept.workflow_nodes.executor.param;

/**
 * Host-supplied parameter lookup. Record-scoped parameters (conditions, rules,
 * router output) are read with the index of the record being processed;
 * node-scoped ones (mode, operation, join settings) with index 0.
 *
 * The host resolves any embedded expressions before returning a value.
 * Returns null when the parameter is not set.
 */
@FunctionalInterface
public interface ParameterAccessor {

    Object get(String name, int itemIndex);
}
