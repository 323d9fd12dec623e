package com.cee.validation.tier;

/** Builders for the {@code path} field of validation issues. */
public final class IssuePaths {

    private IssuePaths() {
    }

    public static String edge(int index) {
        return "edges[" + index + "]";
    }

    public static String node(String nodeId) {
        return "nodesById." + nodeId;
    }

    public static String nodeData(String nodeId, String field) {
        return "nodesById." + nodeId + ".data." + field;
    }
}
