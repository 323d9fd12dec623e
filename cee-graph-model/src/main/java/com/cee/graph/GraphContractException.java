package com.cee.graph;

/**
 * Thrown when a caller breaks the input contract of the engine: a graph without its
 * {@code nodes} or {@code edges} array, a null element in either, or a null argument to an entry point.
 * Rule violations inside a well-formed graph are never reported this way; they become validation issues.
 */
public class GraphContractException extends RuntimeException {

    public GraphContractException(String message) {
        super(message);
    }

    /** Fails with a {@link GraphContractException} when {@code value} is null. */
    public static <T> T requireNonNull(T value, String what) {
        if (value == null) {
            throw new GraphContractException(what + " is required");
        }
        return value;
    }
}
