package com.cee.validation;

import java.util.stream.Collectors;

/**
 * Thrown by {@link GraphValidator#validateOrThrow} when a graph has validation errors.
 * Carries the full result so callers can inspect every issue.
 */
public class GraphRejectedException extends RuntimeException {

    private final GraphValidationResult result;

    public GraphRejectedException(GraphValidationResult result) {
        super("Graph rejected: " + result.getErrors().size() + " error(s): "
                + result.getErrors().stream()
                .map(i -> i.getCode().name())
                .distinct()
                .collect(Collectors.joining(", ")));
        this.result = result;
    }

    public GraphValidationResult getResult() {
        return result;
    }
}
