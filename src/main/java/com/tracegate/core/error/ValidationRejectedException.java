package com.tracegate.core.error;

import com.tracegate.core.model.TestLayer;

/**
 * Thrown when a test artifact on a layer that mandates an anchor could not be resolved to one.
 */
public class ValidationRejectedException extends RuntimeException {

    private final TestLayer testLayer;

    public ValidationRejectedException(TestLayer testLayer, String message) {
        super(message);
        this.testLayer = testLayer;
    }

    public TestLayer getTestLayer() {
        return testLayer;
    }
}
