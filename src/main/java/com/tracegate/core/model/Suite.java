package com.tracegate.core.model;

import java.io.Serializable;

/**
 * Named, reusable grouping of test artifacts. Not tied to a plan or a test layer.
 */
public record Suite(
    String id,
    String name,
    String description
) implements Serializable {}
