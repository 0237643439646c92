package com.tracegate.core.model;

public enum DevelopmentItemKind {
    CUSTOM_BUILD,
    CONFIGURATION
}
