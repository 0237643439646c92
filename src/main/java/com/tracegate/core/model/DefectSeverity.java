package com.tracegate.core.model;

/**
 * Defect severity, highest first: P1 (blocker) to P4 (cosmetic).
 */
public enum DefectSeverity {
    P1,
    P2,
    P3,
    P4
}
