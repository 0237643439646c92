package com.tracegate.core.gate;

/**
 * Reports whether the supporting test-data packages of a plan are usable.
 * The exit gate's data gate delegates to whichever implementation is registered.
 */
public interface DataReadinessCheck {

    DataReadiness check(String planId);
}
