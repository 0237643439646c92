package com.tracegate.core.gate;

public enum GateVerdict {
    PASS,
    FAIL
}
