package com.questrail.circuit.api;

/**
 * Provider-reported data plane activation. Advisory only: it never gates a
 * transition of the other sub-states.
 */
public enum DataPlaneState
{
    DOWN,
    UP
}
