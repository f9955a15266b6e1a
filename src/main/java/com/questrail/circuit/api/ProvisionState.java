package com.questrail.circuit.api;

/**
 * Provision sub-state of a connection. Only leaves {@link #RELEASED} once the
 * reservation is committed.
 */
public enum ProvisionState
{
    RELEASED,
    PROVISIONING,
    PROVISIONED,
    RELEASING;

    /**
     * Returns true when the data plane is, or is about to be, active.
     */
    public boolean isActive() {
        return this != RELEASED;
    }
}
