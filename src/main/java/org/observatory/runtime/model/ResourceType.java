package org.observatory.runtime.model;

/**
 * The four scarce resources every agent and every region pool holds.
 */
public enum ResourceType {
    ENERGY,
    BANDWIDTH,
    MEMORY,
    COMPUTE
}
