package com.cluster.state.core.model;

/**
 * Status reported by a unit or machine agent.
 */
public enum AgentStatus {
    /**
     * The agent has not started yet; nothing has run on its behalf.
     */
    ALLOCATING,
    IDLE,
    EXECUTING,
    ERROR,
    LOST
}
