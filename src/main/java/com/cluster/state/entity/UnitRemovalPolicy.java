package com.cluster.state.entity;

import com.cluster.state.core.model.AgentStatus;
import com.cluster.state.store.Condition;

import java.util.Map;
import java.util.Optional;

/**
 * Decides whether destroying a unit may skip the Dying stage and remove it at once.
 *
 * <p>The policy only sees principal units without subordinates. It returns the
 * assertion on the unit's agent status document that must still hold when the
 * removal is applied, or empty when the unit has to go through Dying so its
 * agent can wind it down.</p>
 */
@FunctionalInterface
public interface UnitRemovalPolicy {

    /**
     * @param unitName  the unit being destroyed
     * @param statusDoc the unit's agent status document, or {@code null} if it has none
     * @return the status assertion guarding direct removal, or empty to set the unit Dying
     */
    Optional<Condition> removalAssertion(String unitName, Map<String, Object> statusDoc);

    /**
     * Removes units whose agent never started, asserting the status is still {@code ALLOCATING}.
     */
    static UnitRemovalPolicy whileAllocating() {
        return (unitName, statusDoc) -> {
            if (statusDoc != null && AgentStatus.ALLOCATING.name().equals(statusDoc.get(StatusDocs.STATUS))) {
                return Optional.of(Condition.eq(StatusDocs.STATUS, AgentStatus.ALLOCATING));
            }
            return Optional.empty();
        };
    }

    /**
     * Always sets units Dying.
     */
    static UnitRemovalPolicy never() {
        return (unitName, statusDoc) -> Optional.empty();
    }
}
