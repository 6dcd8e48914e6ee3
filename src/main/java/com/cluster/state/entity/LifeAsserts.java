package com.cluster.state.entity;

import com.cluster.state.core.model.Life;
import com.cluster.state.store.Condition;

/**
 * Assertions on the {@code life} field shared by every lifecycle document.
 */
public final class LifeAsserts {

    public static final String LIFE = "life";

    private LifeAsserts() {
    }

    public static Condition isAlive() {
        return Condition.eq(LIFE, Life.ALIVE);
    }

    public static Condition isDying() {
        return Condition.eq(LIFE, Life.DYING);
    }

    public static Condition isDead() {
        return Condition.eq(LIFE, Life.DEAD);
    }

    /**
     * Matches an existing document that is Alive or Dying.
     */
    public static Condition notDead() {
        return Condition.ne(LIFE, Life.DEAD);
    }
}
