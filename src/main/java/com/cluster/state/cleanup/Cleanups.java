package com.cluster.state.cleanup;

import com.cluster.state.core.model.Life;
import com.cluster.state.entity.Machine;
import com.cluster.state.entity.StateContext;
import com.cluster.state.entity.Unit;
import com.cluster.state.errors.NotFoundException;
import com.cluster.state.errors.StateException;
import com.cluster.state.logging.LogContext;
import com.cluster.state.store.CollectionNames;
import com.cluster.state.store.Condition;
import com.cluster.state.store.Documents;
import com.cluster.state.store.TxnOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs the cleanup documents queued by lifecycle transactions. A cleanup
 * whose work fails stays queued for the next pass.
 */
public class Cleanups {

    private static final Logger log = LoggerFactory.getLogger(Cleanups.class);

    static final String KIND = "kind";
    static final String PREFIX = "prefix";

    private final StateContext ctx;

    public Cleanups(StateContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Op queueing a cleanup of {@code kind} for the entity named {@code prefix}.
     */
    public static TxnOp newCleanupOp(CleanupKind kind, String prefix) {
        return TxnOp.on(CollectionNames.CLEANUPS, UUID.randomUUID().toString())
                .assertThat(Condition.docMissing())
                .insert(Map.of(KIND, kind.name(), PREFIX, prefix));
    }

    public boolean needsCleanup() {
        return ctx.store().count(CollectionNames.CLEANUPS, Condition.always()) > 0;
    }

    /**
     * Processes every queued cleanup once.
     *
     * @return the number of cleanups completed and dequeued
     */
    public int run() {
        List<Map<String, Object>> pending = ctx.store().findAll(CollectionNames.CLEANUPS);
        if (pending.isEmpty()) {
            return 0;
        }
        log.debug("Running {} cleanup(s)", pending.size());
        int completed = 0;
        for (Map<String, Object> cleanup : pending) {
            String id = Documents.stringValue(cleanup, Documents.ID);
            CleanupKind kind = CleanupKind.valueOf(Documents.stringValue(cleanup, KIND));
            String prefix = Documents.stringValue(cleanup, PREFIX);
            try (LogContext lc = LogContext.forCleanup(id).with("cleanupKind", kind.name())) {
                try {
                    process(kind, prefix);
                } catch (StateException e) {
                    log.warn("Cleanup {} for {} failed, will retry: {}", kind, prefix, e.getMessage());
                    continue;
                }
                ctx.runner().runOnce("remove cleanup " + id, List.of(
                        TxnOp.on(CollectionNames.CLEANUPS, id).assertThat(Condition.docExists()).remove()));
                completed++;
                log.debug("Cleanup {} for {} done", kind, prefix);
            }
        }
        return completed;
    }

    private void process(CleanupKind kind, String prefix) {
        switch (kind) {
            case DYING_UNIT -> cleanupDyingUnit(prefix);
            case UNITS_FOR_DYING_APPLICATION -> cleanupApplicationUnits(prefix);
            case DYING_MACHINE -> cleanupDyingMachine(prefix);
        }
    }

    private void cleanupDyingUnit(String unitName) {
        Unit unit;
        try {
            unit = ctx.unit(unitName);
        } catch (NotFoundException e) {
            return;
        }
        for (String subordinate : unit.getSubordinateNames()) {
            destroyUnit(subordinate);
        }
    }

    private void cleanupApplicationUnits(String applicationName) {
        for (Unit unit : ctx.units(applicationName)) {
            unit.destroy();
        }
    }

    private void cleanupDyingMachine(String machineId) {
        Machine machine;
        try {
            machine = ctx.machine(machineId);
        } catch (NotFoundException e) {
            return;
        }
        for (String unitName : machine.getPrincipalUnits()) {
            Unit unit;
            try {
                unit = ctx.unit(unitName);
            } catch (NotFoundException e) {
                continue;
            }
            if (unit.getLife() == Life.DEAD) {
                unit.remove();
            } else {
                unit.destroy();
            }
        }
    }

    private void destroyUnit(String unitName) {
        try {
            ctx.unit(unitName).destroy();
        } catch (NotFoundException e) {
            log.debug("Unit {} already removed", unitName);
        }
    }
}
